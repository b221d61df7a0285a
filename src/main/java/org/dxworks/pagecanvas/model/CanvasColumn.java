package org.dxworks.pagecanvas.model;

import org.dxworks.pagecanvas.PageCanvasConfig;
import org.dxworks.pagecanvas.markup.MalformedMarkupException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A column of a section. It owns its controls; when it has none it renders as an empty marker
 * control so the column survives a save and reload.
 */
public final class CanvasColumn extends CanvasControl {

    static final int EDIT_DISPLAY_MODE = 2;

    private CanvasSection section;
    private ColumnFactor factor;
    private final List<CanvasControl> controls = new ArrayList<>();

    /** Empty column to be populated by {@link #fromHtml}. */
    public CanvasColumn() {
        this(0, ColumnFactor.FULL, CanvasMarkup.DEFAULT_DATA_VERSION);
    }

    public CanvasColumn(int order, ColumnFactor factor, String dataVersion) {
        super(ControlType.COLUMN, dataVersion);
        this.order = order;
        this.factor = Objects.requireNonNull(factor, "factor");
    }

    /** Owning section, or null while detached. */
    public CanvasSection getSection() {
        return section;
    }

    void setSection(CanvasSection section) {
        this.section = section;
    }

    public ColumnFactor getFactor() {
        return factor;
    }

    public void setFactor(ColumnFactor factor) {
        this.factor = Objects.requireNonNull(factor, "factor");
    }

    public List<CanvasControl> getControls() {
        return Collections.unmodifiableList(controls);
    }

    public CanvasColumn addControl(CanvasControl control) {
        Objects.requireNonNull(control, "control");
        if (control instanceof CanvasColumn) {
            throw new IllegalArgumentException("A column cannot be added as a control of another column");
        }
        control.setColumn(this);
        controls.add(control);
        return this;
    }

    public boolean removeControl(CanvasControl control) {
        boolean removed = controls.remove(control);
        if (removed) {
            control.setColumn(null);
        }
        return removed;
    }

    public CanvasControl getControl(int index) {
        return controls.get(index);
    }

    public <T extends CanvasControl> T getControl(int index, Class<T> type) {
        return type.cast(controls.get(index));
    }

    void reindex() {
        for (int i = 0; i < controls.size(); i++) {
            controls.get(i).setOrder(i + 1);
        }
    }

    @Override
    public String toHtml(int index) {
        this.order = index;

        if (controls.isEmpty()) {
            return CanvasMarkup.controlDiv(getDataVersion(), getJsonData()) + "</div>";
        }

        StringBuilder html = new StringBuilder();
        for (int i = 0; i < controls.size(); i++) {
            html.append(controls.get(i).toHtml(i + 1));
        }
        return html.toString();
    }

    @Override
    public void fromHtml(String html, PageCanvasConfig config) {
        super.fromHtml(html, config);

        ClientSideControlPosition position = requireParsedPosition();
        this.factor = factorOf(position);
        this.order = position.sectionIndex;
    }

    @Override
    protected ClientSideControlData buildControlData() {
        if (section == null) {
            throw new IllegalStateException("Column " + order + " must be added to a section before it is rendered");
        }
        ClientSideControlData data = newControlData();
        data.displayMode = EDIT_DISPLAY_MODE;
        data.position = new ClientSideControlPosition(null, factor.getValue(), order, section.getOrder());
        return data;
    }

    /**
     * Width factor recorded in a control position; full width when the position has none.
     */
    public static ColumnFactor factorOf(ClientSideControlPosition position) {
        if (position.sectionFactor == null) {
            return ColumnFactor.FULL;
        }
        return ColumnFactor.tryFromValue(position.sectionFactor)
                .orElseThrow(() -> new MalformedMarkupException("Unsupported column factor " + position.sectionFactor
                        + " in zone " + position.zoneIndex + ", section " + position.sectionIndex));
    }
}
