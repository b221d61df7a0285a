package org.dxworks.pagecanvas.model;

import org.dxworks.pagecanvas.PageCanvasConfig;
import org.dxworks.pagecanvas.codec.AttributeJsonCodec;
import org.dxworks.pagecanvas.markup.MalformedMarkupException;
import org.dxworks.pagecanvas.markup.MarkupAttributes;

import java.util.Objects;
import java.util.UUID;

/**
 * A control on the page canvas. The set of variants is closed: empty column markers, rich text
 * and web parts.
 *
 * Every variant renders itself from its final 1-based position among its siblings and can read
 * itself back from the markup fragment it rendered.
 */
public abstract sealed class CanvasControl permits CanvasColumn, ClientSideText, ClientSideWebPart {

    private final ControlType controlType;
    protected String dataVersion;
    protected int order = 1;
    protected String id;
    protected ClientSideControlData controlData;
    private CanvasColumn column;

    protected CanvasControl(ControlType controlType, String dataVersion) {
        this.controlType = controlType;
        this.dataVersion = dataVersion;
        this.id = UUID.randomUUID().toString();
    }

    public ControlType getControlType() {
        return controlType;
    }

    /**
     * Data version written to markup. A control built without one takes the version of its column.
     */
    public String getDataVersion() {
        if (dataVersion != null) {
            return dataVersion;
        }
        return column != null ? column.getDataVersion() : CanvasMarkup.DEFAULT_DATA_VERSION;
    }

    public int getOrder() {
        return order;
    }

    public void setOrder(int order) {
        this.order = order;
    }

    /** Instance id, unique within the page. */
    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = Objects.requireNonNull(id, "id");
    }

    /** Owning column, or null while the control is detached. */
    public CanvasColumn getColumn() {
        return column;
    }

    void setColumn(CanvasColumn column) {
        this.column = column;
    }

    /** Metadata read by the last {@link #fromHtml}, or null for a control built in code. */
    public ClientSideControlData getControlData() {
        return controlData;
    }

    /** Value of the {@code data-sp-controldata} attribute for the current tree shape. */
    public String getJsonData() {
        return AttributeJsonCodec.encode(buildControlData());
    }

    public abstract String toHtml(int index);

    public void fromHtml(String html) {
        fromHtml(html, PageCanvasConfig.defaults());
    }

    public void fromHtml(String html, PageCanvasConfig config) {
        this.controlData = AttributeJsonCodec.decode(
                MarkupAttributes.get(html, CanvasMarkup.CONTROL_DATA_ATTRIBUTE), ClientSideControlData.class);

        String version = MarkupAttributes.get(html, CanvasMarkup.DATA_VERSION_ATTRIBUTE);
        if (version != null && !version.isEmpty()) {
            this.dataVersion = version;
        }
        if (controlData.id != null) {
            this.id = controlData.id;
        }
    }

    /**
     * Position data of this control after a parse.
     *
     * @throws MalformedMarkupException if the parsed metadata has no position
     */
    public ClientSideControlPosition requireParsedPosition() {
        if (controlData == null || controlData.position == null) {
            throw new MalformedMarkupException("Control " + id + " carries no position data");
        }
        return controlData.position;
    }

    /**
     * Builds the metadata payload written to {@code data-sp-controldata}.
     */
    protected abstract ClientSideControlData buildControlData();

    /**
     * Starts a metadata payload that keeps the keys the parser did not recognize.
     */
    protected ClientSideControlData newControlData() {
        ClientSideControlData data = new ClientSideControlData();
        if (controlData != null) {
            data.getAdditionalProperties().putAll(controlData.getAdditionalProperties());
        }
        return data;
    }

    protected ClientSideControlPosition positionInColumn() {
        CanvasColumn owner = requireColumn();
        CanvasSection section = owner.getSection();
        if (section == null) {
            throw new IllegalStateException("Column of control " + id + " is not part of a section");
        }
        return new ClientSideControlPosition(order, owner.getFactor().getValue(), owner.getOrder(), section.getOrder());
    }

    private CanvasColumn requireColumn() {
        if (column == null) {
            throw new IllegalStateException("Control " + id + " must be added to a column before it is rendered");
        }
        return column;
    }
}
