package org.dxworks.pagecanvas.page;

import org.dxworks.pagecanvas.model.CanvasColumn;
import org.dxworks.pagecanvas.model.CanvasControl;
import org.dxworks.pagecanvas.model.CanvasSection;
import org.dxworks.pagecanvas.model.ClientSideControlPosition;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Rebuilds the section / column / control tree from controls discovered one after the other in
 * document order. Each control's parsed position says which section (zone index) and column
 * (section index) it belongs to; missing sections and columns are created on first reference.
 *
 * Numeric orders are matched against the structural indices only. They become contiguous when
 * the page is reindexed before rendering.
 */
public final class CanvasTreeReconciler {

    private final List<CanvasSection> sections;
    private final String dataVersion;

    /**
     * @param sections    the page's section list, modified in place
     * @param dataVersion data version of sections and columns created on demand
     */
    public CanvasTreeReconciler(List<CanvasSection> sections, String dataVersion) {
        this.sections = Objects.requireNonNull(sections, "sections");
        this.dataVersion = dataVersion;
    }

    public void mergeControl(CanvasControl control) {
        Objects.requireNonNull(control, "control");
        if (control instanceof CanvasColumn column) {
            mergeColumn(column);
            return;
        }

        ClientSideControlPosition position = control.requireParsedPosition();
        CanvasSection section = sectionFor(position.zoneIndex);
        CanvasColumn column = section.findColumn(position.sectionIndex).orElseGet(() -> {
            CanvasColumn created = new CanvasColumn(position.sectionIndex, CanvasColumn.factorOf(position), dataVersion);
            section.attachColumn(created);
            return created;
        });
        column.addControl(control);
    }

    /**
     * Adds a column read from an empty-column marker to the section named by its zone index.
     */
    public void mergeColumn(CanvasColumn column) {
        Objects.requireNonNull(column, "column");
        ClientSideControlPosition position = column.requireParsedPosition();
        sectionFor(position.zoneIndex).attachColumn(column);
    }

    /**
     * Sorts sections by zone index and columns by section index. Sorting is stable, so controls
     * keep their discovery order.
     */
    public void finish() {
        sections.sort(Comparator.comparingInt(CanvasSection::getOrder));
        for (CanvasSection section : sections) {
            section.sortColumns();
        }
    }

    private CanvasSection sectionFor(int zoneIndex) {
        for (CanvasSection section : sections) {
            if (section.getOrder() == zoneIndex) {
                return section;
            }
        }
        CanvasSection section = new CanvasSection(zoneIndex, dataVersion);
        sections.add(section);
        return section;
    }
}
