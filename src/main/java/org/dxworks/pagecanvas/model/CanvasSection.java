package org.dxworks.pagecanvas.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A horizontal band of the page holding one or more columns. Its order doubles as the zone
 * index recorded in the metadata of every control it contains.
 */
public class CanvasSection {

    private int order;
    private final String dataVersion;
    private final List<CanvasColumn> columns = new ArrayList<>();

    public CanvasSection(int order) {
        this(order, CanvasMarkup.DEFAULT_DATA_VERSION);
    }

    public CanvasSection(int order, String dataVersion) {
        this.order = order;
        this.dataVersion = dataVersion != null ? dataVersion : CanvasMarkup.DEFAULT_DATA_VERSION;
    }

    public int getOrder() {
        return order;
    }

    public void setOrder(int order) {
        this.order = order;
    }

    public List<CanvasColumn> getColumns() {
        return Collections.unmodifiableList(columns);
    }

    /**
     * First column of the section, created full width when the section has none yet.
     */
    public CanvasColumn getDefaultColumn() {
        if (columns.isEmpty()) {
            addColumn(ColumnFactor.FULL);
        }
        return columns.get(0);
    }

    public CanvasColumn addColumn(ColumnFactor factor) {
        CanvasColumn column = new CanvasColumn(nextColumnOrder(), factor, dataVersion);
        attachColumn(column);
        return column;
    }

    /**
     * Appends an existing column as the last column of this section.
     */
    public CanvasSection attachColumn(CanvasColumn column) {
        Objects.requireNonNull(column, "column");
        column.setSection(this);
        columns.add(column);
        return this;
    }

    /** Adds a control to the default column. */
    public CanvasSection addControl(CanvasControl control) {
        getDefaultColumn().addControl(control);
        return this;
    }

    public Optional<CanvasColumn> findColumn(int columnOrder) {
        return columns.stream().filter(c -> c.getOrder() == columnOrder).findFirst();
    }

    /**
     * Puts the columns in ascending order, keeping the relative order of equal ones.
     */
    public void sortColumns() {
        columns.sort(Comparator.comparingInt(CanvasColumn::getOrder));
    }

    public void reindex() {
        for (int i = 0; i < columns.size(); i++) {
            CanvasColumn column = columns.get(i);
            column.setOrder(i + 1);
            column.reindex();
        }
    }

    public String toHtml() {
        StringBuilder html = new StringBuilder();
        for (CanvasColumn column : columns) {
            html.append(column.toHtml(column.getOrder()));
        }
        return html.toString();
    }

    private int nextColumnOrder() {
        return columns.stream().mapToInt(CanvasColumn::getOrder).max().orElse(0) + 1;
    }
}
