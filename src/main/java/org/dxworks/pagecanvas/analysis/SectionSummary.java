package org.dxworks.pagecanvas.analysis;

import java.util.ArrayList;
import java.util.List;

public class SectionSummary {
    public int order; // zone index after reindexing
    public List<ColumnSummary> columns = new ArrayList<>();
}
