package org.dxworks.pagecanvas.analysis;

import java.util.ArrayList;
import java.util.List;

public class ColumnSummary {
    public int order;
    public int factor; // 0, 2, 4, 6, 8 or 12
    public List<ControlSummary> controls = new ArrayList<>();
}
