package org.dxworks.pagecanvas.analysis;

import java.util.ArrayList;
import java.util.List;

public class PageAnalysis {
    public String kind = "page";
    public String filePath;
    public int controlCount;
    public List<SectionSummary> sections = new ArrayList<>();
}
