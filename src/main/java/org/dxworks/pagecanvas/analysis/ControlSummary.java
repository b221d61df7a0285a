package org.dxworks.pagecanvas.analysis;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class ControlSummary {
    public String type;
    public int order;
    public String id;
    public String text;        // text controls only
    public String webPartId;   // web parts only
    public String title;       // web parts only
}
