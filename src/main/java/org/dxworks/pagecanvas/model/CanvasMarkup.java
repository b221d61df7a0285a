package org.dxworks.pagecanvas.model;

import java.util.regex.Pattern;

/**
 * Attribute names and boundary patterns of the canvas markup format.
 */
public final class CanvasMarkup {

    public static final String DEFAULT_DATA_VERSION = "1.0";

    public static final String CANVAS_CONTROL_ATTRIBUTE = "data-sp-canvascontrol";
    public static final String DATA_VERSION_ATTRIBUTE = "data-sp-canvasdataversion";
    public static final String CONTROL_DATA_ATTRIBUTE = "data-sp-controldata";
    public static final String RTE_ATTRIBUTE = "data-sp-rte";
    public static final String WEB_PART_ATTRIBUTE = "data-sp-webpart";
    public static final String WEB_PART_DATA_ATTRIBUTE = "data-sp-webpartdata";
    public static final String COMPONENT_ID_ATTRIBUTE = "data-sp-componentid";
    public static final String HTML_PROPERTIES_ATTRIBUTE = "data-sp-htmlproperties";
    public static final String PROP_NAME_ATTRIBUTE = "data-sp-prop-name";
    public static final String SEARCHABLE_PLAIN_TEXT_ATTRIBUTE = "data-sp-searchableplaintext";

    public static final Pattern CANVAS_CONTROL_BOUNDARY = boundaryFor(CANVAS_CONTROL_ATTRIBUTE);
    public static final Pattern RTE_BOUNDARY = boundaryFor(RTE_ATTRIBUTE);
    public static final Pattern HTML_PROPERTIES_BOUNDARY = boundaryFor(HTML_PROPERTIES_ATTRIBUTE);

    private CanvasMarkup() {}

    /**
     * Opening {@code <div>} tag carrying the given marker attribute.
     */
    public static Pattern boundaryFor(String markerAttribute) {
        return Pattern.compile("<div\\b[^>]*" + Pattern.quote(markerAttribute) + "[^>]*?>", Pattern.CASE_INSENSITIVE);
    }

    static String controlDiv(String dataVersion, String encodedControlData) {
        return "<div " + CANVAS_CONTROL_ATTRIBUTE + "=\"\" " + DATA_VERSION_ATTRIBUTE + "=\"" + dataVersion + "\" "
                + CONTROL_DATA_ATTRIBUTE + "=\"" + encodedControlData + "\">";
    }
}
