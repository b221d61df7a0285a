package org.dxworks.pagecanvas.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Position of a control inside the page: zone (section), section (column) and control index.
 * Columns leave {@code controlIndex} unset.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder(alphabetic = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClientSideControlPosition {
    public Integer controlIndex;
    public Integer sectionFactor;
    public int sectionIndex;
    public int zoneIndex;

    public ClientSideControlPosition() {
    }

    public ClientSideControlPosition(Integer controlIndex, int sectionFactor, int sectionIndex, int zoneIndex) {
        this.controlIndex = controlIndex;
        this.sectionFactor = sectionFactor;
        this.sectionIndex = sectionIndex;
        this.zoneIndex = zoneIndex;
    }
}
