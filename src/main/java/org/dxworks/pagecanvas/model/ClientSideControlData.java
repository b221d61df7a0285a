package org.dxworks.pagecanvas.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Value of the {@code data-sp-controldata} attribute. Keys this model does not know are kept in
 * {@link #getAdditionalProperties()} and written back on render.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder(alphabetic = true)
public class ClientSideControlData {
    public Integer controlType;
    public Integer displayMode;
    public String editorType;
    public String id;
    public ClientSideControlPosition position;
    public String webPartId;

    private final Map<String, JsonNode> additionalProperties = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, JsonNode> getAdditionalProperties() {
        return additionalProperties;
    }

    @JsonAnySetter
    public void setAdditionalProperty(String name, JsonNode value) {
        additionalProperties.put(name, value);
    }
}
