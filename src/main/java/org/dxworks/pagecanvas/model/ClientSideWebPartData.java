package org.dxworks.pagecanvas.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Value of the {@code data-sp-webpartdata} attribute. Server processed content is kept as the host
 * wrote it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder(alphabetic = true)
public class ClientSideWebPartData {
    public String dataVersion;
    public String description;
    public String id;
    public String instanceId;
    public JsonNode properties;
    public JsonNode serverProcessedContent;
    public String title;

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
