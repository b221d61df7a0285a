package org.dxworks.pagecanvas.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ServerProcessedProperty {
    @JsonProperty("Name")
    public String name;
    @JsonProperty("Value")
    public String value;

    public ServerProcessedProperty() {
    }

    public ServerProcessedProperty(String name, String value) {
        this.name = name;
        this.value = value;
    }
}
