package org.dxworks.pagecanvas.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Content the host pre-renders for a web part so it can be indexed without running the part.
 * Each list is optional. The host writes the entries either as an array of {@code Name}/{@code Value}
 * objects or as an object keyed by property name; both read into the same lists.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ServerProcessedContent {
    public List<ServerProcessedProperty> searchablePlainTexts;
    public List<ServerProcessedProperty> imageSources;
    public List<ServerProcessedProperty> links;

    @JsonSetter("searchablePlainTexts")
    void readSearchablePlainTexts(JsonNode node) {
        this.searchablePlainTexts = readProperties(node);
    }

    @JsonSetter("imageSources")
    void readImageSources(JsonNode node) {
        this.imageSources = readProperties(node);
    }

    @JsonSetter("links")
    void readLinks(JsonNode node) {
        this.links = readProperties(node);
    }

    private static List<ServerProcessedProperty> readProperties(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }

        List<ServerProcessedProperty> properties = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode item : node) {
                properties.add(new ServerProcessedProperty(textOf(item.get("Name")), textOf(item.get("Value"))));
            }
        } else if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                properties.add(new ServerProcessedProperty(field.getKey(), textOf(field.getValue())));
            }
        }
        return properties;
    }

    private static String textOf(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }
}
