package org.dxworks.pagecanvas.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The parts of a component manifest used to initialize a web part.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClientSidePageComponentManifest {
    public String id;
    public String alias;
    public String componentType;
    public String version;
    public List<PreconfiguredEntry> preconfiguredEntries = new ArrayList<>();

    public Optional<PreconfiguredEntry> firstPreconfiguredEntry() {
        if (preconfiguredEntries == null || preconfiguredEntries.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(preconfiguredEntries.get(0));
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PreconfiguredEntry {
        public LocalizedString title;
        public LocalizedString description;
        public String groupId;
        public String iconImageUrl;
        public JsonNode properties;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LocalizedString {
        @JsonProperty("default")
        public String defaultValue;

        public static String valueOf(LocalizedString value) {
            return value == null || value.defaultValue == null ? "" : value.defaultValue;
        }
    }
}
