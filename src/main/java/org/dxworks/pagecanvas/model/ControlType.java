package org.dxworks.pagecanvas.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Discriminant stored as {@code controlType} in a control's metadata.
 */
public enum ControlType {
    COLUMN(0),
    WEB_PART(3),
    TEXT(4);

    private final int value;

    ControlType(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    public static Optional<ControlType> fromValue(int value) {
        for (ControlType type : values()) {
            if (type.value == value) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /**
     * Classifies decoded control metadata. Metadata without a {@code controlType} describes an
     * empty column.
     */
    public static Optional<ControlType> of(JsonNode controlData) {
        JsonNode node = controlData == null ? null : controlData.get("controlType");
        if (node == null || node.isNull()) {
            return Optional.of(COLUMN);
        }
        return fromValue(node.asInt(-1));
    }
}
