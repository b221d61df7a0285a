package org.dxworks.pagecanvas.model;

public enum ClientSidePageLayoutType {
    ARTICLE("Article"),
    HOME("Home");

    private final String value;

    ClientSidePageLayoutType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static ClientSidePageLayoutType fromValue(String value) {
        for (ClientSidePageLayoutType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown page layout type: " + value);
    }
}
