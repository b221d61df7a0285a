package org.dxworks.pagecanvas.model;

import java.util.Optional;

/**
 * Relative width of a column. 12 is the full width of the section.
 */
public enum ColumnFactor {
    NONE(0),
    ONE_SIXTH(2),
    ONE_THIRD(4),
    HALF(6),
    TWO_THIRDS(8),
    FULL(12);

    private final int value;

    ColumnFactor(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    public static Optional<ColumnFactor> tryFromValue(int value) {
        for (ColumnFactor factor : values()) {
            if (factor.value == value) {
                return Optional.of(factor);
            }
        }
        return Optional.empty();
    }

    public static ColumnFactor fromValue(int value) {
        return tryFromValue(value)
                .orElseThrow(() -> new IllegalArgumentException("Unsupported column factor: " + value));
    }
}
