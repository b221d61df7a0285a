package org.dxworks.pagecanvas.model;

/**
 * Promotion state of a page in its hosting list.
 */
public enum PromotedState {
    /** Regular page. */
    NOT_PROMOTED(0),
    /** Promoted as a news article once published. */
    PROMOTE_ON_PUBLISH(1),
    /** Promoted as a news article. */
    PROMOTED(2);

    private final int value;

    PromotedState(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    public static PromotedState fromValue(int value) {
        for (PromotedState state : values()) {
            if (state.value == value) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown promoted state: " + value);
    }
}
