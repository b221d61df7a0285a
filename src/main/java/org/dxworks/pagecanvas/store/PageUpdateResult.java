package org.dxworks.pagecanvas.store;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a property update on a page item.
 */
public final class PageUpdateResult {

    private final String pageRef;
    private final List<String> updatedProperties;
    private final String eTag;

    public PageUpdateResult(String pageRef, List<String> updatedProperties, String eTag) {
        this.pageRef = Objects.requireNonNull(pageRef, "pageRef");
        this.updatedProperties = List.copyOf(updatedProperties);
        this.eTag = eTag;
    }

    public String getPageRef() {
        return pageRef;
    }

    public List<String> getUpdatedProperties() {
        return updatedProperties;
    }

    /** Version tag of the item after the update. */
    public String getETag() {
        return eTag;
    }
}
