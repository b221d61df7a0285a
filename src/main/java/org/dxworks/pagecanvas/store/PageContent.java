package org.dxworks.pagecanvas.store;

import java.util.Objects;

/**
 * Canvas markup and comment setting of a stored page.
 */
public final class PageContent {

    private final String pageRef;
    private final String canvasContent;
    private final boolean commentsDisabled;

    public PageContent(String pageRef, String canvasContent, boolean commentsDisabled) {
        this.pageRef = Objects.requireNonNull(pageRef, "pageRef");
        this.canvasContent = canvasContent == null ? "" : canvasContent;
        this.commentsDisabled = commentsDisabled;
    }

    public String getPageRef() {
        return pageRef;
    }

    public String getCanvasContent() {
        return canvasContent;
    }

    public boolean isCommentsDisabled() {
        return commentsDisabled;
    }
}
