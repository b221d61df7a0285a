package org.dxworks.pagecanvas.store;

import org.dxworks.pagecanvas.model.ClientSidePageLayoutType;

import java.io.IOException;

/**
 * Where page items live. Each call is a single blocking request and response; implementations
 * report failures as {@link IOException}s and do not retry.
 */
public interface PageContentStore {

    /**
     * Creates the item for a new, empty page.
     *
     * @throws PageAlreadyExistsException if a page with that name exists
     */
    PageContent createPage(String pageName, String title, ClientSidePageLayoutType layoutType) throws IOException;

    PageContent fetchPageContent(String pageRef) throws IOException;

    PageUpdateResult writePageContent(String pageRef, String canvasContent) throws IOException;

    PageUpdateResult setCommentsDisabled(String pageRef, boolean disabled) throws IOException;
}
