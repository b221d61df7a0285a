package org.dxworks.pagecanvas.store;

import java.io.IOException;

/** Thrown when a page is created under a name that is already taken. */
public class PageAlreadyExistsException extends IOException {

    private final String pageName;

    public PageAlreadyExistsException(String pageName, String location) {
        super("A file with the name '" + pageName + "' already exists in '" + location + "'.");
        this.pageName = pageName;
    }

    public String getPageName() {
        return pageName;
    }
}
