package org.dxworks.pagecanvas.markup;

import org.dxworks.pagecanvas.CanvasException;

/**
 * Thrown when canvas markup cannot be split into balanced fragments, or a fragment
 * lacks a structure the parser depends on. Aborts the parse of the whole page.
 */
public class MalformedMarkupException extends CanvasException {

    public MalformedMarkupException(String message) {
        super(message);
    }
}
