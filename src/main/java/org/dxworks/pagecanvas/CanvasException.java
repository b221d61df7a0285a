package org.dxworks.pagecanvas;

/** Base exception for failures while reading or writing canvas markup. */
public class CanvasException extends RuntimeException {

    public CanvasException(String message) {
        super(message);
    }

    public CanvasException(String message, Throwable cause) {
        super(message, cause);
    }
}
