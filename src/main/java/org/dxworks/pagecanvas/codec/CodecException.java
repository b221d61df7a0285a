package org.dxworks.pagecanvas.codec;

import org.dxworks.pagecanvas.CanvasException;

/** Thrown when an attribute value is not valid escaped JSON, or a value cannot be written as JSON. */
public class CodecException extends CanvasException {

    public CodecException(String message) {
        super(message);
    }

    public CodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
