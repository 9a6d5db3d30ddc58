package com.scanforge.infrastructure.rendering;

/**
 * The renderer was asked to do something its contract does not allow (unknown template placeholder,
 * missing fragment, unusable source shape). There is no corrective path for this error.
 */
public class RenderException extends RuntimeException {

    public RenderException(String message) {
        super(message);
    }

    public RenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
