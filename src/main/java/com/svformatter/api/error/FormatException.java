package com.svformatter.api.error;

/**
 * Base class of every failure a render call can surface to its caller.
 */
public abstract class FormatException extends RuntimeException {

    protected FormatException(String message) {
        super(message);
    }

    protected FormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
