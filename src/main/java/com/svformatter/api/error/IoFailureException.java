package com.svformatter.api.error;

import java.io.IOException;

/**
 * The output sink rejected a write.
 */
public class IoFailureException extends FormatException {

    public IoFailureException(String message) {
        super(message);
    }

    public IoFailureException(String message, IOException cause) {
        super(message, cause);
    }
}
