package com.svformatter.api.error;

/**
 * The grammar, or the kind table generated from it, could not be initialized.
 */
public class LanguageConfigurationException extends FormatException {

    public LanguageConfigurationException(String message) {
        super(message);
    }

    public LanguageConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
