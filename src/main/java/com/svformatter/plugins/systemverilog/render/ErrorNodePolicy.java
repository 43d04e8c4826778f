package com.svformatter.plugins.systemverilog.render;

import java.util.Locale;

/**
 * What the renderer does with an error-recovery node left by the parser.
 */
public enum ErrorNodePolicy {
    /** Fail the whole file with a structural mismatch. */
    ABORT,
    /** Copy the unparsed source text to the output unchanged. */
    VERBATIM;

    /**
     * Parses the configuration spelling ({@code abort} or {@code verbatim}), ignoring case.
     */
    public static ErrorNodePolicy fromConfig(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown error node policy '" + value
                    + "', expected 'abort' or 'verbatim'", e);
        }
    }
}
