package com.svformatter.api.error;

/**
 * Represents an error found during formatting. Lines and columns are one-based.
 */
public class FormatterError {
    private final Severity severity;
    private final String message;
    private final int line;
    private final int column;
    private final String suggestion;

    public FormatterError(Severity severity, String message, int line, int column) {
        this(severity, message, line, column, null);
    }

    public FormatterError(Severity severity, String message, int line, int column, String suggestion) {
        this.severity = severity;
        this.message = message;
        this.line = line;
        this.column = column;
        this.suggestion = suggestion;
    }

    /**
     * Converts a formatting failure into a reportable error.
     */
    public static FormatterError fromException(FormatException e) {
        if (e instanceof StructuralMismatchException) {
            StructuralMismatchException mismatch = (StructuralMismatchException) e;
            String suggestion = mismatch.isErrorRecovery()
                    ? "Fix the syntax error, or set 'errorNodes: verbatim' to pass it through unchanged"
                    : null;
            return new FormatterError(Severity.FATAL, e.getMessage(),
                    mismatch.getRow() + 1, mismatch.getColumn() + 1, suggestion);
        }
        return new FormatterError(Severity.FATAL, e.getMessage(), 1, 1);
    }

    // Getters
    public Severity getSeverity() { return severity; }
    public String getMessage() { return message; }
    public int getLine() { return line; }
    public int getColumn() { return column; }
    public String getSuggestion() { return suggestion; }
}
