package com.svformatter.util;

import com.svformatter.api.error.FormatterError;
import com.svformatter.api.error.Severity;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Renders formatter errors for the terminal, optionally with ANSI colors.
 */
public class ErrorFormatter {
    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_RED = "\u001B[31m";
    public static final String ANSI_GREEN = "\u001B[32m";
    public static final String ANSI_YELLOW = "\u001B[33m";
    public static final String ANSI_BLUE = "\u001B[34m";
    public static final String ANSI_BOLD = "\u001B[1m";

    private final boolean useColors;

    /**
     * @param useColors wrap severities and summaries in ANSI escape codes
     */
    public ErrorFormatter(boolean useColors) {
        this.useColors = useColors;
    }

    /**
     * Formats one error as {@code SEVERITY: message (line:column)} plus an optional suggestion line.
     */
    public String formatError(FormatterError error) {
        StringBuilder sb = new StringBuilder();

        String severityStr = switch (error.getSeverity()) {
            case FATAL -> colorize(ANSI_RED, "FATAL");
            case ERROR -> colorize(ANSI_RED, "ERROR");
            case WARNING -> colorize(ANSI_YELLOW, "WARNING");
            case INFO -> colorize(ANSI_BLUE, "INFO");
        };

        sb.append(severityStr).append(": ");
        sb.append(error.getMessage());
        sb.append(" (").append(error.getLine()).append(':').append(error.getColumn()).append(")");

        if (error.getSuggestion() != null && !error.getSuggestion().isEmpty()) {
            sb.append("\n  ").append(colorize(ANSI_GREEN, "Suggestion: "))
                    .append(error.getSuggestion());
        }

        return sb.toString();
    }

    /**
     * Summarizes error counts per file and in total. Files without errors are skipped.
     */
    public String formatErrorSummary(Map<Path, List<FormatterError>> fileErrors) {
        StringBuilder sb = new StringBuilder();
        sb.append(colorize(ANSI_BOLD, "Error Summary:")).append('\n');

        int[] totals = new int[Severity.values().length];
        for (Map.Entry<Path, List<FormatterError>> entry : fileErrors.entrySet()) {
            List<FormatterError> errors = entry.getValue();
            if (errors.isEmpty()) {
                continue;
            }

            int[] counts = new int[Severity.values().length];
            for (FormatterError error : errors) {
                counts[error.getSeverity().ordinal()]++;
                totals[error.getSeverity().ordinal()]++;
            }
            sb.append(entry.getKey().getFileName()).append(": ").append(describeCounts(counts)).append('\n');
        }

        sb.append("\nTotal: ").append(describeCounts(totals));
        return sb.toString();
    }

    private String describeCounts(int[] counts) {
        StringBuilder sb = new StringBuilder();
        for (Severity severity : Severity.values()) {
            int count = counts[severity.ordinal()];
            if (count == 0) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(", ");
            }
            String label = switch (severity) {
                case FATAL -> colorize(ANSI_RED, count + " fatal");
                case ERROR -> colorize(ANSI_RED, count + " errors");
                case WARNING -> colorize(ANSI_YELLOW, count + " warnings");
                case INFO -> colorize(ANSI_BLUE, count + " info");
            };
            sb.append(label);
        }
        return sb.length() == 0 ? "none" : sb.toString();
    }

    /**
     * Wraps {@code message} in {@code color} and a reset code, or returns it unchanged when colors are off.
     */
    public String colorize(String color, String message) {
        if (useColors) {
            return color + message + ANSI_RESET;
        }
        return message;
    }
}
