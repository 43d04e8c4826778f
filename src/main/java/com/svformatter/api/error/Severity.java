package com.svformatter.api.error;

public enum Severity {
    FATAL,   // Parse or structural errors preventing formatting
    ERROR,   // Formatting was not possible for an item
    WARNING, // Input was formatted but something looked off
    INFO     // Informational messages about formatting
}
