package com.svformatter.api;

import java.nio.file.Path;

import com.svformatter.config.FormatterConfig;

/**
 * Interface for language-specific formatter plugins.
 */
public interface FormatterPlugin {
    /**
     * Initialize the plugin with the configuration. Grammar tables are loaded here.
     */
    void initialize(FormatterConfig config);

    /**
     * Format the provided source code.
     */
    FormatterResult format(Path filePath, String sourceCode);

    /**
     * Render the diagnostic syntax tree dump for the provided source code.
     */
    String dumpTree(Path filePath, String sourceCode);
}
