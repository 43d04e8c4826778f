package com.svformatter.core;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.svformatter.api.CodeFormatter;
import com.svformatter.api.FormatterPlugin;
import com.svformatter.api.FormatterResult;
import com.svformatter.api.error.FormatterError;
import com.svformatter.api.error.Severity;
import com.svformatter.config.FormatterConfig;
import com.svformatter.plugins.FileType;
import com.svformatter.util.LoggerUtil;

/**
 * Thread-safe orchestrator that routes each file to the plugin registered for its type.
 *
 * <p>Every file is an independent render call, so a directory is formatted on a fixed thread
 * pool; a failing file produces a failed {@link FormatterResult} and never affects the others.
 */
public class SvCodeFormatter implements CodeFormatter, AutoCloseable {
    private static final Logger logger = LoggerUtil.getLogger(SvCodeFormatter.class);

    private final Map<FileType, FormatterPlugin> plugins = new ConcurrentHashMap<>();
    private final FormatterConfig config;

    private final AtomicInteger processedFileCount = new AtomicInteger(0);
    private final AtomicInteger successCount = new AtomicInteger(0);
    private final AtomicInteger errorCount = new AtomicInteger(0);

    public SvCodeFormatter(FormatterConfig config) {
        this.config = config;
    }

    /**
     * Registers a plugin for a file type and initializes it with this formatter's configuration.
     * The same plugin instance may serve several file types; it is initialized once.
     */
    public void registerPlugin(FileType fileType, FormatterPlugin plugin) {
        if (!plugins.containsValue(plugin)) {
            plugin.initialize(config);
        }
        plugins.put(fileType, plugin);
        logger.fine("Registered plugin for file type: " + fileType.getDescription());
    }

    @Override
    public FormatterResult formatFile(Path filePath, String sourceCode) {
        FileType fileType = FileType.detect(filePath);
        FormatterPlugin plugin = plugins.get(fileType);

        if (plugin == null) {
            logger.warning("No plugin found for file type: " + fileType + " - " + filePath);
            return FormatterResult.builder()
                    .successful(false)
                    .originalCode(sourceCode)
                    .addError(new FormatterError(
                            Severity.ERROR,
                            "No plugin registered for file type: " + fileType,
                            1, 1))
                    .build();
        }

        try {
            processedFileCount.incrementAndGet();
            FormatterResult result = plugin.format(filePath, sourceCode);

            if (result.isSuccessful()) {
                successCount.incrementAndGet();
                logger.fine("Formatted: " + filePath + (result.isChanged() ? "" : " (unchanged)"));
            } else {
                errorCount.incrementAndGet();
                logger.warning("Failed to format: " + filePath + " - " +
                        result.getErrors().stream()
                                .map(e -> e.getSeverity() + ": " + e.getMessage())
                                .collect(Collectors.joining(", ")));
            }

            return result;
        } catch (RuntimeException e) {
            errorCount.incrementAndGet();
            logger.log(Level.SEVERE, "Unexpected error formatting file: " + filePath, e);

            return FormatterResult.builder()
                    .successful(false)
                    .originalCode(sourceCode)
                    .addError(new FormatterError(
                            Severity.FATAL,
                            "Unexpected error: " + e.getMessage(),
                            1, 1))
                    .build();
        }
    }

    @Override
    public String dumpFile(Path filePath, String sourceCode) {
        FileType fileType = FileType.detect(filePath);
        FormatterPlugin plugin = plugins.get(fileType);
        if (plugin == null) {
            throw new IllegalArgumentException("No plugin registered for file type: " + fileType);
        }
        return plugin.dumpTree(filePath, sourceCode);
    }

    @Override
    public Map<Path, FormatterResult> formatDirectory(Path directory) {
        return formatDirectory(directory, Runtime.getRuntime().availableProcessors());
    }

    /**
     * Formats every supported file below {@code directory} on {@code threadCount} threads.
     */
    public Map<Path, FormatterResult> formatDirectory(Path directory, int threadCount) {
        ConcurrentHashMap<Path, FormatterResult> results = new ConcurrentHashMap<>();

        if (!Files.isDirectory(directory)) {
            logger.warning("Path is not a directory: " + directory);
            return results;
        }

        List<Path> filesToProcess;
        try (Stream<Path> walk = Files.walk(directory)) {
            filesToProcess = walk
                    .filter(Files::isRegularFile)
                    .filter(path -> plugins.containsKey(FileType.detect(path)))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Error scanning directory: " + directory, e);
            return results;
        }

        logger.info("Found " + filesToProcess.size() + " files to process in " + directory);
        return formatFiles(filesToProcess, threadCount);
    }

    /**
     * Formats exactly the given files on {@code threadCount} threads. Files are read from disk;
     * one failing file never affects the others.
     */
    public Map<Path, FormatterResult> formatFiles(List<Path> files, int threadCount) {
        ConcurrentHashMap<Path, FormatterResult> results = new ConcurrentHashMap<>();
        if (files.isEmpty()) {
            return results;
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, Math.min(threadCount, files.size())));
        try {
            for (Path file : files) {
                executor.submit(() -> results.put(file, formatPath(file)));
            }
        } finally {
            executor.shutdown();
        }
        try {
            if (!executor.awaitTermination(30, TimeUnit.MINUTES)) {
                logger.warning("Timeout waiting for file processing to complete");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            logger.log(Level.WARNING, "Processing interrupted", e);
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }

        logger.info("Processed " + results.size() + " files");
        return results;
    }

    private FormatterResult formatPath(Path file) {
        try {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            return formatFile(file, content);
        } catch (IOException e) {
            logger.log(Level.WARNING, "Failed to read file: " + file, e);
            return FormatterResult.builder()
                    .successful(false)
                    .addError(new FormatterError(
                            Severity.FATAL,
                            "Failed to read file: " + e.getMessage(),
                            1, 1))
                    .build();
        }
    }

    /**
     * Files a plugin was invoked for, successful or not. Files without a plugin are not counted.
     */
    public int getProcessedFileCount() {
        return processedFileCount.get();
    }

    public int getSuccessCount() {
        return successCount.get();
    }

    /** Files whose result was unsuccessful. */
    public int getErrorCount() {
        return errorCount.get();
    }

    public boolean hasPluginFor(FileType fileType) {
        return plugins.containsKey(fileType);
    }

    /**
     * Closes every distinct plugin that holds resources. All plugins are closed even if one
     * fails; the first failure is rethrown afterwards.
     */
    @Override
    public void close() throws Exception {
        logger.fine("Closing formatter: processed=" + processedFileCount.get() +
                ", success=" + successCount.get() + ", errors=" + errorCount.get());

        Exception firstException = null;
        for (FormatterPlugin plugin : plugins.values().stream().distinct().collect(Collectors.toList())) {
            if (plugin instanceof AutoCloseable) {
                try {
                    ((AutoCloseable) plugin).close();
                } catch (Exception e) {
                    logger.log(Level.WARNING, "Error closing plugin " + plugin.getClass().getSimpleName(), e);
                    if (firstException == null) {
                        firstException = e;
                    }
                }
            }
        }

        plugins.clear();

        if (firstException != null) {
            throw firstException;
        }
    }
}
