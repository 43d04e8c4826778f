package com.svformatter.plugins;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.logging.Level;
import java.util.logging.Logger;
import com.svformatter.util.LoggerUtil;

/**
 * Source file types the formatter recognizes, detected by extension and, for files without a
 * known extension, by sniffing the first few kilobytes.
 */
public enum FileType {
    SYSTEM_VERILOG("sv"),
    SYSTEM_VERILOG_HEADER("svh"),
    VERILOG("v"),
    VERILOG_HEADER("vh"),
    UNKNOWN("");

    private static final Logger logger = LoggerUtil.getLogger(FileType.class);
    private static final int SNIFF_BYTES = 4096;

    private static final Map<Path, FileType> typeCache = new ConcurrentHashMap<>();
    private static final int MAX_CACHE_SIZE = 10000;

    private static final Pattern SYSTEM_VERILOG_PATTERN = Pattern.compile(
            "(?m)(?:\\b(?:endclass|endfunction|endinterface|endpackage)\\b|^\\s*(?:virtual\\s+)?class\\s+\\w+)");

    private static final Pattern VERILOG_PATTERN = Pattern.compile(
            "(?m)(?:\\bendmodule\\b|^\\s*module\\s+\\w+)");

    private final String extension;

    FileType(String extension) {
        this.extension = extension;
    }

    /** Extension without the dot; empty for {@link #UNKNOWN}. */
    public String getExtension() {
        return extension;
    }

    /**
     * True for every recognized type. Whether a plugin handles it is decided at registration.
     */
    public boolean isSupported() {
        return this != UNKNOWN;
    }

    /**
     * Detects the file type of a path, caching the answer per path.
     */
    public static FileType detect(Path filePath) {
        FileType cachedType = typeCache.get(filePath);
        if (cachedType != null) {
            return cachedType;
        }

        if (typeCache.size() > MAX_CACHE_SIZE) {
            typeCache.clear();
            logger.fine("Cleared file type detection cache");
        }

        FileType typeByExtension = detectByExtension(filePath);
        if (typeByExtension != UNKNOWN) {
            typeCache.put(filePath, typeByExtension);
            return typeByExtension;
        }

        FileType detectedType = Files.isRegularFile(filePath) ? detectByContent(filePath) : UNKNOWN;
        typeCache.put(filePath, detectedType);
        return detectedType;
    }

    static FileType detectByExtension(Path filePath) {
        Path name = filePath.getFileName();
        if (name == null) {
            return UNKNOWN;
        }
        String fileName = name.toString().toLowerCase(Locale.ROOT);
        int dot = fileName.lastIndexOf('.');
        if (dot < 0) {
            return UNKNOWN;
        }

        return switch (fileName.substring(dot + 1)) {
            case "sv" -> SYSTEM_VERILOG;
            case "svh" -> SYSTEM_VERILOG_HEADER;
            case "v" -> VERILOG;
            case "vh" -> VERILOG_HEADER;
            default -> UNKNOWN;
        };
    }

    /**
     * Classifies content by its block keywords: class or function blocks mean SystemVerilog,
     * module blocks alone mean Verilog.
     */
    static FileType detectByContent(String content) {
        if (SYSTEM_VERILOG_PATTERN.matcher(content).find()) {
            return SYSTEM_VERILOG;
        }
        if (VERILOG_PATTERN.matcher(content).find()) {
            return VERILOG;
        }
        return UNKNOWN;
    }

    private static FileType detectByContent(Path filePath) {
        try (InputStream in = Files.newInputStream(filePath)) {
            byte[] head = in.readNBytes(SNIFF_BYTES);
            return detectByContent(new String(head, StandardCharsets.UTF_8));
        } catch (IOException e) {
            logger.log(Level.FINE, "Error reading file for type detection: " + filePath, e);
            return UNKNOWN;
        }
    }

    /** Forgets every cached detection. */
    public static void clearCache() {
        typeCache.clear();
        logger.fine("File type detection cache cleared");
    }

    public static int getCacheSize() {
        return typeCache.size();
    }

    /** Human-readable name used in log and error messages. */
    public String getDescription() {
        return switch (this) {
            case SYSTEM_VERILOG -> "SystemVerilog source file";
            case SYSTEM_VERILOG_HEADER -> "SystemVerilog header file";
            case VERILOG -> "Verilog source file";
            case VERILOG_HEADER -> "Verilog header file";
            case UNKNOWN -> "Unknown file type";
        };
    }
}
