package com.svformatter.cli;

import com.svformatter.api.FormatterResult;
import com.svformatter.api.error.FormatterError;
import com.svformatter.api.error.IoFailureException;
import com.svformatter.config.ConfigurationLoader;
import com.svformatter.config.FormatterConfig;
import com.svformatter.core.SvCodeFormatter;
import com.svformatter.plugins.FileType;
import com.svformatter.plugins.systemverilog.SystemVerilogFormatter;
import com.svformatter.util.ErrorFormatter;
import com.svformatter.util.LoggerUtil;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Command line front end ({@code svformat}).
 *
 * <p>Exit codes: 0 on success, 1 when a file failed to format, when {@code check} found files
 * that need formatting, or on a usage error.
 */
public class FormatterCli {
    private static final Logger logger = LoggerUtil.getLogger(FormatterCli.class);
    private static final String VERSION = "1.0.0";
    static final String CONFIG_FILE_NAME = ".svformat.yml";

    private static ErrorFormatter errorFormatter = new ErrorFormatter(false);
    private static PrintStream out = System.out;

    public static void main(String[] args) {
        int exitCode;
        try {
            exitCode = run(args, System.out);
        } finally {
            LoggerUtil.shutdown();
        }
        System.exit(exitCode);
    }

    /**
     * Runs one command and returns its exit code.
     */
    static int run(String[] args, PrintStream output) {
        out = output;
        errorFormatter = new ErrorFormatter(!_hasOption(args, "--no-color"));

        if (args.length < 1) {
            _printUsage();
            return 1;
        }

        LoggerUtil.setConsoleLevel(_hasOption(args, "--verbose") ? Level.FINE : Level.WARNING);

        try {
            switch (args[0]) {
                case "format":
                    return _formatFiles(args);
                case "check":
                    return _checkFiles(args);
                case "dump":
                    return _dumpFile(args);
                case "init":
                    return _initializeConfig(args);
                case "--version":
                case "-v":
                    out.println("svformat version " + VERSION);
                    return 0;
                case "--help":
                case "-h":
                    _printUsage();
                    return 0;
                default:
                    _printError("Unknown command: " + args[0]);
                    _printUsage();
                    return 1;
            }
        } catch (IOException | RuntimeException e) {
            _printError("Error: " + e.getMessage());
            logger.log(Level.SEVERE, "Unhandled exception", e);
            if (!_hasOption(args, "--verbose")) {
                _printInfo("Use --verbose for details");
            }
            return 1;
        }
    }

    private static void _printUsage() {
        out.println(errorFormatter.colorize(ErrorFormatter.ANSI_BOLD, "svformat v" + VERSION
                + " - SystemVerilog source formatter"));
        out.println("Usage:");
        out.println("  svformat format <path>            - Format files in place");
        out.println("  svformat check <path>             - Report files that need formatting");
        out.println("  svformat dump <file>              - Print the syntax tree of a file");
        out.println("  svformat init [--force]           - Write a default " + CONFIG_FILE_NAME);
        out.println("  svformat --help|-h                - Show this help");
        out.println("  svformat --version|-v             - Show version information");
        out.println();
        out.println("Options:");
        out.println("  --config=<file>                   - Use specific config file (default: " + CONFIG_FILE_NAME + ")");
        out.println("  --verbose                         - Show detailed output");
        out.println("  --ci                              - CI friendly output (no summary, machine readable result line)");
        out.println("  --no-color                        - Disable colored output");
        out.println("  --include=<glob>                  - Only include files matching pattern");
        out.println("  --threads=<num>                   - Number of threads to use (default: available processors)");
        out.println("  --stdout                          - Print formatted output instead of rewriting files");
        out.println("  --force                           - Overwrite an existing config file (with init)");
    }

    private static int _formatFiles(String[] args) throws IOException {
        Path path = _targetPath(args);
        if (path == null) {
            return 1;
        }

        boolean verbose = _hasOption(args, "--verbose");
        boolean ciMode = _hasOption(args, "--ci");
        boolean toStdout = _hasOption(args, "--stdout");
        FormatterConfig config = _loadConfig(args);

        try (SvCodeFormatter formatter = _createFormatter(config)) {
            List<Path> files = _findFiles(path, config.getIgnoreFiles(), _getOptionValue(args, "--include"));
            if (!toStdout) {
                _printInfo("Found " + files.size() + " files to format");
            }

            Instant start = Instant.now();
            Map<Path, FormatterResult> results = _formatAll(formatter, files, _threads(args));

            int changed = 0;
            Map<Path, List<FormatterError>> errorsByFile = new TreeMap<>();
            for (Path file : files) {
                FormatterResult result = results.get(file);
                if (!result.getErrors().isEmpty()) {
                    errorsByFile.put(file, result.getErrors());
                }
                if (!result.isSuccessful()) {
                    _printError("Failed to format: " + file);
                    result.getErrors().forEach(e -> _printError("  " + errorFormatter.formatError(e)));
                    continue;
                }
                if (toStdout) {
                    _emit(result.getFormattedCode(), file);
                } else if (result.isChanged()) {
                    Files.writeString(file, result.getFormattedCode(), StandardCharsets.UTF_8);
                    _printSuccess("Formatted: " + file);
                    changed++;
                } else if (verbose) {
                    _printInfo("  Already formatted: " + file);
                }
                result.getErrors().forEach(e -> _printWarning("  " + errorFormatter.formatError(e)));
            }

            int failed = (int) results.values().stream().filter(r -> !r.isSuccessful()).count();
            if (!toStdout) {
                out.println("\nFormatting complete in " + _formatDuration(Duration.between(start, Instant.now())) + ":");
                out.println("  Processed files: " + files.size());
                out.println("  Reformatted: " + changed);
                out.println("  Files with errors: " + failed);
                if (!errorsByFile.isEmpty() && !ciMode) {
                    out.println("\n" + errorFormatter.formatErrorSummary(errorsByFile));
                }
                if (ciMode) {
                    out.println("RESULT:files=" + files.size() + ";changed=" + changed + ";errors=" + failed);
                }
            }
            return failed > 0 ? 1 : 0;
        } catch (IOException | RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to close formatter: " + e.getMessage(), e);
        }
    }

    private static int _checkFiles(String[] args) throws IOException {
        Path path = _targetPath(args);
        if (path == null) {
            return 1;
        }

        boolean verbose = _hasOption(args, "--verbose");
        boolean ciMode = _hasOption(args, "--ci");
        FormatterConfig config = _loadConfig(args);

        try (SvCodeFormatter formatter = _createFormatter(config)) {
            List<Path> files = _findFiles(path, config.getIgnoreFiles(), _getOptionValue(args, "--include"));
            _printInfo("Found " + files.size() + " files to check");

            Instant start = Instant.now();
            Map<Path, FormatterResult> results = _formatAll(formatter, files, _threads(args));

            int nonCompliant = 0;
            int failed = 0;
            Map<Path, List<FormatterError>> errorsByFile = new TreeMap<>();
            for (Path file : files) {
                FormatterResult result = results.get(file);
                if (!result.isSuccessful()) {
                    failed++;
                    errorsByFile.put(file, result.getErrors());
                    _printError("Could not check: " + file);
                    result.getErrors().forEach(e -> _printError("  " + errorFormatter.formatError(e)));
                } else if (result.isChanged()) {
                    nonCompliant++;
                    _printWarning("File needs formatting: " + file);
                } else if (verbose) {
                    _printSuccess("  OK: " + file);
                }
            }

            out.println("\nCheck complete in " + _formatDuration(Duration.between(start, Instant.now())) + ":");
            out.println("  Checked files: " + files.size());
            out.println("  Files needing formatting: " + nonCompliant);
            out.println("  Files with processing errors: " + failed);
            if (!errorsByFile.isEmpty() && !ciMode) {
                out.println("\n" + errorFormatter.formatErrorSummary(errorsByFile));
            }
            if (ciMode) {
                out.println("RESULT:files=" + files.size() + ";unformatted=" + nonCompliant + ";errors=" + failed);
            }
            return nonCompliant > 0 || failed > 0 ? 1 : 0;
        } catch (IOException | RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to close formatter: " + e.getMessage(), e);
        }
    }

    private static int _dumpFile(String[] args) throws IOException {
        Path path = _targetPath(args);
        if (path == null) {
            return 1;
        }
        if (!Files.isRegularFile(path)) {
            _printError("Error: dump needs a single file: " + path);
            return 1;
        }

        FormatterConfig config = _loadConfig(args);
        try (SvCodeFormatter formatter = _createFormatter(config)) {
            _emit(formatter.dumpFile(path, Files.readString(path, StandardCharsets.UTF_8)), path);
            return 0;
        } catch (IOException | RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to close formatter: " + e.getMessage(), e);
        }
    }

    private static int _initializeConfig(String[] args) throws IOException {
        String configFile = _getOptionValue(args, "--config");
        Path configPath = Paths.get(configFile != null ? configFile : CONFIG_FILE_NAME);
        boolean force = _hasOption(args, "--force");

        if (Files.exists(configPath) && !force) {
            _printWarning("Configuration file already exists: " + configPath);
            out.println("Use --force to overwrite it or specify a different path with --config");
            return 0;
        }

        ConfigurationLoader.saveConfig(ConfigurationLoader.loadDefaultConfig(), configPath);
        _printSuccess("Created configuration file: " + configPath);
        return 0;
    }

    /**
     * Writes command output; a stream that rejected the write fails the command.
     */
    private static void _emit(String text, Path file) {
        out.print(text);
        if (out.checkError()) {
            throw new IoFailureException("Could not write output for " + file);
        }
    }

    private static Map<Path, FormatterResult> _formatAll(SvCodeFormatter formatter, List<Path> files, int threads)
            throws IOException {
        if (files.size() > 1 && threads > 1) {
            Map<Path, FormatterResult> results = new HashMap<>(formatter.formatFiles(files, threads));
            for (Path file : files) {
                if (!results.containsKey(file)) {
                    results.put(file, formatter.formatFile(file, Files.readString(file, StandardCharsets.UTF_8)));
                }
            }
            return results;
        }

        Map<Path, FormatterResult> results = new HashMap<>();
        for (Path file : files) {
            results.put(file, formatter.formatFile(file, Files.readString(file, StandardCharsets.UTF_8)));
        }
        return results;
    }

    private static Path _targetPath(String[] args) {
        if (args.length < 2 || args[1].startsWith("--")) {
            _printError("Error: Missing path argument");
            _printUsage();
            return null;
        }
        Path path = Paths.get(args[1]);
        if (!Files.exists(path)) {
            _printError("Error: Path does not exist: " + args[1]);
            return null;
        }
        return path;
    }

    private static FormatterConfig _loadConfig(String[] args) {
        String configFile = _getOptionValue(args, "--config");
        if (configFile != null) {
            logger.fine("Using config file: " + configFile);
            return ConfigurationLoader.loadConfig(Paths.get(configFile));
        }
        return ConfigurationLoader.loadConfig(Paths.get(CONFIG_FILE_NAME));
    }

    private static SvCodeFormatter _createFormatter(FormatterConfig config) {
        SvCodeFormatter formatter = new SvCodeFormatter(config);
        SystemVerilogFormatter plugin = new SystemVerilogFormatter();
        for (FileType type : FileType.values()) {
            if (type.isSupported()) {
                formatter.registerPlugin(type, plugin);
            }
        }
        return formatter;
    }

    private static int _threads(String[] args) {
        String threadsStr = _getOptionValue(args, "--threads");
        int threads = Runtime.getRuntime().availableProcessors();
        if (threadsStr != null) {
            try {
                threads = Math.max(1, Integer.parseInt(threadsStr));
            } catch (NumberFormatException e) {
                _printWarning("Invalid thread count: " + threadsStr + ", using default");
            }
        }
        return threads;
    }

    static List<Path> _findFiles(Path path, List<String> ignorePatterns, String includePattern) throws IOException {
        if (Files.isRegularFile(path)) {
            return List.of(path);
        }

        try (Stream<Path> walk = Files.walk(path)) {
            return walk
                    .filter(Files::isRegularFile)
                    .filter(p -> FileType.detect(p).isSupported())
                    .filter(p -> _matchesIncludePattern(p, includePattern))
                    .filter(p -> !_isIgnored(p, path, ignorePatterns))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            _printError("Error scanning directory: " + e.getMessage());
            throw e;
        }
    }

    static boolean _matchesIncludePattern(Path file, String includePattern) {
        if (includePattern == null || includePattern.isEmpty()) {
            return true;
        }

        String fileName = file.getFileName().toString();

        if (includePattern.startsWith("*.")) {
            return fileName.endsWith(includePattern.substring(1));
        } else if (includePattern.contains("*")) {
            return fileName.matches(_globToRegex(includePattern));
        } else {
            return fileName.contains(includePattern);
        }
    }

    static boolean _isIgnored(Path file, Path basePath, List<String> ignorePatterns) {
        if (ignorePatterns == null || ignorePatterns.isEmpty()) {
            return false;
        }

        String relativePath = basePath.relativize(file).toString().replace("\\", "/");

        for (String pattern : ignorePatterns) {
            if (pattern.startsWith("**/")) {
                if (relativePath.endsWith(pattern.substring(3))) {
                    return true;
                }
            } else if (pattern.endsWith("/**")) {
                if (relativePath.startsWith(pattern.substring(0, pattern.length() - 3))) {
                    return true;
                }
            } else if (pattern.contains("*")) {
                if (relativePath.matches(_globToRegex(pattern))) {
                    return true;
                }
            } else if (pattern.equals(relativePath)) {
                return true;
            }
        }

        return false;
    }

    private static String _globToRegex(String glob) {
        return glob.replace(".", "\\.").replace("*", ".*").replace("?", ".");
    }

    private static boolean _hasOption(String[] args, String option) {
        return Arrays.asList(args).contains(option);
    }

    private static String _getOptionValue(String[] args, String option) {
        String prefix = option + "=";
        return Arrays.stream(args)
                .filter(arg -> arg.startsWith(prefix))
                .map(arg -> arg.substring(prefix.length()))
                .findFirst()
                .orElse(null);
    }

    private static String _formatDuration(Duration duration) {
        long seconds = duration.getSeconds();
        long millis = duration.toMillis() % 1000;
        if (seconds < 60) {
            return String.format("%d.%03d seconds", seconds, millis);
        }
        return String.format("%d min %d sec", seconds / 60, seconds % 60);
    }

    private static void _printSuccess(String message) {
        out.println(errorFormatter.colorize(ErrorFormatter.ANSI_GREEN, message));
    }

    private static void _printError(String message) {
        out.println(errorFormatter.colorize(ErrorFormatter.ANSI_RED, message));
    }

    private static void _printWarning(String message) {
        out.println(errorFormatter.colorize(ErrorFormatter.ANSI_YELLOW, message));
    }

    private static void _printInfo(String message) {
        out.println(errorFormatter.colorize(ErrorFormatter.ANSI_BLUE, message));
    }
}
