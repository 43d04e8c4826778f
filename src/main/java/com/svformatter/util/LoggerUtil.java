package com.svformatter.util;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.*;

/**
 * Sets up java.util.logging for svformat and hands out loggers.
 *
 * <p>Configuration comes from the {@code /logging.properties} resource. Without it, svformat
 * installs its own console and rotating {@code svformat.log} handlers on the {@code com.svformatter}
 * logger and stops records from reaching the JVM-wide root handlers.
 */
public class LoggerUtil {
    static final String PROJECT_LOGGER = "com.svformatter";
    private static final String LOG_CONFIG_RESOURCE = "/logging.properties";
    private static final String FALLBACK_LOG_PATTERN = "svformat.%g.log";
    private static final int FALLBACK_LOG_LIMIT = 1024 * 1024;
    private static final int FALLBACK_LOG_COUNT = 3;

    private static final Logger projectLogger = Logger.getLogger(PROJECT_LOGGER);
    private static volatile boolean configured = false;
    private static Level consoleLevel = Level.INFO;

    /**
     * Configures logging once per JVM; later calls return immediately.
     */
    public static synchronized void initialize() {
        if (configured) {
            return;
        }
        try (InputStream config = LoggerUtil.class.getResourceAsStream(LOG_CONFIG_RESOURCE)) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            } else {
                _installFallbackHandlers();
            }
            configured = true;
        } catch (IOException | SecurityException e) {
            System.err.println("svformat: logging setup failed, continuing without it: " + e.getMessage());
        }
    }

    /**
     * Console output on stderr at the current console level, everything down to FINE in a
     * rotating log file.
     */
    private static void _installFallbackHandlers() throws IOException {
        for (Handler handler : projectLogger.getHandlers()) {
            projectLogger.removeHandler(handler);
            handler.close();
        }

        ConsoleHandler console = new ConsoleHandler();
        console.setLevel(consoleLevel);
        console.setFormatter(new SimpleFormatter());
        projectLogger.addHandler(console);

        FileHandler file = new FileHandler(FALLBACK_LOG_PATTERN, FALLBACK_LOG_LIMIT, FALLBACK_LOG_COUNT, true);
        file.setLevel(Level.FINE);
        file.setFormatter(new SimpleFormatter());
        projectLogger.addHandler(file);

        projectLogger.setLevel(Level.FINE);
        projectLogger.setUseParentHandlers(false);
    }

    /**
     * Changes what reaches the terminal. {@code --verbose} passes {@code FINE}; the default CLI
     * run passes {@code WARNING}. File handlers keep their own level.
     */
    public static synchronized void setConsoleLevel(Level level) {
        consoleLevel = level;
        if (!configured) {
            return;
        }
        for (Handler handler : _consoleHandlers()) {
            handler.setLevel(level);
        }
        Level effective = projectLogger.getLevel() != null ? projectLogger.getLevel() : Logger.getLogger("").getLevel();
        if (effective != null && effective.intValue() > level.intValue()) {
            projectLogger.setLevel(level);
        }
    }

    /**
     * Console handlers svformat writes through, whether installed from the resource (root) or
     * by the fallback (project logger).
     */
    static List<Handler> _consoleHandlers() {
        List<Handler> consoles = new ArrayList<>();
        for (Logger logger : new Logger[]{Logger.getLogger(""), projectLogger}) {
            for (Handler handler : logger.getHandlers()) {
                if (handler instanceof ConsoleHandler) {
                    consoles.add(handler);
                }
            }
        }
        return consoles;
    }

    /**
     * Logger named after {@code clazz}, configuring logging first if needed.
     */
    public static Logger getLogger(Class<?> clazz) {
        if (!configured) {
            initialize();
        }
        return Logger.getLogger(clazz.getName());
    }

    /**
     * Flushes and closes every handler svformat logs through. Called once before the CLI exits.
     */
    public static synchronized void shutdown() {
        for (Logger logger : new Logger[]{Logger.getLogger(""), projectLogger}) {
            for (Handler handler : logger.getHandlers()) {
                handler.flush();
                handler.close();
            }
        }
    }
}
