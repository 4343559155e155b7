package com.beautifier.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.logging.*;

/**
 * Utility class for configuring and managing logging throughout the application.
 */
public class LoggerUtil {
    private static final Logger rootLogger = Logger.getLogger("");
    private static final String DEFAULT_LOG_CONFIG = "/logging.properties";
    private static boolean initialized = false;
    private static Level consoleLevel = Level.WARNING;

    /**
     * Initializes the logging system from the bundled configuration.
     */
    public static synchronized void initialize() {
        if (initialized) {
            return;
        }

        try {
            try (InputStream is = LoggerUtil.class.getResourceAsStream(DEFAULT_LOG_CONFIG)) {
                if (is != null) {
                    LogManager.getLogManager().readConfiguration(is);
                    initialized = true;
                    return;
                }
            }

            configureBasicLogging();
            initialized = true;
        } catch (IOException e) {
            System.err.println("Failed to initialize logging: " + e.getMessage());
            e.printStackTrace();
        }
    }

    /**
     * Sets up console logging when no configuration resource is available.
     */
    private static void configureBasicLogging() {
        for (Handler handler : rootLogger.getHandlers()) {
            rootLogger.removeHandler(handler);
        }

        ConsoleHandler consoleHandler = new ConsoleHandler();
        consoleHandler.setLevel(consoleLevel);
        consoleHandler.setFormatter(new SimpleFormatter());

        rootLogger.addHandler(consoleHandler);
        rootLogger.setLevel(Level.INFO);
    }

    /**
     * Sets the console logging level.
     */
    public static synchronized void setConsoleLevel(Level level) {
        if (!initialized) {
            initialize();
        }
        consoleLevel = level;

        for (Handler handler : rootLogger.getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                handler.setLevel(level);
            }
        }
        Level rootLevel = rootLogger.getLevel();
        if (rootLevel == null || level.intValue() < rootLevel.intValue()) {
            rootLogger.setLevel(level);
        }
    }

    /**
     * Adds a file handler that records every message, replacing any previous one.
     */
    public static synchronized void setLogFile(Path path) {
        if (!initialized) {
            initialize();
        }

        try {
            for (Handler handler : rootLogger.getHandlers()) {
                if (handler instanceof FileHandler) {
                    rootLogger.removeHandler(handler);
                    handler.close();
                }
            }

            FileHandler fileHandler = new FileHandler(path.toString(), true);
            fileHandler.setLevel(Level.ALL);
            fileHandler.setFormatter(new SimpleFormatter());
            rootLogger.addHandler(fileHandler);
            rootLogger.setLevel(Level.ALL);
        } catch (IOException e) {
            Logger.getLogger(LoggerUtil.class.getName()).log(
                    Level.SEVERE, "Failed to open log file " + path, e);
        }
    }

    /**
     * Gets a logger for a specific class.
     */
    public static Logger getLogger(Class<?> clazz) {
        if (!initialized) {
            initialize();
        }
        return Logger.getLogger(clazz.getName());
    }

    /**
     * Gets a logger for a specific name.
     */
    public static Logger getLogger(String name) {
        if (!initialized) {
            initialize();
        }
        return Logger.getLogger(name);
    }

    /**
     * Closes all handlers, flushing any log file.
     */
    public static void shutdown() {
        for (Handler handler : rootLogger.getHandlers()) {
            handler.close();
        }
    }
}
