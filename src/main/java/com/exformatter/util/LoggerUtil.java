package com.exformatter.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Sets up java.util.logging for the formatter and hands out loggers.
 * <p>
 * The configuration comes from {@code /logging.properties} on the classpath.
 * Without it, records at {@link #getConsoleLevel()} and above go to stderr and
 * everything goes to {@code exformatter.log}.
 */
public final class LoggerUtil {
    private static final Logger rootLogger = Logger.getLogger("");
    private static final String LOG_CONFIG_RESOURCE = "/logging.properties";
    private static boolean initialized = false;
    private static Level consoleLevel = Level.INFO;
    private static Path logFilePath = Paths.get("exformatter.log");

    private LoggerUtil() {
    }

    public static synchronized void initialize() {
        if (initialized) {
            return;
        }

        try (InputStream is = LoggerUtil.class.getResourceAsStream(LOG_CONFIG_RESOURCE)) {
            if (is != null) {
                LogManager.getLogManager().readConfiguration(is);
            } else {
                configureHandlers();
            }
        } catch (IOException e) {
            System.err.println("Failed to initialize logging: " + e.getMessage());
        }
        initialized = true;
    }

    private static void configureHandlers() throws IOException {
        for (Handler handler : rootLogger.getHandlers()) {
            rootLogger.removeHandler(handler);
        }

        ConsoleHandler consoleHandler = new ConsoleHandler();
        consoleHandler.setLevel(consoleLevel);
        consoleHandler.setFormatter(new SimpleFormatter());
        rootLogger.addHandler(consoleHandler);
        rootLogger.addHandler(newFileHandler());
        rootLogger.setLevel(Level.ALL);
    }

    private static FileHandler newFileHandler() throws IOException {
        FileHandler fileHandler = new FileHandler(logFilePath.toString(), true);
        fileHandler.setLevel(Level.ALL);
        fileHandler.setFormatter(new SimpleFormatter());
        return fileHandler;
    }

    public static Level getConsoleLevel() {
        return consoleLevel;
    }

    /**
     * Changes the level of console output. {@code --verbose} lowers it to FINE.
     */
    public static synchronized void setConsoleLevel(Level level) {
        consoleLevel = level;
        for (Handler handler : rootLogger.getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                handler.setLevel(level);
            }
        }
    }

    /**
     * Replaces the file handler so that records go to {@code path}.
     */
    public static synchronized void setLogFilePath(Path path) {
        logFilePath = path;
        if (!initialized) {
            return;
        }

        for (Handler handler : rootLogger.getHandlers()) {
            if (handler instanceof FileHandler) {
                rootLogger.removeHandler(handler);
                handler.close();
            }
        }
        try {
            rootLogger.addHandler(newFileHandler());
        } catch (IOException e) {
            Logger.getLogger(LoggerUtil.class.getName())
                    .log(Level.SEVERE, "Failed to open log file " + path, e);
        }
    }

    public static Logger getLogger(Class<?> clazz) {
        return getLogger(clazz.getName());
    }

    public static Logger getLogger(String name) {
        if (!initialized) {
            initialize();
        }
        return Logger.getLogger(name);
    }

    public static void shutdown() {
        for (Handler handler : rootLogger.getHandlers()) {
            handler.close();
        }
    }
}
