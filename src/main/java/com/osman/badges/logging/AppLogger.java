package com.osman.badges.logging;

import java.io.IOException;
import java.io.UnsupportedEncodingException;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.StreamHandler;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Provides a shared logger configuration for the badge generator.
 */
public final class AppLogger {
    private static final String LOG_FILE_PROPERTY = "badges.log.file";
    private static final String LOG_FILE_ENV = "BADGES_LOG_FILE";

    private static final Logger LOGGER = createLogger();

    private AppLogger() {
    }

    public static Logger get() {
        return LOGGER;
    }

    private static Logger createLogger() {
        Logger logger = Logger.getLogger("com.osman.badges.BadgeGenerator");
        logger.setUseParentHandlers(false);
        Formatter formatter = new Formatter() {
            @Override
            public String format(LogRecord record) {
                String line = "%s %s%n".formatted(record.getLevel().getName(), formatMessage(record));
                if (record.getThrown() != null) {
                    Throwable thrown = record.getThrown();
                    line += "    caused by %s: %s%n".formatted(thrown.getClass().getSimpleName(), thrown.getMessage());
                }
                return line;
            }
        };

        StreamHandler consoleHandler = new StreamHandler(System.out, formatter) {
            @Override
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        try {
            consoleHandler.setEncoding(UTF_8.name());
        } catch (UnsupportedEncodingException ex) {
            throw new IllegalStateException("UTF-8 console encoding unavailable", ex);
        }
        consoleHandler.setLevel(Level.ALL);
        logger.addHandler(consoleHandler);
        logger.setLevel(Level.INFO);

        String logFile = firstNonBlank(System.getProperty(LOG_FILE_PROPERTY), System.getenv(LOG_FILE_ENV));
        if (logFile != null) {
            try {
                FileHandler fileHandler = new FileHandler(logFile, true);
                fileHandler.setEncoding(UTF_8.name());
                fileHandler.setFormatter(formatter);
                fileHandler.setLevel(Level.ALL);
                logger.addHandler(fileHandler);
            } catch (IOException | SecurityException ex) {
                logger.warning("Failed to open log file " + logFile + ": " + ex.getMessage());
            }
        }
        return logger;
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }
}
