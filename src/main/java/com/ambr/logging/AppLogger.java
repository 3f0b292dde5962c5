package com.ambr.logging;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.StreamHandler;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Provides the shared logger used by every stage of a reconciliation run.
 * <p>
 * The level defaults to {@code INFO} and can be changed with the {@code ambr.log.level} system
 * property or the {@code AMBR_LOG_LEVEL} environment variable. When run-log persistence is
 * configured, the database handler is closed on JVM shutdown so queued records are written.
 */
public final class AppLogger {
    static final String LOGGER_NAME = "com.ambr.UnshippedReconciler";
    static final String LEVEL_PROPERTY = "ambr.log.level";

    private static final DateTimeFormatter TIMESTAMP =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss,SSS").withZone(ZoneId.systemDefault());
    private static final Logger LOGGER = createLogger();

    private AppLogger() {
    }

    public static Logger get() {
        return LOGGER;
    }

    static String formatLine(LogRecord record) {
        StringBuilder line = new StringBuilder()
            .append(TIMESTAMP.format(Instant.ofEpochMilli(record.getMillis())))
            .append(" - ").append(record.getLevel().getName())
            .append(" - ").append(record.getMessage());
        Throwable thrown = record.getThrown();
        if (thrown != null) {
            line.append(" (").append(thrown.getClass().getSimpleName()).append(": ").append(thrown.getMessage()).append(')');
        }
        return line.append(System.lineSeparator()).toString();
    }

    /**
     * Parses a JUL level name such as {@code FINE} or {@code WARNING}; blank or unknown names give {@code fallback}.
     */
    static Level parseLevel(String name, Level fallback) {
        if (name == null || name.isBlank()) {
            return fallback;
        }
        try {
            return Level.parse(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return fallback;
        }
    }

    private static Logger createLogger() {
        Logger logger = Logger.getLogger(LOGGER_NAME);
        logger.setUseParentHandlers(false);
        logger.setLevel(parseLevel(
            System.getProperty(LEVEL_PROPERTY, System.getenv("AMBR_LOG_LEVEL")), Level.INFO));
        logger.addHandler(consoleHandler());
        attachRunLog(logger);
        return logger;
    }

    private static StreamHandler consoleHandler() {
        Formatter formatter = new Formatter() {
            @Override
            public String format(LogRecord record) {
                return formatLine(record);
            }
        };
        StreamHandler handler = new StreamHandler(System.out, formatter) {
            @Override
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        try {
            handler.setEncoding(UTF_8.name());
        } catch (Exception ex) {
            System.err.println("Console log encoding left at platform default: " + ex.getMessage());
        }
        handler.setLevel(Level.ALL);
        return handler;
    }

    private static void attachRunLog(Logger logger) {
        DatabaseLogHandler runLog;
        try {
            runLog = new DatabaseLogHandler();
        } catch (IllegalStateException ex) {
            logger.fine("Run log persistence disabled: " + ex.getMessage());
            return;
        } catch (Exception ex) {
            logger.warning("Failed to initialize run log persistence: " + ex.getMessage());
            return;
        }
        runLog.setLevel(Level.INFO);
        logger.addHandler(runLog);
        Runtime.getRuntime().addShutdownHook(new Thread(runLog::close, "run-log-shutdown"));
        logger.fine("Run log persistence enabled, run id " + runLog.runId());
    }
}
