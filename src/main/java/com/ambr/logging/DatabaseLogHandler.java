package com.ambr.logging;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.text.MessageFormat;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;

/**
 * Persists the log of a reconciliation run into the {@code run_logs} PostgreSQL table.
 * <p>
 * Every row carries the run id generated when the handler starts, so one run's records can be
 * selected together. Records are queued and inserted in batches by a daemon thread. Construction
 * fails with {@link IllegalStateException} when no JDBC URL is configured; {@link AppLogger} then
 * logs to the console only.
 */
public final class DatabaseLogHandler extends Handler {

    private static final String INSERT_SQL = """
        INSERT INTO run_logs (
            run_id,
            logged_at,
            level,
            logger,
            message,
            thread_name,
            host,
            thrown_type,
            thrown_msg
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;
    private static final int QUEUE_CAPACITY = 2048;
    private static final int MAX_BATCH = 64;
    private static final long SHUTDOWN_WAIT_MS = 5_000;

    private final BlockingQueue<LogRecord> pending = new LinkedBlockingQueue<>(QUEUE_CAPACITY);
    private final String runId = UUID.randomUUID().toString();
    private final HikariDataSource dataSource;
    private final String hostName;
    private final Thread writer;

    private volatile boolean accepting = true;

    public DatabaseLogHandler() {
        RunLogSettings settings = RunLogSettings.resolve();
        if (settings.url() == null) {
            throw new IllegalStateException("no JDBC URL configured for run logs");
        }
        this.dataSource = openPool(settings);
        this.hostName = localHostName();
        this.writer = new Thread(this::writeUntilClosed, "run-log-writer");
        this.writer.setDaemon(true);
        this.writer.start();
        setLevel(Level.ALL);
    }

    /**
     * Identifier stamped on every row written by this handler.
     */
    public String runId() {
        return runId;
    }

    @Override
    public void publish(LogRecord record) {
        Objects.requireNonNull(record);
        if (!accepting || !isLoggable(record)) {
            return;
        }
        // oldest record is dropped when the database falls behind
        while (!pending.offer(record)) {
            pending.poll();
        }
    }

    @Override
    public void flush() {
        // rows are inserted by the writer thread
    }

    @Override
    public void close() throws SecurityException {
        accepting = false;
        try {
            // the writer notices within one poll interval and inserts what is still queued
            writer.join(SHUTDOWN_WAIT_MS);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
        }
        if (writer.isAlive()) {
            writer.interrupt();
        }
        dataSource.close();
    }

    private void writeUntilClosed() {
        List<LogRecord> batch = new ArrayList<>(MAX_BATCH);
        while (accepting && !Thread.currentThread().isInterrupted()) {
            try {
                LogRecord first = pending.poll(1, TimeUnit.SECONDS);
                if (first == null) {
                    continue;
                }
                batch.add(first);
                pending.drainTo(batch, MAX_BATCH - 1);
                insert(batch);
            } catch (InterruptedException interrupted) {
                Thread.currentThread().interrupt();
            } catch (SQLException ex) {
                System.err.println("Run log insert failed: " + ex.getMessage());
            } finally {
                batch.clear();
            }
        }

        pending.drainTo(batch);
        if (batch.isEmpty()) {
            return;
        }
        // the pool refuses to hand out connections to an interrupted thread
        Thread.interrupted();
        try {
            insert(batch);
        } catch (SQLException ex) {
            System.err.println("Run log insert failed during shutdown: " + ex.getMessage());
        }
    }

    private void insert(List<LogRecord> records) throws SQLException {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement(INSERT_SQL)) {
            for (LogRecord record : records) {
                Throwable thrown = record.getThrown();
                statement.setString(1, runId);
                statement.setTimestamp(2, Timestamp.from(Instant.ofEpochMilli(record.getMillis())));
                statement.setString(3, record.getLevel().getName());
                statement.setString(4, record.getLoggerName());
                statement.setString(5, renderMessage(record));
                statement.setString(6, "thread-" + record.getLongThreadID());
                statement.setString(7, hostName);
                statement.setString(8, thrown == null ? null : thrown.getClass().getName());
                statement.setString(9, thrown == null ? null : thrown.getMessage());
                statement.addBatch();
            }
            statement.executeBatch();
        }
    }

    /**
     * Applies the record's {@link MessageFormat} parameters; a malformed pattern is stored as written.
     */
    static String renderMessage(LogRecord record) {
        String message = record.getMessage();
        if (message == null) {
            return "";
        }
        Object[] params = record.getParameters();
        if (params == null || params.length == 0) {
            return message;
        }
        try {
            return MessageFormat.format(message, params);
        } catch (IllegalArgumentException ex) {
            return message;
        }
    }

    private static String localHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "unknown-host";
        }
    }

    private static HikariDataSource openPool(RunLogSettings settings) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(settings.url());
        hikariConfig.setUsername(settings.username());
        hikariConfig.setPassword(settings.password());
        hikariConfig.setMaximumPoolSize(settings.poolSize());
        hikariConfig.setPoolName("RunLogPool");
        hikariConfig.setAutoCommit(true);
        // start without a database; inserts fail individually until it is reachable
        hikariConfig.setInitializationFailTimeout(-1);
        return new HikariDataSource(hikariConfig);
    }

    /**
     * Connection settings, each looked up as system property, then environment variable, then
     * {@code logging-db.properties} entry.
     */
    private record RunLogSettings(String url, String username, String password, int poolSize) {
        private static final String RESOURCE = "logging-db.properties";
        private static final int DEFAULT_POOL_SIZE = 2;

        static RunLogSettings resolve() {
            Properties resource = readResource();
            String poolSize = lookup(resource, "ambr.logging.jdbc.poolSize", "AMBR_LOGGING_JDBC_POOL", "jdbc.poolSize");
            return new RunLogSettings(
                lookup(resource, "ambr.logging.jdbc.url", "AMBR_LOGGING_JDBC_URL", "jdbc.url"),
                lookup(resource, "ambr.logging.jdbc.user", "AMBR_LOGGING_JDBC_USER", "jdbc.username"),
                lookup(resource, "ambr.logging.jdbc.pass", "AMBR_LOGGING_JDBC_PASS", "jdbc.password"),
                parsePoolSize(poolSize));
        }

        private static String lookup(Properties resource, String property, String environment, String resourceKey) {
            for (String value : new String[]{
                System.getProperty(property), System.getenv(environment), resource.getProperty(resourceKey)}) {
                if (value != null && !value.isBlank()) {
                    return value.trim();
                }
            }
            return null;
        }

        private static Properties readResource() {
            Properties props = new Properties();
            try (InputStream stream = DatabaseLogHandler.class.getClassLoader().getResourceAsStream(RESOURCE)) {
                if (stream != null) {
                    props.load(stream);
                }
            } catch (IOException ex) {
                System.err.println("Ignoring unreadable " + RESOURCE + ": " + ex.getMessage());
            }
            return props;
        }

        private static int parsePoolSize(String raw) {
            if (raw == null) {
                return DEFAULT_POOL_SIZE;
            }
            try {
                return Math.max(1, Integer.parseInt(raw));
            } catch (NumberFormatException ex) {
                return DEFAULT_POOL_SIZE;
            }
        }
    }
}
