package com.ambr.config;

import com.ambr.logging.AppLogger;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Central entry point for resolving configuration values.
 * <p>
 * Each key is looked up as a JVM system property, then as an environment variable (upper case,
 * dots replaced by underscores), then in the properties file named by {@code ambr.config}, then in
 * the classpath {@code ambr.properties}. Keys found nowhere fall back to built-in defaults.
 */
public final class ConfigService {
    private static final Logger LOGGER = AppLogger.get();

    public static final String CONFIG_FILE_KEY = "ambr.config";
    public static final String CLASSPATH_RESOURCE = "ambr.properties";

    public static final String BASE_DIR = "ambr.base.dir";
    public static final String UPLOAD_DIR = "ambr.upload.dir";
    public static final String OUTPUT_DIR = "ambr.output.dir";
    public static final String OLD_MASTER = "ambr.old.master";
    public static final String NEW_MASTER = "ambr.new.master";
    public static final String REGISTRY_SHEET = "ambr.registry.sheet";
    public static final String REMOVED_ROW_PATTERN = "ambr.removed.pattern";
    public static final String WORKERS = "ambr.workers";
    public static final String ENRICHMENT_ENABLED = "ambr.enrichment.enabled";
    public static final String ENRICHMENT_URL = "ambr.enrichment.url";
    public static final String ENRICHMENT_BATCH_SIZE = "ambr.enrichment.batch.size";
    public static final String ENRICHMENT_CONCURRENCY = "ambr.enrichment.concurrency";
    public static final String ENRICHMENT_MAX_ATTEMPTS = "ambr.enrichment.max.attempts";
    public static final String ENRICHMENT_RETRY_DELAY_MS = "ambr.enrichment.retry.delay.ms";
    public static final String ENRICHMENT_TIMEOUT_MS = "ambr.enrichment.timeout.ms";
    public static final String BULK_BUY_ENABLED = "ambr.bulkbuy.enabled";
    public static final String BULK_BUY_THRESHOLD = "ambr.bulkbuy.threshold";
    public static final String TIMEZONE_ENABLED = "ambr.timezone.enabled";
    public static final String TIMEZONE_ZONE = "ambr.timezone.zone";
    public static final String WEBHOOK_URL = "ambr.webhook.url";
    public static final String REPORT_FILE = "ambr.report.file";
    public static final String DROPPED_COLUMNS = "ambr.report.dropped.columns";

    static final String OLD_MASTER_RELATIVE = "OLD_DATA/OLD_Label_and_NonLabel_Vendors_Updated.xlsx";
    static final String NEW_MASTER_FILE = "3rd-Party-Orders-Mastersheet.xlsx";

    private final Properties systemProperties;
    private final Map<String, String> environment;
    private final Properties fileProperties;
    private final Properties classpathProperties;

    public ConfigService() {
        this(System.getProperties(), System.getenv());
    }

    /**
     * Resolves settings from the given property and environment snapshots instead of the process ones.
     */
    public ConfigService(Properties systemProperties, Map<String, String> environment) {
        this.systemProperties = Objects.requireNonNull(systemProperties, "systemProperties");
        this.environment = Objects.requireNonNull(environment, "environment");
        this.classpathProperties = loadClasspath();
        this.fileProperties = loadExternalFile();
    }

    /**
     * Resolves a single key through the lookup chain.
     */
    public Optional<String> get(String key) {
        String value = systemProperties.getProperty(key);
        if (isPresent(value)) {
            return Optional.of(value.trim());
        }
        value = environment.get(toEnvironmentName(key));
        if (isPresent(value)) {
            return Optional.of(value.trim());
        }
        value = fileProperties.getProperty(key);
        if (isPresent(value)) {
            return Optional.of(value.trim());
        }
        value = classpathProperties.getProperty(key);
        if (isPresent(value)) {
            return Optional.of(value.trim());
        }
        return Optional.empty();
    }

    public PipelineConfig load() {
        return load(Map.of());
    }

    /**
     * Builds the run configuration. {@code overrides} take precedence over every other source and are
     * typically the command-line options.
     */
    public PipelineConfig load(Map<String, String> overrides) {
        Objects.requireNonNull(overrides, "overrides");
        Path baseDir = path(overrides, BASE_DIR).orElseGet(() -> Paths.get(System.getProperty("user.home"), "ambr"));
        Path uploadDir = path(overrides, UPLOAD_DIR).orElse(baseDir.resolve("Upload"));
        Path outputDir = path(overrides, OUTPUT_DIR).orElse(baseDir.resolve("Output"));

        PipelineConfig.Builder builder = PipelineConfig.builder()
            .uploadDirectory(uploadDir)
            .outputDirectory(outputDir)
            .oldMasterWorkbook(path(overrides, OLD_MASTER).orElse(baseDir.resolve(OLD_MASTER_RELATIVE)))
            .newMasterWorkbook(path(overrides, NEW_MASTER).orElse(uploadDir.resolve(NEW_MASTER_FILE)));

        value(overrides, REGISTRY_SHEET).ifPresent(builder::registrySheetName);
        value(overrides, REMOVED_ROW_PATTERN).map(raw -> compile(REMOVED_ROW_PATTERN, raw)).ifPresent(builder::removedRowPattern);
        value(overrides, WORKERS).map(raw -> parseInt(WORKERS, raw)).ifPresent(builder::reconciliationWorkers);

        value(overrides, ENRICHMENT_ENABLED).map(Boolean::parseBoolean).ifPresent(builder::enrichmentEnabled);
        value(overrides, ENRICHMENT_URL).map(raw -> parseUri(ENRICHMENT_URL, raw)).ifPresent(builder::enrichmentEndpoint);
        value(overrides, ENRICHMENT_BATCH_SIZE).map(raw -> parseInt(ENRICHMENT_BATCH_SIZE, raw)).ifPresent(builder::enrichmentBatchSize);
        value(overrides, ENRICHMENT_CONCURRENCY).map(raw -> parseInt(ENRICHMENT_CONCURRENCY, raw)).ifPresent(builder::enrichmentConcurrency);
        value(overrides, ENRICHMENT_MAX_ATTEMPTS).map(raw -> parseInt(ENRICHMENT_MAX_ATTEMPTS, raw)).ifPresent(builder::enrichmentMaxAttempts);
        value(overrides, ENRICHMENT_RETRY_DELAY_MS).map(raw -> millis(ENRICHMENT_RETRY_DELAY_MS, raw)).ifPresent(builder::enrichmentRetryDelay);
        value(overrides, ENRICHMENT_TIMEOUT_MS).map(raw -> millis(ENRICHMENT_TIMEOUT_MS, raw)).ifPresent(builder::enrichmentTimeout);

        value(overrides, BULK_BUY_ENABLED).map(Boolean::parseBoolean).ifPresent(builder::bulkBuyCheckEnabled);
        value(overrides, BULK_BUY_THRESHOLD).map(raw -> parseInt(BULK_BUY_THRESHOLD, raw)).ifPresent(builder::bulkBuyThreshold);
        value(overrides, TIMEZONE_ENABLED).map(Boolean::parseBoolean).ifPresent(builder::timezoneAnnotationEnabled);
        value(overrides, TIMEZONE_ZONE).map(raw -> parseZone(TIMEZONE_ZONE, raw)).ifPresent(builder::reportZone);

        value(overrides, WEBHOOK_URL).ifPresent(builder::webhookUrl);
        value(overrides, REPORT_FILE).ifPresent(builder::reportFileName);
        value(overrides, DROPPED_COLUMNS).map(ConfigService::splitList).ifPresent(builder::droppedReportColumns);

        PipelineConfig config = builder.build();
        LOGGER.fine(() -> "Resolved configuration: upload=%s, output=%s, oldMaster=%s, newMaster=%s".formatted(
            config.uploadDirectory(), config.outputDirectory(), config.oldMasterWorkbook(), config.newMasterWorkbook()));
        return config;
    }

    static String toEnvironmentName(String key) {
        return key.replace('.', '_').toUpperCase(Locale.ROOT);
    }

    private Optional<String> value(Map<String, String> overrides, String key) {
        String override = overrides.get(key);
        if (isPresent(override)) {
            return Optional.of(override.trim());
        }
        return get(key);
    }

    private Optional<Path> path(Map<String, String> overrides, String key) {
        return value(overrides, key).map(Paths::get);
    }

    private Properties loadClasspath() {
        Properties properties = new Properties();
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = ConfigService.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(CLASSPATH_RESOURCE)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read classpath " + CLASSPATH_RESOURCE, ex);
        }
        return properties;
    }

    private Properties loadExternalFile() {
        Properties properties = new Properties();
        String location = systemProperties.getProperty(CONFIG_FILE_KEY);
        if (!isPresent(location)) {
            location = environment.get(toEnvironmentName(CONFIG_FILE_KEY));
        }
        if (!isPresent(location)) {
            return properties;
        }
        Path file = Paths.get(location.trim());
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException("Configuration file not found: " + file);
        }
        try (InputStream in = Files.newInputStream(file)) {
            properties.load(in);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read configuration file " + file, ex);
        }
        LOGGER.fine(() -> "Loaded configuration file " + file);
        return properties;
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }

    private static int parseInt(String key, String raw) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid integer for %s: '%s'".formatted(key, raw), ex);
        }
    }

    private static Duration millis(String key, String raw) {
        int value = parseInt(key, raw);
        if (value < 0) {
            throw new IllegalArgumentException("%s must not be negative: %d".formatted(key, value));
        }
        return Duration.ofMillis(value);
    }

    private static URI parseUri(String key, String raw) {
        try {
            return URI.create(raw);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Invalid URL for %s: '%s'".formatted(key, raw), ex);
        }
    }

    private static ZoneId parseZone(String key, String raw) {
        try {
            return ZoneId.of(raw);
        } catch (RuntimeException ex) {
            throw new IllegalArgumentException("Invalid time zone for %s: '%s'".formatted(key, raw), ex);
        }
    }

    private static Pattern compile(String key, String raw) {
        try {
            return Pattern.compile(raw);
        } catch (PatternSyntaxException ex) {
            throw new IllegalArgumentException("Invalid pattern for %s: '%s'".formatted(key, raw), ex);
        }
    }

    private static List<String> splitList(String raw) {
        return Arrays.stream(raw.split(","))
            .map(String::strip)
            .filter(entry -> !entry.isEmpty())
            .toList();
    }
}
