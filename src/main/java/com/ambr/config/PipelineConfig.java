package com.ambr.config;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Immutable settings of one reconciliation run. Built by {@link ConfigService} or directly in tests.
 */
public final class PipelineConfig {

    public static final String DEFAULT_REGISTRY_SHEET = "Overall vendors";
    public static final String DEFAULT_REPORT_FILE = "Optimized_Unshipped_Report.xlsx";

    /**
     * Columns of the export left out of the label and non-label report sheets.
     */
    public static final List<String> DEFAULT_DROPPED_COLUMNS = List.of(
        "order-item-id", "payments-date", "reporting-date", "days-past-promise", "buyer-email",
        "buyer-name", "payment-method-details", "cpf", "quantity-shipped", "quantity-to-ship",
        "ship-service-level", "ship-service-name", "ship-address-3", "gift-wrap-type", "gift-message-text",
        "payment-method", "cod-collectible-amount", "already-paid", "payment-method-fee", "customized-url",
        "customized-page", "purchase-order-number", "price-designation", "is-prime", "fulfilled-by",
        "is-premium-order", "buyer-company-name", "licensee-name", "license-number", "license-state",
        "license-expiration-date", "is-exchange-order", "original-order-id", "is-transparency",
        "default-ship-from-address-name", "default-ship-from-address-field-1",
        "default-ship-from-address-field-2", "default-ship-from-address-field-3", "default-ship-from-city",
        "default-ship-from-state", "default-ship-from-country", "default-ship-from-postal-code",
        "is-ispu-order", "store-chain-store-id", "buyer-requested-cancel-reason", "ioss-number",
        "is-shipping-settings-automation-enabled", "ssa-carrier", "ssa-ship-method", "tax-collection-model",
        "tax-collection-responsible-party", "verge-of-cancellation", "verge-of-lateshipment",
        "signature-confirmation-recommended"
    );

    private final Path uploadDirectory;
    private final Path outputDirectory;
    private final Path oldMasterWorkbook;
    private final Path newMasterWorkbook;
    private final String registrySheetName;
    private final Pattern removedRowPattern;
    private final int reconciliationWorkers;
    private final boolean enrichmentEnabled;
    private final URI enrichmentEndpoint;
    private final int enrichmentBatchSize;
    private final int enrichmentConcurrency;
    private final int enrichmentMaxAttempts;
    private final Duration enrichmentRetryDelay;
    private final Duration enrichmentTimeout;
    private final boolean bulkBuyCheckEnabled;
    private final int bulkBuyThreshold;
    private final boolean timezoneAnnotationEnabled;
    private final ZoneId reportZone;
    private final String webhookUrl;
    private final String reportFileName;
    private final List<String> droppedReportColumns;

    private PipelineConfig(Builder builder) {
        this.uploadDirectory = Objects.requireNonNull(builder.uploadDirectory, "uploadDirectory");
        this.outputDirectory = Objects.requireNonNull(builder.outputDirectory, "outputDirectory");
        this.oldMasterWorkbook = Objects.requireNonNull(builder.oldMasterWorkbook, "oldMasterWorkbook");
        this.newMasterWorkbook = Objects.requireNonNull(builder.newMasterWorkbook, "newMasterWorkbook");
        this.registrySheetName = Objects.requireNonNull(builder.registrySheetName, "registrySheetName");
        this.removedRowPattern = Objects.requireNonNull(builder.removedRowPattern, "removedRowPattern");
        this.reconciliationWorkers = Math.max(1, builder.reconciliationWorkers);
        this.enrichmentEnabled = builder.enrichmentEnabled;
        this.enrichmentEndpoint = builder.enrichmentEndpoint;
        this.enrichmentBatchSize = Math.max(1, builder.enrichmentBatchSize);
        this.enrichmentConcurrency = Math.max(1, builder.enrichmentConcurrency);
        this.enrichmentMaxAttempts = Math.max(1, builder.enrichmentMaxAttempts);
        this.enrichmentRetryDelay = Objects.requireNonNull(builder.enrichmentRetryDelay, "enrichmentRetryDelay");
        this.enrichmentTimeout = Objects.requireNonNull(builder.enrichmentTimeout, "enrichmentTimeout");
        this.bulkBuyCheckEnabled = builder.bulkBuyCheckEnabled;
        this.bulkBuyThreshold = Math.max(1, builder.bulkBuyThreshold);
        this.timezoneAnnotationEnabled = builder.timezoneAnnotationEnabled;
        this.reportZone = Objects.requireNonNull(builder.reportZone, "reportZone");
        this.webhookUrl = builder.webhookUrl == null || builder.webhookUrl.isBlank() ? null : builder.webhookUrl.trim();
        this.reportFileName = Objects.requireNonNull(builder.reportFileName, "reportFileName");
        this.droppedReportColumns = List.copyOf(builder.droppedReportColumns);
        if (enrichmentEnabled && enrichmentEndpoint == null) {
            throw new IllegalArgumentException("Enrichment is enabled but no enrichment endpoint is configured.");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .uploadDirectory(uploadDirectory)
            .outputDirectory(outputDirectory)
            .oldMasterWorkbook(oldMasterWorkbook)
            .newMasterWorkbook(newMasterWorkbook)
            .registrySheetName(registrySheetName)
            .removedRowPattern(removedRowPattern)
            .reconciliationWorkers(reconciliationWorkers)
            .enrichmentEnabled(enrichmentEnabled)
            .enrichmentEndpoint(enrichmentEndpoint)
            .enrichmentBatchSize(enrichmentBatchSize)
            .enrichmentConcurrency(enrichmentConcurrency)
            .enrichmentMaxAttempts(enrichmentMaxAttempts)
            .enrichmentRetryDelay(enrichmentRetryDelay)
            .enrichmentTimeout(enrichmentTimeout)
            .bulkBuyCheckEnabled(bulkBuyCheckEnabled)
            .bulkBuyThreshold(bulkBuyThreshold)
            .timezoneAnnotationEnabled(timezoneAnnotationEnabled)
            .reportZone(reportZone)
            .webhookUrl(webhookUrl)
            .reportFileName(reportFileName)
            .droppedReportColumns(droppedReportColumns);
    }

    public Path uploadDirectory() {
        return uploadDirectory;
    }

    public Path outputDirectory() {
        return outputDirectory;
    }

    public Path oldMasterWorkbook() {
        return oldMasterWorkbook;
    }

    public Path newMasterWorkbook() {
        return newMasterWorkbook;
    }

    public String registrySheetName() {
        return registrySheetName;
    }

    public Pattern removedRowPattern() {
        return removedRowPattern;
    }

    public int reconciliationWorkers() {
        return reconciliationWorkers;
    }

    public boolean enrichmentEnabled() {
        return enrichmentEnabled;
    }

    public URI enrichmentEndpoint() {
        return enrichmentEndpoint;
    }

    public int enrichmentBatchSize() {
        return enrichmentBatchSize;
    }

    public int enrichmentConcurrency() {
        return enrichmentConcurrency;
    }

    public int enrichmentMaxAttempts() {
        return enrichmentMaxAttempts;
    }

    public Duration enrichmentRetryDelay() {
        return enrichmentRetryDelay;
    }

    public Duration enrichmentTimeout() {
        return enrichmentTimeout;
    }

    public boolean bulkBuyCheckEnabled() {
        return bulkBuyCheckEnabled;
    }

    public int bulkBuyThreshold() {
        return bulkBuyThreshold;
    }

    public boolean timezoneAnnotationEnabled() {
        return timezoneAnnotationEnabled;
    }

    public ZoneId reportZone() {
        return reportZone;
    }

    public String webhookUrl() {
        return webhookUrl;
    }

    public String reportFileName() {
        return reportFileName;
    }

    public Path reportFile() {
        return outputDirectory.resolve(reportFileName);
    }

    public List<String> droppedReportColumns() {
        return droppedReportColumns;
    }

    public static final class Builder {
        private Path uploadDirectory;
        private Path outputDirectory;
        private Path oldMasterWorkbook;
        private Path newMasterWorkbook;
        private String registrySheetName = DEFAULT_REGISTRY_SHEET;
        private Pattern removedRowPattern = Pattern.compile("RET|INV");
        private int reconciliationWorkers = Runtime.getRuntime().availableProcessors();
        private boolean enrichmentEnabled;
        private URI enrichmentEndpoint;
        private int enrichmentBatchSize = 50;
        private int enrichmentConcurrency = 4;
        private int enrichmentMaxAttempts = 3;
        private Duration enrichmentRetryDelay = Duration.ofSeconds(2);
        private Duration enrichmentTimeout = Duration.ofSeconds(30);
        private boolean bulkBuyCheckEnabled;
        private int bulkBuyThreshold = 5;
        private boolean timezoneAnnotationEnabled;
        private ZoneId reportZone = ZoneId.systemDefault();
        private String webhookUrl;
        private String reportFileName = DEFAULT_REPORT_FILE;
        private List<String> droppedReportColumns = DEFAULT_DROPPED_COLUMNS;

        private Builder() {
        }

        public Builder uploadDirectory(Path value) {
            this.uploadDirectory = value;
            return this;
        }

        public Builder outputDirectory(Path value) {
            this.outputDirectory = value;
            return this;
        }

        public Builder oldMasterWorkbook(Path value) {
            this.oldMasterWorkbook = value;
            return this;
        }

        public Builder newMasterWorkbook(Path value) {
            this.newMasterWorkbook = value;
            return this;
        }

        public Builder registrySheetName(String value) {
            this.registrySheetName = value;
            return this;
        }

        public Builder removedRowPattern(Pattern value) {
            this.removedRowPattern = value;
            return this;
        }

        public Builder reconciliationWorkers(int value) {
            this.reconciliationWorkers = value;
            return this;
        }

        public Builder enrichmentEnabled(boolean value) {
            this.enrichmentEnabled = value;
            return this;
        }

        public Builder enrichmentEndpoint(URI value) {
            this.enrichmentEndpoint = value;
            return this;
        }

        public Builder enrichmentBatchSize(int value) {
            this.enrichmentBatchSize = value;
            return this;
        }

        public Builder enrichmentConcurrency(int value) {
            this.enrichmentConcurrency = value;
            return this;
        }

        public Builder enrichmentMaxAttempts(int value) {
            this.enrichmentMaxAttempts = value;
            return this;
        }

        public Builder enrichmentRetryDelay(Duration value) {
            this.enrichmentRetryDelay = value;
            return this;
        }

        public Builder enrichmentTimeout(Duration value) {
            this.enrichmentTimeout = value;
            return this;
        }

        public Builder bulkBuyCheckEnabled(boolean value) {
            this.bulkBuyCheckEnabled = value;
            return this;
        }

        public Builder bulkBuyThreshold(int value) {
            this.bulkBuyThreshold = value;
            return this;
        }

        public Builder timezoneAnnotationEnabled(boolean value) {
            this.timezoneAnnotationEnabled = value;
            return this;
        }

        public Builder reportZone(ZoneId value) {
            this.reportZone = value;
            return this;
        }

        public Builder webhookUrl(String value) {
            this.webhookUrl = value;
            return this;
        }

        public Builder reportFileName(String value) {
            this.reportFileName = value;
            return this;
        }

        public Builder droppedReportColumns(List<String> value) {
            this.droppedReportColumns = value == null ? List.of() : value;
            return this;
        }

        public PipelineConfig build() {
            return new PipelineConfig(this);
        }
    }
}
