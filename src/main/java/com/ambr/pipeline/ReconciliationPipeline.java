package com.ambr.pipeline;

import com.ambr.config.PipelineConfig;
import com.ambr.core.RunWarnings;
import com.ambr.core.aggregate.AggregationResult;
import com.ambr.core.aggregate.Aggregator;
import com.ambr.core.aggregate.BulkBuyDetector;
import com.ambr.core.enrich.AttributeMerger;
import com.ambr.core.enrich.EnrichmentClient;
import com.ambr.core.enrich.EnrichmentOutcome;
import com.ambr.core.enrich.EnrichmentTransport;
import com.ambr.core.enrich.RetryPolicy;
import com.ambr.core.knowledge.KnowledgeBase;
import com.ambr.core.knowledge.KnowledgeBaseLoader;
import com.ambr.core.knowledge.ReferenceTable;
import com.ambr.core.model.OrderBatch;
import com.ambr.core.model.OrderRecord;
import com.ambr.core.model.ReconciledOrder;
import com.ambr.core.model.ReconciliationResult;
import com.ambr.core.reconcile.BatchCleaner;
import com.ambr.core.reconcile.ReconciliationEngine;
import com.ambr.core.reconcile.VendorReconciler;
import com.ambr.core.report.Notifier;
import com.ambr.core.report.ReconciliationTotals;
import com.ambr.core.report.ReportSink;
import com.ambr.core.report.RunReport;
import com.ambr.core.report.RunSummary;
import com.ambr.core.report.TimezoneAnnotator;
import com.ambr.core.vendor.VendorClassifier;
import com.ambr.core.vendor.VendorRegistry;
import com.ambr.integration.enrichment.HttpEnrichmentTransport;
import com.ambr.integration.notify.LoggingNotifier;
import com.ambr.integration.notify.WebhookNotifier;
import com.ambr.integration.sheets.ReportWorkbookWriter;
import com.ambr.logging.AppLogger;

import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One end-to-end run: load inputs, clean the batch, reconcile every vendor, aggregate, optionally
 * enrich, write the report and post the summary.
 * <p>
 * Setup failures surface as {@link IOException}s before any output is written. Everything after
 * that degrades into run warnings instead of aborting.
 */
public class ReconciliationPipeline {
    private static final Logger LOGGER = AppLogger.get();

    private final PipelineConfig config;
    private final ReconciliationSources sources;
    private final ReportSink sink;
    private final Notifier notifier;
    private final EnrichmentTransport enrichmentTransport;
    private final Clock clock;

    public ReconciliationPipeline(PipelineConfig config,
                                  ReconciliationSources sources,
                                  ReportSink sink,
                                  Notifier notifier,
                                  EnrichmentTransport enrichmentTransport,
                                  Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.sources = Objects.requireNonNull(sources, "sources");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.notifier = Objects.requireNonNull(notifier, "notifier");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (config.enrichmentEnabled() && enrichmentTransport == null) {
            throw new IllegalArgumentException("Enrichment is enabled but no enrichment transport was supplied.");
        }
        this.enrichmentTransport = enrichmentTransport;
    }

    /**
     * Wires the file-based sources, the workbook report and the configured notifier and enrichment service.
     */
    public static ReconciliationPipeline fromConfig(PipelineConfig config) {
        Notifier notifier = config.webhookUrl() == null
            ? new LoggingNotifier()
            : new WebhookNotifier(URI.create(config.webhookUrl()));
        EnrichmentTransport transport = config.enrichmentEnabled()
            ? new HttpEnrichmentTransport(config.enrichmentEndpoint(), config.enrichmentTimeout())
            : null;
        return new ReconciliationPipeline(
            config,
            new WorkbookSources(config),
            new ReportWorkbookWriter(config.reportFile(), config.droppedReportColumns()),
            notifier,
            transport,
            Clock.system(config.reportZone()));
    }

    public RunReport run() throws IOException {
        LOGGER.info("Starting the unshipped orders process...");
        RunWarnings warnings = new RunWarnings();

        Map<String, ReferenceTable> oldReference = sources.loadOldReference();
        Map<String, ReferenceTable> newReference = sources.loadNewReference();
        VendorRegistry registry = sources.loadVendorRegistry();
        List<OrderRecord> rows = sources.loadBatch();

        OrderBatch batch = new BatchCleaner(config.removedRowPattern()).clean(rows);
        if (config.timezoneAnnotationEnabled()) {
            batch = batch.withOrders(new TimezoneAnnotator(config.reportZone()).annotate(batch.orders()));
        }

        KnowledgeBase knowledgeBase = new KnowledgeBaseLoader(Set.of(config.registrySheetName()))
            .load(oldReference, newReference, warnings);
        VendorReconciler reconciler = new VendorReconciler(knowledgeBase, new VendorClassifier(registry));
        List<ReconciliationResult> results = new ReconciliationEngine(reconciler, config.reconciliationWorkers())
            .reconcile(batch, warnings);
        warnAboutDegradedLabelTypes(knowledgeBase, results, warnings);

        AggregationResult aggregation = new Aggregator().aggregate(results);
        List<String> enrichmentColumns = List.of();
        if (config.enrichmentEnabled()) {
            EnrichmentOutcome outcome = newEnrichmentClient().fetch(aggregation.knownVendorSkus(), warnings);
            LOGGER.info("Enrichment returned attributes for %d SKU(s) in %d batch(es)%s."
                .formatted(outcome.attributesBySku().size(), outcome.batchCount(),
                    outcome.isPartial() ? ", " + outcome.failedBatches().size() + " dropped" : ""));
            AttributeMerger.Merge merge = new AttributeMerger().merge(aggregation, outcome);
            aggregation = merge.aggregation();
            enrichmentColumns = merge.columns();
        }

        List<ReconciledOrder> bulkBuyOrders = config.bulkBuyCheckEnabled()
            ? new BulkBuyDetector(config.bulkBuyThreshold()).detect(aggregation)
            : null;

        RunReport report = new RunReport(
            ZonedDateTime.now(clock).withZoneSameInstant(config.reportZone()),
            aggregation,
            batch.removedRows(),
            bulkBuyOrders,
            enrichmentColumns,
            warnings.asList(),
            ReconciliationTotals.of(batch, results));

        sink.emit(report);
        notifySummary(report);
        LOGGER.info("Processing complete. All reports have been saved.");
        return report;
    }

    private EnrichmentClient newEnrichmentClient() {
        return new EnrichmentClient(
            enrichmentTransport,
            config.enrichmentBatchSize(),
            config.enrichmentConcurrency(),
            new RetryPolicy(config.enrichmentMaxAttempts(), config.enrichmentRetryDelay()));
    }

    private static void warnAboutDegradedLabelTypes(KnowledgeBase knowledgeBase,
                                                    List<ReconciliationResult> results,
                                                    RunWarnings warnings) {
        Set<String> affected = new LinkedHashSet<>();
        for (ReconciliationResult result : results) {
            if (!result.isEmpty() && knowledgeBase.isDegraded(result.labelType())) {
                affected.add(result.labelType());
            }
        }
        for (String labelType : affected) {
            warnings.add("Orders of '%s' were checked against incomplete master data; some may be duplicates."
                .formatted(labelType));
        }
    }

    private void notifySummary(RunReport report) {
        String summary = new RunSummary(config.timezoneAnnotationEnabled()).render(report);
        try {
            notifier.send(RunSummary.TITLE, summary);
        } catch (IOException | RuntimeException ex) {
            LOGGER.log(Level.WARNING, "Failed to send run summary: " + ex.getMessage(), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warning("Interrupted while sending run summary.");
        }
    }
}
