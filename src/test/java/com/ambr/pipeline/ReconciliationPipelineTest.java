package com.ambr.pipeline;

import com.ambr.config.PipelineConfig;
import com.ambr.core.MissingInputException;
import com.ambr.core.enrich.EnrichmentResponse;
import com.ambr.core.enrich.EnrichmentTransport;
import com.ambr.core.knowledge.ReferenceTable;
import com.ambr.core.model.LabelTypes;
import com.ambr.core.model.OrderRecord;
import com.ambr.core.model.PartitionKind;
import com.ambr.core.model.ReconciledOrder;
import com.ambr.core.report.Notifier;
import com.ambr.core.report.ReportSink;
import com.ambr.core.report.RunReport;
import com.ambr.core.report.RunSummary;
import com.ambr.core.vendor.VendorRegistry;
import com.ambr.integration.amazon.UnshippedOrderParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReconciliationPipelineTest {

    private static final ZoneId UTC = ZoneId.of("UTC");
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-09-27T08:00:00Z"), UTC);

    @TempDir
    Path tempDir;

    @Test
    void reconcilesSampleExportEndToEnd() throws IOException {
        CapturingSink sink = new CapturingSink();
        CapturingNotifier notifier = new CapturingNotifier();
        PipelineConfig config = baseConfig().build();

        RunReport report = new ReconciliationPipeline(config, new FakeSources(), sink, notifier, null, CLOCK).run();

        assertEquals(List.of(report), sink.reports);
        assertEquals(List.of("111-0000001-0000001", "111-0000002-0000002"), orderIds(report, PartitionKind.LABEL_VENDORS));
        assertTrue(orderIds(report, PartitionKind.NON_LABEL_VENDORS).isEmpty());
        assertEquals(List.of("111-0000004-0000004"), orderIds(report, PartitionKind.UNKNOWN));
        assertEquals(List.of("ACME-RET-1", "ZETA-INV-9"),
            report.removedRows().stream().map(OrderRecord::sku).toList());
        assertEquals(List.of("ACME-TSHIRT-L"),
            report.aggregation().newSkuOrders().stream().map(ReconciledOrder::sku).toList());
        assertEquals(Map.of("ACME", 2), report.aggregation().vendorOrderCounts());
        assertNull(report.bulkBuyOrders());
        assertTrue(report.warnings().isEmpty());
        assertEquals("2025-09-27T08:00Z[UTC]", report.generatedAt().toString());
        assertEquals(1, report.totals().collapsedDuplicates());
        assertEquals(1, report.totals().suppressedOrders());
        assertTrue(report.totals().degradedVendors().isEmpty());

        assertEquals(RunSummary.TITLE, notifier.title);
        assertTrue(notifier.summary.contains("**Total Orders:** 2"));
        assertTrue(notifier.summary.contains("**Removed Orders (RET/INV):** 2"));
        assertTrue(notifier.summary.contains("**Duplicate Rows Collapsed:** 1"));
        assertTrue(notifier.summary.contains("**Already Recorded Orders Skipped:** 1"));
    }

    @Test
    void optionalChecksEnrichAndFlagBulkBuys() throws IOException {
        CapturingSink sink = new CapturingSink();
        List<List<String>> requested = new ArrayList<>();
        EnrichmentTransport transport = skus -> {
            requested.add(List.copyOf(skus));
            return EnrichmentResponse.ok(Map.of("ACME-TSHIRT-L", Map.of("sku", "ACME-TSHIRT-L", "color", "navy")));
        };
        PipelineConfig config = baseConfig()
            .enrichmentEnabled(true)
            .enrichmentEndpoint(URI.create("http://localhost/enrich"))
            .enrichmentRetryDelay(Duration.ZERO)
            .bulkBuyCheckEnabled(true)
            .bulkBuyThreshold(5)
            .timezoneAnnotationEnabled(true)
            .build();

        RunReport report = new ReconciliationPipeline(config, new FakeSources(), sink, new CapturingNotifier(),
            transport, CLOCK).run();

        assertEquals(List.of(List.of("ACME-MUG-11W", "ACME-TSHIRT-L")), requested);
        assertEquals(List.of("color"), report.enrichmentColumns());
        List<ReconciledOrder> label = report.aggregation().partition(PartitionKind.LABEL_VENDORS).orders();
        assertNull(label.get(0).order().attribute("color"));
        assertEquals("navy", label.get(1).order().attribute("color"));
        assertEquals("2025-09-24 12:02:50 UTC", label.get(0).order().attribute("purchase-date-local"));
        assertEquals(List.of("111-0000002-0000002"),
            report.bulkBuyOrders().stream().map(ReconciledOrder::orderId).toList());
        assertEquals("navy", report.bulkBuyOrders().get(0).order().attribute("color"));
    }

    @Test
    void failingNotifierDoesNotFailTheRun() throws IOException {
        CapturingSink sink = new CapturingSink();
        Notifier failing = (title, summary) -> {
            throw new IOException("webhook down");
        };

        RunReport report = new ReconciliationPipeline(baseConfig().build(), new FakeSources(), sink, failing, null, CLOCK)
            .run();

        assertEquals(1, sink.reports.size());
        assertEquals(3, report.aggregation().size());
    }

    @Test
    void incompleteMasterDataIsReportedAsWarning() throws IOException {
        FakeSources sources = new FakeSources();
        sources.oldReference.put(LabelTypes.LABEL_VENDORS, ReferenceTable.unreadable(LabelTypes.LABEL_VENDORS, "corrupt"));

        RunReport report = new ReconciliationPipeline(baseConfig().build(), sources, new CapturingSink(),
            new CapturingNotifier(), null, CLOCK).run();

        assertTrue(report.warnings().stream().anyMatch(w -> w.contains("could not be read")));
        assertTrue(report.warnings().stream().anyMatch(w -> w.contains("incomplete master data")));
        assertEquals(2, report.aggregation().partition(PartitionKind.LABEL_VENDORS).size());
    }

    @Test
    void missingInputAbortsBeforeAnyOutput() {
        CapturingSink sink = new CapturingSink();
        CapturingNotifier notifier = new CapturingNotifier();
        FakeSources sources = new FakeSources() {
            @Override
            public List<OrderRecord> loadBatch() throws IOException {
                throw new MissingInputException("Upload", "No unshipped-orders export found in Upload");
            }
        };
        ReconciliationPipeline pipeline = new ReconciliationPipeline(baseConfig().build(), sources, sink, notifier, null, CLOCK);

        assertThrows(MissingInputException.class, pipeline::run);
        assertTrue(sink.reports.isEmpty());
        assertNull(notifier.title);
    }

    @Test
    void enrichmentRequiresTransport() {
        PipelineConfig config = baseConfig()
            .enrichmentEnabled(true)
            .enrichmentEndpoint(URI.create("http://localhost/enrich"))
            .build();

        assertThrows(IllegalArgumentException.class, () ->
            new ReconciliationPipeline(config, new FakeSources(), new CapturingSink(), new CapturingNotifier(), null, CLOCK));
    }

    private PipelineConfig.Builder baseConfig() {
        return PipelineConfig.builder()
            .uploadDirectory(tempDir.resolve("Upload"))
            .outputDirectory(tempDir.resolve("Output"))
            .oldMasterWorkbook(tempDir.resolve("old.xlsx"))
            .newMasterWorkbook(tempDir.resolve("new.xlsx"))
            .reconciliationWorkers(2)
            .reportZone(UTC);
    }

    private static List<String> orderIds(RunReport report, PartitionKind kind) {
        return report.aggregation().partition(kind).orders().stream().map(ReconciledOrder::orderId).toList();
    }

    static List<OrderRecord> sampleOrders() throws IOException {
        try (InputStream stream = Thread.currentThread().getContextClassLoader()
                .getResourceAsStream("unshipped/sample-unshipped-orders.txt");
             Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
            return new UnshippedOrderParser().parse(reader, "sample-unshipped-orders.txt");
        }
    }

    private static class FakeSources implements ReconciliationSources {
        final Map<String, ReferenceTable> oldReference = new LinkedHashMap<>();
        final Map<String, ReferenceTable> newReference = new LinkedHashMap<>();

        FakeSources() {
            oldReference.put(LabelTypes.LABEL_VENDORS, ReferenceTable.of(LabelTypes.LABEL_VENDORS,
                List.of("Order ID", "SKU"), List.of(List.of("111-9999999-0000000", "ACME-MUG-11W"))));
            newReference.put(LabelTypes.NON_LABEL_VENDORS, ReferenceTable.of(LabelTypes.NON_LABEL_VENDORS,
                List.of("order-id", "sku"), List.of(List.of("111-0000003-0000003", "ZETA-CAP"))));
            newReference.put(PipelineConfig.DEFAULT_REGISTRY_SHEET, ReferenceTable.of(PipelineConfig.DEFAULT_REGISTRY_SHEET,
                List.of("Prefix", "Label"), List.of(
                    List.of("ACME", LabelTypes.LABEL_VENDORS),
                    List.of("ZETA", LabelTypes.NON_LABEL_VENDORS))));
        }

        @Override
        public List<OrderRecord> loadBatch() throws IOException {
            return sampleOrders();
        }

        @Override
        public Map<String, ReferenceTable> loadOldReference() {
            return oldReference;
        }

        @Override
        public Map<String, ReferenceTable> loadNewReference() {
            return newReference;
        }

        @Override
        public VendorRegistry loadVendorRegistry() throws IOException {
            return VendorRegistry.fromTable(newReference.get(PipelineConfig.DEFAULT_REGISTRY_SHEET));
        }
    }

    private static class CapturingSink implements ReportSink {
        final List<RunReport> reports = new ArrayList<>();

        @Override
        public void emit(RunReport report) {
            reports.add(report);
        }
    }

    private static class CapturingNotifier implements Notifier {
        String title;
        String summary;

        @Override
        public void send(String title, String summary) {
            this.title = title;
            this.summary = summary;
        }
    }
}
