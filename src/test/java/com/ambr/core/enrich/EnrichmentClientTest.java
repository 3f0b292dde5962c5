package com.ambr.core.enrich;

import com.ambr.core.RunWarnings;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EnrichmentClientTest {

    private static final RetryPolicy NO_DELAY = new RetryPolicy(3, Duration.ZERO);

    @Test
    void emptyInputMakesNoCall() {
        RecordingTransport transport = new RecordingTransport();
        RunWarnings warnings = new RunWarnings();

        EnrichmentOutcome outcome = new EnrichmentClient(transport, 2, 2, NO_DELAY).fetch(List.of(), warnings);

        assertTrue(outcome.attributesBySku().isEmpty());
        assertEquals(0, outcome.batchCount());
        assertTrue(transport.calls.isEmpty());
        assertTrue(warnings.isEmpty());
    }

    @Test
    void batchesDistinctSkusAndStripsSkuKey() {
        RecordingTransport transport = new RecordingTransport();
        RunWarnings warnings = new RunWarnings();

        EnrichmentOutcome outcome = new EnrichmentClient(transport, 2, 1, NO_DELAY)
            .fetch(List.of("A-1", "B-1", "A-1", " ", "C-1"), warnings);

        assertEquals(2, outcome.batchCount());
        assertEquals(List.of(List.of("A-1", "B-1"), List.of("C-1")), transport.calls);
        assertEquals(Map.of("color", "red-A-1"), outcome.attributesFor("A-1"));
        assertEquals(List.of("color"), outcome.attributeColumns());
        assertTrue(warnings.isEmpty());
        assertFalse(outcome.isPartial());
    }

    @Test
    void attributesForUnrequestedSkusAreIgnored() {
        RecordingTransport transport = new RecordingTransport() {
            @Override
            EnrichmentResponse reply(List<String> skus) throws IOException {
                Map<String, Map<String, String>> data = new LinkedHashMap<>(super.reply(skus).data());
                data.put("ZZZ-9", Map.of("sku", "ZZZ-9", "color", "blue"));
                return EnrichmentResponse.ok(data);
            }
        };

        EnrichmentOutcome outcome = new EnrichmentClient(transport, 10, 1, NO_DELAY)
            .fetch(List.of("A-1"), new RunWarnings());

        assertEquals(List.of("A-1"), List.copyOf(outcome.attributesBySku().keySet()));
        assertNull(outcome.attributesFor("ZZZ-9"));
    }

    @Test
    void failedBatchDoesNotAffectOthers() {
        RecordingTransport transport = new RecordingTransport() {
            @Override
            EnrichmentResponse reply(List<String> skus) throws IOException {
                if (skus.contains("B-1")) {
                    throw new IOException("connection reset");
                }
                return super.reply(skus);
            }
        };
        RunWarnings warnings = new RunWarnings();

        EnrichmentOutcome outcome = new EnrichmentClient(transport, 1, 3, NO_DELAY)
            .fetch(List.of("A-1", "B-1", "C-1"), warnings);

        assertEquals(3, outcome.batchCount());
        assertEquals(List.of("A-1", "C-1"), List.copyOf(outcome.attributesBySku().keySet()));
        assertEquals(1, outcome.failedBatches().size());
        EnrichmentOutcome.FailedBatch failed = outcome.failedBatches().get(0);
        assertEquals(1, failed.index());
        assertEquals(List.of("B-1"), failed.skus());
        assertEquals("connection reset", failed.reason());
        assertEquals(1, warnings.size());
        assertTrue(warnings.asList().get(0).contains("1 of 3 batch(es) dropped"));
    }

    @Test
    void retriesAreBoundedByPolicy() {
        AtomicInteger attempts = new AtomicInteger();
        EnrichmentTransport transport = skus -> {
            attempts.incrementAndGet();
            throw new IOException("timeout");
        };

        EnrichmentOutcome outcome = new EnrichmentClient(transport, 5, 1, NO_DELAY)
            .fetch(List.of("A-1"), new RunWarnings());

        assertEquals(3, attempts.get());
        assertTrue(outcome.isPartial());
    }

    @Test
    void statusFalseIsRetriedUntilSuccess() {
        AtomicInteger attempts = new AtomicInteger();
        EnrichmentTransport transport = skus -> attempts.incrementAndGet() < 3
            ? EnrichmentResponse.failed()
            : EnrichmentResponse.ok(Map.of("A-1", Map.of("size", "L")));

        EnrichmentOutcome outcome = new EnrichmentClient(transport, 5, 1, NO_DELAY)
            .fetch(List.of("A-1"), new RunWarnings());

        assertEquals(3, attempts.get());
        assertEquals(Map.of("size", "L"), outcome.attributesFor("A-1"));
    }

    @Test
    void malformedReplyDropsBatchWithoutRetry() {
        AtomicInteger attempts = new AtomicInteger();
        EnrichmentTransport transport = skus -> {
            attempts.incrementAndGet();
            throw new MalformedEnrichmentResponseException("missing 'data'");
        };
        RunWarnings warnings = new RunWarnings();

        EnrichmentOutcome outcome = new EnrichmentClient(transport, 5, 1, NO_DELAY)
            .fetch(List.of("A-1", "B-1"), warnings);

        assertEquals(1, attempts.get());
        assertTrue(outcome.failedBatches().get(0).reason().startsWith("malformed response"));
        assertEquals(1, warnings.size());
    }

    @Test
    void retryPolicyCountsAttempts() {
        RetryPolicy policy = new RetryPolicy(2, Duration.ZERO);

        assertTrue(policy.shouldRetry(1));
        assertFalse(policy.shouldRetry(2));
        assertEquals(3, RetryPolicy.defaultPolicy().getMaxAttempts());
    }

    private static class RecordingTransport implements EnrichmentTransport {
        final List<List<String>> calls = Collections.synchronizedList(new ArrayList<>());

        @Override
        public EnrichmentResponse fetch(List<String> skus) throws IOException {
            calls.add(List.copyOf(skus));
            return reply(skus);
        }

        EnrichmentResponse reply(List<String> skus) throws IOException {
            Map<String, Map<String, String>> data = new ConcurrentHashMap<>();
            for (String sku : skus) {
                data.put(sku, Map.of("sku", sku, "color", "red-" + sku));
            }
            return EnrichmentResponse.ok(data);
        }
    }
}
