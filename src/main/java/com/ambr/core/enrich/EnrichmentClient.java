package com.ambr.core.enrich;

import com.ambr.core.RunWarnings;
import com.ambr.logging.AppLogger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * Fetches enrichment attributes for a set of SKUs in fixed-size batches.
 * <p>
 * Batches run concurrently up to {@code concurrency}. Transport failures and {@code status == false}
 * replies are retried per {@link RetryPolicy}; malformed replies drop the batch at once. A dropped
 * batch never affects the others: its SKUs simply have no attributes in the outcome.
 */
public class EnrichmentClient {
    private static final Logger LOGGER = AppLogger.get();

    public static final int DEFAULT_BATCH_SIZE = 50;
    static final String SKU_KEY = "sku";

    private final EnrichmentTransport transport;
    private final int batchSize;
    private final int concurrency;
    private final RetryPolicy retryPolicy;

    public EnrichmentClient(EnrichmentTransport transport, int batchSize, int concurrency, RetryPolicy retryPolicy) {
        this.transport = Objects.requireNonNull(transport, "transport");
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1: " + batchSize);
        }
        this.batchSize = batchSize;
        this.concurrency = Math.max(1, concurrency);
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    }

    public EnrichmentOutcome fetch(Collection<String> skus, RunWarnings warnings) {
        Objects.requireNonNull(warnings, "warnings");
        List<List<String>> batches = partition(skus);
        if (batches.isEmpty()) {
            LOGGER.info("No SKUs to enrich.");
            return EnrichmentOutcome.empty();
        }

        int poolSize = Math.min(concurrency, batches.size());
        LOGGER.info("Enriching SKUs in %d batch(es) of up to %d, %d at a time..."
            .formatted(batches.size(), batchSize, poolSize));

        AtomicInteger threadCounter = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(poolSize, task -> {
            Thread thread = new Thread(task, "enrichment-batch-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });

        Map<String, Map<String, String>> attributes = new LinkedHashMap<>();
        List<EnrichmentOutcome.FailedBatch> failures = new ArrayList<>();
        try {
            List<Future<BatchResult>> futures = new ArrayList<>(batches.size());
            for (int i = 0; i < batches.size(); i++) {
                int index = i;
                List<String> batch = batches.get(i);
                futures.add(executor.submit(() -> runBatch(index, batch)));
            }
            for (int i = 0; i < futures.size(); i++) {
                BatchResult result = await(i, batches.get(i), futures.get(i));
                if (result.failure() != null) {
                    failures.add(result.failure());
                } else {
                    attributes.putAll(result.attributes());
                }
            }
        } finally {
            executor.shutdownNow();
        }

        if (!failures.isEmpty()) {
            int missing = failures.stream().mapToInt(failure -> failure.skus().size()).sum();
            warnings.add("Enrichment incomplete: %d of %d batch(es) dropped; %d SKU(s) have no enrichment attributes."
                .formatted(failures.size(), batches.size(), missing));
        }
        LOGGER.info("Enrichment finished: attributes for %d SKU(s).".formatted(attributes.size()));
        return new EnrichmentOutcome(attributes, failures, batches.size());
    }

    private List<List<String>> partition(Collection<String> skus) {
        List<List<String>> batches = new ArrayList<>();
        if (skus == null || skus.isEmpty()) {
            return batches;
        }
        Set<String> distinct = new LinkedHashSet<>();
        for (String sku : skus) {
            if (sku != null && !sku.isBlank()) {
                distinct.add(sku);
            }
        }
        List<String> current = new ArrayList<>(batchSize);
        for (String sku : distinct) {
            current.add(sku);
            if (current.size() == batchSize) {
                batches.add(List.copyOf(current));
                current.clear();
            }
        }
        if (!current.isEmpty()) {
            batches.add(List.copyOf(current));
        }
        return batches;
    }

    private BatchResult runBatch(int index, List<String> batch) throws InterruptedException {
        String lastError = "no attempt made";
        for (int attempt = 1; ; attempt++) {
            try {
                EnrichmentResponse response = transport.fetch(batch);
                if (response == null) {
                    throw new MalformedEnrichmentResponseException("empty reply");
                }
                if (response.status()) {
                    return BatchResult.success(select(batch, response));
                }
                lastError = "service reported status=false";
            } catch (MalformedEnrichmentResponseException ex) {
                LOGGER.warning("Enrichment batch %d returned an unexpected response: %s".formatted(index, ex.getMessage()));
                return BatchResult.failed(index, batch, "malformed response: " + ex.getMessage());
            } catch (IOException ex) {
                lastError = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
            }

            if (!retryPolicy.shouldRetry(attempt)) {
                LOGGER.warning("Enrichment batch %d dropped after %d attempt(s): %s".formatted(index, attempt, lastError));
                return BatchResult.failed(index, batch, lastError);
            }
            int failedAttempt = attempt;
            String error = lastError;
            LOGGER.fine(() -> "Enrichment batch %d attempt %d failed (%s); retrying.".formatted(index, failedAttempt, error));
            retryPolicy.pause();
        }
    }

    private static Map<String, Map<String, String>> select(List<String> batch, EnrichmentResponse response)
        throws MalformedEnrichmentResponseException {
        Map<String, Map<String, String>> data = response.data();
        if (data == null) {
            throw new MalformedEnrichmentResponseException("reply has no '" + SKU_KEY + "'-keyed data");
        }
        Map<String, Map<String, String>> selected = new LinkedHashMap<>();
        for (String sku : batch) {
            Map<String, String> bag = data.get(sku);
            if (bag == null) {
                continue;
            }
            Map<String, String> copy = new LinkedHashMap<>(bag);
            copy.remove(SKU_KEY);
            selected.put(sku, copy);
        }
        return selected;
    }

    private static BatchResult await(int index, List<String> batch, Future<BatchResult> future) {
        try {
            return future.get();
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            LOGGER.warning("Enrichment batch %d failed: %s".formatted(index, cause.getMessage()));
            return BatchResult.failed(index, batch, String.valueOf(cause.getMessage()));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for enrichment batch " + index, ex);
        }
    }

    private record BatchResult(Map<String, Map<String, String>> attributes, EnrichmentOutcome.FailedBatch failure) {

        static BatchResult success(Map<String, Map<String, String>> attributes) {
            return new BatchResult(attributes, null);
        }

        static BatchResult failed(int index, List<String> batch, String reason) {
            return new BatchResult(Map.of(), new EnrichmentOutcome.FailedBatch(index, batch, reason));
        }
    }
}
