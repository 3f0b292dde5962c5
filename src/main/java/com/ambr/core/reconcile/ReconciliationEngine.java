package com.ambr.core.reconcile;

import com.ambr.core.RunWarnings;
import com.ambr.core.model.OrderBatch;
import com.ambr.core.model.OrderRecord;
import com.ambr.core.model.ReconciliationResult;
import com.ambr.logging.AppLogger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * Fans the batch out per vendor prefix onto a fixed worker pool and fans the results back in,
 * in first-seen vendor order. A vendor whose reconciliation throws is replaced by a degraded
 * result; the remaining vendors are unaffected.
 */
public final class ReconciliationEngine {
    private static final Logger LOGGER = AppLogger.get();

    private final VendorReconciler reconciler;
    private final int workers;

    public ReconciliationEngine(VendorReconciler reconciler, int workers) {
        this.reconciler = Objects.requireNonNull(reconciler, "reconciler");
        this.workers = Math.max(1, workers);
    }

    public List<ReconciliationResult> reconcile(OrderBatch batch, RunWarnings warnings) {
        Objects.requireNonNull(warnings, "warnings");
        if (batch == null || batch.isEmpty()) {
            LOGGER.info("Batch is empty; nothing to reconcile.");
            return List.of();
        }

        Map<String, List<OrderRecord>> byVendor = batch.ordersByVendor();
        int poolSize = Math.min(workers, byVendor.size());
        LOGGER.info("Reconciling %d vendor(s) on %d worker(s)...".formatted(byVendor.size(), poolSize));

        ExecutorService executor = Executors.newFixedThreadPool(poolSize, new WorkerThreadFactory());
        try {
            Map<String, Future<ReconciliationResult>> futures = new LinkedHashMap<>();
            byVendor.forEach((vendor, orders) ->
                futures.put(vendor, executor.submit(() -> reconciler.reconcile(vendor, orders))));

            List<ReconciliationResult> results = new ArrayList<>(futures.size());
            for (Map.Entry<String, Future<ReconciliationResult>> entry : futures.entrySet()) {
                String vendor = entry.getKey();
                results.add(awaitResult(vendor, entry.getValue(), byVendor.get(vendor), warnings));
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    private ReconciliationResult awaitResult(String vendor,
                                             Future<ReconciliationResult> future,
                                             List<OrderRecord> orders,
                                             RunWarnings warnings) {
        try {
            return future.get();
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            warnings.add("Vendor %s could not be reconciled (%s); its %d order(s) are reported without duplicate or new-SKU checks."
                .formatted(vendor, describe(cause), orders.size()));
            return reconciler.degraded(vendor, orders);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while reconciling vendor " + vendor, ex);
        }
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank()
            ? error.getClass().getSimpleName()
            : error.getClass().getSimpleName() + ": " + message;
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "vendor-reconciler-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
