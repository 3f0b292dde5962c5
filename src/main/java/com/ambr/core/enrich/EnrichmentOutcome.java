package com.ambr.core.enrich;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Attributes fetched for a run, plus the batches that had to be dropped.
 */
public final class EnrichmentOutcome {
    private final Map<String, Map<String, String>> attributesBySku;
    private final List<FailedBatch> failedBatches;
    private final int batchCount;

    public EnrichmentOutcome(Map<String, Map<String, String>> attributesBySku,
                             List<FailedBatch> failedBatches,
                             int batchCount) {
        this.attributesBySku = Collections.unmodifiableMap(new LinkedHashMap<>(attributesBySku));
        this.failedBatches = List.copyOf(failedBatches);
        this.batchCount = batchCount;
    }

    public static EnrichmentOutcome empty() {
        return new EnrichmentOutcome(Map.of(), List.of(), 0);
    }

    public Map<String, Map<String, String>> attributesBySku() {
        return attributesBySku;
    }

    public Map<String, String> attributesFor(String sku) {
        return attributesBySku.get(sku);
    }

    public List<FailedBatch> failedBatches() {
        return failedBatches;
    }

    public int batchCount() {
        return batchCount;
    }

    public boolean isPartial() {
        return !failedBatches.isEmpty();
    }

    /**
     * Attribute names across all fetched bags, first-seen order.
     */
    public List<String> attributeColumns() {
        Set<String> columns = new LinkedHashSet<>();
        attributesBySku.values().forEach(bag -> columns.addAll(bag.keySet()));
        return List.copyOf(columns);
    }

    /**
     * @param index  zero-based batch number
     * @param skus   SKUs the batch asked for
     * @param reason last failure seen for the batch
     */
    public record FailedBatch(int index, List<String> skus, String reason) {
        public FailedBatch {
            skus = List.copyOf(skus);
        }
    }
}
