package com.ambr.core.aggregate;

import com.ambr.core.model.Partition;
import com.ambr.core.model.PartitionKind;
import com.ambr.core.model.ReconciledOrder;
import com.ambr.core.model.ReconciliationResult;
import com.ambr.logging.AppLogger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Merges per-vendor results into the label, non-label and unknown partitions and computes the
 * vendor and SKU order counts.
 */
public final class Aggregator {
    private static final Logger LOGGER = AppLogger.get();

    public AggregationResult aggregate(List<ReconciliationResult> results) {
        Map<PartitionKind, List<ReconciledOrder>> rows = new EnumMap<>(PartitionKind.class);
        for (PartitionKind kind : PartitionKind.values()) {
            rows.put(kind, new ArrayList<>());
        }
        Map<String, Set<String>> vendorOrders = new LinkedHashMap<>();
        Map<String, Set<String>> skuOrders = new LinkedHashMap<>();

        if (results != null) {
            for (ReconciliationResult result : results) {
                if (result == null || result.isEmpty()) {
                    continue;
                }
                PartitionKind kind = result.partitionKind();
                rows.get(kind).addAll(result.orders());
                if (!kind.isKnownVendor()) {
                    continue;
                }
                for (ReconciledOrder order : result.orders()) {
                    vendorOrders.computeIfAbsent(order.vendorPrefix(), key -> new LinkedHashSet<>()).add(order.orderId());
                    skuOrders.computeIfAbsent(order.sku(), key -> new LinkedHashSet<>()).add(order.orderId());
                }
            }
        }

        Map<PartitionKind, Partition> partitions = new EnumMap<>(PartitionKind.class);
        rows.forEach((kind, orders) -> partitions.put(kind, new Partition(kind, orders)));

        AggregationResult aggregation = new AggregationResult(partitions, toCounts(vendorOrders), sortByCount(skuOrders));
        LOGGER.info("Aggregated orders: %d label, %d non-label, %d unknown, %d new SKU order(s)."
            .formatted(
                aggregation.partition(PartitionKind.LABEL_VENDORS).size(),
                aggregation.partition(PartitionKind.NON_LABEL_VENDORS).size(),
                aggregation.partition(PartitionKind.UNKNOWN).size(),
                aggregation.newSkuOrders().size()));
        return aggregation;
    }

    private static Map<String, Integer> toCounts(Map<String, Set<String>> grouped) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        grouped.forEach((key, ids) -> counts.put(key, ids.size()));
        return counts;
    }

    private static Map<String, Integer> sortByCount(Map<String, Set<String>> grouped) {
        List<Map.Entry<String, Integer>> entries = new ArrayList<>(toCounts(grouped).entrySet());
        entries.sort(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
            .thenComparing(Map.Entry.comparingByKey()));
        Map<String, Integer> sorted = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> entry : entries) {
            sorted.put(entry.getKey(), entry.getValue());
        }
        return sorted;
    }
}
