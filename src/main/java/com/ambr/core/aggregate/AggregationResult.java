package com.ambr.core.aggregate;

import com.ambr.core.model.Partition;
import com.ambr.core.model.PartitionKind;
import com.ambr.core.model.ReconciledOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * The three partitions of a run plus the counts reported alongside them.
 */
public final class AggregationResult {
    private final Map<PartitionKind, Partition> partitions;
    private final Map<String, Integer> vendorOrderCounts;
    private final Map<String, Integer> skuOrderCounts;

    AggregationResult(Map<PartitionKind, Partition> partitions,
                      Map<String, Integer> vendorOrderCounts,
                      Map<String, Integer> skuOrderCounts) {
        EnumMap<PartitionKind, Partition> complete = new EnumMap<>(PartitionKind.class);
        for (PartitionKind kind : PartitionKind.values()) {
            complete.put(kind, partitions.getOrDefault(kind, Partition.empty(kind)));
        }
        this.partitions = Collections.unmodifiableMap(complete);
        this.vendorOrderCounts = Collections.unmodifiableMap(new LinkedHashMap<>(vendorOrderCounts));
        this.skuOrderCounts = Collections.unmodifiableMap(new LinkedHashMap<>(skuOrderCounts));
    }

    public Partition partition(PartitionKind kind) {
        return partitions.get(kind);
    }

    public Map<PartitionKind, Partition> partitions() {
        return partitions;
    }

    /**
     * Unique order count per vendor prefix over the label and non-label partitions.
     */
    public Map<String, Integer> vendorOrderCounts() {
        return vendorOrderCounts;
    }

    /**
     * Unique order count per SKU over the label and non-label partitions, highest count first.
     */
    public Map<String, Integer> skuOrderCounts() {
        return skuOrderCounts;
    }

    /**
     * Orders flagged as new SKUs, in partition order.
     */
    public List<ReconciledOrder> newSkuOrders() {
        List<ReconciledOrder> flagged = new ArrayList<>();
        for (Partition partition : partitions.values()) {
            for (ReconciledOrder order : partition.orders()) {
                if (order.newSku()) {
                    flagged.add(order);
                }
            }
        }
        return flagged;
    }

    /**
     * Distinct SKUs of the label and non-label partitions, in first-seen order.
     */
    public Set<String> knownVendorSkus() {
        Set<String> skus = new LinkedHashSet<>();
        for (Partition partition : partitions.values()) {
            if (!partition.kind().isKnownVendor()) {
                continue;
            }
            for (ReconciledOrder order : partition.orders()) {
                skus.add(order.sku());
            }
        }
        return skus;
    }

    public int labelVendorOrderCount() {
        return partition(PartitionKind.LABEL_VENDORS).uniqueOrderCount();
    }

    public int nonLabelVendorOrderCount() {
        return partition(PartitionKind.NON_LABEL_VENDORS).uniqueOrderCount();
    }

    /**
     * Unique order ids across the label and non-label partitions together.
     */
    public int totalOrderCount() {
        Set<String> ids = new LinkedHashSet<>(partition(PartitionKind.LABEL_VENDORS).orderIds());
        ids.addAll(partition(PartitionKind.NON_LABEL_VENDORS).orderIds());
        return ids.size();
    }

    public int size() {
        return partitions.values().stream().mapToInt(Partition::size).sum();
    }

    /**
     * Applies {@code mapper} to every row of every partition; counts are unchanged.
     */
    public AggregationResult mapOrders(UnaryOperator<ReconciledOrder> mapper) {
        Map<PartitionKind, Partition> mapped = new EnumMap<>(PartitionKind.class);
        partitions.forEach((kind, partition) -> mapped.put(kind, partition.map(mapper)));
        return new AggregationResult(mapped, vendorOrderCounts, skuOrderCounts);
    }
}
