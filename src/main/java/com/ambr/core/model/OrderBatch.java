package com.ambr.core.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cleaned batch ready for reconciliation: removed rows are split off and intra-batch
 * duplicates collapsed.
 */
public final class OrderBatch {
    private final List<OrderRecord> orders;
    private final List<OrderRecord> removedRows;
    private final int collapsedDuplicates;

    public OrderBatch(List<OrderRecord> orders, List<OrderRecord> removedRows, int collapsedDuplicates) {
        this.orders = List.copyOf(orders);
        this.removedRows = List.copyOf(removedRows);
        this.collapsedDuplicates = collapsedDuplicates;
    }

    public static OrderBatch empty() {
        return new OrderBatch(List.of(), List.of(), 0);
    }

    public List<OrderRecord> orders() {
        return orders;
    }

    public List<OrderRecord> removedRows() {
        return removedRows;
    }

    public int collapsedDuplicates() {
        return collapsedDuplicates;
    }

    public boolean isEmpty() {
        return orders.isEmpty();
    }

    /**
     * Orders grouped by vendor prefix, prefixes in first-seen order and orders in batch order.
     */
    public Map<String, List<OrderRecord>> ordersByVendor() {
        Map<String, List<OrderRecord>> grouped = new LinkedHashMap<>();
        for (OrderRecord order : orders) {
            grouped.computeIfAbsent(order.vendorPrefix(), key -> new ArrayList<>()).add(order);
        }
        return grouped;
    }

    public OrderBatch withOrders(List<OrderRecord> replacement) {
        return new OrderBatch(replacement, removedRows, collapsedDuplicates);
    }
}
