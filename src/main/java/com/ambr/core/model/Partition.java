package com.ambr.core.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Ordered union of the vendor results that share a reporting bucket.
 */
public final class Partition {
    private final PartitionKind kind;
    private final List<ReconciledOrder> orders;

    public Partition(PartitionKind kind, List<ReconciledOrder> orders) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.orders = List.copyOf(orders);
    }

    public static Partition empty(PartitionKind kind) {
        return new Partition(kind, List.of());
    }

    public PartitionKind kind() {
        return kind;
    }

    public List<ReconciledOrder> orders() {
        return orders;
    }

    public int size() {
        return orders.size();
    }

    public boolean isEmpty() {
        return orders.isEmpty();
    }

    public Set<String> orderIds() {
        return orders.stream()
            .map(ReconciledOrder::orderId)
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public int uniqueOrderCount() {
        return orderIds().size();
    }

    public Partition map(UnaryOperator<ReconciledOrder> mapper) {
        return new Partition(kind, orders.stream().map(mapper).collect(Collectors.toList()));
    }
}
