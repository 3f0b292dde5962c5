package com.ambr.core.model;

import java.util.List;

/**
 * Outcome of reconciling one vendor prefix.
 *
 * @param vendorPrefix    SKU prefix the orders were selected by
 * @param labelType       label type resolved for the prefix
 * @param orders          retained orders, in batch order
 * @param suppressedCount orders dropped because a master sheet already knows them
 * @param degraded        true when the vendor was reconciled without reference data after a failure
 */
public record ReconciliationResult(String vendorPrefix,
                                   String labelType,
                                   List<ReconciledOrder> orders,
                                   int suppressedCount,
                                   boolean degraded) {

    public ReconciliationResult {
        vendorPrefix = vendorPrefix == null ? "" : vendorPrefix;
        labelType = labelType == null ? LabelTypes.UNKNOWN : labelType;
        orders = List.copyOf(orders);
    }

    public static ReconciliationResult empty(String vendorPrefix) {
        return new ReconciliationResult(vendorPrefix, LabelTypes.UNKNOWN, List.of(), 0, false);
    }

    public PartitionKind partitionKind() {
        return PartitionKind.forLabelType(labelType);
    }

    public boolean isEmpty() {
        return orders.isEmpty();
    }
}
