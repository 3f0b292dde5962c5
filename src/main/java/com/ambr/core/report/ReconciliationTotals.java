package com.ambr.core.report;

import com.ambr.core.model.OrderBatch;
import com.ambr.core.model.ReconciliationResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Batch-wide reconciliation figures that do not show up in the partitions themselves.
 *
 * @param collapsedDuplicates rows dropped because their order id already appeared in the batch
 * @param suppressedOrders    orders dropped because a master workbook already lists them
 * @param degradedVendors     vendor prefixes reported without duplicate or new-SKU checks
 */
public record ReconciliationTotals(int collapsedDuplicates, int suppressedOrders, List<String> degradedVendors) {

    public ReconciliationTotals {
        degradedVendors = List.copyOf(degradedVendors);
    }

    public static ReconciliationTotals none() {
        return new ReconciliationTotals(0, 0, List.of());
    }

    public static ReconciliationTotals of(OrderBatch batch, List<ReconciliationResult> results) {
        int suppressed = 0;
        List<String> degraded = new ArrayList<>();
        for (ReconciliationResult result : results) {
            suppressed += result.suppressedCount();
            if (result.degraded()) {
                degraded.add(result.vendorPrefix());
            }
        }
        return new ReconciliationTotals(batch.collapsedDuplicates(), suppressed, degraded);
    }
}
