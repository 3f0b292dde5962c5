package com.ambr.core.aggregate;

import com.ambr.core.model.Partition;
import com.ambr.core.model.ReconciledOrder;
import com.ambr.logging.AppLogger;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Lists reconciled label and non-label orders whose purchased quantity reaches the threshold.
 */
public final class BulkBuyDetector {
    private static final Logger LOGGER = AppLogger.get();

    public static final String QUANTITY_COLUMN = "quantity-purchased";

    private final int threshold;

    public BulkBuyDetector(int threshold) {
        if (threshold < 1) {
            throw new IllegalArgumentException("Bulk-buy threshold must be at least 1: " + threshold);
        }
        this.threshold = threshold;
    }

    public List<ReconciledOrder> detect(AggregationResult aggregation) {
        List<ReconciledOrder> bulk = new ArrayList<>();
        for (Partition partition : aggregation.partitions().values()) {
            if (!partition.kind().isKnownVendor()) {
                continue;
            }
            for (ReconciledOrder order : partition.orders()) {
                if (quantityOf(order) >= threshold) {
                    bulk.add(order);
                }
            }
        }
        LOGGER.info("Bulk-buy check: %d order(s) with quantity >= %d.".formatted(bulk.size(), threshold));
        return bulk;
    }

    private static int quantityOf(ReconciledOrder order) {
        String raw = order.order().attribute(QUANTITY_COLUMN);
        if (raw == null || raw.isBlank()) {
            return 0;
        }
        try {
            return Integer.parseInt(raw.strip());
        } catch (NumberFormatException ex) {
            LOGGER.fine(() -> "Unable to parse quantity for order " + order.orderId() + ": " + raw);
            return 0;
        }
    }
}
