package com.ambr.core.reconcile;

import com.ambr.core.model.OrderBatch;
import com.ambr.core.model.OrderRecord;
import com.ambr.logging.AppLogger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Prepares a parsed export for reconciliation.
 * <ol>
 *     <li>Rows whose SKU contains the removed-row marker (returns, inventory adjustments) are split off.</li>
 *     <li>Remaining rows sharing an order id are collapsed to the first occurrence.</li>
 * </ol>
 * Marker rows are split off first so a return line never shadows a real order with the same id.
 */
public final class BatchCleaner {
    private static final Logger LOGGER = AppLogger.get();

    public static final String DEFAULT_REMOVED_ROW_PATTERN = "RET|INV";

    private final Pattern removedRowPattern;

    public BatchCleaner(Pattern removedRowPattern) {
        this.removedRowPattern = Objects.requireNonNull(removedRowPattern, "removedRowPattern");
    }

    public BatchCleaner() {
        this(Pattern.compile(DEFAULT_REMOVED_ROW_PATTERN));
    }

    public OrderBatch clean(List<OrderRecord> records) {
        if (records == null || records.isEmpty()) {
            return OrderBatch.empty();
        }

        List<OrderRecord> removed = new ArrayList<>();
        List<OrderRecord> kept = new ArrayList<>();
        Set<String> seenOrderIds = new HashSet<>();
        int duplicates = 0;

        for (OrderRecord record : records) {
            if (isRemovedRow(record)) {
                removed.add(record);
                continue;
            }
            if (!seenOrderIds.add(record.orderId())) {
                duplicates++;
                continue;
            }
            kept.add(record);
        }

        LOGGER.info("Removed %d row(s) matching '%s'; collapsed %d duplicate order row(s); %d order(s) remain."
            .formatted(removed.size(), removedRowPattern.pattern(), duplicates, kept.size()));
        return new OrderBatch(kept, removed, duplicates);
    }

    public boolean isRemovedRow(OrderRecord record) {
        return record != null && removedRowPattern.matcher(record.sku()).find();
    }
}
