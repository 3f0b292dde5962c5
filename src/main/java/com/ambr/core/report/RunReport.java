package com.ambr.core.report;

import com.ambr.core.aggregate.AggregationResult;
import com.ambr.core.model.OrderRecord;
import com.ambr.core.model.ReconciledOrder;

import java.time.ZonedDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Everything a report sink and the notifier need from a finished run.
 *
 * @param generatedAt      run timestamp, in the reporting zone
 * @param aggregation      partitions and counts, with enrichment columns merged in when enabled
 * @param removedRows      rows excluded as returns or inventory adjustments
 * @param bulkBuyOrders    bulk-buy orders, or {@code null} when the check is disabled
 * @param enrichmentColumns attribute columns appended by enrichment, empty when none
 * @param warnings         degraded-path warnings raised during the run
 * @param totals           duplicate, suppression and degraded-vendor figures
 */
public record RunReport(ZonedDateTime generatedAt,
                        AggregationResult aggregation,
                        List<OrderRecord> removedRows,
                        List<ReconciledOrder> bulkBuyOrders,
                        List<String> enrichmentColumns,
                        List<String> warnings,
                        ReconciliationTotals totals) {

    public RunReport {
        Objects.requireNonNull(generatedAt, "generatedAt");
        Objects.requireNonNull(aggregation, "aggregation");
        removedRows = List.copyOf(removedRows);
        bulkBuyOrders = bulkBuyOrders == null ? null : List.copyOf(bulkBuyOrders);
        enrichmentColumns = List.copyOf(enrichmentColumns);
        warnings = List.copyOf(warnings);
        totals = totals == null ? ReconciliationTotals.none() : totals;
    }

    public boolean bulkBuyCheckEnabled() {
        return bulkBuyOrders != null;
    }
}
