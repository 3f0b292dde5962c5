package com.ambr.core.report;

import java.time.format.DateTimeFormatter;

/**
 * Renders the operator summary sent through the {@link Notifier}.
 */
public final class RunSummary {
    public static final String TITLE = "Unshipped Orders Summary";

    private static final DateTimeFormatter PLAIN = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final DateTimeFormatter ZONED = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");

    private final boolean showZone;

    public RunSummary(boolean showZone) {
        this.showZone = showZone;
    }

    public String render(RunReport report) {
        StringBuilder builder = new StringBuilder();
        builder.append("**Timestamp:** ").append(report.generatedAt().format(showZone ? ZONED : PLAIN)).append('\n');
        builder.append("**Total Label Vendors Orders:** ").append(report.aggregation().labelVendorOrderCount()).append('\n');
        builder.append("**Total Non-Label Vendors Orders:** ").append(report.aggregation().nonLabelVendorOrderCount()).append('\n');
        builder.append("**Total Orders:** ").append(report.aggregation().totalOrderCount()).append('\n');
        builder.append("**New SKUs Found:** ").append(report.aggregation().newSkuOrders().size()).append('\n');
        builder.append("**Removed Orders (RET/INV):** ").append(report.removedRows().size());
        ReconciliationTotals totals = report.totals();
        if (totals.collapsedDuplicates() > 0) {
            builder.append('\n').append("**Duplicate Rows Collapsed:** ").append(totals.collapsedDuplicates());
        }
        if (totals.suppressedOrders() > 0) {
            builder.append('\n').append("**Already Recorded Orders Skipped:** ").append(totals.suppressedOrders());
        }
        if (!totals.degradedVendors().isEmpty()) {
            builder.append('\n').append("**Vendors Reported Unchecked:** ").append(String.join(", ", totals.degradedVendors()));
        }
        if (report.bulkBuyCheckEnabled()) {
            builder.append('\n').append("**Bulk-Buy Orders:** ").append(report.bulkBuyOrders().size());
        }
        for (String warning : report.warnings()) {
            builder.append('\n').append("**Warning:** ").append(warning);
        }
        return builder.toString();
    }
}
