package com.ambr.core.enrich;

import com.ambr.core.aggregate.AggregationResult;
import com.ambr.core.model.Partition;
import com.ambr.core.model.ReconciledOrder;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Left-joins enrichment attributes onto every partition row by SKU. Rows are never dropped;
 * a SKU without fetched attributes gets {@code null} in every appended column.
 * <p>
 * Export columns are never overwritten: an attribute whose name is already an export column is
 * appended as {@code enrichment.<name>}.
 */
public final class AttributeMerger {
    public static final String COLLISION_PREFIX = "enrichment.";

    public Merge merge(AggregationResult aggregation, EnrichmentOutcome outcome) {
        List<String> attributes = outcome.attributeColumns();
        if (attributes.isEmpty()) {
            return new Merge(aggregation, List.of());
        }
        Map<String, String> targets = targetColumns(attributes, exportColumns(aggregation));
        AggregationResult merged = aggregation.mapOrders(
            row -> row.withOrder(row.order().withAttributes(joined(row, targets, outcome))));
        return new Merge(merged, List.copyOf(targets.values()));
    }

    private static Set<String> exportColumns(AggregationResult aggregation) {
        Set<String> columns = new HashSet<>();
        for (Partition partition : aggregation.partitions().values()) {
            for (ReconciledOrder row : partition.orders()) {
                columns.addAll(row.order().attributes().keySet());
            }
        }
        return columns;
    }

    private static Map<String, String> targetColumns(List<String> attributes, Set<String> exportColumns) {
        Map<String, String> targets = new LinkedHashMap<>();
        for (String attribute : attributes) {
            targets.put(attribute, exportColumns.contains(attribute) ? COLLISION_PREFIX + attribute : attribute);
        }
        return targets;
    }

    private static Map<String, String> joined(ReconciledOrder row, Map<String, String> targets, EnrichmentOutcome outcome) {
        Map<String, String> fetched = outcome.attributesFor(row.sku());
        Map<String, String> values = new LinkedHashMap<>();
        targets.forEach((attribute, column) -> values.put(column, fetched == null ? null : fetched.get(attribute)));
        return values;
    }

    /**
     * @param aggregation partitions with the enrichment columns appended
     * @param columns     names of the appended columns, in attribute order
     */
    public record Merge(AggregationResult aggregation, List<String> columns) {
        public Merge {
            columns = List.copyOf(columns);
        }
    }
}
