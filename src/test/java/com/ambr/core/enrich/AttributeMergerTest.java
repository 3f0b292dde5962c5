package com.ambr.core.enrich;

import com.ambr.core.aggregate.AggregationResult;
import com.ambr.core.aggregate.Aggregator;
import com.ambr.core.model.LabelTypes;
import com.ambr.core.model.OrderRecord;
import com.ambr.core.model.PartitionKind;
import com.ambr.core.model.ReconciledOrder;
import com.ambr.core.model.ReconciliationResult;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AttributeMergerTest {

    private final AttributeMerger merger = new AttributeMerger();

    @Test
    void leftJoinKeepsEveryRowAndFillsMissingWithNull() {
        AggregationResult aggregation = sample();
        EnrichmentOutcome outcome = new EnrichmentOutcome(
            Map.of("ABC-1", Map.of("color", "red", "size", "M")), List.of(), 1);

        AttributeMerger.Merge merge = merger.merge(aggregation, outcome);
        AggregationResult merged = merge.aggregation();

        assertEquals(List.of("color", "size"), merge.columns());
        assertEquals(aggregation.size(), merged.size());
        ReconciledOrder enriched = merged.partition(PartitionKind.LABEL_VENDORS).orders().get(0);
        assertEquals("red", enriched.order().attribute("color"));
        assertEquals("M", enriched.order().attribute("size"));

        ReconciledOrder missing = merged.partition(PartitionKind.NON_LABEL_VENDORS).orders().get(0);
        assertTrue(missing.order().attributes().containsKey("color"));
        assertNull(missing.order().attribute("color"));
        assertNull(missing.order().attribute("size"));

        ReconciledOrder unknown = merged.partition(PartitionKind.UNKNOWN).orders().get(0);
        assertTrue(unknown.order().attributes().containsKey("size"));
    }

    @Test
    void countsAndFlagsSurviveTheMerge() {
        AggregationResult aggregation = sample();
        EnrichmentOutcome outcome = new EnrichmentOutcome(
            Map.of("XYZ-1", Map.of("color", "blue")), List.of(), 1);

        AggregationResult merged = merger.merge(aggregation, outcome).aggregation();

        assertEquals(aggregation.vendorOrderCounts(), merged.vendorOrderCounts());
        assertEquals(aggregation.skuOrderCounts(), merged.skuOrderCounts());
        assertEquals(1, merged.newSkuOrders().size());
        assertEquals("ABC-1", merged.newSkuOrders().get(0).sku());
    }

    @Test
    void nothingFetchedLeavesRowsUntouched() {
        AggregationResult aggregation = sample();

        AttributeMerger.Merge merge = merger.merge(aggregation, EnrichmentOutcome.empty());

        assertSame(aggregation, merge.aggregation());
        assertTrue(merge.columns().isEmpty());
    }

    @Test
    void attributeNamedLikeAnExportColumnIsAppendedUnderItsOwnName() {
        AggregationResult aggregation = new Aggregator().aggregate(List.of(new ReconciliationResult(
            "ABC", LabelTypes.LABEL_VENDORS, List.of(
                labelled("1", "ABC-1", "Mug A"),
                labelled("2", "ABC-2", "Mug B")), 0, false)));
        EnrichmentOutcome outcome = new EnrichmentOutcome(
            Map.of("ABC-1", Map.of("product-name", "Remote A")), List.of(), 2);

        AttributeMerger.Merge merge = merger.merge(aggregation, outcome);

        assertEquals(List.of("enrichment.product-name"), merge.columns());
        List<ReconciledOrder> rows = merge.aggregation().partition(PartitionKind.LABEL_VENDORS).orders();
        assertEquals("Mug A", rows.get(0).order().attribute("product-name"));
        assertEquals("Remote A", rows.get(0).order().attribute("enrichment.product-name"));
        assertEquals("Mug B", rows.get(1).order().attribute("product-name"));
        assertNull(rows.get(1).order().attribute("enrichment.product-name"));
    }

    private static ReconciledOrder labelled(String id, String sku, String productName) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("order-id", id);
        attributes.put("sku", sku);
        attributes.put("product-name", productName);
        return new ReconciledOrder(new OrderRecord(id, sku, attributes), LabelTypes.LABEL_VENDORS, false);
    }

    private static AggregationResult sample() {
        return new Aggregator().aggregate(List.of(
            result("ABC", LabelTypes.LABEL_VENDORS, "1", "ABC-1", true),
            result("XYZ", LabelTypes.NON_LABEL_VENDORS, "2", "XYZ-1", false),
            result("QQQ", LabelTypes.UNKNOWN, "3", "QQQ-1", false)));
    }

    private static ReconciliationResult result(String prefix, String labelType, String id, String sku, boolean newSku) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("order-id", id);
        attributes.put("sku", sku);
        OrderRecord record = new OrderRecord(id, sku, attributes);
        return new ReconciliationResult(prefix, labelType, List.of(new ReconciledOrder(record, labelType, newSku)), 0, false);
    }
}
