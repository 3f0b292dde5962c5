package com.ambr.core.reconcile;

import com.ambr.core.model.OrderBatch;
import com.ambr.core.model.OrderRecord;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BatchCleanerTest {

    private final BatchCleaner cleaner = new BatchCleaner();

    @Test
    void splitsOffReturnAndInventoryRows() {
        OrderBatch batch = cleaner.clean(List.of(
            order("1", "ABC-123"),
            order("2", "XYZ-RET-9"),
            order("3", "INV-ADJ"),
            order("4", "ABC-555")));

        assertEquals(List.of("1", "4"), batch.orders().stream().map(OrderRecord::orderId).toList());
        assertEquals(List.of("2", "3"), batch.removedRows().stream().map(OrderRecord::orderId).toList());
    }

    @Test
    void keepsFirstRowPerOrderId() {
        OrderRecord first = new OrderRecord("1", "ABC-123", Map.of("order-item-id", "a"));
        OrderRecord second = new OrderRecord("1", "ABC-999", Map.of("order-item-id", "b"));

        OrderBatch batch = cleaner.clean(List.of(first, second, order("2", "ABC-1")));

        assertEquals(2, batch.orders().size());
        assertEquals("a", batch.orders().get(0).attribute("order-item-id"));
        assertEquals(1, batch.collapsedDuplicates());
    }

    @Test
    void removedRowDoesNotShadowRealOrderWithSameId() {
        OrderBatch batch = cleaner.clean(List.of(order("7", "ABC-RET-1"), order("7", "ABC-100")));

        assertEquals(1, batch.orders().size());
        assertEquals("ABC-100", batch.orders().get(0).sku());
        assertEquals(1, batch.removedRows().size());
    }

    @Test
    void markerIsMatchedAnywhereAndCaseSensitively() {
        assertTrue(cleaner.isRemovedRow(order("1", "ABCRETX")));
        assertFalse(cleaner.isRemovedRow(order("1", "abc-ret-1")));
        assertFalse(cleaner.isRemovedRow(order("1", "")));
    }

    @Test
    void cleaningTwiceChangesNothing() {
        OrderBatch once = cleaner.clean(List.of(order("1", "A-1"), order("1", "A-1"), order("2", "B-RET")));
        OrderBatch twice = cleaner.clean(once.orders());

        assertEquals(once.orders(), twice.orders());
        assertTrue(twice.removedRows().isEmpty());
    }

    @Test
    void customPatternReplacesDefault() {
        BatchCleaner custom = new BatchCleaner(Pattern.compile("RET|INV|SAMPLE"));

        OrderBatch batch = custom.clean(List.of(order("1", "ABC-SAMPLE"), order("2", "ABC-1")));

        assertEquals(1, batch.removedRows().size());
    }

    @Test
    void emptyInputGivesEmptyBatch() {
        assertTrue(cleaner.clean(List.of()).isEmpty());
    }

    private static OrderRecord order(String id, String sku) {
        return new OrderRecord(id, sku, Map.of("order-id", id, "sku", sku));
    }
}
