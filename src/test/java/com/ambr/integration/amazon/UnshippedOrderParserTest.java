package com.ambr.integration.amazon;

import com.ambr.core.MissingInputException;
import com.ambr.core.model.OrderRecord;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UnshippedOrderParserTest {

    private final UnshippedOrderParser parser = new UnshippedOrderParser();

    @Test
    void parsesSampleFile() throws IOException {
        try (InputStream stream = getResource("unshipped/sample-unshipped-orders.txt")) {
            assertNotNull(stream, "Sample resource is missing");
            List<OrderRecord> records = parser.parse(new InputStreamReader(stream, StandardCharsets.UTF_8), "sample");

            assertEquals(7, records.size());
            OrderRecord first = records.get(0);
            assertEquals("111-0000001-0000001", first.orderId());
            assertEquals("ACME-MUG-11W", first.sku());
            assertEquals("ACME", first.vendorPrefix());
            assertEquals("Ann Lee", first.attribute("buyer-name"));
            assertEquals("1", first.attribute("quantity-purchased"));
            assertEquals(List.of("order-id", "order-item-id", "purchase-date", "buyer-email", "buyer-name", "sku",
                "product-name", "quantity-purchased", "ship-city"), List.copyOf(first.attributes().keySet()));
            assertEquals("ZETA", records.get(2).vendorPrefix());
        }
    }

    @Test
    void normalizesHeadersAndAcceptsUnderscoredOrderId() throws IOException {
        String data = String.join("\n",
            " Order ID \tSKU\tShip City",
            "114-1\tACME-1\tNew York"
        );

        List<OrderRecord> records = parser.parse(new StringReader(data), "inline");

        assertEquals(1, records.size());
        assertEquals("114-1", records.get(0).orderId());
        assertEquals("ACME-1", records.get(0).sku());
        assertEquals("New York", records.get(0).attribute("ship_city"));
    }

    @Test
    void skipsBlankLinesAndPadsShortRows() throws IOException {
        String data = String.join("\n",
            "order-id\tsku\tproduct-name",
            "",
            "114-2\tZETA-9"
        );

        List<OrderRecord> records = parser.parse(new StringReader(data), "inline");

        assertEquals(1, records.size());
        assertEquals("", records.get(0).attribute("product-name"));
    }

    @Test
    void rowWithoutSkuKeepsEmptySku() throws IOException {
        String data = "order-id\tsku\n114-3\t\n";

        OrderRecord record = parser.parse(new StringReader(data), "inline").get(0);

        assertEquals("", record.sku());
        assertEquals("", record.vendorPrefix());
    }

    @Test
    void missingSkuColumnIsFatal() {
        String data = "order-id\tproduct-name\n114-4\tMug\n";

        MissingInputException ex = assertThrows(MissingInputException.class,
            () -> parser.parse(new StringReader(data), "inline"));
        assertTrue(ex.getMessage().contains("sku"), ex.getMessage());
    }

    @Test
    void missingOrderIdColumnIsFatal() {
        String data = "sku\tproduct-name\nACME-1\tMug\n";

        assertThrows(MissingInputException.class, () -> parser.parse(new StringReader(data), "inline"));
    }

    @Test
    void blankOrderIdIsFatal() {
        String data = "order-id\tsku\n\tACME-1\n";

        MissingInputException ex = assertThrows(MissingInputException.class,
            () -> parser.parse(new StringReader(data), "inline"));
        assertTrue(ex.getMessage().contains("Row 2"), ex.getMessage());
    }

    @Test
    void emptyFileIsFatal() {
        assertThrows(MissingInputException.class, () -> parser.parse(new StringReader(""), "inline"));
    }

    private InputStream getResource(String path) {
        return Thread.currentThread().getContextClassLoader().getResourceAsStream(path);
    }
}
