package com.ambr.core.knowledge;

import java.util.Locale;

/**
 * Header normalization shared by the export parser and the master-sheet reader.
 */
public final class ColumnNames {
    public static final String ORDER_ID = "order_id";
    public static final String ORDER_ID_EXPORT = "order-id";
    public static final String SKU = "sku";

    private ColumnNames() {
    }

    /**
     * Trims, case-folds and replaces spaces with underscores: {@code " Order ID"} becomes {@code "order_id"}.
     */
    public static String normalize(String header) {
        if (header == null) {
            return "";
        }
        return header.strip().toLowerCase(Locale.ROOT).replace(' ', '_');
    }
}
