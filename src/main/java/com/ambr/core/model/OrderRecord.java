package com.ambr.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable row of the unshipped-orders export.
 * <p>
 * {@code orderId} and {@code sku} are validated at ingestion; every other column is carried through
 * untouched in {@link #attributes()}, keyed by normalized column name and kept in export order.
 * Attribute values may be {@code null} once enrichment columns have been merged in.
 */
public final class OrderRecord {
    private final String orderId;
    private final String sku;
    private final String vendorPrefix;
    private final Map<String, String> attributes;

    public OrderRecord(String orderId, String sku, Map<String, String> attributes) {
        this.orderId = requireNonBlank(orderId, "orderId");
        this.sku = sku == null ? "" : sku;
        this.vendorPrefix = vendorPrefixOf(this.sku);
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(
            attributes == null ? Map.of() : attributes));
    }

    /**
     * First {@code -}-delimited token of the SKU; a SKU without a separator is its own prefix.
     */
    public static String vendorPrefixOf(String sku) {
        if (sku == null) {
            return "";
        }
        int dash = sku.indexOf('-');
        return dash < 0 ? sku : sku.substring(0, dash);
    }

    public String orderId() {
        return orderId;
    }

    public String sku() {
        return sku;
    }

    public String vendorPrefix() {
        return vendorPrefix;
    }

    public Map<String, String> attributes() {
        return attributes;
    }

    public String attribute(String column) {
        return attributes.get(column);
    }

    /**
     * Returns a copy with the given columns appended (or replaced when already present).
     */
    public OrderRecord withAttributes(Map<String, String> extra) {
        if (extra == null || extra.isEmpty()) {
            return this;
        }
        Map<String, String> merged = new LinkedHashMap<>(attributes);
        merged.putAll(extra);
        return new OrderRecord(orderId, sku, merged);
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null) {
            throw new IllegalArgumentException(field + " cannot be null");
        }
        if (value.isBlank()) {
            throw new IllegalArgumentException(field + " cannot be blank");
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OrderRecord that)) return false;
        return orderId.equals(that.orderId)
            && sku.equals(that.sku)
            && attributes.equals(that.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(orderId, sku, attributes);
    }

    @Override
    public String toString() {
        return "OrderRecord{" +
            "orderId='" + orderId + '\'' +
            ", sku='" + sku + '\'' +
            ", vendorPrefix='" + vendorPrefix + '\'' +
            ", attributes=" + attributes.size() +
            '}';
    }
}
