package com.ambr.core.model;

import java.util.Objects;

/**
 * An order that survived duplicate suppression, with the label type it was reconciled under.
 */
public record ReconciledOrder(OrderRecord order, String labelType, boolean newSku) {

    public ReconciledOrder {
        Objects.requireNonNull(order, "order");
        labelType = labelType == null ? LabelTypes.UNKNOWN : labelType;
    }

    public String orderId() {
        return order.orderId();
    }

    public String sku() {
        return order.sku();
    }

    public String vendorPrefix() {
        return order.vendorPrefix();
    }

    public ReconciledOrder withOrder(OrderRecord replacement) {
        return new ReconciledOrder(replacement, labelType, newSku);
    }
}
