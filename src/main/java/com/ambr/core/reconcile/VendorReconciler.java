package com.ambr.core.reconcile;

import com.ambr.core.knowledge.KnowledgeBase;
import com.ambr.core.model.LabelTypes;
import com.ambr.core.model.OrderRecord;
import com.ambr.core.model.ReconciledOrder;
import com.ambr.core.model.ReconciliationResult;
import com.ambr.core.vendor.VendorClassifier;
import com.ambr.logging.AppLogger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Reconciles the orders of a single vendor prefix against the knowledge base.
 * Pure with respect to its inputs; safe to call from several threads at once.
 */
public class VendorReconciler {
    private static final Logger LOGGER = AppLogger.get();

    private final KnowledgeBase knowledgeBase;
    private final VendorClassifier classifier;

    public VendorReconciler(KnowledgeBase knowledgeBase, VendorClassifier classifier) {
        this.knowledgeBase = Objects.requireNonNull(knowledgeBase, "knowledgeBase");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    public ReconciliationResult reconcile(String vendorPrefix, List<OrderRecord> vendorOrders) {
        if (vendorOrders == null || vendorOrders.isEmpty()) {
            LOGGER.warning("No orders found for vendor: " + vendorPrefix);
            return ReconciliationResult.empty(vendorPrefix);
        }

        String labelType = classifier.classify(vendorPrefix);
        if (LabelTypes.isUnknown(labelType)) {
            List<ReconciledOrder> untouched = new ArrayList<>(vendorOrders.size());
            for (OrderRecord order : vendorOrders) {
                untouched.add(new ReconciledOrder(order, LabelTypes.UNKNOWN, false));
            }
            LOGGER.fine(() -> "Vendor %s is not registered; %d order(s) reported as unknown."
                .formatted(vendorPrefix, untouched.size()));
            return new ReconciliationResult(vendorPrefix, LabelTypes.UNKNOWN, untouched, 0, false);
        }

        Set<String> existingSkus = knowledgeBase.knownSkus(labelType);
        List<ReconciledOrder> retained = new ArrayList<>(vendorOrders.size());
        int suppressed = 0;
        for (OrderRecord order : vendorOrders) {
            if (knowledgeBase.isKnownOrder(labelType, order.orderId())) {
                suppressed++;
                continue;
            }
            retained.add(new ReconciledOrder(order, labelType, !existingSkus.contains(order.sku())));
        }

        int suppressedCount = suppressed;
        LOGGER.fine(() -> "Vendor %s (%s): %d retained, %d already in master sheets."
            .formatted(vendorPrefix, labelType, retained.size(), suppressedCount));
        return new ReconciliationResult(vendorPrefix, labelType, retained, suppressed, false);
    }

    /**
     * Result used when {@link #reconcile} failed: every order kept, none flagged as a new SKU.
     */
    public ReconciliationResult degraded(String vendorPrefix, List<OrderRecord> vendorOrders) {
        String labelType;
        try {
            labelType = classifier.classify(vendorPrefix);
        } catch (RuntimeException ex) {
            LOGGER.warning("Could not classify vendor %s: %s".formatted(vendorPrefix, ex.getMessage()));
            labelType = LabelTypes.UNKNOWN;
        }
        List<ReconciledOrder> kept = new ArrayList<>();
        if (vendorOrders != null) {
            for (OrderRecord order : vendorOrders) {
                kept.add(new ReconciledOrder(order, labelType, false));
            }
        }
        return new ReconciliationResult(vendorPrefix, labelType, kept, 0, true);
    }
}
