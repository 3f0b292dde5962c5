package com.ambr.core.knowledge;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Read-only snapshot of what the old and new master workbooks know, per label type.
 * Built once per run and shared by all vendor workers without locking.
 */
public final class KnowledgeBase {
    private final Map<String, KnownEntries> oldSource;
    private final Map<String, KnownEntries> newSource;
    private final Map<String, Set<String>> knownSkus;
    private final Set<String> degradedLabelTypes;

    public KnowledgeBase(Map<String, KnownEntries> oldSource,
                         Map<String, KnownEntries> newSource,
                         Set<String> degradedLabelTypes) {
        this.oldSource = Map.copyOf(oldSource);
        this.newSource = Map.copyOf(newSource);
        this.degradedLabelTypes = Set.copyOf(degradedLabelTypes);

        Map<String, Set<String>> union = new LinkedHashMap<>();
        for (String labelType : labelTypes(oldSource, newSource)) {
            Set<String> skus = new HashSet<>();
            skus.addAll(oldSource.getOrDefault(labelType, KnownEntries.empty()).skus());
            skus.addAll(newSource.getOrDefault(labelType, KnownEntries.empty()).skus());
            union.put(labelType, Set.copyOf(skus));
        }
        this.knownSkus = Map.copyOf(union);
    }

    public static KnowledgeBase empty() {
        return new KnowledgeBase(Map.of(), Map.of(), Set.of());
    }

    /**
     * True when either master workbook already lists the order under the label type.
     */
    public boolean isKnownOrder(String labelType, String orderId) {
        if (labelType == null || orderId == null) {
            return false;
        }
        KnownEntries old = oldSource.get(labelType);
        if (old != null && old.orderIds().contains(orderId)) {
            return true;
        }
        KnownEntries fresh = newSource.get(labelType);
        return fresh != null && fresh.orderIds().contains(orderId);
    }

    /**
     * SKUs known to either workbook for the label type; empty for label types neither workbook has.
     */
    public Set<String> knownSkus(String labelType) {
        return knownSkus.getOrDefault(labelType, Set.of());
    }

    public Set<String> labelTypes() {
        return knownSkus.keySet();
    }

    public boolean isDegraded(String labelType) {
        return degradedLabelTypes.contains(labelType);
    }

    public Set<String> degradedLabelTypes() {
        return degradedLabelTypes;
    }

    private static Set<String> labelTypes(Map<String, KnownEntries> a, Map<String, KnownEntries> b) {
        Set<String> all = new LinkedHashSet<>(a.keySet());
        all.addAll(b.keySet());
        return all;
    }
}
