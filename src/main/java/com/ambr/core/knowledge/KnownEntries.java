package com.ambr.core.knowledge;

import java.util.Set;

/**
 * Order identifiers and SKUs a single master sheet already knows about.
 */
public record KnownEntries(Set<String> orderIds, Set<String> skus) {

    public KnownEntries {
        orderIds = Set.copyOf(orderIds);
        skus = Set.copyOf(skus);
    }

    public static KnownEntries empty() {
        return new KnownEntries(Set.of(), Set.of());
    }
}
