package com.ambr.core.enrich;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reply of the enrichment service: a status flag and an attribute bag per SKU.
 */
public record EnrichmentResponse(boolean status, Map<String, Map<String, String>> data) {

    public EnrichmentResponse {
        if (data != null) {
            Map<String, Map<String, String>> copy = new LinkedHashMap<>();
            data.forEach((sku, bag) -> copy.put(sku, bag == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(bag))));
            data = Collections.unmodifiableMap(copy);
        }
    }

    public static EnrichmentResponse ok(Map<String, Map<String, String>> data) {
        return new EnrichmentResponse(true, data);
    }

    public static EnrichmentResponse failed() {
        return new EnrichmentResponse(false, Map.of());
    }
}
