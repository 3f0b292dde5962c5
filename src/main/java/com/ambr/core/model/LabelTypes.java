package com.ambr.core.model;

/**
 * Well-known label type names used by the vendor registry and the master sheets.
 * Registries may define further label types; those are reported with the unknown vendors.
 */
public final class LabelTypes {
    public static final String LABEL_VENDORS = "Label Vendors";
    public static final String NON_LABEL_VENDORS = "Non-Label Vendors";
    public static final String UNKNOWN = "Unknown";

    private LabelTypes() {
    }

    public static boolean isUnknown(String labelType) {
        return labelType == null || UNKNOWN.equals(labelType);
    }
}
