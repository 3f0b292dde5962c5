package com.ambr.core.model;

/**
 * The three reporting buckets every reconciled order lands in.
 */
public enum PartitionKind {
    LABEL_VENDORS("Label_Vendors_Orders"),
    NON_LABEL_VENDORS("Non_Label_Vendors_Orders"),
    UNKNOWN("Unknown_Vendors_Report");

    private final String sheetName;

    PartitionKind(String sheetName) {
        this.sheetName = sheetName;
    }

    public String sheetName() {
        return sheetName;
    }

    public boolean isKnownVendor() {
        return this != UNKNOWN;
    }

    /**
     * Any label type other than the two vendor classes folds into {@link #UNKNOWN}.
     */
    public static PartitionKind forLabelType(String labelType) {
        if (LabelTypes.LABEL_VENDORS.equals(labelType)) {
            return LABEL_VENDORS;
        }
        if (LabelTypes.NON_LABEL_VENDORS.equals(labelType)) {
            return NON_LABEL_VENDORS;
        }
        return UNKNOWN;
    }
}
