package com.ambr.pipeline;

import com.ambr.core.knowledge.ReferenceTable;
import com.ambr.core.model.OrderRecord;
import com.ambr.core.vendor.VendorRegistry;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Inputs of one reconciliation run. Failures here are fatal setup errors.
 */
public interface ReconciliationSources {

    /**
     * Raw rows of the current unshipped-orders export, in file order.
     */
    List<OrderRecord> loadBatch() throws IOException;

    /**
     * Sheets of the historical master workbook keyed by label type.
     */
    Map<String, ReferenceTable> loadOldReference() throws IOException;

    /**
     * Sheets of the current master workbook keyed by label type.
     */
    Map<String, ReferenceTable> loadNewReference() throws IOException;

    VendorRegistry loadVendorRegistry() throws IOException;
}
