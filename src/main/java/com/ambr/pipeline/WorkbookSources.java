package com.ambr.pipeline;

import com.ambr.config.PipelineConfig;
import com.ambr.core.MissingInputException;
import com.ambr.core.fs.UploadDiscoveryService;
import com.ambr.core.knowledge.ReferenceTable;
import com.ambr.core.model.OrderRecord;
import com.ambr.core.vendor.VendorRegistry;
import com.ambr.integration.amazon.UnshippedOrderParser;
import com.ambr.integration.sheets.WorkbookReader;
import com.ambr.logging.AppLogger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Reads the export from the upload folder and both master workbooks from disk.
 * The current master workbook is read once and also supplies the vendor registry sheet.
 */
public class WorkbookSources implements ReconciliationSources {
    private static final Logger LOGGER = AppLogger.get();

    private final PipelineConfig config;
    private final UploadDiscoveryService discovery;
    private final UnshippedOrderParser parser;
    private final WorkbookReader workbookReader;

    private Map<String, ReferenceTable> newReference;

    public WorkbookSources(PipelineConfig config) {
        this(config, new UploadDiscoveryService(), new UnshippedOrderParser(), new WorkbookReader());
    }

    public WorkbookSources(PipelineConfig config,
                           UploadDiscoveryService discovery,
                           UnshippedOrderParser parser,
                           WorkbookReader workbookReader) {
        this.config = Objects.requireNonNull(config, "config");
        this.discovery = Objects.requireNonNull(discovery, "discovery");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.workbookReader = Objects.requireNonNull(workbookReader, "workbookReader");
    }

    @Override
    public List<OrderRecord> loadBatch() throws IOException {
        Path export = discovery.findExport(config.uploadDirectory());
        return parser.parse(export);
    }

    @Override
    public Map<String, ReferenceTable> loadOldReference() throws IOException {
        LOGGER.info("Loading old master workbook " + config.oldMasterWorkbook());
        return workbookReader.readAll(config.oldMasterWorkbook());
    }

    @Override
    public synchronized Map<String, ReferenceTable> loadNewReference() throws IOException {
        if (newReference == null) {
            LOGGER.info("Loading new master workbook " + config.newMasterWorkbook());
            newReference = workbookReader.readAll(config.newMasterWorkbook());
        }
        return newReference;
    }

    @Override
    public VendorRegistry loadVendorRegistry() throws IOException {
        String sheetName = config.registrySheetName();
        ReferenceTable table = loadNewReference().get(sheetName);
        if (table == null) {
            throw new MissingInputException(sheetName,
                "'%s' sheet not found in %s.".formatted(sheetName, config.newMasterWorkbook().getFileName()));
        }
        VendorRegistry registry = VendorRegistry.fromTable(table);
        LOGGER.info("Vendor registry loaded: %d prefix(es).".formatted(registry.size()));
        return registry;
    }
}
