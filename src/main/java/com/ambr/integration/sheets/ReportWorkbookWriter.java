package com.ambr.integration.sheets;

import com.ambr.core.aggregate.AggregationResult;
import com.ambr.core.model.OrderRecord;
import com.ambr.core.model.PartitionKind;
import com.ambr.core.model.ReconciledOrder;
import com.ambr.core.report.ReportSink;
import com.ambr.core.report.RunReport;
import com.ambr.logging.AppLogger;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Writes the run report as a single {@code .xlsx} workbook.
 */
public class ReportWorkbookWriter implements ReportSink {
    private static final Logger LOGGER = AppLogger.get();

    public static final String SKU_COUNTS_SHEET = "SKU_Counts_Report";
    public static final String VENDOR_COUNTS_SHEET = "Vendor_Order_Counts";
    public static final String NEW_SKU_SHEET = "New_SKU_Report";
    public static final String REMOVED_SHEET = "Removed_Orders";
    public static final String BULK_BUY_SHEET = "Bulk_Buy_Orders";
    public static final String WARNINGS_SHEET = "Run_Warnings";

    public static final String VENDOR_COLUMN = "vendor_name";
    public static final String NEW_SKU_COLUMN = "new_sku";

    private final Path target;
    private final Set<String> droppedColumns;

    /**
     * @param target         workbook to create or replace
     * @param droppedColumns export columns omitted from the label and non-label sheets
     */
    public ReportWorkbookWriter(Path target, List<String> droppedColumns) {
        this.target = Objects.requireNonNull(target, "target");
        this.droppedColumns = new HashSet<>(droppedColumns == null ? List.of() : droppedColumns);
    }

    public Path target() {
        return target;
    }

    @Override
    public void emit(RunReport report) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = Files.createTempFile(parent, "report-", ".xlsx.tmp");
        try (Workbook workbook = new XSSFWorkbook()) {
            CellStyle headerStyle = headerStyle(workbook);
            AggregationResult aggregation = report.aggregation();
            List<String> enrichment = report.enrichmentColumns();

            writeOrders(workbook, headerStyle, PartitionKind.LABEL_VENDORS.sheetName(),
                aggregation.partition(PartitionKind.LABEL_VENDORS).orders(), droppedColumns, enrichment);
            writeOrders(workbook, headerStyle, PartitionKind.NON_LABEL_VENDORS.sheetName(),
                aggregation.partition(PartitionKind.NON_LABEL_VENDORS).orders(), droppedColumns, enrichment);
            writeOrders(workbook, headerStyle, PartitionKind.UNKNOWN.sheetName(),
                aggregation.partition(PartitionKind.UNKNOWN).orders(), Set.of(), enrichment);
            writeCounts(workbook, headerStyle, SKU_COUNTS_SHEET, "SKU", "Unshipped Orders", aggregation.skuOrderCounts());
            writeCounts(workbook, headerStyle, VENDOR_COUNTS_SHEET, "Vendor", "Order Count", aggregation.vendorOrderCounts());
            writeOrders(workbook, headerStyle, NEW_SKU_SHEET, aggregation.newSkuOrders(), Set.of(), enrichment);
            writeRemoved(workbook, headerStyle, report.removedRows());
            if (report.bulkBuyCheckEnabled()) {
                writeOrders(workbook, headerStyle, BULK_BUY_SHEET, report.bulkBuyOrders(), droppedColumns, enrichment);
            }
            if (!report.warnings().isEmpty()) {
                writeWarnings(workbook, headerStyle, report.warnings());
            }

            try (OutputStream out = Files.newOutputStream(temp)) {
                workbook.write(out);
            }
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(temp);
        }
        LOGGER.info("Saved report workbook to " + target);
    }

    private static void writeOrders(Workbook workbook, CellStyle headerStyle, String sheetName,
                                    List<ReconciledOrder> orders, Set<String> dropped, List<String> enrichment) {
        Sheet sheet = workbook.createSheet(sheetName);
        if (orders.isEmpty()) {
            return;
        }
        // export columns first, enrichment columns after them in fetch order
        List<String> columns = attributeColumns(orders.stream().map(ReconciledOrder::order).toList(), dropped);
        columns.removeAll(enrichment);
        for (String column : enrichment) {
            if (!dropped.contains(column)) {
                columns.add(column);
            }
        }
        List<String> header = new ArrayList<>(columns);
        header.add(VENDOR_COLUMN);
        header.add(NEW_SKU_COLUMN);
        writeHeader(sheet, headerStyle, header);

        int rowIndex = 1;
        for (ReconciledOrder order : orders) {
            Row row = sheet.createRow(rowIndex++);
            int c = writeAttributes(row, order.order(), columns);
            row.createCell(c++).setCellValue(order.vendorPrefix());
            row.createCell(c).setCellValue(order.newSku());
        }
    }

    private static void writeRemoved(Workbook workbook, CellStyle headerStyle, List<OrderRecord> removed) {
        Sheet sheet = workbook.createSheet(REMOVED_SHEET);
        if (removed.isEmpty()) {
            return;
        }
        List<String> columns = attributeColumns(removed, Set.of());
        List<String> header = new ArrayList<>(columns);
        header.add(VENDOR_COLUMN);
        writeHeader(sheet, headerStyle, header);

        int rowIndex = 1;
        for (OrderRecord record : removed) {
            Row row = sheet.createRow(rowIndex++);
            int c = writeAttributes(row, record, columns);
            row.createCell(c).setCellValue(record.vendorPrefix());
        }
    }

    private static void writeCounts(Workbook workbook, CellStyle headerStyle, String sheetName,
                                    String keyHeader, String countHeader, Map<String, Integer> counts) {
        Sheet sheet = workbook.createSheet(sheetName);
        writeHeader(sheet, headerStyle, List.of(keyHeader, countHeader));
        int rowIndex = 1;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            Row row = sheet.createRow(rowIndex++);
            row.createCell(0).setCellValue(entry.getKey());
            row.createCell(1).setCellValue(entry.getValue());
        }
    }

    private static void writeWarnings(Workbook workbook, CellStyle headerStyle, List<String> warnings) {
        Sheet sheet = workbook.createSheet(WARNINGS_SHEET);
        writeHeader(sheet, headerStyle, List.of("Warning"));
        int rowIndex = 1;
        for (String warning : warnings) {
            sheet.createRow(rowIndex++).createCell(0).setCellValue(warning);
        }
    }

    private static List<String> attributeColumns(List<OrderRecord> records, Set<String> dropped) {
        Set<String> columns = new LinkedHashSet<>();
        for (OrderRecord record : records) {
            for (String column : record.attributes().keySet()) {
                if (!dropped.contains(column)) {
                    columns.add(column);
                }
            }
        }
        columns.remove(VENDOR_COLUMN);
        columns.remove(NEW_SKU_COLUMN);
        return new ArrayList<>(columns);
    }

    private static int writeAttributes(Row row, OrderRecord record, List<String> columns) {
        int c = 0;
        for (String column : columns) {
            String value = record.attribute(column);
            if (value != null) {
                row.createCell(c).setCellValue(value);
            }
            c++;
        }
        return c;
    }

    private static void writeHeader(Sheet sheet, CellStyle style, List<String> header) {
        Row row = sheet.createRow(0);
        for (int i = 0; i < header.size(); i++) {
            Cell cell = row.createCell(i);
            cell.setCellValue(header.get(i));
            cell.setCellStyle(style);
        }
    }

    private static CellStyle headerStyle(Workbook workbook) {
        Font font = workbook.createFont();
        font.setBold(true);
        CellStyle style = workbook.createCellStyle();
        style.setFont(font);
        return style;
    }
}
