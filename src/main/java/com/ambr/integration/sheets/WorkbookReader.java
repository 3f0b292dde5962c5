package com.ambr.integration.sheets;

import com.ambr.core.MissingInputException;
import com.ambr.core.knowledge.ReferenceTable;
import com.ambr.logging.AppLogger;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads every sheet of a master workbook into {@link ReferenceTable}s, first row as header.
 * <p>
 * Cells are rendered as the text Excel would display, so numeric order ids keep their digits.
 * A sheet that cannot be read is returned as an unreadable table rather than failing the workbook.
 */
public class WorkbookReader {
    private static final Logger LOGGER = AppLogger.get();

    private final DataFormatter formatter = new DataFormatter();

    /**
     * @return tables keyed by sheet name, in workbook order
     * @throws MissingInputException when the workbook does not exist
     * @throws IOException           when the file is not a readable workbook
     */
    public Map<String, ReferenceTable> readAll(Path workbookPath) throws IOException {
        if (workbookPath == null || !Files.isRegularFile(workbookPath)) {
            throw new MissingInputException(String.valueOf(workbookPath), "Workbook not found: " + workbookPath);
        }
        Map<String, ReferenceTable> tables = new LinkedHashMap<>();
        try (InputStream in = Files.newInputStream(workbookPath);
             Workbook workbook = WorkbookFactory.create(in)) {
            for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
                Sheet sheet = workbook.getSheetAt(i);
                tables.put(sheet.getSheetName(), readSheet(sheet));
            }
        } catch (RuntimeException ex) {
            throw new IOException("Unable to open workbook " + workbookPath + ": " + ex.getMessage(), ex);
        }
        LOGGER.info("Loaded %d sheet(s) from %s.".formatted(tables.size(), workbookPath.getFileName()));
        return tables;
    }

    ReferenceTable readSheet(Sheet sheet) {
        String name = sheet.getSheetName();
        try {
            Row headerRow = sheet.getRow(sheet.getFirstRowNum());
            if (headerRow == null) {
                return ReferenceTable.of(name, List.of(), List.of());
            }
            int width = Math.max(0, headerRow.getLastCellNum());
            List<String> header = cellsOf(headerRow, width);
            List<List<String>> rows = new ArrayList<>();
            for (int r = headerRow.getRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                if (row == null) {
                    continue;
                }
                List<String> cells = cellsOf(row, width);
                if (cells.stream().allMatch(String::isBlank)) {
                    continue;
                }
                rows.add(cells);
            }
            return ReferenceTable.of(name, header, rows);
        } catch (RuntimeException ex) {
            LOGGER.log(Level.WARNING, "Unable to read sheet '%s': %s".formatted(name, ex.getMessage()), ex);
            return ReferenceTable.unreadable(name, ex.getMessage());
        }
    }

    private List<String> cellsOf(Row row, int width) {
        List<String> cells = new ArrayList<>(width);
        for (int c = 0; c < width; c++) {
            Cell cell = row.getCell(c, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL);
            cells.add(cell == null ? "" : formatter.formatCellValue(cell));
        }
        return cells;
    }
}
