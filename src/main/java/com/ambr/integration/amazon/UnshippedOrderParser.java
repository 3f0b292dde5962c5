package com.ambr.integration.amazon;

import com.ambr.core.MissingInputException;
import com.ambr.core.knowledge.ColumnNames;
import com.ambr.core.model.OrderRecord;
import com.ambr.logging.AppLogger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Parses the marketplace unshipped-orders export (tab-separated, header row first) into {@link OrderRecord}s.
 * <p>
 * Every column is kept as an attribute under its normalized header. The {@code order-id} and {@code sku}
 * columns are mandatory and every data row must carry an order id.
 */
public class UnshippedOrderParser {
    private static final Logger LOGGER = AppLogger.get();

    private static final String HEADER_ORDER_ID = ColumnNames.ORDER_ID_EXPORT;
    private static final String HEADER_ORDER_ID_ALIAS = ColumnNames.ORDER_ID;
    private static final String HEADER_SKU = ColumnNames.SKU;

    /**
     * Parse the provided file path.
     *
     * @param file source TXT file (tab separated)
     * @return parsed rows in file order
     * @throws MissingInputException if a mandatory column or order id is missing
     * @throws IOException           if the file cannot be read
     */
    public List<OrderRecord> parse(Path file) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return parse(reader, file.getFileName().toString());
        }
    }

    /**
     * Parse the provided reader (expects tab separated values with headers).
     */
    public List<OrderRecord> parse(Reader reader, String sourceName) throws IOException {
        try (BufferedReader buffered = new BufferedReader(reader)) {
            String headerLine = buffered.readLine();
            if (headerLine == null) {
                throw new MissingInputException(sourceName, "Export %s is empty.".formatted(sourceName));
            }

            List<String> headers = normalizeHeaders(splitLine(stripBom(headerLine)));
            Map<String, Integer> headerIndex = mapHeaderIndexes(headers);
            String orderIdColumn = resolveOrderIdColumn(headerIndex, sourceName);
            if (!headerIndex.containsKey(HEADER_SKU)) {
                throw new MissingInputException(sourceName,
                    "Export %s is missing the required '%s' column.".formatted(sourceName, HEADER_SKU));
            }

            List<OrderRecord> records = new ArrayList<>();
            String line;
            int rowIndex = 1;
            while ((line = buffered.readLine()) != null) {
                rowIndex++;
                if (line.isBlank()) {
                    continue;
                }
                List<String> columns = splitLine(line);
                String orderId = getOptionalValue(columns, headerIndex, orderIdColumn);
                if (orderId.isEmpty()) {
                    throw new MissingInputException(sourceName,
                        "Row %d of %s has no order id.".formatted(rowIndex, sourceName));
                }
                String sku = getOptionalValue(columns, headerIndex, HEADER_SKU);
                records.add(new OrderRecord(orderId, sku, toAttributes(headers, columns)));
            }

            int count = records.size();
            LOGGER.info(() -> "Parsed %d row(s) from %s.".formatted(count, sourceName));
            return records;
        }
    }

    private static String resolveOrderIdColumn(Map<String, Integer> headerIndex, String sourceName)
            throws MissingInputException {
        if (headerIndex.containsKey(HEADER_ORDER_ID)) {
            return HEADER_ORDER_ID;
        }
        if (headerIndex.containsKey(HEADER_ORDER_ID_ALIAS)) {
            return HEADER_ORDER_ID_ALIAS;
        }
        throw new MissingInputException(sourceName,
            "Export %s is missing the required '%s' column.".formatted(sourceName, HEADER_ORDER_ID));
    }

    private static Map<String, String> toAttributes(List<String> headers, List<String> columns) {
        Map<String, String> attributes = new LinkedHashMap<>();
        for (int i = 0; i < headers.size(); i++) {
            String header = headers.get(i);
            if (header.isEmpty() || attributes.containsKey(header)) {
                continue;
            }
            String value = i < columns.size() ? columns.get(i) : "";
            attributes.put(header, value == null ? "" : value.trim());
        }
        return attributes;
    }

    private static String stripBom(String line) {
        return !line.isEmpty() && line.charAt(0) == '\uFEFF' ? line.substring(1) : line;
    }

    private static List<String> splitLine(String line) {
        return Arrays.stream(line.split("\t", -1))
            .map(value -> value == null ? "" : value)
            .collect(Collectors.toList());
    }

    private static List<String> normalizeHeaders(List<String> raw) {
        return raw.stream().map(ColumnNames::normalize).collect(Collectors.toList());
    }

    private static Map<String, Integer> mapHeaderIndexes(List<String> headers) {
        Map<String, Integer> indexMap = new LinkedHashMap<>();
        for (int i = 0; i < headers.size(); i++) {
            String header = headers.get(i);
            if (header.isEmpty()) continue;
            indexMap.putIfAbsent(header, i);
        }
        return indexMap;
    }

    private static String getOptionalValue(List<String> columns, Map<String, Integer> headerIndex, String key) {
        Integer index = headerIndex.get(key);
        if (index == null || index < 0 || index >= columns.size()) {
            return "";
        }
        String value = columns.get(index);
        return value == null ? "" : value.trim();
    }
}
