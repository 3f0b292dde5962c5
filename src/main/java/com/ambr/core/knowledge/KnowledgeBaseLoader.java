package com.ambr.core.knowledge;

import com.ambr.core.RunWarnings;
import com.ambr.logging.AppLogger;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Builds the {@link KnowledgeBase} from the old and new master workbooks.
 * <p>
 * Each sheet name is a label type. A sheet without an order-id or SKU column contributes an empty
 * set for that axis and marks its label type degraded; only the vendor registry sheet is skipped.
 */
public final class KnowledgeBaseLoader {
    private static final Logger LOGGER = AppLogger.get();

    private final Set<String> ignoredSheets;

    public KnowledgeBaseLoader(Set<String> ignoredSheets) {
        this.ignoredSheets = ignoredSheets == null ? Set.of() : Set.copyOf(ignoredSheets);
    }

    public KnowledgeBase load(Map<String, ReferenceTable> oldSheets,
                              Map<String, ReferenceTable> newSheets,
                              RunWarnings warnings) {
        Set<String> degraded = new LinkedHashSet<>();
        Map<String, KnownEntries> oldEntries = index("old", oldSheets, degraded, warnings);
        Map<String, KnownEntries> newEntries = index("new", newSheets, degraded, warnings);
        KnowledgeBase knowledgeBase = new KnowledgeBase(oldEntries, newEntries, degraded);
        LOGGER.info("Knowledge base ready: %d label type(s), %d degraded."
            .formatted(knowledgeBase.labelTypes().size(), degraded.size()));
        return knowledgeBase;
    }

    private Map<String, KnownEntries> index(String sourceName,
                                            Map<String, ReferenceTable> sheets,
                                            Set<String> degraded,
                                            RunWarnings warnings) {
        Map<String, KnownEntries> entries = new LinkedHashMap<>();
        if (sheets == null) {
            return entries;
        }
        sheets.forEach((labelType, table) -> {
            if (ignoredSheets.contains(labelType)) {
                return;
            }
            if (table == null || !table.isReadable()) {
                String reason = table == null ? "missing" : table.loadError().orElse("unreadable");
                warnings.add("Sheet '%s' of the %s master workbook could not be read (%s); treating it as empty."
                    .formatted(labelType, sourceName, reason));
                degraded.add(labelType);
                entries.put(labelType, KnownEntries.empty());
                return;
            }

            Set<String> orderIds = collect(table, sourceName, labelType, degraded, warnings,
                ColumnNames.ORDER_ID, ColumnNames.ORDER_ID_EXPORT);
            Set<String> skus = collect(table, sourceName, labelType, degraded, warnings,
                ColumnNames.SKU);
            entries.put(labelType, new KnownEntries(orderIds, skus));
            LOGGER.fine(() -> "Indexed %s sheet '%s': %d order id(s), %d sku(s)."
                .formatted(sourceName, labelType, orderIds.size(), skus.size()));
        });
        return entries;
    }

    private static Set<String> collect(ReferenceTable table,
                                       String sourceName,
                                       String labelType,
                                       Set<String> degraded,
                                       RunWarnings warnings,
                                       String... columnCandidates) {
        Optional<String> column = table.findColumn(columnCandidates);
        if (column.isEmpty()) {
            warnings.add("Sheet '%s' of the %s master workbook has no '%s' column; treating it as empty."
                .formatted(labelType, sourceName, columnCandidates[0]));
            degraded.add(labelType);
            return Set.of();
        }
        Set<String> values = new LinkedHashSet<>();
        for (Map<String, String> row : table.rows()) {
            String value = row.get(column.get());
            if (value == null || value.isBlank()) {
                continue;
            }
            values.add(value.strip());
        }
        return values;
    }
}
