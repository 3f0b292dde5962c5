package com.ambr.core.knowledge;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One sheet of a master workbook: normalized column names and rows of cell text.
 * A sheet that failed to load is represented with {@link #unreadable(String, String)}.
 */
public final class ReferenceTable {
    private final String name;
    private final List<String> columns;
    private final List<Map<String, String>> rows;
    private final String loadError;

    private ReferenceTable(String name, List<String> columns, List<Map<String, String>> rows, String loadError) {
        this.name = name;
        this.columns = List.copyOf(columns);
        this.rows = rows;
        this.loadError = loadError;
    }

    /**
     * @param rawColumns header cells as found in the sheet; normalized with {@link ColumnNames#normalize(String)}
     * @param rawRows    cell text per row, positionally aligned with {@code rawColumns}
     */
    public static ReferenceTable of(String name, List<String> rawColumns, List<List<String>> rawRows) {
        List<String> columns = new ArrayList<>(rawColumns.size());
        for (String raw : rawColumns) {
            columns.add(ColumnNames.normalize(raw));
        }
        List<Map<String, String>> rows = new ArrayList<>(rawRows.size());
        for (List<String> raw : rawRows) {
            Map<String, String> row = new LinkedHashMap<>();
            for (int i = 0; i < columns.size(); i++) {
                String column = columns.get(i);
                if (column.isEmpty() || row.containsKey(column)) {
                    continue;
                }
                row.put(column, i < raw.size() ? raw.get(i) : null);
            }
            rows.add(Collections.unmodifiableMap(row));
        }
        return new ReferenceTable(name, columns, Collections.unmodifiableList(rows), null);
    }

    public static ReferenceTable unreadable(String name, String reason) {
        return new ReferenceTable(name, List.of(), List.of(), reason == null ? "unreadable" : reason);
    }

    public String name() {
        return name;
    }

    public List<String> columns() {
        return columns;
    }

    public List<Map<String, String>> rows() {
        return rows;
    }

    public boolean hasColumn(String normalizedColumn) {
        return columns.contains(normalizedColumn);
    }

    /**
     * First of the given columns present in this table.
     */
    public Optional<String> findColumn(String... candidates) {
        for (String candidate : candidates) {
            if (hasColumn(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    public Optional<String> loadError() {
        return Optional.ofNullable(loadError);
    }

    public boolean isReadable() {
        return loadError == null;
    }
}
