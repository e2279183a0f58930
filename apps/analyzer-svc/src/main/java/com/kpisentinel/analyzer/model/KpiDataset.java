package com.kpisentinel.analyzer.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A tabular KPI upload. {@code rows} keep the cell text as read; {@code numericColumns} holds the
 * columns classified as numeric, in header order, with one value per row.
 */
public record KpiDataset(
        List<String> columns,
        List<List<String>> rows,
        List<String> dateColumns,
        Map<String, double[]> numericColumns
) {
    public KpiDataset {
        columns = columns == null ? List.of() : List.copyOf(columns);
        rows = rows == null ? List.of() : rows.stream().map(List::copyOf).toList();
        dateColumns = dateColumns == null ? List.of() : List.copyOf(dateColumns);
        numericColumns = numericColumns == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(numericColumns));
    }

    public int rowCount() {
        return rows.size();
    }

    public List<String> numericColumnNames() {
        return List.copyOf(numericColumns.keySet());
    }

    public Optional<double[]> values(String column) {
        return Optional.ofNullable(numericColumns.get(column)).map(double[]::clone);
    }

    public boolean hasDateColumn() {
        return !dateColumns.isEmpty();
    }
}
