package com.treeroll.service.core.fact;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Read-only fact table handed to the rollup. */
public record FactTable(FactSchema schema, List<FactRow> rows) {

    public FactTable {
        if (schema == null) {
            throw new IllegalArgumentException("fact schema is required");
        }
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    /** Builds a table whose schema is the union of the columns the rows carry. */
    public static FactTable inferred(List<FactRow> rows) {
        Set<String> dimensions = new LinkedHashSet<>();
        Set<String> measures = new LinkedHashSet<>();
        for (FactRow row : rows) {
            dimensions.addAll(row.dimensions().keySet());
            measures.addAll(row.measures().keySet());
        }
        return new FactTable(new FactSchema(List.copyOf(dimensions), List.copyOf(measures)), rows);
    }

    public int size() {
        return rows.size();
    }
}
