package com.treeroll.service.core.fact;

import java.util.List;

public record FactSchema(List<String> dimensionColumns, List<String> measureColumns) {

    public FactSchema {
        dimensionColumns = dimensionColumns == null ? List.of() : List.copyOf(dimensionColumns);
        measureColumns = measureColumns == null ? List.of() : List.copyOf(measureColumns);
    }

    public boolean hasDimension(String column) {
        return dimensionColumns.contains(column);
    }

    public boolean hasMeasure(String column) {
        return measureColumns.contains(column);
    }
}
