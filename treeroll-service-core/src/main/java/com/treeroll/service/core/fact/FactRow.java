package com.treeroll.service.core.fact;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** One leaf record. Dimension and measure values may be null. */
public record FactRow(Map<String, String> dimensions, Map<String, BigDecimal> measures) {

    public FactRow {
        dimensions = dimensions == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(dimensions));
        measures = measures == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(measures));
    }

    public String dimension(String column) {
        return dimensions.get(column);
    }

    public BigDecimal measure(String column) {
        return measures.get(column);
    }
}
