package com.treeroll.service.core.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * Display metadata for a metric, dimension or fact id. Only consumed downstream for rendering, apart from
 * the labels the tree carries.
 */
public record CatalogEntry(
        String id,
        String name,
        String unit,
        String humanize,
        @JsonProperty("chart_type") String chartType,
        @JsonProperty("value_labels") Map<String, String> valueLabels,
        @JsonProperty("other_label") String otherLabel) {

    public CatalogEntry {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Catalog entry id is required");
        }
        valueLabels = valueLabels == null ? Map.of() : Map.copyOf(valueLabels);
    }
}
