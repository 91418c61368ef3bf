package com.treeroll.service.core.config.model;

import com.treeroll.service.core.catalog.CatalogEntry;
import com.treeroll.service.core.hierarchy.DimensionSpec;
import com.treeroll.service.core.hierarchy.HierarchySpec;
import java.util.List;

/** Contents of one definitions file. Every section is optional. */
public record RollupDefinitions(
        List<MetricDefinition> metrics,
        List<DimensionSpec> dimensions,
        List<HierarchySpec> hierarchies,
        List<CatalogEntry> catalog) {

    public RollupDefinitions {
        metrics = metrics == null ? List.of() : List.copyOf(metrics);
        dimensions = dimensions == null ? List.of() : List.copyOf(dimensions);
        hierarchies = hierarchies == null ? List.of() : List.copyOf(hierarchies);
        catalog = catalog == null ? List.of() : List.copyOf(catalog);
    }

    public boolean isEmpty() {
        return metrics.isEmpty() && dimensions.isEmpty() && hierarchies.isEmpty() && catalog.isEmpty();
    }
}
