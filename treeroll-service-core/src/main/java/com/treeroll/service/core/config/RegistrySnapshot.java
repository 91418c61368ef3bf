package com.treeroll.service.core.config;

import com.treeroll.service.core.catalog.CatalogEntry;
import com.treeroll.service.core.hierarchy.DimensionSpec;
import com.treeroll.service.core.hierarchy.HierarchySpec;
import com.treeroll.service.core.metric.MetricRegistry;
import java.time.Instant;
import java.util.Map;

/** Immutable view of every loaded definition. */
public record RegistrySnapshot(
        MetricRegistry metrics,
        Map<String, DimensionSpec> dimensions,
        Map<String, HierarchySpec> hierarchies,
        Map<String, CatalogEntry> catalog,
        Instant loadedAt) {

    public RegistrySnapshot {
        metrics = metrics == null ? MetricRegistry.empty() : metrics;
        dimensions = dimensions == null ? Map.of() : Map.copyOf(dimensions);
        hierarchies = hierarchies == null ? Map.of() : Map.copyOf(hierarchies);
        catalog = catalog == null ? Map.of() : Map.copyOf(catalog);
    }

    public static RegistrySnapshot empty() {
        return new RegistrySnapshot(MetricRegistry.empty(), Map.of(), Map.of(), Map.of(), Instant.EPOCH);
    }
}
