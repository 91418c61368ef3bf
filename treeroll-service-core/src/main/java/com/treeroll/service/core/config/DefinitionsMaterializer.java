package com.treeroll.service.core.config;

import com.treeroll.service.core.catalog.CatalogEntry;
import com.treeroll.service.core.config.model.MetricDefinition;
import com.treeroll.service.core.config.model.RollupDefinitions;
import com.treeroll.service.core.hierarchy.DimensionSpec;
import com.treeroll.service.core.hierarchy.HierarchySpec;
import com.treeroll.service.core.metric.MetricFunction;
import com.treeroll.service.core.metric.MetricKind;
import com.treeroll.service.core.metric.MetricRegistry;
import com.treeroll.service.core.metric.MetricSpec;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Converts parsed definition files into a runtime {@link RegistrySnapshot}. */
public class DefinitionsMaterializer {

    public RegistrySnapshot materialize(List<RollupDefinitions> files, Instant loadedAt) {
        List<MetricSpec> metrics = new ArrayList<>();
        Map<String, DimensionSpec> dimensions = new LinkedHashMap<>();
        Map<String, HierarchySpec> hierarchies = new LinkedHashMap<>();
        Map<String, CatalogEntry> catalog = new LinkedHashMap<>();
        for (RollupDefinitions file : files) {
            for (MetricDefinition definition : file.metrics()) {
                metrics.add(materializeMetric(definition));
            }
            for (DimensionSpec dimension : file.dimensions()) {
                putUnique(dimensions, dimension.id(), dimension, "dimension");
            }
            for (HierarchySpec hierarchy : file.hierarchies()) {
                if (hierarchy.id() == null || hierarchy.id().isBlank()) {
                    throw new IllegalArgumentException("Hierarchy id must be provided in definitions");
                }
                putUnique(hierarchies, hierarchy.id(), hierarchy, "hierarchy");
            }
            for (CatalogEntry entry : file.catalog()) {
                putUnique(catalog, entry.id(), entry, "catalog entry");
            }
        }
        return new RegistrySnapshot(
                MetricRegistry.of(metrics),
                dimensions,
                hierarchies,
                catalog,
                loadedAt != null ? loadedAt : Instant.now());
    }

    MetricSpec materializeMetric(MetricDefinition definition) {
        String id = safeTrim(definition.id());
        if (id == null) {
            throw new IllegalArgumentException("Metric id must be provided in definitions");
        }
        MetricKind kind = definition.kind() == null ? null : MetricKind.fromConfigValue(definition.kind());
        MetricFunction function =
                definition.function() == null ? null : MetricFunction.fromConfigValue(definition.function());
        return new MetricSpec(
                id,
                kind,
                function,
                safeTrim(definition.measure()),
                safeTrim(definition.denominator()),
                definition.percentile(),
                definition.sampleSize());
    }

    private static <V> void putUnique(Map<String, V> target, String id, V value, String what) {
        if (target.putIfAbsent(id, value) != null) {
            throw new IllegalArgumentException("Duplicate " + what + " id: " + id);
        }
    }

    private static String safeTrim(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
