package com.treeroll.service.core.catalog;

import java.util.Optional;

/** Opaque lookup of display metadata keyed by metric, dimension or fact id. */
public interface MetricCatalog {

    Optional<CatalogEntry> lookup(String id);

    default String valueLabel(String dimId, String value) {
        return lookup(dimId).map(entry -> entry.valueLabels().get(value)).orElse(null);
    }

    default String otherLabel(String dimId) {
        return lookup(dimId).map(CatalogEntry::otherLabel).orElse(null);
    }
}
