package com.treeroll.service.core.catalog;

import com.treeroll.service.core.config.RollupRegistry;
import java.util.Optional;
import org.springframework.stereotype.Component;

/** Catalog backed by the entries of the current definitions snapshot. */
@Component
public class RegistryMetricCatalog implements MetricCatalog {
    private final RollupRegistry registry;

    public RegistryMetricCatalog(RollupRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Optional<CatalogEntry> lookup(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(registry.current().catalog().get(id));
    }
}
