package com.treeroll.service.core.metric;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** Metric definitions keyed by id, in declaration order. */
public final class MetricRegistry {
    private static final MetricRegistry EMPTY = new MetricRegistry(Map.of());

    private final Map<String, MetricSpec> byId;

    private MetricRegistry(Map<String, MetricSpec> byId) {
        this.byId = byId;
    }

    public static MetricRegistry empty() {
        return EMPTY;
    }

    public static MetricRegistry of(Collection<MetricSpec> specs) {
        Map<String, MetricSpec> map = new LinkedHashMap<>();
        for (MetricSpec spec : specs) {
            if (map.putIfAbsent(spec.id(), spec) != null) {
                throw new IllegalArgumentException("Duplicate metric id: " + spec.id());
            }
        }
        return new MetricRegistry(Collections.unmodifiableMap(map));
    }

    public Optional<MetricSpec> find(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    public boolean contains(String id) {
        return byId.containsKey(id);
    }

    public int size() {
        return byId.size();
    }
}
