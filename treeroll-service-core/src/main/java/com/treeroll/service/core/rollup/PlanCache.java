package com.treeroll.service.core.rollup;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.treeroll.service.core.config.RegistrySnapshot;
import com.treeroll.service.core.config.RollupProperties;
import com.treeroll.service.core.hierarchy.HierarchyPlan;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Plans of configured hierarchies, keyed by hierarchy id. Each registry snapshot gets its own cache, swapped
 * in when that snapshot is first seen, so a plan computed for an older snapshot never lands in a newer
 * one. Failed plans are not cached.
 */
@Slf4j
@Component
public class PlanCache {

    private record Generation(RegistrySnapshot snapshot, Cache<String, HierarchyPlan> plans) {}

    private final int size;
    private final AtomicReference<Generation> current = new AtomicReference<>();

    public PlanCache(RollupProperties properties) {
        this.size = properties.getRollup().getPlanCacheSize();
        log.info("Initialized hierarchy plan cache size={}", size);
    }

    public HierarchyPlan get(RegistrySnapshot snapshot, String hierarchyId, Function<String, HierarchyPlan> planner) {
        Generation generation =
                current.updateAndGet(g -> g != null && g.snapshot() == snapshot ? g : newGeneration(snapshot));
        return generation.plans().get(hierarchyId, planner);
    }

    private Generation newGeneration(RegistrySnapshot snapshot) {
        log.debug("Plan cache bound to a new definitions snapshot");
        return new Generation(snapshot, Caffeine.newBuilder().maximumSize(size).recordStats().build());
    }

    long hits() {
        Generation generation = current.get();
        return generation == null ? 0L : generation.plans().stats().hitCount();
    }
}
