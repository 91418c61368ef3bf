package com.treeroll.service.core.hierarchy;

import com.treeroll.service.core.metric.MetricSpec;
import java.util.List;
import java.util.Set;

/**
 * One resolved stage of a {@link HierarchyPlan}.
 *
 * @param index position from the leaf (0) to the root
 * @param dimension grouping dimension, null for the root
 * @param metrics metrics emitted on this level's rows, in declared order
 * @param limit top-N limit applied to this level's rows inside each parent group, or null
 * @param ordering sibling order of this level's rows
 * @param additiveMeasures measures whose sum and count this level and its ancestors need
 * @param carriedMeasures measures whose full-grain sequence this level and its ancestors need
 */
public record Level(
        int index,
        DimensionSpec dimension,
        List<MetricSpec> metrics,
        LimitConfig limit,
        RowOrdering ordering,
        Set<String> additiveMeasures,
        Set<String> carriedMeasures) {

    public Level {
        metrics = List.copyOf(metrics);
        additiveMeasures = Set.copyOf(additiveMeasures);
        carriedMeasures = Set.copyOf(carriedMeasures);
    }

    public boolean isRoot() {
        return dimension == null;
    }

    public boolean isLeaf() {
        return index == 0;
    }

    public String dimensionId() {
        return dimension == null ? null : dimension.id();
    }
}
