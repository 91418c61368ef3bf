package com.treeroll.service.core.rollup;

import com.treeroll.service.core.metric.GroupAccumulator;
import com.treeroll.service.core.model.MetricValue;
import java.util.List;

/**
 * Level-scoped aggregate: the dimension path it was grouped by (own value first), its accumulators, its
 * metric values and its candidate children, already in sibling order.
 */
public record Group(
        List<String> path, GroupAccumulator accumulator, List<MetricValue> metrics, List<CarriedRow> candidates) {

    public Group {
        path = List.copyOf(path);
        metrics = List.copyOf(metrics);
        candidates = List.copyOf(candidates);
    }
}
