package com.treeroll.service.core.hierarchy;

import com.treeroll.service.core.hierarchy.HierarchySpec.LevelSpec;
import com.treeroll.service.core.metric.MetricRegistry;
import com.treeroll.service.core.metric.MetricSpec;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Validates a {@link HierarchySpec} against the known dimensions and metrics and resolves it into a
 * {@link HierarchyPlan}. All problems are collected and reported together.
 */
@Component
public class HierarchyPlanner {

    public HierarchyPlan plan(HierarchySpec spec, MetricRegistry metrics, Map<String, DimensionSpec> dimensions) {
        if (spec == null) {
            throw new HierarchyConfigurationException(null, List.of("hierarchy specification is required"));
        }
        List<String> problems = new ArrayList<>();
        if (spec.id() == null || spec.id().isBlank()) {
            problems.add("hierarchy id is required");
        }
        List<LevelSpec> levelSpecs = spec.levels();
        if (levelSpecs.isEmpty()) {
            problems.add("hierarchy has no levels");
            throw new HierarchyConfigurationException(spec.id(), problems);
        }

        int rootIndex = levelSpecs.size() - 1;
        Set<String> seenDimensions = new HashSet<>();
        List<DimensionSpec> resolvedDimensions = new ArrayList<>(levelSpecs.size());
        List<List<MetricSpec>> resolvedMetrics = new ArrayList<>(levelSpecs.size());
        for (int i = 0; i < levelSpecs.size(); i++) {
            LevelSpec levelSpec = levelSpecs.get(i);
            String where = i == rootIndex ? "root level" : "level " + i;
            if (levelSpec == null) {
                problems.add(where + " is empty");
                resolvedDimensions.add(null);
                resolvedMetrics.add(List.of());
                continue;
            }
            resolvedDimensions.add(resolveDimension(levelSpec, i == rootIndex, where, dimensions, seenDimensions, problems));
            List<MetricSpec> levelMetrics = resolveMetrics(levelSpec, where, metrics, problems);
            resolvedMetrics.add(levelMetrics);
            validateLimit(levelSpec, levelMetrics, i, rootIndex, where, problems);
            validateOrder(levelSpec, levelMetrics, where, problems);
        }
        if (!problems.isEmpty()) {
            throw new HierarchyConfigurationException(spec.id(), problems);
        }

        List<Level> levels = new ArrayList<>(levelSpecs.size());
        Set<String> additive = new LinkedHashSet<>();
        Set<String> carried = new LinkedHashSet<>();
        List<Set<String>> additiveByLevel = new ArrayList<>();
        List<Set<String>> carriedByLevel = new ArrayList<>();
        for (int i = rootIndex; i >= 0; i--) {
            for (MetricSpec metric : resolvedMetrics.get(i)) {
                (metric.needsFullGrain() ? carried : additive).addAll(metric.measures());
            }
            additiveByLevel.add(0, Set.copyOf(additive));
            carriedByLevel.add(0, Set.copyOf(carried));
        }
        for (int i = 0; i < levelSpecs.size(); i++) {
            LevelSpec levelSpec = levelSpecs.get(i);
            levels.add(new Level(
                    i,
                    resolvedDimensions.get(i),
                    resolvedMetrics.get(i),
                    levelSpec.limit(),
                    orderingOf(levelSpec, spec.tieBreak()),
                    additiveByLevel.get(i),
                    carriedByLevel.get(i)));
        }
        return new HierarchyPlan(spec.id(), spec.label(), levels);
    }

    private DimensionSpec resolveDimension(
            LevelSpec levelSpec,
            boolean root,
            String where,
            Map<String, DimensionSpec> dimensions,
            Set<String> seen,
            List<String> problems) {
        String dimId = trimToNull(levelSpec.dimId());
        if (root) {
            if (dimId != null) {
                problems.add("the last level is the root and must not name a dimension (found '" + dimId + "')");
            }
            return null;
        }
        if (dimId == null) {
            problems.add(where + " must name a dimension; only the last level may omit it");
            return null;
        }
        if (!seen.add(dimId)) {
            problems.add(where + " repeats dimension '" + dimId + "'");
        }
        DimensionSpec dimension = dimensions.get(dimId);
        if (dimension == null) {
            problems.add(where + " references unknown dimension '" + dimId + "'");
        }
        return dimension;
    }

    private List<MetricSpec> resolveMetrics(
            LevelSpec levelSpec, String where, MetricRegistry metrics, List<String> problems) {
        List<MetricSpec> resolved = new ArrayList<>(levelSpec.metrics().size());
        Set<String> seen = new HashSet<>();
        for (String metricId : levelSpec.metrics()) {
            if (metricId == null || metricId.isBlank()) {
                problems.add(where + " lists a blank metric id");
                continue;
            }
            if (!seen.add(metricId)) {
                problems.add(where + " lists metric '" + metricId + "' twice");
                continue;
            }
            Optional<MetricSpec> metric = metrics.find(metricId);
            if (metric.isEmpty()) {
                problems.add(where + " references unknown metric '" + metricId + "'");
                continue;
            }
            resolved.add(metric.get());
        }
        return resolved;
    }

    private void validateLimit(
            LevelSpec levelSpec,
            List<MetricSpec> levelMetrics,
            int index,
            int rootIndex,
            String where,
            List<String> problems) {
        LimitConfig limit = levelSpec.limit();
        if (limit == null) {
            return;
        }
        if (index == rootIndex) {
            problems.add("the root level cannot be limited");
            return;
        }
        if (index == rootIndex - 1) {
            problems.add(where + " is the root's breakdown, which is never limited");
        }
        if (limit.keptN() <= 0) {
            problems.add(where + " limit kept_n must be positive, got " + limit.keptN());
        }
        checkRankingMetric(limit.rankingMetricId(), levelMetrics, where + " limit", problems);
    }

    private void validateOrder(LevelSpec levelSpec, List<MetricSpec> levelMetrics, String where, List<String> problems) {
        OrderConfig order = levelSpec.order();
        if (order == null) {
            return;
        }
        if (levelSpec.limit() != null) {
            problems.add(where + " sets both limit and order; a limited level is ordered by its ranking metric");
            return;
        }
        checkRankingMetric(order.metricId(), levelMetrics, where + " order", problems);
    }

    private void checkRankingMetric(String metricId, List<MetricSpec> levelMetrics, String where, List<String> problems) {
        if (metricId == null || metricId.isBlank()) {
            problems.add(where + " must name a ranking metric");
            return;
        }
        MetricSpec ranking = levelMetrics.stream()
                .filter(m -> m.id().equals(metricId))
                .findFirst()
                .orElse(null);
        if (ranking == null) {
            problems.add(where + " ranks by '" + metricId + "', which is not in that level's metrics");
        } else if (!ranking.isRankable()) {
            problems.add(where + " ranks by sampled series '" + metricId + "', which has no scalar value");
        }
    }

    private RowOrdering orderingOf(LevelSpec levelSpec, TieBreak tieBreak) {
        if (levelSpec.limit() != null) {
            return new RowOrdering(levelSpec.limit().rankingMetricId(), levelSpec.limit().withValues(), tieBreak);
        }
        if (levelSpec.order() != null) {
            return new RowOrdering(levelSpec.order().metricId(), levelSpec.order().withValues(), tieBreak);
        }
        return RowOrdering.byValue(tieBreak);
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
