package com.treeroll.service.core.rollup;

import com.treeroll.service.core.catalog.MetricCatalog;
import com.treeroll.service.core.engine.TabularEngine;
import com.treeroll.service.core.hierarchy.LimitConfig;
import com.treeroll.service.core.hierarchy.Level;
import com.treeroll.service.core.metric.GroupAccumulator;
import com.treeroll.service.core.metric.MetricComputer;
import com.treeroll.service.core.model.LimitSpec;
import com.treeroll.service.core.model.ReportRow;
import com.treeroll.service.core.model.RowKey;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Keeps the first {@code kept_n} of a group's ordered children and folds the rest into one
 * {@code total_other} row computed with the children's own metric set.
 */
@Component
public class TopNLimiter {
    private final TabularEngine engine;
    private final MetricComputer computer;
    private final MetricCatalog catalog;

    public TopNLimiter(TabularEngine engine, MetricComputer computer, MetricCatalog catalog) {
        this.engine = engine;
        this.computer = computer;
        this.catalog = catalog;
    }

    public LimitedChildren limit(Group group, Level childLevel) {
        if (childLevel == null) {
            return LimitedChildren.none();
        }
        List<CarriedRow> candidates = group.candidates();
        LimitConfig limit = childLevel.limit();
        if (limit == null || candidates.size() <= limit.keptN()) {
            return new LimitedChildren(rowsOf(candidates), null);
        }
        List<CarriedRow> kept = candidates.subList(0, limit.keptN());
        List<CarriedRow> excluded = candidates.subList(limit.keptN(), candidates.size());
        List<ReportRow> rows = new ArrayList<>(kept.size() + 1);
        rows.addAll(rowsOf(kept));
        rows.add(otherRow(childLevel, excluded));
        return new LimitedChildren(
                rows, LimitSpec.topN(candidates.size(), limit.keptN(), limit.withValues(), limit.rankingMetricId()));
    }

    private ReportRow otherRow(Level level, List<CarriedRow> excluded) {
        List<GroupAccumulator> parts = new ArrayList<>(excluded.size());
        for (CarriedRow row : excluded) {
            parts.add(row.accumulator());
        }
        GroupAccumulator remainder =
                GroupAccumulator.merge(parts, level.additiveMeasures(), level.carriedMeasures(), engine);
        String dimId = level.dimensionId();
        return new ReportRow(
                RowKey.other(dimId, catalog.otherLabel(dimId)), computer.computeAll(level.metrics(), remainder), null);
    }

    private static List<ReportRow> rowsOf(List<CarriedRow> rows) {
        List<ReportRow> out = new ArrayList<>(rows.size());
        for (CarriedRow row : rows) {
            out.add(row.row());
        }
        return out;
    }
}
