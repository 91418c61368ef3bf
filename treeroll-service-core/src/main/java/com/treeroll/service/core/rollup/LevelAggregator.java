package com.treeroll.service.core.rollup;

import com.treeroll.service.core.config.RollupProperties;
import com.treeroll.service.core.engine.GroupMembers;
import com.treeroll.service.core.engine.TabularEngine;
import com.treeroll.service.core.fact.FactRow;
import com.treeroll.service.core.hierarchy.DimensionSpec;
import com.treeroll.service.core.hierarchy.Level;
import com.treeroll.service.core.metric.GroupAccumulator;
import com.treeroll.service.core.metric.MetricComputer;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Builds the groups of one level. Fact rows are grouped by their whole dimension path so that equal values
 * under different parents stay apart; rows of the level below are grouped by their parent path. Grouping
 * is sequential, aggregating a group is pure and may run on any thread.
 */
@Component
public class LevelAggregator {
    private final TabularEngine engine;
    private final MetricComputer computer;
    private final RollupProperties properties;

    public LevelAggregator(TabularEngine engine, MetricComputer computer, RollupProperties properties) {
        this.engine = engine;
        this.computer = computer;
        this.properties = properties;
    }

    /** Groups facts by the values of {@code path} (leaf dimension first). An empty path yields one group. */
    public List<GroupMembers<List<String>, FactRow>> groupFacts(List<FactRow> facts, List<DimensionSpec> path) {
        String placeholder = properties.getRollup().getNullDimensionValue();
        return engine.groupBy(facts, fact -> pathOf(fact, path, placeholder));
    }

    public List<GroupMembers<List<String>, CarriedRow>> groupChildren(List<CarriedRow> children) {
        return engine.groupBy(children, CarriedRow::parentPath);
    }

    public Group aggregateFacts(Level level, GroupMembers<List<String>, FactRow> members) {
        GroupAccumulator accumulator = GroupAccumulator.ofFacts(
                members.members(), level.additiveMeasures(), level.carriedMeasures(), engine);
        return new Group(members.key(), accumulator, computer.computeAll(level.metrics(), accumulator), List.of());
    }

    /**
     * Sorts the children into {@code childLevel}'s sibling order, then folds their accumulators into the
     * group's. Carried sequences are concatenated in that order.
     */
    public Group aggregateChildren(Level level, Level childLevel, GroupMembers<List<String>, CarriedRow> members) {
        List<CarriedRow> ordered = new ArrayList<>(members.members());
        ordered.sort(childLevel.ordering().<CarriedRow>comparator(
                CarriedRow::numericMetric, CarriedRow::dimensionValue));
        List<GroupAccumulator> parts = new ArrayList<>(ordered.size());
        for (CarriedRow child : ordered) {
            parts.add(child.accumulator());
        }
        GroupAccumulator accumulator =
                GroupAccumulator.merge(parts, level.additiveMeasures(), level.carriedMeasures(), engine);
        return new Group(members.key(), accumulator, computer.computeAll(level.metrics(), accumulator), ordered);
    }

    private static List<String> pathOf(FactRow fact, List<DimensionSpec> path, String placeholder) {
        List<String> values = new ArrayList<>(path.size());
        for (DimensionSpec dimension : path) {
            String value = fact.dimension(dimension.column());
            values.add(value == null ? placeholder : value);
        }
        return List.copyOf(values);
    }
}
