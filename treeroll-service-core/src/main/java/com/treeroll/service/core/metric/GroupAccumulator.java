package com.treeroll.service.core.metric;

import com.treeroll.service.core.engine.TabularEngine;
import com.treeroll.service.core.fact.FactRow;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-group accumulator buffers: sum and non-null count per additive measure, and the flattened sequence
 * of leaf values per carried measure. Built from facts at the leaf and merged (never nested) above it.
 */
public final class GroupAccumulator {
    private final Map<String, BigDecimal> sums;
    private final Map<String, Long> counts;
    private final Map<String, List<BigDecimal>> carried;

    private GroupAccumulator(
            Map<String, BigDecimal> sums, Map<String, Long> counts, Map<String, List<BigDecimal>> carried) {
        this.sums = Collections.unmodifiableMap(sums);
        this.counts = Collections.unmodifiableMap(counts);
        this.carried = Collections.unmodifiableMap(carried);
    }

    public static GroupAccumulator ofFacts(
            List<FactRow> rows, Set<String> additiveMeasures, Set<String> carriedMeasures, TabularEngine engine) {
        Map<String, BigDecimal> sums = new HashMap<>();
        Map<String, Long> counts = new HashMap<>();
        for (String measure : additiveMeasures) {
            List<BigDecimal> values = engine.collect(rows, row -> row.measure(measure));
            sums.put(measure, engine.sum(values));
            counts.put(measure, engine.count(values));
        }
        Map<String, List<BigDecimal>> sequences = new HashMap<>();
        for (String measure : carriedMeasures) {
            sequences.put(measure, Collections.unmodifiableList(engine.collect(rows, row -> row.measure(measure))));
        }
        return new GroupAccumulator(sums, counts, sequences);
    }

    /**
     * Merges child accumulators in the given order. Only the requested measures are kept, so sequences no
     * longer needed further up are released with the children.
     */
    public static GroupAccumulator merge(
            Collection<GroupAccumulator> parts,
            Set<String> additiveMeasures,
            Set<String> carriedMeasures,
            TabularEngine engine) {
        Map<String, BigDecimal> sums = new HashMap<>();
        Map<String, Long> counts = new HashMap<>();
        for (String measure : additiveMeasures) {
            List<BigDecimal> partials = new ArrayList<>(parts.size());
            long count = 0L;
            for (GroupAccumulator part : parts) {
                partials.add(part.sum(measure));
                count += part.count(measure);
            }
            sums.put(measure, engine.sum(partials));
            counts.put(measure, count);
        }
        Map<String, List<BigDecimal>> sequences = new HashMap<>();
        for (String measure : carriedMeasures) {
            List<List<BigDecimal>> partials = new ArrayList<>(parts.size());
            for (GroupAccumulator part : parts) {
                partials.add(part.carried(measure));
            }
            sequences.put(measure, Collections.unmodifiableList(engine.concat(partials)));
        }
        return new GroupAccumulator(sums, counts, sequences);
    }

    public static GroupAccumulator empty(Set<String> additiveMeasures, Set<String> carriedMeasures) {
        Map<String, BigDecimal> sums = new HashMap<>();
        Map<String, Long> counts = new HashMap<>();
        for (String measure : additiveMeasures) {
            sums.put(measure, BigDecimal.ZERO);
            counts.put(measure, 0L);
        }
        Map<String, List<BigDecimal>> sequences = new HashMap<>();
        for (String measure : carriedMeasures) {
            sequences.put(measure, List.of());
        }
        return new GroupAccumulator(sums, counts, sequences);
    }

    public BigDecimal sum(String measure) {
        BigDecimal sum = sums.get(measure);
        if (sum == null) {
            throw new IllegalStateException("measure '" + measure + "' is not accumulated");
        }
        return sum;
    }

    public long count(String measure) {
        Long count = counts.get(measure);
        if (count == null) {
            throw new IllegalStateException("measure '" + measure + "' is not accumulated");
        }
        return count;
    }

    public List<BigDecimal> carried(String measure) {
        List<BigDecimal> sequence = carried.get(measure);
        if (sequence == null) {
            throw new IllegalStateException("measure '" + measure + "' is not carried");
        }
        return sequence;
    }
}
