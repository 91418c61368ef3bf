package com.treeroll.service.core.engine;

import java.math.BigDecimal;
import java.util.List;
import java.util.function.Function;

/**
 * Execution primitives the rollup relies on. Any row or columnar engine able to group rows, aggregate a
 * numeric column and move value sequences between groupings can back the rollup.
 *
 * <p>Null values are absent everywhere: they are skipped by the aggregates and never materialized.
 */
public interface TabularEngine {

    /** Groups rows by a computed key, preserving first-seen key order and row order within a group. */
    <T, K> List<GroupMembers<K, T>> groupBy(List<T> rows, Function<? super T, ? extends K> key);

    BigDecimal sum(List<BigDecimal> values);

    long count(List<BigDecimal> values);

    /**
     * Exact percentile with linear interpolation between the closest ranks.
     *
     * @return null when there are no values
     */
    BigDecimal percentile(List<BigDecimal> values, double percentile);

    default BigDecimal median(List<BigDecimal> values) {
        return percentile(values, 0.5d);
    }

    /** Materializes one column of a group's rows, dropping nulls. */
    <T> List<BigDecimal> collect(List<T> rows, Function<? super T, BigDecimal> column);

    /** Flattens per-group sequences into one, in the given order. */
    List<BigDecimal> concat(List<List<BigDecimal>> sequences);
}
