package com.treeroll.service.core.hierarchy;

import com.treeroll.service.core.model.WithValues;
import java.math.BigDecimal;
import java.util.Comparator;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Sibling order of one level: by a metric (highest or lowest first, nulls last) when one is set, then by
 * the row's dimension value as the tie-break.
 */
public record RowOrdering(String metricId, WithValues withValues, TieBreak tieBreak) {

    public RowOrdering {
        withValues = withValues == null ? WithValues.HIGHEST : withValues;
        tieBreak = tieBreak == null ? TieBreak.VALUE_ASC : tieBreak;
    }

    public static RowOrdering byValue(TieBreak tieBreak) {
        return new RowOrdering(null, WithValues.HIGHEST, tieBreak);
    }

    public boolean byMetric() {
        return metricId != null;
    }

    public <T> Comparator<T> comparator(
            BiFunction<T, String, BigDecimal> metricOf, Function<T, String> dimensionValueOf) {
        Comparator<String> valueOrder =
                tieBreak == TieBreak.VALUE_ASC ? Comparator.naturalOrder() : Comparator.reverseOrder();
        Comparator<T> secondary = Comparator.comparing(dimensionValueOf, Comparator.nullsLast(valueOrder));
        if (metricId == null) {
            return secondary;
        }
        Comparator<BigDecimal> metricOrder =
                withValues == WithValues.HIGHEST ? Comparator.reverseOrder() : Comparator.naturalOrder();
        Comparator<T> primary =
                Comparator.comparing(row -> metricOf.apply(row, metricId), Comparator.nullsLast(metricOrder));
        return primary.thenComparing(secondary);
    }
}
