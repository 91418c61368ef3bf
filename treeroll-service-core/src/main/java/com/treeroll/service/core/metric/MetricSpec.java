package com.treeroll.service.core.metric;

import java.util.List;

/**
 * Immutable description of a metric: which measure column it reads and how it is computed.
 * {@code denominator} is used by {@link MetricFunction#RATIO}, {@code percentile} by the full-grain
 * functions (a median is the 0.5 percentile), {@code sampleSize} by sampled series (null means the
 * configured default).
 */
public record MetricSpec(
        String id,
        MetricKind kind,
        MetricFunction function,
        String measure,
        String denominator,
        Double percentile,
        Integer sampleSize) {

    public MetricSpec {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Metric id is required");
        }
        if (function == null && kind == null) {
            throw new IllegalArgumentException("Metric '" + id + "' needs a kind or a function");
        }
        if (function == null) {
            function = MetricFunction.defaultFor(kind);
        }
        if (kind == null) {
            kind = function.kind();
        }
        if (function.kind() != kind) {
            throw new IllegalArgumentException(
                    "Metric '" + id + "' function " + function + " is not a " + kind + " function");
        }
        if (measure == null || measure.isBlank()) {
            throw new IllegalArgumentException("Metric '" + id + "' must reference a measure");
        }
        if (function == MetricFunction.RATIO && (denominator == null || denominator.isBlank())) {
            throw new IllegalArgumentException("Ratio metric '" + id + "' must reference a denominator measure");
        }
        if (function != MetricFunction.RATIO) {
            denominator = null;
        }
        if (function == MetricFunction.MEDIAN) {
            percentile = 0.5d;
        }
        if (function == MetricFunction.PERCENTILE) {
            if (percentile == null || percentile <= 0.0d || percentile >= 1.0d) {
                throw new IllegalArgumentException(
                        "Percentile metric '" + id + "' needs a percentile in (0, 1), got " + percentile);
            }
        }
        if (sampleSize != null && sampleSize <= 0) {
            throw new IllegalArgumentException("Metric '" + id + "' sample size must be positive");
        }
    }

    public static MetricSpec of(String id, MetricFunction function, String measure) {
        return new MetricSpec(id, function.kind(), function, measure, null, null, null);
    }

    /** Measure columns this metric reads. */
    public List<String> measures() {
        return denominator == null ? List.of(measure) : List.of(measure, denominator);
    }

    public boolean needsFullGrain() {
        return kind.needsFullGrain();
    }

    public boolean isRankable() {
        return kind != MetricKind.SAMPLED_SERIES;
    }
}
