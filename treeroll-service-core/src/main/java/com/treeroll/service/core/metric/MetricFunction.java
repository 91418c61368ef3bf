package com.treeroll.service.core.metric;

import java.util.Locale;

public enum MetricFunction {
    SUM(MetricKind.ADDITIVE),
    COUNT(MetricKind.ADDITIVE),
    MEAN(MetricKind.DERIVED),
    RATIO(MetricKind.DERIVED),
    MEDIAN(MetricKind.FULL_GRAIN),
    PERCENTILE(MetricKind.FULL_GRAIN),
    SAMPLE(MetricKind.SAMPLED_SERIES);

    private final MetricKind kind;

    MetricFunction(MetricKind kind) {
        this.kind = kind;
    }

    public MetricKind kind() {
        return kind;
    }

    public static MetricFunction fromConfigValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Metric function is required");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "sum" -> SUM;
            case "count" -> COUNT;
            case "mean", "avg", "average" -> MEAN;
            case "ratio" -> RATIO;
            case "median" -> MEDIAN;
            case "percentile", "quantile" -> PERCENTILE;
            case "sample", "spark", "sparkline" -> SAMPLE;
            default -> throw new IllegalArgumentException("Unsupported metric function: " + value);
        };
    }

    /** Function used when a definition names only a kind. */
    public static MetricFunction defaultFor(MetricKind kind) {
        return switch (kind) {
            case ADDITIVE -> SUM;
            case DERIVED -> MEAN;
            case FULL_GRAIN -> MEDIAN;
            case SAMPLED_SERIES -> SAMPLE;
        };
    }
}
