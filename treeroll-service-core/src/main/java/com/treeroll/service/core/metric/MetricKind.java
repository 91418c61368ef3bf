package com.treeroll.service.core.metric;

import java.util.Locale;

public enum MetricKind {
    /** Aggregable by summing partial sums. */
    ADDITIVE,
    /** Recomputed at every level from that level's additive accumulators. */
    DERIVED,
    /** Needs every leaf value under the group. */
    FULL_GRAIN,
    /** Bounded sample of the leaf values, reported as a series. */
    SAMPLED_SERIES;

    public static MetricKind fromConfigValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Metric kind is required");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT).replace('-', '_')) {
            case "additive" -> ADDITIVE;
            case "derived" -> DERIVED;
            case "full_grain" -> FULL_GRAIN;
            case "sampled_series" -> SAMPLED_SERIES;
            default -> throw new IllegalArgumentException("Unsupported metric kind: " + value);
        };
    }

    public boolean needsFullGrain() {
        return this == FULL_GRAIN || this == SAMPLED_SERIES;
    }
}
