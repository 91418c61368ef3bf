package com.treeroll.service.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Describes a truncated breakdown: {@code keptN} of {@code fromTotalN} children were kept. */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record LimitSpec(
        String type,
        @JsonProperty("from_total_n") int fromTotalN,
        @JsonProperty("kept_n") int keptN,
        @JsonProperty("with_values") WithValues withValues,
        @JsonProperty("metric_id") String metricId) {

    public static final String METRIC_TOP_N = "metric_top_n";

    public LimitSpec {
        type = type == null ? METRIC_TOP_N : type;
        if (keptN <= 0) {
            throw new IllegalArgumentException("kept_n must be positive, got " + keptN);
        }
        if (keptN > fromTotalN) {
            throw new IllegalArgumentException("kept_n (" + keptN + ") exceeds from_total_n (" + fromTotalN + ")");
        }
        if (withValues == null) {
            throw new IllegalArgumentException("with_values is required");
        }
        if (metricId == null || metricId.isBlank()) {
            throw new IllegalArgumentException("metric_id is required");
        }
    }

    public static LimitSpec topN(int fromTotalN, int keptN, WithValues withValues, String metricId) {
        return new LimitSpec(METRIC_TOP_N, fromTotalN, keptN, withValues, metricId);
    }
}
