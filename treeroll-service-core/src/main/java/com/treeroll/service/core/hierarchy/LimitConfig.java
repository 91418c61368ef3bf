package com.treeroll.service.core.hierarchy;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.treeroll.service.core.model.WithValues;

/** Top-N limit applied to the rows of one level inside each parent group. */
public record LimitConfig(
        @JsonProperty("kept_n") int keptN,
        @JsonProperty("with_values") WithValues withValues,
        @JsonProperty("ranking_metric_id") String rankingMetricId) {

    public LimitConfig {
        withValues = withValues == null ? WithValues.HIGHEST : withValues;
    }
}
