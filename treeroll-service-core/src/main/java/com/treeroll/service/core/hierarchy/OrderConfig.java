package com.treeroll.service.core.hierarchy;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.treeroll.service.core.model.WithValues;

/** Sibling order for an unlimited level. */
public record OrderConfig(
        @JsonProperty("metric_id") String metricId, @JsonProperty("with_values") WithValues withValues) {

    public OrderConfig {
        withValues = withValues == null ? WithValues.HIGHEST : withValues;
    }
}
