package com.treeroll.service.core.config.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Metric as written in a definitions file; kind and function are free-form until materialized. */
public record MetricDefinition(
        String id,
        String kind,
        String function,
        String measure,
        String denominator,
        Double percentile,
        @JsonProperty("sample_size") Integer sampleSize) {}
