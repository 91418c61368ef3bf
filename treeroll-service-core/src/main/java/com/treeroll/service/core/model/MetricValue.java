package com.treeroll.service.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One computed metric on a report row. Scalar metrics populate {@code value}, sampled series populate
 * {@code values}; the two are never set together. A scalar whose result is undefined (mean of an empty
 * group, median of no values) leaves both null.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record MetricValue(@JsonProperty("metric_id") String metricId, String value, List<String> values) {

    public MetricValue {
        if (metricId == null || metricId.isBlank()) {
            throw new IllegalArgumentException("metric_id is required");
        }
        if (value != null && values != null) {
            throw new IllegalArgumentException("metric '" + metricId + "' cannot carry both value and values");
        }
        values = values == null ? null : Collections.unmodifiableList(new ArrayList<>(values));
    }

    public static MetricValue scalar(String metricId, String value) {
        return new MetricValue(metricId, value, null);
    }

    public static MetricValue series(String metricId, List<String> values) {
        return new MetricValue(metricId, null, values == null ? List.of() : values);
    }

    public boolean hasSeries() {
        return values != null;
    }
}
