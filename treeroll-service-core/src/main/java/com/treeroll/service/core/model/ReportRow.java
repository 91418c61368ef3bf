package com.treeroll.service.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.Optional;

/** Node of the report tree. Immutable once built; owned by its parent breakdown or by the caller for the root. */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record ReportRow(RowKey key, List<MetricValue> metrics, Breakdown breakdown) {

    public ReportRow {
        if (key == null) {
            throw new IllegalArgumentException("report row key is required");
        }
        metrics = metrics == null ? List.of() : List.copyOf(metrics);
    }

    public Optional<MetricValue> metric(String metricId) {
        for (MetricValue metric : metrics) {
            if (metric.metricId().equals(metricId)) {
                return Optional.of(metric);
            }
        }
        return Optional.empty();
    }

    public List<ReportRow> children() {
        return breakdown == null ? List.of() : breakdown.children();
    }
}
