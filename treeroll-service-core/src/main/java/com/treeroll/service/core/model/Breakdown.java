package com.treeroll.service.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonInclude(JsonInclude.Include.ALWAYS)
public record Breakdown(By by, LimitSpec limit, List<ReportRow> children) {

    public static final String DIMENSION_VALUES = "dimension_values";

    public Breakdown {
        if (by == null) {
            throw new IllegalArgumentException("breakdown.by is required");
        }
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static Breakdown byDimension(String dimId, LimitSpec limit, List<ReportRow> children) {
        return new Breakdown(new By(DIMENSION_VALUES, dimId), limit, children);
    }

    @JsonInclude(JsonInclude.Include.ALWAYS)
    public record By(String how, @JsonProperty("dim_id") String dimId) {}
}
