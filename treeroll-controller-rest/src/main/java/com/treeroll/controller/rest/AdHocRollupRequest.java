package com.treeroll.controller.rest;

import com.treeroll.service.core.fact.FactRow;
import com.treeroll.service.core.hierarchy.HierarchySpec;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/** Body of an ad-hoc rollup: a hierarchy plus the fact rows to run it over. */
public record AdHocRollupRequest(
        @NotNull(message = "hierarchy is required") HierarchySpec hierarchy, @Valid List<@NotNull Fact> facts) {

    public record Fact(Map<String, String> dimensions, Map<String, BigDecimal> measures) {

        FactRow toFactRow() {
            return new FactRow(dimensions, measures);
        }
    }

    List<FactRow> factRows() {
        return facts == null ? List.of() : facts.stream().map(Fact::toFactRow).toList();
    }
}
