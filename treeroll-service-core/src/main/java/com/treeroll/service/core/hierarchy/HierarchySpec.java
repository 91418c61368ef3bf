package com.treeroll.service.core.hierarchy;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Declarative hierarchy supplied by the caller. {@code levels} run from the leaf breakdown to the root;
 * the last level is the root aggregate and names no dimension.
 */
public record HierarchySpec(
        String id, String label, List<LevelSpec> levels, @JsonProperty("tie_break") TieBreak tieBreak) {

    public HierarchySpec {
        levels = levels == null ? List.of() : List.copyOf(levels);
        tieBreak = tieBreak == null ? TieBreak.VALUE_ASC : tieBreak;
    }

    public record LevelSpec(
            @JsonProperty("dim_id") String dimId, List<String> metrics, LimitConfig limit, OrderConfig order) {

        public LevelSpec {
            metrics = metrics == null ? List.of() : List.copyOf(metrics);
        }

        public static LevelSpec root(List<String> metrics) {
            return new LevelSpec(null, metrics, null, null);
        }

        public static LevelSpec of(String dimId, List<String> metrics) {
            return new LevelSpec(dimId, metrics, null, null);
        }

        public LevelSpec withLimit(LimitConfig limit) {
            return new LevelSpec(dimId, metrics, limit, order);
        }

        public LevelSpec withOrder(OrderConfig order) {
            return new LevelSpec(dimId, metrics, limit, order);
        }
    }
}
