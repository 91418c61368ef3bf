package com.treeroll.service.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Identifies a row of the report tree. {@code value} is set only for {@link Kind#DIMENSION_VALUE} rows;
 * the root and the synthesized remainder row never carry one.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record RowKey(Kind kind, @JsonProperty("ref_id") String refId, String value, String label) {

    public enum Kind {
        ROOT_TOTAL("root_total"),
        DIMENSION_VALUE("dimension_value"),
        TOTAL_OTHER("total_other");

        private final String wireName;

        Kind(String wireName) {
            this.wireName = wireName;
        }

        @JsonValue
        public String wireName() {
            return wireName;
        }
    }

    public RowKey {
        if (kind == null) {
            throw new IllegalArgumentException("row key kind is required");
        }
        if (refId == null || refId.isBlank()) {
            throw new IllegalArgumentException("row key ref_id is required");
        }
        if (kind == Kind.DIMENSION_VALUE && value == null) {
            throw new IllegalArgumentException("dimension_value key for '" + refId + "' must carry a value");
        }
        if (kind != Kind.DIMENSION_VALUE && value != null) {
            throw new IllegalArgumentException(kind.wireName() + " key for '" + refId + "' must not carry a value");
        }
    }

    public static RowKey root(String refId, String label) {
        return new RowKey(Kind.ROOT_TOTAL, refId, null, label);
    }

    public static RowKey dimension(String dimId, String value, String label) {
        return new RowKey(Kind.DIMENSION_VALUE, dimId, value, label);
    }

    public static RowKey other(String dimId, String label) {
        return new RowKey(Kind.TOTAL_OTHER, dimId, null, label);
    }
}
