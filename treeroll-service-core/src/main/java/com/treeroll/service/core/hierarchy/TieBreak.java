package com.treeroll.service.core.hierarchy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Secondary sort key applied when the ranking metric is equal: the row's own dimension value. */
public enum TieBreak {
    VALUE_ASC,
    VALUE_DESC;

    @JsonCreator
    public static TieBreak fromConfigValue(String value) {
        if (value == null || value.isBlank()) {
            return VALUE_ASC;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "value_asc", "asc" -> VALUE_ASC;
            case "value_desc", "desc" -> VALUE_DESC;
            default -> throw new IllegalArgumentException("Unsupported tie_break: " + value);
        };
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
