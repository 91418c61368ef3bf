package com.treeroll.service.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Which end of a ranking is kept: the highest metric values first, or the lowest. */
public enum WithValues {
    HIGHEST,
    LOWEST;

    @JsonCreator
    public static WithValues fromConfigValue(String value) {
        if (value == null || value.isBlank()) {
            return HIGHEST;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "highest", "desc", "descending" -> HIGHEST;
            case "lowest", "asc", "ascending" -> LOWEST;
            default -> throw new IllegalArgumentException("Unsupported with_values: " + value);
        };
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
