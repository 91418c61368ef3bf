package com.treeroll.service.core.hierarchy;

/** A dimension id and the fact column holding its values. */
public record DimensionSpec(String id, String column) {

    public DimensionSpec {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Dimension id is required");
        }
        column = column == null || column.isBlank() ? id : column.trim();
    }

    public static DimensionSpec of(String id) {
        return new DimensionSpec(id, id);
    }
}
