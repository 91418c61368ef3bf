package com.treeroll.service.core.fact;

public class InMemoryFactSource implements FactSource {
    private final FactTable table;

    public InMemoryFactSource(FactTable table) {
        if (table == null) {
            throw new IllegalArgumentException("fact table is required");
        }
        this.table = table;
    }

    @Override
    public FactTable read() {
        return table;
    }

    @Override
    public String describe() {
        return "in-memory(" + table.size() + " rows)";
    }
}
