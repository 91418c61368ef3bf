package com.treeroll.service.core.fact;

/** Supplies the fact table for one rollup run. Called once per run, before any aggregation. */
public interface FactSource {

    FactTable read();

    /** Short human-readable description used in logs. */
    default String describe() {
        return getClass().getSimpleName();
    }
}
