package com.treeroll.service.core.config;

import java.util.concurrent.atomic.AtomicReference;
import org.springframework.stereotype.Component;

/**
 * In-memory snapshot of all rollup definitions. Readers see one consistent snapshot per call; reloads
 * replace it with a single reference swap.
 */
@Component
public class RollupRegistry {
    private final AtomicReference<RegistrySnapshot> ref = new AtomicReference<>(RegistrySnapshot.empty());

    public RegistrySnapshot current() {
        return ref.get();
    }

    public void swap(RegistrySnapshot next) {
        if (next == null) {
            throw new IllegalArgumentException("registry snapshot is required");
        }
        ref.set(next);
    }
}
