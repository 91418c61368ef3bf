package com.treeroll.service.core.hierarchy;

import java.util.List;

/** Validated, resolved hierarchy: levels ordered leaf to root, the root last. */
public record HierarchyPlan(String id, String label, List<Level> levels) {

    public HierarchyPlan {
        levels = List.copyOf(levels);
        if (levels.isEmpty() || !levels.get(levels.size() - 1).isRoot()) {
            throw new IllegalArgumentException("hierarchy plan must end with the root level");
        }
    }

    public Level root() {
        return levels.get(levels.size() - 1);
    }

    /** The level whose rows form the breakdown of {@code level}, or null for the leaf. */
    public Level childOf(Level level) {
        return level.index() == 0 ? null : levels.get(level.index() - 1);
    }

    /** Dimensions of every non-root level, leaf first. */
    public List<DimensionSpec> path() {
        return levels.subList(0, levels.size() - 1).stream()
                .map(Level::dimension)
                .toList();
    }

    public int depth() {
        return levels.size();
    }
}
