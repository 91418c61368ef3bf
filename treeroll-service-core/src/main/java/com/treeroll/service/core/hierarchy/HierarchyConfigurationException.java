package com.treeroll.service.core.hierarchy;

import java.util.List;

/** A hierarchy specification was rejected before execution. Carries every problem found. */
public class HierarchyConfigurationException extends IllegalArgumentException {
    private final String hierarchyId;
    private final List<String> problems;

    public HierarchyConfigurationException(String hierarchyId, List<String> problems) {
        super("Invalid hierarchy '" + hierarchyId + "': " + String.join("; ", problems));
        this.hierarchyId = hierarchyId;
        this.problems = List.copyOf(problems);
    }

    public String hierarchyId() {
        return hierarchyId;
    }

    public List<String> problems() {
        return problems;
    }
}
