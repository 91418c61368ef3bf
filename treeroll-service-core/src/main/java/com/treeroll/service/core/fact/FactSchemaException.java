package com.treeroll.service.core.fact;

import java.util.List;

/** The fact table lacks columns the hierarchy or its metrics reference. */
public class FactSchemaException extends IllegalArgumentException {
    private final List<String> missingDimensions;
    private final List<String> missingMeasures;

    public FactSchemaException(List<String> missingDimensions, List<String> missingMeasures) {
        super(buildMessage(missingDimensions, missingMeasures));
        this.missingDimensions = missingDimensions == null ? List.of() : List.copyOf(missingDimensions);
        this.missingMeasures = missingMeasures == null ? List.of() : List.copyOf(missingMeasures);
    }

    public List<String> missingDimensions() {
        return missingDimensions;
    }

    public List<String> missingMeasures() {
        return missingMeasures;
    }

    private static String buildMessage(List<String> dimensions, List<String> measures) {
        StringBuilder sb = new StringBuilder("Fact table is missing columns:");
        if (dimensions != null && !dimensions.isEmpty()) {
            sb.append(" dimensions=").append(dimensions);
        }
        if (measures != null && !measures.isEmpty()) {
            sb.append(" measures=").append(measures);
        }
        return sb.toString();
    }
}
