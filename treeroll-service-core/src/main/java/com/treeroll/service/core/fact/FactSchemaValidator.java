package com.treeroll.service.core.fact;

import com.treeroll.service.core.hierarchy.DimensionSpec;
import com.treeroll.service.core.hierarchy.HierarchyPlan;
import com.treeroll.service.core.hierarchy.Level;
import com.treeroll.service.core.metric.MetricSpec;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/** Checks that a fact table carries every column a plan reads. */
@Component
public class FactSchemaValidator {

    public void validate(HierarchyPlan plan, FactSchema schema) {
        FactSchema required = requiredSchema(plan);
        List<String> missingDimensions = new ArrayList<>();
        for (String column : required.dimensionColumns()) {
            if (!schema.hasDimension(column)) {
                missingDimensions.add(column);
            }
        }
        List<String> missingMeasures = new ArrayList<>();
        for (String measure : required.measureColumns()) {
            if (!schema.hasMeasure(measure)) {
                missingMeasures.add(measure);
            }
        }
        if (!missingDimensions.isEmpty() || !missingMeasures.isEmpty()) {
            throw new FactSchemaException(missingDimensions, missingMeasures);
        }
    }

    /** The columns a plan reads: mapped dimension columns leaf first, then measures in level order. */
    public FactSchema requiredSchema(HierarchyPlan plan) {
        Set<String> dimensions = new LinkedHashSet<>();
        for (DimensionSpec dimension : plan.path()) {
            dimensions.add(dimension.column());
        }
        Set<String> measures = new LinkedHashSet<>();
        for (Level level : plan.levels()) {
            for (MetricSpec metric : level.metrics()) {
                measures.addAll(metric.measures());
            }
        }
        return new FactSchema(List.copyOf(dimensions), List.copyOf(measures));
    }
}
