package com.treeroll.service.core.rollup;

import com.treeroll.service.core.hierarchy.HierarchyPlan;
import com.treeroll.service.core.hierarchy.Level;
import com.treeroll.service.core.model.Breakdown;
import com.treeroll.service.core.model.ReportRow;
import com.treeroll.service.core.model.RowKey;
import org.springframework.stereotype.Component;

/** Builds the {@code root_total} row from the single group of the outermost level. */
@Component
public class RootFinalizer {

    public ReportRow finalizeRoot(HierarchyPlan plan, Group group, LimitedChildren children) {
        if (children.limit() != null) {
            throw new IllegalStateException("root breakdown of '" + plan.id() + "' must not be limited");
        }
        Level child = plan.childOf(plan.root());
        Breakdown breakdown = child == null ? null : Breakdown.byDimension(child.dimensionId(), null, children.rows());
        return new ReportRow(RowKey.root(plan.id(), plan.label()), group.metrics(), breakdown);
    }
}
