package com.treeroll.service.core.rollup;

import com.treeroll.service.core.catalog.MetricCatalog;
import com.treeroll.service.core.hierarchy.Level;
import com.treeroll.service.core.model.Breakdown;
import com.treeroll.service.core.model.ReportRow;
import com.treeroll.service.core.model.RowKey;
import java.util.List;
import org.springframework.stereotype.Component;

/** Turns a non-root group into its report row and the carried state the next level groups on. */
@Component
public class TreeAssembler {
    private final MetricCatalog catalog;

    public TreeAssembler(MetricCatalog catalog) {
        this.catalog = catalog;
    }

    public CarriedRow assemble(Level level, Level childLevel, Group group, LimitedChildren children) {
        if (level.isRoot()) {
            throw new IllegalArgumentException("root level is finalized by RootFinalizer");
        }
        List<String> path = group.path();
        String dimId = level.dimensionId();
        String value = path.get(0);
        RowKey key = RowKey.dimension(dimId, value, catalog.valueLabel(dimId, value));
        Breakdown breakdown = childLevel == null
                ? null
                : Breakdown.byDimension(childLevel.dimensionId(), children.limit(), children.rows());
        ReportRow row = new ReportRow(key, group.metrics(), breakdown);
        return new CarriedRow(row, value, path.subList(1, path.size()), group.accumulator());
    }
}
