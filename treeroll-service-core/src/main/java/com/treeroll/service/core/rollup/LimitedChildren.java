package com.treeroll.service.core.rollup;

import com.treeroll.service.core.model.LimitSpec;
import com.treeroll.service.core.model.ReportRow;
import java.util.List;

/** Children of a group after top-N limiting; {@code limit} is null when nothing was cut. */
public record LimitedChildren(List<ReportRow> rows, LimitSpec limit) {

    public LimitedChildren {
        rows = List.copyOf(rows);
    }

    public static LimitedChildren none() {
        return new LimitedChildren(List.of(), null);
    }
}
