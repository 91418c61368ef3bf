package com.treeroll.service.core.rollup;

import com.treeroll.service.core.metric.DecimalRenderer;
import com.treeroll.service.core.metric.GroupAccumulator;
import com.treeroll.service.core.model.MetricValue;
import com.treeroll.service.core.model.ReportRow;
import java.math.BigDecimal;
import java.util.List;

/**
 * A finished row of one level on its way to the next: the immutable report row plus what the parent level
 * still needs from it. {@code parentPath} holds the ancestor dimension values, nearest first; the
 * accumulator is dropped once the parent has merged it.
 */
public record CarriedRow(ReportRow row, String dimensionValue, List<String> parentPath, GroupAccumulator accumulator) {

    public CarriedRow {
        parentPath = List.copyOf(parentPath);
    }

    BigDecimal numericMetric(String metricId) {
        return row.metric(metricId).map(MetricValue::value).map(DecimalRenderer::parse).orElse(null);
    }
}
