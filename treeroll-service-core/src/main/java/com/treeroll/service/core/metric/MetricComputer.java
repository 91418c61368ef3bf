package com.treeroll.service.core.metric;

import com.treeroll.service.core.config.RollupProperties;
import com.treeroll.service.core.engine.TabularEngine;
import com.treeroll.service.core.model.MetricValue;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/** Computes metric values from one group's accumulators. */
@Component
public class MetricComputer {
    private final TabularEngine engine;
    private final RollupProperties properties;

    public MetricComputer(TabularEngine engine, RollupProperties properties) {
        this.engine = engine;
        this.properties = properties;
    }

    public List<MetricValue> computeAll(List<MetricSpec> specs, GroupAccumulator accumulator) {
        List<MetricValue> out = new ArrayList<>(specs.size());
        for (MetricSpec spec : specs) {
            out.add(compute(spec, accumulator));
        }
        return out;
    }

    public MetricValue compute(MetricSpec spec, GroupAccumulator accumulator) {
        return switch (spec.function()) {
            case SUM -> MetricValue.scalar(spec.id(), DecimalRenderer.render(accumulator.sum(spec.measure())));
            case COUNT -> MetricValue.scalar(spec.id(), Long.toString(accumulator.count(spec.measure())));
            case MEAN -> MetricValue.scalar(
                    spec.id(),
                    divide(accumulator.sum(spec.measure()), BigDecimal.valueOf(accumulator.count(spec.measure()))));
            case RATIO -> MetricValue.scalar(
                    spec.id(), divide(accumulator.sum(spec.measure()), accumulator.sum(spec.denominator())));
            case MEDIAN, PERCENTILE -> MetricValue.scalar(
                    spec.id(),
                    DecimalRenderer.render(engine.percentile(accumulator.carried(spec.measure()), spec.percentile())));
            case SAMPLE -> MetricValue.series(spec.id(), sample(accumulator.carried(spec.measure()), sampleSize(spec)));
        };
    }

    private int sampleSize(MetricSpec spec) {
        return spec.sampleSize() != null
                ? spec.sampleSize()
                : properties.getRollup().getDefaultSampleSize();
    }

    private static String divide(BigDecimal numerator, BigDecimal denominator) {
        if (denominator.signum() == 0) {
            return null;
        }
        return DecimalRenderer.render(numerator.divide(denominator, MathContext.DECIMAL64));
    }

    /** First {@code size} distinct values of the carried sequence, in sequence order. */
    private static List<String> sample(List<BigDecimal> sequence, int size) {
        Set<String> distinct = new LinkedHashSet<>();
        for (BigDecimal value : sequence) {
            if (distinct.size() >= size) {
                break;
            }
            distinct.add(DecimalRenderer.render(value));
        }
        return List.copyOf(distinct);
    }
}
