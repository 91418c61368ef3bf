package com.treeroll.service.core.engine;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.springframework.stereotype.Component;

/** Heap-backed engine over plain lists. */
@Component
public class InMemoryTabularEngine implements TabularEngine {

    @Override
    public <T, K> List<GroupMembers<K, T>> groupBy(List<T> rows, Function<? super T, ? extends K> key) {
        Map<K, List<T>> groups = new LinkedHashMap<>();
        for (T row : rows) {
            groups.computeIfAbsent(key.apply(row), k -> new ArrayList<>()).add(row);
        }
        List<GroupMembers<K, T>> out = new ArrayList<>(groups.size());
        for (Map.Entry<K, List<T>> entry : groups.entrySet()) {
            out.add(new GroupMembers<>(entry.getKey(), entry.getValue()));
        }
        return out;
    }

    @Override
    public BigDecimal sum(List<BigDecimal> values) {
        BigDecimal total = BigDecimal.ZERO;
        for (BigDecimal value : values) {
            if (value != null) {
                total = total.add(value);
            }
        }
        return total;
    }

    @Override
    public long count(List<BigDecimal> values) {
        long count = 0L;
        for (BigDecimal value : values) {
            if (value != null) {
                count++;
            }
        }
        return count;
    }

    @Override
    public BigDecimal percentile(List<BigDecimal> values, double percentile) {
        if (percentile < 0.0d || percentile > 1.0d) {
            throw new IllegalArgumentException("percentile must be within [0, 1], got " + percentile);
        }
        List<BigDecimal> sorted = new ArrayList<>(values.size());
        for (BigDecimal value : values) {
            if (value != null) {
                sorted.add(value);
            }
        }
        if (sorted.isEmpty()) {
            return null;
        }
        sorted.sort(BigDecimal::compareTo);
        BigDecimal rank = BigDecimal.valueOf(percentile).multiply(BigDecimal.valueOf(sorted.size() - 1L));
        int lower = rank.setScale(0, RoundingMode.FLOOR).intValueExact();
        BigDecimal fraction = rank.subtract(BigDecimal.valueOf(lower));
        BigDecimal low = sorted.get(lower);
        if (fraction.signum() == 0 || lower + 1 >= sorted.size()) {
            return low;
        }
        BigDecimal high = sorted.get(lower + 1);
        return low.add(high.subtract(low).multiply(fraction));
    }

    @Override
    public <T> List<BigDecimal> collect(List<T> rows, Function<? super T, BigDecimal> column) {
        List<BigDecimal> out = new ArrayList<>(rows.size());
        for (T row : rows) {
            BigDecimal value = column.apply(row);
            if (value != null) {
                out.add(value);
            }
        }
        return out;
    }

    @Override
    public List<BigDecimal> concat(List<List<BigDecimal>> sequences) {
        int size = 0;
        for (List<BigDecimal> sequence : sequences) {
            size += sequence.size();
        }
        List<BigDecimal> out = new ArrayList<>(size);
        for (List<BigDecimal> sequence : sequences) {
            out.addAll(sequence);
        }
        return out;
    }
}
