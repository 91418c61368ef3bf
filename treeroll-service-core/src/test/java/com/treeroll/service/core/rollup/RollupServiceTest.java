package com.treeroll.service.core.rollup;

import static com.treeroll.service.core.rollup.RollupFixtures.ALL_SCALARS;
import static com.treeroll.service.core.rollup.RollupFixtures.COUNT;
import static com.treeroll.service.core.rollup.RollupFixtures.MEAN;
import static com.treeroll.service.core.rollup.RollupFixtures.MEDIAN;
import static com.treeroll.service.core.rollup.RollupFixtures.P90;
import static com.treeroll.service.core.rollup.RollupFixtures.SPARK;
import static com.treeroll.service.core.rollup.RollupFixtures.SUM;
import static com.treeroll.service.core.rollup.RollupFixtures.child;
import static com.treeroll.service.core.rollup.RollupFixtures.childValues;
import static com.treeroll.service.core.rollup.RollupFixtures.fact;
import static com.treeroll.service.core.rollup.RollupFixtures.referenceTitles;
import static com.treeroll.service.core.rollup.RollupFixtures.titlesByType;
import static com.treeroll.service.core.rollup.RollupFixtures.value;
import static com.treeroll.service.core.rollup.RollupFixtures.values;
import static com.treeroll.service.core.rollup.RollupFixtures.walk;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.treeroll.service.core.catalog.CatalogEntry;
import com.treeroll.service.core.fact.FactRow;
import com.treeroll.service.core.fact.FactSchema;
import com.treeroll.service.core.fact.FactSchemaException;
import com.treeroll.service.core.fact.FactSource;
import com.treeroll.service.core.fact.FactTable;
import com.treeroll.service.core.fact.InMemoryFactSource;
import com.treeroll.service.core.hierarchy.HierarchyConfigurationException;
import com.treeroll.service.core.hierarchy.HierarchySpec;
import com.treeroll.service.core.hierarchy.HierarchySpec.LevelSpec;
import com.treeroll.service.core.hierarchy.OrderConfig;
import com.treeroll.service.core.hierarchy.TieBreak;
import com.treeroll.service.core.model.MetricValue;
import com.treeroll.service.core.model.ReportRow;
import com.treeroll.service.core.model.RowKey;
import com.treeroll.service.core.model.WithValues;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RollupServiceTest {

    private RollupFixtures.Harness harness;

    @BeforeEach
    void setUp() {
        harness = RollupFixtures.harness();
    }

    @AfterEach
    void tearDown() {
        harness.pool().stop();
    }

    @Test
    void referenceScenarioProducesExpectedTotals() {
        ReportRow root = harness.service().rollup(titlesByType(ALL_SCALARS), referenceTitles());

        assertThat(root.key()).isEqualTo(RowKey.root("titles", "All titles"));
        assertThat(root.breakdown().limit()).isNull();
        assertThat(root.breakdown().by().dimId()).isEqualTo("type");
        assertThat(value(root, SUM)).isEqualTo("4950");
        assertThat(value(root, COUNT)).isEqualTo("8");
        assertThat(childValues(root)).containsExactly("Movie", "TV Show");

        ReportRow movie = child(root, "Movie");
        ReportRow tv = child(root, "TV Show");
        assertThat(value(movie, SUM)).isEqualTo("450");
        assertThat(value(tv, SUM)).isEqualTo("4500");
        assertThat(movie.breakdown().by().dimId()).isEqualTo("rating");
        assertThat(value(child(movie, "G"), SUM)).isEqualTo("250");
        assertThat(value(child(tv, "TV-PG"), SUM)).isEqualTo("2000");

        ReportRow leaf = child(child(movie, "G"), "s1");
        assertThat(leaf.key()).isEqualTo(RowKey.dimension("show_id", "s1", null));
        assertThat(leaf.breakdown()).isNull();
        assertThat(value(leaf, SUM)).isEqualTo("150");
    }

    @Test
    void explodingTreeRecoversEveryFactRow() {
        ReportRow root = harness.service().rollup(titlesByType(List.of(SUM)), referenceTitles());

        List<Map<String, String>> exploded = new ArrayList<>();
        explode(root, new LinkedHashMap<>(), exploded);

        Set<Map<String, String>> expected = new HashSet<>();
        for (FactRow fact : referenceTitles().rows()) {
            Map<String, String> row = new LinkedHashMap<>(fact.dimensions());
            row.put("duration", fact.measure("duration").toPlainString());
            expected.add(row);
        }
        assertThat(exploded).hasSize(8);
        assertThat(new HashSet<>(exploded)).isEqualTo(expected);
    }

    @Test
    void additiveMetricsAreConservedAtEveryLevel() {
        ReportRow root = harness.service().rollup(titlesByType(ALL_SCALARS), referenceTitles());

        AtomicInteger checked = new AtomicInteger();
        walk(root, row -> {
            if (row.children().isEmpty()) {
                return;
            }
            BigDecimal childSum = BigDecimal.ZERO;
            long childCount = 0L;
            for (ReportRow child : row.children()) {
                childSum = childSum.add(new BigDecimal(value(child, SUM)));
                childCount += Long.parseLong(value(child, COUNT));
            }
            assertThat(childSum).isEqualByComparingTo(value(row, SUM));
            assertThat(childCount).isEqualTo(Long.parseLong(value(row, COUNT)));
            checked.incrementAndGet();
        });
        assertThat(checked.get()).isEqualTo(7);
    }

    @Test
    void derivedMetricsAreRecomputedPerLevel() {
        ReportRow root = harness.service().rollup(titlesByType(ALL_SCALARS), referenceTitles());

        assertThat(value(child(root, "Movie"), MEAN)).isEqualTo("112.5");
        assertThat(value(child(root, "TV Show"), MEAN)).isEqualTo("1125");
        // 4950 / 8, not the mean of the two type means
        assertThat(value(root, MEAN)).isEqualTo("618.75");
    }

    @Test
    void fullGrainMetricsUseEveryLeafValue() {
        List<String> metrics = List.of(SUM, MEDIAN, P90);
        HierarchySpec spec = new HierarchySpec(
                "titles",
                null,
                List.of(
                        LevelSpec.of("show_id", metrics),
                        LevelSpec.of("rating", metrics),
                        LevelSpec.of("type", metrics),
                        LevelSpec.root(metrics)),
                null);

        ReportRow root = harness.service().rollup(spec, referenceTitles());

        assertThat(value(child(root, "Movie"), MEDIAN)).isEqualTo("100");
        assertThat(value(child(root, "TV Show"), MEDIAN)).isEqualTo("1000");
        // the median of the two type medians would be 550
        assertThat(value(root, MEDIAN)).isEqualTo("575");
        assertThat(value(root, P90)).isEqualTo("1150");
        assertThat(value(child(child(root, "Movie"), "G"), MEDIAN)).isEqualTo("125");
    }

    @Test
    void sampledSeriesFollowsTheCarriedOrderWithoutDuplicates() {
        List<String> metrics = List.of(SUM, SPARK);
        ReportRow root = harness.service().rollup(titlesByType(metrics), referenceTitles());

        MetricValue spark = root.metric(SPARK).orElseThrow();
        assertThat(spark.value()).isNull();
        assertThat(spark.values()).containsExactly("150", "100", "1500", "1000");
        assertThat(values(child(root, "Movie"), SPARK)).containsExactly("150", "100");
        assertThat(values(child(child(root, "TV Show"), "TV-G"), SPARK)).containsExactly("1500", "1000");
    }

    @Test
    void siblingsFollowConfiguredOrderWithValueTieBreak() {
        List<String> metrics = List.of(SUM);
        HierarchySpec spec = new HierarchySpec(
                "titles",
                null,
                List.of(
                        LevelSpec.of("show_id", metrics).withOrder(new OrderConfig(SUM, WithValues.LOWEST)),
                        LevelSpec.of("rating", metrics).withOrder(new OrderConfig(SUM, WithValues.HIGHEST)),
                        LevelSpec.of("type", metrics),
                        LevelSpec.root(metrics)),
                TieBreak.VALUE_DESC);

        ReportRow root = harness.service().rollup(spec, referenceTitles());

        assertThat(childValues(root)).containsExactly("TV Show", "Movie");
        ReportRow movie = child(root, "Movie");
        assertThat(childValues(movie)).containsExactly("G", "PG");
        assertThat(childValues(child(movie, "G"))).containsExactly("s2", "s1");
        // PG titles tie on duration; value_desc puts s4 first
        assertThat(childValues(child(movie, "PG"))).containsExactly("s4", "s3");
        assertThat(childValues(child(root, "TV Show"))).containsExactly("TV-G", "TV-PG");
    }

    @Test
    void catalogChangesLabelsButNeverValues() {
        ReportRow plain = harness.service().rollup(titlesByType(ALL_SCALARS), referenceTitles());

        harness.catalog(List.of(
                new CatalogEntry("type", "Show type", null, null, null, Map.of("Movie", "Movies"), null),
                new CatalogEntry(SUM, "Total duration", "h", "hours", "sparkbar", null, null)));
        ReportRow labelled = harness.service().rollup(titlesByType(ALL_SCALARS), referenceTitles());

        assertThat(child(labelled, "Movie").key().label()).isEqualTo("Movies");
        assertThat(child(plain, "Movie").key().label()).isNull();
        assertThat(metricsOf(labelled)).isEqualTo(metricsOf(plain));
    }

    @Test
    void nullMeasuresAreAbsentRatherThanZero() {
        FactTable facts = new FactTable(
                new FactSchema(List.of("show_id", "type", "rating"), List.of("duration")),
                List.of(
                        fact("s1", "Movie", "G", 150),
                        fact("s2", "Movie", "G", null),
                        fact("s3", "Movie", "PG", null)));

        ReportRow root = harness.service().rollup(titlesByType(ALL_SCALARS), facts);

        ReportRow movie = child(root, "Movie");
        assertThat(value(movie, SUM)).isEqualTo("150");
        assertThat(value(movie, COUNT)).isEqualTo("1");
        assertThat(value(movie, MEAN)).isEqualTo("150");
        ReportRow pg = child(movie, "PG");
        assertThat(value(pg, SUM)).isEqualTo("0");
        assertThat(value(pg, COUNT)).isEqualTo("0");
        assertThat(value(pg, MEAN)).isNull();
        assertThat(value(pg, MEDIAN)).isNull();
    }

    @Test
    void nullDimensionValuesGroupUnderPlaceholder() {
        FactTable facts = new FactTable(
                new FactSchema(List.of("show_id", "type", "rating"), List.of("duration")),
                List.of(fact("s1", "Movie", null, 150), fact("s2", "Movie", null, 50)));

        ReportRow root = harness.service().rollup(titlesByType(List.of(SUM)), facts);

        ReportRow unrated = child(child(root, "Movie"), "");
        assertThat(value(unrated, SUM)).isEqualTo("200");
        assertThat(unrated.children()).hasSize(2);
    }

    @Test
    void emptyFactTableYieldsEmptyRoot() {
        FactTable facts = new FactTable(new FactSchema(List.of("show_id", "type", "rating"), List.of("duration")), List.of());

        ReportRow root = harness.service().rollup(titlesByType(ALL_SCALARS), facts);

        assertThat(root.key().kind()).isEqualTo(RowKey.Kind.ROOT_TOTAL);
        assertThat(value(root, SUM)).isEqualTo("0");
        assertThat(value(root, MEAN)).isNull();
        assertThat(root.breakdown().children()).isEmpty();
    }

    @Test
    void postedRowsWithoutAnyFactsYieldEmptyRoot() {
        ReportRow root = harness.service().rollupRows(titlesByType(ALL_SCALARS), List.of());

        assertThat(value(root, SUM)).isEqualTo("0");
        assertThat(value(root, COUNT)).isEqualTo("0");
        assertThat(root.breakdown().children()).isEmpty();
    }

    @Test
    void postedRowsInferTheirSchema() {
        ReportRow root = harness.service().rollupRows(titlesByType(List.of(SUM)), referenceTitles().rows());

        assertThat(value(root, SUM)).isEqualTo("4950");

        List<FactRow> unrated = List.of(new FactRow(Map.of("show_id", "s1", "type", "Movie"), Map.of("duration", BigDecimal.TEN)));
        assertThatThrownBy(() -> harness.service().rollupRows(titlesByType(List.of(SUM)), unrated))
                .isInstanceOfSatisfying(FactSchemaException.class,
                        ex -> assertThat(ex.missingDimensions()).containsExactly("rating"));
    }

    @Test
    void rootOnlyHierarchyAggregatesFactsDirectly() {
        HierarchySpec spec = new HierarchySpec("total", null, List.of(LevelSpec.root(List.of(SUM, MEDIAN))), null);

        ReportRow root = harness.service().rollup(spec, referenceTitles());

        assertThat(root.breakdown()).isNull();
        assertThat(value(root, SUM)).isEqualTo("4950");
        assertThat(value(root, MEDIAN)).isEqualTo("575");
    }

    @Test
    void sameLeafValueUnderDifferentParentsStaysSeparate() {
        FactTable facts = new FactTable(
                new FactSchema(List.of("show_id", "type", "rating"), List.of("duration")),
                List.of(fact("x", "Movie", "G", 10), fact("x", "TV Show", "TV-G", 20)));

        ReportRow root = harness.service().rollup(titlesByType(List.of(SUM)), facts);

        assertThat(value(child(child(child(root, "Movie"), "G"), "x"), SUM)).isEqualTo("10");
        assertThat(value(child(child(child(root, "TV Show"), "TV-G"), "x"), SUM)).isEqualTo("20");
    }

    @Test
    void parallelWorkersProduceTheSameTree() {
        RollupFixtures.Harness parallel = RollupFixtures.harness(4);
        try {
            ReportRow sequential = harness.service().rollup(titlesByType(ALL_SCALARS), referenceTitles());
            ReportRow concurrent = parallel.service().rollup(titlesByType(ALL_SCALARS), referenceTitles());
            assertThat(concurrent).isEqualTo(sequential);
        } finally {
            parallel.pool().stop();
        }
    }

    @Test
    void factSourceIsEquivalentToTheTableItWraps() {
        ReportRow fromTable = harness.service().rollup(titlesByType(ALL_SCALARS), referenceTitles());
        ReportRow fromSource =
                harness.service().rollup(titlesByType(ALL_SCALARS), new InMemoryFactSource(referenceTitles()));

        assertThat(fromSource).isEqualTo(fromTable);
    }

    @Test
    void configurationErrorsAreRaisedBeforeReadingFacts() {
        AtomicInteger reads = new AtomicInteger();
        FactSource source = () -> {
            reads.incrementAndGet();
            return referenceTitles();
        };
        HierarchySpec spec = new HierarchySpec(
                "broken", null, List.of(LevelSpec.of("country", List.of(SUM)), LevelSpec.root(List.of(SUM))), null);

        assertThatThrownBy(() -> harness.service().rollup(spec, source))
                .isInstanceOf(HierarchyConfigurationException.class)
                .hasMessageContaining("unknown dimension 'country'");
        assertThat(reads.get()).isZero();
    }

    @Test
    void missingColumnsAreSchemaErrors() {
        FactTable facts = new FactTable(new FactSchema(List.of("show_id", "type"), List.of("runtime")), List.of());

        assertThatThrownBy(() -> harness.service().rollup(titlesByType(List.of(SUM)), facts))
                .isInstanceOfSatisfying(FactSchemaException.class, ex -> {
                    assertThat(ex.missingDimensions()).containsExactly("rating");
                    assertThat(ex.missingMeasures()).containsExactly("duration");
                });
    }

    @Test
    void unknownConfiguredHierarchyIsRejected() {
        assertThatThrownBy(() -> harness.service().rollup("nope", () -> referenceTitles()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown hierarchy: nope");
    }

    @Test
    void interruptedCallerAbortsAtLevelBoundary() {
        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> harness.service().rollup(titlesByType(List.of(SUM)), referenceTitles()))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("cancelled");
        } finally {
            Thread.interrupted();
        }
    }

    private static void explode(ReportRow row, Map<String, String> path, List<Map<String, String>> out) {
        Map<String, String> here = new LinkedHashMap<>(path);
        if (row.key().kind() == RowKey.Kind.DIMENSION_VALUE) {
            here.put(row.key().refId(), row.key().value());
        }
        if (row.breakdown() == null) {
            here.put("duration", value(row, SUM));
            out.add(here);
            return;
        }
        for (ReportRow child : row.children()) {
            explode(child, here, out);
        }
    }

    private static List<MetricValue> metricsOf(ReportRow root) {
        List<MetricValue> out = new ArrayList<>();
        walk(root, row -> out.addAll(row.metrics()));
        return out;
    }
}
