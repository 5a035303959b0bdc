package com.seriesfilter.reads;

import com.seriesfilter.expression.Expression;
import com.seriesfilter.optimizer.FieldKeyValueRemovalRule;
import com.seriesfilter.optimizer.PredicateOptimizer;
import com.seriesfilter.reads.config.ReadFilterConfig;
import com.seriesfilter.reads.converter.TranslationException;
import com.seriesfilter.reads.proto.Node;
import com.seriesfilter.reads.proto.Predicate;
import com.seriesfilter.test.TestBase;
import com.seriesfilter.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.seriesfilter.reads.FilterNodes.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests for {@link ReadPredicatePlanner}: translation, measurement
 * scoping and index condition derivation together.
 */
@TestCategories.Integration
@TestCategories.Tier2
@DisplayName("Read Predicate Planner Tests")
public class ReadPredicatePlannerTest extends TestBase {

    private ReadPredicatePlanner planner;

    @Override
    protected void doSetUp() {
        planner = new ReadPredicatePlanner(ReadFilterConfig.defaults());
    }

    private static Node measurementHostValueFilter() {
        return and(
            comparison(Node.Comparison.COMPARISON_EQUAL, tagRef("_measurement"), string("cpu")),
            comparison(Node.Comparison.COMPARISON_EQUAL, tagRef("host"), string("a")),
            comparison(Node.Comparison.COMPARISON_GREATER, fieldRef("usage"), floating(1.0)));
    }

    @Nested
    @DisplayName("Planning")
    class PlanningTests {

        @Test
        @DisplayName("Field clauses are dropped from the index condition")
        void testHostFieldValueFilter() {
            ReadPredicate predicate = planner.plan(hostFieldValueFilter());

            assertThat(predicate.condition()).map(Expression::render)
                .contains("host::tag = 'host1' AND _field::tag =~ /^us-west/ AND \"$\" = 0.5");
            assertThat(predicate.measurement()).isEmpty();
            assertThat(predicate.indexCondition()).map(Expression::render)
                .contains("host::tag = 'host1'");
            assertThat(predicate.matchesAllSeries()).isFalse();
        }

        @Test
        @DisplayName("Measurement tag key is remapped and pins the measurement")
        void testMeasurementPinned() {
            ReadPredicate predicate = planner.plan(measurementHostValueFilter());

            assertThat(predicate.measurement()).contains("cpu");
            assertThat(predicate.indexCondition()).map(Expression::render)
                .contains("_name::tag = 'cpu' AND host::tag = 'a'");
        }

        @Test
        @DisplayName("Without remapping the measurement key is an ordinary tag")
        void testWithoutRemap() {
            ReadPredicatePlanner plain = new ReadPredicatePlanner(
                new ReadFilterConfig(ReadFilterConfig.DEFAULT_MAX_NODE_DEPTH, Map.of()));

            ReadPredicate predicate = plain.plan(measurementHostValueFilter());

            assertThat(predicate.measurement()).isEmpty();
            assertThat(predicate.indexCondition()).map(Expression::render)
                .contains("_measurement::tag = 'cpu' AND host::tag = 'a'");
        }

        @Test
        @DisplayName("Disjunction keeps the index condition but not the measurement")
        void testDisjunction() {
            Node node = or(
                comparison(Node.Comparison.COMPARISON_EQUAL, tagRef("_measurement"), string("cpu")),
                comparison(Node.Comparison.COMPARISON_EQUAL, tagRef("host"), string("a")));

            ReadPredicate predicate = planner.plan(node);

            assertThat(predicate.measurement()).isEmpty();
            assertThat(predicate.indexCondition()).map(Expression::render)
                .contains("_name::tag = 'cpu' OR host::tag = 'a'");
        }

        @Test
        @DisplayName("Field-only filter matches all series")
        void testFieldOnlyFilter() {
            Node node = and(
                comparison(Node.Comparison.COMPARISON_EQUAL, tagRef("_field"), string("usage")),
                comparison(Node.Comparison.COMPARISON_LESS, fieldRef("usage"), integer(10)));

            ReadPredicate predicate = planner.plan(node);

            assertThat(predicate.condition()).isPresent();
            assertThat(predicate.indexCondition()).isEmpty();
            assertThat(predicate.matchesAllSeries()).isTrue();
        }

        @Test
        @DisplayName("Predicate message with root is planned from the root")
        void testPredicateMessage() {
            Predicate message = Predicate.newBuilder().setRoot(measurementHostValueFilter()).build();

            assertThat(planner.plan(message)).isEqualTo(planner.plan(measurementHostValueFilter()));
        }

        @Test
        @DisplayName("Missing filter matches everything")
        void testMissingFilter() {
            assertThat(planner.plan(Predicate.getDefaultInstance())).isSameAs(ReadPredicate.matchAll());
            assertThat(planner.plan((Predicate) null)).isSameAs(ReadPredicate.matchAll());
            assertThat(ReadPredicate.matchAll().condition()).isEmpty();
            assertThat(ReadPredicate.matchAll().matchesAllSeries()).isTrue();
        }

        @Test
        @DisplayName("Custom optimizer controls the index condition")
        void testCustomOptimizer() {
            ReadPredicatePlanner neutralizeOnly = new ReadPredicatePlanner(
                ReadFilterConfig.defaults(),
                new PredicateOptimizer(List.of(new FieldKeyValueRemovalRule()), 1));

            ReadPredicate predicate = neutralizeOnly.plan(hostFieldValueFilter());

            assertThat(predicate.indexCondition()).map(Expression::render)
                .contains("host::tag = 'host1' AND true AND true");
        }

        @Test
        @DisplayName("Depth limit comes from the configuration")
        void testDepthLimitFromConfig() {
            ReadPredicatePlanner shallow = new ReadPredicatePlanner(new ReadFilterConfig(2, Map.of()));

            assertThatThrownBy(() -> shallow.plan(hostFieldValueFilter()))
                .isInstanceOf(TranslationException.class);
        }

        @Test
        @DisplayName("Malformed filter fails planning")
        void testMalformedFilter() {
            Node bad = and(comparison(Node.Comparison.COMPARISON_EQUAL, tagRef("host")));

            assertThatThrownBy(() -> planner.plan(bad))
                .isInstanceOf(TranslationException.class)
                .hasMessageContaining("root.children[0]");
        }

        @Test
        @DisplayName("Named field comparison keeps its name in the condition and leaves the index")
        void testNamedFieldComparison() {
            ReadPredicate predicate = planner.plan(measurementHostValueFilter());

            assertThat(predicate.condition()).map(Expression::render).hasValueSatisfying(
                rendered -> assertThat(rendered).contains("usage::field > "));
            assertThat(predicate.indexCondition()).map(Expression::render).hasValueSatisfying(
                rendered -> assertThat(rendered).doesNotContain("usage"));
        }

        @Test
        @DisplayName("Comparison of a comparison is rejected rather than narrowing the index")
        void testNestedComparisonRejected() {
            // Given: false = ($ > 1)
            Node node = comparison(Node.Comparison.COMPARISON_EQUAL, bool(false),
                comparison(Node.Comparison.COMPARISON_GREATER, fieldRef("$"), integer(1)));

            // When
            Throwable thrown = catchThrowable(() -> planner.plan(node));

            // Then
            assertThat(thrown).isInstanceOf(TranslationException.class);
            assertThat(((TranslationException) thrown).getKind())
                .isEqualTo(TranslationException.ErrorKind.TYPE_MISMATCH);
        }
    }

    @Nested
    @DisplayName("Wide Filters")
    class WideFilterTests {

        private Node wideAnd(int width) {
            Node.Builder builder = Node.newBuilder()
                .setNodeType(Node.Type.TYPE_LOGICAL_EXPRESSION)
                .setLogical(Node.Logical.LOGICAL_AND)
                .addChildren(comparison(Node.Comparison.COMPARISON_EQUAL, tagRef("_measurement"), string("cpu")));
            for (int i = 1; i < width; i++) {
                builder.addChildren(comparison(Node.Comparison.COMPARISON_EQUAL, tagRef("host"), string("h" + i)));
            }
            return builder.build();
        }

        @Test
        @DisplayName("Very wide conjunction fails with a depth error")
        void testVeryWideConjunction() {
            Node node = wideAnd(100_000);

            Throwable thrown = catchThrowable(() -> planner.plan(node));

            assertThat(thrown).isInstanceOf(TranslationException.class);
            assertThat(((TranslationException) thrown).getKind())
                .isEqualTo(TranslationException.ErrorKind.MAX_DEPTH_EXCEEDED);
        }

        @Test
        @DisplayName("Conjunction within the depth limit is planned")
        void testModeratelyWideConjunction() {
            ReadPredicate predicate = planner.plan(wideAnd(400));

            assertThat(predicate.measurement()).contains("cpu");
            assertThat(predicate.indexCondition()).map(Expression::render).hasValueSatisfying(rendered -> {
                assertThat(rendered).startsWith("_name::tag = 'cpu' AND host::tag = 'h1'");
                assertThat(rendered).endsWith("host::tag = 'h399'");
            });
        }
    }

    @Test
    @DisplayName("One planner serves concurrent requests")
    void testConcurrentPlanning() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Callable<ReadPredicate>> tasks = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                Node node = (i % 2 == 0) ? measurementHostValueFilter() : hostFieldValueFilter();
                tasks.add(() -> planner.plan(node));
            }

            List<Future<ReadPredicate>> results = executor.invokeAll(tasks, 30, TimeUnit.SECONDS);

            ReadPredicate even = planner.plan(measurementHostValueFilter());
            ReadPredicate odd = planner.plan(hostFieldValueFilter());
            for (int i = 0; i < results.size(); i++) {
                assertThat(results.get(i).get()).isEqualTo(i % 2 == 0 ? even : odd);
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
