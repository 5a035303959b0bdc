package com.seriesfilter.predicate;

import com.seriesfilter.expression.Expression;
import com.seriesfilter.expression.Literal;
import com.seriesfilter.expression.ParenExpression;
import com.seriesfilter.expression.VarRef;
import com.seriesfilter.test.TestBase;
import com.seriesfilter.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.Optional;
import java.util.stream.Stream;

import static com.seriesfilter.expression.BinaryExpression.and;
import static com.seriesfilter.expression.BinaryExpression.equal;
import static com.seriesfilter.expression.BinaryExpression.notEqual;
import static com.seriesfilter.expression.BinaryExpression.or;
import static com.seriesfilter.expression.BinaryExpression.regexMatch;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link MeasurementScopeAnalyzer}.
 *
 * <p>Expressions are built directly; each case lists the query text it
 * corresponds to.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Measurement Scope Analyzer Tests")
public class MeasurementScopeAnalyzerTest extends TestBase {

    private static Expression nameIs(String measurement) {
        return equal(VarRef.of("_name"), Literal.of(measurement));
    }

    private static Expression tagNotEqual(String tag, String value) {
        return notEqual(VarRef.of(tag), Literal.of(value));
    }

    private static Expression tagEqual(String tag, String value) {
        return equal(VarRef.of(tag), Literal.of(value));
    }

    static Stream<Arguments> queryCases() {
        return Stream.of(
            Arguments.of("_name = 'm0'",
                nameIs("m0"), "m0"),
            Arguments.of("_something = 'f' AND _name = 'm0'",
                and(tagEqual("_something", "f"), nameIs("m0")), "m0"),
            Arguments.of("_something = 'f' AND (a =~ /x0/ AND _name = 'm0')",
                and(tagEqual("_something", "f"),
                    ParenExpression.of(and(regexMatch(VarRef.of("a"), Literal.regex("x0")), nameIs("m0")))),
                "m0"),
            Arguments.of("tag1 != 'foo'",
                tagNotEqual("tag1", "foo"), null),
            Arguments.of("_name = 'm0' OR tag1 != 'foo'",
                or(nameIs("m0"), tagNotEqual("tag1", "foo")), null),
            Arguments.of("_name = 'm0' AND tag1 != 'foo' AND _name = 'other'",
                and(and(nameIs("m0"), tagNotEqual("tag1", "foo")), nameIs("other")), null),
            Arguments.of("_name = 'm0' AND tag1 != 'foo' OR _name = 'other'",
                or(and(nameIs("m0"), tagNotEqual("tag1", "foo")), nameIs("other")), null),
            Arguments.of("_name = 'm0' AND (tag1 != 'foo' OR tag2 = 'other')",
                and(nameIs("m0"), ParenExpression.of(or(tagNotEqual("tag1", "foo"), tagEqual("tag2", "other")))),
                null),
            Arguments.of("(tag1 != 'foo' OR tag2 = 'other') OR _name = 'm0'",
                or(ParenExpression.of(or(tagNotEqual("tag1", "foo"), tagEqual("tag2", "other"))), nameIs("m0")),
                null)
        );
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("queryCases")
    @DisplayName("Query cases")
    void testQueryCases(String query, Expression expr, String expected) {
        assertThat(MeasurementScopeAnalyzer.hasSingleMeasurementNoOr(expr))
            .as(query)
            .isEqualTo(Optional.ofNullable(expected));
    }

    @Nested
    @DisplayName("Edge Cases")
    class EdgeCaseTests {

        @Test
        @DisplayName("Same measurement pinned twice is still single")
        void testSameMeasurementTwice() {
            Expression expr = and(nameIs("m0"), and(tagEqual("host", "a"), nameIs("m0")));

            assertThat(MeasurementScopeAnalyzer.hasSingleMeasurementNoOr(expr)).contains("m0");
        }

        @Test
        @DisplayName("Tag-annotated measurement reference pins the measurement")
        void testTagAnnotatedReference() {
            Expression expr = and(equal(VarRef.tag("_name"), Literal.of("cpu")), tagEqual("host", "a"));

            assertThat(MeasurementScopeAnalyzer.hasSingleMeasurementNoOr(expr)).contains("cpu");
        }

        @Test
        @DisplayName("Measurement inequality does not pin")
        void testMeasurementNotEqual() {
            assertThat(MeasurementScopeAnalyzer.hasSingleMeasurementNoOr(
                and(notEqual(VarRef.of("_name"), Literal.of("m0")), tagEqual("host", "a")))).isEmpty();
        }

        @Test
        @DisplayName("Measurement regex does not pin")
        void testMeasurementRegex() {
            assertThat(MeasurementScopeAnalyzer.hasSingleMeasurementNoOr(
                regexMatch(VarRef.of("_name"), Literal.regex("^m")))).isEmpty();
        }

        @Test
        @DisplayName("Empty measurement name does not pin")
        void testEmptyMeasurementName() {
            assertThat(MeasurementScopeAnalyzer.hasSingleMeasurementNoOr(nameIs(""))).isEmpty();
        }

        @Test
        @DisplayName("Literal on the left does not pin")
        void testReversedOperands() {
            assertThat(MeasurementScopeAnalyzer.hasSingleMeasurementNoOr(
                equal(Literal.of("m0"), VarRef.of("_name")))).isEmpty();
        }

        @Test
        @DisplayName("Non-string literal does not pin")
        void testNonStringLiteral() {
            assertThat(MeasurementScopeAnalyzer.hasSingleMeasurementNoOr(
                equal(VarRef.of("_name"), Literal.of(5L)))).isEmpty();
        }

        @Test
        @DisplayName("Bare literal has no measurement")
        void testBareLiteral() {
            assertThat(MeasurementScopeAnalyzer.hasSingleMeasurementNoOr(Literal.TRUE)).isEmpty();
        }

        @Test
        @DisplayName("Parenthesized pin is transparent")
        void testParenthesizedPin() {
            assertThat(MeasurementScopeAnalyzer.hasSingleMeasurementNoOr(
                ParenExpression.of(ParenExpression.of(nameIs("m0"))))).contains("m0");
        }

        @Test
        @DisplayName("OR that does not mention the measurement still disqualifies")
        void testOrWithoutMeasurement() {
            Expression expr = and(or(tagEqual("a", "1"), tagEqual("b", "2")), nameIs("m0"));

            assertThat(MeasurementScopeAnalyzer.hasSingleMeasurementNoOr(expr)).isEmpty();
        }

        @Test
        @DisplayName("Null expression is rejected")
        void testNullExpression() {
            assertThatThrownBy(() -> MeasurementScopeAnalyzer.hasSingleMeasurementNoOr(null))
                .isInstanceOf(NullPointerException.class);
        }
    }
}
