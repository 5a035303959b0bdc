package com.seriesfilter.predicate;

import com.seriesfilter.expression.BinaryExpression;
import com.seriesfilter.expression.BinaryExpression.Operator;
import com.seriesfilter.expression.Expression;
import com.seriesfilter.expression.ExpressionUtils;
import com.seriesfilter.expression.Literal;
import com.seriesfilter.expression.ParenExpression;
import com.seriesfilter.expression.PseudoReferences;

import java.util.Objects;
import java.util.Optional;

/**
 * Decides whether a predicate restricts a read to exactly one measurement.
 *
 * <p>When it does, the storage engine can scan that measurement alone. The
 * decision is made from boolean structure only:
 * <pre>
 *   _name = 'm0'                                  -&gt; m0
 *   _something = 'f' AND _name = 'm0'             -&gt; m0
 *   _name = 'm0' OR tag1 != 'foo'                 -&gt; none
 *   _name = 'm0' AND tag1 != 'foo' AND _name = 'x' -&gt; none
 *   _name = 'm0' AND (tag1 != 'foo' OR tag2 = 'x') -&gt; none
 * </pre>
 *
 * <p>A disjunction anywhere in the predicate disqualifies it, even one that
 * sits under a conjunction pinning the measurement. Comparing two different
 * measurement names in the same conjunction disqualifies it as well; the
 * analyzer does not try to prove such a predicate unsatisfiable.
 */
public final class MeasurementScopeAnalyzer {

    private MeasurementScopeAnalyzer() {}

    /**
     * Returns the single measurement the expression is scoped to.
     *
     * @param expr the predicate to analyze
     * @return the measurement name, or empty if the predicate may admit rows
     *         from more than one measurement
     */
    public static Optional<String> hasSingleMeasurementNoOr(Expression expr) {
        Objects.requireNonNull(expr, "expr must not be null");
        Scope scope = analyze(expr);
        return scope.kind == ScopeKind.PINNED ? Optional.of(scope.measurement) : Optional.empty();
    }

    private static Scope analyze(Expression expr) {
        if (expr instanceof ParenExpression paren) {
            return analyze(paren.inner());
        }
        if (expr instanceof BinaryExpression bin) {
            switch (bin.operator()) {
                case OR:
                    return Scope.INVALID;
                case AND:
                    return combine(analyze(bin.left()), analyze(bin.right()));
                default:
                    return analyzeComparison(bin);
            }
        }
        // Bare references and literals
        return PseudoReferences.isMeasurement(expr) ? Scope.INVALID : Scope.NEUTRAL;
    }

    private static Scope analyzeComparison(BinaryExpression cmp) {
        if (cmp.operator() == Operator.EQUAL &&
            PseudoReferences.isMeasurement(cmp.left()) &&
            cmp.right() instanceof Literal lit &&
            lit.kind() == Literal.Kind.STRING &&
            !lit.stringValue().isEmpty()) {
            return Scope.pinned(lit.stringValue());
        }
        if (ExpressionUtils.containsReference(cmp, PseudoReferences.MEASUREMENT) ||
            ExpressionUtils.containsOr(cmp)) {
            return Scope.INVALID;
        }
        return Scope.NEUTRAL;
    }

    private static Scope combine(Scope left, Scope right) {
        if (left.kind == ScopeKind.INVALID || right.kind == ScopeKind.INVALID) {
            return Scope.INVALID;
        }
        if (left.kind == ScopeKind.NEUTRAL) {
            return right;
        }
        if (right.kind == ScopeKind.NEUTRAL) {
            return left;
        }
        return left.measurement.equals(right.measurement) ? left : Scope.INVALID;
    }

    private enum ScopeKind {
        /** Restricted to one named measurement. */
        PINNED,
        /** No measurement reference and no disjunction. */
        NEUTRAL,
        INVALID
    }

    private static final class Scope {
        static final Scope NEUTRAL = new Scope(ScopeKind.NEUTRAL, null);
        static final Scope INVALID = new Scope(ScopeKind.INVALID, null);

        final ScopeKind kind;
        final String measurement;

        private Scope(ScopeKind kind, String measurement) {
            this.kind = kind;
            this.measurement = measurement;
        }

        static Scope pinned(String measurement) {
            return new Scope(ScopeKind.PINNED, measurement);
        }
    }
}
