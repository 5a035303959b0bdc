package com.seriesfilter.optimizer;

import com.seriesfilter.expression.Expression;

/**
 * A rewrite applied to a predicate by {@link PredicateOptimizer}.
 *
 * <p>Rules applied to a predicate that is pushed down to the index may widen
 * it (admit more series) but must never narrow it. A rule applied to its own
 * output returns that output unchanged.
 */
public interface OptimizationRule {

    /**
     * Applies this rule to an expression.
     *
     * @param expr the input expression
     * @return the rewritten expression, or the input if the rule does not apply
     */
    Expression apply(Expression expr);

    /**
     * Returns the name used in optimizer trace output.
     *
     * @return the rule name
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
