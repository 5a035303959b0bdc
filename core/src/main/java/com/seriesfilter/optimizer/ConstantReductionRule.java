package com.seriesfilter.optimizer;

import com.seriesfilter.eval.ExpressionReducer;
import com.seriesfilter.eval.Valuer;
import com.seriesfilter.expression.Expression;

import java.util.Objects;

/**
 * Rewrite rule that folds constant sub-expressions with a fixed set of
 * bindings.
 *
 * @see ExpressionReducer
 */
public class ConstantReductionRule implements OptimizationRule {

    private final Valuer valuer;

    /**
     * Creates a rule that folds literals only.
     */
    public ConstantReductionRule() {
        this(Valuer.none());
    }

    public ConstantReductionRule(Valuer valuer) {
        this.valuer = Objects.requireNonNull(valuer, "valuer must not be null");
    }

    @Override
    public Expression apply(Expression expr) {
        return ExpressionReducer.reduce(expr, valuer);
    }
}
