package com.seriesfilter.optimizer;

import com.seriesfilter.expression.BinaryExpression;
import com.seriesfilter.expression.Expression;
import com.seriesfilter.expression.ExpressionUtils;
import com.seriesfilter.expression.Literal;
import com.seriesfilter.expression.PseudoReferences;

/**
 * Rewrite rule that neutralizes comparisons the series index cannot answer.
 *
 * <p>The index only knows tags. A comparison against the field key
 * ({@code _field}), the field value ({@code $}) or a named field
 * ({@code usage::field}) is replaced by
 * {@code true}, which turns the predicate into one that admits every series
 * the original admits. The field conditions are still evaluated later, row
 * by row, against the original predicate.
 *
 * <pre>
 *   host::tag = 'host1' AND _field::tag =~ /^us-west/ AND "$" = 0.5
 *   -&gt; host::tag = 'host1' AND true AND true
 * </pre>
 *
 * <p>The rule does not fold the resulting constants; run
 * {@link ConstantReductionRule} afterwards for that.
 */
public class FieldKeyValueRemovalRule implements OptimizationRule {

    @Override
    public Expression apply(Expression expr) {
        return rewriteRemoveFieldKeyAndValue(expr);
    }

    /**
     * Replaces every comparison that references the field key or a field
     * value, directly or anywhere in an operand, with {@code true}.
     *
     * @param expr the expression to rewrite
     * @return the rewritten expression
     */
    public static Expression rewriteRemoveFieldKeyAndValue(Expression expr) {
        return ExpressionUtils.rewrite(expr, FieldKeyValueRemovalRule::neutralize);
    }

    // Visited top-down: the outermost comparison that mentions a field is
    // replaced as a whole.
    private static Expression neutralize(Expression node) {
        if (node instanceof BinaryExpression bin && bin.operator().isComparison()) {
            if (PseudoReferences.containsFieldKeyOrValue(bin.left()) ||
                PseudoReferences.containsFieldKeyOrValue(bin.right())) {
                return Literal.TRUE;
            }
        }
        return node;
    }
}
