package com.seriesfilter.optimizer;

import com.seriesfilter.expression.Expression;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Applies rewrite rules to a predicate until it stops changing.
 *
 * <p>Each iteration applies all rules in order. Iteration stops when an
 * iteration leaves the expression unchanged or the iteration limit is
 * reached.
 *
 * <p>Example usage:
 * <pre>
 *   PredicateOptimizer optimizer = new PredicateOptimizer();
 *   Expression indexCondition = optimizer.optimize(condition);
 * </pre>
 *
 * <p>The optimizer includes these rules by default:
 * <ul>
 *   <li>Field key and value removal - neutralize clauses the index cannot answer</li>
 *   <li>Constant reduction - fold the resulting constants</li>
 * </ul>
 */
public class PredicateOptimizer {
    private static final Logger logger = LoggerFactory.getLogger(PredicateOptimizer.class);

    public static final int DEFAULT_MAX_ITERATIONS = 10;

    private final List<OptimizationRule> rules;
    private final int maxIterations;

    public PredicateOptimizer() {
        this(DEFAULT_RULES, DEFAULT_MAX_ITERATIONS);
    }

    /**
     * @param rules the rules, applied in list order within each iteration
     * @param maxIterations upper bound on full passes over the rules, at least 1
     */
    public PredicateOptimizer(List<OptimizationRule> rules, int maxIterations) {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be positive: " + maxIterations);
        }
        this.rules = List.copyOf(rules);
        this.maxIterations = maxIterations;
    }

    /**
     * Rewrites an expression with the configured rules.
     *
     * @param expr the predicate, may be null
     * @return the rewritten predicate, or null for a null input
     */
    public Expression optimize(Expression expr) {
        if (expr == null) {
            return null;
        }

        Expression current = expr;

        for (int iteration = 0; iteration < maxIterations; iteration++) {
            Expression previous = current;

            for (OptimizationRule rule : rules) {
                Expression next = rule.apply(current);
                if (logger.isTraceEnabled() && !next.equals(current)) {
                    logger.trace("Rule {} rewrote {} to {}", rule.name(), current, next);
                }
                current = next;
            }

            if (current.equals(previous)) {
                break;
            }
        }

        return current;
    }

    private static final List<OptimizationRule> DEFAULT_RULES = List.of(
        new FieldKeyValueRemovalRule(),
        new ConstantReductionRule()
    );

    public List<OptimizationRule> rules() {
        return rules;
    }

    public int maxIterations() {
        return maxIterations;
    }
}
