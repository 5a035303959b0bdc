package com.seriesfilter.expression;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Utility methods for traversing, inspecting and rewriting expressions.
 */
public final class ExpressionUtils {

    private ExpressionUtils() {}

    /**
     * Rewrites an expression top-down.
     *
     * <p>The function is applied to a node before its children. When it
     * returns a different node, that node is the result for the whole
     * subtree and is not visited further; when it returns the node itself,
     * the children are rewritten. Subtrees left alone are shared with the
     * input rather than copied.
     *
     * @param expr the expression to rewrite
     * @param fn the function applied to every visited node, pre-order
     * @return the rewritten expression
     */
    public static Expression rewrite(Expression expr, UnaryOperator<Expression> fn) {
        Objects.requireNonNull(expr, "expr must not be null");
        Expression replaced = Objects.requireNonNull(fn.apply(expr), "rewrite function returned null");
        if (replaced != expr) {
            return replaced;
        }
        if (expr instanceof BinaryExpression bin) {
            return bin.withOperands(rewrite(bin.left(), fn), rewrite(bin.right(), fn));
        }
        if (expr instanceof ParenExpression paren) {
            return paren.withInner(rewrite(paren.inner(), fn));
        }
        return expr;
    }

    /**
     * Visits every node of an expression, parents before children, left
     * operands before right operands.
     *
     * @param expr the expression to walk
     * @param visitor the callback invoked for each node
     */
    public static void walk(Expression expr, Consumer<Expression> visitor) {
        visitor.accept(expr);
        if (expr instanceof BinaryExpression bin) {
            walk(bin.left(), visitor);
            walk(bin.right(), visitor);
        } else if (expr instanceof ParenExpression paren) {
            walk(paren.inner(), visitor);
        }
    }

    /**
     * Returns true if any node in the subtree is a reference with the given
     * name. The whole subtree is searched.
     *
     * @param expr the expression to search
     * @param name the reference name
     * @return true if the name is referenced
     */
    public static boolean containsReference(Expression expr, String name) {
        if (expr instanceof VarRef ref) {
            return ref.refersTo(name);
        }
        if (expr instanceof BinaryExpression bin) {
            return containsReference(bin.left(), name) || containsReference(bin.right(), name);
        }
        if (expr instanceof ParenExpression paren) {
            return containsReference(paren.inner(), name);
        }
        return false;
    }

    /**
     * Returns true if the subtree contains an {@code OR} operator.
     *
     * @param expr the expression to search
     * @return true if a disjunction is present
     */
    public static boolean containsOr(Expression expr) {
        if (expr instanceof BinaryExpression bin) {
            return bin.operator() == BinaryExpression.Operator.OR ||
                   containsOr(bin.left()) || containsOr(bin.right());
        }
        if (expr instanceof ParenExpression paren) {
            return containsOr(paren.inner());
        }
        return false;
    }

    /**
     * Strips any number of enclosing parentheses.
     *
     * @param expr the expression
     * @return the first node that is not a {@link ParenExpression}
     */
    public static Expression unwrapParens(Expression expr) {
        Expression current = expr;
        while (current instanceof ParenExpression paren) {
            current = paren.inner();
        }
        return current;
    }

    /**
     * Counts the nodes of an expression tree.
     *
     * @param expr the expression
     * @return the number of nodes, at least one
     */
    public static int countNodes(Expression expr) {
        int[] count = {0};
        walk(expr, node -> count[0]++);
        return count[0];
    }
}
