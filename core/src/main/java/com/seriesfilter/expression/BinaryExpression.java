package com.seriesfilter.expression;

import java.util.Objects;

/**
 * Expression representing a binary operation (operation with two operands).
 *
 * <p>Binary expressions include:
 * <ul>
 *   <li>Logical: a AND b, a OR b</li>
 *   <li>Comparison: a = b, a != b, a &lt; b, a &lt;= b, a &gt; b, a &gt;= b</li>
 *   <li>Regex comparison: a =~ /re/, a !~ /re/</li>
 * </ul>
 *
 * <p>Examples:
 * <pre>
 *   host::tag = 'host1'                -- tag comparison
 *   _field::tag =~ /^us-west/          -- field key match
 *   "$" &gt; 0.5                          -- field value comparison
 *   region::tag = 'us' AND "$" &gt; 1     -- logical
 * </pre>
 *
 * <p>Rendering is left-associative: {@code AND(AND(a, b), c)} renders as
 * {@code a AND b AND c}, while {@code AND(a, AND(b, c))} renders as
 * {@code a AND (b AND c)}.
 */
public final class BinaryExpression implements Expression {

    /**
     * Binary operators.
     */
    public enum Operator {
        // Logical operators
        OR("OR", 1),
        AND("AND", 2),

        // Comparison operators
        EQUAL("=", 4),
        NOT_EQUAL("!=", 4),
        REGEX_MATCH("=~", 4),
        REGEX_NOT_MATCH("!~", 4),
        LESS_THAN("<", 4),
        LESS_THAN_OR_EQUAL("<=", 4),
        GREATER_THAN(">", 4),
        GREATER_THAN_OR_EQUAL(">=", 4);

        private final String symbol;
        private final int precedence;

        Operator(String symbol, int precedence) {
            this.symbol = symbol;
            this.precedence = precedence;
        }

        public String symbol() {
            return symbol;
        }

        /**
         * Returns the binding strength of this operator; higher binds tighter.
         *
         * @return the precedence
         */
        public int precedence() {
            return precedence;
        }

        public boolean isLogical() {
            return this == AND || this == OR;
        }

        public boolean isComparison() {
            return !isLogical();
        }

        public boolean isRegex() {
            return this == REGEX_MATCH || this == REGEX_NOT_MATCH;
        }

        public boolean isOrdering() {
            return this == LESS_THAN || this == LESS_THAN_OR_EQUAL ||
                   this == GREATER_THAN || this == GREATER_THAN_OR_EQUAL;
        }
    }

    private final Expression left;
    private final Operator operator;
    private final Expression right;

    /**
     * Creates a binary expression.
     *
     * @param left the left operand
     * @param operator the operator
     * @param right the right operand
     */
    public BinaryExpression(Expression left, Operator operator, Expression right) {
        this.left = Objects.requireNonNull(left, "left must not be null");
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.right = Objects.requireNonNull(right, "right must not be null");
    }

    public Expression left() {
        return left;
    }

    public Operator operator() {
        return operator;
    }

    public Expression right() {
        return right;
    }

    /**
     * Returns a copy of this expression with new operands, or this instance
     * when both operands are unchanged.
     *
     * @param newLeft the new left operand
     * @param newRight the new right operand
     * @return the binary expression with the given operands
     */
    public BinaryExpression withOperands(Expression newLeft, Expression newRight) {
        if (newLeft == left && newRight == right) {
            return this;
        }
        return new BinaryExpression(newLeft, operator, newRight);
    }

    @Override
    public String render() {
        return renderOperand(left, false) + " " + operator.symbol() + " " + renderOperand(right, true);
    }

    private String renderOperand(Expression operand, boolean rightSide) {
        String text = operand.render();
        if (operand instanceof BinaryExpression child) {
            int childPrecedence = child.operator.precedence();
            int parentPrecedence = operator.precedence();
            if (childPrecedence < parentPrecedence || (rightSide && childPrecedence == parentPrecedence)) {
                return "(" + text + ")";
            }
        }
        return text;
    }

    @Override
    public String toString() {
        return render();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof BinaryExpression)) return false;
        BinaryExpression that = (BinaryExpression) obj;
        return Objects.equals(left, that.left) &&
               operator == that.operator &&
               Objects.equals(right, that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, operator, right);
    }

    // ==================== Factory Methods ====================

    public static BinaryExpression and(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.AND, right);
    }

    public static BinaryExpression or(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.OR, right);
    }

    public static BinaryExpression equal(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.EQUAL, right);
    }

    public static BinaryExpression notEqual(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.NOT_EQUAL, right);
    }

    public static BinaryExpression regexMatch(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.REGEX_MATCH, right);
    }

    public static BinaryExpression regexNotMatch(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.REGEX_NOT_MATCH, right);
    }

    public static BinaryExpression lessThan(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.LESS_THAN, right);
    }

    public static BinaryExpression greaterThan(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.GREATER_THAN, right);
    }
}
