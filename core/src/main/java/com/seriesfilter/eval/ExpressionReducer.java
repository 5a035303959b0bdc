package com.seriesfilter.eval;

import com.seriesfilter.expression.BinaryExpression;
import com.seriesfilter.expression.BinaryExpression.Operator;
import com.seriesfilter.expression.Expression;
import com.seriesfilter.expression.Literal;
import com.seriesfilter.expression.ParenExpression;
import com.seriesfilter.expression.VarRef;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Folds constant sub-expressions.
 *
 * <p>The reducer replaces references that the {@link Valuer} binds with
 * literals, evaluates comparisons whose operands are both literals, and
 * simplifies logical operators with a boolean literal operand:
 * <pre>
 *   true AND x   -&gt; x         false AND x  -&gt; false
 *   true OR x    -&gt; true      false OR x   -&gt; x
 *   'a' = 'a'    -&gt; true      (true)       -&gt; true
 * </pre>
 *
 * <p>Anything that cannot be decided from the available bindings is kept as
 * it is, so the result is always equivalent to the input under those
 * bindings. The reducer is stateless and safe to use from any thread.
 */
public final class ExpressionReducer {

    private ExpressionReducer() {}

    /**
     * Reduces an expression.
     *
     * @param expr the expression to reduce
     * @param valuer the bindings to substitute, or null for none
     * @return the reduced expression
     */
    public static Expression reduce(Expression expr, Valuer valuer) {
        Objects.requireNonNull(expr, "expr must not be null");
        return reduceNode(expr, valuer != null ? valuer : Valuer.none());
    }

    private static Expression reduceNode(Expression expr, Valuer valuer) {
        if (expr instanceof BinaryExpression bin) {
            return reduceBinary(bin, valuer);
        }
        if (expr instanceof ParenExpression paren) {
            Expression inner = reduceNode(paren.inner(), valuer);
            // Grouping only matters around another binary expression
            if (inner instanceof BinaryExpression) {
                return paren.withInner(inner);
            }
            return inner;
        }
        if (expr instanceof VarRef ref) {
            return valuer.value(ref.name())
                .flatMap(ExpressionReducer::toLiteral)
                .<Expression>map(lit -> lit)
                .orElse(ref);
        }
        return expr;
    }

    private static Expression reduceBinary(BinaryExpression bin, Valuer valuer) {
        Expression left = reduceNode(bin.left(), valuer);
        Expression right = reduceNode(bin.right(), valuer);

        switch (bin.operator()) {
            case AND:
                if (left instanceof Literal lit && lit.isBoolean()) {
                    return lit.isTrue() ? right : Literal.FALSE;
                }
                if (right instanceof Literal lit && lit.isBoolean()) {
                    return lit.isTrue() ? left : Literal.FALSE;
                }
                break;
            case OR:
                if (left instanceof Literal lit && lit.isBoolean()) {
                    return lit.isTrue() ? Literal.TRUE : right;
                }
                if (right instanceof Literal lit && lit.isBoolean()) {
                    return lit.isTrue() ? Literal.TRUE : left;
                }
                break;
            default:
                if (left instanceof Literal lhs && right instanceof Literal rhs) {
                    Optional<Boolean> result = evaluate(lhs, bin.operator(), rhs);
                    if (result.isPresent()) {
                        return Literal.of(result.get());
                    }
                }
                break;
        }
        return bin.withOperands(left, right);
    }

    /**
     * Evaluates a comparison between two literals.
     *
     * @return the result, or empty if the operand kinds do not support the operator
     */
    static Optional<Boolean> evaluate(Literal lhs, Operator op, Literal rhs) {
        Literal.Kind lk = lhs.kind();
        Literal.Kind rk = rhs.kind();

        if (lk == Literal.Kind.STRING && rk == Literal.Kind.REGEX) {
            boolean matches = rhs.regexValue().matcher(lhs.stringValue()).find();
            if (op == Operator.REGEX_MATCH) return Optional.of(matches);
            if (op == Operator.REGEX_NOT_MATCH) return Optional.of(!matches);
            return Optional.empty();
        }
        if (op.isRegex()) {
            return Optional.empty();
        }
        if (lk == Literal.Kind.STRING && rk == Literal.Kind.STRING) {
            return compare(lhs.stringValue().compareTo(rhs.stringValue()), op);
        }
        if (lk == Literal.Kind.BOOLEAN && rk == Literal.Kind.BOOLEAN) {
            if (op.isOrdering()) return Optional.empty();
            return compare(Boolean.compare(lhs.isTrue(), rhs.isTrue()), op);
        }
        if (lk == Literal.Kind.DURATION && rk == Literal.Kind.DURATION) {
            return compare(((Duration) lhs.value()).compareTo((Duration) rhs.value()), op);
        }
        if (lk.isNumeric() && rk.isNumeric()) {
            return compareNumbers(lhs, op, rhs);
        }
        return Optional.empty();
    }

    private static Optional<Boolean> compareNumbers(Literal lhs, Operator op, Literal rhs) {
        Literal.Kind lk = lhs.kind();
        Literal.Kind rk = rhs.kind();
        long lv = lk == Literal.Kind.FLOAT ? 0L : (Long) lhs.value();
        long rv = rk == Literal.Kind.FLOAT ? 0L : (Long) rhs.value();

        if (lk == Literal.Kind.FLOAT || rk == Literal.Kind.FLOAT) {
            double l = asDouble(lhs);
            double r = asDouble(rhs);
            if (Double.isNaN(l) || Double.isNaN(r)) {
                return Optional.of(op == Operator.NOT_EQUAL);
            }
            return compare(Double.compare(l, r), op);
        }
        if (lk == Literal.Kind.INTEGER && rk == Literal.Kind.INTEGER) {
            return compare(Long.compare(lv, rv), op);
        }
        if (lk == Literal.Kind.UNSIGNED && rk == Literal.Kind.UNSIGNED) {
            return compare(Long.compareUnsigned(lv, rv), op);
        }
        // one signed, one unsigned
        if (lk == Literal.Kind.INTEGER) {
            return compare(lv < 0 ? -1 : Long.compareUnsigned(lv, rv), op);
        }
        return compare(rv < 0 ? 1 : Long.compareUnsigned(lv, rv), op);
    }

    private static double asDouble(Literal lit) {
        switch (lit.kind()) {
            case FLOAT:
                return (Double) lit.value();
            case UNSIGNED:
                long bits = (Long) lit.value();
                double d = (double) (bits >>> 1) * 2.0;
                return d + (bits & 1L);
            default:
                return (double) (Long) lit.value();
        }
    }

    private static Optional<Boolean> compare(int cmp, Operator op) {
        switch (op) {
            case EQUAL:
                return Optional.of(cmp == 0);
            case NOT_EQUAL:
                return Optional.of(cmp != 0);
            case LESS_THAN:
                return Optional.of(cmp < 0);
            case LESS_THAN_OR_EQUAL:
                return Optional.of(cmp <= 0);
            case GREATER_THAN:
                return Optional.of(cmp > 0);
            case GREATER_THAN_OR_EQUAL:
                return Optional.of(cmp >= 0);
            default:
                return Optional.empty();
        }
    }

    /**
     * Converts a bound value to a literal. Values of unsupported types are
     * left unbound.
     */
    static Optional<Literal> toLiteral(Object value) {
        if (value instanceof String s) {
            return Optional.of(Literal.of(s));
        }
        if (value instanceof Double || value instanceof Float) {
            return Optional.of(Literal.of(((Number) value).doubleValue()));
        }
        if (value instanceof Long || value instanceof Integer ||
            value instanceof Short || value instanceof Byte) {
            return Optional.of(Literal.of(((Number) value).longValue()));
        }
        if (value instanceof Boolean b) {
            return Optional.of(Literal.of(b));
        }
        if (value instanceof Duration d) {
            return Optional.of(Literal.of(d));
        }
        if (value instanceof Pattern p) {
            return Optional.of(Literal.regex(p));
        }
        return Optional.empty();
    }
}
