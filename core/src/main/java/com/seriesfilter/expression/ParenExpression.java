package com.seriesfilter.expression;

import java.util.Objects;

/**
 * Expression representing explicit grouping.
 *
 * <p>Evaluation order is given by tree shape, so a paren node does not change
 * what an expression means; it only keeps the grouping visible in rendered
 * text: {@code region::tag = 'us' AND (host::tag = 'a' OR host::tag = 'b')}.
 */
public final class ParenExpression implements Expression {

    private final Expression inner;

    public ParenExpression(Expression inner) {
        this.inner = Objects.requireNonNull(inner, "inner must not be null");
    }

    public Expression inner() {
        return inner;
    }

    public ParenExpression withInner(Expression newInner) {
        return newInner == inner ? this : new ParenExpression(newInner);
    }

    @Override
    public String render() {
        return "(" + inner.render() + ")";
    }

    @Override
    public String toString() {
        return render();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ParenExpression)) return false;
        return inner.equals(((ParenExpression) obj).inner);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ParenExpression.class, inner);
    }

    public static ParenExpression of(Expression inner) {
        return new ParenExpression(inner);
    }
}
