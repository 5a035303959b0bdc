package com.seriesfilter.expression;

/**
 * Base interface for all expressions handled by the predicate layer.
 *
 * <p>Expressions are the query language's in-memory representation of a
 * predicate. They are produced by translating a storage filter tree and are
 * consumed by the measurement-scope analyzer, the rewrite rules and the
 * constant reducer.
 *
 * <p>The hierarchy is closed:
 * <ul>
 *   <li>{@link BinaryExpression} - logical combinators and comparisons</li>
 *   <li>{@link VarRef} - a reference to a tag, a field or a pseudo variable</li>
 *   <li>{@link Literal} - a typed constant</li>
 *   <li>{@link ParenExpression} - explicit grouping</li>
 * </ul>
 *
 * <p>All implementations are immutable, so a tree may be read from any
 * number of threads without synchronization.
 */
public sealed interface Expression
    permits BinaryExpression, VarRef, Literal, ParenExpression {

    /**
     * Renders this expression as query-language text.
     *
     * <p>Rendering is deterministic: the same tree always produces the same
     * string, and parentheses are emitted wherever the tree shape would
     * otherwise be ambiguous.
     *
     * @return the textual form of this expression
     */
    String render();
}
