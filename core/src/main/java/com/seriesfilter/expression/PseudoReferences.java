package com.seriesfilter.expression;

/**
 * Reserved reference names that stand for series metadata rather than a
 * user tag or field. They are recognized by name; a {@link VarRef}
 * carrying one of these names is a pseudo reference whatever its type
 * annotation says. Any {@code ::field} reference also counts as a field
 * value for {@link #isFieldKeyOrValue}.
 */
public final class PseudoReferences {

    /** The measurement a series belongs to. */
    public static final String MEASUREMENT = "_name";

    /** The key of the field being read. */
    public static final String FIELD_KEY = "_field";

    /** The value of the field being read. */
    public static final String FIELD_VALUE = "$";

    private PseudoReferences() {}

    public static boolean isMeasurement(Expression expr) {
        return expr instanceof VarRef ref && ref.refersTo(MEASUREMENT);
    }

    /**
     * Returns true if the expression is a reference to the field key or to a
     * field value, neither of which can be resolved by a tag index.
     *
     * @param expr the expression to check
     * @return true for {@code _field}, {@code $} and {@code ::field} references
     */
    public static boolean isFieldKeyOrValue(Expression expr) {
        return expr instanceof VarRef ref &&
               (ref.type() == VarRef.Type.FIELD || ref.refersTo(FIELD_KEY) || ref.refersTo(FIELD_VALUE));
    }

    /**
     * Returns true if any node of the subtree is a field key or field value
     * reference.
     *
     * @param expr the expression to search
     * @return true if a field reference is present
     */
    public static boolean containsFieldKeyOrValue(Expression expr) {
        boolean[] found = {false};
        ExpressionUtils.walk(expr, node -> found[0] |= isFieldKeyOrValue(node));
        return found[0];
    }
}
