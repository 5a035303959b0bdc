package com.seriesfilter.expression;

import java.util.Objects;

/**
 * Expression representing an unresolved reference to a variable.
 *
 * <p>A reference names a tag, a field, or one of the pseudo variables
 * described in {@link PseudoReferences}. Whether a reference is a tag or a
 * field is recorded as an optional type annotation that survives rendering:
 * <pre>
 *   host            -- untyped
 *   host::tag       -- tag
 *   usage::field    -- field
 *   "$"             -- field value pseudo variable (quoted, not an identifier)
 * </pre>
 */
public final class VarRef implements Expression {

    /**
     * Type annotation attached to a reference.
     */
    public enum Type {
        UNKNOWN(""),
        TAG("tag"),
        FIELD("field");

        private final String keyword;

        Type(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }
    }

    private final String name;
    private final Type type;

    /**
     * Creates a reference.
     *
     * @param name the referenced name
     * @param type the type annotation
     */
    public VarRef(String name, Type type) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.type = Objects.requireNonNull(type, "type must not be null");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("name must not be empty");
        }
    }

    public String name() {
        return name;
    }

    public Type type() {
        return type;
    }

    /**
     * Returns whether this reference names the given variable, ignoring the
     * type annotation.
     *
     * @param candidate the name to compare with
     * @return true if the names are equal
     */
    public boolean refersTo(String candidate) {
        return name.equals(candidate);
    }

    @Override
    public String render() {
        String quoted = QueryQuoting.quoteIdentifierIfNeeded(name);
        if (type == Type.UNKNOWN) {
            return quoted;
        }
        return quoted + "::" + type.keyword();
    }

    @Override
    public String toString() {
        return render();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof VarRef)) return false;
        VarRef that = (VarRef) obj;
        return name.equals(that.name) && type == that.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    // ==================== Factory Methods ====================

    public static VarRef of(String name) {
        return new VarRef(name, Type.UNKNOWN);
    }

    public static VarRef tag(String name) {
        return new VarRef(name, Type.TAG);
    }

    public static VarRef field(String name) {
        return new VarRef(name, Type.FIELD);
    }
}
