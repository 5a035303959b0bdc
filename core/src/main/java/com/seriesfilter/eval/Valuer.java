package com.seriesfilter.eval;

import java.util.Optional;

/**
 * Supplies values for references during constant reduction.
 *
 * <p>A valuer is passed explicitly to {@link ExpressionReducer#reduce}; the
 * reducer never consults any other source of variable bindings.
 */
@FunctionalInterface
public interface Valuer {

    /**
     * Looks up the value bound to a reference name.
     *
     * @param key the reference name, without any type annotation
     * @return the bound value, or empty if the name is unbound
     */
    Optional<Object> value(String key);

    /**
     * Returns a valuer that binds nothing.
     *
     * @return the empty valuer
     */
    static Valuer none() {
        return key -> Optional.empty();
    }
}
