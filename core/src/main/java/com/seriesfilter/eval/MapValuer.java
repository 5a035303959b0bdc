package com.seriesfilter.eval;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link Valuer} backed by an immutable copy of a map.
 *
 * <p>Example usage:
 * <pre>
 *   Valuer valuer = MapValuer.of(Map.of("host", "host1"));
 *   Expression reduced = ExpressionReducer.reduce(expr, valuer);
 * </pre>
 */
public final class MapValuer implements Valuer {

    private final Map<String, Object> values;

    private MapValuer(Map<String, ?> values) {
        this.values = Map.copyOf(Objects.requireNonNull(values, "values must not be null"));
    }

    public static MapValuer of(Map<String, ?> values) {
        return new MapValuer(values);
    }

    @Override
    public Optional<Object> value(String key) {
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public String toString() {
        return "MapValuer" + values;
    }
}
