package com.seriesfilter.reads;

import com.seriesfilter.expression.Expression;

import java.util.Objects;
import java.util.Optional;

/**
 * The parts of a read filter each stage of a storage read needs.
 *
 * <ul>
 *   <li>{@link #condition()} - the full predicate, evaluated per row during the scan</li>
 *   <li>{@link #measurement()} - the only measurement that can match, if the
 *       predicate pins one</li>
 *   <li>{@link #indexCondition()} - the tag-only predicate used to select
 *       series from the index; empty when every series matches</li>
 * </ul>
 */
public final class ReadPredicate {

    private static final ReadPredicate MATCH_ALL = new ReadPredicate(null, null, null);

    private final Expression condition;
    private final String measurement;
    private final Expression indexCondition;

    ReadPredicate(Expression condition, String measurement, Expression indexCondition) {
        this.condition = condition;
        this.measurement = measurement;
        this.indexCondition = indexCondition;
    }

    /**
     * Returns the predicate of a read without a filter.
     *
     * @return the match-all predicate
     */
    public static ReadPredicate matchAll() {
        return MATCH_ALL;
    }

    public Optional<Expression> condition() {
        return Optional.ofNullable(condition);
    }

    public Optional<String> measurement() {
        return Optional.ofNullable(measurement);
    }

    public Optional<Expression> indexCondition() {
        return Optional.ofNullable(indexCondition);
    }

    /**
     * Returns true if the index does not need to filter series.
     *
     * @return true when there is no index condition
     */
    public boolean matchesAllSeries() {
        return indexCondition == null;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ReadPredicate)) return false;
        ReadPredicate that = (ReadPredicate) obj;
        return Objects.equals(condition, that.condition) &&
               Objects.equals(measurement, that.measurement) &&
               Objects.equals(indexCondition, that.indexCondition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(condition, measurement, indexCondition);
    }

    @Override
    public String toString() {
        return "ReadPredicate{condition=" + condition +
               ", measurement=" + measurement +
               ", indexCondition=" + indexCondition + "}";
    }
}
