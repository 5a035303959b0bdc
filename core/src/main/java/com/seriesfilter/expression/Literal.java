package com.seriesfilter.expression;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Expression representing a literal constant value.
 *
 * <p>Each literal carries an explicit {@link Kind}; values keep the exact
 * type they were created with and are never coerced:
 * <ul>
 *   <li>STRING: {@code 'host1'}</li>
 *   <li>FLOAT: {@code 0.5}, {@code 1.0}</li>
 *   <li>INTEGER: {@code 42}</li>
 *   <li>UNSIGNED: {@code 18446744073709551615}</li>
 *   <li>BOOLEAN: {@code true}, {@code false}</li>
 *   <li>REGEX: {@code /^us-west/}</li>
 *   <li>DURATION: {@code 10s}, {@code 1500ms}</li>
 * </ul>
 */
public final class Literal implements Expression {

    /**
     * Literal kinds.
     */
    public enum Kind {
        STRING,
        FLOAT,
        INTEGER,
        UNSIGNED,
        BOOLEAN,
        REGEX,
        DURATION;

        public boolean isNumeric() {
            return this == FLOAT || this == INTEGER || this == UNSIGNED;
        }
    }

    public static final Literal TRUE = new Literal(Kind.BOOLEAN, Boolean.TRUE);
    public static final Literal FALSE = new Literal(Kind.BOOLEAN, Boolean.FALSE);

    private final Kind kind;
    private final Object value;

    private Literal(Kind kind, Object value) {
        this.kind = kind;
        this.value = Objects.requireNonNull(value, "value must not be null");
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Returns the literal value: a {@link String}, {@link Double},
     * {@link Long} (also for UNSIGNED, holding the raw bits), {@link Boolean},
     * {@link Pattern} or {@link Duration} depending on {@link #kind()}.
     *
     * @return the value, never null
     */
    public Object value() {
        return value;
    }

    public boolean isBoolean() {
        return kind == Kind.BOOLEAN;
    }

    public boolean isTrue() {
        return kind == Kind.BOOLEAN && (Boolean) value;
    }

    public boolean isFalse() {
        return kind == Kind.BOOLEAN && !(Boolean) value;
    }

    public String stringValue() {
        return (String) value;
    }

    public Pattern regexValue() {
        return (Pattern) value;
    }

    @Override
    public String render() {
        switch (kind) {
            case STRING:
                return QueryQuoting.quoteString((String) value);
            case FLOAT:
                return formatFloat((Double) value);
            case UNSIGNED:
                return Long.toUnsignedString((Long) value);
            case REGEX:
                return QueryQuoting.quoteRegex(((Pattern) value).pattern());
            case DURATION:
                return formatDuration((Duration) value);
            default:
                // INTEGER, BOOLEAN
                return value.toString();
        }
    }

    /**
     * Formats a float so that it always reads back as a float: plain decimal
     * notation with at least one fractional digit.
     */
    static String formatFloat(double d) {
        if (!Double.isFinite(d)) {
            return Double.toString(d);
        }
        String plain = BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
        return plain.indexOf('.') < 0 ? plain + ".0" : plain;
    }

    /**
     * Formats a duration using the largest unit that represents it exactly.
     */
    static String formatDuration(Duration duration) {
        long nanos = duration.toNanos();
        if (nanos == 0) {
            return "0s";
        }
        long[] divisors = {
            Duration.ofDays(7).toNanos(), Duration.ofDays(1).toNanos(), Duration.ofHours(1).toNanos(),
            Duration.ofMinutes(1).toNanos(), 1_000_000_000L, 1_000_000L, 1_000L
        };
        String[] units = {"w", "d", "h", "m", "s", "ms", "u"};
        for (int i = 0; i < divisors.length; i++) {
            if (nanos % divisors[i] == 0) {
                return (nanos / divisors[i]) + units[i];
            }
        }
        return nanos + "ns";
    }

    @Override
    public String toString() {
        return render();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Literal)) return false;
        Literal that = (Literal) obj;
        if (kind != that.kind) return false;
        if (kind == Kind.REGEX) {
            // Pattern has identity equality
            return regexValue().pattern().equals(that.regexValue().pattern());
        }
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        Object key = kind == Kind.REGEX ? regexValue().pattern() : value;
        return Objects.hash(kind, key);
    }

    // ==================== Factory Methods ====================

    public static Literal of(String value) {
        return new Literal(Kind.STRING, value);
    }

    public static Literal of(double value) {
        return new Literal(Kind.FLOAT, value);
    }

    public static Literal of(long value) {
        return new Literal(Kind.INTEGER, value);
    }

    public static Literal of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static Literal of(Duration value) {
        return new Literal(Kind.DURATION, value);
    }

    /**
     * Creates an unsigned integer literal from its raw 64-bit representation.
     *
     * @param bits the value, interpreted as unsigned
     * @return the literal expression
     */
    public static Literal unsigned(long bits) {
        return new Literal(Kind.UNSIGNED, bits);
    }

    /**
     * Creates a regex literal.
     *
     * @param pattern the regular expression source
     * @return the literal expression
     * @throws java.util.regex.PatternSyntaxException if the pattern does not compile
     */
    public static Literal regex(String pattern) {
        return new Literal(Kind.REGEX, Pattern.compile(pattern));
    }

    public static Literal regex(Pattern pattern) {
        return new Literal(Kind.REGEX, pattern);
    }
}
