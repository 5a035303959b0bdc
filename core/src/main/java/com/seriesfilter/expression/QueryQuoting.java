package com.seriesfilter.expression;

import java.util.Locale;
import java.util.Set;

/**
 * Utilities for quoting identifiers, string literals and regular expressions
 * when expressions are rendered as query-language text.
 *
 * <p>Example usage:
 * <pre>
 *   QueryQuoting.quoteIdentifierIfNeeded("host");   // host
 *   QueryQuoting.quoteIdentifierIfNeeded("$");      // "$"
 *   QueryQuoting.quoteString("O'Reilly");           // 'O\'Reilly'
 *   QueryQuoting.quoteRegex("^a/b$");               // /^a\/b$/
 * </pre>
 *
 * @see VarRef
 * @see Literal
 */
public final class QueryQuoting {

    /**
     * Reserved words that must be quoted when used as identifiers.
     */
    static final Set<String> KEYWORDS = Set.of(
        "ALL", "ALTER", "ANALYZE", "AND", "ANY", "AS", "ASC", "BEGIN", "BY",
        "CARDINALITY", "CREATE", "CONTINUOUS", "DATABASE", "DATABASES", "DEFAULT",
        "DELETE", "DESC", "DESTINATIONS", "DIAGNOSTICS", "DISTINCT", "DROP",
        "DURATION", "END", "EVERY", "EXACT", "EXPLAIN", "FIELD", "FOR", "FROM",
        "GRANT", "GRANTS", "GROUP", "GROUPS", "IN", "INF", "INSERT", "INTO",
        "KEY", "KEYS", "KILL", "LIMIT", "MEASUREMENT", "MEASUREMENTS", "NAME",
        "OFFSET", "ON", "OR", "ORDER", "PASSWORD", "POLICIES", "POLICY",
        "PRIVILEGES", "QUERIES", "QUERY", "READ", "REPLICATION", "RESAMPLE",
        "RETENTION", "REVOKE", "SELECT", "SERIES", "SET", "SHARD", "SHARDS",
        "SLIMIT", "SOFFSET", "STATS", "SUBSCRIPTION", "SUBSCRIPTIONS", "TAG",
        "TO", "USER", "USERS", "VALUES", "WHERE", "WITH", "WRITE",
        "TRUE", "FALSE"
    );

    private QueryQuoting() {}

    /**
     * Quotes an identifier only when it is not a plain identifier or collides
     * with a keyword.
     *
     * <p>A plain identifier starts with a letter or underscore and continues
     * with letters, digits or underscores.
     *
     * @param identifier the identifier
     * @return the identifier, double-quoted if required
     * @throws IllegalArgumentException if identifier is null or empty
     */
    public static String quoteIdentifierIfNeeded(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
        if (isPlainIdentifier(identifier) && !KEYWORDS.contains(identifier.toUpperCase(Locale.ROOT))) {
            return identifier;
        }
        return quoteIdentifier(identifier);
    }

    /**
     * Double-quotes an identifier, escaping backslashes, quotes and newlines.
     *
     * @param identifier the identifier
     * @return the quoted identifier
     */
    static String quoteIdentifier(String identifier) {
        return "\"" + escape(identifier, '"') + "\"";
    }

    /**
     * Single-quotes a string literal, escaping backslashes, quotes and newlines.
     *
     * @param value the string value
     * @return the quoted literal
     */
    public static String quoteString(String value) {
        return "'" + escape(value, '\'') + "'";
    }

    /**
     * Wraps a regular expression in slashes, escaping embedded slashes.
     *
     * @param pattern the regular expression source
     * @return the delimited regex
     */
    public static String quoteRegex(String pattern) {
        return "/" + pattern.replace("/", "\\/") + "/";
    }

    static boolean isPlainIdentifier(String identifier) {
        char first = identifier.charAt(0);
        if (!(Character.isLetter(first) || first == '_')) {
            return false;
        }
        for (int i = 1; i < identifier.length(); i++) {
            char c = identifier.charAt(i);
            if (!(Character.isLetterOrDigit(c) || c == '_')) {
                return false;
            }
        }
        return true;
    }

    private static String escape(String value, char quote) {
        StringBuilder sb = new StringBuilder(value.length() + 2);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\\') {
                sb.append("\\\\");
            } else if (c == quote) {
                sb.append('\\').append(quote);
            } else if (c == '\n') {
                sb.append("\\n");
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
