package com.hogql.generator;

import java.util.regex.Pattern;

/**
 * Quoting helpers for rendering HogQL identifiers and string literals.
 *
 * <p>HogQL identifiers may contain {@code $} (as in {@code properties.$host}), so
 * those are left bare. Anything else outside {@code [A-Za-z0-9_$]}, or starting with
 * a digit, is quoted with backticks.
 *
 * <p>Examples:
 * <pre>
 *   quoteIdentifierIfNeeded("$host")        -> $host
 *   quoteIdentifierIfNeeded("my column")    -> `my column`
 *   quoteLiteral("it's")                    -> 'it\'s'
 * </pre>
 */
public final class HogQLQuoting {

    private static final Pattern BARE_IDENTIFIER = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");

    private HogQLQuoting() {}

    /**
     * Quotes an identifier with backticks, escaping embedded backticks and backslashes.
     *
     * @param identifier the identifier
     * @return the quoted identifier
     * @throws IllegalArgumentException if the identifier is null or empty
     */
    public static String quoteIdentifier(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
        String escaped = identifier.replace("\\", "\\\\").replace("`", "\\`");
        return "`" + escaped + "`";
    }

    /**
     * Quotes an identifier only when it cannot be written bare.
     *
     * @param identifier the identifier
     * @return the identifier, quoted if necessary
     * @throws IllegalArgumentException if the identifier is null or empty
     */
    public static String quoteIdentifierIfNeeded(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
        if (BARE_IDENTIFIER.matcher(identifier).matches()) {
            return identifier;
        }
        return quoteIdentifier(identifier);
    }

    /**
     * Quotes a string literal with single quotes.
     *
     * @param value the string value (may be null)
     * @return the quoted literal, or {@code NULL}
     */
    public static String quoteLiteral(String value) {
        if (value == null) {
            return "NULL";
        }
        String escaped = value.replace("\\", "\\\\").replace("'", "\\'");
        return "'" + escaped + "'";
    }
}
