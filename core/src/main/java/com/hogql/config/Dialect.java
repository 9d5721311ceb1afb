package com.hogql.config;

/**
 * Target SQL dialect of a query compilation.
 */
public enum Dialect {
    HOGQL,
    CLICKHOUSE;

    /**
     * Parse a dialect name (case-insensitive).
     *
     * @param value "hogql" or "clickhouse"
     * @return the parsed dialect
     * @throws IllegalArgumentException if value is not recognized
     */
    public static Dialect parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Dialect must not be null");
        }
        return switch (value.trim().toLowerCase()) {
            case "hogql" -> HOGQL;
            case "clickhouse" -> CLICKHOUSE;
            default -> throw new IllegalArgumentException(
                "Unknown dialect: '%s'. Valid values: hogql, clickhouse".formatted(value));
        };
    }
}
