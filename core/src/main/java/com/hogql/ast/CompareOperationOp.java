package com.hogql.ast;

/**
 * Operators of a {@link CompareOperation}.
 */
public enum CompareOperationOp {
    EQ("=", "equals"),
    NOT_EQ("!=", "notEquals"),
    LT("<", "less"),
    LT_EQ("<=", "lessOrEquals"),
    GT(">", "greater"),
    GT_EQ(">=", "greaterOrEquals"),
    LIKE("LIKE", "like"),
    NOT_LIKE("NOT LIKE", "notLike"),
    ILIKE("ILIKE", "ilike"),
    NOT_ILIKE("NOT ILIKE", "notILike"),
    IN("IN", "in"),
    NOT_IN("NOT IN", "notIn");

    private final String symbol;
    private final String functionName;

    CompareOperationOp(String symbol, String functionName) {
        this.symbol = symbol;
        this.functionName = functionName;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Returns the name of the function equivalent to this operator, e.g.
     * {@code equals} for {@code =}.
     *
     * @return the function name
     */
    public String functionName() {
        return functionName;
    }
}
