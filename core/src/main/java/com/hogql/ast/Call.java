package com.hogql.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A function call with zero or more arguments.
 *
 * <p>Examples:
 * <pre>
 *   count()                          -- aggregate, no arguments
 *   uniq(person_id)                  -- aggregate
 *   countIf(event = '$pageview')     -- conditional aggregate
 *   sumMerge(pageviews_count_state)  -- merge of a pre-aggregated state column
 *   equals(event, '$pageview')       -- comparison in call form
 * </pre>
 */
public final class Call implements Expr {

    private final String name;
    private final List<Expr> args;
    private final boolean distinct;

    /**
     * Creates a function call.
     *
     * @param name the function name
     * @param args the arguments
     * @param distinct whether DISTINCT is applied to the arguments
     */
    public Call(String name, List<Expr> args, boolean distinct) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        if (this.name.trim().isEmpty()) {
            throw new IllegalArgumentException("name must not be empty");
        }
        this.args = new ArrayList<>(Objects.requireNonNull(args, "args must not be null"));
        this.distinct = distinct;
    }

    /**
     * Creates a non-distinct function call.
     *
     * @param name the function name
     * @param args the arguments
     */
    public Call(String name, List<Expr> args) {
        this(name, args, false);
    }

    /**
     * Returns the function name, as written (HogQL function names are case-sensitive).
     *
     * @return the function name
     */
    public String name() {
        return name;
    }

    /**
     * Returns the function arguments.
     *
     * @return an unmodifiable list of arguments
     */
    public List<Expr> args() {
        return Collections.unmodifiableList(args);
    }

    public boolean distinct() {
        return distinct;
    }

    @Override
    public String toHogQL() {
        String argsSQL = args.stream()
            .map(Expr::toHogQL)
            .collect(Collectors.joining(", "));
        return name + "(" + (distinct ? "DISTINCT " : "") + argsSQL + ")";
    }

    @Override
    public String toString() {
        return toHogQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Call)) return false;
        Call that = (Call) obj;
        return distinct == that.distinct &&
               Objects.equals(name, that.name) &&
               Objects.equals(args, that.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, args, distinct);
    }

    // ==================== Factory Methods ====================

    /**
     * Creates a function call.
     *
     * @param name the function name
     * @param args the arguments
     * @return the call
     */
    public static Call of(String name, Expr... args) {
        return new Call(name, List.of(args));
    }
}
