package com.hogql.ast;

import com.hogql.generator.HogQLQuoting;
import java.util.Objects;

/**
 * An expression with an output name, as in {@code count() AS pageviews}.
 */
public final class Alias implements Expr {

    private final String alias;
    private final Expr expr;

    public Alias(String alias, Expr expr) {
        this.alias = Objects.requireNonNull(alias, "alias must not be null");
        if (this.alias.isEmpty()) {
            throw new IllegalArgumentException("alias must not be empty");
        }
        this.expr = Objects.requireNonNull(expr, "expr must not be null");
    }

    public String alias() {
        return alias;
    }

    public Expr expr() {
        return expr;
    }

    /**
     * Returns the expression under any number of nested aliases.
     *
     * @param expr the expression to unwrap
     * @return the innermost non-alias expression
     */
    public static Expr unwrap(Expr expr) {
        Expr current = expr;
        while (current instanceof Alias alias) {
            current = alias.expr();
        }
        return current;
    }

    @Override
    public String toHogQL() {
        return expr.toHogQL() + " AS " + HogQLQuoting.quoteIdentifierIfNeeded(alias);
    }

    @Override
    public String toString() {
        return toHogQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Alias)) return false;
        Alias that = (Alias) obj;
        return Objects.equals(alias, that.alias) &&
               Objects.equals(expr, that.expr);
    }

    @Override
    public int hashCode() {
        return Objects.hash(alias, expr);
    }

    public static Alias of(String alias, Expr expr) {
        return new Alias(alias, expr);
    }
}
