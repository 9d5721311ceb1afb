package com.hogql.ast;

import com.hogql.generator.HogQLQuoting;
import java.util.Objects;

/**
 * A common table expression: {@code name AS (SELECT ...)}.
 */
public final class Cte implements Expr {

    private final String name;
    private final Expr expr;

    public Cte(String name, Expr expr) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.expr = Objects.requireNonNull(expr, "expr must not be null");
    }

    public String name() {
        return name;
    }

    public Expr expr() {
        return expr;
    }

    @Override
    public String toHogQL() {
        return HogQLQuoting.quoteIdentifierIfNeeded(name) + " AS (" + expr.toHogQL() + ")";
    }

    @Override
    public String toString() {
        return toHogQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Cte)) return false;
        Cte that = (Cte) obj;
        return Objects.equals(name, that.name) && Objects.equals(expr, that.expr);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, expr);
    }
}
