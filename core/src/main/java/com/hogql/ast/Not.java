package com.hogql.ast;

import java.util.Objects;

/**
 * Logical negation.
 */
public final class Not implements Expr {

    private final Expr expr;

    public Not(Expr expr) {
        this.expr = Objects.requireNonNull(expr, "expr must not be null");
    }

    public Expr expr() {
        return expr;
    }

    @Override
    public String toHogQL() {
        return "NOT " + expr.toHogQL();
    }

    @Override
    public String toString() {
        return toHogQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Not)) return false;
        return Objects.equals(expr, ((Not) obj).expr);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Not.class, expr);
    }
}
