package com.hogql.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Logical AND of zero or more boolean expressions.
 */
public final class And implements Expr {

    private final List<Expr> exprs;

    public And(List<Expr> exprs) {
        this.exprs = new ArrayList<>(Objects.requireNonNull(exprs, "exprs must not be null"));
    }

    /**
     * Returns the operands.
     *
     * @return an unmodifiable list of operands
     */
    public List<Expr> exprs() {
        return Collections.unmodifiableList(exprs);
    }

    @Override
    public String toHogQL() {
        return exprs.stream()
            .map(Expr::toHogQL)
            .collect(Collectors.joining(" AND ", "(", ")"));
    }

    @Override
    public String toString() {
        return toHogQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof And)) return false;
        And that = (And) obj;
        return Objects.equals(exprs, that.exprs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), exprs);
    }

    public static And of(Expr... exprs) {
        return new And(List.of(exprs));
    }
}
