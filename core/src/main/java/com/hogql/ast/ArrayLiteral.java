package com.hogql.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An array of expressions, typically the right-hand side of an {@code IN}:
 * <pre>
 *   event IN ['$pageview', '$screen']
 * </pre>
 */
public final class ArrayLiteral implements Expr {

    private final List<Expr> exprs;

    public ArrayLiteral(List<Expr> exprs) {
        this.exprs = new ArrayList<>(Objects.requireNonNull(exprs, "exprs must not be null"));
    }

    public List<Expr> exprs() {
        return Collections.unmodifiableList(exprs);
    }

    @Override
    public String toHogQL() {
        return exprs.stream()
            .map(Expr::toHogQL)
            .collect(Collectors.joining(", ", "[", "]"));
    }

    @Override
    public String toString() {
        return toHogQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ArrayLiteral)) return false;
        return Objects.equals(exprs, ((ArrayLiteral) obj).exprs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ArrayLiteral.class, exprs);
    }

    public static ArrayLiteral of(Expr... exprs) {
        return new ArrayLiteral(List.of(exprs));
    }
}
