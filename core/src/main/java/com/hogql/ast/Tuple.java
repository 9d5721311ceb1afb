package com.hogql.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A tuple of expressions, used to carry several aggregate states in one column:
 * <pre>
 *   (uniqState(person_id), countState()) AS user_stats
 * </pre>
 *
 * <p>A single-element tuple renders as {@code tuple(x)} so it is not read back as a
 * parenthesised expression.
 */
public final class Tuple implements Expr {

    private final List<Expr> exprs;

    public Tuple(List<Expr> exprs) {
        Objects.requireNonNull(exprs, "exprs must not be null");
        if (exprs.isEmpty()) {
            throw new IllegalArgumentException("Tuple must have at least one element");
        }
        this.exprs = new ArrayList<>(exprs);
    }

    public List<Expr> exprs() {
        return Collections.unmodifiableList(exprs);
    }

    @Override
    public String toHogQL() {
        String elements = exprs.stream()
            .map(Expr::toHogQL)
            .collect(Collectors.joining(", "));
        return exprs.size() == 1 ? "tuple(" + elements + ")" : "(" + elements + ")";
    }

    @Override
    public String toString() {
        return toHogQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Tuple)) return false;
        return Objects.equals(exprs, ((Tuple) obj).exprs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Tuple.class, exprs);
    }

    public static Tuple of(Expr... exprs) {
        return new Tuple(List.of(exprs));
    }
}
