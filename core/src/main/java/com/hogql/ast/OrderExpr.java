package com.hogql.ast;

import java.util.Objects;

/**
 * One entry of an {@code ORDER BY} clause.
 */
public final class OrderExpr implements Expr {

    public enum Direction { ASC, DESC }

    private final Expr expr;
    private final Direction direction;

    public OrderExpr(Expr expr, Direction direction) {
        this.expr = Objects.requireNonNull(expr, "expr must not be null");
        this.direction = Objects.requireNonNull(direction, "direction must not be null");
    }

    public Expr expr() {
        return expr;
    }

    public Direction direction() {
        return direction;
    }

    @Override
    public String toHogQL() {
        return expr.toHogQL() + " " + direction.name();
    }

    @Override
    public String toString() {
        return toHogQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof OrderExpr)) return false;
        OrderExpr that = (OrderExpr) obj;
        return direction == that.direction && Objects.equals(expr, that.expr);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expr, direction);
    }

    public static OrderExpr asc(Expr expr) {
        return new OrderExpr(expr, Direction.ASC);
    }

    public static OrderExpr desc(Expr expr) {
        return new OrderExpr(expr, Direction.DESC);
    }
}
