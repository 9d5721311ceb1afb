package com.hogql.ast;

import java.util.Objects;

/**
 * A binary comparison.
 *
 * <p>Examples:
 * <pre>
 *   event = '$pageview'
 *   team_id = 1
 *   timestamp >= '2024-01-01'
 *   event IN ['$pageview', '$screen']
 * </pre>
 */
public final class CompareOperation implements Expr {

    private final Expr left;
    private final CompareOperationOp op;
    private final Expr right;

    /**
     * Creates a comparison.
     *
     * @param left the left operand
     * @param op the operator
     * @param right the right operand
     */
    public CompareOperation(Expr left, CompareOperationOp op, Expr right) {
        this.left = Objects.requireNonNull(left, "left must not be null");
        this.op = Objects.requireNonNull(op, "op must not be null");
        this.right = Objects.requireNonNull(right, "right must not be null");
    }

    public Expr left() {
        return left;
    }

    public CompareOperationOp op() {
        return op;
    }

    public Expr right() {
        return right;
    }

    @Override
    public String toHogQL() {
        return left.toHogQL() + " " + op.symbol() + " " + right.toHogQL();
    }

    @Override
    public String toString() {
        return toHogQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CompareOperation)) return false;
        CompareOperation that = (CompareOperation) obj;
        return op == that.op &&
               Objects.equals(left, that.left) &&
               Objects.equals(right, that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, op, right);
    }

    // ==================== Factory Methods ====================

    public static CompareOperation of(Expr left, CompareOperationOp op, Expr right) {
        return new CompareOperation(left, op, right);
    }

    public static CompareOperation eq(Expr left, Expr right) {
        return new CompareOperation(left, CompareOperationOp.EQ, right);
    }
}
