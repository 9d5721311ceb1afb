package com.hogql.ast;

import java.util.Objects;

/**
 * A {@code SAMPLE} clause attached to a table in {@code FROM}, e.g. {@code SAMPLE 0.1}.
 */
public final class SampleExpr implements Expr {

    private final Constant ratio;

    public SampleExpr(Constant ratio) {
        this.ratio = Objects.requireNonNull(ratio, "ratio must not be null");
    }

    public Constant ratio() {
        return ratio;
    }

    /**
     * Returns whether this sample reads the whole table.
     *
     * @return true for {@code SAMPLE 1}
     */
    public boolean isFullSample() {
        return ratio.isOne();
    }

    @Override
    public String toHogQL() {
        return "SAMPLE " + ratio.toHogQL();
    }

    @Override
    public String toString() {
        return toHogQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SampleExpr)) return false;
        return Objects.equals(ratio, ((SampleExpr) obj).ratio);
    }

    @Override
    public int hashCode() {
        return Objects.hash(SampleExpr.class, ratio);
    }

    public static SampleExpr of(Number ratio) {
        return new SampleExpr(Constant.of(ratio));
    }
}
