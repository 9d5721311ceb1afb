package com.hogql.ast;

import com.hogql.generator.HogQLQuoting;
import java.math.BigDecimal;
import java.util.Objects;

/**
 * A literal constant value.
 *
 * <p>Supported values:
 * <ul>
 *   <li>Strings: {@code '$pageview'}</li>
 *   <li>Numbers: {@code 1}, {@code 0.5}</li>
 *   <li>Booleans: {@code true}, {@code false}</li>
 *   <li>Null: {@code NULL}</li>
 * </ul>
 */
public final class Constant implements Expr {

    private static final Constant NULL = new Constant(null);

    private final Object value;

    /**
     * Creates a constant.
     *
     * @param value a String, Number, Boolean or null
     * @throws IllegalArgumentException if the value has any other type
     */
    public Constant(Object value) {
        if (value != null && !(value instanceof String)
                && !(value instanceof Number) && !(value instanceof Boolean)) {
            throw new IllegalArgumentException(
                "Unsupported constant type: " + value.getClass().getName());
        }
        this.value = value;
    }

    /**
     * Returns the constant value.
     *
     * @return the value, or null for NULL
     */
    public Object value() {
        return value;
    }

    public boolean isNull() {
        return value == null;
    }

    public boolean isString() {
        return value instanceof String;
    }

    /**
     * Returns whether this is a numeric constant equal to one.
     *
     * @return true for {@code 1}, {@code 1.0} and similar
     */
    public boolean isOne() {
        if (value instanceof BigDecimal decimal) {
            // exact, doubleValue() rounds 1.0000000000000000001 to 1
            return decimal.compareTo(BigDecimal.ONE) == 0;
        }
        return value instanceof Number number && number.doubleValue() == 1.0d;
    }

    @Override
    public String toHogQL() {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof String str) {
            return HogQLQuoting.quoteLiteral(str);
        }
        return value.toString();
    }

    @Override
    public String toString() {
        return toHogQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Constant)) return false;
        Constant that = (Constant) obj;
        return Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    // ==================== Factory Methods ====================

    public static Constant of(Object value) {
        return value == null ? NULL : new Constant(value);
    }

    public static Constant nullValue() {
        return NULL;
    }
}
