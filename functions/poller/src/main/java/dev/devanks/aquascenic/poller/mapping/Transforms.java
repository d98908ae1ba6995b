package dev.devanks.aquascenic.poller.mapping;

import java.util.function.UnaryOperator;

/**
 * Value conversions between pool document fields and device capabilities.
 */
public final class Transforms {

    private Transforms() {
    }

    /**
     * Remote value divided by {@code divisor}, e.g. pH 740 -> 7.4.
     */
    public static UnaryOperator<Object> scaledDown(double divisor) {
        return value -> asNumber(value) / divisor;
    }

    /**
     * Capability value multiplied by {@code factor} and rounded to a whole number.
     */
    public static UnaryOperator<Object> scaledUp(double factor) {
        return value -> Math.round(asNumber(value) * factor);
    }

    /**
     * Same as {@link #scaledUp}, written as a decimal string.
     */
    public static UnaryOperator<Object> scaledUpAsString(double factor) {
        return value -> Long.toString(Math.round(asNumber(value) * factor));
    }

    public static UnaryOperator<Object> secondsToHours() {
        return value -> Math.round(asNumber(value) / 3600);
    }

    public static UnaryOperator<Object> truthy() {
        return Transforms::isTruthy;
    }

    public static UnaryOperator<Object> truthToCode() {
        return value -> isTruthy(value) ? 1L : 0L;
    }

    public static UnaryOperator<Object> toLabel(CodeTable table) {
        return table::label;
    }

    public static UnaryOperator<Object> toCode(CodeTable table) {
        return table::code;
    }

    /**
     * Numbers and numeric strings ({@code "720"}) as a double.
     *
     * @throws IllegalArgumentException for anything else
     */
    public static double asNumber(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            try {
                return Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Not a number: '" + value + "'", e);
            }
        }
        throw new IllegalArgumentException("Not a number: " + value);
    }

    /**
     * Whole-number view of a code, or {@code null} when the value is not a whole number.
     */
    static Long asWholeNumber(Object value) {
        try {
            double d = asNumber(value);
            return d == Math.rint(d) && !Double.isInfinite(d) ? (long) d : null;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /**
     * Truthiness of a loosely typed document value: 0, empty strings, NaN and null are false.
     */
    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            return d != 0 && !Double.isNaN(d);
        }
        if (value instanceof String) {
            return !((String) value).isEmpty();
        }
        return true;
    }
}
