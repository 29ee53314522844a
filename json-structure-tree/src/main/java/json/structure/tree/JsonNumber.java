package json.structure.tree;

import java.math.BigDecimal;

/// A JSON number held as an IEEE 754 double.
///
/// Integral values render without a fractional part (`3`, not `3.0`), the way
/// a browser renders them; every other value uses [Double#toString(double)],
/// which is still valid JSON number syntax.
///
/// @param value the finite numeric value
public record JsonNumber(double value) implements JsonValue {

    /// Beyond this magnitude integral values switch to exponent notation.
    private static final double PLAIN_LIMIT = 1e21;

    public JsonNumber {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Not a valid JSON number: " + value);
        }
    }

    /// {@return a JSON number for the given `double`}
    /// @throws IllegalArgumentException if `value` is NaN or infinite
    public static JsonNumber of(double value) {
        return new JsonNumber(value);
    }

    /// {@return a JSON number for the given `long`}
    public static JsonNumber of(long value) {
        return new JsonNumber(value);
    }

    /// {@return `true` if this number has no fractional component}
    public boolean isIntegral() {
        return value == Math.rint(value);
    }

    @Override
    public Kind kind() {
        return Kind.NUMBER;
    }

    @Override
    public double toDouble() {
        return value;
    }

    @Override
    public long toLong() {
        if (!isIntegral() || value < Long.MIN_VALUE || value > Long.MAX_VALUE) {
            throw new JsonAssertionException("JsonNumber " + this + " cannot be represented as a long.");
        }
        return (long) value;
    }

    @Override
    public String toString() {
        if (isIntegral() && Math.abs(value) < PLAIN_LIMIT) {
            // new BigDecimal(double) is exact for integral doubles; -0.0 renders as 0
            return new BigDecimal(value).toPlainString();
        }
        return Double.toString(value);
    }
}
