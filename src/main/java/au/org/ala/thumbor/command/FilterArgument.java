package au.org.ala.thumbor.command;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A single filter argument. Each kind has its own text form:
 * booleans as {@code true}/{@code false}, integers in decimal, floating point values as a plain
 * decimal without trailing zeros, and strings unchanged.
 */
public final class FilterArgument {

    public enum Type { STRING, INTEGER, FLOAT, BOOLEAN }

    private final Type type;
    private final String text;

    private FilterArgument(Type type, String text) {
        this.type = type;
        this.text = text;
    }

    public static FilterArgument of(String value) {
        return new FilterArgument(Type.STRING, Objects.requireNonNull(value, "value"));
    }

    public static FilterArgument of(long value) {
        return new FilterArgument(Type.INTEGER, Long.toString(value));
    }

    public static FilterArgument of(double value) {
        return new FilterArgument(Type.FLOAT, fmt(value));
    }

    /**
     * Formatted from the float's own shortest text, so {@code 1.1f} renders as {@code 1.1}.
     */
    public static FilterArgument of(float value) {
        return new FilterArgument(Type.FLOAT, fmt(value));
    }

    public static FilterArgument of(boolean value) {
        return new FilterArgument(Type.BOOLEAN, value ? "true" : "false");
    }

    /**
     * Wrap an untyped value. Accepts {@link FilterArgument}, {@link CharSequence}, {@link Boolean},
     * the integral boxed types and {@link Float}/{@link Double}.
     */
    public static FilterArgument ofObject(Object value) {
        if (value instanceof FilterArgument) return (FilterArgument) value;
        if (value instanceof CharSequence) return of(value.toString());
        if (value instanceof Boolean) return of(((Boolean) value).booleanValue());
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return of(((Number) value).longValue());
        }
        if (value instanceof Float) {
            return of(((Float) value).floatValue());
        }
        if (value instanceof Double) {
            return of(((Double) value).doubleValue());
        }
        throw new IllegalArgumentException("Unsupported filter argument: " +
                (value == null ? "null" : value.getClass().getName()));
    }

    static String fmt(double v) {
        if (Double.isNaN(v) || Double.isInfinite(v)) {
            throw new IllegalArgumentException("Filter argument must be finite: " + v);
        }
        return plain(Double.toString(v));
    }

    static String fmt(float v) {
        if (Float.isNaN(v) || Float.isInfinite(v)) {
            throw new IllegalArgumentException("Filter argument must be finite: " + v);
        }
        return plain(Float.toString(v));
    }

    // Plain decimal, no exponent, trailing zeros stripped
    private static String plain(String text) {
        BigDecimal bd = new BigDecimal(text).stripTrailingZeros();
        String s = bd.toPlainString();
        if (s.equals("-0") || s.equals("-0.0")) return "0";
        return s;
    }

    public Type getType() { return type; }

    public String canonical() { return text; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FilterArgument)) return false;
        FilterArgument that = (FilterArgument) o;
        return type == that.type && text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text);
    }

    @Override
    public String toString() {
        return text;
    }
}
