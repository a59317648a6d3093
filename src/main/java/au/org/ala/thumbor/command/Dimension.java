package au.org.ala.thumbor.command;

import java.util.Objects;

/**
 * One side of a resize box: either a pixel count or the literal {@code orig},
 * meaning the source image's own size on that axis.
 */
public final class Dimension {

    public static final String ORIG_TOKEN = "orig";

    private static final Dimension ORIG = new Dimension(true, 0);

    private final boolean original;
    private final int pixels;

    private Dimension(boolean original, int pixels) {
        this.original = original;
        this.pixels = pixels;
    }

    public static Dimension of(int pixels) { return new Dimension(false, pixels); }

    public static Dimension orig() { return ORIG; }

    /**
     * Parse a dimension token: {@code orig} (any case) or a signed integer.
     */
    public static Dimension parse(String s) {
        if (s == null) throw new IllegalArgumentException("Dimension string is null");
        String in = s.trim();
        if (in.equalsIgnoreCase(ORIG_TOKEN)) return orig();
        try {
            return of(Integer.parseInt(in));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid dimension: " + s, e);
        }
    }

    public boolean isOriginal() {
        return original;
    }

    /**
     * @throws IllegalStateException for {@link #orig()}, which has no magnitude
     */
    public int getPixels() {
        if (original) throw new IllegalStateException("orig dimension has no pixel value");
        return pixels;
    }

    /**
     * Canonical token, negated when {@code flipped}. {@code orig} is never negated.
     */
    public String canonical(boolean flipped) {
        if (original) return ORIG_TOKEN;
        int value = flipped ? -Math.abs(pixels) : pixels;
        return Integer.toString(value);
    }

    public String canonical() {
        return canonical(false);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Dimension)) return false;
        Dimension that = (Dimension) o;
        return original == that.original && pixels == that.pixels;
    }

    @Override
    public int hashCode() {
        return Objects.hash(original, pixels);
    }

    @Override
    public String toString() {
        return canonical();
    }
}
