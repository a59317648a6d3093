package au.org.ala.thumbor.command;

import java.util.Objects;

/**
 * The single resize directive of a {@link CommandSet}. Flips are not stored here; they are
 * passed in at render time so that the stored value never changes.
 */
public final class Resize {

    public enum Type {
        PLAIN(""),
        FIT_IN("fit-in/"),
        FULL_FIT_IN("full-fit-in/"),
        ADAPTIVE_FIT_IN("adaptive-fit-in/");

        private final String prefix;

        Type(String prefix) {
            this.prefix = prefix;
        }

        public String getPrefix() { return prefix; }
    }

    private final Type type;
    private final Dimension width;
    private final Dimension height;

    private Resize(Type type, Dimension width, Dimension height) {
        this.type = Objects.requireNonNull(type, "type");
        this.width = Objects.requireNonNull(width, "width");
        this.height = Objects.requireNonNull(height, "height");
    }

    public static Resize plain(Dimension width, Dimension height) { return new Resize(Type.PLAIN, width, height); }
    public static Resize plain(int width, int height) { return plain(Dimension.of(width), Dimension.of(height)); }
    public static Resize fitIn(int width, int height) { return new Resize(Type.FIT_IN, Dimension.of(width), Dimension.of(height)); }
    public static Resize fullFitIn(int width, int height) { return new Resize(Type.FULL_FIT_IN, Dimension.of(width), Dimension.of(height)); }
    public static Resize adaptiveFitIn(int width, int height) { return new Resize(Type.ADAPTIVE_FIT_IN, Dimension.of(width), Dimension.of(height)); }

    public Type getType() { return type; }
    public Dimension getWidth() { return width; }
    public Dimension getHeight() { return height; }

    /**
     * Render as {@code [adaptive-][full-]fit-in/WxH} or {@code WxH}. A flipped side is written
     * as the negative of its absolute value; an {@code orig} side is left alone.
     */
    public String canonical(boolean flipHorizontal, boolean flipVertical) {
        return type.getPrefix() + width.canonical(flipHorizontal) + "x" + height.canonical(flipVertical);
    }

    public String canonical() {
        return canonical(false, false);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Resize)) return false;
        Resize resize = (Resize) o;
        return type == resize.type && width.equals(resize.width) && height.equals(resize.height);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, width, height);
    }

    @Override
    public String toString() {
        return "Resize{" +
                "type=" + type +
                ", width=" + width +
                ", height=" + height +
                '}';
    }
}
