package au.org.ala.thumbor.command;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The set of image operations requested for one Thumbor URL.
 *
 * Mutators only record what was asked for. Nothing is range checked: Thumbor itself is lenient
 * and out of range values are passed straight through. {@link #toArray()} renders the
 * operations as URL path segments in the order Thumbor expects:
 * meta, trim, crop, resize, halign, valign, smart, filters.
 *
 * @see <a href="https://thumbor.readthedocs.io/en/latest/usage.html">Thumbor usage</a>
 */
public class CommandSet {

    private static final Joiner FILTER_JOINER = Joiner.on(':');

    private String trim;
    private String crop;
    private Resize resize;
    private String halign;
    private String valign;
    private boolean smartCrop;
    private boolean metadataOnly;
    private boolean flipHorizontal;
    private boolean flipVertical;
    private final List<Filter> filters;

    public CommandSet() {
        filters = new ArrayList<>();
    }

    /**
     * Copy constructor. Everything except the filter list is immutable, so only that is copied.
     */
    public CommandSet(CommandSet other) {
        trim = other.trim;
        crop = other.crop;
        resize = other.resize;
        halign = other.halign;
        valign = other.valign;
        smartCrop = other.smartCrop;
        metadataOnly = other.metadataOnly;
        flipHorizontal = other.flipHorizontal;
        flipVertical = other.flipVertical;
        filters = new ArrayList<>(other.filters);
    }

    /**
     * Trim surrounding space, taking the background colour from the top-left pixel.
     */
    public void trim() {
        trim((String) null, null);
    }

    public void trim(String colourSource) {
        trim(colourSource, null);
    }

    /**
     * Trim surrounding space.
     *
     * @param colourSource {@code top-left} or {@code bottom-right}, or null for the server default
     * @param tolerance euclidean colour distance (0-442 for RGB), or null for none
     */
    public void trim(String colourSource, Integer tolerance) {
        StringBuilder sb = new StringBuilder("trim");
        if (colourSource != null) {
            sb.append(':').append(colourSource);
        }
        if (tolerance != null) {
            sb.append(':').append(tolerance);
        }
        this.trim = sb.toString();
    }

    public void trim(TrimColourSource colourSource, Integer tolerance) {
        trim(colourSource == null ? null : colourSource.canonical(), tolerance);
    }

    /**
     * Manual crop window. Coordinates are not checked against each other.
     */
    public void crop(int topLeftX, int topLeftY, int bottomRightX, int bottomRightY) {
        this.crop = topLeftX + "x" + topLeftY + ":" + bottomRightX + "x" + bottomRightY;
    }

    /**
     * Fit the image in a box of the given size. Replaces any earlier resize.
     */
    public void fitIn(int width, int height) {
        resize = Resize.fitIn(width, height);
    }

    /**
     * Fit the image by its smallest side. Replaces any earlier resize.
     */
    public void fullFitIn(int width, int height) {
        resize = Resize.fullFitIn(width, height);
    }

    /**
     * Like fit-in, but the box is inverted when that gives a better fit for the image's orientation.
     * Replaces any earlier resize.
     */
    public void adaptiveFitIn(int width, int height) {
        resize = Resize.adaptiveFitIn(width, height);
    }

    /**
     * Resize to the given size. 0 on one side keeps the aspect ratio, e.g. {@code resize(320, 0)} on a 640x480
     * image gives 320x240. Replaces any earlier resize.
     */
    public void resize(int width, int height) {
        resize = Resize.plain(width, height);
    }

    /**
     * Resize allowing {@link Dimension#orig()} on either side, e.g. {@code resize(of(320), orig())} on a 640x480
     * image gives 320x480. Replaces any earlier resize.
     */
    public void resize(Dimension width, Dimension height) {
        resize = Resize.plain(width, height);
    }

    public void flipHorizontal(boolean flip) {
        this.flipHorizontal = flip;
    }

    public void flipVertical(boolean flip) {
        this.flipVertical = flip;
    }

    /**
     * @param halign normally left, center or right; not checked
     */
    public void halign(String halign) {
        this.halign = halign;
    }

    public void halign(HorizontalAlign halign) {
        halign(halign.canonical());
    }

    /**
     * @param valign normally top, middle or bottom; not checked
     */
    public void valign(String valign) {
        this.valign = valign;
    }

    public void valign(VerticalAlign valign) {
        valign(valign.canonical());
    }

    /**
     * Let the server pick the crop focus with feature detection. The server then ignores halign/valign,
     * though they are still written to the URL.
     */
    public void smartCrop(boolean smartCrop) {
        this.smartCrop = smartCrop;
    }

    /**
     * Ask for JSON metadata instead of the image.
     */
    public void metadataOnly(boolean metadataOnly) {
        this.metadataOnly = metadataOnly;
    }

    public void addFilter(Filter filter) {
        filters.add(Objects.requireNonNull(filter, "filter"));
    }

    /**
     * Append a filter. Arguments may be strings, integers, floating point numbers or booleans.
     *
     * @see <a href="https://thumbor.readthedocs.io/en/latest/filters.html">Thumbor filters</a>
     */
    public void addFilter(String name, Object... args) {
        addFilter(Filter.of(name, args));
    }

    // --- Filter shortcuts --------------------------------------------------

    /**
     * @param quality 1-100
     */
    public void quality(int quality) {
        addFilter("quality", quality);
    }

    public void format(String format) {
        addFilter("format", format);
    }

    public void format(ImageFormat format) {
        format(format.canonical());
    }

    public void webp() {
        format(ImageFormat.WEBP);
    }

    public void avif() {
        format(ImageFormat.AVIF);
    }

    public void blur(int radius) {
        addFilter("blur", radius);
    }

    public void blur(int radius, int sigma) {
        addFilter("blur", radius, sigma);
    }

    /**
     * @param amount -100 to 100
     */
    public void brightness(int amount) {
        addFilter("brightness", amount);
    }

    /**
     * @param amount -100 to 100
     */
    public void contrast(int amount) {
        addFilter("contrast", amount);
    }

    public void grayscale() {
        addFilter("grayscale");
    }

    /**
     * @param angle 0, 90, 180 or 270
     */
    public void rotate(int angle) {
        addFilter("rotate", angle);
    }

    public void sharpen(double amount, double radius) {
        sharpen(amount, radius, false);
    }

    public void sharpen(double amount, double radius, boolean luminanceOnly) {
        addFilter("sharpen", amount, radius, luminanceOnly);
    }

    /**
     * @param amount 0-100
     */
    public void noise(int amount) {
        addFilter("noise", amount);
    }

    public void watermark(String imageUrl) {
        watermark(imageUrl, 0, 0, 0);
    }

    /**
     * @param x negative values are measured from the right
     * @param y negative values are measured from the bottom
     * @param alpha 0 (opaque) to 100
     */
    public void watermark(String imageUrl, int x, int y, int alpha) {
        addFilter("watermark", imageUrl, x, y, alpha);
    }

    /**
     * @param color hex without '#', or auto, blur or transparent
     */
    public void fill(String color) {
        addFilter("fill", color);
    }

    public void roundCorners(int radius) {
        addFilter("round_corner", radius);
    }

    public void roundCorners(int radius, int red, int green, int blue) {
        addFilter("round_corner", radius, red, green, blue);
    }

    public void stripExif() {
        addFilter("strip_exif");
    }

    public void stripIcc() {
        addFilter("strip_icc");
    }

    public void noUpscale() {
        addFilter("no_upscale");
    }

    /**
     * @param amount 0.0 to 2.0, 1.0 leaves the image unchanged
     */
    public void saturation(double amount) {
        addFilter("saturation", amount);
    }

    public void rgb(int red, int green, int blue) {
        addFilter("rgb", red, green, blue);
    }

    public void maxBytes(long bytes) {
        addFilter("max_bytes", bytes);
    }

    public void equalize() {
        addFilter("equalize");
    }

    public void convolution(int[] matrix, int columns) {
        convolution(matrix, columns, false);
    }

    public void convolution(int[] matrix, int columns, boolean normalize) {
        String values = Arrays.stream(matrix).mapToObj(Integer::toString).collect(Collectors.joining(";"));
        addFilter("convolution", values, columns, normalize);
    }

    public void convolution(double[] matrix, int columns) {
        convolution(matrix, columns, false);
    }

    public void convolution(double[] matrix, int columns, boolean normalize) {
        String values = Arrays.stream(matrix).mapToObj(FilterArgument::fmt).collect(Collectors.joining(";"));
        addFilter("convolution", values, columns, normalize);
    }

    // --- Accessors ---------------------------------------------------------

    public Resize getResize() { return resize; }

    public boolean isFlipHorizontal() { return flipHorizontal; }

    public boolean isFlipVertical() { return flipVertical; }

    public List<Filter> getFilters() { return ImmutableList.copyOf(filters); }

    /**
     * Render the path segments in canonical order. Flips only show up as negated resize dimensions,
     * so they are dropped when no resize is set.
     */
    public List<String> toArray() {
        ImmutableList.Builder<String> commands = ImmutableList.builder();

        if (metadataOnly) {
            commands.add("meta");
        }
        if (trim != null) {
            commands.add(trim);
        }
        if (crop != null) {
            commands.add(crop);
        }
        if (resize != null) {
            commands.add(resize.canonical(flipHorizontal, flipVertical));
        }
        if (halign != null) {
            commands.add(halign);
        }
        if (valign != null) {
            commands.add(valign);
        }
        if (smartCrop) {
            commands.add("smart");
        }
        if (!filters.isEmpty()) {
            commands.add("filters:" + FILTER_JOINER.join(filters));
        }
        return commands.build();
    }

    @Override
    public String toString() {
        return "CommandSet" + toArray();
    }
}
