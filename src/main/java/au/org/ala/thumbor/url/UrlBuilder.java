package au.org.ala.thumbor.url;

import au.org.ala.thumbor.command.CommandSet;
import au.org.ala.thumbor.command.Dimension;
import au.org.ala.thumbor.command.Filter;
import au.org.ala.thumbor.command.HorizontalAlign;
import au.org.ala.thumbor.command.ImageFormat;
import au.org.ala.thumbor.command.TrimColourSource;
import au.org.ala.thumbor.command.VerticalAlign;

import java.util.List;
import java.util.Objects;

/**
 * Fluent builder for a Thumbor URL. Each call records an operation on the underlying
 * {@link CommandSet} and returns this builder, e.g.
 *
 * <pre>
 * String url = thumbor.url("https://example.com/image.jpg")
 *         .fitIn(640, 480)
 *         .smartCrop(true)
 *         .webp()
 *         .quality(80)
 *         .toString();
 * </pre>
 *
 * Not thread safe; use {@link #copy()} to branch a builder.
 */
public class UrlBuilder {

    private final String server;
    private final String secret;
    private final String original;
    private final CommandSet commands;

    public UrlBuilder(String server, String secret, String original) {
        this(server, secret, original, new CommandSet());
    }

    private UrlBuilder(String server, String secret, String original, CommandSet commands) {
        this.server = Objects.requireNonNull(server, "server");
        this.secret = secret;
        this.original = Objects.requireNonNull(original, "original");
        this.commands = commands;
    }

    /**
     * An independent builder with the same address and a copy of the current operations.
     */
    public UrlBuilder copy() {
        return new UrlBuilder(server, secret, original, new CommandSet(commands));
    }

    public UrlBuilder trim() {
        commands.trim();
        return this;
    }

    public UrlBuilder trim(String colourSource) {
        commands.trim(colourSource);
        return this;
    }

    public UrlBuilder trim(String colourSource, Integer tolerance) {
        commands.trim(colourSource, tolerance);
        return this;
    }

    public UrlBuilder trim(TrimColourSource colourSource, Integer tolerance) {
        commands.trim(colourSource, tolerance);
        return this;
    }

    public UrlBuilder crop(int topLeftX, int topLeftY, int bottomRightX, int bottomRightY) {
        commands.crop(topLeftX, topLeftY, bottomRightX, bottomRightY);
        return this;
    }

    public UrlBuilder fitIn(int width, int height) {
        commands.fitIn(width, height);
        return this;
    }

    public UrlBuilder fullFitIn(int width, int height) {
        commands.fullFitIn(width, height);
        return this;
    }

    public UrlBuilder adaptiveFitIn(int width, int height) {
        commands.adaptiveFitIn(width, height);
        return this;
    }

    public UrlBuilder resize(int width, int height) {
        commands.resize(width, height);
        return this;
    }

    public UrlBuilder resize(Dimension width, Dimension height) {
        commands.resize(width, height);
        return this;
    }

    public UrlBuilder flipHorizontal() {
        return flipHorizontal(true);
    }

    public UrlBuilder flipHorizontal(boolean flip) {
        commands.flipHorizontal(flip);
        return this;
    }

    public UrlBuilder flipVertical() {
        return flipVertical(true);
    }

    public UrlBuilder flipVertical(boolean flip) {
        commands.flipVertical(flip);
        return this;
    }

    public UrlBuilder halign(String halign) {
        commands.halign(halign);
        return this;
    }

    public UrlBuilder halign(HorizontalAlign halign) {
        commands.halign(halign);
        return this;
    }

    public UrlBuilder valign(String valign) {
        commands.valign(valign);
        return this;
    }

    public UrlBuilder valign(VerticalAlign valign) {
        commands.valign(valign);
        return this;
    }

    public UrlBuilder smartCrop(boolean smartCrop) {
        commands.smartCrop(smartCrop);
        return this;
    }

    public UrlBuilder metadataOnly(boolean metadataOnly) {
        commands.metadataOnly(metadataOnly);
        return this;
    }

    public UrlBuilder addFilter(Filter filter) {
        commands.addFilter(filter);
        return this;
    }

    public UrlBuilder addFilter(String name, Object... args) {
        commands.addFilter(name, args);
        return this;
    }

    public UrlBuilder quality(int quality) {
        commands.quality(quality);
        return this;
    }

    public UrlBuilder format(String format) {
        commands.format(format);
        return this;
    }

    public UrlBuilder format(ImageFormat format) {
        commands.format(format);
        return this;
    }

    public UrlBuilder webp() {
        commands.webp();
        return this;
    }

    public UrlBuilder avif() {
        commands.avif();
        return this;
    }

    public UrlBuilder blur(int radius) {
        commands.blur(radius);
        return this;
    }

    public UrlBuilder blur(int radius, int sigma) {
        commands.blur(radius, sigma);
        return this;
    }

    public UrlBuilder brightness(int amount) {
        commands.brightness(amount);
        return this;
    }

    public UrlBuilder contrast(int amount) {
        commands.contrast(amount);
        return this;
    }

    public UrlBuilder grayscale() {
        commands.grayscale();
        return this;
    }

    public UrlBuilder rotate(int angle) {
        commands.rotate(angle);
        return this;
    }

    public UrlBuilder sharpen(double amount, double radius) {
        commands.sharpen(amount, radius);
        return this;
    }

    public UrlBuilder sharpen(double amount, double radius, boolean luminanceOnly) {
        commands.sharpen(amount, radius, luminanceOnly);
        return this;
    }

    public UrlBuilder noise(int amount) {
        commands.noise(amount);
        return this;
    }

    public UrlBuilder watermark(String imageUrl) {
        commands.watermark(imageUrl);
        return this;
    }

    public UrlBuilder watermark(String imageUrl, int x, int y, int alpha) {
        commands.watermark(imageUrl, x, y, alpha);
        return this;
    }

    public UrlBuilder fill(String color) {
        commands.fill(color);
        return this;
    }

    public UrlBuilder roundCorners(int radius) {
        commands.roundCorners(radius);
        return this;
    }

    public UrlBuilder roundCorners(int radius, int red, int green, int blue) {
        commands.roundCorners(radius, red, green, blue);
        return this;
    }

    public UrlBuilder stripExif() {
        commands.stripExif();
        return this;
    }

    public UrlBuilder stripIcc() {
        commands.stripIcc();
        return this;
    }

    public UrlBuilder noUpscale() {
        commands.noUpscale();
        return this;
    }

    public UrlBuilder saturation(double amount) {
        commands.saturation(amount);
        return this;
    }

    public UrlBuilder rgb(int red, int green, int blue) {
        commands.rgb(red, green, blue);
        return this;
    }

    public UrlBuilder maxBytes(long bytes) {
        commands.maxBytes(bytes);
        return this;
    }

    public UrlBuilder equalize() {
        commands.equalize();
        return this;
    }

    public UrlBuilder convolution(int[] matrix, int columns) {
        commands.convolution(matrix, columns);
        return this;
    }

    public UrlBuilder convolution(int[] matrix, int columns, boolean normalize) {
        commands.convolution(matrix, columns, normalize);
        return this;
    }

    public UrlBuilder convolution(double[] matrix, int columns) {
        commands.convolution(matrix, columns);
        return this;
    }

    public UrlBuilder convolution(double[] matrix, int columns, boolean normalize) {
        commands.convolution(matrix, columns, normalize);
        return this;
    }

    public String getServer() { return server; }

    public String getOriginal() { return original; }

    /**
     * The path segments the current operations render to.
     */
    public List<String> getCommands() { return commands.toArray(); }

    public ThumborUrl build() {
        return new ThumborUrl(server, secret, original, commands.toArray());
    }

    @Override
    public String toString() {
        return build().toString();
    }
}
