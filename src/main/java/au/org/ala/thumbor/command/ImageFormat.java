package au.org.ala.thumbor.command;

/**
 * Output formats accepted by the {@code format} filter. AVIF and HEIC need Thumbor 7 or later.
 */
public enum ImageFormat {
    WEBP("webp"),
    JPEG("jpeg"),
    PNG("png"),
    GIF("gif"),
    AVIF("avif"),
    HEIC("heic");

    private final String formatName;

    ImageFormat(String formatName) {
        this.formatName = formatName;
    }

    public String canonical() { return formatName; }

    /**
     * Parse output format token. Case-insensitive, accepts jpg as a synonym for jpeg.
     */
    public static ImageFormat parse(String s) {
        if (s == null) throw new IllegalArgumentException("Format string is null");
        String in = s.trim().toLowerCase();
        switch (in) {
            case "webp":
                return WEBP;
            case "jpg":
            case "jpeg":
                return JPEG;
            case "png":
                return PNG;
            case "gif":
                return GIF;
            case "avif":
                return AVIF;
            case "heic":
                return HEIC;
            default:
                throw new IllegalArgumentException("Unknown format: " + s);
        }
    }
}
