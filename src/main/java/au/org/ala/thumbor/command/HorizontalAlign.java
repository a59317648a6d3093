package au.org.ala.thumbor.command;

/**
 * Horizontal alignment used when the width is cut down by cropping.
 */
public enum HorizontalAlign {
    LEFT, CENTER, RIGHT;

    public String canonical() { return name().toLowerCase(); }

    /**
     * Parse alignment token, case-insensitive. Accepts "centre" as a synonym for center.
     */
    public static HorizontalAlign parse(String s) {
        if (s == null) throw new IllegalArgumentException("Horizontal alignment string is null");
        String in = s.trim().toLowerCase();
        switch (in) {
            case "left":
                return LEFT;
            case "center":
            case "centre":
                return CENTER;
            case "right":
                return RIGHT;
            default:
                throw new IllegalArgumentException("Unknown horizontal alignment: " + s);
        }
    }
}
