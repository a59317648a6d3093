package au.org.ala.thumbor.command;

/**
 * Vertical alignment used when the height is cut down by cropping.
 */
public enum VerticalAlign {
    TOP, MIDDLE, BOTTOM;

    public String canonical() { return name().toLowerCase(); }

    public static VerticalAlign parse(String s) {
        if (s == null) throw new IllegalArgumentException("Vertical alignment string is null");
        String in = s.trim().toLowerCase();
        switch (in) {
            case "top":
                return TOP;
            case "middle":
                return MIDDLE;
            case "bottom":
                return BOTTOM;
            default:
                throw new IllegalArgumentException("Unknown vertical alignment: " + s);
        }
    }
}
