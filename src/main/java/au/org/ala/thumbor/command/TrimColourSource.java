package au.org.ala.thumbor.command;

/**
 * Which corner pixel the server samples for the background colour when trimming.
 */
public enum TrimColourSource {
    TOP_LEFT("top-left"),
    BOTTOM_RIGHT("bottom-right");

    private final String token;

    TrimColourSource(String token) {
        this.token = token;
    }

    public String canonical() { return token; }

    public static TrimColourSource parse(String s) {
        if (s == null) throw new IllegalArgumentException("Trim colour source string is null");
        String in = s.trim().toLowerCase();
        for (TrimColourSource source : values()) {
            if (source.token.equals(in)) return source;
        }
        throw new IllegalArgumentException("Unknown trim colour source: " + s);
    }
}
