package log;

/** Log levels, lowest first. */
public enum Level {
    DEBUG("\u001b[32;3;4m", "\u001b[32m"),
    INFO("\u001b[34m", "\u001b[34m"),
    WARN("\u001b[33;1m", "\u001b[33m"),
    ERROR("\u001b[31;1;4m", "\u001b[31m");

    final String tagStyle;
    final String lineStyle;

    Level(String tagStyle, String lineStyle) {
        this.tagStyle = tagStyle;
        this.lineStyle = lineStyle;
    }

    /** Bracketed tag as it appears in the output, e.g. {@code [WARN]}. */
    public String tag() { return "[" + name() + "]"; }

    public boolean atLeast(Level min) { return compareTo(min) >= 0; }
}
