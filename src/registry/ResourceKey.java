package registry;

/** Builds hierarchical registry keys such as {@code glfw/window/render_ms}. */
public final class ResourceKey {
    public static final String SEPARATOR = "/";

    private ResourceKey() {}

    public static String of(String... segments) {
        if (segments.length == 0) throw new IllegalArgumentException("key needs at least one segment");
        StringBuilder sb = new StringBuilder();
        for (String s : segments) {
            if (s == null || s.isBlank()) throw new IllegalArgumentException("blank key segment");
            if (s.contains(SEPARATOR)) throw new IllegalArgumentException("segment contains '/': " + s);
            if (sb.length() > 0) sb.append(SEPARATOR);
            sb.append(s);
        }
        return sb.toString();
    }

    /** Appends segments under an existing key. */
    public static String child(String parent, String... segments) {
        return parent + SEPARATOR + of(segments);
    }
}
