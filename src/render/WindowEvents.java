package render;

/**
 * Per-event callback shapes. A window holds at most one callback per kind; setting a new one
 * replaces the previous one. Callbacks run on the thread that polls events.
 */
public final class WindowEvents {
    private WindowEvents() {}

    @FunctionalInterface
    public interface Resize { void onResize(int width, int height); }

    @FunctionalInterface
    public interface Move { void onMove(int x, int y); }

    @FunctionalInterface
    public interface Close { void onClose(); }

    /** {@code key} and {@code mods} are GLFW key codes / modifier bits. */
    @FunctionalInterface
    public interface Key { void onKey(int key, int scancode, Action action, int mods); }

    @FunctionalInterface
    public interface MouseButton { void onMouseButton(int button, Action action, int mods); }

    @FunctionalInterface
    public interface CursorMove { void onCursorMove(double x, double y); }

    @FunctionalInterface
    public interface Scroll { void onScroll(double dx, double dy); }
}
