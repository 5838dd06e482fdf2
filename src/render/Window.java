package render;

import org.joml.Vector2i;

/**
 * The single application window plus its graphics context.
 *
 * Lives in the registry under {@code glfw/window}; every call goes through the slot's lock.
 * Context calls ({@link #makeContextCurrent}, {@link #loadGraphics}, {@link #viewport},
 * {@link #swapBuffers}) belong to the render thread.
 */
public interface Window {
    void show();
    void hide();
    boolean isVisible();

    boolean shouldClose();
    void setShouldClose(boolean value);

    Vector2i size();
    void setSize(int width, int height);
    Vector2i position();
    void setPosition(int x, int y);

    void setCursorMode(CursorMode mode);

    void makeContextCurrent();
    void releaseContext();
    /** Resolves graphics entry points for the current context. */
    void loadGraphics();
    void viewport(int width, int height);
    void swapBuffers();

    void onResize(WindowEvents.Resize cb);
    void onMove(WindowEvents.Move cb);
    void onClose(WindowEvents.Close cb);
    void onKey(WindowEvents.Key cb);
    void onMouseButton(WindowEvents.MouseButton cb);
    void onCursorMove(WindowEvents.CursorMove cb);
    void onScroll(WindowEvents.Scroll cb);

    void destroy();
}
