package render;

import static org.lwjgl.glfw.GLFW.GLFW_CURSOR_DISABLED;
import static org.lwjgl.glfw.GLFW.GLFW_CURSOR_HIDDEN;
import static org.lwjgl.glfw.GLFW.GLFW_CURSOR_NORMAL;

public enum CursorMode {
    /** Visible, free. */
    NORMAL(GLFW_CURSOR_NORMAL),
    /** Invisible while over the window. */
    HIDDEN(GLFW_CURSOR_HIDDEN),
    /** Invisible and locked to the window (mouse-look). */
    DISABLED(GLFW_CURSOR_DISABLED);

    public final int glfw;

    CursorMode(int glfw) { this.glfw = glfw; }
}
