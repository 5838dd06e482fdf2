package render;

import static org.lwjgl.glfw.GLFW.GLFW_PRESS;
import static org.lwjgl.glfw.GLFW.GLFW_RELEASE;
import static org.lwjgl.glfw.GLFW.GLFW_REPEAT;

/** Key / mouse button transition. */
public enum Action {
    RELEASE(GLFW_RELEASE),
    PRESS(GLFW_PRESS),
    REPEAT(GLFW_REPEAT);

    public final int glfw;

    Action(int glfw) { this.glfw = glfw; }

    public static Action fromGlfw(int value) {
        for (Action a : values()) if (a.glfw == value) return a;
        throw new IllegalArgumentException("unknown GLFW action " + value);
    }
}
