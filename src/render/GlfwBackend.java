package render;

import static org.lwjgl.glfw.GLFW.*;

import org.lwjgl.glfw.GLFWErrorCallback;

import engine.EngineConfig;
import log.Log;

/**
 * GLFW implementation of the window backend. {@link #createWindow} and {@link #pollEvents}
 * must run on the control (main) thread.
 */
public final class GlfwBackend implements WindowBackend {
    private boolean initialized = false;

    @Override
    public Window createWindow(EngineConfig cfg) {
        init();

        // OpenGL 3.3 core, hidden until the render thread is ready
        glfwDefaultWindowHints();
        glfwWindowHint(GLFW_CONTEXT_VERSION_MAJOR, cfg.glMajor);
        glfwWindowHint(GLFW_CONTEXT_VERSION_MINOR, cfg.glMinor);
        glfwWindowHint(GLFW_OPENGL_PROFILE, GLFW_OPENGL_CORE_PROFILE);
        glfwWindowHint(GLFW_OPENGL_FORWARD_COMPAT, GLFW_TRUE);
        glfwWindowHint(GLFW_VISIBLE, GLFW_FALSE);
        glfwWindowHint(GLFW_RESIZABLE, cfg.resizable ? GLFW_TRUE : GLFW_FALSE);
        if (cfg.glDebug) glfwWindowHint(GLFW_OPENGL_DEBUG_CONTEXT, GLFW_TRUE);

        long handle = glfwCreateWindow(cfg.width, cfg.height, cfg.title, 0L, 0L);
        Log.debug(GlfwBackend.class, "window handle = %d", handle);
        if (handle == 0L) throw new IllegalStateException("glfwCreateWindow failed");
        return new GlfwWindow(handle, cfg);
    }

    @Override
    public void pollEvents() {
        glfwPollEvents();
    }

    @Override
    public void terminate() {
        if (!initialized) return;
        initialized = false;
        glfwTerminate();
        GLFWErrorCallback prev = glfwSetErrorCallback(null);
        if (prev != null) prev.free();
    }

    private void init() {
        if (initialized) return;
        // Surface GLFW errors through the logger
        glfwSetErrorCallback(GLFWErrorCallback.create((code, desc) ->
                Log.error(GlfwBackend.class, "GLFW error 0x%X: %s", code, GLFWErrorCallback.getDescription(desc))));
        if (!glfwInit()) throw new IllegalStateException("GLFW init failed");
        initialized = true;
    }
}
