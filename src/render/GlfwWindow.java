package render;

import static org.lwjgl.glfw.GLFW.*;
import static org.lwjgl.opengl.GL11.glViewport;

import org.joml.Vector2i;
import org.lwjgl.glfw.Callbacks;
import org.lwjgl.opengl.GL;
import org.lwjgl.opengl.GL43;
import org.lwjgl.opengl.GLDebugMessageCallback;
import org.lwjgl.system.Callback;

import engine.EngineConfig;
import log.Log;

/** A GLFW window and its OpenGL context. */
final class GlfwWindow implements Window {
    private final long handle;
    private final EngineConfig cfg;
    private GLDebugMessageCallback debugCallback;

    GlfwWindow(long handle, EngineConfig cfg) {
        this.handle = handle;
        this.cfg = cfg;
    }

    @Override public void show() { glfwShowWindow(handle); }
    @Override public void hide() { glfwHideWindow(handle); }
    @Override public boolean isVisible() { return glfwGetWindowAttrib(handle, GLFW_VISIBLE) == GLFW_TRUE; }

    @Override public boolean shouldClose() { return glfwWindowShouldClose(handle); }
    @Override public void setShouldClose(boolean value) { glfwSetWindowShouldClose(handle, value); }

    @Override
    public Vector2i size() {
        int[] w = new int[1], h = new int[1];
        glfwGetWindowSize(handle, w, h);
        return new Vector2i(w[0], h[0]);
    }

    @Override public void setSize(int width, int height) { glfwSetWindowSize(handle, width, height); }

    @Override
    public Vector2i position() {
        int[] x = new int[1], y = new int[1];
        glfwGetWindowPos(handle, x, y);
        return new Vector2i(x[0], y[0]);
    }

    @Override public void setPosition(int x, int y) { glfwSetWindowPos(handle, x, y); }

    @Override
    public void setCursorMode(CursorMode mode) {
        glfwSetInputMode(handle, GLFW_CURSOR, mode.glfw);
        if (mode == CursorMode.DISABLED && glfwRawMouseMotionSupported()) {
            glfwSetInputMode(handle, GLFW_RAW_MOUSE_MOTION, GLFW_TRUE);
        }
    }

    @Override
    public void makeContextCurrent() {
        glfwMakeContextCurrent(handle);
        glfwSwapInterval(cfg.vsync ? 1 : 0);
    }

    @Override
    public void releaseContext() {
        if (debugCallback != null) {
            GL43.glDebugMessageCallback(null, 0L);
            debugCallback.free();
            debugCallback = null;
        }
        GL.setCapabilities(null);
        glfwMakeContextCurrent(0L);
    }

    @Override
    public void loadGraphics() {
        GL.createCapabilities();
        // Optional GL debug
        if (cfg.glDebug && GL.getCapabilities().GL_KHR_debug) {
            GL43.glEnable(GL43.GL_DEBUG_OUTPUT);
            debugCallback = GLDebugMessageCallback.create((src, type, id, sev, len, msg, user) ->
                    Log.warn("GL", "%s", GLDebugMessageCallback.getMessage(len, msg)));
            GL43.glDebugMessageCallback(debugCallback, 0L);
        }
    }

    @Override public void viewport(int width, int height) { glViewport(0, 0, width, height); }
    @Override public void swapBuffers() { glfwSwapBuffers(handle); }

    @Override
    public void onResize(WindowEvents.Resize cb) {
        free(glfwSetWindowSizeCallback(handle, (win, w, h) -> cb.onResize(w, h)));
    }

    @Override
    public void onMove(WindowEvents.Move cb) {
        free(glfwSetWindowPosCallback(handle, (win, x, y) -> cb.onMove(x, y)));
    }

    @Override
    public void onClose(WindowEvents.Close cb) {
        free(glfwSetWindowCloseCallback(handle, win -> cb.onClose()));
    }

    @Override
    public void onKey(WindowEvents.Key cb) {
        free(glfwSetKeyCallback(handle, (win, key, scancode, action, mods) ->
                cb.onKey(key, scancode, Action.fromGlfw(action), mods)));
    }

    @Override
    public void onMouseButton(WindowEvents.MouseButton cb) {
        free(glfwSetMouseButtonCallback(handle, (win, button, action, mods) ->
                cb.onMouseButton(button, Action.fromGlfw(action), mods)));
    }

    @Override
    public void onCursorMove(WindowEvents.CursorMove cb) {
        free(glfwSetCursorPosCallback(handle, (win, x, y) -> cb.onCursorMove(x, y)));
    }

    @Override
    public void onScroll(WindowEvents.Scroll cb) {
        free(glfwSetScrollCallback(handle, (win, dx, dy) -> cb.onScroll(dx, dy)));
    }

    @Override
    public void destroy() {
        Callbacks.glfwFreeCallbacks(handle);
        glfwDestroyWindow(handle);
    }

    private static void free(Callback previous) {
        if (previous != null) previous.free();
    }
}
