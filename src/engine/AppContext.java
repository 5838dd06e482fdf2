package engine;

import org.joml.Vector2i;

import registry.Registry;
import registry.ThreadNames;
import render.CursorMode;
import render.Window;

/**
 * Queries and commands on the running app, all answered from the registry. Safe to call from
 * either thread and from hooks; every getter falls back to a default when nothing is stored.
 */
public final class AppContext {
    private static final AppContext GLOBAL = new AppContext(Registry.global());

    private final Registry registry;
    private final Telemetry telemetry;
    private final ThreadNames threadNames;

    public AppContext(Registry registry) {
        this.registry = registry;
        this.telemetry = new Telemetry(registry);
        this.threadNames = new ThreadNames(registry);
    }

    /** Context over {@link Registry#global()}. */
    public static AppContext global() { return GLOBAL; }

    public Registry registry() { return registry; }
    public Telemetry telemetry() { return telemetry; }

    /** Asks the render loop to stop; it notices at the top of its next frame. */
    public boolean exit() {
        return registry.modify(App.WINDOW, Window.class, w -> w.setShouldClose(true));
    }

    public Vector2i windowSize() {
        return registry.read(App.WINDOW, Window.class, Window::size).orElseGet(Vector2i::new);
    }

    public boolean setWindowSize(int width, int height) {
        return registry.modify(App.WINDOW, Window.class, w -> w.setSize(width, height));
    }

    public Vector2i windowPosition() {
        return registry.read(App.WINDOW, Window.class, Window::position).orElseGet(Vector2i::new);
    }

    public boolean setWindowPosition(int x, int y) {
        return registry.modify(App.WINDOW, Window.class, w -> w.setPosition(x, y));
    }

    public boolean setCursorMode(CursorMode mode) {
        return registry.modify(App.WINDOW, Window.class, w -> w.setCursorMode(mode));
    }

    /** Latest control-loop iteration, ms. */
    public double eventMs() { return telemetry.eventMs(); }
    public double eventFps() { return telemetry.eventFps(); }
    /** Latest render-loop iteration, ms. */
    public double renderMs() { return telemetry.renderMs(); }
    public double renderFps() { return telemetry.renderFps(); }
    public long renderedFrames() { return telemetry.getFrameCount(); }

    public void setStallThreshold(double ms) { telemetry.setStallThreshold(ms); }

    public String currentThreadName() { return threadNames.current(); }
    public void setCurrentThreadName(String name) { threadNames.nameCurrentThread(name); }
}
