package engine;

import java.util.Objects;

import log.Log;
import registry.Registry;
import registry.ResourceExistsException;
import registry.ThreadNames;
import render.GlfwBackend;
import render.Window;
import render.WindowBackend;
import render.WindowEvents;

/**
 * Collects the window settings and hooks, then {@link #build()}s the {@link App}.
 *
 * <pre>
 * App app = new AppBuilder(800, 600, "demo")
 *         .renderInit(scene::upload)
 *         .renderLoop(scene::draw)
 *         .eventLoop(input::update)
 *         .build();
 * app.run();
 * </pre>
 */
public final class AppBuilder {
    private static final Runnable NOOP = () -> {};

    private final EngineConfig cfg;
    private final WindowBackend backend;
    private final Registry registry;
    private final AppContext context;

    private final EventHooks events = new EventHooks();
    private Runnable renderInit, renderLoop, eventInit, eventLoop;
    private boolean built = false;

    public AppBuilder(int width, int height, String title) {
        this(new EngineConfig(width, height, title));
    }

    public AppBuilder(EngineConfig cfg) {
        this(cfg, new GlfwBackend(), Registry.global());
    }

    public AppBuilder(EngineConfig cfg, WindowBackend backend, Registry registry) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.backend = Objects.requireNonNull(backend, "backend");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.context = registry == Registry.global() ? AppContext.global() : new AppContext(registry);
    }

    public App.State state() { return built ? App.State.BUILT : App.State.CONFIGURING; }

    /** Available before {@link #build()} so hooks can capture it. */
    public AppContext context() { return context; }

    /** Runs once on the render thread with the context current, before the window is shown. */
    public AppBuilder renderInit(Runnable hook) { renderInit = hook; return this; }
    /** Runs every frame on the render thread, between viewport update and buffer swap. */
    public AppBuilder renderLoop(Runnable hook) { renderLoop = hook; return this; }
    /** Runs once on the control thread when {@link App#run()} starts. */
    public AppBuilder eventInit(Runnable hook) { eventInit = hook; return this; }
    /**
     * Runs every control iteration before events are polled. While the user drags or resizes
     * the window some platforms block the event pump, and this hook with it.
     */
    public AppBuilder eventLoop(Runnable hook) { eventLoop = hook; return this; }

    public AppBuilder onResize(WindowEvents.Resize hook) { events.resize = hook; return this; }
    public AppBuilder onMove(WindowEvents.Move hook) { events.move = hook; return this; }
    public AppBuilder onClose(WindowEvents.Close hook) { events.close = hook; return this; }
    public AppBuilder onKey(WindowEvents.Key hook) { events.key = hook; return this; }
    public AppBuilder onMouseButton(WindowEvents.MouseButton hook) { events.mouseButton = hook; return this; }
    public AppBuilder onCursorMove(WindowEvents.CursorMove hook) { events.cursorMove = hook; return this; }
    public AppBuilder onScroll(WindowEvents.Scroll hook) { events.scroll = hook; return this; }

    /**
     * Creates the window, starts the render thread and waits until its init hook has finished;
     * only then is the window shown. Must be called on the thread that will call {@link App#run()}.
     *
     * @throws EngineStartupException if an app already exists in this registry, the window cannot
     *         be created or the render thread fails to initialise
     */
    public App build() {
        if (built) throw new IllegalStateException("build() already called on this builder");
        built = true;
        cfg.validate();

        new ThreadNames(registry).nameCurrentThread("control");
        if (registry.exists(App.WINDOW)) {
            Log.error(AppBuilder.class, "an App instance already exists");
            throw new EngineStartupException("duplicate App instance: " + App.WINDOW + " is already registered");
        }

        Log.debug(AppBuilder.class, "creating %dx%d window \"%s\"", cfg.width, cfg.height, cfg.title);
        Window window;
        try {
            window = backend.createWindow(cfg);
        } catch (RuntimeException e) {
            Log.error(AppBuilder.class, e, "window creation failed");
            backend.terminate();
            throw new EngineStartupException("window creation failed", e);
        }
        try {
            registry.register(App.WINDOW, Window.class, window);
        } catch (ResourceExistsException e) {
            Log.error(AppBuilder.class, "an App instance already exists");
            window.destroy();
            throw new EngineStartupException("duplicate App instance: " + App.WINDOW + " is already registered", e);
        }
        context.telemetry().clearSamples();
        context.telemetry().setStallThreshold(cfg.stallThresholdMs);

        Log.debug(AppBuilder.class, "installing %d window callbacks", events.count());
        registry.modify(App.WINDOW, Window.class, events::install);

        Log.debug(AppBuilder.class, "starting render thread");
        RenderThread rt = new RenderThread(registry, context.telemetry(),
                orNoop(renderInit), orNoop(renderLoop));
        rt.start();
        awaitRender(rt, window);

        Log.debug(AppBuilder.class, "showing window");
        registry.modify(App.WINDOW, Window.class, Window::show);
        return new App(registry, backend, window, rt, context, orNoop(eventInit), orNoop(eventLoop));
    }

    private void awaitRender(RenderThread rt, Window window) {
        boolean ready;
        try {
            ready = rt.awaitStartup();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abort(rt, window);
            throw new EngineStartupException("interrupted while waiting for the render thread", e);
        }
        if (!ready) {
            abort(rt, window);
            throw new EngineStartupException("render thread failed to initialise", rt.failure().orElse(null));
        }
    }

    private void abort(RenderThread rt, Window window) {
        registry.modify(App.WINDOW, Window.class, w -> w.setShouldClose(true));
        rt.joinFully();
        registry.remove(App.WINDOW);
        context.telemetry().clearSamples();
        window.destroy();
        backend.terminate();
    }

    private static Runnable orNoop(Runnable hook) { return hook == null ? NOOP : hook; }
}
