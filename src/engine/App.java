package engine;

import java.util.Optional;

import log.Log;
import registry.Registry;
import registry.ResourceKey;
import render.Window;
import render.WindowBackend;

/**
 * A built application: the render thread is running and the window is visible. The thread
 * that built it calls {@link #run()} to drive the control loop until the render loop ends.
 */
public final class App implements AutoCloseable {
    /** Registry key of the single window. */
    public static final String WINDOW = ResourceKey.of("glfw", "window");

    public enum State { CONFIGURING, BUILT, RUNNING, STOPPED }

    private final Registry registry;
    private final WindowBackend backend;
    private final Window window;
    private final RenderThread renderThread;
    private final AppContext context;
    private final Runnable eventInit;
    private final Runnable eventLoop;

    private volatile State state = State.BUILT;
    private boolean closed = false;

    App(Registry registry, WindowBackend backend, Window window, RenderThread renderThread,
        AppContext context, Runnable eventInit, Runnable eventLoop) {
        this.registry = registry;
        this.backend = backend;
        this.window = window;
        this.renderThread = renderThread;
        this.context = context;
        this.eventInit = eventInit;
        this.eventLoop = eventLoop;
    }

    /**
     * Control loop: event-init once, then until the render thread signals exit:
     * yield, publish the iteration time, run the event hook, poll window events.
     * Returns after the render thread has finished.
     */
    public void run() {
        if (state != State.BUILT) throw new IllegalStateException("run() needs a BUILT app, state is " + state);
        state = State.RUNNING;
        Log.debug(App.class, "starting event loop");
        boolean finished = false;
        try {
            eventInit.run();
            FrameClock clock = new FrameClock();
            while (!renderThread.exitSignalled()) {
                Thread.yield();
                context.telemetry().sampleEvent(clock.tick());
                eventLoop.run();
                backend.pollEvents();
            }
            finished = true;
        } finally {
            if (!finished) {
                Log.warn(App.class, "event loop aborted, stopping render thread");
                context.exit();
            }
            renderThread.joinFully();
            state = State.STOPPED;
        }
        Log.debug(App.class, "event loop exited");
    }

    /** Same as {@code context().exit()}. */
    public boolean exit() { return context.exit(); }

    public AppContext context() { return context; }

    public State state() { return state; }

    /** What ended the render thread abnormally, if anything did. */
    public Optional<Throwable> renderFailure() { return renderThread.failure(); }

    /**
     * Stops the render thread if needed, then unregisters and destroys the window.
     * Afterwards a new {@link AppBuilder} may build again in this registry.
     */
    @Override
    public void close() {
        if (closed) return;
        closed = true;
        if (renderThread.isAlive()) {
            context.exit();
            renderThread.joinFully();
        }
        state = State.STOPPED;
        registry.remove(WINDOW);
        context.telemetry().clearSamples();
        window.destroy();
        backend.terminate();
        Log.debug(App.class, "closed");
    }
}
