package engine;

import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.function.Consumer;

import org.joml.Vector2i;

import log.Log;
import registry.Registry;
import registry.ThreadNames;
import render.Window;

/**
 * Owns the graphics context for its whole life. Startup: make the context current, load GL,
 * run the init hook, then release {@link #awaitStartup()}. Each frame: time it, warn on stall,
 * publish the duration, match the viewport to the window, run the loop hook, present.
 * Runs until the window's close flag is set, then fires the exit signal.
 */
public final class RenderThread extends Thread {
    private final Registry registry;
    private final Telemetry tm;
    private final Runnable init;
    private final Runnable loop;
    private final FrameClock clock;

    private final CountDownLatch startupReady = new CountDownLatch(1);
    private final CountDownLatch exited = new CountDownLatch(1);
    private volatile boolean initialized = false;
    private volatile Throwable failure;

    RenderThread(Registry registry, Telemetry tm, Runnable init, Runnable loop) {
        this(registry, tm, init, loop, new FrameClock());
    }

    RenderThread(Registry registry, Telemetry tm, Runnable init, Runnable loop, FrameClock clock) {
        this.registry = registry;
        this.tm = tm;
        this.init = init;
        this.loop = loop;
        this.clock = clock;
        setName("RenderThread");
    }

    @Override
    public void run() {
        new ThreadNames(registry).nameCurrentThread("render");
        Log.debug(RenderThread.class, "start");
        boolean contextCurrent = false;
        try {
            withWindow(Window::makeContextCurrent);
            contextCurrent = true;
            withWindow(Window::loadGraphics);

            init.run();
            initialized = true;
            Log.debug(RenderThread.class, "init OK, entering loop");
            startupReady.countDown();

            clock.reset();
            while (!closeRequested()) {
                frame(clock.tick());
            }
            Log.debug(RenderThread.class, "window requested close after %d frames", tm.getFrameCount());
        } catch (Throwable t) {
            failure = t;
            Log.error(RenderThread.class, t, initialized ? "render loop failed" : "render init failed");
        } finally {
            try {
                if (contextCurrent) withWindow(Window::releaseContext);
            } finally {
                startupReady.countDown();
                exited.countDown();
            }
        }
    }

    /** One loop body, given the time since the previous one started. */
    void frame(double elapsedMs) {
        tm.checkStall(elapsedMs);
        tm.sampleRender(elapsedMs);
        registry.read(App.WINDOW, Window.class, w -> {
            Vector2i size = w.size();
            w.viewport(size.x, size.y);
            return size;
        });

        loop.run();

        registry.modify(App.WINDOW, Window.class, Window::swapBuffers);
        tm.markFrame();
    }

    /**
     * Blocks until init has finished (or failed).
     * @return true if the render loop is running
     */
    boolean awaitStartup() throws InterruptedException {
        startupReady.await();
        return initialized;
    }

    boolean exitSignalled() { return exited.getCount() == 0; }

    /**
     * Joins this thread, retrying if the caller is interrupted, so nothing the thread draws into
     * is torn down under it. The caller's interrupt status is restored afterwards.
     */
    void joinFully() {
        boolean interrupted = false;
        while (isAlive()) {
            try {
                join();
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) Thread.currentThread().interrupt();
    }

    Optional<Throwable> failure() { return Optional.ofNullable(failure); }

    private boolean closeRequested() {
        // a missing window means there is nothing left to draw into
        return registry.read(App.WINDOW, Window.class, Window::shouldClose).orElse(true);
    }

    private void withWindow(Consumer<Window> action) {
        if (!registry.modify(App.WINDOW, Window.class, action)) {
            throw new IllegalStateException("no window registered under " + App.WINDOW);
        }
    }
}
