package engine;

import log.Log;
import registry.Registry;
import registry.ResourceKey;

/**
 * Loop timings kept in the registry: the latest render and control iteration durations,
 * the stall threshold and the presented-frame count. Only the latest sample is kept.
 */
public class Telemetry {
    public static final String EVENT_MS = ResourceKey.child(App.WINDOW, "event_ms");
    public static final String RENDER_MS = ResourceKey.child(App.WINDOW, "render_ms");
    public static final String STALL_MS = ResourceKey.child(App.WINDOW, "stall_ms");
    public static final String FRAMES = ResourceKey.child(App.WINDOW, "frames");

    public static final double DEFAULT_STALL_MS = 16.67;

    private final Registry registry;

    public Telemetry(Registry registry) {
        this.registry = registry;
    }

    public void sampleRender(double ms) { registry.put(RENDER_MS, Double.class, ms); }
    public void sampleEvent(double ms) { registry.put(EVENT_MS, Double.class, ms); }

    public double renderMs() { return registry.get(RENDER_MS, Double.class).orElse(0.0); }
    public double eventMs() { return registry.get(EVENT_MS, Double.class).orElse(0.0); }

    public double renderFps() { return rate(renderMs()); }
    public double eventFps() { return rate(eventMs()); }

    /** Iterations per second for a duration in ms; 0 when nothing has been measured. */
    public static double rate(double ms) {
        return ms > 0 ? 1000.0 / ms : 0.0;
    }

    public double stallThresholdMs() { return registry.get(STALL_MS, Double.class).orElse(DEFAULT_STALL_MS); }

    /** Takes effect on the next frame comparison. */
    public void setStallThreshold(double ms) {
        if (!(ms > 0)) throw new IllegalArgumentException("stall threshold must be > 0: " + ms);
        registry.put(STALL_MS, Double.class, ms);
    }

    /** Logs a warning and returns true when a frame took longer than the threshold. */
    public boolean checkStall(double frameMs) {
        double limit = stallThresholdMs();
        if (frameMs <= limit) return false;
        Log.warn(Telemetry.class, "render frame took %.2fms, over the %.2fms threshold", frameMs, limit);
        return true;
    }

    public void markFrame() {
        if (!registry.replace(FRAMES, Long.class, n -> n + 1)) {
            registry.registerIfAbsent(FRAMES, Long.class, () -> 0L);
            registry.replace(FRAMES, Long.class, n -> n + 1);
        }
    }

    /** Drops the timings and the frame count of a finished app. The stall threshold stays. */
    public void clearSamples() {
        registry.remove(RENDER_MS);
        registry.remove(EVENT_MS);
        registry.remove(FRAMES);
    }

    public long getFrameCount() { return registry.get(FRAMES, Long.class).orElse(0L); }
}
