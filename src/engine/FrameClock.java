package engine;

import java.util.function.LongSupplier;

/** Monotonic loop timer: each {@link #tick()} returns ms since the previous one. */
final class FrameClock {
    private final LongSupplier nanoTime;
    private long last;

    FrameClock() { this(System::nanoTime); }

    FrameClock(LongSupplier nanoTime) {
        this.nanoTime = nanoTime;
        this.last = nanoTime.getAsLong();
    }

    void reset() { last = nanoTime.getAsLong(); }

    double tick() {
        long now = nanoTime.getAsLong();
        double ms = (now - last) / 1_000_000.0;
        last = now;
        return ms;
    }
}
