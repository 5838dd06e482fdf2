package registry;

import static org.junit.jupiter.api.Assertions.*;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

final class RegistryConcurrencyTest {
    private final Registry registry = new Registry();
    private final ExecutorService pool = Executors.newFixedThreadPool(4);

    @AfterEach
    void shutdown() {
        pool.shutdownNow();
    }

    /** Plain mutable counter: only safe because the slot lock serializes writers. */
    static final class Counter { int value; }

    @Test
    @Timeout(10)
    void writers_on_one_key_serialize() throws Exception {
        registry.register("count", Counter.class, new Counter());
        int perThread = 20_000;
        CountDownLatch go = new CountDownLatch(1);

        Runnable bump = () -> {
            try { go.await(); } catch (InterruptedException e) { Thread.currentThread().interrupt(); return; }
            for (int i = 0; i < perThread; i++) registry.modify("count", Counter.class, c -> c.value++);
        };
        Future<?> a = pool.submit(bump);
        Future<?> b = pool.submit(bump);
        go.countDown();
        a.get();
        b.get();

        assertEquals(Integer.valueOf(2 * perThread), registry.read("count", Counter.class, c -> c.value).orElseThrow());
    }

    @Test
    @Timeout(10)
    void a_held_key_does_not_block_another_key() throws Exception {
        registry.register("render_ms", Double.class, 0.0);
        registry.register("event_ms", Double.class, 0.0);
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        Future<?> holder = pool.submit(() -> registry.modify("render_ms", Double.class, v -> {
            holding.countDown();
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }));
        assertTrue(holding.await(5, TimeUnit.SECONDS));

        long start = System.nanoTime();
        Future<Boolean> other = pool.submit(() -> registry.put("event_ms", Double.class, 4.2));
        assertTrue(other.get(1, TimeUnit.SECONDS));
        long tookMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertFalse(holder.isDone(), "first key is still held");
        assertTrue(tookMs < 1000, "other key waited " + tookMs + "ms");
        release.countDown();
        holder.get(5, TimeUnit.SECONDS);
    }

    @Test
    @Timeout(10)
    void a_writer_waits_for_the_holder_of_the_same_key() throws Exception {
        registry.register("w", Counter.class, new Counter());
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        Future<?> holder = pool.submit(() -> registry.modify("w", Counter.class, c -> {
            holding.countDown();
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            c.value = 1;
        }));
        assertTrue(holding.await(5, TimeUnit.SECONDS));

        Future<Integer> reader = pool.submit(() -> registry.read("w", Counter.class, c -> c.value).orElseThrow());
        Thread.sleep(100);
        assertFalse(reader.isDone(), "reader must wait for the exclusive holder");

        release.countDown();
        assertEquals(1, reader.get(5, TimeUnit.SECONDS));
        holder.get(5, TimeUnit.SECONDS);
    }

    @Test
    @Timeout(10)
    void concurrent_lazy_creation_creates_exactly_once() throws Exception {
        int threads = 4;
        CountDownLatch go = new CountDownLatch(1);
        Future<?>[] fs = new Future<?>[threads];
        int[] created = new int[1];
        for (int i = 0; i < threads; i++) {
            fs[i] = pool.submit(() -> {
                go.await();
                if (registry.registerIfAbsent("table", Counter.class, Counter::new)) {
                    synchronized (created) { created[0]++; }
                }
                return null;
            });
        }
        go.countDown();
        for (Future<?> f : fs) f.get();

        assertEquals(1, created[0]);
    }
}
