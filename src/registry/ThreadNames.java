package registry;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Human-readable thread labels kept in the registry, so the logger and telemetry can show
 * "render" / "control" instead of JVM thread ids. Entries are never removed.
 */
public final class ThreadNames {
    public static final String KEY = ResourceKey.of("app", "thread_names");

    private final Registry registry;

    public ThreadNames(Registry registry) {
        this.registry = registry;
    }

    public void nameCurrentThread(String name) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("blank thread name");
        ensureTable();
        long id = Thread.currentThread().getId();
        registry.modify(KEY, Table.class, t -> t.names.put(id, name));
    }

    public Optional<String> nameOf(Thread thread) {
        ensureTable();
        long id = thread.getId();
        return registry.read(KEY, Table.class, t -> t.names.get(id));
    }

    /** The label for the calling thread, or {@code Thread-<id>} if it never named itself. */
    public String current() {
        Thread t = Thread.currentThread();
        return nameOf(t).orElseGet(() -> "Thread-" + t.getId());
    }

    private void ensureTable() {
        registry.registerIfAbsent(KEY, Table.class, Table::new);
    }

    /** Slot value: thread id to label. Only touched under the slot lock. */
    public static final class Table {
        final Map<Long, String> names = new HashMap<>();

        public int size() { return names.size(); }
    }
}
