package registry;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Named, typed, lock-per-key resource store shared by the render and control threads.
 *
 * Every slot is bound to the exact {@link Class} it was created with. Access with any other
 * class is reported as an empty / false result, never as a cast. Each slot carries its own
 * read/write lock; there is no store-wide lock on the access path, so a slow writer on one key
 * never blocks another key.
 *
 * Functions handed to {@link #read}, {@link #write}, {@link #modify} and {@link #replace} run
 * while the slot's lock is held. They must not call back into the store for the same key.
 */
public final class Registry {
    private static final Registry GLOBAL = new Registry();

    private final ConcurrentMap<String, Slot> slots = new ConcurrentHashMap<>();

    /** The process-wide instance. */
    public static Registry global() { return GLOBAL; }

    /**
     * Creates a slot for {@code key}.
     * @throws ResourceExistsException if the key is already taken (whatever its type)
     */
    public <T> void register(String key, Class<T> type, T value) {
        Slot slot = new Slot(type, checked(type, value));
        if (slots.putIfAbsent(key(key), slot) != null) {
            throw new ResourceExistsException(key);
        }
    }

    /** Creates the slot only if the key is free. Returns true if this call created it. */
    public <T> boolean registerIfAbsent(String key, Class<T> type, Supplier<? extends T> value) {
        Objects.requireNonNull(value, "value");
        boolean[] created = { false };
        slots.computeIfAbsent(key(key), k -> {
            created[0] = true;
            return new Slot(type, checked(type, value.get()));
        });
        return created[0];
    }

    /**
     * Creates the slot or overwrites its value. An existing slot keeps its type: if it was
     * created with a different class nothing is written and false is returned.
     */
    public <T> boolean put(String key, Class<T> type, T value) {
        T v = checked(type, value);
        Slot slot = slots.computeIfAbsent(key(key), k -> new Slot(type, v));
        if (!slot.type.equals(type)) return false;
        slot.lock.writeLock().lock();
        try {
            slot.value = v;
        } finally {
            slot.lock.writeLock().unlock();
        }
        return true;
    }

    /** Runs {@code fn} under the slot's shared lock. Empty if missing, wrong type or null result. */
    public <T, R> Optional<R> read(String key, Class<T> type, Function<? super T, ? extends R> fn) {
        Slot slot = find(key, type);
        if (slot == null) return Optional.empty();
        slot.lock.readLock().lock();
        try {
            return Optional.ofNullable(fn.apply(type.cast(slot.value)));
        } finally {
            slot.lock.readLock().unlock();
        }
    }

    /** Runs {@code fn} under the slot's exclusive lock. Empty if missing, wrong type or null result. */
    public <T, R> Optional<R> write(String key, Class<T> type, Function<? super T, ? extends R> fn) {
        Slot slot = find(key, type);
        if (slot == null) return Optional.empty();
        slot.lock.writeLock().lock();
        try {
            return Optional.ofNullable(fn.apply(type.cast(slot.value)));
        } finally {
            slot.lock.writeLock().unlock();
        }
    }

    /** Exclusive access without a result. False if the key is missing or holds another type. */
    public <T> boolean modify(String key, Class<T> type, Consumer<? super T> fn) {
        Slot slot = find(key, type);
        if (slot == null) return false;
        slot.lock.writeLock().lock();
        try {
            fn.accept(type.cast(slot.value));
            return true;
        } finally {
            slot.lock.writeLock().unlock();
        }
    }

    /** Exclusive read-modify-write of the stored value itself (for immutable values). */
    public <T> boolean replace(String key, Class<T> type, UnaryOperator<T> fn) {
        Slot slot = find(key, type);
        if (slot == null) return false;
        slot.lock.writeLock().lock();
        try {
            slot.value = checked(type, fn.apply(type.cast(slot.value)));
            return true;
        } finally {
            slot.lock.writeLock().unlock();
        }
    }

    public <T> Optional<T> get(String key, Class<T> type) {
        return read(key, type, Function.identity());
    }

    public boolean exists(String key) {
        return slots.containsKey(key(key));
    }

    public boolean exists(String key, Class<?> type) {
        Slot slot = slots.get(key(key));
        return slot != null && slot.type.equals(type);
    }

    public Optional<Class<?>> typeOf(String key) {
        Slot slot = slots.get(key(key));
        return slot == null ? Optional.empty() : Optional.of(slot.type);
    }

    /** Drops the slot. Threads currently inside a function on it finish against the old value. */
    public boolean remove(String key) {
        return slots.remove(key(key)) != null;
    }

    public Set<String> keys() {
        return Set.copyOf(slots.keySet());
    }

    /** The slot for {@code key} if it was created with exactly {@code type}. */
    private Slot find(String key, Class<?> type) {
        Objects.requireNonNull(type, "type");
        Slot slot = slots.get(key(key));
        return slot == null || !slot.type.equals(type) ? null : slot;
    }

    private static String key(String key) {
        return Objects.requireNonNull(key, "key");
    }

    private static <T> T checked(Class<T> type, Object value) {
        Objects.requireNonNull(type, "type");
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException("value " + value + " is not a " + type.getName());
        }
        return type.cast(value);
    }

    /** One value and the class it is bound to; the value is always an instance of {@code type}. */
    private static final class Slot {
        final Class<?> type;
        final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
        Object value;

        Slot(Class<?> type, Object value) { this.type = type; this.value = value; }
    }
}
