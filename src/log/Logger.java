package log;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Leveled logger. One lock guards the level, the sink and the write itself, so lines from the
 * render and control threads never interleave.
 */
public final class Logger {
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    static final int OWNER_WIDTH = 60;
    static final int THREAD_WIDTH = 20;

    private final Object lock = new Object();
    private final Supplier<String> threadName;
    private final Supplier<LocalDateTime> clock;

    private volatile Level level = Level.INFO;
    private LogSink sink;
    private Path file;

    public Logger(Supplier<String> threadName) {
        this(threadName, LocalDateTime::now, new ConsoleSink());
    }

    public Logger(Supplier<String> threadName, Supplier<LocalDateTime> clock, LogSink sink) {
        this.threadName = Objects.requireNonNull(threadName, "threadName");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public void setLevel(Level level) {
        synchronized (lock) { this.level = Objects.requireNonNull(level, "level"); }
    }

    public Level level() { return level; }

    /** Switches to appending to {@code file}; {@code null} goes back to the console. */
    public void setFile(Path file) {
        synchronized (lock) {
            this.file = file;
            this.sink = file == null ? new ConsoleSink() : new FileSink(file);
        }
    }

    public Path file() {
        synchronized (lock) { return file; }
    }

    public void setSink(LogSink sink) {
        synchronized (lock) {
            this.sink = Objects.requireNonNull(sink, "sink");
            this.file = sink instanceof FileSink ? ((FileSink) sink).file() : null;
        }
    }

    public LogSink sink() {
        synchronized (lock) { return sink; }
    }

    public boolean isEnabled(Level l) { return l.atLeast(level); }

    public void log(Level l, String owner, String message) {
        if (!isEnabled(l)) return;
        // looked up before taking our lock: the name table has its own
        String who = owner + " @" + pad(threadName.get(), THREAD_WIDTH);
        String body = String.format("%" + OWNER_WIDTH + "s |: %s", who, message);
        String tag = pad(l.tag(), 7);
        synchronized (lock) {
            if (!isEnabled(l)) return;
            String prefix = clock.get().format(TIMESTAMP);
            try {
                sink.write(l, prefix, tag, body);
            } catch (RuntimeException e) {
                System.err.println(prefix + " [ERROR] log sink failed (" + e + "), dropped: " + body);
            }
        }
    }

    public void log(Level l, String owner, String format, Object... args) {
        if (!isEnabled(l)) return;
        log(l, owner, args.length == 0 ? format : String.format(Locale.ROOT, format, args));
    }

    private static String pad(String s, int width) {
        return String.format("%-" + width + "s", s);
    }
}
