package log;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.Locale;

import registry.Registry;
import registry.ThreadNames;

/**
 * Static facade over the process-wide {@link Logger}. Thread labels come from the global
 * {@link Registry}. Owners are usually the calling class: {@code Log.debug(App.class, "...")}.
 */
public final class Log {
    private static final Logger LOGGER = new Logger(new ThreadNames(Registry.global())::current);

    private Log() {}

    public static Logger logger() { return LOGGER; }

    public static void setLevel(Level level) { LOGGER.setLevel(level); }

    public static void setFile(Path file) { LOGGER.setFile(file); }

    public static void debug(Class<?> owner, String format, Object... args) { LOGGER.log(Level.DEBUG, owner.getName(), format, args); }
    public static void info(Class<?> owner, String format, Object... args) { LOGGER.log(Level.INFO, owner.getName(), format, args); }
    public static void warn(Class<?> owner, String format, Object... args) { LOGGER.log(Level.WARN, owner.getName(), format, args); }
    public static void error(Class<?> owner, String format, Object... args) { LOGGER.log(Level.ERROR, owner.getName(), format, args); }

    public static void debug(String owner, String format, Object... args) { LOGGER.log(Level.DEBUG, owner, format, args); }
    public static void info(String owner, String format, Object... args) { LOGGER.log(Level.INFO, owner, format, args); }
    public static void warn(String owner, String format, Object... args) { LOGGER.log(Level.WARN, owner, format, args); }
    public static void error(String owner, String format, Object... args) { LOGGER.log(Level.ERROR, owner, format, args); }

    /** Error followed by the throwable's stack trace. */
    public static void error(Class<?> owner, Throwable t, String format, Object... args) {
        if (!LOGGER.isEnabled(Level.ERROR)) return;
        String msg = args.length == 0 ? format : String.format(Locale.ROOT, format, args);
        StringWriter trace = new StringWriter();
        t.printStackTrace(new PrintWriter(trace));
        LOGGER.log(Level.ERROR, owner.getName(), msg + ": " + trace.toString().stripTrailing());
    }
}
