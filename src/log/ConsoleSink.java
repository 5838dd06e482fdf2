package log;

import java.io.PrintStream;

/** ANSI-coloured console output; errors go to stderr. */
public final class ConsoleSink implements LogSink {
    private static final String RESET = "\u001b[0m";

    private final PrintStream out;
    private final PrintStream err;

    public ConsoleSink() { this(System.out, System.err); }

    public ConsoleSink(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    @Override
    public void write(Level level, String prefix, String tag, String body) {
        String line = level.lineStyle + prefix + " " + level.tagStyle + tag + RESET
                + level.lineStyle + " " + body + RESET;
        (level == Level.ERROR ? err : out).println(line);
    }
}
