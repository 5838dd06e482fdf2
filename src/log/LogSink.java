package log;

/** Destination for formatted log lines. Called with the logger's lock held. */
public interface LogSink {
    /**
     * @param level  level of the record
     * @param tag    the padded level tag, e.g. {@code [INFO] }
     * @param prefix timestamp
     * @param body   owner column and message
     */
    void write(Level level, String prefix, String tag, String body);
}
