package log;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/** Appends plain lines to a file, opening and flushing it on every record. */
public final class FileSink implements LogSink {
    private final Path file;

    public FileSink(Path file) {
        this.file = file;
    }

    public Path file() { return file; }

    @Override
    public void write(Level level, String prefix, String tag, String body) {
        String line = prefix + " " + tag + " " + body + System.lineSeparator();
        try {
            Files.writeString(file, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot append to log file " + file, e);
        }
    }
}
