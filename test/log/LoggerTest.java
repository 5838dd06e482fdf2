package log;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import registry.Registry;
import registry.ThreadNames;

final class LoggerTest {
    private static final LocalDateTime NOW = LocalDateTime.of(2024, 3, 1, 12, 30, 5);

    private final Registry registry = new Registry();
    private final ThreadNames names = new ThreadNames(registry);
    private final CapturingSink sink = new CapturingSink();
    private final Logger logger = new Logger(names::current, () -> NOW, sink);

    @Test
    void default_level_is_info() {
        Logger fresh = new Logger(names::current);
        assertEquals(Level.INFO, fresh.level());
        assertFalse(fresh.isEnabled(Level.DEBUG));
        assertTrue(fresh.isEnabled(Level.WARN));
    }

    @Test
    void records_below_the_minimum_are_dropped() {
        logger.setLevel(Level.WARN);

        logger.log(Level.DEBUG, "Owner", "d");
        logger.log(Level.INFO, "Owner", "i");
        logger.log(Level.WARN, "Owner", "w");
        logger.log(Level.ERROR, "Owner", "e");

        assertEquals(2, sink.records().size());
        assertEquals(1, sink.count(Level.WARN));
        assertEquals(1, sink.count(Level.ERROR));
    }

    @Test
    void disabled_level_skips_formatting() {
        Object explodes = new Object() {
            @Override public String toString() { throw new AssertionError("formatted a disabled record"); }
        };
        logger.log(Level.DEBUG, "Owner", "value %s", explodes);
        assertTrue(sink.records().isEmpty());
    }

    @Test
    void line_has_timestamp_tag_owner_thread_and_message() {
        names.nameCurrentThread("control");

        logger.log(Level.INFO, "engine.App", "took %.2fms", 3.14159);

        String line = sink.records().get(0).line;
        assertTrue(line.startsWith("2024-03-01 12:30:05 [INFO]  "), line);
        assertTrue(line.contains("engine.App @control"), line);
        assertTrue(line.endsWith(" |: took 3.14ms"), line);

        String owner = "engine.App @" + String.format("%-" + Logger.THREAD_WIDTH + "s", "control");
        String body = line.substring("2024-03-01 12:30:05 [INFO]  ".length());
        assertEquals(Logger.OWNER_WIDTH, body.indexOf(" |: "), "owner column is right-justified to a fixed width");
        assertTrue(body.substring(0, Logger.OWNER_WIDTH).endsWith(owner), line);
    }

    @Test
    void message_without_args_is_not_treated_as_a_format() {
        logger.log(Level.INFO, "Owner", "100% done");
        assertTrue(sink.records().get(0).line.endsWith("|: 100% done"));
    }

    @Test
    void file_output_appends_one_line_per_record(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("app.log");
        Files.writeString(file, "existing\n");
        logger.setFile(file);
        assertEquals(file, logger.file());

        logger.log(Level.WARN, "Owner", "first");
        logger.log(Level.ERROR, "Owner", "second");

        List<String> lines = Files.readAllLines(file);
        assertEquals(3, lines.size());
        assertEquals("existing", lines.get(0));
        assertTrue(lines.get(1).startsWith("2024-03-01 12:30:05 [WARN]  "));
        assertTrue(lines.get(1).endsWith("|: first"));
        assertTrue(lines.get(2).contains("[ERROR]"));
        assertFalse(lines.get(2).contains("\u001b["), "file output is plain text");
    }

    @Test
    void setFile_null_goes_back_to_console(@TempDir Path dir) {
        logger.setFile(dir.resolve("x.log"));
        logger.setFile(null);
        assertNull(logger.file());
        assertTrue(logger.sink() instanceof ConsoleSink);
    }

    @Test
    void failing_sink_does_not_throw_into_the_caller() {
        Logger broken = new Logger(names::current, () -> NOW, (level, prefix, tag, body) -> {
            throw new IllegalStateException("disk full");
        });
        assertDoesNotThrow(() -> broken.log(Level.ERROR, "Owner", "boom"));
    }

    @Test
    void console_sink_sends_errors_to_stderr_with_colour() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        Logger console = new Logger(names::current, () -> NOW,
                new ConsoleSink(new PrintStream(out, true, StandardCharsets.UTF_8), new PrintStream(err, true, StandardCharsets.UTF_8)));

        console.log(Level.INFO, "Owner", "hello");
        console.log(Level.ERROR, "Owner", "bad");

        String o = out.toString(StandardCharsets.UTF_8);
        String e = err.toString(StandardCharsets.UTF_8);
        assertTrue(o.contains("hello") && !o.contains("bad"));
        assertTrue(e.contains("bad") && !e.contains("hello"));
        assertTrue(o.contains("\u001b[34m"));
        assertTrue(e.contains("[ERROR]"));
    }
}
