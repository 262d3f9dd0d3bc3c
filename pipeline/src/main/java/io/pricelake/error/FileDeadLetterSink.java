package io.pricelake.error;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;

/**
 * Appends one JSON line per failed key.
 */
public class FileDeadLetterSink implements DeadLetterSink {
    private static final Logger log = LoggerFactory.getLogger(FileDeadLetterSink.class);

    private final Path file;
    private final Clock clock;

    public FileDeadLetterSink(Path file) throws IOException {
        this(file, Clock.systemUTC());
    }

    public FileDeadLetterSink(Path file, Clock clock) throws IOException {
        this.file = file;
        this.clock = clock;
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        if (!Files.exists(file)) {
            Files.writeString(file, "", StandardCharsets.UTF_8, StandardOpenOption.CREATE);
        }
    }

    public Path file() { return file; }

    @Override
    public synchronized void acceptFailure(String stage, String key, FailureKind kind, String error) {
        String json = String.format(
                "{\"ts\":\"%s\",\"stage\":\"%s\",\"key\":\"%s\",\"kind\":\"%s\",\"error\":\"%s\"}%n",
                clock.instant(), safe(stage), safe(key), kind, safe(String.valueOf(error)));
        try {
            Files.writeString(file, json, StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.warn("Could not record dead letter for {} {} in {}: {}", stage, key, file, e.toString());
        }
    }

    private static String safe(String s) {
        return s.replace("\\", "\\\\").replace("\"", "'").replace("\n", " ").replace("\r", " ");
    }
}
