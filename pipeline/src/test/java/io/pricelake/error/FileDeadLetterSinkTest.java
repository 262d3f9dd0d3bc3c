package io.pricelake.error;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileDeadLetterSinkTest {
    @Test
    void appendsOneJsonLinePerFailure() throws Exception {
        Path tmp = Files.createTempDirectory("dlq-test");
        try {
            Path file = tmp.resolve("nested").resolve("dead_letters.jsonl");
            Clock clock = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);
            FileDeadLetterSink sink = new FileDeadLetterSink(file, clock);
            sink.acceptFailure("ingest", "raw/2024/AAPL", FailureKind.TRANSIENT, "timed out after 100ms");
            sink.acceptFailure("transform", "raw/2024/MSFT", FailureKind.DATA, "zero \"close\"");

            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            assertEquals(2, lines.size());
            assertEquals("{\"ts\":\"2024-05-01T12:00:00Z\",\"stage\":\"ingest\",\"key\":\"raw/2024/AAPL\",\"kind\":\"TRANSIENT\",\"error\":\"timed out after 100ms\"}", lines.get(0));
            assertTrue(lines.get(1).contains("\"error\":\"zero 'close'\""));
        } finally {
            try (var s = Files.walk(tmp)) { s.sorted(java.util.Comparator.reverseOrder()).forEach(p -> { try { Files.deleteIfExists(p); } catch (Exception ignore) {} }); }
        }
    }
}
