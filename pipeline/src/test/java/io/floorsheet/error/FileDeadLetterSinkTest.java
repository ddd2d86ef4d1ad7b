package io.floorsheet.error;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.floorsheet.core.Record;
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
            Path file = tmp.resolve("nested").resolve("dlq.jsonl");
            Clock clock = Clock.fixed(Instant.parse("2024-01-02T10:15:30Z"), ZoneOffset.UTC);
            FileDeadLetterSink<String> sink = new FileDeadLetterSink<>(file, p -> "row " + p, clock);

            sink.acceptFailure("parse", new Record<>(3, 7, "<td>\"x\"</td>"), "quantity is not a number: 'abc'");
            sink.acceptFailure("transform", null, "page 2 unavailable");

            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            assertEquals(2, lines.size());
            assertEquals(2, sink.written());

            ObjectMapper mapper = new ObjectMapper();
            JsonNode first = mapper.readTree(lines.get(0));
            assertEquals("2024-01-02T10:15:30Z", first.get("ts").asText());
            assertEquals("parse", first.get("stage").asText());
            assertEquals(3, first.get("seq").asLong());
            assertEquals(7, first.get("subSeq").asInt());
            assertEquals("quantity is not a number: 'abc'", first.get("reason").asText());
            assertEquals("row <td>\"x\"</td>", first.get("payload").asText());

            JsonNode second = mapper.readTree(lines.get(1));
            assertEquals(-1, second.get("seq").asLong());
            assertFalse(second.has("payload"));
        } finally {
            try (var s = Files.walk(tmp)) { s.sorted(java.util.Comparator.reverseOrder()).forEach(p -> { try { Files.deleteIfExists(p); } catch (Exception ignore) {} }); }
        }
    }
}
