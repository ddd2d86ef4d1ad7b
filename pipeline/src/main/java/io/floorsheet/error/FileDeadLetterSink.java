package io.floorsheet.error;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.floorsheet.core.Record;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.function.Function;

/**
 * Appends one JSON object per failure to a file: ts, stage, seq, subSeq, reason and a short
 * description of the payload.
 */
public class FileDeadLetterSink<T> implements DeadLetterSink<T> {
    private static final Logger log = LoggerFactory.getLogger(FileDeadLetterSink.class);

    private final Path file;
    private final Function<T, String> describe;
    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper();
    private int written;

    public FileDeadLetterSink(Path file) throws IOException {
        this(file, String::valueOf, Clock.systemUTC());
    }

    public FileDeadLetterSink(Path file, Function<T, String> describe, Clock clock) throws IOException {
        this.file = file;
        this.describe = describe;
        this.clock = clock;
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
    }

    @Override
    public synchronized void acceptFailure(String stage, Record<T> record, String reason) {
        ObjectNode line = mapper.createObjectNode();
        line.put("ts", clock.instant().toString());
        line.put("stage", stage);
        line.put("seq", record == null ? -1 : record.seq());
        line.put("subSeq", record == null ? -1 : record.subSeq());
        line.put("reason", reason);
        if (record != null && record.payload() != null) {
            line.put("payload", describe.apply(record.payload()));
        }
        try {
            Files.writeString(file, mapper.writeValueAsString(line) + "\n", StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            written++;
        } catch (IOException e) {
            // best effort: the batch continues
            log.warn("Could not append to dead-letter file {}: {}", file, e.getMessage());
        }
    }

    public Path file() { return file; }

    public synchronized int written() { return written; }
}
