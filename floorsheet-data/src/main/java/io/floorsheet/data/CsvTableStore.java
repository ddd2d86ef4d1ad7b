package io.floorsheet.data;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * A whole-file table of rows of one type, stored as CSV with a header row.
 * <p>
 * Reads map columns by header name, so a missing column reads as null for a boxed or object field (0 for
 * a primitive one) and unknown columns are ignored. Writes go to a temporary file next to the target which then replaces the target
 * in a single move; a failed write leaves the previous file untouched.
 */
public class CsvTableStore<T> {
    private static final Logger log = LoggerFactory.getLogger(CsvTableStore.class);

    private final Path path;
    private final Class<T> rowType;
    private final CsvMapper mapper;
    private final CsvSchema writeSchema;

    public CsvTableStore(Path path, Class<T> rowType) {
        this.path = path;
        this.rowType = rowType;
        this.mapper = CsvMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(CsvParser.Feature.TRIM_SPACES)
                .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
                .enable(CsvParser.Feature.EMPTY_STRING_AS_NULL)
                .build();
        this.writeSchema = mapper.schemaFor(rowType).withHeader();
    }

    public Path path() { return path; }

    public boolean exists() { return Files.isRegularFile(path); }

    /**
     * Reads the whole table. An absent file loads as an empty, absent table; an unreadable one is logged
     * and also loads as absent.
     */
    public Loaded<T> load() {
        if (!exists()) {
            log.info("Table not found: {}", path);
            return Loaded.absent();
        }
        ObjectReader reader = mapper.readerFor(rowType).with(CsvSchema.emptySchema().withHeader());
        try (Reader in = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             MappingIterator<T> it = reader.readValues(in)) {
            List<T> rows = it.readAll();
            log.info("Loaded {} rows from {}", rows.size(), path);
            return new Loaded<>(List.copyOf(rows), true);
        } catch (IOException | RuntimeJsonMappingException e) {
            log.warn("Could not read {}, treating it as empty: {}", path, e.getMessage());
            return Loaded.absent();
        }
    }

    /** Replaces the table with the given rows. */
    public void write(List<T> rows) {
        Path dir = path.toAbsolutePath().getParent();
        Path tmp = null;
        try {
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, path.getFileName().toString(), ".tmp");
            try (Writer out = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                if (rows.isEmpty()) {
                    out.write(headerLine());
                } else {
                    try (SequenceWriter seq = mapper.writer(writeSchema).writeValues(out)) {
                        seq.writeAll(rows);
                    }
                }
            }
            moveIntoPlace(tmp);
            log.info("Wrote {} rows to {}", rows.size(), path);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new TableStoreException(path, "Could not write table", e);
        }
    }

    private void moveIntoPlace(Path tmp) throws IOException {
        try {
            Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private String headerLine() {
        StringBuilder sb = new StringBuilder();
        for (CsvSchema.Column c : writeSchema) {
            if (sb.length() > 0) sb.append(writeSchema.getColumnSeparator());
            sb.append(c.getName());
        }
        return sb.append('\n').toString();
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Could not remove temporary file {}: {}", tmp, e.getMessage());
        }
    }

    /** Rows of a table and whether a readable file was found. */
    public record Loaded<T>(List<T> rows, boolean present) {
        static <T> Loaded<T> absent() {
            return new Loaded<>(List.of(), false);
        }
    }
}
