package io.floorsheet.data;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static io.floorsheet.data.Fixtures.tx;
import static org.junit.jupiter.api.Assertions.*;

class CsvTableStoreTest {
    private Path tmp;

    @BeforeEach
    void setup() throws IOException {
        tmp = Files.createTempDirectory("csv-table-test");
    }

    @AfterEach
    void cleanup() throws IOException {
        Fixtures.deleteRecursively(tmp);
    }

    @Test
    void writesHeaderInColumnOrderAndReadsRowsBack() throws IOException {
        CsvTableStore<TransactionRecord> store = new CsvTableStore<>(tmp.resolve("public/raw.csv"), TransactionRecord.class);
        TransactionRecord quoted = new TransactionRecord(LocalDate.of(2024, 1, 2), "100200", "NABIL",
                "Nabil Bank Limited, \"A\" class", "58", "Naasa Securities Co. Ltd.", "34", "Vision Securities, Pvt",
                1_250L, 512.5, 640_625.0);
        List<TransactionRecord> rows = List.of(quoted, tx("2024-01-03", "100201", "X", "B1", "B2", 40, 4_200));

        store.write(rows);

        List<String> lines = Files.readAllLines(store.path(), StandardCharsets.UTF_8);
        assertEquals("date,transaction_no,symbol,symbol_full,buyer_id,buyer_name,seller_id,seller_name,quantity,rate,amount", lines.get(0));
        assertTrue(lines.get(1).startsWith("2024-01-02,100200,NABIL,"), lines.get(1));

        CsvTableStore.Loaded<TransactionRecord> loaded = store.load();
        assertTrue(loaded.present());
        assertEquals(rows, loaded.rows());
    }

    @Test
    void missingFileLoadsAsAbsent() {
        CsvTableStore<DateSummary> store = new CsvTableStore<>(tmp.resolve("nope.csv"), DateSummary.class);
        CsvTableStore.Loaded<DateSummary> loaded = store.load();
        assertFalse(loaded.present());
        assertTrue(loaded.rows().isEmpty());
    }

    @Test
    void unreadableFileLoadsAsAbsent() throws IOException {
        Path p = tmp.resolve("broken.csv");
        Files.writeString(p, "date,broker_id,buy_quantity\nnot-a-date,B1,lots\n", StandardCharsets.UTF_8);
        CsvTableStore<DateSummary> store = new CsvTableStore<>(p, DateSummary.class);
        assertFalse(store.load().present());
    }

    @Test
    void emptyTableStillHasHeader() throws IOException {
        CsvTableStore<GlobalSummary> store = new CsvTableStore<>(tmp.resolve("global.csv"), GlobalSummary.class);
        store.write(List.of());

        List<String> lines = Files.readAllLines(store.path(), StandardCharsets.UTF_8);
        assertEquals(List.of("broker_id,broker_name,symbol,buy_quantity,buy_amount,sell_quantity,sell_amount,"
                + "last_updated,avg_buy_price,avg_sell_price,net_quantity,avg_holding_price"), lines);
        CsvTableStore.Loaded<GlobalSummary> loaded = store.load();
        assertTrue(loaded.present());
        assertTrue(loaded.rows().isEmpty());
    }

    @Test
    void failedWriteLeavesPreviousTableAndNoTempFile() throws IOException {
        Path p = tmp.resolve("rows.csv");
        CsvTableStore<Row> store = new CsvTableStore<>(p, Row.class);
        store.write(List.of(new Row("a"), new Row("b")));
        String before = Files.readString(p, StandardCharsets.UTF_8);

        TableStoreException e = assertThrows(TableStoreException.class,
                () -> store.write(List.of(new Row("c"), new Row("boom"))));
        assertEquals(p, e.path());

        assertEquals(before, Files.readString(p, StandardCharsets.UTF_8));
        try (var files = Files.list(tmp)) {
            assertEquals(List.of(p), files.toList());
        }
    }

    /** Row type whose serialization fails on demand. */
    record Row(String name) {
        @Override
        public String name() {
            if ("boom".equals(name)) throw new IllegalStateException("cannot serialize " + name);
            return name;
        }
    }
}
