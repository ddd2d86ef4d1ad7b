package io.floorsheet.data;

import com.codahale.metrics.MetricRegistry;
import io.floorsheet.metrics.Metrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static io.floorsheet.data.Fixtures.day;
import static io.floorsheet.data.Fixtures.tx;
import static org.junit.jupiter.api.Assertions.*;

class DateRollupStageTest {
    private static final LocalDate CUTOFF = LocalDate.of(2023, 6, 1);

    private Path tmp;
    private CsvTableStore<TransactionRecord> raw;
    private CsvTableStore<DateSummary> dates;
    private Metrics metrics;
    private DateRollupStage stage;

    @BeforeEach
    void setup() throws IOException {
        tmp = Files.createTempDirectory("date-rollup-test");
        raw = new CsvTableStore<>(tmp.resolve("raw.csv"), TransactionRecord.class);
        dates = new CsvTableStore<>(tmp.resolve("dates.csv"), DateSummary.class);
        metrics = new Metrics(new MetricRegistry());
        stage = new DateRollupStage(raw, dates, metrics);
    }

    @AfterEach
    void cleanup() throws IOException {
        Fixtures.deleteRecursively(tmp);
    }

    @Test
    void summarizesEachDate() {
        raw.write(List.of(
                tx("2024-01-02", "1", "X", "B1", "B2", 100, 10_000),
                tx("2024-01-02", "2", "X", "B2", "B1", 40, 4_200),
                tx("2024-01-03", "3", "Y", "B1", "B3", 5, 500)));

        StageResult r = stage.run(CUTOFF);

        assertEquals(StageResult.Status.WRITTEN, r.status());
        List<DateSummary> rows = dates.load().rows();
        assertEquals(4, rows.size());
        DateSummary b1 = rows.stream().filter(s -> s.date().equals(LocalDate.of(2024, 1, 2)) && s.brokerId().equals("B1"))
                .findFirst().orElseThrow();
        assertEquals(60, b1.netQuantity());
        assertEquals(96.67, b1.avgHoldingPrice(), 0.005);
    }

    @Test
    void rerunOnUnchangedInputLeavesFileByteIdentical() throws IOException {
        raw.write(List.of(
                tx("2024-01-02", "1", "X", "B1", "B2", 100, 10_000),
                tx("2024-01-03", "2", "X", "B2", "B1", 40, 4_200)));
        assertEquals(StageResult.Status.WRITTEN, stage.run(CUTOFF).status());
        byte[] first = Files.readAllBytes(dates.path());

        StageResult again = stage.run(CUTOFF);

        assertEquals(StageResult.Status.NO_OP, again.status());
        assertArrayEquals(first, Files.readAllBytes(dates.path()));
    }

    @Test
    void recomputedDateReplacesStoredRowsForThatDateOnly() {
        DateSummary keptOther = day("2024-01-01", "B9", "Z", 1, 10, 0, 0);
        DateSummary staleSameDate = day("2024-01-02", "B7", "Q", 1, 10, 0, 0);
        dates.write(List.of(keptOther, staleSameDate));
        raw.write(List.of(tx("2024-01-02", "1", "X", "B1", "B2", 100, 10_000)));

        stage.run(CUTOFF);

        List<DateSummary> rows = dates.load().rows();
        assertTrue(rows.contains(keptOther));
        assertFalse(rows.contains(staleSameDate));
        assertEquals(3, rows.size());
    }

    @Test
    void storedSummariesOlderThanCutoffAreDropped() {
        dates.write(List.of(day("2023-01-01", "B9", "Z", 1, 10, 0, 0)));
        raw.write(List.of(tx("2024-01-02", "1", "X", "B1", "B2", 100, 10_000)));

        stage.run(CUTOFF);

        assertTrue(dates.load().rows().stream().noneMatch(s -> s.date().isBefore(CUTOFF)));
        assertEquals(1, metrics.countOf("retention.rows.removed"));
    }

    @Test
    void badDateIsSkippedAndOthersProceed() {
        raw.write(List.of(
                tx("2024-01-02", "1", "X", "B1", null, 100, 10_000),
                tx("2024-01-03", "2", "X", "B1", "B2", 100, 10_000)));

        StageResult r = stage.run(CUTOFF);

        assertEquals(StageResult.Status.WRITTEN, r.status());
        assertTrue(dates.load().rows().stream().allMatch(s -> s.date().equals(LocalDate.of(2024, 1, 3))));
        assertEquals(1, metrics.countOf("date.rollup.dates.failed"));
    }

    @Test
    void failsWhenNoDateCanBeSummarized() {
        raw.write(List.of(tx("2024-01-02", "1", "X", null, "B2", 100, 10_000)));
        StageResult r = stage.run(CUTOFF);
        assertEquals(StageResult.Status.FAILED, r.status());
        assertFalse(Files.exists(dates.path()));
    }

    @Test
    void failsWithoutRawData() {
        assertEquals(StageResult.Status.FAILED, stage.run(CUTOFF).status());

        raw.write(List.of(tx("2022-01-02", "1", "X", "B1", "B2", 100, 10_000)));
        StageResult r = stage.run(CUTOFF);
        assertEquals(StageResult.Status.FAILED, r.status());
        assertEquals("No raw data to summarize", r.message());
    }

    @Test
    void rawTableWithoutAmountColumnIsNotSummarizedAsZero() throws IOException {
        Files.writeString(raw.path(),
                "date,transaction_no,symbol,buyer_id,seller_id,quantity,rate\n"
                        + "2024-01-02,1,X,B1,B2,100,100.0\n");

        StageResult r = stage.run(CUTOFF);

        assertEquals(StageResult.Status.FAILED, r.status());
        assertEquals(1, metrics.countOf("date.rollup.dates.failed"));
        assertFalse(Files.exists(dates.path()));
    }

    @Test
    void dateWithMissingQuantityIsSkipped() throws IOException {
        Files.writeString(raw.path(),
                "date,transaction_no,symbol,buyer_id,seller_id,quantity,rate,amount\n"
                        + "2024-01-02,1,X,B1,B2,,100.0,10000\n"
                        + "2024-01-03,2,X,B1,B2,100,100.0,10000\n");

        StageResult r = stage.run(CUTOFF);

        assertEquals(StageResult.Status.WRITTEN, r.status());
        List<DateSummary> rows = dates.load().rows();
        assertTrue(rows.stream().allMatch(s -> s.date().equals(LocalDate.of(2024, 1, 3))));
        assertTrue(rows.stream().noneMatch(s -> s.buyAmount() == 0 && s.buyQuantity() > 0));
        assertEquals(1, metrics.countOf("date.rollup.dates.failed"));
    }
}
