package io.floorsheet.data;

import io.floorsheet.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Recomputes the broker/stock summary of every trading date in the raw table and upserts the results by
 * date into the date-summary table. A date that cannot be folded is skipped and keeps whatever the
 * table already had for it.
 */
public class DateRollupStage {
    static final String NAME = "date-rollup";
    private static final Logger log = LoggerFactory.getLogger(DateRollupStage.class);

    private final CsvTableStore<TransactionRecord> rawTable;
    private final CsvTableStore<DateSummary> dateTable;
    private final Metrics metrics;

    public DateRollupStage(CsvTableStore<TransactionRecord> rawTable, CsvTableStore<DateSummary> dateTable, Metrics metrics) {
        this.rawTable = rawTable;
        this.dateTable = dateTable;
        this.metrics = metrics;
    }

    public StageResult run(LocalDate cutoff) {
        try (StageLock ignored = StageLock.acquire(dateTable.path())) {
            RetentionFilter.Retained<TransactionRecord> raw = RetentionFilter.apply(rawTable.load().rows(), cutoff);
            if (raw.removed() > 0) {
                log.info("Filtered out {} raw records older than {}", raw.removed(), cutoff);
            }
            metrics.count("retention.rows.removed", raw.removed());
            if (raw.rows().isEmpty()) {
                return StageResult.failed(NAME, "No raw data to summarize");
            }

            SortedMap<LocalDate, List<TransactionRecord>> byDate = groupByDate(raw.rows());
            if (byDate.isEmpty()) {
                return StageResult.failed(NAME, "Raw data has no trading dates in " + rawTable.path());
            }
            log.info("Found {} unique dates in raw data", byDate.size());

            SortedMap<LocalDate, List<DateSummary>> recomputed = new TreeMap<>();
            for (var e : byDate.entrySet()) {
                BrokerStockFolder.FoldResult fold = BrokerStockFolder.fold(e.getKey(), e.getValue());
                if (fold.failed()) {
                    log.warn("Skipping {}: {}", e.getKey(), fold.failure());
                    metrics.count("date.rollup.dates.failed", 1);
                    continue;
                }
                log.debug("Summary for {} has {} broker-stock combinations", e.getKey(), fold.rows().size());
                recomputed.put(e.getKey(), fold.rows());
            }
            if (recomputed.isEmpty()) {
                return StageResult.failed(NAME, "Failed to create date-wise summaries");
            }

            CsvTableStore.Loaded<DateSummary> stored = dateTable.load();
            RetentionFilter.Retained<DateSummary> kept = RetentionFilter.apply(stored.rows(), cutoff);
            if (kept.removed() > 0) {
                log.info("Removed {} summary rows older than {}", kept.removed(), cutoff);
            }
            metrics.count("retention.rows.removed", kept.removed());

            DateKeyedUpsertMerge.Upserted upserted = DateKeyedUpsertMerge.merge(kept.rows(), recomputed);
            for (LocalDate d : upserted.replacedDates()) {
                log.info("Replacing data for date {}", d);
            }
            if (stored.present() && upserted.rows().equals(stored.rows())) {
                return StageResult.noOp(NAME, stored.rows().size(), "Date summaries already up to date");
            }
            dateTable.write(upserted.rows());
            metrics.count("date.rollup.rows", upserted.rows().size());
            return StageResult.written(NAME, upserted.rows().size(),
                    "Saved " + upserted.rows().size() + " summary rows for " + recomputed.size() + " recomputed dates to "
                            + dateTable.path());
        } catch (StageLockedException | TableStoreException e) {
            log.error("Date rollup failed: {}", e.getMessage());
            return StageResult.failed(NAME, e.getMessage());
        }
    }

    private SortedMap<LocalDate, List<TransactionRecord>> groupByDate(List<TransactionRecord> rows) {
        SortedMap<LocalDate, List<TransactionRecord>> byDate = new TreeMap<>();
        int undated = 0;
        for (TransactionRecord r : rows) {
            if (r.date() == null) {
                undated++;
                continue;
            }
            byDate.computeIfAbsent(r.date(), d -> new ArrayList<>()).add(r);
        }
        if (undated > 0) {
            log.warn("Ignoring {} raw records without a trading date", undated);
        }
        return byDate;
    }
}
