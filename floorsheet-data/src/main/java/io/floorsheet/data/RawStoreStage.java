package io.floorsheet.data;

import io.floorsheet.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.List;

/**
 * Stores fetched transactions in the raw table: retention on both the batch and the stored rows, then a
 * dedup merge by (date, transaction_no), then an atomic rewrite of the table when anything changed.
 */
public class RawStoreStage {
    static final String NAME = "raw-store";
    private static final Logger log = LoggerFactory.getLogger(RawStoreStage.class);

    private final CsvTableStore<TransactionRecord> rawTable;
    private final Metrics metrics;

    public RawStoreStage(CsvTableStore<TransactionRecord> rawTable, Metrics metrics) {
        this.rawTable = rawTable;
        this.metrics = metrics;
    }

    public StageResult store(List<TransactionRecord> batch, LocalDate cutoff) {
        if (batch.isEmpty()) {
            return StageResult.failed(NAME, "No transactions to store");
        }
        log.info("Data retention policy: keeping data from {} onwards", cutoff);
        try (StageLock ignored = StageLock.acquire(rawTable.path())) {
            RetentionFilter.Retained<TransactionRecord> fresh = RetentionFilter.apply(batch, cutoff);
            if (fresh.removed() > 0) {
                log.info("Filtered out {} fetched records older than {}", fresh.removed(), cutoff);
            }
            metrics.count("retention.rows.removed", fresh.removed());

            CsvTableStore.Loaded<TransactionRecord> stored = rawTable.load();
            if (!stored.present()) {
                if (fresh.rows().isEmpty()) {
                    return StageResult.noOp(NAME, 0, "No records left after applying retention; nothing written");
                }
                rawTable.write(fresh.rows());
                metrics.count("raw.rows.written", fresh.rows().size());
                return StageResult.written(NAME, fresh.rows().size(),
                        "Saved " + fresh.rows().size() + " records to " + rawTable.path());
            }

            RetentionFilter.Retained<TransactionRecord> kept = RetentionFilter.apply(stored.rows(), cutoff);
            if (kept.removed() > 0) {
                log.info("Removed {} stored records older than {}", kept.removed(), cutoff);
            }
            metrics.count("retention.rows.removed", kept.removed());

            TransactionDedupMerge.Merged merged = TransactionDedupMerge.merge(kept.rows(), fresh.rows());
            metrics.count("raw.rows.duplicates", merged.duplicates());
            log.info("Merge: {} new, {} replaced, {} already stored", merged.added(), merged.replaced(), merged.unchanged());

            if (!merged.changesStoredRows() && kept.removed() == 0) {
                return StageResult.noOp(NAME, stored.rows().size(), "No new records to add; file unchanged");
            }
            rawTable.write(merged.rows());
            metrics.count("raw.rows.written", merged.rows().size());
            return StageResult.written(NAME, merged.rows().size(),
                    "Added " + merged.added() + " and replaced " + merged.replaced() + " records; "
                            + merged.rows().size() + " records in " + rawTable.path());
        } catch (StageLockedException | TableStoreException e) {
            log.error("Raw store run failed: {}", e.getMessage());
            return StageResult.failed(NAME, e.getMessage());
        }
    }
}
