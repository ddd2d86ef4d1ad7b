package io.floorsheet.data;

import io.floorsheet.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Aggregates the whole date-summary table into one row per broker and stock and overwrites the global
 * table with it. The date-summary table is read as-is: retention was applied when it was written.
 */
public class GlobalRollupStage {
    static final String NAME = "global-rollup";
    private static final Logger log = LoggerFactory.getLogger(GlobalRollupStage.class);

    private final CsvTableStore<DateSummary> dateTable;
    private final CsvTableStore<GlobalSummary> globalTable;
    private final Metrics metrics;

    public GlobalRollupStage(CsvTableStore<DateSummary> dateTable, CsvTableStore<GlobalSummary> globalTable, Metrics metrics) {
        this.dateTable = dateTable;
        this.globalTable = globalTable;
        this.metrics = metrics;
    }

    public StageResult run() {
        try (StageLock ignored = StageLock.acquire(globalTable.path())) {
            List<DateSummary> dated = dateTable.load().rows();
            if (dated.isEmpty()) {
                return StageResult.failed(NAME, "No date-summarized data to aggregate");
            }
            long dates = dated.stream().map(DateSummary::date).distinct().count();
            log.info("Aggregating {} rows from {} dates", dated.size(), dates);

            List<GlobalSummary> global = GlobalOverwriteMerge.fold(dated);
            globalTable.write(global);
            metrics.count("global.rollup.rows", global.size());
            return StageResult.written(NAME, global.size(),
                    "Saved " + global.size() + " broker-stock combinations to " + globalTable.path());
        } catch (StageLockedException | TableStoreException e) {
            log.error("Global rollup failed: {}", e.getMessage());
            return StageResult.failed(NAME, e.getMessage());
        }
    }
}
