package io.floorsheet.data;

import com.google.inject.Injector;

import java.io.PrintWriter;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Runs the stages for the command line and prints what the operator wants to see after each of them.
 */
final class StageRunner {
    static final String DOWNLOAD = "download";

    private final Injector injector;
    private final FloorsheetConfig cfg;
    private final PrintWriter out;
    private final LocalDate cutoff;

    StageRunner(Injector injector, FloorsheetConfig cfg, PrintWriter out) {
        this.injector = injector;
        this.cfg = cfg;
        this.out = out;
        this.cutoff = RetentionFilter.cutoff(injector.getInstance(Clock.class), cfg.retentionDays());
    }

    LocalDate cutoff() { return cutoff; }

    StageResult download(Optional<LocalDate> date) {
        out.println(date.map(d -> "Downloading floorsheet data for date: " + d).orElse("Downloading latest floorsheet data"));
        out.println("Data retention policy: " + cfg.retentionDays() + " days (keeping " + cutoff + " onwards)");
        out.flush();

        FetchResult fetched = injector.getInstance(TransactionSource.class).fetch(date);
        if (!fetched.complete()) {
            out.println("Warning: download stopped after " + fetched.pagesFetched() + " pages; keeping what was read");
        }
        if (fetched.skippedRows() > 0) {
            out.println("Skipped " + fetched.skippedRows() + " unparseable rows (see " + cfg.deadLetterPath() + ")");
        }
        if (fetched.records().isEmpty()) {
            out.println("No data was downloaded.");
            return report(StageResult.failed(DOWNLOAD, "No data was downloaded"));
        }

        StageResult stored = injector.getInstance(RawStoreStage.class).store(fetched.records(), cutoff);
        if (stored.succeeded()) {
            out.println();
            out.println("Download Summary:");
            out.println("Total records downloaded: " + fetched.records().size());
            out.println("Trading date: " + fetched.tradingDate());
            out.println("Raw data saved to: " + cfg.rawPath());
            out.println("Data retention: Keeping last " + cfg.retentionDays() + " days only");
        }
        return report(stored);
    }

    StageResult summarizeDates() {
        out.println("Data retention policy: " + cfg.retentionDays() + " days");
        StageResult r = injector.getInstance(DateRollupStage.class).run(cutoff);
        if (r.succeeded()) {
            out.println();
            out.println("Date-wise summarization completed successfully.");
            out.println("Date-wise summarized data saved to: " + cfg.datePath());
            out.println("Data retention: Keeping data for the last " + cfg.retentionDays() + " days");
        }
        return report(r);
    }

    StageResult summarize() {
        out.println("Using date-summarized data with " + cfg.retentionDays() + "-day retention policy");
        StageResult r = injector.getInstance(GlobalRollupStage.class).run();
        if (r.succeeded()) {
            out.println();
            out.println("Data aggregation completed successfully.");
            out.println("Aggregated data saved to: " + cfg.globalPath());
        }
        return report(r);
    }

    private StageResult report(StageResult r) {
        out.println("[" + r.stage() + "] " + r.status() + ": " + r.message());
        out.flush();
        return r;
    }
}
