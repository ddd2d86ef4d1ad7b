package io.floorsheet.data;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.Injector;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.time.LocalDate;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * download, summarize-dates and summarize in order on the configured tables. Stops at the first failed stage.
 */
@CommandLine.Command(name = "run-all", mixinStandardHelpOptions = true, description = "Download, then rebuild the date-wise and global summaries")
public final class RunAllCommand implements Callable<Integer> {
    @CommandLine.ParentCommand
    FloorsheetMain parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = "--date", description = "Trading date to download (yyyy-MM-dd); default latest")
    LocalDate date;

    @CommandLine.Option(names = "--max-pages", description = "Maximum number of pages to download; default all")
    Integer maxPages;

    @CommandLine.Option(names = "--retention-days", description = "Days of data to keep (default: 365)")
    Integer retentionDays;

    @Override
    public Integer call() {
        FloorsheetConfig cfg = FloorsheetMain.withRetention(spec.commandLine(), parent.config(), retentionDays);
        if (maxPages != null) {
            if (maxPages < 1) throw new CommandLine.ParameterException(spec.commandLine(), "--max-pages must be positive: " + maxPages);
            cfg = cfg.withMaxPages(maxPages);
        }

        Injector injector = parent.injector(cfg);
        PrintWriter out = spec.commandLine().getOut();
        StageRunner runner = new StageRunner(injector, cfg, out);
        try {
            StageResult r = runner.download(Optional.ofNullable(date));
            if (!r.succeeded()) return FloorsheetMain.exitCode(r);
            r = runner.summarizeDates();
            if (!r.succeeded()) return FloorsheetMain.exitCode(r);
            return FloorsheetMain.exitCode(runner.summarize());
        } finally {
            FloorsheetMain.printOnce(injector.getInstance(MetricRegistry.class), out);
        }
    }
}
