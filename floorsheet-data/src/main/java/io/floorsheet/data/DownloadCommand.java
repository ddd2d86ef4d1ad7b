package io.floorsheet.data;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.Injector;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Optional;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "download", mixinStandardHelpOptions = true, description = "Download one trading date's floorsheet into the raw table")
public final class DownloadCommand implements Callable<Integer> {
    @CommandLine.ParentCommand
    FloorsheetMain parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = "--date", description = "Trading date to download (yyyy-MM-dd); default latest")
    LocalDate date;

    @CommandLine.Option(names = "--max-pages", description = "Maximum number of pages to download; default all")
    Integer maxPages;

    @CommandLine.Option(names = "--output", description = "Raw table file")
    Path output;

    @CommandLine.Option(names = "--retention-days", description = "Days of data to keep (default: 365)")
    Integer retentionDays;

    @Override
    public Integer call() {
        FloorsheetConfig cfg = FloorsheetMain.withRetention(spec.commandLine(), parent.config(), retentionDays);
        if (maxPages != null) {
            if (maxPages < 1) throw new CommandLine.ParameterException(spec.commandLine(), "--max-pages must be positive: " + maxPages);
            cfg = cfg.withMaxPages(maxPages);
        }
        if (output != null) cfg = cfg.withRawPath(output);

        Injector injector = parent.injector(cfg);
        PrintWriter out = spec.commandLine().getOut();
        StageResult r = new StageRunner(injector, cfg, out).download(Optional.ofNullable(date));
        FloorsheetMain.printOnce(injector.getInstance(MetricRegistry.class), out);
        return FloorsheetMain.exitCode(r);
    }
}
