package io.floorsheet.data;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.Injector;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "summarize-dates", mixinStandardHelpOptions = true, description = "Create date-wise broker/stock summaries from the raw table")
public final class SummarizeDatesCommand implements Callable<Integer> {
    @CommandLine.ParentCommand
    FloorsheetMain parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = "--input", description = "Raw table file")
    Path input;

    @CommandLine.Option(names = "--output", description = "Date summary table file")
    Path output;

    @CommandLine.Option(names = "--retention-days", description = "Days of data to keep (default: 365)")
    Integer retentionDays;

    @Override
    public Integer call() {
        FloorsheetConfig cfg = FloorsheetMain.withRetention(spec.commandLine(), parent.config(), retentionDays);
        if (input != null) cfg = cfg.withRawPath(input);
        if (output != null) cfg = cfg.withDatePath(output);

        Injector injector = parent.injector(cfg);
        PrintWriter out = spec.commandLine().getOut();
        StageResult r = new StageRunner(injector, cfg, out).summarizeDates();
        FloorsheetMain.printOnce(injector.getInstance(MetricRegistry.class), out);
        return FloorsheetMain.exitCode(r);
    }
}
