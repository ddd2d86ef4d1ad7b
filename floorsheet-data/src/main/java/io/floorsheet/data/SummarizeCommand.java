package io.floorsheet.data;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.Injector;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Global rollup. --retention-days is only reported: the date summaries were already trimmed when written.
 */
@CommandLine.Command(name = "summarize", mixinStandardHelpOptions = true, description = "Aggregate the date-wise summaries into one row per broker and stock")
public final class SummarizeCommand implements Callable<Integer> {
    @CommandLine.ParentCommand
    FloorsheetMain parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = "--input", description = "Date summary table file")
    Path input;

    @CommandLine.Option(names = "--output", description = "Global summary table file")
    Path output;

    @CommandLine.Option(names = "--retention-days", description = "Retention the date summaries were written with (default: 365)")
    Integer retentionDays;

    @Override
    public Integer call() {
        FloorsheetConfig cfg = FloorsheetMain.withRetention(spec.commandLine(), parent.config(), retentionDays);
        if (input != null) cfg = cfg.withDatePath(input);
        if (output != null) cfg = cfg.withGlobalPath(output);

        Injector injector = parent.injector(cfg);
        PrintWriter out = spec.commandLine().getOut();
        StageResult r = new StageRunner(injector, cfg, out).summarize();
        FloorsheetMain.printOnce(injector.getInstance(MetricRegistry.class), out);
        return FloorsheetMain.exitCode(r);
    }
}
