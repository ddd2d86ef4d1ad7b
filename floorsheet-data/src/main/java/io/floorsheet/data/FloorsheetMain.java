package io.floorsheet.data;

import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Module;
import com.google.inject.util.Modules;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.time.Instant;
import java.util.concurrent.Callable;

/**
 * CLI for downloading floorsheets and maintaining the date-wise and global broker summaries.
 */
@CommandLine.Command(name = "floorsheet", mixinStandardHelpOptions = true,
        description = "Download floorsheet data and maintain broker/stock summaries",
        subcommands = {DownloadCommand.class, SummarizeDatesCommand.class, SummarizeCommand.class, RunAllCommand.class})
public final class FloorsheetMain implements Callable<Integer> {
    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private final FloorsheetConfig baseConfig;
    private final Module overrides;

    public FloorsheetMain() {
        this(null, null);
    }

    /** Tests pass their own configuration and bindings (fake client, fixed clock) here. */
    public FloorsheetMain(FloorsheetConfig baseConfig, Module overrides) {
        this.baseConfig = baseConfig;
        this.overrides = overrides;
    }

    public static void main(String[] args) {
        int code = new CommandLine(new FloorsheetMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing sub-command");
    }

    FloorsheetConfig config() {
        return baseConfig != null ? baseConfig : FloorsheetConfig.fromEnv();
    }

    Injector injector(FloorsheetConfig cfg) {
        Module module = new FloorsheetModule(cfg);
        return Guice.createInjector(overrides == null ? module : Modules.override(module).with(overrides));
    }

    /** Validates a --retention-days value and applies it over the configured default. */
    static FloorsheetConfig withRetention(CommandLine commandLine, FloorsheetConfig cfg, Integer retentionDays) {
        int days = retentionDays != null ? retentionDays : cfg.retentionDays();
        if (days < 0) {
            throw new CommandLine.ParameterException(commandLine, "--retention-days must not be negative: " + days);
        }
        return cfg.withRetentionDays(days);
    }

    static int exitCode(StageResult... results) {
        for (StageResult r : results) {
            if (r != null && !r.succeeded()) return 1;
        }
        return 0;
    }

    static void printOnce(MetricRegistry r, PrintWriter out) {
        Meter in = r.meter("pipeline.input.rate");
        Meter outRate = r.meter("pipeline.output.rate");
        Meter err = r.meter("pipeline.error.rate");
        Timer src = r.timer("pipeline.source.time");
        Timer xfm = r.timer("pipeline.transform.time");

        out.println("[" + Instant.now() + "] metrics:" +
                " pages=" + r.counter("floorsheet.pages.fetched").getCount() +
                " pagesFailed=" + r.counter("floorsheet.pages.failed").getCount() +
                " | inCnt=" + in.getCount() + " outCnt=" + outRate.getCount() + " errCnt=" + err.getCount() +
                " | skipped=" + r.counter("floorsheet.rows.skipped").getCount() +
                " | raw.written=" + r.counter("raw.rows.written").getCount() +
                " raw.duplicates=" + r.counter("raw.rows.duplicates").getCount() +
                " retention.removed=" + r.counter("retention.rows.removed").getCount() +
                " | date.rows=" + r.counter("date.rollup.rows").getCount() +
                " date.failed=" + r.counter("date.rollup.dates.failed").getCount() +
                " | global.rows=" + r.counter("global.rollup.rows").getCount() +
                " | t.p50(ms)=" + nsToMs(src.getSnapshot().getMedian()) + "/" + nsToMs(xfm.getSnapshot().getMedian())
        );
        out.flush();
    }

    private static String nsToMs(double nanos) { return String.format("%.3f", nanos / 1_000_000.0); }
}
