package io.floorsheet.data;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.floorsheet.error.DeadLetterSink;
import io.floorsheet.error.FileDeadLetterSink;
import io.floorsheet.metrics.Metrics;

import java.io.IOException;
import java.time.Clock;

public class FloorsheetModule extends AbstractModule {
    private final FloorsheetConfig config;

    public FloorsheetModule(FloorsheetConfig config) { this.config = config; }

    @Override
    protected void configure() {
        bind(FloorsheetConfig.class).toInstance(config);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton Metrics metrics(MetricRegistry registry) { return new Metrics(registry); }

    @Provides @Singleton Clock clock() { return Clock.systemDefaultZone(); }

    @Provides @Singleton FloorsheetClient client() { return new HttpFloorsheetClient(config.baseUrl(), config.httpTimeout()); }

    @Provides PageDelay pageDelay() { return PageDelay.randomMillis(config.minPageDelayMillis(), config.maxPageDelayMillis()); }

    @Provides @Singleton DeadLetterSink<FloorsheetPage> skippedRows(Clock clock) throws IOException {
        return new FileDeadLetterSink<>(config.deadLetterPath(), p -> "page " + p.number() + " of " + p.tradingDate(), clock);
    }

    @Provides @Singleton TransactionSource transactionSource(FloorsheetClient client, PageDelay delay, DeadLetterSink<FloorsheetPage> dlq, MetricRegistry registry) {
        return new MerolaganiTransactionSource(client, config.maxPages(), delay, dlq, registry);
    }

    @Provides @Singleton CsvTableStore<TransactionRecord> rawTable() { return new CsvTableStore<>(config.rawPath(), TransactionRecord.class); }

    @Provides @Singleton CsvTableStore<DateSummary> dateTable() { return new CsvTableStore<>(config.datePath(), DateSummary.class); }

    @Provides @Singleton CsvTableStore<GlobalSummary> globalTable() { return new CsvTableStore<>(config.globalPath(), GlobalSummary.class); }

    @Provides @Singleton RawStoreStage rawStoreStage(CsvTableStore<TransactionRecord> raw, Metrics metrics) {
        return new RawStoreStage(raw, metrics);
    }

    @Provides @Singleton DateRollupStage dateRollupStage(CsvTableStore<TransactionRecord> raw, CsvTableStore<DateSummary> dates, Metrics metrics) {
        return new DateRollupStage(raw, dates, metrics);
    }

    @Provides @Singleton GlobalRollupStage globalRollupStage(CsvTableStore<DateSummary> dates, CsvTableStore<GlobalSummary> global, Metrics metrics) {
        return new GlobalRollupStage(dates, global, metrics);
    }
}
