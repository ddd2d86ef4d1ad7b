package io.floorsheet.data;

import com.codahale.metrics.MetricRegistry;
import io.floorsheet.error.DeadLetterSink;
import io.floorsheet.metrics.Metrics;
import io.floorsheet.runtime.BatchPipeline;
import io.floorsheet.runtime.BatchPipelineBuilder;
import io.floorsheet.sink.CollectingSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Downloads a trading date's floorsheet page by page and parses it into transactions.
 */
public class MerolaganiTransactionSource implements TransactionSource {
    private static final Logger log = LoggerFactory.getLogger(MerolaganiTransactionSource.class);

    private final FloorsheetClient client;
    private final int maxPages;
    private final PageDelay delay;
    private final DeadLetterSink<FloorsheetPage> deadLetters;
    private final MetricRegistry registry;

    public MerolaganiTransactionSource(FloorsheetClient client, int maxPages, PageDelay delay,
                                       DeadLetterSink<FloorsheetPage> deadLetters, MetricRegistry registry) {
        this.client = client;
        this.maxPages = maxPages;
        this.delay = delay;
        this.deadLetters = deadLetters;
        this.registry = registry;
    }

    @Override
    public FetchResult fetch(Optional<LocalDate> date) {
        Metrics metrics = new Metrics(registry);
        FloorsheetPageSource pages = new FloorsheetPageSource(client, date, maxPages, delay, metrics);
        FloorsheetRowTransform rows = new FloorsheetRowTransform(deadLetters, metrics);
        CollectingSink<TransactionRecord> sink = new CollectingSink<>();

        BatchPipeline<FloorsheetPage, TransactionRecord> pipeline = new BatchPipelineBuilder<FloorsheetPage, TransactionRecord>()
                .source(pages)
                .transform(rows)
                .sink(sink)
                .metrics(registry)
                .deadLetters(deadLetters)
                .build();
        try {
            BatchPipeline.Summary summary = pipeline.run();
            log.info("Fetched {} pages, {} transactions, {} rows skipped", summary.inputs(), summary.outputs(), rows.skipped());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Fetch interrupted; keeping {} transactions", sink.items().size());
        } catch (Exception e) {
            throw new IllegalStateException("Collecting floorsheet transactions failed", e);
        }
        return new FetchResult(pages.tradingDate(), sink.items(), rows.skipped(), pages.pagesFetched(), pages.complete());
    }
}
