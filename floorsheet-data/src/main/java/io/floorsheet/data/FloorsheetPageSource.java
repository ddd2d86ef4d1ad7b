package io.floorsheet.data;

import io.floorsheet.core.Record;
import io.floorsheet.core.Source;
import io.floorsheet.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Emits the floorsheet pages of one trading date, page 1 first. Page 1 decides the trading date and the
 * number of pages (capped by maxPages when positive). The first page that cannot be fetched ends the
 * source; pages emitted before it stay valid and {@link #complete()} turns false.
 */
public class FloorsheetPageSource implements Source<FloorsheetPage> {
    private static final Logger log = LoggerFactory.getLogger(FloorsheetPageSource.class);

    private final FloorsheetClient client;
    private final Optional<LocalDate> targetDate;
    private final int maxPages;
    private final PageDelay delay;
    private final Metrics metrics;

    private int nextPage = 1;
    private int totalPages = 1;
    private LocalDate tradingDate;
    private boolean finished;
    private boolean complete = true;
    private int fetched;

    public FloorsheetPageSource(FloorsheetClient client, Optional<LocalDate> targetDate, int maxPages, PageDelay delay, Metrics metrics) {
        this.client = client;
        this.targetDate = targetDate;
        this.maxPages = maxPages;
        this.delay = delay;
        this.metrics = metrics;
    }

    @Override
    public Optional<Record<FloorsheetPage>> poll() {
        if (finished) return Optional.empty();
        String html;
        try {
            if (nextPage > 1) delay.pause();
            html = client.fetchPage(nextPage, targetDate);
        } catch (IOException e) {
            return stop("Failed to fetch page " + nextPage + ": " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return stop("Interrupted before page " + nextPage);
        }
        fetched++;
        metrics.count("floorsheet.pages.fetched", 1);

        if (nextPage == 1) {
            tradingDate = FloorsheetPageParser.tradingDate(html).orElse(targetDate.orElse(null));
            if (tradingDate == null) {
                return stop("First page carries no trading date");
            }
            int reported = FloorsheetPageParser.totalPages(html);
            totalPages = maxPages > 0 ? Math.min(reported, maxPages) : reported;
            log.info("Date: {}, total pages: {} (site reports {})", tradingDate, totalPages, reported);
        } else {
            log.info("Fetched page {}/{}", nextPage, totalPages);
        }

        Record<FloorsheetPage> r = new Record<>(nextPage - 1, 0, new FloorsheetPage(nextPage, tradingDate, html));
        nextPage++;
        if (nextPage > totalPages) finished = true;
        return Optional.of(r);
    }

    private Optional<Record<FloorsheetPage>> stop(String reason) {
        log.warn("{}; keeping the {} pages already fetched", reason, fetched);
        metrics.count("floorsheet.pages.failed", 1);
        finished = true;
        complete = false;
        return Optional.empty();
    }

    @Override
    public boolean isFinished() {
        return finished;
    }

    public LocalDate tradingDate() { return tradingDate; }
    public int pagesFetched() { return fetched; }
    public boolean complete() { return complete; }
}
