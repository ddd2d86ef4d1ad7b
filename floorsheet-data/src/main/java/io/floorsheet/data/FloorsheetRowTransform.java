package io.floorsheet.data;

import io.floorsheet.core.Record;
import io.floorsheet.core.Transform;
import io.floorsheet.error.DeadLetterSink;
import io.floorsheet.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a floorsheet page into transaction records. Rows that do not parse are left out and reported to
 * the dead-letter sink; they never fail the page.
 */
public class FloorsheetRowTransform implements Transform<FloorsheetPage, TransactionRecord> {
    private static final Logger log = LoggerFactory.getLogger(FloorsheetRowTransform.class);

    private final DeadLetterSink<FloorsheetPage> deadLetters;
    private final Metrics metrics;
    private int skipped;

    public FloorsheetRowTransform(DeadLetterSink<FloorsheetPage> deadLetters, Metrics metrics) {
        this.deadLetters = deadLetters;
        this.metrics = metrics;
    }

    @Override
    public List<Record<TransactionRecord>> apply(Record<FloorsheetPage> input) {
        FloorsheetPage page = input.payload();
        List<RowParseResult> parsed = FloorsheetPageParser.rows(page.html(), page.tradingDate());
        List<Record<TransactionRecord>> out = new ArrayList<>(parsed.size());
        int sub = 0;
        for (RowParseResult r : parsed) {
            if (r.ok()) {
                out.add(new Record<>(input.seq(), sub++, r.record()));
            } else {
                skipped++;
                metrics.count("floorsheet.rows.skipped", 1);
                log.debug("Skipping row {} of page {}: {}", r.row(), page.number(), r.reason());
                deadLetters.acceptFailure("parse", input, "row " + r.row() + ": " + r.reason());
            }
        }
        log.info("Processed page {}, extracted {} transactions", page.number(), out.size());
        return out;
    }

    public int skipped() { return skipped; }
}
