package io.floorsheet.data;

import java.time.LocalDate;
import java.util.List;

/**
 * What a fetch produced.
 *
 * @param tradingDate  date the source reported, null when not even the first page was read
 * @param skippedRows  rows that could not be parsed and were left out
 * @param complete     false when fetching stopped early; records holds what was read before that
 */
public record FetchResult(LocalDate tradingDate, List<TransactionRecord> records, int skippedRows, int pagesFetched, boolean complete) {

    public FetchResult {
        records = List.copyOf(records);
    }
}
