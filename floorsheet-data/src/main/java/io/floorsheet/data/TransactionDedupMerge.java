package io.floorsheet.data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges a freshly fetched batch into the stored raw table by (date, transaction_no).
 * Stored rows whose key is not in the batch are kept in their stored order; the batch follows in full,
 * so on a key collision the fetched row replaces the stored one.
 */
public final class TransactionDedupMerge {
    private TransactionDedupMerge() {}

    public static Merged merge(List<TransactionRecord> existing, List<TransactionRecord> incoming) {
        Map<TransactionRecord.Key, TransactionRecord> batch = new LinkedHashMap<>();
        for (TransactionRecord r : incoming) {
            batch.put(r.key(), r); // last occurrence within the batch wins
        }

        List<TransactionRecord> rows = new ArrayList<>(existing.size() + batch.size());
        int replaced = 0;
        int unchanged = 0;
        for (TransactionRecord old : existing) {
            TransactionRecord fresh = batch.get(old.key());
            if (fresh == null) {
                rows.add(old);
            } else if (fresh.equals(old)) {
                unchanged++;
            } else {
                replaced++;
            }
        }
        rows.addAll(batch.values());
        int added = batch.size() - replaced - unchanged;
        return new Merged(List.copyOf(rows), added, replaced, unchanged);
    }

    /**
     * @param added     batch rows whose key was not stored before
     * @param replaced  stored rows superseded by a different batch row
     * @param unchanged batch rows identical to the stored row with the same key
     */
    public record Merged(List<TransactionRecord> rows, int added, int replaced, int unchanged) {
        public int duplicates() { return replaced + unchanged; }

        public boolean changesStoredRows() { return added > 0 || replaced > 0; }
    }
}
