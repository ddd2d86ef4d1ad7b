package io.floorsheet.data;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeSet;

/**
 * Replaces every stored row of a recomputed date with that date's new rows. Dates not recomputed are
 * left as they are. Surviving stored rows keep their order and recomputed dates follow in ascending
 * order, so recomputing the same dates from the same input yields the same table.
 */
public final class DateKeyedUpsertMerge {
    private DateKeyedUpsertMerge() {}

    public static Upserted merge(List<DateSummary> stored, SortedMap<LocalDate, List<DateSummary>> recomputed) {
        List<DateSummary> rows = new ArrayList<>(stored.size());
        TreeSet<LocalDate> replacedDates = new TreeSet<>();
        int dropped = 0;
        for (DateSummary row : stored) {
            if (row.date() != null && recomputed.containsKey(row.date())) {
                replacedDates.add(row.date());
                dropped++;
            } else {
                rows.add(row);
            }
        }
        for (List<DateSummary> fresh : recomputed.values()) {
            rows.addAll(fresh);
        }
        TreeSet<LocalDate> addedDates = new TreeSet<>(recomputed.keySet());
        addedDates.removeAll(replacedDates);
        return new Upserted(List.copyOf(rows), List.copyOf(replacedDates), List.copyOf(addedDates), dropped);
    }

    /**
     * @param replacedDates recomputed dates that were already stored
     * @param addedDates    recomputed dates seen for the first time
     * @param droppedRows   stored rows removed because their date was recomputed
     */
    public record Upserted(List<DateSummary> rows, List<LocalDate> replacedDates, List<LocalDate> addedDates, int droppedRows) {}
}
