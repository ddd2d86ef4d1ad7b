package io.floorsheet.data;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Drops rows dated strictly before a cutoff. Rows without a date are kept.
 */
public final class RetentionFilter {
    private RetentionFilter() {}

    /** The earliest date still retained: today on the given clock minus retentionDays. */
    public static LocalDate cutoff(Clock clock, int retentionDays) {
        if (retentionDays < 0) throw new IllegalArgumentException("retentionDays must be >= 0: " + retentionDays);
        return LocalDate.now(clock).minusDays(retentionDays);
    }

    public static <T extends Dated> Retained<T> apply(List<T> rows, LocalDate cutoff) {
        List<T> kept = new ArrayList<>(rows.size());
        for (T row : rows) {
            LocalDate d = row.date();
            if (d == null || !d.isBefore(cutoff)) kept.add(row);
        }
        return new Retained<>(List.copyOf(kept), rows.size() - kept.size());
    }

    public record Retained<T>(List<T> rows, int removed) {}
}
