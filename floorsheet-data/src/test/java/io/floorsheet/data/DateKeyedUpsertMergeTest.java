package io.floorsheet.data;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

import static io.floorsheet.data.Fixtures.day;
import static org.junit.jupiter.api.Assertions.*;

class DateKeyedUpsertMergeTest {

    @Test
    void recomputedDateIsReplacedAndOthersUntouched() {
        DateSummary d1 = day("2024-01-01", "B1", "X", 10, 100, 0, 0);
        DateSummary d2a = day("2024-01-02", "B1", "X", 10, 100, 0, 0);
        DateSummary d2b = day("2024-01-02", "B2", "X", 0, 0, 10, 100);
        DateSummary d2New = day("2024-01-02", "B3", "Y", 5, 60, 0, 0);

        SortedMap<LocalDate, List<DateSummary>> recomputed = new TreeMap<>();
        recomputed.put(LocalDate.of(2024, 1, 2), List.of(d2New));
        DateKeyedUpsertMerge.Upserted u = DateKeyedUpsertMerge.merge(List.of(d1, d2a, d2b), recomputed);

        assertEquals(List.of(d1, d2New), u.rows());
        assertEquals(List.of(LocalDate.of(2024, 1, 2)), u.replacedDates());
        assertTrue(u.addedDates().isEmpty());
        assertEquals(2, u.droppedRows());
    }

    @Test
    void newDatesAreAppendedInDateOrder() {
        DateSummary d1 = day("2024-01-01", "B1", "X", 10, 100, 0, 0);
        DateSummary d3 = day("2024-01-03", "B1", "X", 1, 10, 0, 0);
        DateSummary d2 = day("2024-01-02", "B1", "X", 2, 20, 0, 0);

        SortedMap<LocalDate, List<DateSummary>> recomputed = new TreeMap<>();
        recomputed.put(d3.date(), List.of(d3));
        recomputed.put(d2.date(), List.of(d2));
        DateKeyedUpsertMerge.Upserted u = DateKeyedUpsertMerge.merge(List.of(d1), recomputed);

        assertEquals(List.of(d1, d2, d3), u.rows());
        assertEquals(List.of(d2.date(), d3.date()), u.addedDates());
    }

    @Test
    void upsertingTwiceGivesTheSameTable() {
        DateSummary d1 = day("2024-01-01", "B1", "X", 10, 100, 0, 0);
        SortedMap<LocalDate, List<DateSummary>> recomputed = new TreeMap<>();
        recomputed.put(d1.date(), List.of(d1));

        List<DateSummary> once = DateKeyedUpsertMerge.merge(List.of(), recomputed).rows();
        List<DateSummary> twice = DateKeyedUpsertMerge.merge(once, recomputed).rows();

        assertEquals(once, twice);
    }
}
