package io.floorsheet.data;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Supplies the transactions of one trading date.
 */
@FunctionalInterface
public interface TransactionSource {
    /**
     * @param date trading date to fetch; empty for the most recent trading date
     */
    FetchResult fetch(Optional<LocalDate> date);
}
