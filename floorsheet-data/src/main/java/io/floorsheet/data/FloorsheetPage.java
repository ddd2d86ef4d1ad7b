package io.floorsheet.data;

import java.time.LocalDate;

/** One fetched page of the floorsheet, stamped with the trading date read from page 1. */
public record FloorsheetPage(int number, LocalDate tradingDate, String html) {

    @Override
    public String toString() {
        return "page " + number + " of " + tradingDate;
    }
}
