package io.floorsheet.data;

import java.io.IOException;
import java.time.LocalDate;
import java.util.Optional;

/** Fetches one page of the floorsheet as HTML. */
@FunctionalInterface
public interface FloorsheetClient {
    String fetchPage(int page, Optional<LocalDate> date) throws IOException, InterruptedException;
}
