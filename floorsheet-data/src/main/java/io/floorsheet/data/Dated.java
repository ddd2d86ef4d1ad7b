package io.floorsheet.data;

import java.time.LocalDate;

/** A row partitioned by trading date. A null date means the row carries no date column. */
public interface Dated {
    LocalDate date();
}
