package io.floorsheet.data;

/**
 * A parsed floorsheet row, or the reason the row was skipped.
 *
 * @param row 1-based position of the row among the table's data rows
 */
public record RowParseResult(int row, TransactionRecord record, String reason) {

    static RowParseResult parsed(int row, TransactionRecord record) {
        return new RowParseResult(row, record, null);
    }

    static RowParseResult skipped(int row, String reason) {
        return new RowParseResult(row, null, reason);
    }

    public boolean ok() { return record != null; }
}
