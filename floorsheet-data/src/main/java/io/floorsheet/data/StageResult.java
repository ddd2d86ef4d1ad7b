package io.floorsheet.data;

/**
 * Outcome of one stage run.
 *
 * @param rows rows in the table the stage left on disk (0 when it failed)
 */
public record StageResult(String stage, Status status, int rows, String message) {

    public enum Status {
        /** The output table was replaced. */
        WRITTEN,
        /** Nothing new to write; the existing output, if any, is still valid. */
        NO_OP,
        FAILED
    }

    static StageResult written(String stage, int rows, String message) {
        return new StageResult(stage, Status.WRITTEN, rows, message);
    }

    static StageResult noOp(String stage, int rows, String message) {
        return new StageResult(stage, Status.NO_OP, rows, message);
    }

    static StageResult failed(String stage, String message) {
        return new StageResult(stage, Status.FAILED, 0, message);
    }

    public boolean succeeded() { return status != Status.FAILED; }
}
