package io.floorsheet.error;

import io.floorsheet.core.Record;

/**
 * Receives records a stage gave up on, with the reason.
 */
public interface DeadLetterSink<T> extends AutoCloseable {
    void acceptFailure(String stage, Record<T> record, String reason);

    @Override default void close() {}

    static <T> DeadLetterSink<T> discarding() {
        return (stage, record, reason) -> { };
    }
}
