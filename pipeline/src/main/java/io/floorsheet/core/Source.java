package io.floorsheet.core;

import java.io.Closeable;
import java.util.Optional;

/**
 * A finite producer of records, drained one poll at a time.
 */
public interface Source<T> extends Closeable {
    /**
     * Next record, or empty when nothing is available. Once {@link #isFinished()} is true every poll
     * returns empty.
     */
    Optional<Record<T>> poll();

    /**
     * Whether the source has reached a terminal state, either exhausted or stopped after a failure.
     */
    boolean isFinished();

    @Override
    default void close() {}
}
