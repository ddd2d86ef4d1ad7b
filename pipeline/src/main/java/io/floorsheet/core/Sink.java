package io.floorsheet.core;

import java.io.Closeable;

/**
 * Consumes records in seq/subSeq order.
 */
public interface Sink<T> extends Closeable {
    void accept(Record<T> record) throws Exception;

    @Override
    default void close() {}
}
