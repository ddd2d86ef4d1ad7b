package io.floorsheet.core;

import java.util.List;

/** Sink that takes the whole drained batch at once, for whole-table writers. */
public interface BatchSink<T> extends Sink<T> {
    void acceptBatch(List<Record<T>> records) throws Exception;
}
