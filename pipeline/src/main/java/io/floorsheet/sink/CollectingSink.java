package io.floorsheet.sink;

import io.floorsheet.core.BatchSink;
import io.floorsheet.core.Record;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps the payloads it receives, in arrival order, for callers that want the batch in memory.
 */
public class CollectingSink<T> implements BatchSink<T> {
    private final List<T> items = new ArrayList<>();

    @Override
    public void accept(Record<T> record) {
        items.add(record.payload());
    }

    @Override
    public void acceptBatch(List<Record<T>> records) {
        for (Record<T> r : records) {
            accept(r);
        }
    }

    public List<T> items() { return List.copyOf(items); }
}
