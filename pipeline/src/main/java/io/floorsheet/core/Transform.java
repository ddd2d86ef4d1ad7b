package io.floorsheet.core;

import java.util.List;

/**
 * Converts one input record into zero or more output records.
 * Outputs keep the input's seq and number their subSeq from 0.
 */
@FunctionalInterface
public interface Transform<I, O> {
    List<Record<O>> apply(Record<I> input) throws Exception;
}
