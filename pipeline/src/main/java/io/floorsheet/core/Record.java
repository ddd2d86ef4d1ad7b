package io.floorsheet.core;

/**
 * Carries a payload together with its position in the source: seq orders records across the source,
 * subSeq orders the outputs a transform fans out from one input.
 */
public record Record<T>(long seq, int subSeq, T payload) implements Comparable<Record<?>> {

    @Override
    public int compareTo(Record<?> o) {
        int c = Long.compare(seq, o.seq);
        if (c != 0) return c;
        return Integer.compare(subSeq, o.subSeq);
    }
}
