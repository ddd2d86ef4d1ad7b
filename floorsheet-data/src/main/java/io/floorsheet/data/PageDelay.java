package io.floorsheet.data;

import java.util.concurrent.ThreadLocalRandom;

/** Pause taken before every page after the first. */
@FunctionalInterface
public interface PageDelay {
    void pause() throws InterruptedException;

    static PageDelay none() {
        return () -> { };
    }

    /** Sleeps a uniformly random time in [minMillis, maxMillis]. */
    static PageDelay randomMillis(long minMillis, long maxMillis) {
        long lo = Math.max(0, Math.min(minMillis, maxMillis));
        long hi = Math.max(lo, maxMillis);
        if (hi == 0) return none();
        return () -> Thread.sleep(ThreadLocalRandom.current().nextLong(lo, hi + 1));
    }
}
