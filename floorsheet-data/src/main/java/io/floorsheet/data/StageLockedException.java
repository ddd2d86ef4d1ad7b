package io.floorsheet.data;

import java.nio.file.Path;

/** Another writer holds the lock on an output table. */
public class StageLockedException extends RuntimeException {
    public StageLockedException(Path lockFile) {
        super("Output is locked by another run: " + lockFile);
    }
}
