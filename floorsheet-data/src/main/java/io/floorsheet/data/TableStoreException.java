package io.floorsheet.data;

import java.io.IOException;
import java.nio.file.Path;

/** A table could not be written (or read, where reading is required to succeed). */
public class TableStoreException extends RuntimeException {
    private final Path path;

    public TableStoreException(Path path, String message, IOException cause) {
        super(message + ": " + path + (cause == null ? "" : " (" + cause.getMessage() + ")"), cause);
        this.path = path;
    }

    public Path path() { return path; }
}
