package io.floorsheet.data;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Exclusive lock on {@code <output>.lock}, held for one load-transform-persist cycle. Acquisition never
 * waits: a held lock fails the run with {@link StageLockedException}.
 */
public final class StageLock implements AutoCloseable {
    private final Path lockFile;
    private final FileChannel channel;
    private final FileLock lock;

    private StageLock(Path lockFile, FileChannel channel, FileLock lock) {
        this.lockFile = lockFile;
        this.channel = channel;
        this.lock = lock;
    }

    public static StageLock acquire(Path output) {
        Path lockFile = output.resolveSibling(output.getFileName() + ".lock");
        FileChannel channel = null;
        try {
            Path parent = lockFile.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            FileLock lock = channel.tryLock();
            if (lock == null) {
                channel.close();
                throw new StageLockedException(lockFile);
            }
            return new StageLock(lockFile, channel, lock);
        } catch (OverlappingFileLockException e) {
            closeQuietly(channel);
            throw new StageLockedException(lockFile);
        } catch (IOException e) {
            closeQuietly(channel);
            throw new TableStoreException(lockFile, "Could not lock output", e);
        }
    }

    public Path lockFile() { return lockFile; }

    boolean isOpen() { return channel.isOpen(); }

    /** Releases the lock. The channel is closed even when the release fails. */
    @Override
    public void close() {
        IOException failure = null;
        try {
            lock.release();
        } catch (IOException e) {
            failure = e;
        } finally {
            try {
                channel.close();
            } catch (IOException e) {
                if (failure == null) failure = e;
                else failure.addSuppressed(e);
            }
        }
        if (failure != null) {
            throw new TableStoreException(lockFile, "Could not release lock", failure);
        }
    }

    private static void closeQuietly(FileChannel channel) {
        if (channel == null) return;
        try {
            channel.close();
        } catch (IOException ignored) {
            // already failing with a more useful exception
        }
    }
}
