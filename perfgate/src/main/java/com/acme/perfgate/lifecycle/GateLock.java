package com.acme.perfgate.lifecycle;

import com.acme.perfgate.model.GateSetupException;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.logging.Logger;

/**
 * Non-blocking exclusive lock serializing benchmark runs on one host. The lock file is
 * left in place; only the OS-level lock is released.
 */
public final class GateLock implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(GateLock.class.getName());

    private final Path file;
    private final FileChannel channel;
    private final FileLock lock;

    private GateLock(Path file, FileChannel channel, FileLock lock) {
        this.file = file;
        this.channel = channel;
        this.lock = lock;
    }

    /**
     * @throws GateSetupException when another run holds the lock or the file cannot be opened
     */
    public static GateLock acquire(Path file) {
        FileChannel channel = null;
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            channel = FileChannel.open(file, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            FileLock lock = channel.tryLock();
            if (lock == null) {
                closeQuietly(channel);
                throw new GateSetupException("another benchmark run is active (lock: " + file + ")");
            }
            LOG.fine(() -> "Lock acquired file=" + file);
            return new GateLock(file, channel, lock);
        } catch (OverlappingFileLockException e) {
            closeQuietly(channel);
            throw new GateSetupException("another benchmark run is active in this JVM (lock: " + file + ")", e);
        } catch (IOException e) {
            closeQuietly(channel);
            throw new GateSetupException("failed to open lock file " + file + ": " + e.getMessage(), e);
        }
    }

    public Path file() {
        return file;
    }

    @Override
    public void close() throws IOException {
        try {
            if (lock.isValid()) {
                lock.release();
            }
        } finally {
            channel.close();
        }
    }

    private static void closeQuietly(FileChannel channel) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            LOG.fine("Lock channel close failed: " + e.getClass().getSimpleName());
        }
    }
}
