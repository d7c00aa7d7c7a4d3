package io.ehsdesk.reporting;

import io.ehsdesk.error.TransferException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.UUID;

/**
 * Chunked copy into a sibling temp file followed by a move into place. The deadline and the
 * interrupt flag are checked between chunks, so a stuck or cancelled upload stops promptly.
 *
 * <p>{@code latencyMs} adds a fixed delay before the copy, standing in for a slow uplink.
 */
public final class StreamingMediaTransfer implements MediaTransfer {
    private static final Logger log = LoggerFactory.getLogger(StreamingMediaTransfer.class);
    private static final long LATENCY_SLICE_MS = 50L;

    private final int chunkBytes;
    private final long latencyMs;

    public StreamingMediaTransfer(int chunkBytes, long latencyMs) {
        this.chunkBytes = Math.max(512, chunkBytes);
        this.latencyMs = Math.max(0L, latencyMs);
    }

    @Override
    public void transfer(Path source, Path target, Duration timeout) {
        long deadlineNs = System.nanoTime() + timeout.toNanos();
        if (!Files.isRegularFile(source) || !Files.isReadable(source)) {
            throw new TransferException("Media file not readable: " + source);
        }
        Path parent = target.toAbsolutePath().getParent();
        Path tmp = target.resolveSibling(target.getFileName() + ".part-" + UUID.randomUUID());
        try {
            if (parent != null) {
                Files.createDirectories(parent);
            }
            simulateLatency(deadlineNs, timeout);
            byte[] buffer = new byte[chunkBytes];
            try (InputStream in = Files.newInputStream(source);
                 OutputStream out = Files.newOutputStream(tmp, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                int read;
                while ((read = in.read(buffer)) >= 0) {
                    checkProgress(deadlineNs, timeout);
                    out.write(buffer, 0, read);
                }
            }
            checkProgress(deadlineNs, timeout);
            moveIntoPlace(tmp, target);
        } catch (IOException e) {
            throw new TransferException("Failed to save media " + source + " -> " + target + ": " + e.getMessage(), e);
        } finally {
            deleteQuietly(tmp);
        }
    }

    private void simulateLatency(long deadlineNs, Duration timeout) {
        long remainingMs = latencyMs;
        while (remainingMs > 0L) {
            checkProgress(deadlineNs, timeout);
            long slice = Math.min(LATENCY_SLICE_MS, remainingMs);
            try {
                Thread.sleep(slice);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransferException("Media transfer interrupted", e);
            }
            remainingMs -= slice;
        }
    }

    private void checkProgress(long deadlineNs, Duration timeout) {
        if (Thread.currentThread().isInterrupted()) {
            throw new TransferException("Media transfer interrupted");
        }
        if (System.nanoTime() - deadlineNs > 0L) {
            throw new TransferException("Media transfer timed out after " + timeout.toMillis() + " ms");
        }
    }

    private void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ignored) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path tmp) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.debug("Could not remove partial upload {}: {}", tmp, e.getMessage());
        }
    }
}
