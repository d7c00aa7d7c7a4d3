package io.ehsdesk.config;

import io.ehsdesk.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Runtime tunables read from {@code ehsdesk-settings.json} in the data root.
 *
 * <p>Every field is optional in the file; missing or out-of-range values fall back to
 * {@link #defaults()}.
 */
public record DeskSettings(
        long transferTimeoutMs,
        long transferLatencyMs,
        int transferChunkBytes,
        int reportWorkers,
        int reportQueueCapacity,
        long shutdownGraceMs,
        boolean allowCustomViolationStatus,
        boolean blockViolationAfterCompletion
) {
    public static final long DEFAULT_TRANSFER_TIMEOUT_MS = 10L * 60L * 1000L;
    public static final int DEFAULT_TRANSFER_CHUNK_BYTES = 64 * 1024;
    public static final int DEFAULT_REPORT_WORKERS = 4;
    public static final int DEFAULT_REPORT_QUEUE_CAPACITY = 100;
    public static final long DEFAULT_SHUTDOWN_GRACE_MS = 5_000L;

    public static DeskSettings defaults() {
        return new DeskSettings(
                DEFAULT_TRANSFER_TIMEOUT_MS,
                0L,
                DEFAULT_TRANSFER_CHUNK_BYTES,
                DEFAULT_REPORT_WORKERS,
                DEFAULT_REPORT_QUEUE_CAPACITY,
                DEFAULT_SHUTDOWN_GRACE_MS,
                true,
                false
        );
    }

    public static DeskSettings load(Path file) {
        DeskSettings defaults = defaults();
        if (file == null || !Files.exists(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read settings file: " + file, e);
        }
    }

    static DeskSettings fromFile(SettingsFile file, DeskSettings defaults) {
        if (file == null) {
            return defaults;
        }
        return new DeskSettings(
                sanitizeLong(file.transferTimeoutMs(), defaults.transferTimeoutMs(), 100L),
                sanitizeLong(file.transferLatencyMs(), defaults.transferLatencyMs(), 0L),
                sanitizeInt(file.transferChunkBytes(), defaults.transferChunkBytes(), 512),
                sanitizeInt(file.reportWorkers(), defaults.reportWorkers(), 1),
                sanitizeInt(file.reportQueueCapacity(), defaults.reportQueueCapacity(), 1),
                sanitizeLong(file.shutdownGraceMs(), defaults.shutdownGraceMs(), 0L),
                sanitizeBoolean(file.allowCustomViolationStatus(), defaults.allowCustomViolationStatus()),
                sanitizeBoolean(file.blockViolationAfterCompletion(), defaults.blockViolationAfterCompletion())
        );
    }

    public DeskSettings withTransferTimeoutMs(long value) {
        return new DeskSettings(value, transferLatencyMs, transferChunkBytes, reportWorkers,
                reportQueueCapacity, shutdownGraceMs, allowCustomViolationStatus, blockViolationAfterCompletion);
    }

    public DeskSettings withTransferLatencyMs(long value) {
        return new DeskSettings(transferTimeoutMs, value, transferChunkBytes, reportWorkers,
                reportQueueCapacity, shutdownGraceMs, allowCustomViolationStatus, blockViolationAfterCompletion);
    }

    public DeskSettings withViolationPolicy(boolean allowCustomStatus, boolean blockAfterCompletion) {
        return new DeskSettings(transferTimeoutMs, transferLatencyMs, transferChunkBytes, reportWorkers,
                reportQueueCapacity, shutdownGraceMs, allowCustomStatus, blockAfterCompletion);
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static boolean sanitizeBoolean(Boolean raw, boolean fallback) {
        if (raw == null) {
            return fallback;
        }
        return raw;
    }

    record SettingsFile(
            Long transferTimeoutMs,
            Long transferLatencyMs,
            Integer transferChunkBytes,
            Integer reportWorkers,
            Integer reportQueueCapacity,
            Long shutdownGraceMs,
            Boolean allowCustomViolationStatus,
            Boolean blockViolationAfterCompletion
    ) {
    }
}
