package io.ehsdesk.model;

/**
 * Persisted draft of a worker report and the state of its background transfer.
 * The row is written before the transfer starts, so the report text survives a failed upload.
 */
public record ReportSubmission(
        long id,
        long taskId,
        long workerId,
        String reportText,
        String mediaSource,
        ReportState state,
        String mediaPath,
        String error,
        long createdAtMs,
        long updatedAtMs
) {
}
