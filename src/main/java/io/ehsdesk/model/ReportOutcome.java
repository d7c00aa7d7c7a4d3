package io.ehsdesk.model;

public record ReportOutcome(
        long submissionId,
        long taskId,
        ReportState state,
        String mediaPath,
        String error
) {
    public boolean success() {
        return state == ReportState.COMMITTED;
    }

    public static ReportOutcome committed(long submissionId, long taskId, String mediaPath) {
        return new ReportOutcome(submissionId, taskId, ReportState.COMMITTED, mediaPath, null);
    }

    public static ReportOutcome failed(long submissionId, long taskId, String error) {
        return new ReportOutcome(submissionId, taskId, ReportState.FAILED, null, error);
    }
}
