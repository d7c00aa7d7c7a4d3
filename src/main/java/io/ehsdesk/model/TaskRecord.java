package io.ehsdesk.model;

/** Full task row, including the manager-only numeric worker id. */
public record TaskRecord(
        long id,
        long workerId,
        String workerUsername,
        String description,
        String status,
        String violationComment,
        String violationTimestamp,
        String workerReport,
        String workerMediaPath
) {
    public boolean isCompleted() {
        return TaskStatus.COMPLETED.matches(status);
    }

    public TaskView toWorkerView() {
        return new TaskView(id, workerUsername, description, status, violationComment,
                violationTimestamp, workerReport, workerMediaPath);
    }
}
