package io.ehsdesk.model;

/** Worker-facing projection of a task. */
public record TaskView(
        long id,
        String workerUsername,
        String description,
        String status,
        String violationComment,
        String violationTimestamp,
        String workerReport,
        String workerMediaPath
) {
}
