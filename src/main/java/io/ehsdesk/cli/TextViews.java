package io.ehsdesk.cli;

import io.ehsdesk.model.Actor;
import io.ehsdesk.model.ReportOutcome;
import io.ehsdesk.model.ReportSubmission;
import io.ehsdesk.model.RuleFeedback;
import io.ehsdesk.model.RuleView;
import io.ehsdesk.model.TaskRecord;
import io.ehsdesk.model.TaskView;

import java.util.List;
import java.util.function.Function;

final class TextViews {
    private TextViews() {
    }

    static String managerTasks(List<TaskRecord> tasks) {
        return lines("No tasks found.", tasks, task -> "Task ID: " + task.id()
                + " | Assigned To: " + task.workerUsername() + " (" + task.workerId() + ")"
                + " | Status: " + task.status()
                + "\n  Description: " + task.description()
                + violation(task.violationComment(), task.violationTimestamp())
                + report(task.workerReport(), task.workerMediaPath()));
    }

    static String workerTasks(List<TaskView> tasks) {
        return lines("No tasks assigned.", tasks, task -> "Task ID: " + task.id()
                + " | Description: " + task.description()
                + " | Status: " + task.status()
                + violation(task.violationComment(), task.violationTimestamp())
                + report(task.workerReport(), task.workerMediaPath()));
    }

    static String workers(List<Actor> workers) {
        return lines("No workers registered.", workers,
                worker -> "ID: " + worker.id() + " | Username: " + worker.username());
    }

    static String rules(List<RuleView> rules) {
        return lines("No rules found.", rules, rule -> "Rule ID: " + rule.id()
                + " | " + rule.text()
                + (rule.timestamp() == null || rule.timestamp().isEmpty() ? "" : " (" + rule.timestamp() + ")"));
    }

    static String feedback(List<RuleFeedback> feedback) {
        return lines("No rules found.", feedback, item -> "Rule ID: " + item.ruleId()
                + "\n  Rule: " + item.ruleText()
                + "\n  Feedback: " + (item.hasFeedback() ? item.feedback() : "No feedback yet."));
    }

    static String submission(ReportSubmission submission) {
        StringBuilder sb = new StringBuilder()
                .append("Report ").append(submission.id())
                .append(" for task ").append(submission.taskId())
                .append(": ").append(submission.state().dbValue());
        if (submission.mediaPath() != null && !submission.mediaPath().isEmpty()) {
            sb.append(" | Media: ").append(submission.mediaPath());
        }
        if (submission.error() != null && !submission.error().isEmpty()) {
            sb.append(" | Error: ").append(submission.error());
        }
        return sb.toString();
    }

    static String submissions(List<ReportSubmission> submissions) {
        return lines("No reports submitted.", submissions, TextViews::submission);
    }

    static String outcome(ReportOutcome outcome) {
        if (outcome.success()) {
            return "Task " + outcome.taskId() + " report submitted successfully. Media stored at " + outcome.mediaPath();
        }
        return "Report " + outcome.submissionId() + " for task " + outcome.taskId() + " failed: " + outcome.error()
                + " (retry with report-retry " + outcome.submissionId() + ")";
    }

    private static String violation(String comment, String timestamp) {
        if (comment == null || comment.isEmpty()) {
            return "";
        }
        return "\n  Violation: " + comment + (timestamp == null || timestamp.isEmpty() ? "" : " at " + timestamp);
    }

    private static String report(String text, String mediaPath) {
        if ((text == null || text.isEmpty()) && (mediaPath == null || mediaPath.isEmpty())) {
            return "";
        }
        return "\n  Report: " + (text == null ? "" : text)
                + (mediaPath == null || mediaPath.isEmpty() ? "" : " | Media: " + mediaPath);
    }

    private static <T> String lines(String empty, List<T> items, Function<T, String> render) {
        if (items.isEmpty()) {
            return empty;
        }
        StringBuilder sb = new StringBuilder();
        for (T item : items) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(render.apply(item));
        }
        return sb.toString();
    }
}
