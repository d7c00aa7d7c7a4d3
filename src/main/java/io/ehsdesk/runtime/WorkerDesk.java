package io.ehsdesk.runtime;

import io.ehsdesk.error.AuthorizationException;
import io.ehsdesk.error.NotFoundException;
import io.ehsdesk.model.Actor;
import io.ehsdesk.model.ReportSubmission;
import io.ehsdesk.model.RuleFeedback;
import io.ehsdesk.model.RuleView;
import io.ehsdesk.model.TaskView;
import io.ehsdesk.reporting.ReportHandle;

import java.util.List;
import java.util.Map;

/** What a signed-in worker can do. Task reads are limited to the worker's own assignments. */
public final class WorkerDesk implements Desk {
    private final EhsDeskRuntime runtime;
    private final Actor actor;

    WorkerDesk(EhsDeskRuntime runtime, Actor actor) {
        this.runtime = runtime;
        this.actor = actor;
    }

    @Override
    public Actor actor() {
        return actor;
    }

    public List<TaskView> listTasks() {
        return runtime.lifecycle().listForWorker(actor.id());
    }

    public List<TaskView> listReportableTasks() {
        return runtime.lifecycle().listReportable(actor.id());
    }

    /**
     * Queues a report with media for one of the worker's open tasks. Returns once the draft is
     * stored; the task turns {@code completed} when the handle's outcome is committed.
     */
    public ReportHandle submitReport(long taskId, String reportText, String mediaPath) {
        return runtime.auditRejection(actor, "report.submit", "task/" + taskId, Map.of(),
                () -> runtime.reportingExecutor().submit(taskId, actor.id(), reportText, mediaPath));
    }

    public ReportHandle retryReport(long submissionId) {
        return runtime.auditRejection(actor, "report.retry", "report/" + submissionId, Map.of(),
                () -> runtime.reportingExecutor().retry(submissionId, actor.id()));
    }

    public ReportSubmission reportStatus(long submissionId) {
        ReportSubmission submission = runtime.reportingExecutor().status(submissionId)
                .orElseThrow(() -> new NotFoundException("Report submission not found: " + submissionId));
        if (submission.workerId() != actor.id()) {
            throw new AuthorizationException("Report submission " + submissionId + " belongs to another worker");
        }
        return submission;
    }

    @Override
    public List<RuleView> listRules() {
        return runtime.ledger().listRules();
    }

    @Override
    public List<RuleFeedback> listFeedback() {
        return runtime.ledger().listFeedback();
    }

    public void giveFeedback(long ruleId, String feedback) {
        runtime.auditedRun(actor, "rule.feedback", "rule/" + ruleId,
                Map.of("feedback", feedback == null ? "" : feedback),
                () -> runtime.ledger().giveFeedback(ruleId, feedback));
    }
}
