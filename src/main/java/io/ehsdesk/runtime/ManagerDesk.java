package io.ehsdesk.runtime;

import io.ehsdesk.error.NotFoundException;
import io.ehsdesk.model.Actor;
import io.ehsdesk.model.ReportSubmission;
import io.ehsdesk.model.RuleFeedback;
import io.ehsdesk.model.RuleView;
import io.ehsdesk.model.TaskRecord;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** What a signed-in manager can do. Every mutation is written to the audit log with the manager as actor. */
public final class ManagerDesk implements Desk {
    private final EhsDeskRuntime runtime;
    private final Actor actor;

    ManagerDesk(EhsDeskRuntime runtime, Actor actor) {
        this.runtime = runtime;
        this.actor = actor;
    }

    @Override
    public Actor actor() {
        return actor;
    }

    public long assignTask(long workerId, String description) {
        return runtime.audited(actor, "task.assign", "worker/" + workerId,
                Map.of("worker_id", workerId),
                () -> runtime.lifecycle().assign(workerId, description));
    }

    public TaskRecord reportViolation(long taskId, String status, String comment) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("status", status == null ? "" : status);
        details.put("comment", comment == null ? "" : comment);
        return runtime.audited(actor, "task.violation", "task/" + taskId, details,
                () -> runtime.lifecycle().reportViolation(taskId, status, comment));
    }

    public void deleteTask(long taskId) {
        runtime.auditedRun(actor, "task.delete", "task/" + taskId, Map.of(),
                () -> runtime.lifecycle().delete(taskId));
    }

    public TaskRecord task(long taskId) {
        return runtime.lifecycle().get(taskId)
                .orElseThrow(() -> new NotFoundException("Task not found: " + taskId));
    }

    public List<TaskRecord> listTasks() {
        return runtime.lifecycle().listAll();
    }

    public List<TaskRecord> listTasksByStatus(String status) {
        return runtime.lifecycle().listByStatus(status);
    }

    public List<Actor> listWorkers() {
        return runtime.listWorkers();
    }

    public List<ReportSubmission> reportSubmissions(long taskId) {
        return runtime.reportingExecutor().submissions(taskId);
    }

    public ReportSubmission reportSubmission(long submissionId) {
        return runtime.reportingExecutor().status(submissionId)
                .orElseThrow(() -> new NotFoundException("Report submission not found: " + submissionId));
    }

    public long addRule(String text) {
        return runtime.audited(actor, "rule.add", "rules", Map.of(),
                () -> runtime.ledger().addRule(text));
    }

    public void deleteRule(long ruleId) {
        runtime.auditedRun(actor, "rule.delete", "rule/" + ruleId, Map.of(),
                () -> runtime.ledger().deleteRule(ruleId));
    }

    @Override
    public List<RuleView> listRules() {
        return runtime.ledger().listRules();
    }

    @Override
    public List<RuleFeedback> listFeedback() {
        return runtime.ledger().listFeedback();
    }
}
