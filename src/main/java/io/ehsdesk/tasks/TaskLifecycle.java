package io.ehsdesk.tasks;

import io.ehsdesk.config.DeskSettings;
import io.ehsdesk.error.AuthorizationException;
import io.ehsdesk.error.NotFoundException;
import io.ehsdesk.error.ValidationException;
import io.ehsdesk.model.Actor;
import io.ehsdesk.model.Role;
import io.ehsdesk.model.TaskRecord;
import io.ehsdesk.model.TaskStatus;
import io.ehsdesk.model.TaskView;
import io.ehsdesk.storage.StoreWriteLock;
import io.ehsdesk.storage.TaskStore;
import io.ehsdesk.storage.UserStore;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Task state machine: assignment, violation annotation, completion and removal.
 *
 * <p>No transition table is enforced. A violation can overwrite a completed task and a
 * completion can overwrite a violation, unless {@link DeskSettings#blockViolationAfterCompletion()}
 * is set. Every mutation is a single statement under the store write lock; reads are lock-free
 * snapshots and may interleave with an in-flight commit.
 */
public final class TaskLifecycle {
    private final TaskStore taskStore;
    private final UserStore userStore;
    private final StoreWriteLock writeLock;
    private final DeskSettings settings;
    private final Clock clock;

    public TaskLifecycle(TaskStore taskStore, UserStore userStore, StoreWriteLock writeLock,
                         DeskSettings settings, Clock clock) {
        this.taskStore = taskStore;
        this.userStore = userStore;
        this.writeLock = writeLock;
        this.settings = settings;
        this.clock = clock;
    }

    public long assign(long workerId, String description) {
        if (description == null || description.isBlank()) {
            throw new ValidationException("Task description cannot be empty");
        }
        Actor worker = userStore.get(workerId)
                .filter(user -> user.role() == Role.WORKER)
                .orElseThrow(() -> new NotFoundException("Worker not found: " + workerId));
        return taskStore.insert(worker.id(), worker.username(), description.trim());
    }

    public TaskRecord reportViolation(long taskId, String newStatus, String comment) {
        String status = validateViolationStatus(newStatus);
        return writeLock.guard(() -> {
            TaskRecord current = taskStore.get(taskId)
                    .orElseThrow(() -> new NotFoundException("Task not found: " + taskId));
            if (settings.blockViolationAfterCompletion() && current.isCompleted()) {
                throw new ValidationException("Task " + taskId + " is already completed");
            }
            String timestamp = clock.instant().toString();
            String safeComment = comment == null ? "" : comment.trim();
            if (!taskStore.updateViolation(taskId, status, safeComment, timestamp)) {
                throw new NotFoundException("Task not found: " + taskId);
            }
            return new TaskRecord(current.id(), current.workerId(), current.workerUsername(),
                    current.description(), status, safeComment, timestamp,
                    current.workerReport(), current.workerMediaPath());
        });
    }

    /**
     * Marks a task completed with the worker's report. Only the reporting executor calls this,
     * after the media transfer has finished.
     */
    public void complete(long taskId, long workerId, String reportText, String mediaPath) {
        writeLock.guard(() -> {
            if (taskStore.updateCompletion(taskId, workerId, reportText, mediaPath)) {
                return;
            }
            if (taskStore.get(taskId).isEmpty()) {
                throw new NotFoundException("Task not found: " + taskId);
            }
            throw new AuthorizationException("Task " + taskId + " is not assigned to worker " + workerId);
        });
    }

    public void delete(long taskId) {
        if (!taskStore.delete(taskId)) {
            throw new NotFoundException("Task not found: " + taskId);
        }
    }

    public Optional<TaskRecord> get(long taskId) {
        return taskStore.get(taskId);
    }

    public List<TaskRecord> listAll() {
        return taskStore.listAll();
    }

    public List<TaskView> listForWorker(long workerId) {
        return taskStore.listByWorker(workerId).stream()
                .map(TaskRecord::toWorkerView)
                .toList();
    }

    /** Tasks the worker may still report on: assigned to them and not completed. */
    public List<TaskView> listReportable(long workerId) {
        return taskStore.listOpenByWorker(workerId).stream()
                .map(TaskRecord::toWorkerView)
                .toList();
    }

    public List<TaskRecord> listByStatus(String status) {
        if (status == null || status.isBlank()) {
            throw new ValidationException("Status filter cannot be empty");
        }
        return taskStore.listByStatus(TaskStatus.known(status).map(TaskStatus::value).orElse(status.trim()));
    }

    String validateViolationStatus(String raw) {
        String status = raw == null ? "" : raw.trim();
        if (status.isEmpty() || isNumeric(status)) {
            throw new ValidationException("Task status must be a non-numeric string");
        }
        Optional<TaskStatus> known = TaskStatus.known(status);
        if (known.isPresent()) {
            if (!settings.allowCustomViolationStatus() && known.get() == TaskStatus.COMPLETED) {
                throw new ValidationException("Status 'completed' is set by a worker report only");
            }
            return known.get().value();
        }
        if (!settings.allowCustomViolationStatus()) {
            throw new ValidationException("Unknown task status: " + status
                    + ", expected one of pending, violation, incomplete");
        }
        return status;
    }

    static boolean isNumeric(String value) {
        return !value.isEmpty() && value.chars().allMatch(Character::isDigit);
    }
}
