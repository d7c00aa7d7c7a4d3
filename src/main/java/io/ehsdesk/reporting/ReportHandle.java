package io.ehsdesk.reporting;

import io.ehsdesk.model.ReportOutcome;
import io.ehsdesk.model.ReportState;
import io.ehsdesk.model.ReportSubmission;
import io.ehsdesk.storage.ReportStore;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Returned by {@link ReportingExecutor#submit} as soon as the report draft is persisted. The
 * caller may block on {@link #await}, chain on {@link #completion()} or poll {@link #state()}.
 */
public final class ReportHandle {
    private final long submissionId;
    private final long taskId;
    private final ReportStore reportStore;
    private final CompletableFuture<ReportOutcome> completion;

    ReportHandle(long submissionId, long taskId, ReportStore reportStore) {
        this.submissionId = submissionId;
        this.taskId = taskId;
        this.reportStore = reportStore;
        this.completion = new CompletableFuture<>();
    }

    public long submissionId() {
        return submissionId;
    }

    public long taskId() {
        return taskId;
    }

    /** A read-only view of the outcome; it never completes exceptionally. */
    public CompletableFuture<ReportOutcome> completion() {
        return completion.copy();
    }

    public boolean isDone() {
        return completion.isDone();
    }

    /** Current persisted state, read from the store. */
    public ReportState state() {
        return reportStore.get(submissionId)
                .map(ReportSubmission::state)
                .orElse(ReportState.FAILED);
    }

    /** Waits up to {@code timeout}; empty if the job is still running or the wait was interrupted. */
    public Optional<ReportOutcome> await(Duration timeout) {
        try {
            return Optional.of(completion.get(Math.max(0L, timeout.toMillis()), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Report job " + submissionId + " completed exceptionally", e.getCause());
        }
    }

    void complete(ReportOutcome outcome) {
        completion.complete(outcome);
    }
}
