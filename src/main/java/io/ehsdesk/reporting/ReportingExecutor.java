package io.ehsdesk.reporting;

import io.ehsdesk.config.DeskSettings;
import io.ehsdesk.config.EhsDeskConfig;
import io.ehsdesk.error.AuthorizationException;
import io.ehsdesk.error.EhsDeskException;
import io.ehsdesk.error.InvalidSelectionException;
import io.ehsdesk.error.NotFoundException;
import io.ehsdesk.error.StoreException;
import io.ehsdesk.error.TransferException;
import io.ehsdesk.error.ValidationException;
import io.ehsdesk.model.ReportOutcome;
import io.ehsdesk.model.ReportState;
import io.ehsdesk.model.ReportSubmission;
import io.ehsdesk.model.TaskStatus;
import io.ehsdesk.model.TaskView;
import io.ehsdesk.observability.AuditLogger;
import io.ehsdesk.storage.ReportStore;
import io.ehsdesk.storage.StoreWriteLock;
import io.ehsdesk.tasks.TaskLifecycle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Applies worker reports to the store.
 *
 * <p>{@link #submit} validates the selection, persists the report as a draft and returns a
 * {@link ReportHandle} without waiting. The media transfer then runs on a bounded pool and, once
 * it has finished, the commit takes the store write lock only for the task update. A failed
 * transfer or commit leaves the task untouched and the draft in state {@code failed}, from where
 * {@link #retry} can pick it up again.
 */
public final class ReportingExecutor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ReportingExecutor.class);
    static final String INTERRUPTED_BY_RESTART = "Interrupted by restart";
    static final String SHUT_DOWN_BEFORE_TRANSFER = "Shut down before transfer started";

    private final TaskLifecycle lifecycle;
    private final ReportStore reportStore;
    private final StoreWriteLock writeLock;
    private final MediaTransfer mediaTransfer;
    private final EhsDeskConfig config;
    private final DeskSettings settings;
    private final AuditLogger auditLogger;
    private final Clock clock;
    private final ThreadPoolExecutor pool;
    private final ConcurrentMap<Long, ReportHandle> activeHandles;

    public ReportingExecutor(TaskLifecycle lifecycle, ReportStore reportStore, StoreWriteLock writeLock,
                             MediaTransfer mediaTransfer, EhsDeskConfig config, DeskSettings settings,
                             AuditLogger auditLogger, Clock clock) {
        this.lifecycle = lifecycle;
        this.reportStore = reportStore;
        this.writeLock = writeLock;
        this.mediaTransfer = mediaTransfer;
        this.config = config;
        this.settings = settings;
        this.auditLogger = auditLogger;
        this.clock = clock;
        this.activeHandles = new ConcurrentHashMap<>();
        this.pool = new ThreadPoolExecutor(
                settings.reportWorkers(),
                settings.reportWorkers(),
                60L,
                TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(settings.reportQueueCapacity()),
                new TransferThreadFactory(),
                new ThreadPoolExecutor.AbortPolicy()
        );
    }

    public ReportHandle submit(long taskId, long workerId, String reportText, String mediaRef) {
        if (mediaRef == null || mediaRef.isBlank()) {
            throw new ValidationException("Media file path cannot be empty");
        }
        if (reportText == null) {
            throw new ValidationException("Report text cannot be null");
        }
        String source = mediaRef.trim();
        long submissionId = writeLock.guard(() -> {
            ensureReportable(taskId, workerId);
            return reportStore.insert(taskId, workerId, reportText, source, clock.millis());
        });
        audit("report.submit", workerId, submissionId, taskId, "queued", Map.of("media_source", source));
        log.info("Report {} queued: worker={} task={}", submissionId, workerId, taskId);
        return dispatch(submissionId, taskId, workerId, reportText, source);
    }

    /** Re-dispatches a failed submission from its persisted draft. */
    public ReportHandle retry(long submissionId, long workerId) {
        ReportSubmission draft = writeLock.guard(() -> {
            ReportSubmission current = reportStore.get(submissionId)
                    .orElseThrow(() -> new NotFoundException("Report submission not found: " + submissionId));
            if (current.workerId() != workerId) {
                throw new AuthorizationException("Report submission " + submissionId + " belongs to another worker");
            }
            if (current.state() != ReportState.FAILED) {
                throw new InvalidSelectionException("Only failed reports can be retried, submission "
                        + submissionId + " is " + current.state().dbValue());
            }
            ensureReportable(current.taskId(), workerId);
            reportStore.requeue(submissionId, clock.millis());
            return current;
        });
        audit("report.retry", workerId, submissionId, draft.taskId(), "queued", Map.of());
        log.info("Report {} requeued: worker={} task={}", submissionId, workerId, draft.taskId());
        return dispatch(submissionId, draft.taskId(), workerId, draft.reportText(), draft.mediaSource());
    }

    public Optional<ReportSubmission> status(long submissionId) {
        return reportStore.get(submissionId);
    }

    public List<ReportSubmission> submissions(long taskId) {
        return reportStore.listByTask(taskId);
    }

    /** The live handle of a job dispatched by this process, if it has not finished yet. */
    public Optional<ReportHandle> handle(long submissionId) {
        return Optional.ofNullable(activeHandles.get(submissionId));
    }

    public int inFlightCount() {
        return activeHandles.size();
    }

    /**
     * Waits until every job dispatched by this process has finished or {@code timeout} passes.
     * Returns true when nothing is left in flight.
     */
    public boolean awaitIdle(Duration timeout) {
        CompletableFuture<?>[] pending = activeHandles.values().stream()
                .map(ReportHandle::completion)
                .toArray(CompletableFuture<?>[]::new);
        if (pending.length == 0) {
            return true;
        }
        try {
            CompletableFuture.allOf(pending).get(Math.max(0L, timeout.toMillis()), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            log.warn("{} report transfer(s) still running after {} ms", activeHandles.size(), timeout.toMillis());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Report job completed exceptionally", e.getCause());
        }
    }

    /** Fails submissions a previous process left queued or transferring. Call before accepting new work. */
    public int recoverInterrupted() {
        int recovered = reportStore.failInFlight(INTERRUPTED_BY_RESTART, clock.millis());
        if (recovered > 0) {
            log.warn("Marked {} interrupted report submission(s) as failed", recovered);
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "report.recover", "system", "report_submissions", "failed",
                    Map.of("count", recovered)
            ));
        }
        return recovered;
    }

    /**
     * Stops the pool. Running transfers get the shutdown grace, then are interrupted; jobs that
     * never left the queue are failed so their handles complete.
     */
    @Override
    public void close() {
        pool.shutdown();
        List<Runnable> neverStarted = List.of();
        try {
            if (!pool.awaitTermination(settings.shutdownGraceMs(), TimeUnit.MILLISECONDS)) {
                log.warn("Interrupting {} report transfer(s) still running after shutdown grace", activeHandles.size());
                neverStarted = pool.shutdownNow();
                if (!pool.awaitTermination(settings.shutdownGraceMs(), TimeUnit.MILLISECONDS)) {
                    log.warn("Report transfer threads did not stop after interrupt");
                }
            }
        } catch (InterruptedException e) {
            neverStarted = pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        for (Runnable job : neverStarted) {
            if (job instanceof ReportJob) {
                ReportJob reportJob = (ReportJob) job;
                fail(reportJob.handle, reportJob.workerId, SHUT_DOWN_BEFORE_TRANSFER, null);
            }
        }
    }

    private void ensureReportable(long taskId, long workerId) {
        TaskView task = lifecycle.listForWorker(workerId).stream()
                .filter(candidate -> candidate.id() == taskId)
                .findFirst()
                .orElseThrow(() -> new InvalidSelectionException(
                        "Invalid or unassigned task id " + taskId + " for worker " + workerId));
        if (TaskStatus.COMPLETED.matches(task.status())) {
            throw new InvalidSelectionException("Task " + taskId + " is already completed");
        }
        reportStore.findInFlight(taskId).ifPresent(inFlight -> {
            throw new InvalidSelectionException("Task " + taskId + " already has report "
                    + inFlight.id() + " in progress");
        });
    }

    private ReportHandle dispatch(long submissionId, long taskId, long workerId, String text, String source) {
        ReportHandle handle = new ReportHandle(submissionId, taskId, reportStore);
        activeHandles.put(submissionId, handle);
        try {
            pool.execute(new ReportJob(handle, workerId, text, source));
        } catch (RejectedExecutionException e) {
            fail(handle, workerId, "Report queue is full or shutting down", e);
        }
        return handle;
    }

    private void run(ReportHandle handle, long workerId, String text, String source) {
        long submissionId = handle.submissionId();
        long taskId = handle.taskId();
        Path target = config.uploadTarget(taskId, workerId);
        long startedNs = System.nanoTime();
        try {
            reportStore.markTransferring(submissionId, clock.millis());
            mediaTransfer.transfer(resolveSource(source), target, Duration.ofMillis(settings.transferTimeoutMs()));
        } catch (EhsDeskException e) {
            fail(handle, workerId, e.getMessage(), e);
            return;
        } catch (RuntimeException e) {
            fail(handle, workerId, "Unexpected transfer failure: " + e.getMessage(), e);
            return;
        }

        String mediaPath = target.toString();
        try {
            writeLock.guard(() -> {
                lifecycle.complete(taskId, workerId, text, mediaPath);
                reportStore.markCommitted(submissionId, mediaPath, clock.millis());
            });
        } catch (EhsDeskException e) {
            removeUpload(target);
            fail(handle, workerId, e.getMessage(), e);
            return;
        }

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNs);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("media_path", mediaPath);
        details.put("elapsed_ms", elapsedMs);
        audit("report.commit", workerId, submissionId, taskId, "committed", details);
        log.info("Report {} committed: task={} media={} elapsedMs={}", submissionId, taskId, mediaPath, elapsedMs);
        activeHandles.remove(submissionId);
        handle.complete(ReportOutcome.committed(submissionId, taskId, mediaPath));
    }

    private Path resolveSource(String source) {
        try {
            return Path.of(source);
        } catch (InvalidPathException e) {
            throw new TransferException("Invalid media path: " + source, e);
        }
    }

    private void fail(ReportHandle handle, long workerId, String error, Exception cause) {
        long submissionId = handle.submissionId();
        String message = (error == null || error.isBlank()) && cause != null ? cause.getClass().getSimpleName() : error;
        if (cause == null || cause instanceof TransferException || cause instanceof RejectedExecutionException) {
            log.warn("Report {} failed for task {}: {}", submissionId, handle.taskId(), message);
        } else {
            log.warn("Report {} failed for task {}", submissionId, handle.taskId(), cause);
        }
        try {
            reportStore.markFailed(submissionId, message, clock.millis());
        } catch (StoreException e) {
            log.error("Could not record failure of report {}", submissionId, e);
        }
        audit("report.fail", workerId, submissionId, handle.taskId(), "failed", Map.of("error", message));
        activeHandles.remove(submissionId);
        handle.complete(ReportOutcome.failed(submissionId, handle.taskId(), message));
    }

    private void removeUpload(Path target) {
        try {
            Files.deleteIfExists(target);
        } catch (IOException e) {
            log.warn("Could not remove orphaned upload {}: {}", target, e.getMessage());
        }
    }

    private void audit(String action, long workerId, long submissionId, long taskId, String result,
                       Map<String, Object> extra) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("submission_id", submissionId);
        details.put("task_id", taskId);
        details.putAll(extra);
        auditLogger.log(AuditLogger.AuditEvent.of(action, "worker:" + workerId, "task/" + taskId, result, details));
    }

    private final class ReportJob implements Runnable {
        private final ReportHandle handle;
        private final long workerId;
        private final String text;
        private final String source;

        ReportJob(ReportHandle handle, long workerId, String text, String source) {
            this.handle = handle;
            this.workerId = workerId;
            this.text = text;
            this.source = source;
        }

        @Override
        public void run() {
            ReportingExecutor.this.run(handle, workerId, text, source);
        }
    }

    private static final class TransferThreadFactory implements ThreadFactory {
        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "ehsdesk-report-transfer-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            thread.setUncaughtExceptionHandler((t, e) ->
                    log.error("Unexpected exception in report transfer thread {}", t.getName(), e));
            return thread;
        }
    }
}
