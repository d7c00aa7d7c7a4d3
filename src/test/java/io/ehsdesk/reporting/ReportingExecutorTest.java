package io.ehsdesk.reporting;

import io.ehsdesk.config.DeskSettings;
import io.ehsdesk.config.EhsDeskConfig;
import io.ehsdesk.error.AuthorizationException;
import io.ehsdesk.error.InvalidSelectionException;
import io.ehsdesk.error.NotFoundException;
import io.ehsdesk.error.TransferException;
import io.ehsdesk.error.ValidationException;
import io.ehsdesk.model.ReportOutcome;
import io.ehsdesk.model.ReportState;
import io.ehsdesk.model.ReportSubmission;
import io.ehsdesk.model.Role;
import io.ehsdesk.model.TaskRecord;
import io.ehsdesk.observability.AuditLogger;
import io.ehsdesk.storage.Database;
import io.ehsdesk.storage.ReportStore;
import io.ehsdesk.storage.TaskStore;
import io.ehsdesk.storage.UserStore;
import io.ehsdesk.tasks.TaskLifecycle;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

final class ReportingExecutorTest {
    private static final Duration WAIT = Duration.ofSeconds(10);

    @Test
    void committedReportCompletesTaskWithUploadedMedia() throws Exception {
        Path root = Files.createTempDirectory("ehsdesk-test-report-commit-");
        try (Fixture fx = new Fixture(root, DeskSettings.defaults(), null)) {
            long workerId = fx.seedWorkerWithId5();
            long taskId = fx.lifecycle.assign(workerId, "Wear PPE");
            Path image = writeMedia(root, "img.jpg", "jpeg-bytes");

            ReportHandle handle = fx.executor.submit(taskId, workerId, "PPE confirmed", image.toString());
            ReportOutcome outcome = handle.await(WAIT).orElseThrow();

            Assertions.assertEquals(1L, taskId);
            Assertions.assertTrue(outcome.success(), outcome.error());
            TaskRecord task = fx.lifecycle.get(taskId).orElseThrow();
            Assertions.assertEquals("completed", task.status());
            Assertions.assertEquals("PPE confirmed", task.workerReport());
            Assertions.assertTrue(Path.of(task.workerMediaPath()).endsWith(Path.of("uploads", "task_1_user_5")));
            Assertions.assertEquals("jpeg-bytes", Files.readString(Path.of(task.workerMediaPath()), StandardCharsets.UTF_8));
            Assertions.assertEquals(ReportState.COMMITTED, handle.state());
            Assertions.assertEquals(0, fx.executor.inFlightCount());
            Assertions.assertTrue(fx.executor.handle(handle.submissionId()).isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failedTransferKeepsTaskPendingAndDraftRetryable() throws Exception {
        Path root = Files.createTempDirectory("ehsdesk-test-report-fail-");
        try (Fixture fx = new Fixture(root, DeskSettings.defaults(), null)) {
            long workerId = fx.users.insert("walt", "h", Role.WORKER);
            long taskId = fx.lifecycle.assign(workerId, "Check extinguisher");
            Path missing = root.resolve("later.jpg");

            ReportHandle handle = fx.executor.submit(taskId, workerId, "Gauge in green", missing.toString());
            ReportOutcome failed = handle.await(WAIT).orElseThrow();

            Assertions.assertFalse(failed.success());
            Assertions.assertTrue(failed.error().contains("not readable"), failed.error());
            Assertions.assertEquals("pending", fx.lifecycle.get(taskId).orElseThrow().status());
            ReportSubmission draft = fx.executor.status(handle.submissionId()).orElseThrow();
            Assertions.assertEquals(ReportState.FAILED, draft.state());
            Assertions.assertEquals("Gauge in green", draft.reportText());
            Assertions.assertEquals(missing.toString(), draft.mediaSource());

            writeMedia(root, "later.jpg", "photo");
            ReportOutcome retried = fx.executor.retry(handle.submissionId(), workerId).await(WAIT).orElseThrow();

            Assertions.assertTrue(retried.success(), retried.error());
            Assertions.assertEquals(handle.submissionId(), retried.submissionId());
            TaskRecord task = fx.lifecycle.get(taskId).orElseThrow();
            Assertions.assertEquals("completed", task.status());
            Assertions.assertEquals("Gauge in green", task.workerReport());
            Assertions.assertEquals(1, fx.executor.submissions(taskId).size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void transferExceedingTimeoutFails() throws Exception {
        Path root = Files.createTempDirectory("ehsdesk-test-report-timeout-");
        DeskSettings settings = DeskSettings.defaults().withTransferTimeoutMs(100L).withTransferLatencyMs(2_000L);
        try (Fixture fx = new Fixture(root, settings, null)) {
            long workerId = fx.users.insert("walt", "h", Role.WORKER);
            long taskId = fx.lifecycle.assign(workerId, "Inspect scaffold");
            Path image = writeMedia(root, "scaffold.jpg", "pixels");

            ReportOutcome outcome = fx.executor.submit(taskId, workerId, "Scaffold ok", image.toString())
                    .await(WAIT).orElseThrow();

            Assertions.assertFalse(outcome.success());
            Assertions.assertTrue(outcome.error().contains("timed out"), outcome.error());
            Assertions.assertEquals("pending", fx.lifecycle.get(taskId).orElseThrow().status());
            Assertions.assertFalse(Files.exists(fx.config.uploadTarget(taskId, workerId)));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void storeWriteLockIsFreeWhileMediaTransfers() throws Exception {
        Path root = Files.createTempDirectory("ehsdesk-test-report-lock-");
        AtomicBoolean lockedDuringTransfer = new AtomicBoolean(true);
        AtomicBoolean otherWriteSucceeded = new AtomicBoolean(false);
        Fixture[] holder = new Fixture[1];
        MediaTransfer probing = (source, target, timeout) -> {
            lockedDuringTransfer.set(holder[0].database.writeLock().isLocked());
            long otherWorker = holder[0].users.insert("vera", "h", Role.WORKER);
            otherWriteSucceeded.set(holder[0].lifecycle.assign(otherWorker, "Parallel assignment") > 0L);
            copy(source, target);
        };
        try (Fixture fx = new Fixture(root, DeskSettings.defaults(), probing)) {
            holder[0] = fx;
            long workerId = fx.users.insert("walt", "h", Role.WORKER);
            long taskId = fx.lifecycle.assign(workerId, "Wear PPE");
            Path image = writeMedia(root, "img.jpg", "x");

            ReportOutcome outcome = fx.executor.submit(taskId, workerId, "done", image.toString()).await(WAIT).orElseThrow();

            Assertions.assertTrue(outcome.success(), outcome.error());
            Assertions.assertFalse(lockedDuringTransfer.get());
            Assertions.assertTrue(otherWriteSucceeded.get());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void submitReturnsBeforeTransferAndRejectsSecondReportForSameTask() throws Exception {
        Path root = Files.createTempDirectory("ehsdesk-test-report-inflight-");
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        MediaTransfer gated = (source, target, timeout) -> {
            started.countDown();
            try {
                if (!release.await(10, TimeUnit.SECONDS)) {
                    throw new IllegalStateException("test gate never opened");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
            copy(source, target);
        };
        try (Fixture fx = new Fixture(root, DeskSettings.defaults(), gated)) {
            long workerId = fx.users.insert("walt", "h", Role.WORKER);
            long taskId = fx.lifecycle.assign(workerId, "Wear PPE");
            Path image = writeMedia(root, "img.jpg", "x");

            ReportHandle first = fx.executor.submit(taskId, workerId, "first", image.toString());
            Assertions.assertTrue(started.await(10, TimeUnit.SECONDS));
            Assertions.assertFalse(first.isDone());
            Assertions.assertEquals(ReportState.TRANSFERRING, first.state());
            Assertions.assertTrue(fx.executor.handle(first.submissionId()).isPresent());
            Assertions.assertEquals("pending", fx.lifecycle.get(taskId).orElseThrow().status());

            Assertions.assertThrows(InvalidSelectionException.class,
                    () -> fx.executor.submit(taskId, workerId, "second", image.toString()));

            release.countDown();
            Assertions.assertTrue(first.completion().get(10, TimeUnit.SECONDS).success());
            Assertions.assertEquals("first", fx.lifecycle.get(taskId).orElseThrow().workerReport());
            Assertions.assertThrows(InvalidSelectionException.class,
                    () -> fx.executor.submit(taskId, workerId, "after completion", image.toString()));
        } finally {
            release.countDown();
            deleteRecursively(root);
        }
    }

    @Test
    void invalidSelectionsCreateNoDraft() throws Exception {
        Path root = Files.createTempDirectory("ehsdesk-test-report-select-");
        try (Fixture fx = new Fixture(root, DeskSettings.defaults(), null)) {
            long walt = fx.users.insert("walt", "h", Role.WORKER);
            long vera = fx.users.insert("vera", "h", Role.WORKER);
            long waltTask = fx.lifecycle.assign(walt, "Wear PPE");
            String media = writeMedia(root, "img.jpg", "x").toString();

            Assertions.assertThrows(InvalidSelectionException.class, () -> fx.executor.submit(waltTask, vera, "mine?", media));
            Assertions.assertThrows(InvalidSelectionException.class, () -> fx.executor.submit(404L, walt, "ghost", media));
            Assertions.assertThrows(ValidationException.class, () -> fx.executor.submit(waltTask, walt, "no media", " "));

            Assertions.assertTrue(fx.executor.submissions(waltTask).isEmpty());
            Assertions.assertEquals("pending", fx.lifecycle.get(waltTask).orElseThrow().status());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void recoveryFailsInterruptedDraftsAndRetryChecksOwnership() throws Exception {
        Path root = Files.createTempDirectory("ehsdesk-test-report-recover-");
        try (Fixture fx = new Fixture(root, DeskSettings.defaults(), null)) {
            long walt = fx.users.insert("walt", "h", Role.WORKER);
            long vera = fx.users.insert("vera", "h", Role.WORKER);
            long taskId = fx.lifecycle.assign(walt, "Wear PPE");
            long otherTask = fx.lifecycle.assign(walt, "Check exits");
            String media = writeMedia(root, "img.jpg", "x").toString();
            long queued = fx.reportStore.insert(taskId, walt, "queued before crash", media, 1L);
            long transferring = fx.reportStore.insert(otherTask, walt, "mid-transfer", media, 1L);
            fx.reportStore.markTransferring(transferring, 2L);

            Assertions.assertEquals(2, fx.executor.recoverInterrupted());
            Assertions.assertEquals(0, fx.executor.recoverInterrupted());

            ReportSubmission recovered = fx.executor.status(queued).orElseThrow();
            Assertions.assertEquals(ReportState.FAILED, recovered.state());
            Assertions.assertEquals("Interrupted by restart", recovered.error());
            Assertions.assertEquals("queued before crash", recovered.reportText());

            Assertions.assertThrows(AuthorizationException.class, () -> fx.executor.retry(queued, vera));
            Assertions.assertThrows(NotFoundException.class, () -> fx.executor.retry(999L, walt));

            Assertions.assertTrue(fx.executor.retry(queued, walt).await(WAIT).orElseThrow().success());
            Assertions.assertThrows(InvalidSelectionException.class, () -> fx.executor.retry(queued, walt));
            Assertions.assertEquals("completed", fx.lifecycle.get(taskId).orElseThrow().status());
            Assertions.assertEquals("pending", fx.lifecycle.get(otherTask).orElseThrow().status());

            List<String> actions = fx.audit.tail(50).stream().map(row -> row.path("action").asText()).toList();
            Assertions.assertTrue(actions.contains("report.recover"));
            Assertions.assertTrue(actions.contains("report.retry"));
            Assertions.assertTrue(actions.contains("report.commit"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void closeFailsJobsThatNeverLeftTheQueue() throws Exception {
        Path root = Files.createTempDirectory("ehsdesk-test-report-close-");
        DeskSettings settings = new DeskSettings(10_000L, 0L, DeskSettings.DEFAULT_TRANSFER_CHUNK_BYTES,
                1, 10, 200L, true, false);
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch never = new CountDownLatch(1);
        MediaTransfer stuck = (source, target, timeout) -> {
            started.countDown();
            try {
                never.await(30, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransferException("Media transfer interrupted", e);
            }
        };
        try (Fixture fx = new Fixture(root, settings, stuck)) {
            long workerId = fx.users.insert("walt", "h", Role.WORKER);
            long firstTask = fx.lifecycle.assign(workerId, "Wear PPE");
            long secondTask = fx.lifecycle.assign(workerId, "Check exits");
            String media = writeMedia(root, "img.jpg", "x").toString();

            ReportHandle running = fx.executor.submit(firstTask, workerId, "first", media);
            Assertions.assertTrue(started.await(10, TimeUnit.SECONDS));
            ReportHandle queued = fx.executor.submit(secondTask, workerId, "second", media);
            Assertions.assertEquals(ReportState.QUEUED, queued.state());

            fx.executor.close();

            Assertions.assertTrue(running.isDone());
            Assertions.assertEquals(ReportState.FAILED, running.state());
            ReportOutcome stranded = queued.await(Duration.ofSeconds(1)).orElseThrow();
            Assertions.assertFalse(stranded.success());
            Assertions.assertEquals("Shut down before transfer started", stranded.error());
            Assertions.assertEquals(ReportState.FAILED, queued.state());
            Assertions.assertEquals(0, fx.executor.inFlightCount());
            Assertions.assertEquals("pending", fx.lifecycle.get(firstTask).orElseThrow().status());
            Assertions.assertEquals("pending", fx.lifecycle.get(secondTask).orElseThrow().status());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void reportTextIsStoredAsGiven() throws Exception {
        Path root = Files.createTempDirectory("ehsdesk-test-report-verbatim-");
        try (Fixture fx = new Fixture(root, DeskSettings.defaults(), null)) {
            long workerId = fx.users.insert("walt", "h", Role.WORKER);
            long taskId = fx.lifecycle.assign(workerId, "Wear PPE");
            String media = writeMedia(root, "img.jpg", "x").toString();

            Assertions.assertThrows(ValidationException.class, () -> fx.executor.submit(taskId, workerId, null, media));
            ReportOutcome outcome = fx.executor.submit(taskId, workerId, "  gloves on\t", media).await(WAIT).orElseThrow();

            Assertions.assertTrue(outcome.success(), outcome.error());
            Assertions.assertEquals("  gloves on\t", fx.lifecycle.get(taskId).orElseThrow().workerReport());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void awaitIdleWaitsForDispatchedJobs() throws Exception {
        Path root = Files.createTempDirectory("ehsdesk-test-report-idle-");
        DeskSettings settings = DeskSettings.defaults().withTransferLatencyMs(300L);
        try (Fixture fx = new Fixture(root, settings, null)) {
            long workerId = fx.users.insert("walt", "h", Role.WORKER);
            long taskId = fx.lifecycle.assign(workerId, "Wear PPE");
            String media = writeMedia(root, "img.jpg", "x").toString();

            Assertions.assertTrue(fx.executor.awaitIdle(Duration.ZERO));
            ReportHandle handle = fx.executor.submit(taskId, workerId, "done", media);

            Assertions.assertTrue(fx.executor.awaitIdle(WAIT));
            Assertions.assertTrue(handle.isDone());
            Assertions.assertEquals("completed", fx.lifecycle.get(taskId).orElseThrow().status());
        } finally {
            deleteRecursively(root);
        }
    }

    private static Path writeMedia(Path root, String name, String content) throws IOException {
        Path file = root.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    private static void copy(Path source, Path target) {
        try {
            Files.createDirectories(target.getParent());
            Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }

    private static final class Fixture implements AutoCloseable {
        final EhsDeskConfig config;
        final Database database;
        final UserStore users;
        final ReportStore reportStore;
        final TaskLifecycle lifecycle;
        final AuditLogger audit;
        final ReportingExecutor executor;

        Fixture(Path root, DeskSettings settings, MediaTransfer transfer) {
            this.config = EhsDeskConfig.fromRoot(root.toString());
            this.database = new Database(config);
            database.init();
            this.users = new UserStore(database);
            this.reportStore = new ReportStore(database);
            this.lifecycle = new TaskLifecycle(new TaskStore(database), users, database.writeLock(), settings,
                    Clock.systemUTC());
            this.audit = new AuditLogger(config.auditFile());
            this.executor = new ReportingExecutor(
                    lifecycle,
                    reportStore,
                    database.writeLock(),
                    transfer == null
                            ? new StreamingMediaTransfer(settings.transferChunkBytes(), settings.transferLatencyMs())
                            : transfer,
                    config,
                    settings,
                    audit,
                    Clock.systemUTC()
            );
        }

        long seedWorkerWithId5() {
            users.insert("manager", "h", Role.MANAGER);
            users.insert("w2", "h", Role.WORKER);
            users.insert("w3", "h", Role.WORKER);
            users.insert("w4", "h", Role.WORKER);
            return users.insert("dana", "h", Role.WORKER);
        }

        @Override
        public void close() {
            executor.close();
        }
    }
}
