package io.ehsdesk.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.ehsdesk.config.DeskSettings;
import io.ehsdesk.config.EhsDeskConfig;
import io.ehsdesk.error.AuthorizationException;
import io.ehsdesk.error.ValidationException;
import io.ehsdesk.model.Actor;
import io.ehsdesk.model.ReportOutcome;
import io.ehsdesk.model.Role;
import io.ehsdesk.model.RuleFeedback;
import io.ehsdesk.model.TaskView;
import io.ehsdesk.reporting.ReportHandle;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.stream.Stream;

final class EhsDeskRuntimeTest {

    @Test
    void desksAreScopedToTheActorRole() throws Exception {
        Path root = Files.createTempDirectory("ehsdesk-test-runtime-roles-");
        try (EhsDeskRuntime runtime = new EhsDeskRuntime(EhsDeskConfig.fromRoot(root.toString()), DeskSettings.defaults())) {
            runtime.init();
            Actor manager = runtime.register("maria", "pw", Role.MANAGER);
            Actor worker = runtime.register("walt", "pw", Role.WORKER);

            Assertions.assertInstanceOf(ManagerDesk.class, runtime.desk(manager));
            Assertions.assertInstanceOf(WorkerDesk.class, runtime.desk(worker));
            Assertions.assertThrows(AuthorizationException.class, () -> runtime.managerDesk(worker));
            Assertions.assertThrows(AuthorizationException.class, () -> runtime.workerDesk(manager));
            Assertions.assertEquals(List.of(worker), runtime.managerDesk(manager).listWorkers());
            Assertions.assertEquals(worker, runtime.login("walt", "pw").orElseThrow());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void managerAndWorkerFlowIsAudited() throws Exception {
        Path root = Files.createTempDirectory("ehsdesk-test-runtime-flow-");
        try (EhsDeskRuntime runtime = new EhsDeskRuntime(EhsDeskConfig.fromRoot(root.toString()), DeskSettings.defaults())) {
            runtime.init();
            ManagerDesk manager = runtime.managerDesk(runtime.register("maria", "pw", Role.MANAGER));
            Actor walt = runtime.register("walt", "pw", Role.WORKER);
            WorkerDesk worker = runtime.workerDesk(walt);

            long taskId = manager.assignTask(walt.id(), "Wear PPE");
            long ruleId = manager.addRule("Hard hats on site");
            Assertions.assertThrows(ValidationException.class, () -> manager.reportViolation(taskId, "7", "numeric"));

            Path image = root.resolve("img.jpg");
            Files.writeString(image, "jpeg");
            ReportHandle handle = worker.submitReport(taskId, "PPE confirmed", image.toString());
            ReportOutcome outcome = handle.await(Duration.ofSeconds(10)).orElseThrow();
            Assertions.assertTrue(outcome.success(), outcome.error());
            Assertions.assertEquals(outcome.submissionId(), worker.reportStatus(handle.submissionId()).id());
            Assertions.assertEquals(1, manager.reportSubmissions(taskId).size());

            TaskView view = worker.listTasks().get(0);
            Assertions.assertEquals("completed", view.status());
            Assertions.assertTrue(worker.listReportableTasks().isEmpty());

            manager.reportViolation(taskId, "violation", "no helmet");
            Assertions.assertEquals("violation", manager.task(taskId).status());
            worker.giveFeedback(ruleId, "Need more sizes");
            RuleFeedback feedback = manager.listFeedback().get(0);
            Assertions.assertEquals("Need more sizes", feedback.feedback());

            List<JsonNode> rows = runtime.auditLogger().tail(100);
            Assertions.assertTrue(rows.stream().anyMatch(row -> "task.assign".equals(row.path("action").asText())
                    && "ok".equals(row.path("result").asText())));
            Assertions.assertTrue(rows.stream().anyMatch(row -> "task.violation".equals(row.path("action").asText())
                    && "rejected".equals(row.path("result").asText())
                    && "validation".equals(row.path("details").path("error_code").asText())));
            Assertions.assertTrue(rows.stream().anyMatch(row -> "rule.feedback".equals(row.path("action").asText())
                    && ("worker:" + walt.id()).equals(row.path("actor").asText())));
            Assertions.assertTrue(rows.stream().anyMatch(row -> "report.commit".equals(row.path("action").asText())));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void workersCannotReadOtherWorkersReports() throws Exception {
        Path root = Files.createTempDirectory("ehsdesk-test-runtime-isolation-");
        try (EhsDeskRuntime runtime = new EhsDeskRuntime(EhsDeskConfig.fromRoot(root.toString()), DeskSettings.defaults())) {
            runtime.init();
            ManagerDesk manager = runtime.managerDesk(runtime.register("maria", "pw", Role.MANAGER));
            Actor walt = runtime.register("walt", "pw", Role.WORKER);
            Actor vera = runtime.register("vera", "pw", Role.WORKER);
            long taskId = manager.assignTask(walt.id(), "Wear PPE");

            ReportHandle handle = runtime.workerDesk(walt).submitReport(taskId, "text", root.resolve("missing.jpg").toString());
            Assertions.assertFalse(handle.await(Duration.ofSeconds(10)).orElseThrow().success());

            Assertions.assertThrows(AuthorizationException.class,
                    () -> runtime.workerDesk(vera).reportStatus(handle.submissionId()));
            Assertions.assertThrows(AuthorizationException.class,
                    () -> runtime.workerDesk(vera).retryReport(handle.submissionId()));
            Assertions.assertTrue(runtime.workerDesk(vera).listTasks().isEmpty());
        } finally {
            deleteRecursively(root);
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
}
