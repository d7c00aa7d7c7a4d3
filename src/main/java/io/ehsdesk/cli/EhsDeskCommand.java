package io.ehsdesk.cli;

import io.ehsdesk.config.EhsDeskConfig;
import io.ehsdesk.error.EhsDeskException;
import io.ehsdesk.model.Actor;
import io.ehsdesk.model.ReportOutcome;
import io.ehsdesk.model.ReportSubmission;
import io.ehsdesk.model.Role;
import io.ehsdesk.model.TaskRecord;
import io.ehsdesk.reporting.ReportHandle;
import io.ehsdesk.runtime.EhsDeskRuntime;
import io.ehsdesk.runtime.ManagerDesk;
import io.ehsdesk.runtime.WorkerDesk;
import io.ehsdesk.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
        name = "ehsdesk",
        mixinStandardHelpOptions = true,
        description = "EHS task, report and safety-rule desk",
        subcommands = {
                EhsDeskCommand.InitCommand.class,
                EhsDeskCommand.RegisterCommand.class,
                EhsDeskCommand.WorkersCommand.class,
                EhsDeskCommand.AssignCommand.class,
                EhsDeskCommand.ReportViolationCommand.class,
                EhsDeskCommand.TasksCommand.class,
                EhsDeskCommand.DeleteTaskCommand.class,
                EhsDeskCommand.ReportCommand.class,
                EhsDeskCommand.ReportStatusCommand.class,
                EhsDeskCommand.ReportRetryCommand.class,
                EhsDeskCommand.RulesCommand.class,
                EhsDeskCommand.AddRuleCommand.class,
                EhsDeskCommand.DeleteRuleCommand.class,
                EhsDeskCommand.FeedbackCommand.class,
                EhsDeskCommand.GiveFeedbackCommand.class,
                EhsDeskCommand.AuditTailCommand.class,
                EhsDeskCommand.ConsoleCommand.class
        }
)
public final class EhsDeskCommand implements Runnable {
    static final int EXIT_OK = 0;
    static final int EXIT_REJECTED = 1;
    static final int EXIT_BAD_CREDENTIALS = 2;

    @Spec
    CommandSpec spec;

    @Option(names = {"--root"}, description = "Data root directory", defaultValue = EhsDeskConfig.DEFAULT_ROOT)
    String root;

    @Override
    public void run() {
        out().println("Use subcommands: init | register | workers | assign | report-violation | tasks | delete-task | report | report-status | report-retry | rules | add-rule | delete-rule | feedback | give-feedback | audit-tail | console");
    }

    EhsDeskRuntime runtime() {
        return new EhsDeskRuntime(EhsDeskConfig.fromRoot(root));
    }

    PrintWriter out() {
        return spec.commandLine().getOut();
    }

    PrintWriter err() {
        return spec.commandLine().getErr();
    }

    int emit(CommandOutcome outcome, boolean json) {
        if (json) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("success", outcome.success());
            payload.put("detail", outcome.detail());
            if (outcome.data() != null) {
                payload.put("data", outcome.data());
            }
            out().println(Jsons.toJson(payload));
        } else if (outcome.success()) {
            out().println(outcome.detail());
        } else {
            err().println("Error: " + outcome.detail());
        }
        out().flush();
        err().flush();
        return outcome.success() ? EXIT_OK : EXIT_REJECTED;
    }

    /** Base for subcommands that act as a signed-in user. */
    abstract static class DeskCommand implements Callable<Integer> {
        @ParentCommand
        EhsDeskCommand parent;

        @Option(names = {"--user"}, required = true, description = "Username")
        String user;

        @Option(names = {"--password"}, required = true, description = "Password", interactive = true, arity = "0..1")
        String password;

        @Option(names = {"--json"}, description = "Print the result as JSON")
        boolean json;

        @Override
        public Integer call() {
            try (EhsDeskRuntime runtime = parent.runtime()) {
                runtime.init();
                Optional<Actor> actor = runtime.login(user, password);
                if (actor.isEmpty()) {
                    parent.err().println("Invalid username or password.");
                    parent.err().flush();
                    return EXIT_BAD_CREDENTIALS;
                }
                int code = parent.emit(execute(runtime, actor.get()), json);
                awaitReports(runtime);
                return code;
            } catch (EhsDeskException e) {
                return parent.emit(CommandOutcome.rejected(e.getMessage()), json);
            }
        }

        abstract CommandOutcome execute(EhsDeskRuntime runtime, Actor actor);

        /** A one-shot process must not exit while an accepted report is still transferring. */
        private void awaitReports(EhsDeskRuntime runtime) {
            int inFlight = runtime.inFlightReports();
            if (inFlight == 0) {
                return;
            }
            parent.err().println("Waiting for " + inFlight + " report transfer(s) to finish...");
            parent.err().flush();
            if (!runtime.awaitPendingReports()) {
                parent.err().println("Report transfer did not finish in time; check report-status.");
                parent.err().flush();
            }
        }
    }

    @Command(name = "init", description = "Initialize directories and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        EhsDeskCommand parent;

        @Override
        public Integer call() {
            try (EhsDeskRuntime runtime = parent.runtime()) {
                runtime.init();
                parent.out().println("Initialized EHS desk at: " + runtime.config().rootDir());
            }
            return EXIT_OK;
        }
    }

    @Command(name = "register", description = "Register a worker or manager account")
    static final class RegisterCommand implements Callable<Integer> {
        @ParentCommand
        EhsDeskCommand parent;

        @Option(names = {"--username"}, required = true, description = "New username")
        String username;

        @Option(names = {"--password"}, required = true, description = "New password", interactive = true, arity = "0..1")
        String password;

        @Option(names = {"--role"}, required = true, description = "worker|manager")
        String role;

        @Option(names = {"--json"}, description = "Print the result as JSON")
        boolean json;

        @Override
        public Integer call() {
            try (EhsDeskRuntime runtime = parent.runtime()) {
                runtime.init();
                Actor created = runtime.register(username, password, Role.fromString(role));
                return parent.emit(CommandOutcome.ok(
                        "Registered " + created.role().dbValue() + " '" + created.username() + "' with id " + created.id(),
                        created
                ), json);
            } catch (EhsDeskException e) {
                return parent.emit(CommandOutcome.rejected(e.getMessage()), json);
            }
        }
    }

    @Command(name = "workers", description = "List registered workers (manager)")
    static final class WorkersCommand extends DeskCommand {
        @Override
        CommandOutcome execute(EhsDeskRuntime runtime, Actor actor) {
            List<Actor> workers = runtime.managerDesk(actor).listWorkers();
            return CommandOutcome.ok(TextViews.workers(workers), workers);
        }
    }

    @Command(name = "assign", description = "Assign a task to a worker (manager)")
    static final class AssignCommand extends DeskCommand {
        @Option(names = {"--worker"}, required = true, description = "Worker id")
        long workerId;

        @Option(names = {"--description"}, required = true, description = "Task description")
        String description;

        @Override
        CommandOutcome execute(EhsDeskRuntime runtime, Actor actor) {
            long taskId = runtime.managerDesk(actor).assignTask(workerId, description);
            return CommandOutcome.ok("Task " + taskId + " assigned successfully.", Map.of("taskId", taskId));
        }
    }

    @Command(name = "report-violation", description = "Set a task status with a violation comment (manager)")
    static final class ReportViolationCommand extends DeskCommand {
        @Option(names = {"--task"}, required = true, description = "Task id")
        long taskId;

        @Option(names = {"--status"}, required = true, description = "New status, e.g. violation or incomplete")
        String status;

        @Option(names = {"--comment"}, defaultValue = "", description = "Violation comment")
        String comment;

        @Override
        CommandOutcome execute(EhsDeskRuntime runtime, Actor actor) {
            TaskRecord updated = runtime.managerDesk(actor).reportViolation(taskId, status, comment);
            return CommandOutcome.ok("Task " + taskId + " updated with violation info.", updated);
        }
    }

    @Command(name = "tasks", description = "List tasks: all for a manager, own tasks for a worker")
    static final class TasksCommand extends DeskCommand {
        @Option(names = {"--status"}, description = "Filter by status (manager)")
        String status;

        @Override
        CommandOutcome execute(EhsDeskRuntime runtime, Actor actor) {
            if (actor.isManager()) {
                ManagerDesk desk = runtime.managerDesk(actor);
                List<TaskRecord> tasks = status == null || status.isBlank() ? desk.listTasks() : desk.listTasksByStatus(status);
                return CommandOutcome.ok(TextViews.managerTasks(tasks), tasks);
            }
            WorkerDesk desk = runtime.workerDesk(actor);
            var tasks = desk.listTasks();
            return CommandOutcome.ok(TextViews.workerTasks(tasks), tasks);
        }
    }

    @Command(name = "delete-task", description = "Delete a task (manager)")
    static final class DeleteTaskCommand extends DeskCommand {
        @Parameters(index = "0", description = "Task id")
        long taskId;

        @Override
        CommandOutcome execute(EhsDeskRuntime runtime, Actor actor) {
            runtime.managerDesk(actor).deleteTask(taskId);
            return CommandOutcome.ok("Task " + taskId + " deleted successfully.");
        }
    }

    @Command(name = "report", description = "Report on an assigned task with a media file (worker)")
    static final class ReportCommand extends DeskCommand {
        @Option(names = {"--task"}, required = true, description = "Task id")
        long taskId;

        @Option(names = {"--media"}, required = true, description = "Path to the media file")
        String media;

        @Option(names = {"--text"}, defaultValue = "", description = "Report description")
        String text;

        @Option(names = {"--no-wait"}, description = "Print as soon as the report is queued; the process still exits after the transfer")
        boolean noWait;

        @Override
        CommandOutcome execute(EhsDeskRuntime runtime, Actor actor) {
            WorkerDesk desk = runtime.workerDesk(actor);
            ReportHandle handle = desk.submitReport(taskId, text, media);
            if (noWait) {
                return CommandOutcome.ok("Report " + handle.submissionId() + " queued for task " + taskId + ".",
                        desk.reportStatus(handle.submissionId()));
            }
            long waitMs = runtime.settings().transferTimeoutMs() + runtime.settings().shutdownGraceMs();
            Optional<ReportOutcome> outcome = handle.await(Duration.ofMillis(waitMs));
            if (outcome.isEmpty()) {
                return CommandOutcome.ok("Report " + handle.submissionId() + " is still in progress. Check with report-status "
                        + handle.submissionId(), desk.reportStatus(handle.submissionId()));
            }
            return new CommandOutcome(outcome.get().success(), TextViews.outcome(outcome.get()), outcome.get());
        }
    }

    @Command(name = "report-status", description = "Show the state of a report submission")
    static final class ReportStatusCommand extends DeskCommand {
        @Parameters(index = "0", description = "Submission id")
        long submissionId;

        @Override
        CommandOutcome execute(EhsDeskRuntime runtime, Actor actor) {
            ReportSubmission submission = actor.isManager()
                    ? runtime.managerDesk(actor).reportSubmission(submissionId)
                    : runtime.workerDesk(actor).reportStatus(submissionId);
            return CommandOutcome.ok(TextViews.submission(submission), submission);
        }
    }

    @Command(name = "report-retry", description = "Retry a failed report submission (worker)")
    static final class ReportRetryCommand extends DeskCommand {
        @Parameters(index = "0", description = "Submission id")
        long submissionId;

        @Override
        CommandOutcome execute(EhsDeskRuntime runtime, Actor actor) {
            ReportHandle handle = runtime.workerDesk(actor).retryReport(submissionId);
            long waitMs = runtime.settings().transferTimeoutMs() + runtime.settings().shutdownGraceMs();
            return handle.await(Duration.ofMillis(waitMs))
                    .map(outcome -> new CommandOutcome(outcome.success(), TextViews.outcome(outcome), outcome))
                    .orElseGet(() -> CommandOutcome.ok("Report " + submissionId + " is still in progress."));
        }
    }

    @Command(name = "rules", description = "List safety rules")
    static final class RulesCommand extends DeskCommand {
        @Override
        CommandOutcome execute(EhsDeskRuntime runtime, Actor actor) {
            var rules = runtime.desk(actor).listRules();
            return CommandOutcome.ok(TextViews.rules(rules), rules);
        }
    }

    @Command(name = "add-rule", description = "Add a safety rule (manager)")
    static final class AddRuleCommand extends DeskCommand {
        @Option(names = {"--text"}, required = true, description = "Rule text")
        String text;

        @Override
        CommandOutcome execute(EhsDeskRuntime runtime, Actor actor) {
            long ruleId = runtime.managerDesk(actor).addRule(text);
            return CommandOutcome.ok("Rule " + ruleId + " added successfully.", Map.of("ruleId", ruleId));
        }
    }

    @Command(name = "delete-rule", description = "Delete a safety rule (manager)")
    static final class DeleteRuleCommand extends DeskCommand {
        @Parameters(index = "0", description = "Rule id")
        long ruleId;

        @Override
        CommandOutcome execute(EhsDeskRuntime runtime, Actor actor) {
            runtime.managerDesk(actor).deleteRule(ruleId);
            return CommandOutcome.ok("Rule " + ruleId + " deleted successfully.");
        }
    }

    @Command(name = "feedback", description = "List rules with their worker feedback")
    static final class FeedbackCommand extends DeskCommand {
        @Override
        CommandOutcome execute(EhsDeskRuntime runtime, Actor actor) {
            var feedback = runtime.desk(actor).listFeedback();
            return CommandOutcome.ok(TextViews.feedback(feedback), feedback);
        }
    }

    @Command(name = "give-feedback", description = "Give feedback on a safety rule (worker)")
    static final class GiveFeedbackCommand extends DeskCommand {
        @Option(names = {"--rule"}, required = true, description = "Rule id")
        long ruleId;

        @Option(names = {"--text"}, required = true, description = "Feedback text")
        String text;

        @Override
        CommandOutcome execute(EhsDeskRuntime runtime, Actor actor) {
            runtime.workerDesk(actor).giveFeedback(ruleId, text);
            return CommandOutcome.ok("Feedback submitted successfully.");
        }
    }

    @Command(name = "audit-tail", description = "Print the latest audit log rows (manager)")
    static final class AuditTailCommand extends DeskCommand {
        @Option(names = {"--lines"}, defaultValue = "50", description = "Number of latest lines")
        int lines;

        @Override
        CommandOutcome execute(EhsDeskRuntime runtime, Actor actor) {
            runtime.managerDesk(actor);
            var rows = runtime.auditLogger().tail(lines);
            StringBuilder sb = new StringBuilder();
            for (var row : rows) {
                if (sb.length() > 0) {
                    sb.append('\n');
                }
                sb.append(Jsons.toCompactJson(row));
            }
            return CommandOutcome.ok(sb.length() == 0 ? "Audit log is empty." : sb.toString(), rows);
        }
    }

    @Command(name = "console", description = "Interactive session for a signed-in user")
    static final class ConsoleCommand extends DeskCommand {
        @Option(names = {"--read-only"}, description = "Reject commands that change state")
        boolean readOnly;

        @Override
        CommandOutcome execute(EhsDeskRuntime runtime, Actor actor) {
            BufferedReader stdin = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            new ConsoleSession(runtime.desk(actor), stdin, parent.out(), readOnly).run();
            return CommandOutcome.ok("Session closed.");
        }
    }
}
