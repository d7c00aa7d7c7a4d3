package io.ehsdesk.cli;

import io.ehsdesk.error.EhsDeskException;
import io.ehsdesk.model.ReportSubmission;
import io.ehsdesk.reporting.ReportHandle;
import io.ehsdesk.runtime.Desk;
import io.ehsdesk.runtime.ManagerDesk;
import io.ehsdesk.runtime.WorkerDesk;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Locale;

/**
 * Line-oriented session for one signed-in user. Rejected commands print their reason and the
 * session keeps reading; {@code logout} or end of input ends it.
 */
final class ConsoleSession {
    private static final List<String> MANAGER_HELP = List.of(
            "tasks [status]",
            "workers",
            "assign <workerId> <description...>",
            "violation <taskId> <status> <comment...>",
            "delete-task <taskId>",
            "reports <taskId>",
            "rules",
            "add-rule <text...>",
            "delete-rule <ruleId>",
            "feedback",
            "help",
            "logout"
    );
    private static final List<String> WORKER_HELP = List.of(
            "tasks",
            "report <taskId> <mediaPath> <text...>   (quote a path that has spaces)",
            "status <submissionId>",
            "retry <submissionId>",
            "rules",
            "feedback",
            "give-feedback <ruleId> <text...>",
            "help",
            "logout"
    );

    private final Desk desk;
    private final BufferedReader in;
    private final PrintWriter out;
    private final boolean readOnly;
    private boolean open;

    ConsoleSession(Desk desk, BufferedReader in, PrintWriter out, boolean readOnly) {
        this.desk = desk;
        this.in = in;
        this.out = out;
        this.readOnly = readOnly;
        this.open = true;
    }

    void run() {
        out.println("Signed in as " + desk.actor().username() + " (" + desk.actor().role().dbValue() + "). Type 'help' for commands.");
        while (open) {
            out.print(desk.actor().username() + "> ");
            out.flush();
            String line;
            try {
                line = in.readLine();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read console input", e);
            }
            if (line == null) {
                break;
            }
            CommandOutcome outcome = execute(line);
            if (outcome != null) {
                out.println(outcome.success() ? outcome.detail() : "Error: " + outcome.detail());
                out.flush();
            }
        }
        out.println("Logged out.");
        out.flush();
    }

    boolean isOpen() {
        return open;
    }

    /** Runs one command line; returns null for a blank line. */
    CommandOutcome execute(String line) {
        List<String> tokens = ConsoleCommandParser.parseTokens(line);
        if (tokens.isEmpty()) {
            return null;
        }
        String op = tokens.get(0).toLowerCase(Locale.ROOT);
        if (readOnly && ConsoleCommandParser.isWriteCommand(op)) {
            return CommandOutcome.rejected("Session is read-only: " + op);
        }
        try {
            switch (op) {
                case "help" -> {
                    return CommandOutcome.ok(String.join("\n", desk instanceof ManagerDesk ? MANAGER_HELP : WORKER_HELP));
                }
                case "logout", "exit", "quit" -> {
                    open = false;
                    return CommandOutcome.ok("Bye.");
                }
                case "rules" -> {
                    return CommandOutcome.ok(TextViews.rules(desk.listRules()));
                }
                case "feedback" -> {
                    return CommandOutcome.ok(TextViews.feedback(desk.listFeedback()));
                }
                default -> {
                    if (desk instanceof ManagerDesk) {
                        return managerCommand((ManagerDesk) desk, op, tokens);
                    }
                    return workerCommand((WorkerDesk) desk, op, tokens);
                }
            }
        } catch (EhsDeskException e) {
            return CommandOutcome.rejected(e.getMessage());
        }
    }

    private CommandOutcome managerCommand(ManagerDesk manager, String op, List<String> tokens) {
        switch (op) {
            case "tasks" -> {
                return CommandOutcome.ok(TextViews.managerTasks(tokens.size() > 1
                        ? manager.listTasksByStatus(tokens.get(1))
                        : manager.listTasks()));
            }
            case "workers" -> {
                return CommandOutcome.ok(TextViews.workers(manager.listWorkers()));
            }
            case "assign" -> {
                long workerId = ConsoleCommandParser.parseId(tokens, 1, "worker id");
                long taskId = manager.assignTask(workerId, ConsoleCommandParser.joinTail(tokens, 2));
                return CommandOutcome.ok("Task " + taskId + " assigned successfully.");
            }
            case "violation" -> {
                long taskId = ConsoleCommandParser.parseId(tokens, 1, "task id");
                String status = tokens.size() > 2 ? tokens.get(2) : "";
                manager.reportViolation(taskId, status, ConsoleCommandParser.joinTail(tokens, 3));
                return CommandOutcome.ok("Task " + taskId + " updated with violation info.");
            }
            case "delete-task" -> {
                long taskId = ConsoleCommandParser.parseId(tokens, 1, "task id");
                manager.deleteTask(taskId);
                return CommandOutcome.ok("Task " + taskId + " deleted successfully.");
            }
            case "reports" -> {
                long taskId = ConsoleCommandParser.parseId(tokens, 1, "task id");
                return CommandOutcome.ok(TextViews.submissions(manager.reportSubmissions(taskId)));
            }
            case "add-rule" -> {
                long ruleId = manager.addRule(ConsoleCommandParser.joinTail(tokens, 1));
                return CommandOutcome.ok("Rule " + ruleId + " added successfully.");
            }
            case "delete-rule" -> {
                long ruleId = ConsoleCommandParser.parseId(tokens, 1, "rule id");
                manager.deleteRule(ruleId);
                return CommandOutcome.ok("Rule " + ruleId + " deleted successfully.");
            }
            default -> {
                return unknown(op);
            }
        }
    }

    private CommandOutcome workerCommand(WorkerDesk worker, String op, List<String> tokens) {
        switch (op) {
            case "tasks" -> {
                return CommandOutcome.ok(TextViews.workerTasks(worker.listTasks()));
            }
            case "report" -> {
                long taskId = ConsoleCommandParser.parseId(tokens, 1, "task id");
                String mediaPath = tokens.size() > 2 ? tokens.get(2) : "";
                ReportHandle handle = worker.submitReport(taskId, ConsoleCommandParser.joinTail(tokens, 3), mediaPath);
                return CommandOutcome.ok("Report " + handle.submissionId() + " queued for task " + taskId
                        + ". Check progress with: status " + handle.submissionId());
            }
            case "status" -> {
                ReportSubmission submission = worker.reportStatus(ConsoleCommandParser.parseId(tokens, 1, "submission id"));
                return CommandOutcome.ok(TextViews.submission(submission));
            }
            case "retry" -> {
                ReportHandle handle = worker.retryReport(ConsoleCommandParser.parseId(tokens, 1, "submission id"));
                return CommandOutcome.ok("Report " + handle.submissionId() + " queued again for task " + handle.taskId() + ".");
            }
            case "give-feedback" -> {
                long ruleId = ConsoleCommandParser.parseId(tokens, 1, "rule id");
                worker.giveFeedback(ruleId, ConsoleCommandParser.joinTail(tokens, 2));
                return CommandOutcome.ok("Feedback submitted successfully.");
            }
            default -> {
                return unknown(op);
            }
        }
    }

    private static CommandOutcome unknown(String op) {
        return CommandOutcome.rejected("Unknown command '" + op + "'. Type 'help' for commands.");
    }
}
