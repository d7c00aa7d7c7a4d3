package io.ehsdesk.cli;

/** Result of one CLI or console operation: a success flag, a line for humans and optional data for {@code --json}. */
record CommandOutcome(boolean success, String detail, Object data) {
    static CommandOutcome ok(String detail) {
        return new CommandOutcome(true, detail, null);
    }

    static CommandOutcome ok(String detail, Object data) {
        return new CommandOutcome(true, detail, data);
    }

    static CommandOutcome rejected(String detail) {
        return new CommandOutcome(false, detail, null);
    }
}
