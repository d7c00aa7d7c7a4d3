package io.ehsdesk.cli;

import io.ehsdesk.error.ValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

final class ConsoleCommandParser {
    private static final Set<String> WRITE_COMMANDS = Set.of(
            "assign",
            "violation",
            "report",
            "retry",
            "add-rule",
            "delete-rule",
            "delete-task",
            "give-feedback"
    );

    private ConsoleCommandParser() {
    }

    /** Splits on whitespace; a double-quoted run is one token, so paths may contain spaces. */
    static List<String> parseTokens(String raw) {
        List<String> out = new ArrayList<>();
        if (raw == null || raw.isBlank()) {
            return out;
        }
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        boolean pending = false;
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c == '"') {
                quoted = !quoted;
                pending = true;
            } else if (!quoted && Character.isWhitespace(c)) {
                if (pending) {
                    out.add(current.toString());
                    current.setLength(0);
                    pending = false;
                }
            } else {
                current.append(c);
                pending = true;
            }
        }
        if (pending) {
            out.add(current.toString());
        }
        return out;
    }

    static String joinTail(List<String> tokens, int startIndex) {
        if (tokens == null || tokens.isEmpty() || startIndex >= tokens.size()) {
            return "";
        }
        return String.join(" ", tokens.subList(startIndex, tokens.size()));
    }

    static boolean isWriteCommand(String op) {
        if (op == null || op.isBlank()) {
            return false;
        }
        return WRITE_COMMANDS.contains(op.trim().toLowerCase(Locale.ROOT));
    }

    /** Parses a numeric id argument; the label names it in the error. */
    static long parseId(List<String> tokens, int index, String label) {
        if (tokens == null || index >= tokens.size()) {
            throw new ValidationException("Missing " + label);
        }
        String raw = tokens.get(index);
        try {
            long value = Long.parseLong(raw);
            if (value <= 0L) {
                throw new ValidationException("Invalid " + label + ": " + raw);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new ValidationException("Invalid " + label + ": " + raw);
        }
    }
}
