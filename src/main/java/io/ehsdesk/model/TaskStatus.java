package io.ehsdesk.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Known task status values. The tasks table stores free text, so a manager may also write a
 * custom status through a violation report; those rows do not map to a constant here.
 */
public enum TaskStatus {
    PENDING("pending"),
    COMPLETED("completed"),
    VIOLATION("violation"),
    INCOMPLETE("incomplete");

    private final String value;

    TaskStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public boolean matches(String raw) {
        return raw != null && value.equalsIgnoreCase(raw.trim());
    }

    public static Optional<TaskStatus> known(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (TaskStatus status : values()) {
            if (status.value.equals(normalized)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
