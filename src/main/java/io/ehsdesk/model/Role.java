package io.ehsdesk.model;

import io.ehsdesk.error.ValidationException;

public enum Role {
    MANAGER("manager"),
    WORKER("worker");

    private final String dbValue;

    Role(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }

    public static Role fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException("Role cannot be empty, expected 'worker' or 'manager'");
        }
        for (Role value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim()) || value.dbValue.equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new ValidationException("Invalid role: " + raw + ", expected 'worker' or 'manager'");
    }
}
