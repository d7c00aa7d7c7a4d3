package io.ehsdesk.model;

import java.util.Locale;

public enum ReportState {
    QUEUED,
    TRANSFERRING,
    COMMITTED,
    FAILED;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ReportState fromString(String raw) {
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
