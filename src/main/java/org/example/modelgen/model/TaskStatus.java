package org.example.modelgen.model;

import java.util.Locale;

/**
 * Status of a generation task as reported by the external service.
 * Unrecognized values parse to {@link #PROCESSING} so polling continues.
 */
public enum TaskStatus {
    QUEUED("queued"),
    PROCESSING("processing"),
    SUCCESS("success"),
    FAILED("failed"),
    CANCELLED("cancelled"),
    TIMEOUT("timeout");

    private final String value;

    TaskStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED || this == CANCELLED || this == TIMEOUT;
    }

    public static TaskStatus parse(String raw) {
        TaskStatus known = lookup(raw);
        return known != null ? known : PROCESSING;
    }

    public static boolean isRecognized(String raw) {
        return lookup(raw) != null;
    }

    /**
     * True when the raw string names one of the terminal statuses.
     */
    public static boolean isTerminalValue(String raw) {
        TaskStatus known = lookup(raw);
        return known != null && known.isTerminal();
    }

    private static TaskStatus lookup(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (TaskStatus status : values()) {
            if (status.value.equals(normalized)) {
                return status;
            }
        }
        return null;
    }
}
