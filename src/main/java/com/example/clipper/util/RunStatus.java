package com.example.clipper.util;

import java.util.Locale;

/**
 * Lifecycle of a remote workflow run as the platform reports it.
 */
public enum RunStatus {
    UNKNOWN,
    QUEUED,
    IN_PROGRESS,
    COMPLETED;

    public static RunStatus fromRemote(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "queued", "requested", "waiting", "pending" -> QUEUED;
            case "in_progress" -> IN_PROGRESS;
            case "completed" -> COMPLETED;
            default -> UNKNOWN;
        };
    }
}
