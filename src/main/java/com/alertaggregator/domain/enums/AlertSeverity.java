package com.alertaggregator.domain.enums;

import com.alertaggregator.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Severity level for alerts, ordered from least to most severe.
 *
 * <p>Declaration order is significant: {@link #isAtLeast(AlertSeverity)} and filtering by
 * minimum severity rely on ordinal ordering (DEBUG &lt; INFO &lt; WARNING &lt; ERROR &lt; CRITICAL).
 *
 * <p>Default channel routing:
 * <ul>
 *   <li>CRITICAL: all channels (console + file + webhook + email)</li>
 *   <li>ERROR: console + file + webhook</li>
 *   <li>WARNING: console + file</li>
 *   <li>INFO: console only</li>
 *   <li>DEBUG: file only</li>
 * </ul>
 */
public enum AlertSeverity {
    DEBUG("debug"),
    INFO("info"),
    WARNING("warning"),
    ERROR("error"),
    CRITICAL("critical");

    private final String value;

    AlertSeverity(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isAtLeast(AlertSeverity other) {
        return ordinal() >= other.ordinal();
    }

    /**
     * Parses a wire value ("warning") or constant name ("WARNING"), ignoring case.
     *
     * @throws ValidationException for null, blank, or unknown input
     */
    @JsonCreator
    public static AlertSeverity fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException("Alert severity is required");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (AlertSeverity severity : values()) {
            if (severity.value.equals(normalized)) {
                return severity;
            }
        }
        throw new ValidationException("Unknown alert severity: " + raw);
    }
}
