package com.alertaggregator.domain.enums;

import com.alertaggregator.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Alert lifecycle status.
 *
 * <p>Transitions are not enforced: every explicit lifecycle call sets its status
 * unconditionally. RESOLVED and DISMISSED are terminal in the sense that they drop the alert
 * from the active deduplication set.
 */
public enum AlertStatus {
    NEW("new"),
    ACKNOWLEDGED("acknowledged"),
    IN_PROGRESS("in_progress"),
    RESOLVED("resolved"),
    DISMISSED("dismissed");

    private final String value;

    AlertStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == RESOLVED || this == DISMISSED;
    }

    @JsonCreator
    public static AlertStatus fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException("Alert status is required");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (AlertStatus status : values()) {
            if (status.value.equals(normalized)) {
                return status;
            }
        }
        throw new ValidationException("Unknown alert status: " + raw);
    }
}
