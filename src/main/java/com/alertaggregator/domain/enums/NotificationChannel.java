package com.alertaggregator.domain.enums;

import com.alertaggregator.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Delivery channels an alert can be routed to. The engine only names them; senders live in
 * the host application.
 */
public enum NotificationChannel {
    CONSOLE("console"),
    FILE("file"),
    WEBHOOK("webhook"),
    EMAIL("email");

    private final String value;

    NotificationChannel(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static NotificationChannel fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException("Notification channel is required");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (NotificationChannel channel : values()) {
            if (channel.value.equals(normalized)) {
                return channel;
            }
        }
        throw new ValidationException("Unknown notification channel: " + raw);
    }
}
