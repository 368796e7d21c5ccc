package com.alertaggregator.domain.model;

import com.alertaggregator.domain.enums.AlertSeverity;
import com.alertaggregator.domain.enums.AlertStatus;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Data;
import lombok.Setter;

/**
 * Domain model for a normalized alert.
 *
 * <p>An alert is created by a collector from heterogeneous input, handed to the
 * {@code AlertAggregator}, and then either merged into an already-active alert with the same
 * fingerprint (and discarded) or persisted as the new record of truth.
 *
 * <p>Key fields:
 * <ul>
 *   <li>{@code id} -- generated UUID, distinct from the deduplication fingerprint</li>
 *   <li>{@code fingerprint} -- stable hash of (source, severity, title, message), see
 *       {@link AlertFingerprint}</li>
 *   <li>{@code duplicateCount} -- starts at 1, incremented once per merged duplicate</li>
 *   <li>{@code firstSeen}/{@code lastSeen} -- default to {@code timestamp}; merges only extend
 *       {@code lastSeen}</li>
 * </ul>
 *
 * <p>Only the aggregator mutates status and lifecycle fields after creation. Content fields
 * (source, severity, title, message) are never rewritten once stored.
 */
@Data
@Builder
public class Alert {

    private String id;

    private String source;

    private AlertSeverity severity;

    private String title;

    private String message;

    private Instant timestamp;

    @Builder.Default
    private AlertStatus status = AlertStatus.NEW;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    /** Loosely-typed values: string, number, boolean, nested map or list. Insertion order is kept. */
    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    /** Derived from the content fields; recomputed by {@link #ensureDefaults}. */
    @Setter(AccessLevel.NONE)
    private String fingerprint;

    @Builder.Default
    private int duplicateCount = 1;

    private Instant firstSeen;

    private Instant lastSeen;

    private Instant acknowledgedAt;

    private Instant resolvedAt;

    private String acknowledgedBy;

    /**
     * Creates a new alert with a fresh id and computed fingerprint.
     */
    public static Alert create(
            String source,
            AlertSeverity severity,
            String title,
            String message,
            List<String> tags,
            Map<String, Object> metadata,
            Instant timestamp) {
        Alert alert = Alert.builder()
                .id(UUID.randomUUID().toString())
                .source(source)
                .severity(severity)
                .title(title)
                .message(message)
                .timestamp(timestamp)
                .tags(tags != null ? new ArrayList<>(tags) : new ArrayList<>())
                .metadata(metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>())
                .build();
        alert.ensureDefaults(timestamp);
        return alert;
    }

    /**
     * Fills fields left empty by a hand-built alert: id, timestamps, status and mutable copies of
     * the collections. The fingerprint is always recomputed from the content fields.
     *
     * @param now used when the alert carries no timestamp
     */
    public void ensureDefaults(Instant now) {
        if (id == null || id.isBlank()) {
            id = UUID.randomUUID().toString();
        }
        if (timestamp == null) {
            timestamp = now;
        }
        fingerprint = AlertFingerprint.of(this);
        if (firstSeen == null) {
            firstSeen = timestamp;
        }
        if (lastSeen == null) {
            lastSeen = timestamp;
        }
        if (status == null) {
            status = AlertStatus.NEW;
        }
        if (duplicateCount < 1) {
            duplicateCount = 1;
        }
        tags = tags != null ? new ArrayList<>(tags) : new ArrayList<>();
        metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
    }

    /**
     * Folds a duplicate occurrence into this alert. Existing metadata keys are never overwritten.
     */
    public void mergeDuplicate(Alert other) {
        duplicateCount++;

        Instant current = lastSeen != null ? lastSeen : timestamp;
        Instant incoming = other.getTimestamp();
        if (incoming != null && (current == null || incoming.isAfter(current))) {
            lastSeen = incoming;
        } else {
            lastSeen = current;
        }

        if (other.getMetadata() != null) {
            other.getMetadata().forEach((key, value) -> {
                if (!metadata.containsKey(key)) {
                    metadata.put(key, value);
                }
            });
        }
    }

    /** Independent copy; the tag list and metadata map are copied, their values are shared. */
    public Alert copy() {
        return Alert.builder()
                .id(id)
                .source(source)
                .severity(severity)
                .title(title)
                .message(message)
                .timestamp(timestamp)
                .status(status)
                .tags(tags != null ? new ArrayList<>(tags) : new ArrayList<>())
                .metadata(metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>())
                .fingerprint(fingerprint)
                .duplicateCount(duplicateCount)
                .firstSeen(firstSeen)
                .lastSeen(lastSeen)
                .acknowledgedAt(acknowledgedAt)
                .resolvedAt(resolvedAt)
                .acknowledgedBy(acknowledgedBy)
                .build();
    }

    /**
     * Takes over the fields that change after insert (status, occurrence count, last seen,
     * acknowledgement, resolution and metadata) from {@code other}.
     */
    public void applyMutableState(Alert other) {
        status = other.getStatus();
        duplicateCount = other.getDuplicateCount();
        lastSeen = other.getLastSeen();
        acknowledgedAt = other.getAcknowledgedAt();
        resolvedAt = other.getResolvedAt();
        acknowledgedBy = other.getAcknowledgedBy();
        metadata = other.getMetadata() != null ? new LinkedHashMap<>(other.getMetadata()) : new LinkedHashMap<>();
    }

    public void acknowledge(String by, Instant at) {
        status = AlertStatus.ACKNOWLEDGED;
        acknowledgedAt = at;
        acknowledgedBy = by;
    }

    public void markInProgress() {
        status = AlertStatus.IN_PROGRESS;
    }

    public void resolve(Instant at) {
        status = AlertStatus.RESOLVED;
        resolvedAt = at;
    }

    public void dismiss() {
        status = AlertStatus.DISMISSED;
    }

    public boolean isActive() {
        return status != null && !status.isTerminal();
    }

    /**
     * Flat, ordered representation with wire-format enum values and ISO-8601 timestamps.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", id);
        map.put("source", source);
        map.put("severity", severity != null ? severity.getValue() : null);
        map.put("title", title);
        map.put("message", message);
        map.put("timestamp", iso(timestamp));
        map.put("status", status != null ? status.getValue() : null);
        map.put("tags", tags != null ? List.copyOf(tags) : List.of());
        map.put("metadata", metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>());
        map.put("fingerprint", fingerprint);
        map.put("duplicate_count", duplicateCount);
        map.put("first_seen", iso(firstSeen));
        map.put("last_seen", iso(lastSeen));
        map.put("acknowledged_at", iso(acknowledgedAt));
        map.put("resolved_at", iso(resolvedAt));
        map.put("acknowledged_by", acknowledgedBy);
        return map;
    }

    private static String iso(Instant instant) {
        return instant != null ? instant.toString() : null;
    }
}
