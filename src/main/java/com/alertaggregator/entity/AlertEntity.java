package com.alertaggregator.entity;

import com.alertaggregator.domain.enums.AlertSeverity;
import com.alertaggregator.domain.enums.AlertStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the alerts table.
 *
 * <p>One row per distinct alert ever ingested, keyed by the generated alert id. Merged
 * duplicates never get a row of their own; they only bump {@code duplicateCount} and
 * {@code lastSeen} on the row they were folded into.
 *
 * <p>Secondary indexes cover the query filters (severity, status, source), the newest-first
 * ordering (timestamp) and fingerprint lookups. Free-text columns carry no length limit; source
 * is an unbounded varchar so it stays indexable. Tags and metadata are JSON text columns.
 */
@Entity
@Table(
        name = "alerts",
        indexes = {
            @Index(name = "idx_alerts_severity", columnList = "severity"),
            @Index(name = "idx_alerts_status", columnList = "status"),
            @Index(name = "idx_alerts_source", columnList = "source"),
            @Index(name = "idx_alerts_timestamp", columnList = "timestamp"),
            @Index(name = "idx_alerts_fingerprint", columnList = "fingerprint")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AlertEntity {

    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(name = "source", nullable = false, columnDefinition = "varchar")
    private String source;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false, columnDefinition = "varchar(20)")
    private AlertSeverity severity;

    @Column(name = "title", nullable = false, columnDefinition = "TEXT")
    private String title;

    @Column(name = "message", nullable = false, columnDefinition = "TEXT")
    private String message;

    @Column(name = "timestamp", nullable = false)
    private Instant timestamp;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, columnDefinition = "varchar(20)")
    private AlertStatus status;

    /** JSON array of tag strings. */
    @Column(name = "tags", columnDefinition = "TEXT")
    private String tags;

    /** JSON object, key order preserved. */
    @Column(name = "metadata", columnDefinition = "TEXT")
    private String metadata;

    @Column(name = "fingerprint", length = 64)
    private String fingerprint;

    @Column(name = "duplicate_count", nullable = false)
    private int duplicateCount;

    @Column(name = "first_seen")
    private Instant firstSeen;

    @Column(name = "last_seen")
    private Instant lastSeen;

    @Column(name = "acknowledged_at")
    private Instant acknowledgedAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(name = "acknowledged_by", columnDefinition = "TEXT")
    private String acknowledgedBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
