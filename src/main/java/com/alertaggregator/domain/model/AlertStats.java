package com.alertaggregator.domain.model;

import com.alertaggregator.domain.enums.AlertSeverity;
import com.alertaggregator.domain.enums.AlertStatus;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;

/**
 * Cumulative ingest statistics owned by one aggregator instance.
 *
 * <p>{@link #record(Alert)} runs exactly once per uniquely-ingested alert and
 * {@link #recordDuplicate()} once per merge, so {@code totalAlerts} counts distinct alerts and
 * {@code duplicatesMerged} counts folded occurrences. Status counts reflect the status at
 * ingest time; later lifecycle changes do not move them.
 *
 * <p>Not thread-safe on its own: the aggregator updates it under its ingest lock and hands out
 * {@link #snapshot()} copies.
 */
@Getter
public class AlertStats {

    private long totalAlerts;
    private long duplicatesMerged;
    private final Map<AlertSeverity, Long> bySeverity = new LinkedHashMap<>();
    private final Map<AlertStatus, Long> byStatus = new LinkedHashMap<>();
    private final Map<String, Long> bySource = new LinkedHashMap<>();

    public AlertStats() {
        for (AlertSeverity severity : AlertSeverity.values()) {
            bySeverity.put(severity, 0L);
        }
        for (AlertStatus status : AlertStatus.values()) {
            byStatus.put(status, 0L);
        }
    }

    public void record(Alert alert) {
        totalAlerts++;
        bySeverity.merge(alert.getSeverity(), 1L, Long::sum);
        byStatus.merge(alert.getStatus(), 1L, Long::sum);
        bySource.merge(alert.getSource(), 1L, Long::sum);
    }

    public void recordDuplicate() {
        duplicatesMerged++;
    }

    /** Merged duplicates per distinct alert; 0 when nothing has been ingested. */
    public double getDeduplicationRate() {
        return totalAlerts > 0 ? (double) duplicatesMerged / totalAlerts : 0.0;
    }

    public AlertStats snapshot() {
        AlertStats copy = new AlertStats();
        copy.totalAlerts = totalAlerts;
        copy.duplicatesMerged = duplicatesMerged;
        copy.bySeverity.putAll(bySeverity);
        copy.byStatus.putAll(byStatus);
        copy.bySource.putAll(bySource);
        return copy;
    }

    public Map<String, Object> toMap() {
        Map<String, Long> severities = new LinkedHashMap<>();
        bySeverity.forEach((severity, count) -> severities.put(severity.getValue(), count));

        Map<String, Long> statuses = new LinkedHashMap<>();
        byStatus.forEach((status, count) -> statuses.put(status.getValue(), count));

        Map<String, Object> map = new LinkedHashMap<>();
        map.put("total_alerts", totalAlerts);
        map.put("by_severity", severities);
        map.put("by_status", statuses);
        map.put("by_source", new LinkedHashMap<>(bySource));
        map.put("duplicates_merged", duplicatesMerged);
        map.put("deduplication_rate", getDeduplicationRate());
        return map;
    }
}
