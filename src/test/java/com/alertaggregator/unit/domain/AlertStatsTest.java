package com.alertaggregator.unit.domain;

import static org.assertj.core.api.Assertions.assertThat;

import com.alertaggregator.domain.enums.AlertSeverity;
import com.alertaggregator.domain.enums.AlertStatus;
import com.alertaggregator.domain.model.Alert;
import com.alertaggregator.domain.model.AlertStats;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AlertStatsTest {

    private Alert alert(String source, AlertSeverity severity) {
        return Alert.create(source, severity, "t", "m", null, null, Instant.parse("2026-01-10T10:00:00Z"));
    }

    @Test
    void newStats_allCountersZero() {
        AlertStats stats = new AlertStats();

        assertThat(stats.getTotalAlerts()).isZero();
        assertThat(stats.getBySeverity()).containsOnlyKeys(AlertSeverity.values()).doesNotContainValue(1L);
        assertThat(stats.getByStatus()).containsOnlyKeys(AlertStatus.values());
        assertThat(stats.getDeduplicationRate()).isZero();
    }

    @Test
    void record_countsSeverityStatusAndSource() {
        AlertStats stats = new AlertStats();

        stats.record(alert("db", AlertSeverity.ERROR));
        stats.record(alert("db", AlertSeverity.WARNING));
        stats.record(alert("api", AlertSeverity.ERROR));

        assertThat(stats.getTotalAlerts()).isEqualTo(3);
        assertThat(stats.getBySeverity())
                .containsEntry(AlertSeverity.ERROR, 2L)
                .containsEntry(AlertSeverity.WARNING, 1L);
        assertThat(stats.getByStatus()).containsEntry(AlertStatus.NEW, 3L);
        assertThat(stats.getBySource()).containsEntry("db", 2L).containsEntry("api", 1L);
    }

    @Test
    void deduplicationRate_isDuplicatesPerDistinctAlert() {
        AlertStats stats = new AlertStats();
        stats.record(alert("db", AlertSeverity.ERROR));
        stats.record(alert("api", AlertSeverity.ERROR));
        stats.recordDuplicate();

        assertThat(stats.getDuplicatesMerged()).isEqualTo(1);
        assertThat(stats.getDeduplicationRate()).isEqualTo(0.5);
    }

    @Test
    void snapshot_isIndependentCopy() {
        AlertStats stats = new AlertStats();
        stats.record(alert("db", AlertSeverity.ERROR));

        AlertStats snapshot = stats.snapshot();
        stats.record(alert("db", AlertSeverity.ERROR));

        assertThat(snapshot.getTotalAlerts()).isEqualTo(1);
        assertThat(snapshot.getBySource()).containsEntry("db", 1L);
    }

    @Test
    @SuppressWarnings("unchecked")
    void toMap_usesWireKeys() {
        AlertStats stats = new AlertStats();
        stats.record(alert("db", AlertSeverity.CRITICAL));

        Map<String, Object> map = stats.toMap();

        assertThat(map)
                .containsOnlyKeys(
                        "total_alerts",
                        "by_severity",
                        "by_status",
                        "by_source",
                        "duplicates_merged",
                        "deduplication_rate");
        assertThat((Map<String, Long>) map.get("by_severity")).containsEntry("critical", 1L);
        assertThat((Map<String, Long>) map.get("by_status")).containsEntry("new", 1L);
    }
}
