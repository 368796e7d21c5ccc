package com.alertaggregator.unit.mapper;

import static org.assertj.core.api.Assertions.assertThat;

import com.alertaggregator.domain.enums.AlertSeverity;
import com.alertaggregator.domain.enums.AlertStatus;
import com.alertaggregator.domain.model.Alert;
import com.alertaggregator.entity.AlertEntity;
import com.alertaggregator.mapper.AlertMapper;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.mapstruct.factory.Mappers;

/**
 * Unit tests for AlertMapper: JSON columns for tags and metadata, lifecycle fields and nulls.
 */
class AlertMapperTest {

    private final AlertMapper alertMapper = Mappers.getMapper(AlertMapper.class);

    @Test
    void toEntity_serializesTagsAndMetadataAsJson() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("host", "db-1");
        metadata.put("retries", 3);
        Alert alert = Alert.create(
                "db",
                AlertSeverity.ERROR,
                "connection lost",
                "timeout",
                List.of("prod", "eu"),
                metadata,
                Instant.parse("2026-01-10T10:00:00Z"));

        AlertEntity entity = alertMapper.toEntity(alert);

        assertThat(entity.getId()).isEqualTo(alert.getId());
        assertThat(entity.getSeverity()).isEqualTo(AlertSeverity.ERROR);
        assertThat(entity.getTags()).isEqualTo("[\"prod\",\"eu\"]");
        assertThat(entity.getMetadata()).isEqualTo("{\"host\":\"db-1\",\"retries\":3}");
        assertThat(entity.getFingerprint()).isEqualTo(alert.getFingerprint());
        assertThat(entity.getDuplicateCount()).isEqualTo(1);
    }

    @Test
    void toDomain_restoresCollectionsAndLifecycle() {
        Instant t = Instant.parse("2026-01-10T10:00:00Z");
        AlertEntity entity = AlertEntity.builder()
                .id("a-1")
                .source("db")
                .severity(AlertSeverity.WARNING)
                .title("disk")
                .message("90% full")
                .timestamp(t)
                .status(AlertStatus.ACKNOWLEDGED)
                .tags("[\"prod\"]")
                .metadata("{\"mount\":\"/var\",\"nested\":{\"a\":1}}")
                .fingerprint("0123456789abcdef")
                .duplicateCount(4)
                .firstSeen(t)
                .lastSeen(t.plusSeconds(90))
                .acknowledgedAt(t.plusSeconds(100))
                .acknowledgedBy("alice")
                .build();

        Alert alert = alertMapper.toDomain(entity);

        assertThat(alert.getTags()).containsExactly("prod");
        assertThat(alert.getMetadata()).containsEntry("mount", "/var").containsKey("nested");
        assertThat(alert.getStatus()).isEqualTo(AlertStatus.ACKNOWLEDGED);
        assertThat(alert.getDuplicateCount()).isEqualTo(4);
        assertThat(alert.getLastSeen()).isEqualTo(t.plusSeconds(90));
        assertThat(alert.getAcknowledgedBy()).isEqualTo("alice");
        assertThat(alert.getResolvedAt()).isNull();
    }

    @Test
    void toDomain_nullJsonColumns_emptyCollections() {
        AlertEntity entity = AlertEntity.builder()
                .id("a-2")
                .source("db")
                .severity(AlertSeverity.INFO)
                .title("t")
                .message("m")
                .timestamp(Instant.parse("2026-01-10T10:00:00Z"))
                .status(AlertStatus.NEW)
                .build();

        Alert alert = alertMapper.toDomain(entity);

        assertThat(alert.getTags()).isEmpty();
        assertThat(alert.getMetadata()).isEmpty();
    }

    @Test
    void toEntity_nullAlert_returnsNull() {
        assertThat(alertMapper.toEntity(null)).isNull();
    }
}
