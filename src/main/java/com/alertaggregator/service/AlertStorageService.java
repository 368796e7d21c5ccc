package com.alertaggregator.service;

import com.alertaggregator.domain.enums.AlertSeverity;
import com.alertaggregator.domain.enums.AlertStatus;
import com.alertaggregator.domain.model.Alert;
import com.alertaggregator.domain.model.StorageStats;
import com.alertaggregator.entity.AlertEntity;
import com.alertaggregator.exception.AlertStorageException;
import com.alertaggregator.exception.DuplicateAlertException;
import com.alertaggregator.exception.ValidationException;
import com.alertaggregator.mapper.AlertMapper;
import com.alertaggregator.repository.jpa.AlertJpaRepository;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Durable alert history on top of {@link AlertJpaRepository}.
 *
 * <p>Each public method runs in its own transaction, so a write is committed before the call
 * returns. Only the lifecycle columns are ever updated after insert, and only RESOLVED rows are
 * ever deleted (by {@link #cleanupOld}).
 *
 * <p>Persistence failures surface as {@link AlertStorageException}; only a primary key
 * violation on insert is reported as {@link DuplicateAlertException}.
 */
@Service
public class AlertStorageService {

    private static final Logger log = LoggerFactory.getLogger(AlertStorageService.class);

    /** SQL standard state for a primary key or unique constraint violation. */
    private static final String UNIQUE_VIOLATION_SQL_STATE = "23505";

    private static final EnumSet<AlertStatus> ACTIVE_STATUSES =
            EnumSet.of(AlertStatus.NEW, AlertStatus.ACKNOWLEDGED, AlertStatus.IN_PROGRESS);

    private final AlertJpaRepository alertJpaRepository;
    private final Clock clock;
    private final AlertMapper alertMapper = Mappers.getMapper(AlertMapper.class);

    public AlertStorageService(AlertJpaRepository alertJpaRepository, Clock clock) {
        this.alertJpaRepository = alertJpaRepository;
        this.clock = clock;
    }

    /**
     * Inserts a new alert.
     *
     * @throws DuplicateAlertException if a row with the same id already exists
     */
    @Transactional
    public void storeAlert(Alert alert) {
        try {
            if (alertJpaRepository.existsById(alert.getId())) {
                throw new DuplicateAlertException(alert.getId());
            }
            alertJpaRepository.saveAndFlush(alertMapper.toEntity(alert));
            log.debug("Stored alert {} ({}/{})", alert.getId(), alert.getSource(), alert.getSeverity());
        } catch (DataIntegrityViolationException e) {
            if (isKeyViolation(e)) {
                throw new DuplicateAlertException(alert.getId());
            }
            throw new AlertStorageException("Failed to store alert " + alert.getId(), e);
        } catch (DataAccessException e) {
            throw new AlertStorageException("Failed to store alert " + alert.getId(), e);
        }
    }

    private static boolean isKeyViolation(DataIntegrityViolationException e) {
        if (e instanceof DuplicateKeyException) {
            return true;
        }
        Throwable cause = NestedExceptionUtils.getMostSpecificCause(e);
        return cause instanceof SQLException sqlException
                && UNIQUE_VIOLATION_SQL_STATE.equals(sqlException.getSQLState());
    }

    /**
     * Rewrites the lifecycle columns of an existing row.
     *
     * @return false if no row has the alert's id
     */
    @Transactional
    public boolean updateAlert(Alert alert) {
        try {
            int updated = alertJpaRepository.updateMutableFields(
                    alert.getId(),
                    alert.getStatus(),
                    alert.getDuplicateCount(),
                    alert.getLastSeen(),
                    alert.getAcknowledgedAt(),
                    alert.getResolvedAt(),
                    alert.getAcknowledgedBy(),
                    alertMapper.metadataToJson(alert.getMetadata()));
            return updated > 0;
        } catch (DataAccessException e) {
            throw new AlertStorageException("Failed to update alert " + alert.getId(), e);
        }
    }

    @Transactional(readOnly = true)
    public Optional<Alert> getAlert(String id) {
        if (id == null) {
            return Optional.empty();
        }
        try {
            return alertJpaRepository.findById(id).map(alertMapper::toDomain);
        } catch (DataAccessException e) {
            throw new AlertStorageException("Failed to load alert " + id, e);
        }
    }

    /**
     * Returns up to {@code limit} alerts, newest first. Null filters match everything.
     */
    @Transactional(readOnly = true)
    public List<Alert> queryAlerts(AlertSeverity severity, AlertStatus status, String source, int limit) {
        if (limit <= 0) {
            throw new ValidationException("Query limit must be positive", Map.of("limit", limit));
        }
        try {
            List<AlertEntity> entities =
                    alertJpaRepository.search(severity, status, source, PageRequest.of(0, limit));
            return alertMapper.toDomainList(entities);
        } catch (DataAccessException e) {
            throw new AlertStorageException("Failed to query alerts", e);
        }
    }

    /**
     * Deletes RESOLVED alerts whose resolution is older than the retention period.
     *
     * @return number of rows deleted
     */
    @Transactional
    public int cleanupOld(int retentionDays) {
        if (retentionDays < 0) {
            throw new ValidationException(
                    "Retention days must not be negative", Map.of("retentionDays", retentionDays));
        }
        Instant cutoff = clock.instant().minus(Duration.ofDays(retentionDays));
        try {
            int deleted = alertJpaRepository.deleteByStatusAndResolvedAtBefore(AlertStatus.RESOLVED, cutoff);
            log.info("Deleted {} resolved alerts older than {} days (cutoff={})", deleted, retentionDays, cutoff);
            return deleted;
        } catch (DataAccessException e) {
            throw new AlertStorageException("Failed to clean up resolved alerts", e);
        }
    }

    /** Active alerts with a timestamp at or after {@code since}, oldest first. */
    @Transactional(readOnly = true)
    public List<Alert> findActiveSince(Instant since) {
        try {
            return alertMapper.toDomainList(
                    alertJpaRepository.findByStatusInAndTimestampGreaterThanEqualOrderByTimestampAsc(
                            ACTIVE_STATUSES, since));
        } catch (DataAccessException e) {
            throw new AlertStorageException("Failed to load active alerts", e);
        }
    }

    @Transactional(readOnly = true)
    public StorageStats getStorageStats() {
        try {
            Map<AlertSeverity, Long> bySeverity = new EnumMap<>(AlertSeverity.class);
            for (AlertSeverity severity : AlertSeverity.values()) {
                bySeverity.put(severity, 0L);
            }
            for (Object[] row : alertJpaRepository.countGroupedBySeverity()) {
                bySeverity.put((AlertSeverity) row[0], ((Number) row[1]).longValue());
            }
            return StorageStats.builder()
                    .totalAlerts(alertJpaRepository.count())
                    .bySeverity(bySeverity)
                    .build();
        } catch (DataAccessException e) {
            throw new AlertStorageException("Failed to compute storage statistics", e);
        }
    }
}
