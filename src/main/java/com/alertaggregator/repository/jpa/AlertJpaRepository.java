package com.alertaggregator.repository.jpa;

import com.alertaggregator.domain.enums.AlertSeverity;
import com.alertaggregator.domain.enums.AlertStatus;
import com.alertaggregator.entity.AlertEntity;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the alerts table.
 *
 * <p>Updates go through {@link #updateMutableFields} so content columns (source, severity,
 * title, message, timestamp, tags, fingerprint) are never rewritten after insert.
 */
@Repository
public interface AlertJpaRepository extends JpaRepository<AlertEntity, String> {

    /** Null filters are ignored. Newest first; the page size is the result limit. */
    @Query("SELECT a FROM AlertEntity a WHERE (:severity IS NULL OR a.severity = :severity) "
            + "AND (:status IS NULL OR a.status = :status) "
            + "AND (:source IS NULL OR a.source = :source) "
            + "ORDER BY a.timestamp DESC")
    List<AlertEntity> search(
            @Param("severity") AlertSeverity severity,
            @Param("status") AlertStatus status,
            @Param("source") String source,
            Pageable pageable);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE AlertEntity a SET a.status = :status, a.duplicateCount = :duplicateCount, "
            + "a.lastSeen = :lastSeen, a.acknowledgedAt = :acknowledgedAt, a.resolvedAt = :resolvedAt, "
            + "a.acknowledgedBy = :acknowledgedBy, a.metadata = :metadata WHERE a.id = :id")
    int updateMutableFields(
            @Param("id") String id,
            @Param("status") AlertStatus status,
            @Param("duplicateCount") int duplicateCount,
            @Param("lastSeen") Instant lastSeen,
            @Param("acknowledgedAt") Instant acknowledgedAt,
            @Param("resolvedAt") Instant resolvedAt,
            @Param("acknowledgedBy") String acknowledgedBy,
            @Param("metadata") String metadata);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM AlertEntity a WHERE a.status = :status AND a.resolvedAt < :cutoff")
    int deleteByStatusAndResolvedAtBefore(@Param("status") AlertStatus status, @Param("cutoff") Instant cutoff);

    List<AlertEntity> findByStatusInAndTimestampGreaterThanEqualOrderByTimestampAsc(
            Collection<AlertStatus> statuses, Instant since);

    @Query("SELECT a.severity, COUNT(a) FROM AlertEntity a GROUP BY a.severity")
    List<Object[]> countGroupedBySeverity();
}
