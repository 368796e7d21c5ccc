package com.alertaggregator.core.engine;

import com.alertaggregator.config.AggregatorProperties;
import com.alertaggregator.core.processor.AlertDeduplicator;
import com.alertaggregator.domain.enums.AlertSeverity;
import com.alertaggregator.domain.enums.AlertStatus;
import com.alertaggregator.domain.enums.NotificationChannel;
import com.alertaggregator.domain.model.Alert;
import com.alertaggregator.domain.model.AlertStats;
import com.alertaggregator.domain.model.RoutingRule;
import com.alertaggregator.event.AlertEvent;
import com.alertaggregator.event.AlertEventListener;
import com.alertaggregator.event.AlertEventType;
import com.alertaggregator.exception.ValidationException;
import com.alertaggregator.notification.AlertRouter;
import com.alertaggregator.service.AlertStorageService;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Orchestrates the alert pipeline: ingest, deduplicate, persist, route and notify.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li><b>Ingest:</b> merges an incoming alert into a matching active alert, or stores it as
 *       new, records statistics and computes its routing channels</li>
 *   <li><b>Lifecycle:</b> acknowledge, mark in progress, resolve and dismiss stored alerts;
 *       resolved and dismissed alerts leave the active set so later occurrences start fresh</li>
 *   <li><b>Notification:</b> fans every change out to registered {@link AlertEventListener}s</li>
 *   <li><b>Startup:</b> optionally reloads stored active alerts still inside the dedup window</li>
 * </ul>
 *
 * <p><b>Concurrency model:</b> the active set is keyed by fingerprint. Ingest and lifecycle calls
 * run under a single {@link ReentrantLock} so that find-duplicate followed by merge-or-insert,
 * and the storage write behind it, cannot interleave with another ingest. Listeners are called
 * in-line on the calling thread while the lock is held.
 */
@Service
public class AlertAggregator {

    private static final Logger log = LoggerFactory.getLogger(AlertAggregator.class);

    /** Active (non-terminal) alerts keyed by fingerprint. Written only under {@link #lock}. */
    private final ConcurrentHashMap<String, Alert> activeAlerts = new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<AlertEventListener> listeners = new CopyOnWriteArrayList<>();

    private final ReentrantLock lock = new ReentrantLock();

    private final AlertStats stats = new AlertStats();

    private final AlertStorageService alertStorageService;
    private final AlertDeduplicator alertDeduplicator;
    private final AlertRouter alertRouter;
    private final AggregatorProperties aggregatorProperties;
    private final Clock clock;

    public AlertAggregator(
            AlertStorageService alertStorageService,
            AlertDeduplicator alertDeduplicator,
            AlertRouter alertRouter,
            AggregatorProperties aggregatorProperties,
            Clock clock,
            List<AlertEventListener> eventListeners) {
        this.alertStorageService = alertStorageService;
        this.alertDeduplicator = alertDeduplicator;
        this.alertRouter = alertRouter;
        this.aggregatorProperties = aggregatorProperties;
        this.clock = clock;
        if (eventListeners != null) {
            this.listeners.addAll(eventListeners);
        }
    }

    // ========================
    // INGEST
    // ========================

    /**
     * Ingests an alert.
     *
     * @return the existing alert when the input was merged as a duplicate, otherwise the input
     *     alert itself (now stored and active)
     * @throws ValidationException if the alert is null or lacks source, severity, title or message
     */
    public Alert ingest(Alert alert) {
        validate(alert);
        alert.ensureDefaults(clock.instant());

        lock.lock();
        try {
            Alert existing = alertDeduplicator.findDuplicate(alert, activeAlerts);
            if (existing != null) {
                Alert merged = existing.copy();
                merged.mergeDuplicate(alert);
                if (alertStorageService.updateAlert(merged)) {
                    existing.applyMutableState(merged);
                    stats.recordDuplicate();
                    log.debug(
                            "Merged alert into {} ({} occurrences): {}",
                            existing.getId(),
                            existing.getDuplicateCount(),
                            existing.getTitle());
                    fireEvent(AlertEventType.DUPLICATE_MERGED, existing, Set.of());
                    return existing;
                }
                log.warn(
                        "Active alert {} is no longer stored, ingesting {} as a new alert",
                        existing.getId(),
                        alert.getId());
                activeAlerts.remove(existing.getFingerprint(), existing);
            }

            alertStorageService.storeAlert(alert);
            activeAlerts.put(alert.getFingerprint(), alert);
            stats.record(alert);

            Set<NotificationChannel> channels = alertRouter.route(alert);
            if (!channels.isEmpty()) {
                fireEvent(AlertEventType.ALERT_ROUTED, alert, channels);
            }
            fireEvent(AlertEventType.ALERT_INGESTED, alert, Set.of());

            log.info(
                    "Ingested alert {} [{}] from {}: {}",
                    alert.getId(),
                    alert.getSeverity(),
                    alert.getSource(),
                    alert.getTitle());
            return alert;
        } finally {
            lock.unlock();
        }
    }

    private void validate(Alert alert) {
        if (alert == null) {
            throw new ValidationException("Alert must not be null");
        }
        if (alert.getSource() == null || alert.getSource().isBlank()) {
            throw new ValidationException("Alert source is required", Map.of("field", "source"));
        }
        if (alert.getSeverity() == null) {
            throw new ValidationException("Alert severity is required", Map.of("field", "severity"));
        }
        if (alert.getTitle() == null) {
            throw new ValidationException("Alert title is required", Map.of("field", "title"));
        }
        if (alert.getMessage() == null) {
            throw new ValidationException("Alert message is required", Map.of("field", "message"));
        }
    }

    // ========================
    // LIFECYCLE
    // ========================

    public boolean acknowledge(String alertId, String acknowledgedBy) {
        return transition(
                alertId,
                AlertEventType.ALERT_ACKNOWLEDGED,
                alert -> alert.acknowledge(acknowledgedBy, clock.instant()));
    }

    public boolean markInProgress(String alertId) {
        return transition(alertId, AlertEventType.ALERT_IN_PROGRESS, Alert::markInProgress);
    }

    public boolean resolve(String alertId) {
        return transition(alertId, AlertEventType.ALERT_RESOLVED, alert -> alert.resolve(clock.instant()));
    }

    public boolean dismiss(String alertId) {
        return transition(alertId, AlertEventType.ALERT_DISMISSED, Alert::dismiss);
    }

    /**
     * Loads the alert, applies the change to a copy and persists it. Only after a successful write
     * is the change taken over by the active-set instance (when the alert is still active) and
     * listeners notified.
     *
     * @return false if no alert with that id is stored
     */
    private boolean transition(String alertId, AlertEventType eventType, Consumer<Alert> change) {
        lock.lock();
        try {
            Optional<Alert> stored = alertStorageService.getAlert(alertId);
            if (stored.isEmpty()) {
                log.warn("Cannot apply {}: alert {} not found", eventType.getEventName(), alertId);
                return false;
            }

            Alert alert = liveInstance(stored.get());
            Alert updated = alert.copy();
            change.accept(updated);
            if (!alertStorageService.updateAlert(updated)) {
                log.warn("Cannot apply {}: alert {} vanished from storage", eventType.getEventName(), alertId);
                return false;
            }
            alert.applyMutableState(updated);

            if (alert.getStatus().isTerminal()) {
                Alert current = activeAlerts.get(alert.getFingerprint());
                if (current != null && current.getId().equals(alert.getId())) {
                    activeAlerts.remove(alert.getFingerprint());
                }
            }

            fireEvent(eventType, alert, Set.of());
            log.info("Alert {} is now {}", alert.getId(), alert.getStatus());
            return true;
        } finally {
            lock.unlock();
        }
    }

    private Alert liveInstance(Alert stored) {
        Alert current = activeAlerts.get(stored.getFingerprint());
        if (current != null && current.getId().equals(stored.getId())) {
            return current;
        }
        return stored;
    }

    // ========================
    // QUERIES
    // ========================

    public List<Alert> getAlerts(AlertSeverity severity, AlertStatus status, String source, int limit) {
        return alertStorageService.queryAlerts(severity, status, source, limit);
    }

    public Optional<Alert> getAlert(String alertId) {
        return alertStorageService.getAlert(alertId);
    }

    /** Point-in-time copy of the running statistics. */
    public AlertStats getStats() {
        lock.lock();
        try {
            return stats.snapshot();
        } finally {
            lock.unlock();
        }
    }

    public int getActiveAlertCount() {
        return activeAlerts.size();
    }

    // ========================
    // CONFIGURATION
    // ========================

    public void addRoutingRule(RoutingRule rule) {
        alertRouter.addRule(rule);
    }

    public void addListener(AlertEventListener listener) {
        listeners.add(listener);
    }

    public boolean removeListener(AlertEventListener listener) {
        return listeners.remove(listener);
    }

    // ========================
    // MAINTENANCE
    // ========================

    /**
     * Deletes resolved alerts older than the given number of days.
     *
     * @return number of alerts deleted
     */
    public int cleanupOldAlerts(int retentionDays) {
        return alertStorageService.cleanupOld(retentionDays);
    }

    /**
     * Reloads stored active alerts whose timestamp is still inside the dedup window, so that
     * duplicates arriving after a restart merge into them. Newer alerts win on a shared
     * fingerprint.
     *
     * @return size of the active set afterwards
     */
    public int restoreActiveAlerts() {
        lock.lock();
        try {
            Instant since = clock.instant().minus(alertDeduplicator.getWindow());
            List<Alert> restored = alertStorageService.findActiveSince(since);
            for (Alert alert : restored) {
                alert.ensureDefaults(clock.instant());
                activeAlerts.put(alert.getFingerprint(), alert);
            }
            log.info("Restored {} active alerts stored since {}", restored.size(), since);
            return activeAlerts.size();
        } finally {
            lock.unlock();
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        AggregatorProperties.Dedup dedup = aggregatorProperties.getDedup();
        if (dedup.isEnabled() && dedup.isRestoreActiveOnStartup()) {
            restoreActiveAlerts();
        }
    }

    // ========================
    // EVENTS
    // ========================

    private void fireEvent(AlertEventType eventType, Alert alert, Set<NotificationChannel> channels) {
        AlertEvent event = new AlertEvent(this, eventType, alert, channels);
        for (AlertEventListener listener : listeners) {
            try {
                listener.onAlertEvent(event);
            } catch (Exception e) {
                log.error(
                        "Alert listener {} failed on {} for alert {}",
                        listener.getClass().getSimpleName(),
                        eventType.getEventName(),
                        alert.getId(),
                        e);
            }
        }
    }
}
