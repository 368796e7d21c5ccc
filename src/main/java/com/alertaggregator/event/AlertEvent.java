package com.alertaggregator.event;

import com.alertaggregator.domain.enums.NotificationChannel;
import com.alertaggregator.domain.model.Alert;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the AlertAggregator whenever an alert is ingested, merged, routed or changes
 * lifecycle state.
 *
 * <p>The alert is the live instance held by the aggregator, not a copy. Listeners must treat
 * it as read-only.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>ApplicationEventBridge -- republishes on the Spring event bus</li>
 *   <li>AlertMetricsService -- ingest, duplicate and resolve counters</li>
 * </ul>
 */
public class AlertEvent extends ApplicationEvent {

    private final AlertEventType eventType;
    private final Alert alert;
    private final Set<NotificationChannel> channels;

    public AlertEvent(Object source, AlertEventType eventType, Alert alert) {
        this(source, eventType, alert, Set.of());
    }

    public AlertEvent(Object source, AlertEventType eventType, Alert alert, Set<NotificationChannel> channels) {
        super(source);
        this.eventType = eventType;
        this.alert = alert;
        this.channels = channels == null || channels.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(EnumSet.copyOf(channels));
    }

    public AlertEventType getEventType() {
        return eventType;
    }

    public String getEventName() {
        return eventType.getEventName();
    }

    public Alert getAlert() {
        return alert;
    }

    /**
     * Channels the alert was routed to. Only populated for {@link AlertEventType#ALERT_ROUTED}.
     */
    public Set<NotificationChannel> getChannels() {
        return channels;
    }
}
