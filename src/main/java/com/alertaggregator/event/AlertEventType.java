package com.alertaggregator.event;

/**
 * Classifies what happened to the alert carried by an {@link AlertEvent}.
 *
 * <p>The lowercase {@link #getEventName() event name} is the stable name consumers key on.
 */
public enum AlertEventType {

    /** A new alert was stored and added to the active set. */
    ALERT_INGESTED("alert_ingested"),

    /** An incoming alert was folded into an existing active alert. The event carries the existing one. */
    DUPLICATE_MERGED("duplicate_merged"),

    /** A new alert matched at least one routing rule. */
    ALERT_ROUTED("alert_routed"),

    ALERT_ACKNOWLEDGED("alert_acknowledged"),

    ALERT_IN_PROGRESS("alert_in_progress"),

    ALERT_RESOLVED("alert_resolved"),

    ALERT_DISMISSED("alert_dismissed");

    private final String eventName;

    AlertEventType(String eventName) {
        this.eventName = eventName;
    }

    public String getEventName() {
        return eventName;
    }
}
