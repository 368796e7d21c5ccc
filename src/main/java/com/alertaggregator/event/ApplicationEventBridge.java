package com.alertaggregator.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Forwards every aggregator callback onto the Spring application event bus, so beans can
 * observe alerts with a plain {@code @EventListener} instead of registering with the aggregator.
 */
@Component
public class ApplicationEventBridge implements AlertEventListener {

    private static final Logger log = LoggerFactory.getLogger(ApplicationEventBridge.class);

    private final EventPublisherHelper eventPublisherHelper;

    public ApplicationEventBridge(EventPublisherHelper eventPublisherHelper) {
        this.eventPublisherHelper = eventPublisherHelper;
    }

    @Override
    public void onAlertEvent(AlertEvent event) {
        log.trace("Republishing {} for alert {}", event.getEventName(), event.getAlert().getId());
        eventPublisherHelper.publishAlertEvent(event);
    }
}
