package com.alertaggregator.event;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Thin wrapper around Spring's {@link ApplicationEventPublisher} for alert events.
 *
 * <p>Delivery is synchronous unless the receiving {@code @EventListener} is also {@code @Async}.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    public void publishAlertEvent(AlertEvent event) {
        applicationEventPublisher.publishEvent(event);
    }
}
