package com.alertaggregator.event;

/**
 * Callback invoked synchronously by the AlertAggregator for every {@link AlertEvent}.
 *
 * <p>Implementations run on the ingesting thread while the aggregator holds its lock, so they
 * should return quickly. Exceptions are logged by the aggregator and never reach the caller.
 */
@FunctionalInterface
public interface AlertEventListener {

    void onAlertEvent(AlertEvent event);
}
