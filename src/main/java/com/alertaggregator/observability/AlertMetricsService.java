package com.alertaggregator.observability;

import com.alertaggregator.core.engine.AlertAggregator;
import com.alertaggregator.domain.enums.AlertSeverity;
import com.alertaggregator.event.AlertEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.EnumMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Registers and updates the alert pipeline's Micrometer metrics.
 * <ul>
 *   <li><b>alerts.ingested.count</b> (counter, tag severity): new alerts stored</li>
 *   <li><b>alerts.duplicates.count</b> (counter): occurrences merged into an existing alert</li>
 *   <li><b>alerts.resolved.count</b> (counter): alerts moved to RESOLVED</li>
 *   <li><b>alerts.active</b> (gauge): size of the aggregator's active set</li>
 * </ul>
 *
 * <p>Counters are driven by {@link AlertEvent}s republished on the Spring event bus. The gauge
 * is polled by Micrometer on scrape.
 */
@Service
public class AlertMetricsService {

    private static final Logger log = LoggerFactory.getLogger(AlertMetricsService.class);

    private final Map<AlertSeverity, Counter> ingestedCounters = new EnumMap<>(AlertSeverity.class);
    private final Counter duplicatesCounter;
    private final Counter resolvedCounter;

    public AlertMetricsService(MeterRegistry meterRegistry, AlertAggregator alertAggregator) {
        for (AlertSeverity severity : AlertSeverity.values()) {
            ingestedCounters.put(
                    severity,
                    Counter.builder("alerts.ingested.count")
                            .description("Distinct alerts stored")
                            .tag("severity", severity.getValue())
                            .register(meterRegistry));
        }

        this.duplicatesCounter = Counter.builder("alerts.duplicates.count")
                .description("Alert occurrences merged into an existing active alert")
                .register(meterRegistry);

        this.resolvedCounter = Counter.builder("alerts.resolved.count")
                .description("Alerts resolved")
                .register(meterRegistry);

        meterRegistry.gauge("alerts.active", alertAggregator, AlertAggregator::getActiveAlertCount);
    }

    @EventListener
    @Order(20)
    public void onAlertEvent(AlertEvent event) {
        switch (event.getEventType()) {
            case ALERT_INGESTED -> ingestedCounters.get(event.getAlert().getSeverity()).increment();
            case DUPLICATE_MERGED -> duplicatesCounter.increment();
            case ALERT_RESOLVED -> resolvedCounter.increment();
            default -> log.trace("No metric for {}", event.getEventName());
        }
    }
}
