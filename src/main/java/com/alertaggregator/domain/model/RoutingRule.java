package com.alertaggregator.domain.model;

import com.alertaggregator.domain.enums.AlertSeverity;
import com.alertaggregator.domain.enums.NotificationChannel;
import java.util.Objects;
import java.util.Set;
import lombok.Builder;
import lombok.Value;

/**
 * Declarative matcher from alert attributes to a set of delivery channels.
 *
 * <p>A rule matches when the alert's severity is listed, the source allow-list is empty or
 * contains the alert's source, and the tag allow-list is empty or shares at least one tag with
 * the alert. Rules only ever add channels; they never exclude a channel chosen by another rule.
 */
@Value
@Builder
public class RoutingRule {

    String name;

    @Builder.Default
    Set<AlertSeverity> severities = Set.of();

    @Builder.Default
    Set<NotificationChannel> channels = Set.of();

    /** Empty means any source. */
    @Builder.Default
    Set<String> sources = Set.of();

    /** Empty means any tags. */
    @Builder.Default
    Set<String> tags = Set.of();

    public boolean matches(Alert alert) {
        if (severities == null || !severities.contains(alert.getSeverity())) {
            return false;
        }
        if (sources != null && !sources.isEmpty() && !sources.contains(alert.getSource())) {
            return false;
        }
        if (tags != null && !tags.isEmpty()) {
            return alert.getTags() != null
                    && alert.getTags().stream().filter(Objects::nonNull).anyMatch(tags::contains);
        }
        return true;
    }
}
