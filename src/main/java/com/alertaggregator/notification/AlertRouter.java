package com.alertaggregator.notification;

import com.alertaggregator.domain.enums.AlertSeverity;
import com.alertaggregator.domain.enums.NotificationChannel;
import com.alertaggregator.domain.model.Alert;
import com.alertaggregator.domain.model.RoutingRule;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Determines which notification channels an alert should reach.
 *
 * <p>Default routing by severity:
 * <ul>
 *   <li>CRITICAL: All channels (console + file + webhook + email)</li>
 *   <li>ERROR: console + file + webhook</li>
 *   <li>WARNING: console + file</li>
 *   <li>INFO: console only</li>
 *   <li>DEBUG: file only</li>
 * </ul>
 *
 * <p>Routing is additive: every matching rule contributes its channels and no rule can remove
 * a channel chosen by another. The router only names channels; delivery belongs to the host.
 *
 * <p>The rule list is copy-on-write, so rules may be added while other threads route.
 */
public class AlertRouter {

    private static final Logger log = LoggerFactory.getLogger(AlertRouter.class);

    static final List<RoutingRule> DEFAULT_RULES = List.of(
            RoutingRule.builder()
                    .name("critical-all")
                    .severities(Set.of(AlertSeverity.CRITICAL))
                    .channels(EnumSet.allOf(NotificationChannel.class))
                    .build(),
            RoutingRule.builder()
                    .name("error-standard")
                    .severities(Set.of(AlertSeverity.ERROR))
                    .channels(Set.of(
                            NotificationChannel.CONSOLE, NotificationChannel.FILE, NotificationChannel.WEBHOOK))
                    .build(),
            RoutingRule.builder()
                    .name("warning-basic")
                    .severities(Set.of(AlertSeverity.WARNING))
                    .channels(Set.of(NotificationChannel.CONSOLE, NotificationChannel.FILE))
                    .build(),
            RoutingRule.builder()
                    .name("info-console")
                    .severities(Set.of(AlertSeverity.INFO))
                    .channels(Set.of(NotificationChannel.CONSOLE))
                    .build(),
            RoutingRule.builder()
                    .name("debug-file")
                    .severities(Set.of(AlertSeverity.DEBUG))
                    .channels(Set.of(NotificationChannel.FILE))
                    .build());

    private final CopyOnWriteArrayList<RoutingRule> rules = new CopyOnWriteArrayList<>();

    /** Creates a router with the default severity rules installed. */
    public AlertRouter() {
        this(true);
    }

    public AlertRouter(boolean installDefaults) {
        if (installDefaults) {
            rules.addAll(DEFAULT_RULES);
        }
    }

    /**
     * Resolves the union of channels of every rule the alert matches. Empty when no rule matches.
     */
    public Set<NotificationChannel> route(Alert alert) {
        Set<NotificationChannel> channels = EnumSet.noneOf(NotificationChannel.class);
        for (RoutingRule rule : rules) {
            if (rule.matches(alert)) {
                channels.addAll(rule.getChannels());
            }
        }
        log.debug("Alert {} ({}) routed to {}", alert.getId(), alert.getSeverity(), channels);
        return channels;
    }

    public void addRule(RoutingRule rule) {
        rules.add(rule);
        log.debug("Added routing rule: {}", rule.getName());
    }

    /** Adds a rule ahead of all existing rules. Order does not change the result of {@link #route}. */
    public void addRuleFirst(RoutingRule rule) {
        rules.add(0, rule);
        log.debug("Prepended routing rule: {}", rule.getName());
    }

    /**
     * Removes every rule with the given name.
     *
     * @return true if at least one rule was removed
     */
    public boolean removeRule(String name) {
        boolean removed = rules.removeIf(rule -> Objects.equals(rule.getName(), name));
        if (removed) {
            log.debug("Removed routing rule: {}", name);
        }
        return removed;
    }

    public void clearRules() {
        rules.clear();
    }

    public void resetToDefaults() {
        rules.clear();
        rules.addAll(DEFAULT_RULES);
    }

    public List<RoutingRule> getRules() {
        return List.copyOf(rules);
    }
}
