package com.alertaggregator.config;

import com.alertaggregator.core.processor.AlertDeduplicator;
import com.alertaggregator.domain.model.RoutingRule;
import com.alertaggregator.notification.AlertRouter;
import java.time.Clock;
import java.time.Duration;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the engine collaborators that are plain classes rather than Spring components.
 *
 * <p>The {@link Clock} bean is the single source of "now" for the engine, which lets tests
 * substitute a fixed clock.
 */
@Configuration
public class AggregatorConfig {

    private static final Logger log = LoggerFactory.getLogger(AggregatorConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public AlertDeduplicator alertDeduplicator(AggregatorProperties properties) {
        AggregatorProperties.Dedup dedup = properties.getDedup();
        log.info(
                "Deduplication enabled={} window={}s fuzzyThreshold={}",
                dedup.isEnabled(),
                dedup.getWindowSeconds(),
                dedup.getFuzzyThreshold());
        return new AlertDeduplicator(
                dedup.isEnabled(), Duration.ofSeconds(dedup.getWindowSeconds()), dedup.getFuzzyThreshold());
    }

    @Bean
    public AlertRouter alertRouter(AggregatorProperties properties) {
        AggregatorProperties.Routing routing = properties.getRouting();
        AlertRouter router = new AlertRouter(routing.isDefaultRulesEnabled());
        for (AggregatorProperties.Rule rule : routing.getRules()) {
            router.addRule(toRoutingRule(rule));
        }
        log.info("Alert router initialized with {} rules", router.getRules().size());
        return router;
    }

    static RoutingRule toRoutingRule(AggregatorProperties.Rule rule) {
        return RoutingRule.builder()
                .name(rule.getName())
                .severities(Set.copyOf(rule.getSeverities()))
                .channels(Set.copyOf(rule.getChannels()))
                .sources(Set.copyOf(rule.getSources()))
                .tags(Set.copyOf(rule.getTags()))
                .build();
    }
}
