package com.alertaggregator.unit.domain;

import static org.assertj.core.api.Assertions.assertThat;

import com.alertaggregator.domain.enums.AlertSeverity;
import com.alertaggregator.domain.enums.NotificationChannel;
import com.alertaggregator.domain.model.Alert;
import com.alertaggregator.domain.model.RoutingRule;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class RoutingRuleTest {

    private Alert alert(String source, AlertSeverity severity, List<String> tags) {
        return Alert.create(source, severity, "title", "message", tags, null, Instant.parse("2026-01-10T10:00:00Z"));
    }

    private RoutingRule.RoutingRuleBuilder rule() {
        return RoutingRule.builder()
                .name("test")
                .severities(Set.of(AlertSeverity.ERROR))
                .channels(Set.of(NotificationChannel.EMAIL));
    }

    @Test
    void matches_severityListed_noFilters() {
        assertThat(rule().build().matches(alert("db", AlertSeverity.ERROR, List.of()))).isTrue();
    }

    @Test
    void matches_severityNotListed_false() {
        assertThat(rule().build().matches(alert("db", AlertSeverity.WARNING, List.of()))).isFalse();
    }

    @Test
    void matches_sourceFilter_requiresListedSource() {
        RoutingRule rule = rule().sources(Set.of("db")).build();

        assertThat(rule.matches(alert("db", AlertSeverity.ERROR, List.of()))).isTrue();
        assertThat(rule.matches(alert("api", AlertSeverity.ERROR, List.of()))).isFalse();
    }

    @Test
    void matches_tagFilter_requiresAnySharedTag() {
        RoutingRule rule = rule().tags(Set.of("prod", "payments")).build();

        assertThat(rule.matches(alert("db", AlertSeverity.ERROR, List.of("staging", "payments")))).isTrue();
        assertThat(rule.matches(alert("db", AlertSeverity.ERROR, List.of("staging")))).isFalse();
        assertThat(rule.matches(alert("db", AlertSeverity.ERROR, List.of()))).isFalse();
    }

    @Test
    void matches_nullTagOnAlert_ignored() {
        RoutingRule rule = rule().tags(Set.of("prod")).build();

        assertThat(rule.matches(alert("db", AlertSeverity.ERROR, Arrays.asList(null, "prod")))).isTrue();
    }

    @Test
    void matches_emptySeverities_neverMatches() {
        RoutingRule rule = RoutingRule.builder().name("empty").build();

        assertThat(rule.matches(alert("db", AlertSeverity.CRITICAL, List.of()))).isFalse();
    }
}
