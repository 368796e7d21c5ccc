package com.alertaggregator.unit.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.alertaggregator.domain.enums.AlertSeverity;
import com.alertaggregator.domain.enums.NotificationChannel;
import com.alertaggregator.domain.model.Alert;
import com.alertaggregator.domain.model.RoutingRule;
import com.alertaggregator.notification.AlertRouter;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for AlertRouter.
 *
 * <p>Verifies: default severity routing, additive custom rules, source and tag filters, and
 * rule management.
 */
class AlertRouterTest {

    private AlertRouter alertRouter;

    @BeforeEach
    void setUp() {
        alertRouter = new AlertRouter();
    }

    private Alert alert(String source, AlertSeverity severity, List<String> tags) {
        return Alert.create(source, severity, "title", "message", tags, null, Instant.parse("2026-01-10T10:00:00Z"));
    }

    @Test
    void critical_defaultRouting_allChannels() {
        assertThat(alertRouter.route(alert("db", AlertSeverity.CRITICAL, List.of())))
                .containsExactlyInAnyOrder(NotificationChannel.values());
    }

    @Test
    void error_defaultRouting_consoleFileWebhook() {
        assertThat(alertRouter.route(alert("db", AlertSeverity.ERROR, List.of())))
                .containsExactlyInAnyOrder(
                        NotificationChannel.CONSOLE, NotificationChannel.FILE, NotificationChannel.WEBHOOK);
    }

    @Test
    void warning_defaultRouting_consoleAndFile() {
        assertThat(alertRouter.route(alert("db", AlertSeverity.WARNING, List.of())))
                .containsExactlyInAnyOrder(NotificationChannel.CONSOLE, NotificationChannel.FILE);
    }

    @Test
    void info_defaultRouting_consoleOnly() {
        assertThat(alertRouter.route(alert("db", AlertSeverity.INFO, List.of())))
                .containsExactly(NotificationChannel.CONSOLE);
    }

    @Test
    void debug_defaultRouting_fileOnly() {
        assertThat(alertRouter.route(alert("db", AlertSeverity.DEBUG, List.of())))
                .containsExactly(NotificationChannel.FILE);
    }

    @Test
    void customRule_addsChannels_neverRemovesDefaults() {
        alertRouter.addRule(RoutingRule.builder()
                .name("db-email")
                .severities(Set.of(AlertSeverity.INFO))
                .channels(Set.of(NotificationChannel.EMAIL))
                .sources(Set.of("db"))
                .build());

        assertThat(alertRouter.route(alert("db", AlertSeverity.INFO, List.of())))
                .containsExactlyInAnyOrder(NotificationChannel.CONSOLE, NotificationChannel.EMAIL);
        assertThat(alertRouter.route(alert("api", AlertSeverity.INFO, List.of())))
                .containsExactly(NotificationChannel.CONSOLE);
    }

    @Test
    void tagRule_matchesOnAnySharedTag() {
        alertRouter.addRuleFirst(RoutingRule.builder()
                .name("prod-webhook")
                .severities(Set.of(AlertSeverity.WARNING))
                .channels(Set.of(NotificationChannel.WEBHOOK))
                .tags(Set.of("prod"))
                .build());

        assertThat(alertRouter.route(alert("db", AlertSeverity.WARNING, List.of("prod", "eu"))))
                .contains(NotificationChannel.WEBHOOK);
        assertThat(alertRouter.route(alert("db", AlertSeverity.WARNING, List.of("staging"))))
                .doesNotContain(NotificationChannel.WEBHOOK);
    }

    @Test
    void noDefaults_noMatchingRule_emptySet() {
        AlertRouter bare = new AlertRouter(false);

        assertThat(bare.route(alert("db", AlertSeverity.CRITICAL, List.of()))).isEmpty();
    }

    @Test
    void removeRule_byName() {
        assertThat(alertRouter.removeRule("info-console")).isTrue();
        assertThat(alertRouter.removeRule("info-console")).isFalse();

        assertThat(alertRouter.route(alert("db", AlertSeverity.INFO, List.of()))).isEmpty();
    }

    @Test
    void clearRules_thenResetToDefaults() {
        alertRouter.clearRules();
        assertThat(alertRouter.getRules()).isEmpty();

        alertRouter.resetToDefaults();
        assertThat(alertRouter.getRules())
                .extracting(RoutingRule::getName)
                .containsExactly("critical-all", "error-standard", "warning-basic", "info-console", "debug-file");
    }

    @Test
    void getRules_returnsImmutableCopy() {
        List<RoutingRule> rules = alertRouter.getRules();

        assertThatThrownBy(() -> rules.add(RoutingRule.builder().name("x").build()))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
