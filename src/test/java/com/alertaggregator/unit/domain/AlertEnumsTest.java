package com.alertaggregator.unit.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.alertaggregator.domain.enums.AlertSeverity;
import com.alertaggregator.domain.enums.AlertStatus;
import com.alertaggregator.domain.enums.NotificationChannel;
import com.alertaggregator.exception.ErrorCode;
import com.alertaggregator.exception.ValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Parsing of severity, status and channel wire strings.
 */
class AlertEnumsTest {

    @ParameterizedTest
    @ValueSource(strings = {"critical", "CRITICAL", "Critical"})
    void severity_fromValue_isCaseInsensitive(String raw) {
        assertThat(AlertSeverity.fromValue(raw)).isEqualTo(AlertSeverity.CRITICAL);
    }

    @Test
    void severity_unknown_throwsValidation() {
        assertThatThrownBy(() -> AlertSeverity.fromValue("fatal"))
                .isInstanceOf(ValidationException.class)
                .satisfies(e -> assertThat(((ValidationException) e).getErrorCode())
                        .isEqualTo(ErrorCode.VALIDATION_ERROR));
    }

    @Test
    void severity_null_throwsValidation() {
        assertThatThrownBy(() -> AlertSeverity.fromValue(null)).isInstanceOf(ValidationException.class);
    }

    @Test
    void severity_isAtLeast_followsDeclaredOrder() {
        assertThat(AlertSeverity.CRITICAL.isAtLeast(AlertSeverity.ERROR)).isTrue();
        assertThat(AlertSeverity.WARNING.isAtLeast(AlertSeverity.WARNING)).isTrue();
        assertThat(AlertSeverity.DEBUG.isAtLeast(AlertSeverity.INFO)).isFalse();
    }

    @Test
    void status_inProgress_usesUnderscoreValue() {
        assertThat(AlertStatus.fromValue("in_progress")).isEqualTo(AlertStatus.IN_PROGRESS);
        assertThat(AlertStatus.IN_PROGRESS.getValue()).isEqualTo("in_progress");
    }

    @Test
    void status_terminalStates() {
        assertThat(AlertStatus.RESOLVED.isTerminal()).isTrue();
        assertThat(AlertStatus.DISMISSED.isTerminal()).isTrue();
        assertThat(AlertStatus.NEW.isTerminal()).isFalse();
        assertThat(AlertStatus.ACKNOWLEDGED.isTerminal()).isFalse();
        assertThat(AlertStatus.IN_PROGRESS.isTerminal()).isFalse();
    }

    @Test
    void channel_fromValue_parsesLowercase() {
        assertThat(NotificationChannel.fromValue("webhook")).isEqualTo(NotificationChannel.WEBHOOK);
        assertThatThrownBy(() -> NotificationChannel.fromValue("sms")).isInstanceOf(ValidationException.class);
    }
}
