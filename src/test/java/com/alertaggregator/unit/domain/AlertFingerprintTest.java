package com.alertaggregator.unit.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.alertaggregator.domain.enums.AlertSeverity;
import com.alertaggregator.domain.model.AlertFingerprint;
import com.alertaggregator.exception.ValidationException;
import org.junit.jupiter.api.Test;

class AlertFingerprintTest {

    @Test
    void compute_sameContent_sameFingerprint() {
        String first = AlertFingerprint.compute("db", AlertSeverity.ERROR, "connection lost", "timeout");
        String second = AlertFingerprint.compute("db", AlertSeverity.ERROR, "connection lost", "timeout");

        assertThat(first).isEqualTo(second);
    }

    @Test
    void compute_isSixteenLowercaseHexChars() {
        String fingerprint = AlertFingerprint.compute("db", AlertSeverity.ERROR, "connection lost", "timeout");

        assertThat(fingerprint).hasSize(16).matches("[0-9a-f]{16}");
    }

    @Test
    void compute_anyFieldChange_changesFingerprint() {
        String base = AlertFingerprint.compute("db", AlertSeverity.ERROR, "connection lost", "timeout");

        assertThat(AlertFingerprint.compute("api", AlertSeverity.ERROR, "connection lost", "timeout"))
                .isNotEqualTo(base);
        assertThat(AlertFingerprint.compute("db", AlertSeverity.WARNING, "connection lost", "timeout"))
                .isNotEqualTo(base);
        assertThat(AlertFingerprint.compute("db", AlertSeverity.ERROR, "connection reset", "timeout"))
                .isNotEqualTo(base);
        assertThat(AlertFingerprint.compute("db", AlertSeverity.ERROR, "connection lost", "refused"))
                .isNotEqualTo(base);
    }

    @Test
    void compute_nullField_throwsValidation() {
        assertThatThrownBy(() -> AlertFingerprint.compute("db", null, "t", "m"))
                .isInstanceOf(ValidationException.class);
    }
}
