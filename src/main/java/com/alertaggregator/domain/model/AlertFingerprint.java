package com.alertaggregator.domain.model;

import com.alertaggregator.domain.enums.AlertSeverity;
import com.alertaggregator.exception.ValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;

/**
 * Computes the deduplication key of an alert.
 *
 * <p>The canonical form is a JSON object of (source, severity, title, message) serialized with
 * sorted keys, hashed with SHA-256 and truncated to {@value #LENGTH} hex characters. Timestamp,
 * tags and metadata never take part, so two occurrences of the same condition always share a
 * fingerprint.
 */
public final class AlertFingerprint {

    public static final int LENGTH = 16;

    private static final ObjectMapper CANONICAL_MAPPER =
            new ObjectMapper().enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private AlertFingerprint() {}

    /**
     * @throws ValidationException if any identity field is missing
     */
    public static String compute(String source, AlertSeverity severity, String title, String message) {
        if (source == null || severity == null || title == null || message == null) {
            throw new ValidationException(
                    "Alert cannot be fingerprinted: source, severity, title and message are required");
        }

        Map<String, String> canonical = new TreeMap<>();
        canonical.put("source", source);
        canonical.put("severity", severity.getValue());
        canonical.put("title", title);
        canonical.put("message", message);

        try {
            byte[] json = CANONICAL_MAPPER.writeValueAsBytes(canonical);
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(json);
            return HexFormat.of().formatHex(digest).substring(0, LENGTH);
        } catch (JsonProcessingException | NoSuchAlgorithmException e) {
            throw new IllegalStateException("Fingerprint computation failed", e);
        }
    }

    public static String of(Alert alert) {
        return compute(alert.getSource(), alert.getSeverity(), alert.getTitle(), alert.getMessage());
    }
}
