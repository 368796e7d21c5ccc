package com.alertaggregator.service;

import com.alertaggregator.config.AggregatorProperties;
import com.alertaggregator.domain.enums.AlertSeverity;
import com.alertaggregator.domain.model.Alert;
import com.alertaggregator.exception.ValidationException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Normalizes raw alert input from collectors into {@link Alert}s ready for ingest.
 *
 * <p>Missing fields fall back to defaults: source {@value #DEFAULT_SOURCE}, severity info,
 * title {@value #DEFAULT_TITLE}, an empty message and the current time. Timestamps are ISO-8601
 * with or without an offset; values without one are read as UTC.
 *
 * <p>Unknown severity strings are rejected unless {@code alertaggregator.collector.lenient-severity}
 * is set, in which case they are downgraded to INFO.
 */
@Service
public class AlertCollector {

    private static final Logger log = LoggerFactory.getLogger(AlertCollector.class);

    static final String DEFAULT_SOURCE = "unknown";
    static final String DEFAULT_TITLE = "Untitled Alert";

    private final ConcurrentHashMap<String, Long> sourceCounts = new ConcurrentHashMap<>();

    private final AggregatorProperties aggregatorProperties;
    private final Clock clock;

    public AlertCollector(AggregatorProperties aggregatorProperties, Clock clock) {
        this.aggregatorProperties = aggregatorProperties;
        this.clock = clock;
    }

    /**
     * Builds a new alert with a fresh id and fingerprint.
     *
     * @param timestamp occurrence time; now when null
     */
    public Alert collect(
            String source,
            String severity,
            String title,
            String message,
            List<String> tags,
            Map<String, Object> metadata,
            Instant timestamp) {
        String resolvedSource = source != null && !source.isBlank() ? source : DEFAULT_SOURCE;
        Alert alert = Alert.create(
                resolvedSource,
                parseSeverity(severity),
                title != null ? title : DEFAULT_TITLE,
                message != null ? message : "",
                tags,
                metadata,
                timestamp != null ? timestamp : clock.instant());

        sourceCounts.merge(resolvedSource, 1L, Long::sum);
        log.debug("Collected alert from {}: {}", resolvedSource, alert.getTitle());
        return alert;
    }

    /**
     * Builds an alert from a JSON-shaped map with keys {@code source, severity, title, message,
     * tags, metadata, timestamp}. Unknown keys are ignored.
     */
    public Alert collectFromMap(Map<String, Object> data) {
        if (data == null) {
            throw new ValidationException("Alert data must not be null");
        }
        return collect(
                stringValue(data.get("source")),
                data.containsKey("severity") ? stringValue(data.get("severity")) : AlertSeverity.INFO.getValue(),
                stringValue(data.get("title")),
                stringValue(data.get("message")),
                toTags(data.get("tags")),
                toMetadata(data.get("metadata")),
                toInstant(data.get("timestamp")));
    }

    /** Alerts collected per source since startup. Keys are sorted. */
    public Map<String, Long> getSourceCounts() {
        return new TreeMap<>(sourceCounts);
    }

    AlertSeverity parseSeverity(String raw) {
        try {
            return AlertSeverity.fromValue(raw);
        } catch (ValidationException e) {
            if (!aggregatorProperties.getCollector().isLenientSeverity()) {
                throw e;
            }
            log.warn("Invalid severity '{}', defaulting to INFO", raw);
            return AlertSeverity.INFO;
        }
    }

    private static String stringValue(Object value) {
        return value != null ? value.toString() : null;
    }

    private static List<String> toTags(Object value) {
        if (value == null) {
            return new ArrayList<>();
        }
        if (value instanceof Collection<?> collection) {
            List<String> tags = new ArrayList<>();
            for (Object tag : collection) {
                if (tag != null) {
                    tags.add(tag.toString());
                }
            }
            return tags;
        }
        if (value instanceof String tag) {
            return new ArrayList<>(List.of(tag));
        }
        throw new ValidationException("Alert tags must be a list of strings", Map.of("tags", value));
    }

    private static Map<String, Object> toMetadata(Object value) {
        if (value == null) {
            return new LinkedHashMap<>();
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            map.forEach((key, entry) -> metadata.put(String.valueOf(key), entry));
            return metadata;
        }
        throw new ValidationException("Alert metadata must be an object", Map.of("metadata", value));
    }

    static Instant toInstant(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        String text = value.toString().trim();
        try {
            TemporalAccessor parsed =
                    DateTimeFormatter.ISO_DATE_TIME.parseBest(text, ZonedDateTime::from, LocalDateTime::from);
            if (parsed instanceof ZonedDateTime zoned) {
                return zoned.toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new ValidationException("Invalid ISO-8601 timestamp: " + text, Map.of("timestamp", text));
        }
    }
}
