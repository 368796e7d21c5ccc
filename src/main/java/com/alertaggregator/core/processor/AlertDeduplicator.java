package com.alertaggregator.core.processor;

import com.alertaggregator.domain.model.Alert;
import java.time.Duration;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether an incoming alert is another occurrence of an already-active alert.
 *
 * <p>Matching runs in two stages:
 * <ol>
 *   <li>Exact: the active map holds the candidate's fingerprint and that alert's timestamp is
 *       within the dedup window of the candidate's timestamp.</li>
 *   <li>Fuzzy: among active alerts with the same source and severity inside the window, the
 *       best weighted title/message similarity ({@value #TITLE_WEIGHT} / {@value #MESSAGE_WEIGHT})
 *       wins if it reaches the threshold. Equal scores go to the lowest alert id so the result
 *       does not depend on map iteration order.</li>
 * </ol>
 *
 * <p>This is a pure query: merging the candidate into the returned alert is the caller's job.
 */
public class AlertDeduplicator {

    private static final Logger log = LoggerFactory.getLogger(AlertDeduplicator.class);

    static final double TITLE_WEIGHT = 0.6;
    static final double MESSAGE_WEIGHT = 0.4;

    public static final Duration DEFAULT_WINDOW = Duration.ofHours(1);
    public static final double DEFAULT_THRESHOLD = 0.85;

    private final boolean enabled;
    private final Duration window;
    private final double fuzzyThreshold;

    public AlertDeduplicator(boolean enabled, Duration window, double fuzzyThreshold) {
        if (window == null || window.isNegative()) {
            throw new IllegalArgumentException("Dedup window must be zero or positive");
        }
        if (fuzzyThreshold < 0.0 || fuzzyThreshold > 1.0) {
            throw new IllegalArgumentException("Fuzzy threshold must be within [0, 1]: " + fuzzyThreshold);
        }
        this.enabled = enabled;
        this.window = window;
        this.fuzzyThreshold = fuzzyThreshold;
    }

    public AlertDeduplicator() {
        this(true, DEFAULT_WINDOW, DEFAULT_THRESHOLD);
    }

    /**
     * Returns the active alert the candidate duplicates, or null.
     *
     * @param activeAlerts active alerts keyed by fingerprint; not modified
     */
    public Alert findDuplicate(Alert candidate, Map<String, Alert> activeAlerts) {
        if (!enabled || activeAlerts == null || activeAlerts.isEmpty()) {
            return null;
        }

        Alert exact = activeAlerts.get(candidate.getFingerprint());
        if (exact != null && withinWindow(candidate, exact)) {
            return exact;
        }

        return fuzzyMatch(candidate, activeAlerts);
    }

    private Alert fuzzyMatch(Alert candidate, Map<String, Alert> activeAlerts) {
        Alert bestMatch = null;
        double bestScore = -1.0;

        for (Alert existing : activeAlerts.values()) {
            if (!existing.getSource().equals(candidate.getSource())
                    || existing.getSeverity() != candidate.getSeverity()) {
                continue;
            }
            if (!withinWindow(candidate, existing)) {
                continue;
            }

            double score = similarity(candidate, existing);
            if (score < fuzzyThreshold) {
                continue;
            }

            if (score > bestScore
                    || (score == bestScore && existing.getId().compareTo(bestMatch.getId()) < 0)) {
                bestScore = score;
                bestMatch = existing;
            }
        }

        if (bestMatch != null) {
            log.debug(
                    "Fuzzy match for alert {}: {} ({}% similar)",
                    candidate.getId(),
                    bestMatch.getId(),
                    String.format("%.1f", bestScore * 100));
        }
        return bestMatch;
    }

    /** Weighted title/message similarity in [0, 1]. */
    public double similarity(Alert a, Alert b) {
        double titleSimilarity = TextSimilarity.ratio(a.getTitle(), b.getTitle());
        double messageSimilarity = TextSimilarity.ratio(a.getMessage(), b.getMessage());
        return titleSimilarity * TITLE_WEIGHT + messageSimilarity * MESSAGE_WEIGHT;
    }

    boolean withinWindow(Alert a, Alert b) {
        Duration gap = Duration.between(a.getTimestamp(), b.getTimestamp()).abs();
        return gap.compareTo(window) <= 0;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Duration getWindow() {
        return window;
    }

    public double getFuzzyThreshold() {
        return fuzzyThreshold;
    }
}
