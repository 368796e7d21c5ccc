package com.alertaggregator.config;

import com.alertaggregator.domain.enums.AlertSeverity;
import com.alertaggregator.domain.enums.NotificationChannel;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the alert aggregation engine.
 *
 * <p>Properties are read from the {@code alertaggregator} prefix and grouped by concern:
 * {@code dedup}, {@code routing}, {@code retention} and {@code collector}.
 * Invalid values fail application startup.
 */
@Configuration
@ConfigurationProperties(prefix = "alertaggregator")
@Validated
@Getter
@Setter
public class AggregatorProperties {

    @Valid
    private Dedup dedup = new Dedup();

    @Valid
    private Routing routing = new Routing();

    @Valid
    private Retention retention = new Retention();

    private Collector collector = new Collector();

    @Getter
    @Setter
    public static class Dedup {

        /** When false every alert is stored as new. */
        private boolean enabled = true;

        /** Maximum distance between two alert timestamps for them to be merged. */
        @Min(0)
        private long windowSeconds = 3600;

        /** Minimum weighted similarity for a fuzzy merge. */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double fuzzyThreshold = 0.85;

        /** Reload stored active alerts inside the window into the active set at startup. */
        private boolean restoreActiveOnStartup = true;
    }

    @Getter
    @Setter
    public static class Routing {

        /** Install the built-in per-severity rules. */
        private boolean defaultRulesEnabled = true;

        /** Extra rules, added after the defaults. */
        @Valid
        private List<Rule> rules = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class Rule {

        @NotBlank
        private String name;

        private List<AlertSeverity> severities = new ArrayList<>();

        private List<NotificationChannel> channels = new ArrayList<>();

        /** Empty means any source. */
        private List<String> sources = new ArrayList<>();

        /** Empty means any tags; otherwise at least one must be present on the alert. */
        private List<String> tags = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class Retention {

        private boolean enabled = true;

        /** Resolved alerts older than this are deleted by the cleanup job. */
        @Min(0)
        private int days = 30;

        /** Spring cron expression for the cleanup job. */
        private String cleanupCron = "0 0 3 * * *";
    }

    @Getter
    @Setter
    public static class Collector {

        /** Downgrade unknown severity strings to INFO instead of rejecting them. */
        private boolean lenientSeverity = false;
    }
}
