package com.alertaggregator.service;

import com.alertaggregator.config.AggregatorProperties;
import com.alertaggregator.core.engine.AlertAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Scheduled pruning of resolved alerts past the retention period.
 *
 * <p>Runs on {@code alertaggregator.retention.cleanup-cron} (daily at 03:00 by default). Only
 * RESOLVED alerts are ever removed. A failed run is logged and retried on the next schedule.
 */
@Service
public class AlertRetentionService {

    private static final Logger log = LoggerFactory.getLogger(AlertRetentionService.class);

    private final AlertAggregator alertAggregator;
    private final AggregatorProperties aggregatorProperties;

    public AlertRetentionService(AlertAggregator alertAggregator, AggregatorProperties aggregatorProperties) {
        this.alertAggregator = alertAggregator;
        this.aggregatorProperties = aggregatorProperties;
    }

    @Scheduled(cron = "${alertaggregator.retention.cleanup-cron:0 0 3 * * *}")
    public void scheduledCleanup() {
        runCleanup();
    }

    /**
     * @return rows deleted, or -1 when retention is disabled or the run failed
     */
    public int runCleanup() {
        AggregatorProperties.Retention retention = aggregatorProperties.getRetention();
        if (!retention.isEnabled()) {
            log.debug("Alert retention disabled, skipping cleanup");
            return -1;
        }
        try {
            int deleted = alertAggregator.cleanupOldAlerts(retention.getDays());
            log.info("Retention cleanup removed {} resolved alerts (retention={} days)", deleted, retention.getDays());
            return deleted;
        } catch (Exception e) {
            log.error("Retention cleanup failed", e);
            return -1;
        }
    }
}
