package com.alertaggregator.domain.model;

import com.alertaggregator.domain.enums.AlertSeverity;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/**
 * Row counts read from the alert store, as opposed to the in-memory {@link AlertStats}.
 */
@Data
@Builder
public class StorageStats {

    private long totalAlerts;

    private Map<AlertSeverity, Long> bySeverity;
}
