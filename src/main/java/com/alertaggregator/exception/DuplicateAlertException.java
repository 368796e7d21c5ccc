package com.alertaggregator.exception;

import java.util.Map;

public class DuplicateAlertException extends BaseException {

    public DuplicateAlertException(String alertId) {
        super(
                ErrorCode.DUPLICATE_KEY,
                String.format("Alert already stored with id: %s", alertId),
                Map.of("alertId", alertId));
    }
}
