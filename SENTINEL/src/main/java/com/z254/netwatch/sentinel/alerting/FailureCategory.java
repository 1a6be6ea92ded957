package com.z254.netwatch.sentinel.alerting;

import java.util.Locale;

/**
 * Root-cause categories an alert can be classified into.
 */
public enum FailureCategory {
    LINK_FAILURE("30-60 minutes"),
    HARDWARE_FAILURE("1-4 hours"),
    BGP_PROCESS_ISSUE("15-30 minutes"),
    LINK_DEGRADATION("30-60 minutes"),
    THERMAL_ISSUE("1-2 hours"),
    POWER_ISSUE("2-4 hours"),
    RESOURCE_EXHAUSTION("15-30 minutes"),
    ROUTE_WITHDRAWAL("30-60 minutes"),
    ROUTING_INSTABILITY("30-60 minutes"),
    UNKNOWN_ANOMALY("30-60 minutes");

    private final String typicalResolution;

    FailureCategory(String typicalResolution) {
        this.typicalResolution = typicalResolution;
    }

    public String getTypicalResolution() {
        return typicalResolution;
    }

    /**
     * Alert type as reported on the alert, e.g. {@code link_failure}.
     */
    public String alertType() {
        return name().toLowerCase(Locale.ROOT);
    }
}
