package com.z254.netwatch.sentinel.domain.model;

/**
 * Telemetry modality an anomaly event was detected on.
 */
public enum Modality {

    /** BGP update stream scored by the discord detector */
    BGP("bgp"),

    /** SNMP device-health polling scored by the outlier classifier */
    SNMP("snmp"),

    /** Pre-scored trap / syslog events */
    TRAP("trap");

    private final String wireName;

    Modality(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }
}
