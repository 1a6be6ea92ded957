package com.z254.netwatch.sentinel.domain.model;

/**
 * Coarse classification of a blast radius.
 */
public enum ImpactClass {
    /** Contained to a rack or a single edge segment */
    EDGE_LOCAL,
    /** Spans several roles or takes out a single point of failure */
    NETWORK_IMPACTING
}
