package com.z254.netwatch.sentinel.domain.model;

/**
 * Topological scope within which a failure's effects are contained.
 */
public enum FailureDomain {
    RACK,
    POD,
    DATACENTER,
    REGION
}
