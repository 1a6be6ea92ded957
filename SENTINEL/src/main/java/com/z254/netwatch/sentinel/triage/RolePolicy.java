package com.z254.netwatch.sentinel.triage;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Scoring policy of one device role.
 */
@Value
@Builder
public class RolePolicy {

    /** Starting point of the criticality score */
    double criticalityBase;

    /** Scales the blast-radius impact score */
    double blastRadiusMultiplier;

    @Builder.Default
    List<String> affectedServices = List.of();
}
