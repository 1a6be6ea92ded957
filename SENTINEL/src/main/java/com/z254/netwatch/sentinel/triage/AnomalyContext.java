package com.z254.netwatch.sentinel.triage;

import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Anomaly facts triage needs beyond the location.
 */
@Value
@Builder
public class AnomalyContext {

    double confidence;
    boolean multiModal;

    @Builder.Default
    Set<String> detectedSeries = Set.of();

    /** First evidence of the anomaly, epoch seconds; null when unknown */
    Double anomalyStartedAt;

    /** Time the triage decision refers to, epoch seconds */
    double observedAt;
}
