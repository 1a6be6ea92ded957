package com.z254.netwatch.sentinel.correlation;

import com.z254.netwatch.sentinel.domain.model.Modality;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Point-in-time snapshot of correlator counters.
 */
@Value
@Builder
public class CorrelationStatistics {

    /** Accepted events per modality since start or last reset */
    @Builder.Default
    Map<Modality, Long> eventsByModality = Map.of();

    /** Events per modality currently held in open windows */
    @Builder.Default
    Map<Modality, Long> openEventsByModality = Map.of();

    long totalEvents;

    /** Windows emitted as correlated events, revisions not counted */
    long correlated;

    long multiModalConfirmations;

    /** Single-modality windows closed below the confidence floor */
    long suppressed;

    long lateDropped;

    long rejected;

    /** Closed-window emissions dropped because the pending queue was full */
    long pendingDropped;

    int openWindows;

    double correlationRate;

    double multiModalRate;
}
