package com.z254.netwatch.sentinel.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Final operational alert, one per emitted {@link CorrelatedEvent}.
 */
@Value
@Builder
public class Alert {

    String alertId;

    Instant timestamp;

    Severity severity;

    Priority priority;

    double confidence;

    /** Failure category name, e.g. {@code link_failure} */
    String alertType;

    Location location;

    BlastRadius blastRadius;

    Criticality criticality;

    String probableRootCause;

    List<String> supportingEvidence;

    List<RecommendedAction> recommendedActions;

    boolean escalationRequired;

    String estimatedResolution;

    /** Location device followed by the first downstream devices */
    List<String> affectedDevices;

    /** Id of the correlated event the alert was built from */
    String correlationId;

    boolean multiModal;
}
