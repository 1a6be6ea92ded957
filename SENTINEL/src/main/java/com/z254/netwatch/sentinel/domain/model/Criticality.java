package com.z254.netwatch.sentinel.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class Criticality {

    /** Score in [0, 10] */
    double score;

    Priority priority;

    /** Human-readable contributions to the score */
    @Builder.Default
    List<String> factors = List.of();

    boolean slaBreachLikely;

    /** Minutes until the SLA window is exhausted; null when not computable */
    Double timeToBreachMin;
}
