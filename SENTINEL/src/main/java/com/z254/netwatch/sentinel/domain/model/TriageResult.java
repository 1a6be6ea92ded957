package com.z254.netwatch.sentinel.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class TriageResult {
    Location location;
    @Builder.Default
    List<RankedPrediction> rankedPredictions = List.of();
    BlastRadius blastRadius;
    Criticality criticality;
    Severity severity;
}
