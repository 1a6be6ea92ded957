package com.z254.netwatch.sentinel.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Weighted anomaly decision over all series of one modality.
 */
@Value
@Builder
public class FusionResult {

    boolean anomaly;
    double confidence;
    double score;

    /** Series that had enough data to contribute */
    @Builder.Default
    List<String> activeSeries = List.of();

    /** Active series whose own score crossed the discord threshold, strongest first */
    @Builder.Default
    List<String> detectedSeries = List.of();

    public static FusionResult inactive() {
        return FusionResult.builder().anomaly(false).confidence(0.0).score(0.0).build();
    }
}
