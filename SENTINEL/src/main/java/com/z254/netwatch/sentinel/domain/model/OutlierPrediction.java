package com.z254.netwatch.sentinel.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Verdict of an {@code OutlierClassifier} for one feature vector.
 */
@Value
@Builder
public class OutlierPrediction {

    boolean anomaly;
    double score;
    double confidence;

    /** Features the model holds responsible, most significant first */
    @Builder.Default
    List<String> affectedFeatures = List.of();
}
