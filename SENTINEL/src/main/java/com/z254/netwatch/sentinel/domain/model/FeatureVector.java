package com.z254.netwatch.sentinel.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * One polled device-health sample: feature name to value.
 */
@Value
@Builder
public class FeatureVector {

    String device;

    /** Interface the sample was polled from, may be null for chassis-level features */
    String interfaceName;

    /** Poll time, epoch seconds */
    double timestamp;

    @Builder.Default
    Map<String, Double> features = Map.of();
}
