package com.z254.netwatch.sentinel.domain.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RankedPrediction {
    String device;
    DeviceRole role;
    double confidence;
}
