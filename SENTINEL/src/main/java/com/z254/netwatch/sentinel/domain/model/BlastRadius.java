package com.z254.netwatch.sentinel.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class BlastRadius {

    int affectedDevices;

    @Builder.Default
    List<String> affectedServices = List.of();

    @Builder.Default
    List<String> downstreamDevices = List.of();

    boolean redundancyAvailable;

    /** Single point of failure */
    boolean spof;

    FailureDomain failureDomain;

    double impactScore;

    ImpactClass impactClass;

    public static BlastRadius none() {
        return BlastRadius.builder()
                .affectedDevices(0)
                .redundancyAvailable(true)
                .spof(false)
                .failureDomain(FailureDomain.RACK)
                .impactScore(0.0)
                .impactClass(ImpactClass.EDGE_LOCAL)
                .build();
    }
}
