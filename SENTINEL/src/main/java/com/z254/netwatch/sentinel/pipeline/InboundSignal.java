package com.z254.netwatch.sentinel.pipeline;

import com.z254.netwatch.sentinel.domain.model.AnomalyEvent;
import com.z254.netwatch.sentinel.domain.model.FeatureBin;
import com.z254.netwatch.sentinel.domain.model.FeatureVector;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * One item of the ingestion queue.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
final class InboundSignal {

    enum Kind {
        EVENT, ROUTING_BIN, HEALTH_SAMPLE, TICK
    }

    private final Kind kind;
    private final Object payload;
    private final double tickTime;

    static InboundSignal event(AnomalyEvent event) {
        return new InboundSignal(Kind.EVENT, event, 0.0);
    }

    static InboundSignal routingBin(FeatureBin bin) {
        return new InboundSignal(Kind.ROUTING_BIN, bin, 0.0);
    }

    static InboundSignal healthSample(FeatureVector sample) {
        return new InboundSignal(Kind.HEALTH_SAMPLE, sample, 0.0);
    }

    static InboundSignal tick(double now) {
        return new InboundSignal(Kind.TICK, null, now);
    }
}
