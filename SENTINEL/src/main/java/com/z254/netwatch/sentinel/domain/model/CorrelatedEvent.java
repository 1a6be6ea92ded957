package com.z254.netwatch.sentinel.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * One incident: the anomaly events of a device that fell into the same correlation window.
 */
@Value
@Builder
public class CorrelatedEvent {

    /** Stable for the lifetime of the window */
    String id;

    /** Incremented each time the same window is re-emitted with a new modality */
    int revision;

    double windowStart;
    double windowEnd;

    Set<Modality> modalities;

    /** True when at least two modalities agree above the minimum confidence */
    boolean multiModal;

    double correlationStrength;

    String primaryDevice;
    String primaryInterface;
    String primaryPeer;

    /** Confidence of the event that won the location tie-break */
    double confidence;

    /** Confidence blended across modalities and correlation strength */
    double combinedConfidence;

    Set<String> detectedSeries;

    /** Events of the window at emission time, ordered by timestamp */
    List<AnomalyEvent> events;

    int eventCount;
}
