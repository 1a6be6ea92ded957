package com.z254.netwatch.sentinel.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;
import java.util.Set;

/**
 * Anomaly detected on a single modality for a single device.
 * <p>
 * Created by the detector adapters (or received pre-scored) and never mutated afterwards.
 */
@Value
public class AnomalyEvent {

    String eventId;

    /** Detection time, epoch seconds */
    double timestamp;

    Modality modality;

    /** Device the anomaly is attributed to; correlation key */
    String device;

    /** Interface, when the modality can locate it */
    String interfaceName;

    /** BGP peer reported by the routing pipeline */
    String bgpPeer;

    /** Detection confidence in [0, 1] */
    double confidence;

    Set<String> detectedSeries;

    /** Severity suggested by the producing detector, may be null */
    Severity severityHint;

    Map<String, Object> rawDetail;

    @Builder(toBuilder = true)
    private AnomalyEvent(String eventId, double timestamp, Modality modality, String device,
                         String interfaceName, String bgpPeer, double confidence,
                         Set<String> detectedSeries, Severity severityHint, Map<String, Object> rawDetail) {
        this.eventId = eventId;
        this.timestamp = timestamp;
        this.modality = modality;
        this.device = device;
        this.interfaceName = interfaceName;
        this.bgpPeer = bgpPeer;
        this.confidence = confidence;
        this.detectedSeries = detectedSeries != null ? Set.copyOf(detectedSeries) : Set.of();
        this.severityHint = severityHint;
        this.rawDetail = rawDetail != null ? Map.copyOf(rawDetail) : Map.of();
    }

    public boolean hasInterface() {
        return interfaceName != null && !interfaceName.isBlank();
    }

    public boolean hasPeer() {
        return bgpPeer != null && !bgpPeer.isBlank();
    }
}
