package com.z254.netwatch.sentinel.triage;

import com.z254.netwatch.sentinel.config.SentinelProperties;
import com.z254.netwatch.sentinel.domain.model.AnomalyEvent;
import com.z254.netwatch.sentinel.domain.model.BlastRadius;
import com.z254.netwatch.sentinel.domain.model.CorrelatedEvent;
import com.z254.netwatch.sentinel.domain.model.Criticality;
import com.z254.netwatch.sentinel.domain.model.DeviceRole;
import com.z254.netwatch.sentinel.domain.model.ImpactClass;
import com.z254.netwatch.sentinel.domain.model.Location;
import com.z254.netwatch.sentinel.domain.model.RankedPrediction;
import com.z254.netwatch.sentinel.domain.model.Severity;
import com.z254.netwatch.sentinel.domain.model.TriageResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Topology-aware triage of a located anomaly.
 * <p>
 * Resolves the device role, estimates blast radius and criticality, derives the severity and
 * ranks candidate root-cause devices when the evidence names more than one.
 */
@Slf4j
@Component
public class TopologyTriage {

    private static final double PEER_FACTOR = 0.8;
    private static final double SIBLING_FACTOR = 0.5;
    private static final int MAX_SIBLINGS_PER_PEER = 4;

    private final TopologyRegistry topology;
    private final BlastRadiusEvaluator blastRadiusEvaluator;
    private final CriticalityAssessor criticalityAssessor;
    private final int maxRankedPredictions;

    public TopologyTriage(TopologyRegistry topology,
                          BlastRadiusEvaluator blastRadiusEvaluator,
                          CriticalityAssessor criticalityAssessor,
                          SentinelProperties properties) {
        this.topology = topology;
        this.blastRadiusEvaluator = blastRadiusEvaluator;
        this.criticalityAssessor = criticalityAssessor;
        this.maxRankedPredictions = properties.getTriage().getMaxRankedPredictions();
    }

    /**
     * Triage a correlated event using its own location and timing.
     */
    public TriageResult analyze(CorrelatedEvent event) {
        AnomalyContext context = AnomalyContext.builder()
                .confidence(event.getCombinedConfidence())
                .multiModal(event.isMultiModal())
                .detectedSeries(event.getDetectedSeries())
                .anomalyStartedAt(event.getWindowStart())
                .observedAt(event.getWindowEnd())
                .build();
        Location location = Location.builder()
                .device(event.getPrimaryDevice())
                .interfaceName(event.getPrimaryInterface())
                .bgpPeer(event.getPrimaryPeer())
                .confidence(event.getCombinedConfidence())
                .build();
        return analyze(context, location, event);
    }

    /**
     * @param context     anomaly facts
     * @param detected    location reported by detection
     * @param correlation correlated event backing the anomaly, may be null
     */
    public TriageResult analyze(AnomalyContext context, Location detected, CorrelatedEvent correlation) {
        // Resolve role
        DeviceRole role = topology.roleOf(detected.getDevice());
        boolean resolved = role != DeviceRole.UNKNOWN;
        double confidence = resolved ? context.getConfidence() : context.getConfidence() / 2.0;
        if (!resolved) {
            log.warn("Device {} not found in topology; triaging as unknown", detected.getDevice());
        }

        Location location = detected.toBuilder()
                .topologyRole(role)
                .confidence(confidence)
                .build();

        // Blast radius and criticality
        BlastRadius blastRadius = blastRadiusEvaluator.evaluate(detected.getDevice(), role);
        Criticality criticality = criticalityAssessor.assess(role, context, confidence, blastRadius);
        Severity severity = determineSeverity(blastRadius, criticality, confidence);

        // Candidate root causes
        List<RankedPrediction> predictions = rankPredictions(location, correlation);

        log.debug("Triage for {}: role={}, priority={}, severity={}, affected={}",
                detected.getDevice(), role, criticality.getPriority(), severity, blastRadius.getAffectedDevices());

        return TriageResult.builder()
                .location(location)
                .rankedPredictions(predictions)
                .blastRadius(blastRadius)
                .criticality(criticality)
                .severity(severity)
                .build();
    }

    static Severity determineSeverity(BlastRadius blastRadius, Criticality criticality, double confidence) {
        if (blastRadius.getImpactClass() == ImpactClass.NETWORK_IMPACTING
                && criticality.getPriority().isUrgent()) {
            return Severity.CRITICAL;
        }
        if (confidence >= 0.7) {
            return Severity.ERROR;
        }
        if (confidence >= 0.5) {
            return Severity.WARNING;
        }
        return Severity.INFO;
    }

    // ========== Private Methods ==========

    private List<RankedPrediction> rankPredictions(Location location, CorrelatedEvent correlation) {
        Map<String, RankedPrediction> candidates = new LinkedHashMap<>();
        offer(candidates, location.getDevice(), location.getTopologyRole(), location.getConfidence());

        // Peers named by routing evidence, best confidence per peer
        Map<String, Double> peers = new LinkedHashMap<>();
        if (correlation != null) {
            for (AnomalyEvent event : correlation.getEvents()) {
                if (event.hasPeer()) {
                    peers.merge(event.getBgpPeer(), event.getConfidence(), Math::max);
                }
            }
        }
        if (location.getBgpPeer() != null && !location.getBgpPeer().isBlank()) {
            peers.putIfAbsent(location.getBgpPeer(), location.getConfidence());
        }

        peers.forEach((peer, peerConfidence) -> {
            if (peer.equals(location.getDevice())) {
                return;
            }
            DeviceRole peerRole = topology.roleOf(peer);
            offer(candidates, peer, peerRole, peerConfidence * PEER_FACTOR);

            if (peerRole == DeviceRole.UNKNOWN) {
                return;
            }
            topology.devicesWithRole(peerRole).stream()
                    .filter(sibling -> !sibling.equals(peer) && !sibling.equals(location.getDevice()))
                    .limit(MAX_SIBLINGS_PER_PEER)
                    .forEach(sibling -> offer(candidates, sibling, peerRole, peerConfidence * SIBLING_FACTOR));
        });

        List<RankedPrediction> ranked = new ArrayList<>(candidates.values());
        ranked.sort(Comparator.comparingDouble(RankedPrediction::getConfidence).reversed()
                .thenComparing(Comparator.comparingInt((RankedPrediction p) -> p.getRole().getRank()).reversed())
                .thenComparing(RankedPrediction::getDevice));
        return List.copyOf(ranked.subList(0, Math.min(maxRankedPredictions, ranked.size())));
    }

    private static void offer(Map<String, RankedPrediction> candidates, String device, DeviceRole role,
                              double confidence) {
        if (device == null) {
            return;
        }
        RankedPrediction existing = candidates.get(device);
        if (existing == null || existing.getConfidence() < confidence) {
            candidates.put(device, RankedPrediction.builder()
                    .device(device)
                    .role(role)
                    .confidence(confidence)
                    .build());
        }
    }
}
