package com.z254.netwatch.sentinel.detection;

import com.z254.netwatch.sentinel.config.SentinelProperties;
import com.z254.netwatch.sentinel.domain.model.AnomalyEvent;
import com.z254.netwatch.sentinel.domain.model.DiscordResult;
import com.z254.netwatch.sentinel.domain.model.FeatureBin;
import com.z254.netwatch.sentinel.domain.model.FusionResult;
import com.z254.netwatch.sentinel.domain.model.Modality;
import com.z254.netwatch.sentinel.exception.InvalidSignalException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Routing-update modality: scores every configured series of a feature bin and fuses the
 * results into at most one BGP anomaly event per bin.
 * <p>
 * The event is attributed to the peer contributing most to the strongest detected series.
 * Bins without a per-peer breakdown are attributed to the collector itself.
 */
@Slf4j
@Component
public class RoutingAnomalyDetector {

    private final SeriesDiscordDetector detector;
    private final MultiSeriesFusion fusion;
    private final List<String> seriesKeys;
    private final String collectorDevice;

    public RoutingAnomalyDetector(SentinelProperties properties) {
        SentinelProperties.Detector detectorConfig = properties.getDetector();
        SentinelProperties.Fusion fusionConfig = properties.getFusion();
        this.detector = SeriesDiscordDetector.create(detectorConfig);
        this.fusion = new MultiSeriesFusion(fusionConfig.getWeights(),
                fusionConfig.getDefaultWeight(), fusionConfig.getThreshold());
        this.seriesKeys = List.copyOf(detectorConfig.getSeriesKeys());
        this.collectorDevice = detectorConfig.getCollectorDevice();
    }

    /**
     * Feed one bin through detection and fusion.
     *
     * @throws InvalidSignalException if the bin is malformed
     */
    public Optional<AnomalyEvent> process(FeatureBin bin) {
        validate(bin);

        Map<String, DiscordResult> results = new LinkedHashMap<>();
        for (String series : seriesKeys) {
            results.put(series, detector.update(series, bin.total(series)));
        }

        FusionResult fused = fusion.combine(results);
        if (!fused.isAnomaly()) {
            return Optional.empty();
        }

        List<String> detected = fused.getDetectedSeries().isEmpty()
                ? List.of(strongestActive(results, fused))
                : fused.getDetectedSeries();
        Optional<String> peer = attributePeer(bin, detected.get(0));

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("fusedScore", fused.getScore());
        detail.put("binStart", bin.getBinStart());
        detail.put("binEnd", bin.getBinEnd());
        Map<String, Double> scores = new LinkedHashMap<>();
        results.forEach((name, result) -> scores.put(name, result.getScore()));
        detail.put("seriesScores", scores);
        detail.put("strategy", results.get(detected.get(0)).getStrategy().name());

        AnomalyEvent event = AnomalyEvent.builder()
                .eventId("bgp-" + bin.getBinStart() + "-" + bin.getBinEnd())
                .timestamp(bin.getBinEnd())
                .modality(Modality.BGP)
                .device(peer.orElse(collectorDevice))
                .bgpPeer(peer.orElse(null))
                .confidence(fused.getConfidence())
                .detectedSeries(Set.copyOf(detected))
                .rawDetail(Map.copyOf(detail))
                .build();

        log.info("Routing anomaly in bin [{}, {}): score={}, series={}, device={}",
                bin.getBinStart(), bin.getBinEnd(), fused.getScore(), detected, event.getDevice());
        return Optional.of(event);
    }

    /**
     * Clear all series history.
     */
    public void reset() {
        detector.reset();
    }

    public Map<String, Integer> bufferSizes() {
        return detector.bufferSizes();
    }

    private String strongestActive(Map<String, DiscordResult> results, FusionResult fused) {
        return fused.getActiveSeries().stream()
                .max((a, b) -> Double.compare(
                        fusion.weightFor(a) * results.get(a).getScore(),
                        fusion.weightFor(b) * results.get(b).getScore()))
                .orElseThrow();
    }

    private static Optional<String> attributePeer(FeatureBin bin, String series) {
        return bin.getPerPeer().entrySet().stream()
                .filter(e -> e.getValue().get(series) != null)
                .filter(e -> e.getValue().get(series) > 0.0)
                .max((a, b) -> Double.compare(a.getValue().get(series), b.getValue().get(series)))
                .map(Map.Entry::getKey);
    }

    private static void validate(FeatureBin bin) {
        if (bin == null) {
            throw new InvalidSignalException("feature-bin", "bin is null");
        }
        if (bin.getBinEnd() <= bin.getBinStart()) {
            throw new InvalidSignalException("feature-bin",
                    "bin end " + bin.getBinEnd() + " is not after start " + bin.getBinStart());
        }
    }
}
