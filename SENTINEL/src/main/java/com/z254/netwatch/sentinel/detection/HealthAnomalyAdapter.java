package com.z254.netwatch.sentinel.detection;

import com.z254.netwatch.sentinel.domain.model.AnomalyEvent;
import com.z254.netwatch.sentinel.domain.model.FeatureVector;
import com.z254.netwatch.sentinel.domain.model.Modality;
import com.z254.netwatch.sentinel.domain.model.OutlierPrediction;
import com.z254.netwatch.sentinel.domain.model.Severity;
import com.z254.netwatch.sentinel.exception.InvalidSignalException;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Turns outlier-model verdicts on device-health samples into SNMP anomaly events.
 */
@Slf4j
public class HealthAnomalyAdapter {

    /** Features whose involvement raises the severity hint one step */
    public static final Set<String> CRITICAL_FEATURES = Set.of(
            "temperature_max", "interface_error_rate", "power_stability_score");

    private final OutlierClassifier classifier;

    public HealthAnomalyAdapter(OutlierClassifier classifier) {
        this.classifier = classifier;
    }

    /**
     * Score one sample.
     *
     * @return an SNMP event when the model flags the sample, otherwise empty
     * @throws InvalidSignalException if the sample has no device or a non-finite timestamp
     */
    public Optional<AnomalyEvent> adapt(FeatureVector vector) {
        validate(vector);

        OutlierPrediction prediction = classifier.predict(vector);
        if (prediction == null || !prediction.isAnomaly()) {
            return Optional.empty();
        }

        double confidence = clamp(prediction.getConfidence());
        List<String> affected = prediction.getAffectedFeatures() != null
                ? prediction.getAffectedFeatures() : List.of();
        Severity hint = severityHint(confidence, affected);

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("outlierScore", prediction.getScore());
        detail.put("features", new LinkedHashMap<>(vector.getFeatures()));

        AnomalyEvent event = AnomalyEvent.builder()
                .eventId("snmp-" + UUID.randomUUID())
                .timestamp(vector.getTimestamp())
                .modality(Modality.SNMP)
                .device(vector.getDevice())
                .interfaceName(vector.getInterfaceName())
                .confidence(confidence)
                .detectedSeries(Set.copyOf(affected))
                .severityHint(hint)
                .rawDetail(Map.copyOf(detail))
                .build();

        log.debug("Health anomaly on {} (confidence={}, hint={}, features={})",
                vector.getDevice(), confidence, hint, affected);
        return Optional.of(event);
    }

    static Severity severityHint(double confidence, List<String> affectedFeatures) {
        boolean critical = affectedFeatures.stream().anyMatch(CRITICAL_FEATURES::contains);
        if (confidence >= 0.85) {
            return critical ? Severity.CRITICAL : Severity.ERROR;
        }
        if (confidence >= 0.7) {
            return critical ? Severity.ERROR : Severity.WARNING;
        }
        if (confidence >= 0.5) {
            return Severity.WARNING;
        }
        return Severity.INFO;
    }

    private static void validate(FeatureVector vector) {
        if (vector == null) {
            throw new InvalidSignalException("health-sample", "sample is null");
        }
        if (vector.getDevice() == null || vector.getDevice().isBlank()) {
            throw new InvalidSignalException("health-sample", "device is required");
        }
        if (!Double.isFinite(vector.getTimestamp()) || vector.getTimestamp() < 0) {
            throw new InvalidSignalException("health-sample",
                    "invalid timestamp " + vector.getTimestamp() + " for " + vector.getDevice());
        }
        if (vector.getFeatures() == null) {
            throw new InvalidSignalException("health-sample", "features are required");
        }
    }

    private static double clamp(double confidence) {
        if (!Double.isFinite(confidence)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, confidence));
    }
}
