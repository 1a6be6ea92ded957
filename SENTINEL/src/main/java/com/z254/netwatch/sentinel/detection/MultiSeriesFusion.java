package com.z254.netwatch.sentinel.detection;

import com.z254.netwatch.sentinel.domain.model.DiscordResult;
import com.z254.netwatch.sentinel.domain.model.FusionResult;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Combines per-series discord results into one anomaly decision.
 * <p>
 * The fused score is the mean of {@code weight * score} over series with ACTIVE status;
 * series still collecting data are left out entirely. Weights come from the configured
 * table, with a default for unknown series.
 */
public class MultiSeriesFusion {

    private final Map<String, Double> weights;
    private final double defaultWeight;
    private final double threshold;

    public MultiSeriesFusion(Map<String, Double> weights, double defaultWeight, double threshold) {
        if (threshold <= 0.0) {
            throw new IllegalArgumentException("fusion threshold must be positive: " + threshold);
        }
        this.weights = Map.copyOf(weights);
        this.defaultWeight = defaultWeight;
        this.threshold = threshold;
    }

    public FusionResult combine(Map<String, DiscordResult> results) {
        List<String> active = new ArrayList<>();
        List<Map.Entry<String, DiscordResult>> detected = new ArrayList<>();
        double weightedSum = 0.0;

        for (Map.Entry<String, DiscordResult> entry : results.entrySet()) {
            DiscordResult result = entry.getValue();
            if (result == null || !result.isActive()) {
                continue;
            }
            active.add(entry.getKey());
            weightedSum += weightFor(entry.getKey()) * result.getScore();
            if (result.isDiscord()) {
                detected.add(entry);
            }
        }

        if (active.isEmpty()) {
            return FusionResult.inactive();
        }

        double fused = weightedSum / active.size();
        detected.sort(Comparator.comparingDouble(
                (Map.Entry<String, DiscordResult> e) -> e.getValue().getScore()).reversed());

        return FusionResult.builder()
                .anomaly(fused > threshold)
                .confidence(Math.min(fused / threshold, 1.0))
                .score(fused)
                .activeSeries(List.copyOf(active))
                .detectedSeries(detected.stream().map(Map.Entry::getKey).toList())
                .build();
    }

    public double weightFor(String seriesName) {
        return weights.getOrDefault(seriesName, defaultWeight);
    }

    public double getThreshold() {
        return threshold;
    }
}
