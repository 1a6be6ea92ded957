package com.z254.netwatch.sentinel.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.HashMap;
import java.util.Map;

/**
 * Fixed-duration aggregate of routing updates produced by the external feature extractor.
 * <p>
 * {@code totals} holds one value per series name (e.g. {@code wdr_total}); {@code perPeer}
 * maps each BGP peer to its share of the same series.
 */
@Value
public class FeatureBin {

    /** Bin start, epoch seconds */
    long binStart;

    /** Bin end, epoch seconds (exclusive) */
    long binEnd;

    Map<String, Double> totals;

    Map<String, Map<String, Double>> perPeer;

    @Builder
    private FeatureBin(long binStart, long binEnd, Map<String, Double> totals,
                       Map<String, Map<String, Double>> perPeer) {
        this.binStart = binStart;
        this.binEnd = binEnd;
        this.totals = totals != null ? Map.copyOf(totals) : Map.of();
        Map<String, Map<String, Double>> peers = new HashMap<>();
        if (perPeer != null) {
            perPeer.forEach((peer, bySeries) -> {
                if (bySeries != null) {
                    peers.put(peer, Map.copyOf(bySeries));
                }
            });
        }
        this.perPeer = Map.copyOf(peers);
    }

    public double total(String seriesName) {
        Double value = totals.get(seriesName);
        return value != null ? value : 0.0;
    }
}
