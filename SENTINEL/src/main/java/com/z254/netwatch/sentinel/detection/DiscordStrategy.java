package com.z254.netwatch.sentinel.detection;

import com.z254.netwatch.sentinel.domain.model.DiscordStrategyType;

import java.util.OptionalDouble;

/**
 * Scores how anomalous the most recent part of a series is.
 */
public interface DiscordStrategy {

    DiscordStrategyType type();

    /**
     * @param series     buffered observations, oldest first
     * @param windowSize subsequence length
     * @return the discord score, or empty when this strategy cannot score the input
     */
    OptionalDouble score(double[] series, int windowSize);
}
