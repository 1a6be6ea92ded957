package com.z254.netwatch.sentinel.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Discord score of the most recent window of one series.
 */
@Value
@Builder
public class DiscordResult {

    private static final DiscordResult INSUFFICIENT = DiscordResult.builder()
            .score(0.0)
            .discord(false)
            .confidence(0.0)
            .status(DiscordStatus.INSUFFICIENT_DATA)
            .strategy(DiscordStrategyType.NONE)
            .build();

    double score;
    boolean discord;
    double confidence;
    DiscordStatus status;
    DiscordStrategyType strategy;

    /**
     * Neutral "not yet decidable" result.
     */
    public static DiscordResult insufficientData() {
        return INSUFFICIENT;
    }

    public boolean isActive() {
        return status == DiscordStatus.ACTIVE;
    }
}
