package com.z254.netwatch.sentinel.domain.model;

/**
 * Algorithm that produced a discord score.
 */
public enum DiscordStrategyType {
    /** Pairwise subsequence-distance discord (matrix profile) */
    MATRIX_PROFILE,
    /** Rolling z-score of the recent window against the trailing baseline */
    ROLLING_ZSCORE,
    /** Nothing was computed (not enough data) */
    NONE
}
