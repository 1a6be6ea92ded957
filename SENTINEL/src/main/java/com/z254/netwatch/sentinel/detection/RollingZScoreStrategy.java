package com.z254.netwatch.sentinel.detection;

import com.z254.netwatch.sentinel.domain.model.DiscordStrategyType;

import java.util.OptionalDouble;

/**
 * Cheap discord approximation: the largest z-score of the most recent window measured
 * against the mean and standard deviation of everything buffered before it.
 * <p>
 * Non-finite observations are skipped on both sides, so a gap in the feed does not
 * poison the baseline.
 */
public class RollingZScoreStrategy implements DiscordStrategy {

    private static final double STD_EPSILON = 1e-9;

    @Override
    public DiscordStrategyType type() {
        return DiscordStrategyType.ROLLING_ZSCORE;
    }

    @Override
    public OptionalDouble score(double[] series, int windowSize) {
        int baselineLength = series.length - windowSize;
        if (windowSize < 1 || baselineLength < 2) {
            return OptionalDouble.empty();
        }

        int count = 0;
        double sum = 0.0;
        for (int i = 0; i < baselineLength; i++) {
            if (Double.isFinite(series[i])) {
                sum += series[i];
                count++;
            }
        }
        if (count < 2) {
            return OptionalDouble.empty();
        }
        double mean = sum / count;

        double sq = 0.0;
        for (int i = 0; i < baselineLength; i++) {
            if (Double.isFinite(series[i])) {
                double diff = series[i] - mean;
                sq += diff * diff;
            }
        }
        double std = Math.sqrt(sq / count);

        double max = 0.0;
        boolean scored = false;
        for (int i = baselineLength; i < series.length; i++) {
            if (!Double.isFinite(series[i])) {
                continue;
            }
            max = Math.max(max, Math.abs(series[i] - mean) / (std + STD_EPSILON));
            scored = true;
        }
        return scored ? OptionalDouble.of(max) : OptionalDouble.empty();
    }
}
