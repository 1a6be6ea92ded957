package com.z254.netwatch.sentinel.detection;

import com.z254.netwatch.sentinel.domain.model.DiscordStrategyType;

import java.util.OptionalDouble;

/**
 * Discord search over the full pairwise matrix profile.
 * <p>
 * The buffer is standardized once against its baseline (every value before the most recent
 * window) and every subsequence of length {@code m} is compared with every other one using the
 * Euclidean distance of the standardized values. The profile value of a subsequence is the
 * distance to its nearest neighbour outside the trivial-match exclusion zone ({@code ceil(m/4)}
 * positions on each side). The discord score is the largest profile value.
 * <p>
 * The baseline scale does not depend on the latest window, so a larger spike above the series
 * never scores lower. A constant baseline is left unscaled.
 */
public class MatrixProfileDiscordStrategy implements DiscordStrategy {

    private static final double CONSTANT_EPSILON = 1e-10;

    @Override
    public DiscordStrategyType type() {
        return DiscordStrategyType.MATRIX_PROFILE;
    }

    @Override
    public OptionalDouble score(double[] series, int windowSize) {
        int n = series.length;
        int m = windowSize;
        int count = n - m + 1;
        if (m < 2 || count < 2) {
            return OptionalDouble.empty();
        }
        for (double v : series) {
            if (!Double.isFinite(v)) {
                return OptionalDouble.empty();
            }
        }

        double[] standardized = standardize(series, n - m);
        int exclusion = (int) Math.ceil(m / 4.0);
        double discord = 0.0;
        boolean profiled = false;

        for (int i = 0; i < count; i++) {
            double nearest = Double.POSITIVE_INFINITY;
            for (int j = 0; j < count; j++) {
                if (Math.abs(i - j) <= exclusion) {
                    continue;
                }
                double d = distance(standardized, m, i, j);
                if (d < nearest) {
                    nearest = d;
                }
            }
            if (Double.isFinite(nearest)) {
                profiled = true;
                discord = Math.max(discord, nearest);
            }
        }

        return profiled ? OptionalDouble.of(discord) : OptionalDouble.empty();
    }

    private static double[] standardize(double[] series, int baselineLength) {
        double sum = 0.0;
        for (int i = 0; i < baselineLength; i++) {
            sum += series[i];
        }
        double mean = sum / baselineLength;
        double sq = 0.0;
        for (int i = 0; i < baselineLength; i++) {
            double diff = series[i] - mean;
            sq += diff * diff;
        }
        double std = Math.sqrt(sq / baselineLength);
        double scale = std < CONSTANT_EPSILON ? 1.0 : std;

        double[] standardized = new double[series.length];
        for (int i = 0; i < series.length; i++) {
            standardized[i] = (series[i] - mean) / scale;
        }
        return standardized;
    }

    private static double distance(double[] values, int m, int i, int j) {
        double sq = 0.0;
        for (int k = 0; k < m; k++) {
            double diff = values[i + k] - values[j + k];
            sq += diff * diff;
        }
        return Math.sqrt(sq);
    }
}
