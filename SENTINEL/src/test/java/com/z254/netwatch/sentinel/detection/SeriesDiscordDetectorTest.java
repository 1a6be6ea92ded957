package com.z254.netwatch.sentinel.detection;

import com.z254.netwatch.sentinel.config.SentinelProperties;
import com.z254.netwatch.sentinel.domain.model.DiscordResult;
import com.z254.netwatch.sentinel.domain.model.DiscordStatus;
import com.z254.netwatch.sentinel.domain.model.DiscordStrategyType;
import com.z254.netwatch.sentinel.exception.InvalidSignalException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SeriesDiscordDetectorTest {

    private static final int WINDOW = 8;

    private static SeriesDiscordDetector detector(SentinelProperties.StrategyMode mode) {
        SentinelProperties.Detector config = new SentinelProperties.Detector();
        config.setWindowSize(WINDOW);
        config.setBufferFactor(3);
        config.setThreshold(2.5);
        config.setStrategy(mode);
        return SeriesDiscordDetector.create(config);
    }

    private static double sine(int i) {
        return Math.sin(2 * Math.PI * i / WINDOW);
    }

    @Nested
    @DisplayName("Warm-up")
    class WarmUp {

        @Test
        @DisplayName("reports insufficient data until 2w+2 observations")
        void insufficientUntilMinimumSamples() {
            SeriesDiscordDetector detector = detector(SentinelProperties.StrategyMode.AUTO);

            for (int i = 0; i < 2 * WINDOW + 1; i++) {
                DiscordResult result = detector.update("wdr_total", sine(i));
                assertThat(result.getStatus()).isEqualTo(DiscordStatus.INSUFFICIENT_DATA);
                assertThat(result.getScore()).isZero();
                assertThat(result.isDiscord()).isFalse();
                assertThat(result.getStrategy()).isEqualTo(DiscordStrategyType.NONE);
            }

            DiscordResult ready = detector.update("wdr_total", sine(2 * WINDOW + 1));
            assertThat(ready.getStatus()).isEqualTo(DiscordStatus.ACTIVE);
        }

        @Test
        @DisplayName("capacity never drops below the minimum sample count")
        void capacityCoversMinimumSamples() {
            SeriesDiscordDetector small = new SeriesDiscordDetector(4, 2, 2.5, 8,
                    new RollingZScoreStrategy(), null);
            SeriesDiscordDetector large = new SeriesDiscordDetector(8, 3, 2.5, 8,
                    new RollingZScoreStrategy(), null);

            assertThat(small.getCapacity()).isEqualTo(10);
            assertThat(large.getCapacity()).isEqualTo(24);
        }
    }

    @Nested
    @DisplayName("Scoring")
    class Scoring {

        @Test
        @DisplayName("larger spikes never score lower with the z-score")
        void spikeScoreIsMonotone() {
            List<Double> scores = spikeScores(SentinelProperties.StrategyMode.ROLLING_ZSCORE);

            assertThat(scores).isSorted();
            assertThat(scores.get(scores.size() - 1)).isGreaterThan(2.5);
        }

        @Test
        @DisplayName("larger spikes never score lower with the matrix profile")
        void matrixProfileSpikeScoreIsMonotone() {
            List<Double> scores = spikeScores(SentinelProperties.StrategyMode.MATRIX_PROFILE);

            assertThat(scores).isSorted();
            assertThat(scores.get(scores.size() - 1)).isGreaterThan(2.5);
        }

        @Test
        @DisplayName("auto mode scores spikes with the matrix profile")
        void autoModeUsesMatrixProfile() {
            SeriesDiscordDetector detector = detector(SentinelProperties.StrategyMode.AUTO);
            for (int i = 0; i < 3 * WINDOW - 1; i++) {
                detector.update("wdr_total", sine(i));
            }

            DiscordResult result = detector.update("wdr_total", 64.0);

            assertThat(result.getStrategy()).isEqualTo(DiscordStrategyType.MATRIX_PROFILE);
            assertThat(result.isDiscord()).isTrue();
        }

        private List<Double> spikeScores(SentinelProperties.StrategyMode mode) {
            List<Double> scores = new ArrayList<>();
            for (double magnitude : new double[]{2, 4, 8, 16, 32, 64}) {
                SeriesDiscordDetector detector = detector(mode);
                for (int i = 0; i < 3 * WINDOW - 1; i++) {
                    detector.update("wdr_total", sine(i));
                }
                DiscordResult result = detector.update("wdr_total", magnitude);
                assertThat(result.getStatus()).isEqualTo(DiscordStatus.ACTIVE);
                scores.add(result.getScore());
            }
            return scores;
        }

        @Test
        @DisplayName("matrix profile separates a spike from a clean periodic series")
        void matrixProfileFindsSpike() {
            SeriesDiscordDetector clean = detector(SentinelProperties.StrategyMode.MATRIX_PROFILE);
            SeriesDiscordDetector spiked = detector(SentinelProperties.StrategyMode.MATRIX_PROFILE);

            DiscordResult cleanResult = null;
            DiscordResult spikedResult = null;
            for (int i = 0; i < 3 * WINDOW; i++) {
                cleanResult = clean.update("wdr_total", sine(i));
                spikedResult = spiked.update("wdr_total", i == 3 * WINDOW - 1 ? 10.0 : sine(i));
            }

            assertThat(cleanResult.getStrategy()).isEqualTo(DiscordStrategyType.MATRIX_PROFILE);
            assertThat(cleanResult.getScore()).isLessThan(0.1);
            assertThat(cleanResult.isDiscord()).isFalse();
            assertThat(spikedResult.getStrategy()).isEqualTo(DiscordStrategyType.MATRIX_PROFILE);
            assertThat(spikedResult.getScore()).isGreaterThan(cleanResult.getScore() + 1.0);
        }

        @Test
        @DisplayName("confidence is the score relative to the threshold, capped at one")
        void confidenceScalesWithThreshold() {
            SeriesDiscordDetector detector = detector(SentinelProperties.StrategyMode.ROLLING_ZSCORE);
            DiscordResult result = null;
            for (int i = 0; i < 3 * WINDOW; i++) {
                result = detector.update("wdr_total", i == 3 * WINDOW - 1 ? 100.0 : sine(i));
            }

            assertThat(result.isDiscord()).isTrue();
            assertThat(result.getConfidence()).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Strategy fallback")
    class Fallback {

        @Test
        @DisplayName("non-finite input falls back to the z-score")
        void nonFiniteInputUsesFallback() {
            SeriesDiscordDetector detector = detector(SentinelProperties.StrategyMode.AUTO);
            DiscordResult result = null;
            for (int i = 0; i < 3 * WINDOW; i++) {
                result = detector.update("wdr_total", i == 5 ? Double.NaN : sine(i));
            }

            assertThat(result.getStatus()).isEqualTo(DiscordStatus.ACTIVE);
            assertThat(result.getStrategy()).isEqualTo(DiscordStrategyType.ROLLING_ZSCORE);
        }

        @Test
        @DisplayName("a failing primary strategy is replaced by the fallback")
        void failingPrimaryUsesFallback() {
            DiscordStrategy broken = new DiscordStrategy() {
                @Override
                public DiscordStrategyType type() {
                    return DiscordStrategyType.MATRIX_PROFILE;
                }

                @Override
                public OptionalDouble score(double[] series, int windowSize) {
                    throw new IllegalStateException("boom");
                }
            };
            SeriesDiscordDetector detector = new SeriesDiscordDetector(4, 3, 2.5, 8,
                    broken, new RollingZScoreStrategy());

            DiscordResult result = null;
            for (int i = 0; i < 12; i++) {
                result = detector.update("ann_total", i % 2);
            }

            assertThat(result.getStatus()).isEqualTo(DiscordStatus.ACTIVE);
            assertThat(result.getStrategy()).isEqualTo(DiscordStrategyType.ROLLING_ZSCORE);
        }

        @Test
        @DisplayName("no usable strategy yields insufficient data")
        void noStrategyYieldsInsufficientData() {
            DiscordStrategy empty = new DiscordStrategy() {
                @Override
                public DiscordStrategyType type() {
                    return DiscordStrategyType.MATRIX_PROFILE;
                }

                @Override
                public OptionalDouble score(double[] series, int windowSize) {
                    return OptionalDouble.empty();
                }
            };
            SeriesDiscordDetector detector = new SeriesDiscordDetector(4, 3, 2.5, 8, empty, null);

            DiscordResult result = null;
            for (int i = 0; i < 12; i++) {
                result = detector.update("ann_total", i);
            }

            assertThat(result).isEqualTo(DiscordResult.insufficientData());
        }
    }

    @Nested
    @DisplayName("Series state")
    class SeriesState {

        @Test
        void evictsOldestSeriesBeyondLimit() {
            SeriesDiscordDetector detector = new SeriesDiscordDetector(4, 3, 2.5, 2,
                    new RollingZScoreStrategy(), null);
            detector.update("a", 1.0);
            detector.update("b", 1.0);
            detector.update("c", 1.0);

            assertThat(detector.bufferSizes()).containsOnlyKeys("b", "c");
        }

        @Test
        void resetClearsAllSeries() {
            SeriesDiscordDetector detector = detector(SentinelProperties.StrategyMode.AUTO);
            for (int i = 0; i < 3 * WINDOW; i++) {
                detector.update("wdr_total", sine(i));
            }

            detector.reset();

            assertThat(detector.bufferSizes()).isEmpty();
            assertThat(detector.update("wdr_total", 1.0).getStatus()).isEqualTo(DiscordStatus.INSUFFICIENT_DATA);
        }

        @Test
        void rejectsBlankSeriesName() {
            SeriesDiscordDetector detector = detector(SentinelProperties.StrategyMode.AUTO);

            assertThatThrownBy(() -> detector.update(" ", 1.0))
                    .isInstanceOf(InvalidSignalException.class);
        }
    }
}
