package com.z254.netwatch.sentinel.detection;

import com.z254.netwatch.sentinel.config.SentinelProperties;
import com.z254.netwatch.sentinel.domain.model.DiscordResult;
import com.z254.netwatch.sentinel.domain.model.DiscordStatus;
import com.z254.netwatch.sentinel.exception.InvalidSignalException;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Streaming discord detector over any number of named series.
 * <p>
 * Each series keeps its own bounded {@link SeriesBuffer}. A series reports
 * {@link DiscordStatus#INSUFFICIENT_DATA} until it holds {@code 2 * windowSize + 2} values;
 * after that every update scores the latest window with the primary strategy, falling back to
 * the secondary one when the primary cannot score the buffer or fails.
 * <p>
 * Not thread-safe. The pipeline drives each instance from a single thread.
 */
@Slf4j
public class SeriesDiscordDetector {

    private final int windowSize;
    private final int capacity;
    private final double threshold;
    private final int maxSeries;
    private final DiscordStrategy primary;
    private final DiscordStrategy fallback;

    private final Map<String, SeriesBuffer> buffers = new LinkedHashMap<>();

    public SeriesDiscordDetector(int windowSize, int bufferFactor, double threshold, int maxSeries,
                                 DiscordStrategy primary, DiscordStrategy fallback) {
        if (windowSize < 2) {
            throw new IllegalArgumentException("windowSize must be at least 2: " + windowSize);
        }
        if (threshold <= 0.0) {
            throw new IllegalArgumentException("threshold must be positive: " + threshold);
        }
        this.windowSize = windowSize;
        this.capacity = Math.max(windowSize * bufferFactor, minimumSamples(windowSize));
        this.threshold = threshold;
        this.maxSeries = maxSeries;
        this.primary = primary;
        this.fallback = fallback;
    }

    /**
     * Build a detector with the strategy pair selected by configuration.
     */
    public static SeriesDiscordDetector create(SentinelProperties.Detector config) {
        DiscordStrategy primary;
        DiscordStrategy fallback;
        if (config.getStrategy() == SentinelProperties.StrategyMode.ROLLING_ZSCORE) {
            primary = new RollingZScoreStrategy();
            fallback = null;
        } else {
            primary = new MatrixProfileDiscordStrategy();
            fallback = new RollingZScoreStrategy();
        }
        log.info("Discord detector configured: window={}, bufferFactor={}, threshold={}, strategy={}",
                config.getWindowSize(), config.getBufferFactor(), config.getThreshold(), primary.type());
        return new SeriesDiscordDetector(config.getWindowSize(), config.getBufferFactor(),
                config.getThreshold(), config.getMaxSeries(), primary, fallback);
    }

    /**
     * Append one observation and score the most recent window of that series.
     *
     * Non-finite values are buffered as observed; the matrix profile declines such buffers
     * and the z-score fallback scores around them.
     *
     * @throws InvalidSignalException if the series name is blank
     */
    public DiscordResult update(String seriesName, double value) {
        if (seriesName == null || seriesName.isBlank()) {
            throw new InvalidSignalException("series", "series name is required");
        }

        SeriesBuffer buffer = bufferFor(seriesName);
        buffer.append(value);

        if (buffer.size() < minimumSamples(windowSize)) {
            return DiscordResult.insufficientData();
        }

        double[] values = buffer.toArray();
        DiscordStrategy used = primary;
        OptionalDouble score = tryScore(primary, seriesName, values);
        if (score.isEmpty() && fallback != null) {
            used = fallback;
            score = tryScore(fallback, seriesName, values);
        }
        if (score.isEmpty()) {
            log.warn("No strategy could score series {}; reporting insufficient data", seriesName);
            return DiscordResult.insufficientData();
        }

        double s = score.getAsDouble();
        return DiscordResult.builder()
                .score(s)
                .discord(s > threshold)
                .confidence(Math.min(s / threshold, 1.0))
                .status(DiscordStatus.ACTIVE)
                .strategy(used.type())
                .build();
    }

    private OptionalDouble tryScore(DiscordStrategy strategy, String seriesName, double[] values) {
        try {
            OptionalDouble score = strategy.score(values, windowSize);
            if (score.isEmpty() && strategy == primary && fallback != null) {
                log.warn("Strategy {} could not score series {}; falling back to {}",
                        strategy.type(), seriesName, fallback.type());
            }
            return score;
        } catch (RuntimeException e) {
            log.warn("Strategy {} failed on series {}: {}", strategy.type(), seriesName, e.getMessage());
            return OptionalDouble.empty();
        }
    }

    private SeriesBuffer bufferFor(String seriesName) {
        SeriesBuffer buffer = buffers.get(seriesName);
        if (buffer != null) {
            return buffer;
        }
        if (buffers.size() >= maxSeries) {
            Iterator<String> oldest = buffers.keySet().iterator();
            String evicted = oldest.next();
            oldest.remove();
            log.warn("Series limit {} reached; evicting oldest series {}", maxSeries, evicted);
        }
        buffer = new SeriesBuffer(capacity);
        buffers.put(seriesName, buffer);
        return buffer;
    }

    /**
     * Current fill level per series.
     */
    public Map<String, Integer> bufferSizes() {
        Map<String, Integer> sizes = new LinkedHashMap<>();
        buffers.forEach((name, buffer) -> sizes.put(name, buffer.size()));
        return Collections.unmodifiableMap(sizes);
    }

    /**
     * Clear every buffer; all series return to insufficient data.
     */
    public void reset() {
        buffers.clear();
    }

    public int getWindowSize() {
        return windowSize;
    }

    public int getCapacity() {
        return capacity;
    }

    public double getThreshold() {
        return threshold;
    }

    static int minimumSamples(int windowSize) {
        return 2 * windowSize + 2;
    }
}
