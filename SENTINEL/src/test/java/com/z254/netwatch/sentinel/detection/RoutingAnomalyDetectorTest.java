package com.z254.netwatch.sentinel.detection;

import com.z254.netwatch.sentinel.config.SentinelProperties;
import com.z254.netwatch.sentinel.domain.model.AnomalyEvent;
import com.z254.netwatch.sentinel.domain.model.FeatureBin;
import com.z254.netwatch.sentinel.domain.model.Modality;
import com.z254.netwatch.sentinel.exception.InvalidSignalException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoutingAnomalyDetectorTest {

    private RoutingAnomalyDetector detector;

    @BeforeEach
    void setUp() {
        SentinelProperties properties = new SentinelProperties();
        properties.getDetector().setWindowSize(4);
        properties.getDetector().setBufferFactor(3);
        properties.getDetector().setStrategy(SentinelProperties.StrategyMode.ROLLING_ZSCORE);
        detector = new RoutingAnomalyDetector(properties);
    }

    private static FeatureBin quietBin(int index) {
        long start = 1_000L + index * 30L;
        return FeatureBin.builder()
                .binStart(start)
                .binEnd(start + 30)
                .totals(Map.of(
                        "wdr_total", index % 2 == 0 ? 10.0 : 12.0,
                        "ann_total", 50.0,
                        "as_path_churn", 2.0))
                .build();
    }

    private void warmUp() {
        for (int i = 0; i < 11; i++) {
            assertThat(detector.process(quietBin(i))).isEmpty();
        }
    }

    @Test
    void withdrawalBurstIsAttributedToStrongestPeer() {
        warmUp();
        FeatureBin burst = FeatureBin.builder()
                .binStart(1_330L)
                .binEnd(1_360L)
                .totals(Map.of("wdr_total", 500.0, "ann_total", 50.0, "as_path_churn", 2.0))
                .perPeer(Map.of(
                        "10.0.0.1", Map.of("wdr_total", 20.0),
                        "10.0.0.2", Map.of("wdr_total", 480.0)))
                .build();

        Optional<AnomalyEvent> event = detector.process(burst);

        assertThat(event).isPresent();
        assertThat(event.get().getModality()).isEqualTo(Modality.BGP);
        assertThat(event.get().getDevice()).isEqualTo("10.0.0.2");
        assertThat(event.get().getBgpPeer()).isEqualTo("10.0.0.2");
        assertThat(event.get().getTimestamp()).isEqualTo(1_360.0);
        assertThat(event.get().getDetectedSeries()).contains("wdr_total");
        assertThat(event.get().getConfidence()).isEqualTo(1.0);
    }

    @Test
    void burstWithoutPeerBreakdownIsAttributedToCollector() {
        warmUp();
        FeatureBin burst = FeatureBin.builder()
                .binStart(1_330L)
                .binEnd(1_360L)
                .totals(Map.of("wdr_total", 500.0))
                .build();

        Optional<AnomalyEvent> event = detector.process(burst);

        assertThat(event).isPresent();
        assertThat(event.get().getDevice()).isEqualTo("bgp-collector");
        assertThat(event.get().getBgpPeer()).isNull();
    }

    @Test
    void rejectsBinEndingBeforeItStarts() {
        FeatureBin broken = FeatureBin.builder().binStart(100L).binEnd(100L).build();

        assertThatThrownBy(() -> detector.process(broken))
                .isInstanceOf(InvalidSignalException.class)
                .hasMessageContaining("feature-bin");
    }

    @Test
    void resetStartsWarmUpAgain() {
        warmUp();
        detector.reset();

        assertThat(detector.bufferSizes()).isEmpty();
        assertThat(detector.process(quietBin(0))).isEmpty();
        assertThat(detector.bufferSizes()).containsEntry("wdr_total", 1);
    }
}
