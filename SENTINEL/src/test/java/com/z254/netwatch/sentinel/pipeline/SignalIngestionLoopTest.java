package com.z254.netwatch.sentinel.pipeline;

import com.z254.netwatch.sentinel.config.SentinelProperties;
import com.z254.netwatch.sentinel.domain.model.Alert;
import com.z254.netwatch.sentinel.domain.model.Severity;
import com.z254.netwatch.sentinel.support.PipelineHarness;
import com.z254.netwatch.sentinel.support.SentinelFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.z254.netwatch.sentinel.support.SentinelFixtures.bgp;
import static com.z254.netwatch.sentinel.support.SentinelFixtures.snmp;
import static org.assertj.core.api.Assertions.assertThat;

class SignalIngestionLoopTest {

    private static final Clock CLOCK = Clock.fixed(Instant.ofEpochSecond(2_000), ZoneOffset.UTC);

    private SentinelProperties properties;
    private PipelineHarness harness;
    private SignalIngestionLoop loop;

    @BeforeEach
    void setUp() {
        properties = SentinelFixtures.properties();
        properties.getPipeline().setAutoStart(false);
        properties.getPipeline().setSweepInterval(Duration.ofHours(1));
        properties.getPipeline().setShutdownTimeout(Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        if (loop != null) {
            loop.stop();
        }
    }

    private void createLoop() {
        harness = new PipelineHarness(properties);
        loop = new SignalIngestionLoop(harness.pipeline, harness.metrics, CLOCK, properties);
    }

    @Test
    void rejectsSubmissionsBeforeStart() {
        createLoop();

        assertThat(loop.isRunning()).isFalse();
        assertThat(loop.submit(bgp("spine-01", 1_000, 0.8, "wdr_total"))).isFalse();
        assertThat(loop.stop()).isTrue();
    }

    @Test
    void submittedEventsReachAlertStream() {
        createLoop();
        loop.start();

        StepVerifier.create(harness.pipeline.alerts())
                .then(() -> {
                    assertThat(loop.submit(bgp("spine-01", 1_000, 0.85, "wdr_total"))).isTrue();
                    assertThat(loop.submit(snmp("spine-01", "Ethernet1/1", 1_005, 0.9, "interface_error_rate")))
                            .isTrue();
                })
                .assertNext(alert -> assertThat(alert.getSeverity()).isEqualTo(Severity.CRITICAL))
                .thenCancel()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void stopDrainsQueueAndFlushesOpenWindows() {
        createLoop();
        List<Alert> received = new CopyOnWriteArrayList<>();
        harness.pipeline.alerts().subscribe(received::add);
        loop.start();

        loop.submit(bgp("tor-01", 1_000, 0.9, "wdr_total"));
        boolean drained = loop.stop();

        assertThat(drained).isTrue();
        assertThat(loop.isRunning()).isFalse();
        assertThat(received).hasSize(1);
        assertThat(received.get(0).getLocation().getDevice()).isEqualTo("tor-01");
        assertThat(loop.getQueuedCount()).isZero();
        assertThat(loop.submit(bgp("tor-01", 1_010, 0.9, "wdr_total"))).isFalse();
    }

    @Test
    void periodicTickExpiresOldWindows() {
        properties.getPipeline().setSweepInterval(Duration.ofMillis(50));
        createLoop();
        loop.start();

        StepVerifier.create(harness.pipeline.alerts())
                .then(() -> loop.submit(bgp("spine-01", 1_000, 0.8, "wdr_total")))
                .assertNext(alert -> assertThat(alert.getCorrelationId()).isEqualTo("corr-spine-01-1000"))
                .thenCancel()
                .verify(Duration.ofSeconds(5));
    }
}
