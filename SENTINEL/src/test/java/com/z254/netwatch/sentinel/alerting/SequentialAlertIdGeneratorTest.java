package com.z254.netwatch.sentinel.alerting;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class SequentialAlertIdGeneratorTest {

    @Test
    void idsAreSequentialAndCarryTimestamp() {
        SequentialAlertIdGenerator generator = new SequentialAlertIdGenerator();
        Instant timestamp = Instant.ofEpochSecond(1_700_000_000L);
        String suffix = Long.toString(1_700_000_000L, 36);

        assertThat(generator.nextId(timestamp)).isEqualTo("alert-000001-" + suffix);
        assertThat(generator.nextId(timestamp)).isEqualTo("alert-000002-" + suffix);
    }
}
