package com.z254.netwatch.sentinel.alerting;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Monotonic counter plus a base-36 epoch-second suffix: {@code alert-000042-sx2k9c}.
 */
@Component
public class SequentialAlertIdGenerator implements AlertIdGenerator {

    private final AtomicLong counter = new AtomicLong();

    @Override
    public String nextId(Instant timestamp) {
        return String.format("alert-%06d-%s", counter.incrementAndGet(),
                Long.toString(timestamp.getEpochSecond(), 36));
    }
}
