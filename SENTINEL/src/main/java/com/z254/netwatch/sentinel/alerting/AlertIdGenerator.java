package com.z254.netwatch.sentinel.alerting;

import java.time.Instant;

/**
 * Source of alert identifiers.
 */
public interface AlertIdGenerator {

    /**
     * @param timestamp time of the alert, used for the id suffix
     */
    String nextId(Instant timestamp);
}
