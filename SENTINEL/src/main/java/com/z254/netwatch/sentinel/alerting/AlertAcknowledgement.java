package com.z254.netwatch.sentinel.alerting;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Operator acknowledgment recorded next to an alert.
 */
@Value
@Builder
public class AlertAcknowledgement {
    String alertId;
    String acknowledgedBy;
    Instant acknowledgedAt;
}
