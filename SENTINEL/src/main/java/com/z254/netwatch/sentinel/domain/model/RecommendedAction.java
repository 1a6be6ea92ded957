package com.z254.netwatch.sentinel.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Operator action, optionally with a rendered CLI command.
 */
@Value
@Builder
public class RecommendedAction {
    int order;
    String description;
    /** Rendered command, null when the action is not a device command */
    String command;
    int estimatedMinutes;
}
