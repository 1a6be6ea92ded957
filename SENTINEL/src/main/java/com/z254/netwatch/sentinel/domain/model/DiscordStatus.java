package com.z254.netwatch.sentinel.domain.model;

public enum DiscordStatus {
    ACTIVE,
    INSUFFICIENT_DATA
}
