package com.alpaca.flowdesk.config;

import java.time.Duration;

public record FollowSettings(double minMove, Duration maxSilence, Duration poll, int queueCapacity) {

    public static FollowSettings defaults() {
        return new FollowSettings(0.05, Duration.ofSeconds(60), Duration.ofSeconds(5), 1024);
    }
}
