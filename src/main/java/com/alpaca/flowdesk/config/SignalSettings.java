package com.alpaca.flowdesk.config;

import java.time.Duration;

/** Thresholds of the order-flow imbalance detector. */
public record SignalSettings(
        double imbalanceUp,
        double imbalanceDown,
        double maxSpread,
        double momentumThreshold,
        Duration hold,
        Duration cooldown,
        Duration refresh
) {
    public static SignalSettings defaults() {
        return new SignalSettings(2.0, 0.5, 0.05, 0.0005,
                Duration.ofSeconds(20), Duration.ofSeconds(300), Duration.ofSeconds(5));
    }
}
