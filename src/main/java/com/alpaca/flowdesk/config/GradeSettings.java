package com.alpaca.flowdesk.config;

import java.time.Duration;

public record GradeSettings(
        int rsiPeriod,
        double rsiMaxLong,
        double rsiMinShort,
        int movingAverageWindow,
        double minTrendPct,
        double minRsiBuffer,
        Duration radarRealert,
        Duration radarRefresh,
        Duration lookback
) {
    public static GradeSettings defaults() {
        return new GradeSettings(14, 62, 38, 20, 0.2, 4,
                Duration.ofMinutes(15), Duration.ofSeconds(60), Duration.ofMinutes(1440));
    }

    /** Bars needed before a symbol can be graded. */
    public int minBars() { return Math.max(movingAverageWindow + 2, 25); }
}
