package com.alpaca.flowdesk.config;

import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;

/** Daily batch parameters. */
public record TradeSettings(
        boolean autoTrade,
        double notionalUsd,
        int openTradeCount,
        double takeProfitPct,
        double stopLossPct,
        Duration maxHold,
        LocalTime windowStart,
        Duration window,
        ZoneId zone,
        Duration poll,
        Duration backoff
) {
    public static TradeSettings defaults() {
        return new TradeSettings(true, 1000, 3, 1.0, 0.5, Duration.ofMinutes(60),
                LocalTime.of(9, 35), Duration.ofMinutes(5), ZoneId.of("America/New_York"),
                Duration.ofSeconds(15), Duration.ofSeconds(30));
    }

    public boolean inWindow(LocalTime t) {
        return !t.isBefore(windowStart) && t.isBefore(windowStart.plus(window));
    }
}
