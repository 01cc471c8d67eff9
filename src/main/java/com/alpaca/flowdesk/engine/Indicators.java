package com.alpaca.flowdesk.engine;

import java.util.List;

public final class Indicators {
    private Indicators() {}

    /**
     * RSI from the simple mean of the last {@code period} gains and losses (no Wilder smoothing).
     * NaN when there are fewer than {@code period + 1} closes.
     */
    public static double rsi(List<Double> closes, int period) {
        int n = closes.size();
        if (period <= 0 || n < period + 1) return Double.NaN;
        double gains = 0, losses = 0;
        for (int i = n - period; i < n; i++) {
            double d = closes.get(i) - closes.get(i - 1);
            if (d > 0) gains += d;
            else losses -= d;
        }
        double avgGain = gains / period;
        double avgLoss = losses / period;
        if (avgLoss == 0) return avgGain == 0 ? 50.0 : 100.0;
        double rs = avgGain / avgLoss;
        return 100.0 - 100.0 / (1.0 + rs);
    }

    /** Mean of {@code window} closes ending just before the most recent one. */
    public static double smaExcludingLast(List<Double> closes, int window) {
        int end = closes.size() - 1;
        int start = end - window;
        if (window <= 0 || start < 0) return Double.NaN;
        double sum = 0;
        for (int i = start; i < end; i++) sum += closes.get(i);
        return sum / window;
    }
}
