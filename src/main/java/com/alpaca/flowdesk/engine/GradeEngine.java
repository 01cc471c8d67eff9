package com.alpaca.flowdesk.engine;

import com.alpaca.flowdesk.config.GradeSettings;
import com.alpaca.flowdesk.model.Bar;
import com.alpaca.flowdesk.model.Candidate;
import com.alpaca.flowdesk.model.Side;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Grades symbols from minute bars.
 *
 * <p>Long: close above its moving average with RSI below {@code rsiMaxLong}. Short: the mirror
 * against {@code rsiMinShort}. Both need the trend divergence and the RSI buffer to clear
 * their minimums (an "A-grade" signal). {@code score = trendPct * 2 + rsiBuffer * 0.5}.
 */
@Component
public class GradeEngine {
    private static final Logger log = LoggerFactory.getLogger(GradeEngine.class);

    private final GradeSettings settings;

    public GradeEngine(GradeSettings settings) {
        this.settings = settings;
    }

    public Optional<Candidate> grade(String symbol, List<Bar> bars) {
        if (bars == null || bars.size() < settings.minBars()) {
            log.debug("{}: {} bars, need {}", symbol, bars == null ? 0 : bars.size(), settings.minBars());
            return Optional.empty();
        }
        List<Double> closes = bars.stream().map(Bar::close).toList();
        double close = closes.get(closes.size() - 1);
        double ma = Indicators.smaExcludingLast(closes, settings.movingAverageWindow());
        double rsi = Indicators.rsi(closes, settings.rsiPeriod());
        if (Double.isNaN(ma) || Double.isNaN(rsi) || ma <= 0 || close <= 0) return Optional.empty();

        if (close > ma && rsi < settings.rsiMaxLong()) {
            double trendPct = (close / ma - 1.0) * 100.0;
            double rsiBuffer = settings.rsiMaxLong() - rsi;
            return aGrade(symbol, Side.LONG, close, rsi, trendPct, rsiBuffer);
        }
        if (close < ma && rsi > settings.rsiMinShort()) {
            double trendPct = (ma / close - 1.0) * 100.0;
            double rsiBuffer = rsi - settings.rsiMinShort();
            return aGrade(symbol, Side.SHORT, close, rsi, trendPct, rsiBuffer);
        }
        return Optional.empty();
    }

    private Optional<Candidate> aGrade(String symbol, Side side, double close, double rsi, double trendPct, double rsiBuffer) {
        if (trendPct < settings.minTrendPct() || rsiBuffer < settings.minRsiBuffer()) return Optional.empty();
        return Optional.of(new Candidate(symbol, side, score(trendPct, rsiBuffer), close, rsi, trendPct));
    }

    public static double score(double trendPct, double rsiBuffer) {
        return trendPct * 2.0 + rsiBuffer * 0.5;
    }

    /** Every qualifying candidate, longs then shorts, each in {@code symbols} order. */
    public List<Candidate> candidates(List<String> symbols, Map<String, List<Bar>> barsBySymbol) {
        List<Candidate> longs = new ArrayList<>();
        List<Candidate> shorts = new ArrayList<>();
        for (String symbol : symbols) {
            grade(symbol, barsBySymbol.get(symbol)).ifPresent(c -> (c.side() == Side.LONG ? longs : shorts).add(c));
        }
        List<Candidate> pool = new ArrayList<>(longs);
        pool.addAll(shorts);
        return pool;
    }

    /** Highest scores first; ties keep their pool order. */
    public static List<Candidate> rank(List<Candidate> pool, int top) {
        List<Candidate> sorted = new ArrayList<>(pool);
        sorted.sort(Comparator.comparingDouble(Candidate::score).reversed());
        return List.copyOf(sorted.subList(0, Math.min(Math.max(top, 0), sorted.size())));
    }

    public List<Candidate> select(List<String> symbols, Map<String, List<Bar>> barsBySymbol, int top) {
        return rank(candidates(symbols, barsBySymbol), top);
    }
}
