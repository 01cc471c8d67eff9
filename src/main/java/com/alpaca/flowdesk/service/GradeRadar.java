package com.alpaca.flowdesk.service;

import com.alpaca.flowdesk.broker.MarketDataClient;
import com.alpaca.flowdesk.config.GradeSettings;
import com.alpaca.flowdesk.config.WatchList;
import com.alpaca.flowdesk.engine.GradeEngine;
import com.alpaca.flowdesk.model.Bar;
import com.alpaca.flowdesk.model.Candidate;
import com.alpaca.flowdesk.telegram.Notifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Standing radar: grades the watch list every cycle and announces A-grade symbols, at most
 * once per {@code radarRealert} per symbol.
 */
@Service
public class GradeRadar {
    private static final Logger log = LoggerFactory.getLogger(GradeRadar.class);

    private final MarketDataClient marketData;
    private final GradeEngine engine;
    private final Notifier notifier;
    private final WatchList watchList;
    private final GradeSettings settings;
    private final Clock clock;
    private final Map<String, Instant> lastNoticeAt = new ConcurrentHashMap<>();

    public GradeRadar(MarketDataClient marketData, GradeEngine engine, Notifier notifier,
                      WatchList watchList, GradeSettings settings, Clock clock) {
        this.marketData = marketData;
        this.engine = engine;
        this.notifier = notifier;
        this.watchList = watchList;
        this.settings = settings;
        this.clock = clock;
    }

    public void runCycle() {
        Instant now = clock.instant();
        Map<String, List<Bar>> bars = marketData.bars(watchList.symbols(), now.minus(settings.lookback()), now);
        for (String symbol : watchList.symbols()) {
            engine.grade(symbol, bars.get(symbol)).ifPresent(c -> announceIfDue(c, now));
        }
    }

    private void announceIfDue(Candidate c, Instant now) {
        Instant last = lastNoticeAt.get(c.symbol());
        if (last != null && Duration.between(last, now).compareTo(settings.radarRealert()) < 0) {
            log.debug("{} still A-grade, last notice at {}", c.symbol(), last);
            return;
        }
        lastNoticeAt.put(c.symbol(), now);
        notifier.send(String.format(Locale.US, "⭐ A-GRADE %s %s%nScore: %.2f | Trend: %+.2f%% | RSI: %.1f%nRef: %.2f",
                c.side(), c.symbol(), c.score(), c.trendPct(), c.rsi(), c.referencePrice()));
    }
}
