package com.alpaca.flowdesk.service;

import com.alpaca.flowdesk.broker.MarketDataClient;
import com.alpaca.flowdesk.config.WatchList;
import com.alpaca.flowdesk.engine.ImbalanceSignalDetector;
import com.alpaca.flowdesk.engine.SignalEvent;
import com.alpaca.flowdesk.exception.TransientFetchException;
import com.alpaca.flowdesk.model.QuoteSnapshot;
import com.alpaca.flowdesk.model.SignalState.Direction;
import com.alpaca.flowdesk.telegram.Notifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

/** Polls quotes and trades for the watch list and relays detector events. */
@Service
public class OrderFlowMonitor {
    private static final Logger log = LoggerFactory.getLogger(OrderFlowMonitor.class);

    private final MarketDataClient marketData;
    private final ImbalanceSignalDetector detector;
    private final Notifier notifier;
    private final WatchList watchList;
    private final Clock clock;

    public OrderFlowMonitor(MarketDataClient marketData, ImbalanceSignalDetector detector, Notifier notifier,
                            WatchList watchList, Clock clock) {
        this.marketData = marketData;
        this.detector = detector;
        this.notifier = notifier;
        this.watchList = watchList;
        this.clock = clock;
    }

    public void runCycle() {
        Instant now = clock.instant();
        for (String symbol : watchList.symbols()) {
            try {
                evaluate(symbol, now).ifPresent(e -> notifier.send(format(e)));
            } catch (TransientFetchException e) {
                log.warn("{}: market data unavailable, skipped ({})", symbol, e.getMessage());
            } catch (RuntimeException e) {
                log.warn("{}: evaluation failed, skipped", symbol, e);
            }
        }
    }

    private Optional<SignalEvent> evaluate(String symbol, Instant now) {
        Optional<QuoteSnapshot> quote = marketData.latestQuote(symbol);
        if (quote.isEmpty() || quote.get().spread() <= 0) {
            log.debug("{}: no usable quote", symbol);
            return Optional.empty();
        }
        Optional<Double> price = marketData.latestTrade(symbol);
        if (price.isEmpty()) {
            log.debug("{}: no latest trade", symbol);
            return Optional.empty();
        }
        return detector.evaluate(symbol, quote.get(), price.get(), now);
    }

    static String format(SignalEvent e) {
        boolean up = e.direction() == Direction.UP;
        if (e.kind() == SignalEvent.Kind.RETRACTED) {
            return String.format(Locale.US, "⚪ %s %s pressure faded before confirmation (price %.2f)",
                    e.symbol(), up ? "buy" : "sell", e.price());
        }
        return String.format(Locale.US, "%s %s PRESSURE %s%nImbalance: %.2f | Spread: %.4f | Momentum: %+.3f%%%nPrice: %.2f",
                up ? "🟢" : "🔴", up ? "BUY" : "SELL", e.symbol(),
                e.imbalance(), e.spread(), e.momentum() * 100.0, e.price());
    }
}
