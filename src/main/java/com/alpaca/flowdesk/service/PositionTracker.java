package com.alpaca.flowdesk.service;

import com.alpaca.flowdesk.broker.BrokerClient;
import com.alpaca.flowdesk.broker.MarketDataClient;
import com.alpaca.flowdesk.config.FollowSettings;
import com.alpaca.flowdesk.exception.TransientFetchException;
import com.alpaca.flowdesk.model.PositionTrack;
import com.alpaca.flowdesk.store.PositionStore;
import com.alpaca.flowdesk.telegram.Notifier;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Follows open positions from their fills. Each tracked symbol gets one monitor task that
 * reports the price against the weighted entry whenever it moved enough or has been quiet for
 * too long. Monitors stop cooperatively at their next poll once the track is stopped.
 */
@Service
public class PositionTracker {
    private static final Logger log = LoggerFactory.getLogger(PositionTracker.class);

    private final MarketDataClient marketData;
    private final BrokerClient broker;
    private final Notifier notifier;
    private final PositionStore store;
    private final FollowSettings settings;
    private final Clock clock;
    private final Executor monitors;

    @Autowired
    public PositionTracker(MarketDataClient marketData, BrokerClient broker, Notifier notifier,
                           PositionStore store, FollowSettings settings, Clock clock) {
        this(marketData, broker, notifier, store, settings, clock, Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "follow-monitor");
            t.setDaemon(true);
            return t;
        }));
    }

    PositionTracker(MarketDataClient marketData, BrokerClient broker, Notifier notifier,
                    PositionStore store, FollowSettings settings, Clock clock, Executor monitors) {
        this.marketData = marketData;
        this.broker = broker;
        this.notifier = notifier;
        this.store = store;
        this.settings = settings;
        this.clock = clock;
        this.monitors = monitors;
    }

    /**
     * A buy fill: opens a track with its own monitor, or merges into the existing one. A new
     * track needs a long position at the broker; a buy that covers a short opens nothing.
     */
    public void start(String symbol, double fillPrice, double fillQty) {
        if (fillPrice <= 0 || fillQty <= 0) {
            log.warn("{}: ignoring fill with price={} qty={}", symbol, fillPrice, fillQty);
            return;
        }
        if (!isTracking(symbol) && !holdsLong(symbol)) {
            log.info("{}: buy fill without a long position (short cover), not followed", symbol);
            return;
        }
        AtomicBoolean created = new AtomicBoolean();
        PositionTrack track = store.compute(symbol, (s, existing) -> {
            if (existing == null || !existing.isRunning()) {
                created.set(true);
                return new PositionTrack(s, fillPrice, fillQty, clock.instant());
            }
            existing.merge(fillPrice, fillQty);
            return existing;
        });

        if (created.get()) {
            log.info("{}: follow started at {} x {}", symbol, fillPrice, fillQty);
            notifier.send(String.format(Locale.US, "🎯 FOLLOW %s%nEntry: %.2f | Qty: %s",
                    symbol, track.getEntryPrice(), qty(track.getQuantity())));
            monitors.execute(() -> followLoop(track));
        } else {
            log.info("{}: merged fill {} x {} -> entry {} qty {}", symbol, fillPrice, fillQty,
                    track.getEntryPrice(), track.getQuantity());
            notifier.send(String.format(Locale.US, "➕ ADDED %s%nNew entry: %.2f | Qty: %s",
                    symbol, track.getEntryPrice(), qty(track.getQuantity())));
        }
    }

    /** After a sell fill: drops the track once the broker no longer reports the position. */
    public boolean stopIfClosed(String symbol) {
        Optional<PositionTrack> found = store.find(symbol);
        if (found.isEmpty()) return false;
        if (broker.position(symbol).isPresent()) {
            log.info("{}: sell fill but position still open, keep following", symbol);
            return false;
        }
        PositionTrack track = found.get();
        track.stop();
        store.remove(symbol, track);
        log.info("{}: position closed, follow stopped", symbol);
        notifier.send("🏁 " + symbol + " position closed, follow stopped");
        return true;
    }

    private boolean holdsLong(String symbol) {
        try {
            return broker.position(symbol).map(p -> p.quantity() > 0).orElse(false);
        } catch (TransientFetchException e) {
            log.warn("{}: position check failed, following anyway: {}", symbol, e.getMessage());
            return true;
        }
    }

    public boolean isTracking(String symbol) {
        return store.find(symbol).map(PositionTrack::isRunning).orElse(false);
    }

    public Optional<PositionTrack> track(String symbol) { return store.find(symbol); }

    private void followLoop(PositionTrack track) {
        log.info("{}: monitor running", track.getSymbol());
        while (track.isRunning()) {
            try {
                followTick(track);
            } catch (RuntimeException e) {
                log.warn("{}: price poll failed, retrying: {}", track.getSymbol(), e.getMessage());
            }
            try {
                Thread.sleep(settings.poll().toMillis());
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.info("{}: monitor exited", track.getSymbol());
    }

    /** One poll of the monitor loop; true when a price notice went out. */
    boolean followTick(PositionTrack track) {
        Optional<Double> latest = marketData.latestTrade(track.getSymbol());
        if (latest.isEmpty() || !track.isRunning()) return false;

        double price = latest.get();
        Instant now = clock.instant();
        Double last = track.getLastObservedPrice();
        boolean moved = last == null || Math.abs(price - last) >= settings.minMove();
        boolean silent = Duration.between(track.getLastObservedAt(), now).compareTo(settings.maxSilence()) >= 0;
        if (!moved && !silent) return false;

        double delta = price - track.getEntryPrice();
        String glyph = delta > 0 ? "🟢▲" : delta < 0 ? "🔴▼" : "⚪";
        notifier.send(String.format(Locale.US, "%s %s %+.2f from entry%nNow: %.2f", glyph, track.getSymbol(), delta, price));
        track.observe(price, now);
        return true;
    }

    @PreDestroy
    public void shutdown() {
        store.all().forEach(PositionTrack::stop);
        if (monitors instanceof ExecutorService es) es.shutdownNow();
    }

    private static String qty(double q) {
        return q == Math.rint(q) ? Long.toString((long) q) : String.format(Locale.US, "%.4f", q);
    }
}
