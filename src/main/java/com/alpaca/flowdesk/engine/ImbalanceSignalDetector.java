package com.alpaca.flowdesk.engine;

import com.alpaca.flowdesk.config.SignalSettings;
import com.alpaca.flowdesk.model.QuoteSnapshot;
import com.alpaca.flowdesk.model.SignalState;
import com.alpaca.flowdesk.model.SignalState.Direction;
import com.alpaca.flowdesk.store.SignalStateStore;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Confirm-then-fire detector over the best quote and the latest trade.
 *
 * <p>A condition (bid-heavy book with a tight spread and rising price, or the mirror) must hold
 * continuously for {@code hold} before an alert fires, and alerts for the same symbol are at
 * least {@code cooldown} apart. A condition that vanishes within {@code hold} yields a
 * retraction; retractions are not subject to the cooldown.
 */
@Component
public class ImbalanceSignalDetector {

    /** Imbalance reported when nothing rests on the ask. */
    public static final double BID_DOMINANCE = 999.0;

    private final SignalSettings settings;
    private final SignalStateStore store;

    public ImbalanceSignalDetector(SignalSettings settings, SignalStateStore store) {
        this.settings = settings;
        this.store = store;
    }

    public static double imbalance(QuoteSnapshot q) {
        return q.askSize() > 0 ? q.bidSize() / q.askSize() : BID_DOMINANCE;
    }

    public Optional<SignalEvent> evaluate(String symbol, QuoteSnapshot quote, double price, Instant now) {
        if (quote == null || quote.spread() <= 0) return Optional.empty();

        double spread = quote.spread();
        double imbalance = imbalance(quote);
        SignalState st = store.stateOf(symbol);

        synchronized (st) {
            Double prev = st.lastObservedPrice;
            double momentum = (prev == null || prev <= 0) ? 0.0 : price / prev - 1.0;
            st.lastObservedPrice = price;

            Direction holding = holdingDirection(imbalance, spread, momentum);
            if (holding != null) {
                if (!st.isPending() || st.pendingDirection != holding) {
                    st.conditionSince = now;
                    st.pendingDirection = holding;
                }
                boolean held = !Duration.between(st.conditionSince, now).minus(settings.hold()).isNegative();
                boolean cooled = st.lastAlertAt == null
                        || !Duration.between(st.lastAlertAt, now).minus(settings.cooldown()).isNegative();
                if (held && cooled) {
                    st.clearPending();
                    st.lastAlertAt = now;
                    return Optional.of(new SignalEvent(symbol, SignalEvent.Kind.ALERT, holding,
                            imbalance, spread, momentum, price));
                }
                return Optional.empty();
            }

            if (st.isPending()) {
                Direction faded = st.pendingDirection;
                boolean early = Duration.between(st.conditionSince, now).compareTo(settings.hold()) <= 0;
                st.clearPending();
                if (early) {
                    return Optional.of(new SignalEvent(symbol, SignalEvent.Kind.RETRACTED, faded,
                            imbalance, spread, momentum, price));
                }
            }
            return Optional.empty();
        }
    }

    private Direction holdingDirection(double imbalance, double spread, double momentum) {
        if (spread > settings.maxSpread()) return null;
        if (imbalance >= settings.imbalanceUp() && momentum >= settings.momentumThreshold()) return Direction.UP;
        if (imbalance <= settings.imbalanceDown() && momentum <= -settings.momentumThreshold()) return Direction.DOWN;
        return null;
    }
}
