package com.alpaca.flowdesk.model;

import java.time.Instant;

/**
 * Per-symbol hysteresis state of the order-flow detector.
 * {@code conditionSince} is set once when a condition episode starts and cleared when it
 * fires or disappears early.
 */
public class SignalState {
    public Instant conditionSince;      // null = no pending episode
    public Direction pendingDirection;
    public Instant lastAlertAt;         // null = never alerted
    public Double lastObservedPrice;    // null = first observation

    public enum Direction { UP, DOWN }

    public boolean isPending() { return conditionSince != null; }

    public void clearPending() {
        conditionSince = null;
        pendingDirection = null;
    }
}
