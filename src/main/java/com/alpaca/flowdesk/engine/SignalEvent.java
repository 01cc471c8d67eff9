package com.alpaca.flowdesk.engine;

import com.alpaca.flowdesk.model.SignalState.Direction;

/** Outcome of one detector evaluation that deserves a notice. */
public record SignalEvent(
        String symbol,
        Kind kind,
        Direction direction,
        double imbalance,
        double spread,
        double momentum,
        double price
) {
    public enum Kind { ALERT, RETRACTED }
}
