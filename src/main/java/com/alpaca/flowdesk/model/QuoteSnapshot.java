package com.alpaca.flowdesk.model;

/** Best bid/ask with resting sizes, one per evaluation cycle. */
public record QuoteSnapshot(double bid, double ask, double bidSize, double askSize) {

    public double spread() { return ask - bid; }
}
