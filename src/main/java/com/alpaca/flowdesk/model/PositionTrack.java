package com.alpaca.flowdesk.model;

import java.time.Instant;

/**
 * Follow-up state of one open position. Guarded by its own monitor: every read-modify-write
 * goes through a {@code synchronized} method.
 */
public class PositionTrack {
    private final String symbol;
    private double entryPrice;
    private double quantity;
    private Double lastObservedPrice;
    private Instant lastObservedAt;
    private volatile boolean running = true;

    public PositionTrack(String symbol, double entryPrice, double quantity, Instant startedAt) {
        this.symbol = symbol;
        this.entryPrice = entryPrice;
        this.quantity = quantity;
        this.lastObservedAt = startedAt;
    }

    /** Volume-weighted merge of another buy fill into the cost basis. */
    public synchronized void merge(double fillPrice, double fillQty) {
        double total = quantity + fillQty;
        entryPrice = (entryPrice * quantity + fillPrice * fillQty) / total;
        quantity = total;
    }

    public synchronized void observe(double price, Instant at) {
        lastObservedPrice = price;
        lastObservedAt = at;
    }

    public String getSymbol() { return symbol; }
    public synchronized double getEntryPrice() { return entryPrice; }
    public synchronized double getQuantity() { return quantity; }
    public synchronized Double getLastObservedPrice() { return lastObservedPrice; }
    public synchronized Instant getLastObservedAt() { return lastObservedAt; }

    public boolean isRunning() { return running; }
    public void stop() { running = false; }
}
