package com.alpaca.flowdesk.model;

/** One order update from the trade_updates feed. */
public record FillEvent(String symbol, FillSide side, String status, double filledAvgPrice, double filledQty) {

    public enum FillSide { BUY, SELL }

    public boolean isFilled() { return "filled".equalsIgnoreCase(status); }
}
