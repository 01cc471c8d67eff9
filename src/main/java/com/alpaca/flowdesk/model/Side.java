package com.alpaca.flowdesk.model;

public enum Side {
    LONG,
    SHORT;

    /** Order side used to enter a position in this direction. */
    public String entryOrderSide() { return this == LONG ? "buy" : "sell"; }
}
