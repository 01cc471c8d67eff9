package com.alpaca.flowdesk.model;

public enum LifecycleState {
    IDLE,
    OPEN_WINDOW_PENDING,
    ORDERS_SUBMITTED,
    NO_BATCH,
    MONITORING,
    REPORTED;

    /** Nothing more happens today once one of these is reached. */
    public boolean isTerminal() { return this == NO_BATCH || this == REPORTED; }
}
