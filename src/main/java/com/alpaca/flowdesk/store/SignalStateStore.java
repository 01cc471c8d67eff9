package com.alpaca.flowdesk.store;

import com.alpaca.flowdesk.model.SignalState;

public interface SignalStateStore {
    /** State for the symbol, created empty on first use. */
    SignalState stateOf(String symbol);
}
