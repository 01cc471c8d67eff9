package com.alpaca.flowdesk.broker;

import com.alpaca.flowdesk.model.FillEvent;

import java.util.function.Consumer;

/** Push feed of order updates. */
public interface AlpacaStream {
    void start(Consumer<FillEvent> onFill);
    void close();
}
