package com.alpaca.flowdesk.store;

import com.alpaca.flowdesk.model.SignalState;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemorySignalStateStore implements SignalStateStore {
    private final Map<String, SignalState> bySymbol = new ConcurrentHashMap<>();

    public SignalState stateOf(String symbol) { return bySymbol.computeIfAbsent(symbol, s -> new SignalState()); }
}
