package com.alpaca.flowdesk.store;

import com.alpaca.flowdesk.model.PositionTrack;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiFunction;

@Component
public class InMemoryPositionStore implements PositionStore {
    private final Map<String, PositionTrack> bySymbol = new ConcurrentHashMap<>();

    public Optional<PositionTrack> find(String symbol) { return Optional.ofNullable(bySymbol.get(symbol)); }

    public PositionTrack compute(String symbol, BiFunction<String, PositionTrack, PositionTrack> fn) {
        return bySymbol.compute(symbol, fn);
    }

    public boolean remove(String symbol, PositionTrack track) { return bySymbol.remove(symbol, track); }
    public Collection<PositionTrack> all() { return List.copyOf(bySymbol.values()); }
}
