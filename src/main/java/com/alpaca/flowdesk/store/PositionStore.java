package com.alpaca.flowdesk.store;

import com.alpaca.flowdesk.model.PositionTrack;

import java.util.Collection;
import java.util.Optional;
import java.util.function.BiFunction;

public interface PositionStore {
    Optional<PositionTrack> find(String symbol);

    /** Atomic read-modify-write of one symbol's entry; a null result removes it. */
    PositionTrack compute(String symbol, BiFunction<String, PositionTrack, PositionTrack> fn);

    boolean remove(String symbol, PositionTrack track);
    Collection<PositionTrack> all();
}
