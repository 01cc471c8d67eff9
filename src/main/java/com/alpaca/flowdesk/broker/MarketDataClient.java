package com.alpaca.flowdesk.broker;

import com.alpaca.flowdesk.model.Bar;
import com.alpaca.flowdesk.model.QuoteSnapshot;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Market data queries. Implementations block with a timeout and throw
 * {@link com.alpaca.flowdesk.exception.TransientFetchException} when the source is unreachable.
 */
public interface MarketDataClient {
    Optional<Double> latestTrade(String symbol);
    Optional<QuoteSnapshot> latestQuote(String symbol);

    /** One-minute bars per symbol, oldest first. Symbols without data are absent. */
    Map<String, List<Bar>> bars(Collection<String> symbols, Instant start, Instant end);
}
