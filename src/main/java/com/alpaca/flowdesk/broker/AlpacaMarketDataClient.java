package com.alpaca.flowdesk.broker;

import com.alpaca.flowdesk.config.AppConfig;
import com.alpaca.flowdesk.exception.TransientFetchException;
import com.alpaca.flowdesk.model.Bar;
import com.alpaca.flowdesk.model.QuoteSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.*;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Instant;
import java.util.*;

/** Alpaca market data v2 over REST. */
@Component
public class AlpacaMarketDataClient implements MarketDataClient {
    private static final Logger log = LoggerFactory.getLogger(AlpacaMarketDataClient.class);
    private static final int BAR_PAGE_LIMIT = 10_000;

    private final RestTemplate http;
    private final String dataBase;
    private final String feed;
    private final String keyId;
    private final String secretKey;

    public AlpacaMarketDataClient(AppConfig cfg, RestTemplate http) {
        cfg.requireAlpacaCredentials();
        this.http = http;
        this.dataBase = cfg.alpacaDataUrl();
        this.feed = cfg.alpacaDataFeed();
        this.keyId = cfg.alpacaKey();
        this.secretKey = cfg.alpacaSecret();
    }

    /* ====================== API helpers ====================== */
    private HttpEntity<?> entityWithAuth() {
        HttpHeaders h = new HttpHeaders();
        h.setAccept(List.of(MediaType.APPLICATION_JSON));
        h.set("APCA-API-KEY-ID", keyId);
        h.set("APCA-API-SECRET-KEY", secretKey);
        return new HttpEntity<>(h);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> getJson(URI uri) {
        try {
            ResponseEntity<Map> r = http.exchange(uri, HttpMethod.GET, entityWithAuth(), Map.class);
            return r.getBody() != null ? r.getBody() : Map.of();
        } catch (RestClientException e) {
            throw new TransientFetchException("GET " + uri.getPath() + " failed: " + e.getMessage(), e);
        }
    }

    private URI latestUri(String symbol, String kind) {
        return UriComponentsBuilder.fromHttpUrl(dataBase)
                .path("/v2/stocks/{symbol}/" + kind + "/latest")
                .queryParam("feed", feed)
                .buildAndExpand(symbol)
                .encode()
                .toUri();
    }

    /* ================== Data: latest trade / quote =========== */
    @Override
    public Optional<Double> latestTrade(String symbol) {
        Object t = getJson(latestUri(symbol, "trades")).get("trade");
        if (t instanceof Map<?, ?> m) return Optional.ofNullable(pickDouble(m, "p", "price"));
        return Optional.empty();
    }

    @Override
    public Optional<QuoteSnapshot> latestQuote(String symbol) {
        Object q = getJson(latestUri(symbol, "quotes")).get("quote");
        if (q instanceof Map<?, ?> m) {
            Double bp = pickDouble(m, "bp", "bid_price");
            Double ap = pickDouble(m, "ap", "ask_price");
            Double bs = pickDouble(m, "bs", "bid_size");
            Double as = pickDouble(m, "as", "ask_size");
            if (bp != null && ap != null) {
                return Optional.of(new QuoteSnapshot(bp, ap, bs != null ? bs : 0, as != null ? as : 0));
            }
        }
        return Optional.empty();
    }

    /* ================== Data: minute bars ===================== */
    @Override
    public Map<String, List<Bar>> bars(Collection<String> symbols, Instant start, Instant end) {
        Map<String, List<Bar>> out = new LinkedHashMap<>();
        if (symbols.isEmpty()) return out;
        String pageToken = null;
        do {
            UriComponentsBuilder b = UriComponentsBuilder.fromHttpUrl(dataBase)
                    .path("/v2/stocks/bars")
                    .queryParam("symbols", String.join(",", symbols))
                    .queryParam("timeframe", "1Min")
                    .queryParam("start", start.toString())
                    .queryParam("end", end.toString())
                    .queryParam("limit", BAR_PAGE_LIMIT)
                    .queryParam("adjustment", "raw")
                    .queryParam("feed", feed);
            if (pageToken != null) b.queryParam("page_token", pageToken);

            Map<String, Object> root = getJson(b.build().encode().toUri());
            if (root.get("bars") instanceof Map<?, ?> bySymbol) {
                for (Map.Entry<?, ?> e : bySymbol.entrySet()) {
                    if (!(e.getValue() instanceof List<?> rows)) continue;
                    List<Bar> series = out.computeIfAbsent(String.valueOf(e.getKey()), k -> new ArrayList<>());
                    for (Object row : rows) {
                        if (row instanceof Map<?, ?> m) toBar(m).ifPresent(series::add);
                    }
                }
            }
            Object next = root.get("next_page_token");
            pageToken = (next == null || String.valueOf(next).isBlank()) ? null : String.valueOf(next);
        } while (pageToken != null);

        out.values().forEach(series -> series.sort(Comparator.comparing(Bar::time)));
        log.debug("Fetched bars for {} symbols between {} and {}", out.size(), start, end);
        return out;
    }

    private static Optional<Bar> toBar(Map<?, ?> m) {
        Double c = pickDouble(m, "c");
        Object t = m.get("t");
        if (c == null || t == null) return Optional.empty();
        try {
            Instant time = Instant.parse(String.valueOf(t));
            return Optional.of(new Bar(time, orElse(pickDouble(m, "o"), c), orElse(pickDouble(m, "h"), c),
                    orElse(pickDouble(m, "l"), c), c, orElse(pickDouble(m, "v"), 0d)));
        } catch (Exception e) {
            log.debug("Skipping bar with bad timestamp {}", t);
            return Optional.empty();
        }
    }

    /* ====================== utils ============================ */
    static Double pickDouble(Map<?, ?> m, String... keys) {
        for (String k : keys) {
            Object v = m.get(k);
            if (v instanceof Number n) return n.doubleValue();
            if (v != null) {
                Double d = parseOrNull(v.toString());
                if (d != null) return d;
            }
        }
        return null;
    }

    private static Double parseOrNull(String s) {
        try { return Double.valueOf(s); } catch (NumberFormatException e) { return null; }
    }

    private static double orElse(Double v, double def) { return v != null ? v : def; }
}
