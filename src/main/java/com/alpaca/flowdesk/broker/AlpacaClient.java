package com.alpaca.flowdesk.broker;

import com.alpaca.flowdesk.config.AppConfig;
import com.alpaca.flowdesk.config.RawProperty;
import com.alpaca.flowdesk.exception.OrderSubmissionException;
import com.alpaca.flowdesk.exception.TransientFetchException;
import com.alpaca.flowdesk.model.BracketOrder;
import com.alpaca.flowdesk.model.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.*;

/** Alpaca trading API v2: bracket orders and positions. */
@Component
public class AlpacaClient implements BrokerClient {

    private static final Logger log = LoggerFactory.getLogger(AlpacaClient.class);
    private final WebClient client;
    private final Duration timeout;

    public AlpacaClient(AppConfig cfg, @Value("${http.timeout-sec:10}") String timeoutSec) {
        cfg.requireAlpacaCredentials();
        this.timeout = Duration.ofSeconds(RawProperty.parseLong(timeoutSec, 10L));
        this.client = WebClient.builder()
                .baseUrl(cfg.alpacaBaseUrl())
                .defaultHeader("APCA-API-KEY-ID", cfg.alpacaKey())
                .defaultHeader("APCA-API-SECRET-KEY", cfg.alpacaSecret())
                .build();
        log.info("Alpaca trading endpoint {} (paper={})", cfg.alpacaBaseUrl(), cfg.isPaper());
    }

    /** Market entry for a dollar amount with a take-profit limit and a stop-loss stop attached. */
    @Override
    public String submitBracketOrder(BracketOrder order) {
        var body = Map.of(
                "symbol", order.symbol(),
                "notional", order.notional().toPlainString(),
                "side", order.side().entryOrderSide(),
                "type", "market",
                "time_in_force", order.timeInForce(),
                "order_class", "bracket",
                "client_order_id", order.symbol().toLowerCase(Locale.ROOT) + "-batch-" + UUID.randomUUID(),
                "take_profit", Map.of("limit_price", order.takeProfitPrice().toPlainString()),
                "stop_loss",   Map.of("stop_price", order.stopLossPrice().toPlainString())
        );

        log.info("Submitting bracket order: {}", body);

        Map<?, ?> resp;
        try {
            resp = client.post()
                    .uri("/v2/orders")
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(Map.class)
                    .block(timeout);
        } catch (WebClientResponseException ex) {
            throw new OrderSubmissionException(order.symbol(),
                    ex.getStatusCode().value() + " " + ex.getResponseBodyAsString(), ex);
        } catch (RuntimeException ex) {
            throw new OrderSubmissionException(order.symbol(), ex.toString(), ex);
        }
        if (resp == null || resp.get("id") == null) {
            throw new OrderSubmissionException(order.symbol(), "no order id in response: " + resp, null);
        }
        log.info("Alpaca order accepted: id={} status={}", resp.get("id"), resp.get("status"));
        return String.valueOf(resp.get("id"));
    }

    @Override
    public Set<String> openPositionSymbols() {
        List<?> rows;
        try {
            rows = client.get()
                    .uri("/v2/positions")
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .bodyToMono(List.class)
                    .block(timeout);
        } catch (RuntimeException ex) {
            throw new TransientFetchException("GET /v2/positions failed: " + ex.getMessage(), ex);
        }
        Set<String> symbols = new LinkedHashSet<>();
        if (rows != null) {
            for (Object row : rows) {
                if (row instanceof Map<?, ?> m && m.get("symbol") != null) symbols.add(String.valueOf(m.get("symbol")));
            }
        }
        return symbols;
    }

    @Override
    public Optional<Position> position(String symbol) {
        Optional<Map> found;
        try {
            found = client.get()
                    .uri("/v2/positions/{symbol}", symbol)
                    .accept(MediaType.APPLICATION_JSON)
                    .<Map>exchangeToMono(r -> {
                        if (r.statusCode().value() == 404) return r.releaseBody().then(Mono.<Map>empty());
                        if (r.statusCode().is2xxSuccessful()) return r.bodyToMono(Map.class);
                        return r.createException().flatMap(e -> Mono.<Map>error(e));
                    })
                    .blockOptional(timeout);
        } catch (RuntimeException ex) {
            throw new TransientFetchException("GET /v2/positions/" + symbol + " failed: " + ex.getMessage(), ex);
        }
        return found.map(m -> new Position(symbol, toD(m.get("qty")), toD(m.get("avg_entry_price"))));
    }

    @Override
    public void closePosition(String symbol) {
        try {
            client.delete()
                    .uri("/v2/positions/{symbol}", symbol)
                    .retrieve()
                    .toBodilessEntity()
                    .block(timeout);
            log.info("Close (market) requested for {}", symbol);
        } catch (WebClientResponseException.NotFound nf) {
            log.info("Close {}: no open position", symbol);
        } catch (RuntimeException ex) {
            throw new OrderSubmissionException(symbol, "close failed: " + ex.getMessage(), ex);
        }
    }

    private static double toD(Object v) {
        if (v instanceof Number n) return n.doubleValue();
        if (v == null) return 0d;
        try { return Double.parseDouble(String.valueOf(v)); } catch (NumberFormatException e) { return 0d; }
    }
}
