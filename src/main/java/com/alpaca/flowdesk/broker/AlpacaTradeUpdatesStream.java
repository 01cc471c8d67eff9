package com.alpaca.flowdesk.broker;

import com.alpaca.flowdesk.config.AppConfig;
import com.alpaca.flowdesk.model.FillEvent;
import com.alpaca.flowdesk.model.FillEvent.FillSide;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.util.retry.Retry;

import java.net.URI;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Alpaca {@code trade_updates} websocket. Authenticates, subscribes, and turns every order
 * update into a {@link FillEvent}. Reconnects with backoff forever.
 */
@Component
public class AlpacaTradeUpdatesStream implements AlpacaStream {
    private static final Logger log = LoggerFactory.getLogger(AlpacaTradeUpdatesStream.class);

    private final ReactorNettyWebSocketClient webSocketClient = new ReactorNettyWebSocketClient();
    private final ObjectMapper objectMapper;
    private final AppConfig cfg;
    private Disposable subscription;

    public AlpacaTradeUpdatesStream(AppConfig cfg, ObjectMapper objectMapper) {
        cfg.requireAlpacaCredentials();
        this.cfg = cfg;
        this.objectMapper = objectMapper;
    }

    @Override
    public synchronized void start(Consumer<FillEvent> onFill) {
        if (subscription != null && !subscription.isDisposed()) return;
        URI uri = URI.create(cfg.alpacaStreamUrl());
        String auth = toJson(Map.of("action", "auth", "key", cfg.alpacaKey(), "secret", cfg.alpacaSecret()));
        String listen = toJson(Map.of("action", "listen", "data", Map.of("streams", new String[]{"trade_updates"})));

        subscription = webSocketClient.execute(uri, session -> session
                        .send(Flux.just(session.textMessage(auth), session.textMessage(listen)))
                        .thenMany(session.receive()
                                .map(WebSocketMessage::getPayloadAsText)
                                .doOnNext(payload -> parse(payload).ifPresent(onFill)))
                        .then())
                .doOnSubscribe(s -> log.info("Connecting trade_updates stream {}", uri))
                .doOnError(e -> log.warn("trade_updates stream error: {}", e.toString()))
                .retryWhen(Retry.backoff(Long.MAX_VALUE, Duration.ofSeconds(1)).maxBackoff(Duration.ofSeconds(30)))
                .subscribe();
    }

    /** Order update payload to a fill event; anything else (auth, listening acks) is empty. */
    Optional<FillEvent> parse(String payload) {
        try {
            JsonNode root = objectMapper.readTree(payload);
            String stream = root.path("stream").asText("");
            JsonNode data = root.path("data");
            if ("authorization".equals(stream) || "listening".equals(stream)) {
                log.info("trade_updates {}: {}", stream, data);
                return Optional.empty();
            }
            if (!"trade_updates".equals(stream)) return Optional.empty();

            JsonNode order = data.path("order");
            String symbol = order.path("symbol").asText(null);
            String side = order.path("side").asText("");
            if (symbol == null || side.isEmpty()) return Optional.empty();

            FillSide fillSide = "buy".equalsIgnoreCase(side) ? FillSide.BUY : FillSide.SELL;
            FillEvent event = new FillEvent(symbol.toUpperCase(Locale.ROOT), fillSide,
                    order.path("status").asText(data.path("event").asText("")),
                    order.path("filled_avg_price").asDouble(0d),
                    order.path("filled_qty").asDouble(0d));
            log.debug("trade_updates {} -> {}", data.path("event").asText(), event);
            return Optional.of(event);
        } catch (Exception e) {
            log.warn("Failed to parse trade update: {}", e.toString());
            return Optional.empty();
        }
    }

    private String toJson(Object o) {
        try {
            return objectMapper.writeValueAsString(o);
        } catch (Exception e) {
            throw new IllegalStateException("Cannot serialise stream message", e);
        }
    }

    @Override
    public synchronized void close() {
        if (subscription != null) subscription.dispose();
    }
}
