package com.alpaca.flowdesk.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;

import static com.alpaca.flowdesk.config.RawProperty.*;

/**
 * Wires the tuning knobs from application.properties. Every value is read as text first
 * (see {@link RawProperty}) and falls back to the record defaults.
 */
@Configuration
public class BotConfig {
    private static final Logger log = LoggerFactory.getLogger(BotConfig.class);

    @Bean
    AppConfig appConfig() { return new AppConfig(); }

    @Bean
    Clock clock() { return Clock.systemUTC(); }

    @Bean
    WatchList watchList(@Value("${watch.symbols:TSLA,NVDA,AAPL,MSFT,AMZN,META,GOOGL,AMD}") String raw) {
        WatchList list = new WatchList(parseSymbols(raw));
        log.info("Watch list => {}", list.symbols());
        return list;
    }

    @Bean
    SignalSettings signalSettings(
            @Value("${signal.imbalance-up:2.0}") String up,
            @Value("${signal.imbalance-down:0.5}") String down,
            @Value("${signal.max-spread:0.05}") String maxSpread,
            @Value("${signal.momentum:0.0005}") String momentum,
            @Value("${signal.hold-sec:20}") String holdSec,
            @Value("${signal.cooldown-sec:300}") String cooldownSec,
            @Value("${signal.refresh-sec:5}") String refreshSec
    ) {
        SignalSettings d = SignalSettings.defaults();
        SignalSettings s = new SignalSettings(
                parseDouble(up, d.imbalanceUp()),
                parseDouble(down, d.imbalanceDown()),
                parseDouble(maxSpread, d.maxSpread()),
                parseDouble(momentum, d.momentumThreshold()),
                Duration.ofSeconds(parseLong(holdSec, d.hold().toSeconds())),
                Duration.ofSeconds(parseLong(cooldownSec, d.cooldown().toSeconds())),
                Duration.ofSeconds(parseLong(refreshSec, d.refresh().toSeconds())));
        log.info("Signal params => {}", s);
        return s;
    }

    @Bean
    FollowSettings followSettings(
            @Value("${follow.min-move:0.05}") String minMove,
            @Value("${follow.max-silence-sec:60}") String maxSilenceSec,
            @Value("${follow.poll-sec:5}") String pollSec,
            @Value("${fills.queue-capacity:1024}") String capacity
    ) {
        FollowSettings d = FollowSettings.defaults();
        FollowSettings s = new FollowSettings(
                parseDouble(minMove, d.minMove()),
                Duration.ofSeconds(parseLong(maxSilenceSec, d.maxSilence().toSeconds())),
                Duration.ofSeconds(parseLong(pollSec, d.poll().toSeconds())),
                parseInt(capacity, d.queueCapacity()));
        log.info("Follow params => {}", s);
        return s;
    }

    @Bean
    GradeSettings gradeSettings(
            @Value("${grade.rsi-period:14}") String rsiPeriod,
            @Value("${grade.rsi-max-long:62}") String rsiMaxLong,
            @Value("${grade.rsi-min-short:38}") String rsiMinShort,
            @Value("${grade.ma-window:20}") String maWindow,
            @Value("${grade.min-trend-pct:0.2}") String minTrendPct,
            @Value("${grade.min-rsi-buffer:4}") String minRsiBuffer,
            @Value("${grade.radar-realert-min:15}") String realertMin,
            @Value("${grade.radar-refresh-sec:60}") String radarRefreshSec,
            @Value("${grade.lookback-min:1440}") String lookbackMin
    ) {
        GradeSettings d = GradeSettings.defaults();
        GradeSettings s = new GradeSettings(
                parseInt(rsiPeriod, d.rsiPeriod()),
                parseDouble(rsiMaxLong, d.rsiMaxLong()),
                parseDouble(rsiMinShort, d.rsiMinShort()),
                parseInt(maWindow, d.movingAverageWindow()),
                parseDouble(minTrendPct, d.minTrendPct()),
                parseDouble(minRsiBuffer, d.minRsiBuffer()),
                Duration.ofMinutes(parseLong(realertMin, d.radarRealert().toMinutes())),
                Duration.ofSeconds(parseLong(radarRefreshSec, d.radarRefresh().toSeconds())),
                Duration.ofMinutes(parseLong(lookbackMin, d.lookback().toMinutes())));
        log.info("Grade params => {}", s);
        return s;
    }

    @Bean
    TradeSettings tradeSettings(
            @Value("${trade.auto:true}") String auto,
            @Value("${trade.notional-usd:1000}") String notional,
            @Value("${trade.open-count:3}") String openCount,
            @Value("${trade.take-profit-pct:1.0}") String tpPct,
            @Value("${trade.stop-loss-pct:0.5}") String slPct,
            @Value("${trade.max-hold-min:60}") String maxHoldMin,
            @Value("${trade.window-start:09:35}") String windowStart,
            @Value("${trade.window-min:5}") String windowMin,
            @Value("${trade.zone:America/New_York}") String zone,
            @Value("${trade.poll-sec:15}") String pollSec,
            @Value("${trade.backoff-sec:30}") String backoffSec
    ) {
        TradeSettings d = TradeSettings.defaults();
        ZoneId zoneId;
        try { zoneId = ZoneId.of(zone.trim()); } catch (Exception e) { zoneId = d.zone(); }
        TradeSettings s = new TradeSettings(
                parseBool(auto, d.autoTrade()),
                parseDouble(notional, d.notionalUsd()),
                parseInt(openCount, d.openTradeCount()),
                parseDouble(tpPct, d.takeProfitPct()),
                parseDouble(slPct, d.stopLossPct()),
                Duration.ofMinutes(parseLong(maxHoldMin, d.maxHold().toMinutes())),
                parseTime(windowStart, d.windowStart()),
                Duration.ofMinutes(parseLong(windowMin, d.window().toMinutes())),
                zoneId,
                Duration.ofSeconds(parseLong(pollSec, d.poll().toSeconds())),
                Duration.ofSeconds(parseLong(backoffSec, d.backoff().toSeconds())));
        log.info("Trade params => {}", s);
        return s;
    }

    @Bean
    RestTemplate restTemplate(@Value("${http.timeout-sec:10}") String timeoutSec) {
        int ms = (int) Duration.ofSeconds(parseLong(timeoutSec, 10L)).toMillis();
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(ms);
        factory.setReadTimeout(ms);
        return new RestTemplate(factory);
    }
}
