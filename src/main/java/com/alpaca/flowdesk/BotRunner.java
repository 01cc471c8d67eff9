package com.alpaca.flowdesk;

import com.alpaca.flowdesk.broker.AlpacaStream;
import com.alpaca.flowdesk.config.AppConfig;
import com.alpaca.flowdesk.config.GradeSettings;
import com.alpaca.flowdesk.config.SignalSettings;
import com.alpaca.flowdesk.config.TradeSettings;
import com.alpaca.flowdesk.config.WatchList;
import com.alpaca.flowdesk.service.*;
import com.alpaca.flowdesk.telegram.Notifier;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Starts the fill feed and the three polling loops once the context is up. */
@Component
public class BotRunner implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(BotRunner.class);

    private final AppConfig cfg;
    private final AlpacaStream stream;
    private final FillEventDispatcher fills;
    private final OrderFlowMonitor orderFlow;
    private final GradeRadar radar;
    private final TradeLifecycleManager lifecycle;
    private final Notifier notifier;
    private final WatchList watchList;
    private final SignalSettings signalSettings;
    private final GradeSettings gradeSettings;
    private final TradeSettings tradeSettings;
    private final List<PollingLoop> loops = new ArrayList<>();

    public BotRunner(AppConfig cfg, AlpacaStream stream, FillEventDispatcher fills, OrderFlowMonitor orderFlow,
                     GradeRadar radar, TradeLifecycleManager lifecycle, Notifier notifier, WatchList watchList,
                     SignalSettings signalSettings, GradeSettings gradeSettings, TradeSettings tradeSettings) {
        this.cfg = cfg;
        this.stream = stream;
        this.fills = fills;
        this.orderFlow = orderFlow;
        this.radar = radar;
        this.lifecycle = lifecycle;
        this.notifier = notifier;
        this.watchList = watchList;
        this.signalSettings = signalSettings;
        this.gradeSettings = gradeSettings;
        this.tradeSettings = tradeSettings;
    }

    @Override
    public void run(String... args) {
        fills.start();
        stream.start(fills::submit);

        loops.add(new PollingLoop("order-flow", signalSettings.refresh(), tradeSettings.backoff(),
                orderFlow::runCycle, null));
        loops.add(new PollingLoop("grade-radar", gradeSettings.radarRefresh(), tradeSettings.backoff(),
                radar::runCycle, null));
        loops.add(new PollingLoop("trade-lifecycle", tradeSettings.poll(), tradeSettings.backoff(),
                lifecycle::runCycle,
                e -> notifier.send("⚠️ ERROR: " + e.getClass().getSimpleName() + ": " + e.getMessage())));
        loops.forEach(PollingLoop::start);

        notifier.send(String.format(Locale.US,
                "🤖 BOT STARTED (%s)%nTickers: %s%nNotional: %.0f$ x %d%nTP: +%.2f%% | SL: -%.2f%% | Max hold: %d min%nAUTO_TRADE: %s",
                cfg.isPaper() ? "paper" : "live",
                String.join(", ", watchList.symbols()),
                tradeSettings.notionalUsd(), tradeSettings.openTradeCount(),
                tradeSettings.takeProfitPct(), tradeSettings.stopLossPct(), tradeSettings.maxHold().toMinutes(),
                tradeSettings.autoTrade() ? "ON" : "OFF"));
        log.info("Bot started. Watching {}", watchList.symbols());
    }

    @PreDestroy
    public void shutdown() {
        loops.forEach(PollingLoop::stop);
        stream.close();
        fills.stop();
    }
}
