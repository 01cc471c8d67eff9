package com.alpaca.flowdesk.service;

import com.alpaca.flowdesk.broker.BrokerClient;
import com.alpaca.flowdesk.broker.MarketDataClient;
import com.alpaca.flowdesk.config.GradeSettings;
import com.alpaca.flowdesk.config.TradeSettings;
import com.alpaca.flowdesk.config.WatchList;
import com.alpaca.flowdesk.engine.GradeEngine;
import com.alpaca.flowdesk.exception.OrderSubmissionException;
import com.alpaca.flowdesk.model.*;
import com.alpaca.flowdesk.telegram.Notifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.*;
import java.util.*;

/**
 * Daily batch state machine:
 * <pre>
 *   IDLE -> OPEN_WINDOW_PENDING -> ORDERS_SUBMITTED | NO_BATCH -> MONITORING -> REPORTED
 * </pre>
 * One {@link TradeLifecycle} per exchange-local date. The batch is opened at most once per day
 * inside the execution window, held for at most {@code maxHold}, then reported once every
 * position of the batch is gone.
 *
 * <p>Not thread-safe: driven by a single polling loop.
 */
@Service
public class TradeLifecycleManager {
    private static final Logger log = LoggerFactory.getLogger(TradeLifecycleManager.class);
    private static final String TIME_IN_FORCE = "day";

    private final MarketDataClient marketData;
    private final BrokerClient broker;
    private final GradeEngine gradeEngine;
    private final Notifier notifier;
    private final WatchList watchList;
    private final TradeSettings settings;
    private final GradeSettings gradeSettings;
    private final Clock clock;

    private TradeLifecycle today;

    public TradeLifecycleManager(MarketDataClient marketData, BrokerClient broker, GradeEngine gradeEngine,
                                 Notifier notifier, WatchList watchList, TradeSettings settings,
                                 GradeSettings gradeSettings, Clock clock) {
        this.marketData = marketData;
        this.broker = broker;
        this.gradeEngine = gradeEngine;
        this.notifier = notifier;
        this.watchList = watchList;
        this.settings = settings;
        this.gradeSettings = gradeSettings;
        this.clock = clock;
    }

    /** Cycle at the current wall-clock time. */
    public void runCycle() {
        runCycle(ZonedDateTime.now(clock).withZoneSameInstant(settings.zone()));
    }

    public void runCycle(ZonedDateTime now) {
        ZonedDateTime local = now.withZoneSameInstant(settings.zone());
        rollDay(local.toLocalDate());
        if (today.getState().isTerminal()) return;

        switch (today.getState()) {
            case IDLE -> {
                if (isOpenWindow(local) && !today.isOpened()) openBatch(local.toInstant());
            }
            case MONITORING -> monitor(local.toInstant());
            default -> log.trace("Lifecycle {} for {}", today.getState(), today.getDate());
        }
    }

    public TradeLifecycle current() { return today; }

    public LifecycleState state() { return today == null ? LifecycleState.IDLE : today.getState(); }

    /* ===================== Day boundary ===================== */

    private void rollDay(LocalDate date) {
        if (today == null) {
            today = new TradeLifecycle(date);
            log.info("Lifecycle initialised for {}", date);
            return;
        }
        if (today.getDate().equals(date)) return;
        if (today.getState() == LifecycleState.MONITORING) {
            log.warn("Date changed to {} while the {} batch is still monitored", date, today.getDate());
            return;
        }
        log.info("New trading day {} (previous {} ended in {})", date, today.getDate(), today.getState());
        today = new TradeLifecycle(date);
        if (!isWeekend(date.getDayOfWeek())) notifier.send("🆕 New trading day " + date);
    }

    private boolean isOpenWindow(ZonedDateTime local) {
        return !isWeekend(local.getDayOfWeek()) && settings.inWindow(local.toLocalTime());
    }

    private static boolean isWeekend(DayOfWeek dow) {
        return dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY;
    }

    /* ===================== Opening ===================== */

    private void openBatch(Instant now) {
        log.info("Open window reached for {}, selecting batch", today.getDate());

        // a failed fetch leaves the day IDLE so the next cycle in the window retries
        int wanted = settings.openTradeCount();
        Map<String, List<Bar>> bars = marketData.bars(watchList.symbols(), now.minus(gradeSettings.lookback()), now);
        List<Candidate> picks = gradeEngine.select(watchList.symbols(), bars, wanted);
        today.markOpened();
        today.setState(LifecycleState.OPEN_WINDOW_PENDING);

        if (picks.size() < wanted) {
            today.setState(LifecycleState.NO_BATCH);
            log.warn("Only {}/{} A-grade candidates, no batch today", picks.size(), wanted);
            notifier.send("⚠️ Only " + picks.size() + "/" + wanted + " A-grade candidates, no trades today"
                    + (picks.isEmpty() ? "" : "\n" + describe(picks)));
            return;
        }
        if (!settings.autoTrade()) {
            today.setState(LifecycleState.NO_BATCH);
            notifier.send("📋 Batch selection (AUTO_TRADE OFF, nothing submitted)\n" + describe(picks));
            return;
        }

        List<String> failures = new ArrayList<>();
        StringBuilder submitted = new StringBuilder();
        for (Candidate c : picks) {
            BracketOrder order = bracketFor(c);
            try {
                String id = broker.submitBracketOrder(order);
                today.getItems().add(new TradeItem(c.symbol(), c.side()));
                submitted.append(String.format(Locale.US, "%s %s | ref %.2f | TP %s | SL %s | score %.2f%n",
                        c.side(), c.symbol(), c.referencePrice(), order.takeProfitPrice(), order.stopLossPrice(), c.score()));
                log.info("{} {} bracket submitted id={}", c.side(), c.symbol(), id);
            } catch (OrderSubmissionException e) {
                log.error("{} {} bracket rejected: {}", c.side(), c.symbol(), e.getMessage());
                failures.add(e.getSymbol() + ": " + e.getMessage());
            }
        }

        if (today.getItems().isEmpty()) {
            today.setState(LifecycleState.NO_BATCH);
            notifier.send("❌ Batch failed, no order accepted\n" + String.join("\n", failures));
            return;
        }

        today.setState(LifecycleState.ORDERS_SUBMITTED);
        today.setBatchStartTime(now);
        StringBuilder msg = new StringBuilder("🚀 BATCH OPENED (")
                .append(today.getItems().size()).append('/').append(picks.size()).append(")\n")
                .append(submitted);
        failures.forEach(f -> msg.append("❌ ").append(f).append('\n'));
        msg.append("Max hold: ").append(settings.maxHold().toMinutes()).append(" min");
        notifier.send(msg.toString());
        today.setState(LifecycleState.MONITORING);
    }

    BracketOrder bracketFor(Candidate c) {
        double ref = c.referencePrice();
        double tp = settings.takeProfitPct() / 100.0;
        double sl = settings.stopLossPct() / 100.0;
        boolean isLong = c.side() == Side.LONG;
        double takeProfit = isLong ? ref * (1 + tp) : ref * (1 - tp);
        double stopLoss = isLong ? ref * (1 - sl) : ref * (1 + sl);
        return new BracketOrder(c.symbol(), cents(settings.notionalUsd()), c.side(),
                cents(takeProfit), cents(stopLoss), TIME_IN_FORCE);
    }

    /* ===================== Monitoring ===================== */

    private void monitor(Instant now) {
        Set<String> open = broker.openPositionSymbols();
        List<String> stillOpen = today.getItems().stream()
                .map(TradeItem::symbol)
                .filter(open::contains)
                .toList();
        if (!stillOpen.isEmpty()) today.markPositionsSeen();

        boolean expired = Duration.between(today.getBatchStartTime(), now).compareTo(settings.maxHold()) >= 0;
        if (expired && !stillOpen.isEmpty()) {
            forceClose(stillOpen);
            return;
        }

        if (stillOpen.isEmpty() && (today.isPositionsSeen() || expired)) report();
    }

    private void forceClose(List<String> symbols) {
        if (!today.isForceCloseAnnounced()) {
            today.markForceCloseAnnounced();
            notifier.send("⏱ Max hold " + settings.maxHold().toMinutes() + " min reached, closing " + String.join(", ", symbols));
        }
        for (String symbol : symbols) {
            try {
                broker.closePosition(symbol);
            } catch (RuntimeException e) {
                log.error("{}: force close failed: {}", symbol, e.getMessage());
            }
        }
    }

    private void report() {
        StringBuilder msg = new StringBuilder("🏁 BATCH CLOSED ").append(today.getDate()).append('\n');
        for (TradeItem item : today.getItems()) {
            msg.append("✅ ").append(item.side()).append(' ').append(item.symbol()).append(" closed\n");
        }
        notifier.send(msg.toString().trim());
        log.info("Batch of {} reported for {}", today.getItems().size(), today.getDate());
        today.getItems().clear();
        today.markReportSent();
        today.setState(LifecycleState.REPORTED);
    }

    /* ===================== utils ===================== */

    private static String describe(List<Candidate> picks) {
        StringBuilder sb = new StringBuilder();
        for (Candidate c : picks) {
            sb.append(String.format(Locale.US, "%s %s | score %.2f | trend %+.2f%% | RSI %.1f%n",
                    c.side(), c.symbol(), c.score(), c.trendPct(), c.rsi()));
        }
        return sb.toString().trim();
    }

    private static BigDecimal cents(double v) {
        return BigDecimal.valueOf(v).setScale(2, RoundingMode.HALF_UP);
    }
}
