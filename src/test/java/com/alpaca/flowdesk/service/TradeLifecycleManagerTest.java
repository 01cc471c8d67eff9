package com.alpaca.flowdesk.service;

import com.alpaca.flowdesk.MutableClock;
import com.alpaca.flowdesk.broker.BrokerClient;
import com.alpaca.flowdesk.broker.MarketDataClient;
import com.alpaca.flowdesk.config.GradeSettings;
import com.alpaca.flowdesk.config.TradeSettings;
import com.alpaca.flowdesk.config.WatchList;
import com.alpaca.flowdesk.engine.GradeEngine;
import com.alpaca.flowdesk.exception.OrderSubmissionException;
import com.alpaca.flowdesk.exception.TransientFetchException;
import com.alpaca.flowdesk.model.*;
import com.alpaca.flowdesk.telegram.Notifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.time.*;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class TradeLifecycleManagerTest {

    private static final ZoneId NY = ZoneId.of("America/New_York");
    private static final LocalDate MONDAY = LocalDate.of(2026, 10, 19);
    private static final LocalDate TUESDAY = LocalDate.of(2026, 10, 20);
    private static final LocalDate FRIDAY = LocalDate.of(2026, 10, 23);
    private static final LocalDate SATURDAY = LocalDate.of(2026, 10, 24);
    private static final LocalDate SUNDAY = LocalDate.of(2026, 10, 25);
    private static final LocalDate NEXT_MONDAY = LocalDate.of(2026, 10, 26);

    private static final List<String> SYMBOLS = List.of("AAPL", "MSFT", "TSLA", "NVDA");
    private static final List<Candidate> PICKS = List.of(
            new Candidate("AAPL", Side.LONG, 3.0, 100, 50, 0.4),
            new Candidate("MSFT", Side.LONG, 2.0, 400, 55, 0.3),
            new Candidate("TSLA", Side.SHORT, 1.5, 250, 45, -0.3));

    private MarketDataClient marketData;
    private BrokerClient broker;
    private GradeEngine gradeEngine;
    private Notifier notifier;
    private TradeLifecycleManager manager;

    @BeforeEach
    void setUp() {
        marketData = mock(MarketDataClient.class);
        broker = mock(BrokerClient.class);
        gradeEngine = mock(GradeEngine.class);
        notifier = mock(Notifier.class);
        when(marketData.bars(any(), any(), any())).thenReturn(Map.of());
        when(gradeEngine.select(eq(SYMBOLS), any(), eq(3))).thenReturn(PICKS);
        when(broker.submitBracketOrder(any())).thenReturn("order-id");
        manager = newManager(TradeSettings.defaults());
    }

    private TradeLifecycleManager newManager(TradeSettings settings) {
        return new TradeLifecycleManager(marketData, broker, gradeEngine, notifier, new WatchList(SYMBOLS),
                settings, GradeSettings.defaults(), new MutableClock(Instant.parse("2026-10-19T12:00:00Z")));
    }

    private static ZonedDateTime at(LocalDate date, int hour, int minute) {
        return ZonedDateTime.of(date, LocalTime.of(hour, minute), NY);
    }

    private List<String> notices() {
        ArgumentCaptor<String> captor = ArgumentCaptor.forClass(String.class);
        verify(notifier, atLeast(0)).send(captor.capture());
        return captor.getAllValues();
    }

    @Nested
    @DisplayName("Opening the batch")
    class Opening {

        @Test
        void opensOncePerDayInsideWindow() {
            manager.runCycle(at(MONDAY, 9, 36));
            manager.runCycle(at(MONDAY, 9, 37));

            verify(broker, times(3)).submitBracketOrder(any());
            assertThat(manager.state()).isEqualTo(LifecycleState.MONITORING);
            assertThat(manager.current().getItems()).extracting(TradeItem::symbol)
                    .containsExactly("AAPL", "MSFT", "TSLA");
            assertThat(notices()).anyMatch(s -> s.startsWith("🚀 BATCH OPENED (3/3)"));
        }

        @Test
        void windowIsHalfOpen() {
            manager.runCycle(at(MONDAY, 9, 34));
            manager.runCycle(at(MONDAY, 9, 40));

            verifyNoInteractions(broker);
            verify(marketData, never()).bars(any(), any(), any());
            assertThat(manager.state()).isEqualTo(LifecycleState.IDLE);
        }

        @Test
        void acceptsUtcInputAndConvertsToExchangeZone() {
            manager.runCycle(ZonedDateTime.of(MONDAY, LocalTime.of(13, 35), ZoneOffset.UTC)); // 09:35 EDT

            verify(broker, times(3)).submitBracketOrder(any());
        }

        @Test
        void weekendNeverOpens() {
            manager.runCycle(at(SATURDAY, 9, 36));

            verifyNoInteractions(broker);
            assertThat(manager.state()).isEqualTo(LifecycleState.IDLE);
        }

        @Test
        void barFetchFailureIsRetriedInsideWindow() {
            when(marketData.bars(any(), any(), any()))
                    .thenThrow(new TransientFetchException("GET /v2/stocks/bars failed: 503", null))
                    .thenReturn(Map.of());

            assertThatThrownBy(() -> manager.runCycle(at(MONDAY, 9, 36)))
                    .isInstanceOf(TransientFetchException.class);
            assertThat(manager.state()).isEqualTo(LifecycleState.IDLE);
            assertThat(manager.current().isOpened()).isFalse();

            manager.runCycle(at(MONDAY, 9, 37));
            manager.runCycle(at(MONDAY, 9, 38));

            verify(broker, times(3)).submitBracketOrder(any());
            assertThat(manager.state()).isEqualTo(LifecycleState.MONITORING);
        }

        @Test
        void tooFewCandidatesSkipsTheDay() {
            when(gradeEngine.select(eq(SYMBOLS), any(), eq(3))).thenReturn(PICKS.subList(0, 2));

            manager.runCycle(at(MONDAY, 9, 36));
            manager.runCycle(at(MONDAY, 9, 38));

            verifyNoInteractions(broker);
            verify(gradeEngine, times(1)).select(any(), any(), anyInt());
            assertThat(manager.state()).isEqualTo(LifecycleState.NO_BATCH);
            assertThat(notices()).anyMatch(s -> s.startsWith("⚠️ Only 2/3"));
        }

        @Test
        void autoTradeOffOnlyAnnouncesSelection() {
            TradeSettings d = TradeSettings.defaults();
            manager = newManager(new TradeSettings(false, d.notionalUsd(), d.openTradeCount(), d.takeProfitPct(),
                    d.stopLossPct(), d.maxHold(), d.windowStart(), d.window(), d.zone(), d.poll(), d.backoff()));

            manager.runCycle(at(MONDAY, 9, 36));

            verifyNoInteractions(broker);
            assertThat(manager.state()).isEqualTo(LifecycleState.NO_BATCH);
            assertThat(notices()).anyMatch(s -> s.contains("AUTO_TRADE OFF") && s.contains("AAPL"));
        }

        @Test
        void rejectedOrderDoesNotAbortTheOthers() {
            when(broker.submitBracketOrder(argThat(o -> o != null && o.symbol().equals("MSFT"))))
                    .thenThrow(new OrderSubmissionException("MSFT", "insufficient buying power", null));

            manager.runCycle(at(MONDAY, 9, 36));

            verify(broker, times(3)).submitBracketOrder(any());
            assertThat(manager.current().getItems()).extracting(TradeItem::symbol).containsExactly("AAPL", "TSLA");
            assertThat(manager.state()).isEqualTo(LifecycleState.MONITORING);
            assertThat(notices()).anyMatch(s -> s.startsWith("🚀 BATCH OPENED (2/3)") && s.contains("❌ MSFT"));
        }

        @Test
        void allOrdersRejectedMeansNoBatch() {
            when(broker.submitBracketOrder(any())).thenThrow(new OrderSubmissionException("X", "market closed", null));

            manager.runCycle(at(MONDAY, 9, 36));

            assertThat(manager.state()).isEqualTo(LifecycleState.NO_BATCH);
            assertThat(manager.current().getItems()).isEmpty();
        }
    }

    @Test
    void bracketPricesAreRoundedToCents() {
        BracketOrder longOrder = manager.bracketFor(new Candidate("AAPL", Side.LONG, 1, 100, 50, 0.3));
        assertThat(longOrder.takeProfitPrice()).isEqualByComparingTo(new BigDecimal("101.00"));
        assertThat(longOrder.stopLossPrice()).isEqualByComparingTo(new BigDecimal("99.50"));
        assertThat(longOrder.notional()).isEqualByComparingTo(new BigDecimal("1000.00"));
        assertThat(longOrder.timeInForce()).isEqualTo("day");

        BracketOrder shortOrder = manager.bracketFor(new Candidate("TSLA", Side.SHORT, 1, 100, 50, -0.3));
        assertThat(shortOrder.takeProfitPrice()).isEqualByComparingTo(new BigDecimal("99.00"));
        assertThat(shortOrder.stopLossPrice()).isEqualByComparingTo(new BigDecimal("100.50"));
        assertThat(shortOrder.takeProfitPrice().scale()).isEqualTo(2);
    }

    @Nested
    @DisplayName("Monitoring and report")
    class Monitoring {

        @BeforeEach
        void openBatch() {
            manager.runCycle(at(MONDAY, 9, 35));
        }

        @Test
        void noReportBeforePositionsAppear() {
            when(broker.openPositionSymbols()).thenReturn(Set.of());

            manager.runCycle(at(MONDAY, 9, 40));

            assertThat(manager.state()).isEqualTo(LifecycleState.MONITORING);
            assertThat(notices()).noneMatch(s -> s.startsWith("🏁"));
        }

        @Test
        void reportsOnceEveryBatchPositionIsGone() {
            when(broker.openPositionSymbols()).thenReturn(Set.of("AAPL", "MSFT", "TSLA", "SPY"));
            manager.runCycle(at(MONDAY, 9, 40));
            assertThat(manager.state()).isEqualTo(LifecycleState.MONITORING);

            when(broker.openPositionSymbols()).thenReturn(Set.of("TSLA", "SPY"));
            manager.runCycle(at(MONDAY, 9, 50));
            assertThat(manager.state()).isEqualTo(LifecycleState.MONITORING);

            when(broker.openPositionSymbols()).thenReturn(Set.of("SPY"));
            manager.runCycle(at(MONDAY, 10, 0));
            manager.runCycle(at(MONDAY, 10, 5));

            assertThat(manager.state()).isEqualTo(LifecycleState.REPORTED);
            assertThat(manager.current().isReportSent()).isTrue();
            assertThat(manager.current().getItems()).isEmpty();
            List<String> reports = notices().stream().filter(s -> s.startsWith("🏁 BATCH CLOSED 2026-10-19")).toList();
            assertThat(reports).hasSize(1);
            assertThat(reports.get(0)).contains("✅ LONG AAPL closed", "✅ SHORT TSLA closed");
            verify(broker, never()).closePosition(anyString());
        }

        @Test
        void forceClosesStillOpenPositionsAfterMaxHold() {
            when(broker.openPositionSymbols()).thenReturn(Set.of("AAPL", "TSLA"));
            manager.runCycle(at(MONDAY, 10, 34));
            verify(broker, never()).closePosition(anyString());

            manager.runCycle(at(MONDAY, 10, 35));
            manager.runCycle(at(MONDAY, 10, 36));

            verify(broker, times(2)).closePosition("AAPL");
            verify(broker, times(2)).closePosition("TSLA");
            verify(broker, never()).closePosition("MSFT");
            assertThat(notices().stream().filter(s -> s.startsWith("⏱"))).hasSize(1);

            when(broker.openPositionSymbols()).thenReturn(Set.of());
            manager.runCycle(at(MONDAY, 10, 37));
            assertThat(manager.state()).isEqualTo(LifecycleState.REPORTED);
        }

        @Test
        void failedForceCloseIsRetriedNextCycle() {
            when(broker.openPositionSymbols()).thenReturn(Set.of("AAPL"));
            doThrow(new IllegalStateException("timeout")).doNothing().when(broker).closePosition("AAPL");

            manager.runCycle(at(MONDAY, 10, 35));
            manager.runCycle(at(MONDAY, 10, 36));

            verify(broker, times(2)).closePosition("AAPL");
            assertThat(manager.state()).isEqualTo(LifecycleState.MONITORING);
        }

        @Test
        void expiredBatchWithNoPositionEverSeenIsReported() {
            when(broker.openPositionSymbols()).thenReturn(Set.of());

            manager.runCycle(at(MONDAY, 10, 35));

            assertThat(manager.state()).isEqualTo(LifecycleState.REPORTED);
        }

        @Test
        void dayDoesNotRollWhileMonitoring() {
            when(broker.openPositionSymbols()).thenReturn(Set.of("AAPL"));

            manager.runCycle(at(TUESDAY, 0, 5));

            assertThat(manager.current().getDate()).isEqualTo(MONDAY);
            assertThat(notices()).noneMatch(s -> s.startsWith("🆕"));
        }
    }

    @Test
    void newDayStartsFreshLifecycle() {
        when(broker.openPositionSymbols()).thenReturn(Set.of());
        manager.runCycle(at(MONDAY, 9, 36));
        manager.runCycle(at(MONDAY, 10, 36));
        assertThat(manager.state()).isEqualTo(LifecycleState.REPORTED);

        manager.runCycle(at(TUESDAY, 8, 0));
        assertThat(manager.current().getDate()).isEqualTo(TUESDAY);
        assertThat(manager.state()).isEqualTo(LifecycleState.IDLE);
        assertThat(notices()).contains("🆕 New trading day 2026-10-20");

        manager.runCycle(at(TUESDAY, 9, 36));
        verify(broker, times(6)).submitBracketOrder(any());
    }

    @Test
    void weekendDatesRollWithoutNotice() {
        when(gradeEngine.select(eq(SYMBOLS), any(), eq(3))).thenReturn(List.of());
        manager.runCycle(at(FRIDAY, 9, 36));

        manager.runCycle(at(SATURDAY, 9, 36));
        manager.runCycle(at(SUNDAY, 9, 36));
        assertThat(manager.current().getDate()).isEqualTo(SUNDAY);
        assertThat(notices()).noneMatch(s -> s.startsWith("🆕"));

        manager.runCycle(at(NEXT_MONDAY, 8, 0));
        assertThat(notices()).containsOnlyOnce("🆕 New trading day 2026-10-26");
    }

    @Test
    void noBatchDayEndsAtMidnight() {
        when(gradeEngine.select(eq(SYMBOLS), any(), eq(3))).thenReturn(List.of());
        manager.runCycle(at(MONDAY, 9, 36));
        assertThat(manager.state()).isEqualTo(LifecycleState.NO_BATCH);

        manager.runCycle(at(TUESDAY, 0, 1));

        assertThat(manager.state()).isEqualTo(LifecycleState.IDLE);
    }
}
