package com.alpaca.flowdesk.service;

import com.alpaca.flowdesk.config.FollowSettings;
import com.alpaca.flowdesk.model.FillEvent;
import com.alpaca.flowdesk.model.FillEvent.FillSide;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class FillEventDispatcherTest {

    private PositionTracker tracker;
    private FillEventDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        tracker = mock(PositionTracker.class);
        dispatcher = new FillEventDispatcher(tracker, new FollowSettings(0.05, Duration.ofSeconds(60), Duration.ofSeconds(5), 1));
    }

    @AfterEach
    void tearDown() {
        dispatcher.stop();
    }

    @Test
    void filledBuyStartsTracking() {
        dispatcher.dispatch(new FillEvent("AAPL", FillSide.BUY, "filled", 150.25, 10));
        verify(tracker).start("AAPL", 150.25, 10);
    }

    @Test
    void onlyFilledStatusIsActedOn() {
        dispatcher.dispatch(new FillEvent("AAPL", FillSide.BUY, "partially_filled", 150.25, 3));
        dispatcher.dispatch(new FillEvent("AAPL", FillSide.BUY, "new", 0, 0));
        dispatcher.dispatch(new FillEvent("AAPL", FillSide.SELL, "canceled", 0, 0));
        verifyNoInteractions(tracker);
    }

    @Test
    void sellFillOnTrackedSymbolChecksBroker() {
        when(tracker.isTracking("AAPL")).thenReturn(true);
        dispatcher.dispatch(new FillEvent("AAPL", FillSide.SELL, "filled", 151, 10));
        verify(tracker).stopIfClosed("AAPL");
    }

    @Test
    void sellFillOnUntrackedSymbolIsIgnored() {
        when(tracker.isTracking("MSFT")).thenReturn(false);
        dispatcher.dispatch(new FillEvent("MSFT", FillSide.SELL, "filled", 400, 1));
        verify(tracker, never()).stopIfClosed(anyString());
    }

    @Test
    void queuedEventsAreDrainedBySingleConsumer() {
        dispatcher.start();
        assertThat(dispatcher.submit(new FillEvent("NVDA", FillSide.BUY, "filled", 120, 2))).isTrue();
        verify(tracker, timeout(2000)).start("NVDA", 120.0, 2.0);
    }

    @Test
    void fullQueueRejects() {
        assertThat(dispatcher.submit(new FillEvent("A", FillSide.BUY, "filled", 1, 1))).isTrue();
        assertThat(dispatcher.submit(new FillEvent("B", FillSide.BUY, "filled", 1, 1))).isFalse();
        assertThat(dispatcher.pending()).isEqualTo(1);
    }

    @Test
    void consumerSurvivesTrackerFailure() {
        doThrow(new IllegalStateException("boom")).when(tracker).start(eq("BAD"), anyDouble(), anyDouble());
        dispatcher.start();

        dispatcher.submit(new FillEvent("BAD", FillSide.BUY, "filled", 1, 1));
        dispatcher.submit(new FillEvent("GOOD", FillSide.BUY, "filled", 2, 1));

        verify(tracker, timeout(2000)).start("GOOD", 2.0, 1.0);
    }
}
