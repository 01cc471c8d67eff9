package com.alpaca.flowdesk.service;

import com.alpaca.flowdesk.MutableClock;
import com.alpaca.flowdesk.broker.MarketDataClient;
import com.alpaca.flowdesk.config.GradeSettings;
import com.alpaca.flowdesk.config.WatchList;
import com.alpaca.flowdesk.engine.GradeEngine;
import com.alpaca.flowdesk.model.Candidate;
import com.alpaca.flowdesk.model.Side;
import com.alpaca.flowdesk.telegram.Notifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class GradeRadarTest {

    private final MarketDataClient marketData = mock(MarketDataClient.class);
    private final GradeEngine engine = mock(GradeEngine.class);
    private final Notifier notifier = mock(Notifier.class);
    private final MutableClock clock = new MutableClock(Instant.parse("2026-10-19T14:00:00Z"));
    private GradeRadar radar;

    @BeforeEach
    void setUp() {
        when(marketData.bars(any(), any(), any())).thenReturn(Map.of());
        when(engine.grade(anyString(), any())).thenReturn(Optional.empty());
        when(engine.grade(eq("AAPL"), any()))
                .thenReturn(Optional.of(new Candidate("AAPL", Side.LONG, 2.5, 187.3, 51.2, 0.42)));
        radar = new GradeRadar(marketData, engine, notifier, new WatchList(List.of("AAPL", "MSFT")),
                GradeSettings.defaults(), clock);
    }

    @Test
    void announcesAGradeSymbol() {
        radar.runCycle();

        verify(notifier).send(startsWith("⭐ A-GRADE LONG AAPL"));
        verifyNoMoreInteractions(notifier);
    }

    @Test
    void requestsLookbackWindowOfBars() {
        radar.runCycle();

        verify(marketData).bars(List.of("AAPL", "MSFT"),
                Instant.parse("2026-10-18T14:00:00Z"), Instant.parse("2026-10-19T14:00:00Z"));
    }

    @Test
    void realertsOnlyAfterInterval() {
        radar.runCycle();
        clock.advance(Duration.ofMinutes(14));
        radar.runCycle();
        verify(notifier, times(1)).send(anyString());

        clock.advance(Duration.ofMinutes(1));
        radar.runCycle();
        verify(notifier, times(2)).send(anyString());
    }
}
