package com.alpaca.flowdesk.service;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class PollingLoopTest {

    @Test
    void failedCycleGoesToErrorHook() {
        List<Exception> errors = new ArrayList<>();
        PollingLoop loop = new PollingLoop("test", Duration.ofMillis(1), Duration.ofMillis(1),
                () -> { throw new IllegalStateException("boom"); }, errors::add);

        assertThat(loop.runOnce()).isFalse();
        assertThat(errors).singleElement().extracting(Exception::getMessage).isEqualTo("boom");
    }

    @Test
    void failingErrorHookDoesNotEscape() {
        PollingLoop loop = new PollingLoop("test", Duration.ofMillis(1), Duration.ofMillis(1),
                () -> { throw new IllegalStateException("boom"); }, e -> { throw new IllegalArgumentException("hook"); });

        assertThat(loop.runOnce()).isFalse();
    }

    @Test
    void keepsRunningAfterFailuresUntilStopped() throws InterruptedException {
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch reachedFive = new CountDownLatch(5);
        PollingLoop loop = new PollingLoop("test", Duration.ofMillis(1), Duration.ofMillis(1), () -> {
            reachedFive.countDown();
            if (calls.incrementAndGet() % 2 == 0) throw new IllegalStateException("every other cycle");
        }, null);

        loop.start();
        assertThat(reachedFive.await(2, TimeUnit.SECONDS)).isTrue();
        loop.stop();

        assertThat(loop.isRunning()).isFalse();
        assertThat(calls.get()).isGreaterThanOrEqualTo(5);
    }
}
