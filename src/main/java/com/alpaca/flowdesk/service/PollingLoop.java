package com.alpaca.flowdesk.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Consumer;

/**
 * A named background loop: run a cycle, sleep {@code interval}, repeat. A cycle that throws
 * is logged, handed to the error hook, and followed by a {@code backoff} sleep. The loop only
 * ends through {@link #stop()}.
 */
public class PollingLoop {
    private static final Logger log = LoggerFactory.getLogger(PollingLoop.class);

    private final String name;
    private final Duration interval;
    private final Duration backoff;
    private final Runnable cycle;
    private final Consumer<Exception> onError;

    private volatile boolean running;
    private Thread thread;

    public PollingLoop(String name, Duration interval, Duration backoff, Runnable cycle, Consumer<Exception> onError) {
        this.name = name;
        this.interval = interval;
        this.backoff = backoff;
        this.cycle = cycle;
        this.onError = onError != null ? onError : e -> { };
    }

    public synchronized void start() {
        if (running) return;
        running = true;
        thread = new Thread(this::loop, name);
        thread.setDaemon(true);
        thread.start();
        log.info("Loop '{}' started (interval={}s, backoff={}s)", name, interval.toSeconds(), backoff.toSeconds());
    }

    public synchronized void stop() {
        running = false;
        if (thread != null) thread.interrupt();
    }

    public boolean isRunning() { return running; }

    /** One cycle; false when it failed. */
    boolean runOnce() {
        try {
            cycle.run();
            return true;
        } catch (Exception e) {
            log.error("Loop '{}' cycle failed; backing off {}s", name, backoff.toSeconds(), e);
            try {
                onError.accept(e);
            } catch (RuntimeException hookFailure) {
                log.warn("Loop '{}' error hook failed: {}", name, hookFailure.toString());
            }
            return false;
        }
    }

    private void loop() {
        while (running) {
            boolean ok = runOnce();
            try {
                Thread.sleep((ok ? interval : backoff).toMillis());
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.info("Loop '{}' stopped", name);
    }
}
