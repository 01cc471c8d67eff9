package com.alpaca.flowdesk.service;

import com.alpaca.flowdesk.config.FollowSettings;
import com.alpaca.flowdesk.model.FillEvent;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Single consumer between the fill feed and the {@link PositionTracker}: creation and merge for
 * a symbol are applied in arrival order. The queue is bounded; a producer waits at most a
 * second for room before the event is dropped.
 */
@Service
public class FillEventDispatcher {
    private static final Logger log = LoggerFactory.getLogger(FillEventDispatcher.class);

    private final PositionTracker tracker;
    private final BlockingQueue<FillEvent> queue;
    private Thread consumer;

    public FillEventDispatcher(PositionTracker tracker, FollowSettings settings) {
        this.tracker = tracker;
        this.queue = new ArrayBlockingQueue<>(Math.max(1, settings.queueCapacity()));
    }

    public boolean submit(FillEvent event) {
        try {
            if (queue.offer(event, 1, TimeUnit.SECONDS)) return true;
            log.warn("Fill queue full, dropped {}", event);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while queueing {}", event);
        }
        return false;
    }

    public synchronized void start() {
        if (consumer != null) return;
        consumer = new Thread(this::drain, "fill-dispatch");
        consumer.setDaemon(true);
        consumer.start();
    }

    private void drain() {
        while (!Thread.currentThread().isInterrupted()) {
            FillEvent event;
            try {
                event = queue.take();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                break;
            }
            try {
                dispatch(event);
            } catch (RuntimeException e) {
                log.error("Fill dispatch failed for {}", event, e);
            }
        }
        log.info("Fill dispatcher stopped");
    }

    void dispatch(FillEvent event) {
        if (!event.isFilled()) {
            log.debug("Ignoring {} update for {}", event.status(), event.symbol());
            return;
        }
        switch (event.side()) {
            case BUY -> tracker.start(event.symbol(), event.filledAvgPrice(), event.filledQty());
            case SELL -> {
                if (tracker.isTracking(event.symbol())) tracker.stopIfClosed(event.symbol());
            }
        }
    }

    int pending() { return queue.size(); }

    @PreDestroy
    public synchronized void stop() {
        if (consumer != null) consumer.interrupt();
    }
}
