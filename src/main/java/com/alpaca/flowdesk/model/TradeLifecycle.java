package com.alpaca.flowdesk.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/** The batch of one trading day. Owned by the lifecycle manager only. */
public class TradeLifecycle {
    private final LocalDate date;
    private LifecycleState state = LifecycleState.IDLE;
    private final List<TradeItem> items = new ArrayList<>();
    private Instant batchStartTime;
    private boolean opened;
    private boolean reportSent;
    private boolean positionsSeen;
    private boolean forceCloseAnnounced;

    public TradeLifecycle(LocalDate date) {
        this.date = date;
    }

    public LocalDate getDate() { return date; }
    public LifecycleState getState() { return state; }
    public void setState(LifecycleState state) { this.state = state; }
    public List<TradeItem> getItems() { return items; }
    public Instant getBatchStartTime() { return batchStartTime; }
    public void setBatchStartTime(Instant batchStartTime) { this.batchStartTime = batchStartTime; }
    public boolean isOpened() { return opened; }
    public void markOpened() { this.opened = true; }
    public boolean isReportSent() { return reportSent; }
    public void markReportSent() { this.reportSent = true; }
    public boolean isPositionsSeen() { return positionsSeen; }
    public void markPositionsSeen() { this.positionsSeen = true; }
    public boolean isForceCloseAnnounced() { return forceCloseAnnounced; }
    public void markForceCloseAnnounced() { this.forceCloseAnnounced = true; }
}
