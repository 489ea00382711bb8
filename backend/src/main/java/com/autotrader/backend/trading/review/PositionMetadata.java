package com.autotrader.backend.trading.review;

import lombok.Getter;

import java.time.Duration;
import java.time.Instant;

/**
 * What the review engine remembers about a held position. Peaks only ever rise.
 */
@Getter
public class PositionMetadata {

    private final Instant entryTime;
    private final double entryPrice;
    private double peakPnlPct;
    private double peakPrice;
    private int adjustmentCount;

    public PositionMetadata(Instant entryTime, double entryPrice) {
        this.entryTime = entryTime;
        this.entryPrice = entryPrice;
        this.peakPnlPct = 0.0;
        this.peakPrice = entryPrice;
    }

    public synchronized void observe(double pnlPct, double price) {
        if (pnlPct > peakPnlPct) {
            peakPnlPct = pnlPct;
        }
        if (price > peakPrice) {
            peakPrice = price;
        }
    }

    public synchronized double drawdownFromPeakPct(double pnlPct) {
        return Math.round((peakPnlPct - pnlPct) * 100.0) / 100.0;
    }

    public synchronized void incrementAdjustments() {
        adjustmentCount++;
    }

    public int minutesHeld(Instant now) {
        return (int) Duration.between(entryTime, now).toMinutes();
    }
}
