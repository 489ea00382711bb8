package com.autotrader.backend.broker;

/**
 * Snapshot quote. Any field may be null when the feed has no value for it.
 */
public record Quote(Double bid, Double ask, Double last, Double close, Double volume) {

    public static Quote empty() {
        return new Quote(null, null, null, null, null);
    }

    /**
     * Best available price: last, then close.
     */
    public Double price() {
        if (isUsable(last)) {
            return last;
        }
        if (isUsable(close)) {
            return close;
        }
        return null;
    }

    public Double spreadPct() {
        if (!isUsable(bid) || !isUsable(ask)) {
            return null;
        }
        double mid = (bid + ask) / 2.0;
        return mid <= 0 ? null : (ask - bid) / mid * 100.0;
    }

    public static boolean isUsable(Double value) {
        return value != null && !value.isNaN() && value > 0;
    }
}
