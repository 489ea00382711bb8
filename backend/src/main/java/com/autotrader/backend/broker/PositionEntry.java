package com.autotrader.backend.broker;

/**
 * Raw position line without market data, used when the portfolio feed is empty.
 */
public record PositionEntry(String account, Contract contract, double position, double averageCost) {
}
