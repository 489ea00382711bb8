package com.autotrader.backend.broker;

public record PositionRow(
        String account,
        String symbol,
        String exchange,
        String currency,
        double quantity,
        double avgCost,
        Double marketPrice,
        Double marketValue,
        Double unrealisedPnl,
        Double realisedPnl
) {
}
