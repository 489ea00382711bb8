package com.autotrader.backend.broker;

public record PortfolioItem(
        String account,
        Contract contract,
        double position,
        double marketPrice,
        double marketValue,
        double averageCost,
        double unrealizedPnl,
        double realizedPnl
) {
}
