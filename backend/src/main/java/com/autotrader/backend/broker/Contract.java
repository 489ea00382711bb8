package com.autotrader.backend.broker;

/**
 * Instrument identity as the brokerage sees it. {@code conId} is 0 until the contract is qualified.
 */
public record Contract(
        int conId,
        String symbol,
        String secType,
        String exchange,
        String primaryExchange,
        String currency,
        String tradingClass
) {

    public static Contract stock(String symbol, String exchange, String currency) {
        return new Contract(0, symbol, "STK", exchange, null, currency, null);
    }

    public boolean isQualified() {
        return conId > 0;
    }

    /**
     * Cache key for per-instrument metadata such as the minimum tick.
     */
    public String cacheKey() {
        if (conId > 0) {
            return String.valueOf(conId);
        }
        return symbol + ":" + exchange + ":" + currency;
    }
}
