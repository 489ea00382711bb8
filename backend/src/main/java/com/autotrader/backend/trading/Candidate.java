package com.autotrader.backend.trading;

import com.autotrader.backend.broker.Contract;

/**
 * One symbol in the cycle's universe, with where it came from.
 */
public record Candidate(String symbol, String exchange, String currency, String scanSource, String tradingClass) {

    public static final String US_EXCHANGE = "SMART";
    public static final String UK_EXCHANGE = "LSE";

    public static Candidate us(String symbol, String source, String tradingClass) {
        return new Candidate(symbol, US_EXCHANGE, "USD", source, tradingClass);
    }

    public static Candidate uk(String symbol, String source, String tradingClass) {
        return new Candidate(symbol, UK_EXCHANGE, "GBP", source, tradingClass);
    }

    public Contract contract() {
        return Contract.stock(symbol, exchange, currency);
    }
}
