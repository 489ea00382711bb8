package com.autotrader.backend.exception;

public class DecisionException extends TradingException {
    public DecisionException(String message) {
        super(message);
    }

    public DecisionException(String message, Throwable cause) {
        super(message, cause);
    }
}
