package com.autotrader.backend.exception;

public class BrokerTimeoutException extends TradingException {
    public BrokerTimeoutException(String message) {
        super(message);
    }

    public BrokerTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
