package com.autotrader.backend.exception;

public class BrokerNotConnectedException extends TradingException {
    public BrokerNotConnectedException(String message) {
        super(message);
    }

    public BrokerNotConnectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
