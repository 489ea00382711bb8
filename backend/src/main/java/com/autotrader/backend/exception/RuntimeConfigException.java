package com.autotrader.backend.exception;

public class RuntimeConfigException extends TradingException {
    public RuntimeConfigException(String message) {
        super(message);
    }

    public RuntimeConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
