package com.autotrader.backend.exception;

/**
 * A runtime config document failed validation. The message names the offending path.
 */
public class InvalidRuntimeConfigException extends RuntimeConfigException {
    public InvalidRuntimeConfigException(String message) {
        super(message);
    }
}
