package com.autotrader.backend.broker;

public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED
}
