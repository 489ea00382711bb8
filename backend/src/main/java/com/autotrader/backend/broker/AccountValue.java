package com.autotrader.backend.broker;

public record AccountValue(String account, String tag, String value, String currency) {
}
