package com.autotrader.backend.broker;

public record AccountSummaryItem(String tag, Double value, String currency) {
}
