package com.autotrader.backend.broker;

public record ScanRequest(
        String instrument,
        String locationCode,
        String scanCode,
        Double abovePrice,
        Double belowPrice,
        Long aboveVolume,
        int numberOfRows
) {
}
