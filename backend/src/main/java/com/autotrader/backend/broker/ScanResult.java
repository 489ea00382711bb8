package com.autotrader.backend.broker;

public record ScanResult(int rank, Contract contract) {
}
