package com.autotrader.backend.broker;

public record ContractDetails(Contract contract, double minTick, String longName) {
}
