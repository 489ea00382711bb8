package com.autotrader.backend.broker;

import java.time.Instant;

/**
 * An order as tracked by the session: ticket, instrument and latest status.
 */
public record OpenTrade(
        Contract contract,
        BrokerOrder order,
        String status,
        double filled,
        double remaining,
        Instant createdAt
) {

    public String symbol() {
        return contract == null ? null : contract.symbol();
    }
}
