package com.autotrader.backend.service;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MarketHoursServiceTest {

    private final MarketHoursService hours = new MarketHoursService();

    // Wednesday 10 January 2024; New York on EST, London on GMT.
    private static final Instant WEDNESDAY_15_00_UTC = Instant.parse("2024-01-10T15:00:00Z");

    @Test
    void usAndUkOpenMidAfternoonLondon() {
        assertThat(hours.isOpen(MarketHoursService.Market.US, WEDNESDAY_15_00_UTC)).isTrue();
        assertThat(hours.isOpen(MarketHoursService.Market.UK, WEDNESDAY_15_00_UTC)).isTrue();
    }

    @Test
    void ukClosedWhenUsStillOpen() {
        Instant evening = Instant.parse("2024-01-10T18:00:00Z");

        assertThat(hours.isOpen("LSE", "GBP", evening)).isFalse();
        assertThat(hours.isOpen("SMART", "USD", evening)).isTrue();
        assertThat(hours.anyOpen(List.of("UK", "US"), evening)).isTrue();
    }

    @Test
    void weekendIsClosed() {
        Instant saturday = Instant.parse("2024-01-13T15:00:00Z");

        assertThat(hours.anyOpen(List.of("US", "UK"), saturday)).isFalse();
    }

    @Test
    void nearCloseWithinWindowOnly() {
        assertThat(hours.isNearClose("SMART", "USD", 10, Instant.parse("2024-01-10T20:55:00Z"))).isTrue();
        assertThat(hours.isNearClose("SMART", "USD", 10, Instant.parse("2024-01-10T20:40:00Z"))).isFalse();
        assertThat(hours.isNearClose("SMART", "USD", 10, Instant.parse("2024-01-10T21:05:00Z"))).isFalse();
        assertThat(hours.isNearClose("SMART", "USD", 0, Instant.parse("2024-01-10T20:59:00Z"))).isFalse();
    }

    @Test
    void gbpMapsToLondon() {
        assertThat(hours.marketFor("SMART", "GBP")).isEqualTo(MarketHoursService.Market.UK);
        assertThat(hours.marketFor("NASDAQ", "USD")).isEqualTo(MarketHoursService.Market.US);
    }
}
