package com.autotrader.backend.service;

import org.springframework.stereotype.Service;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Collection;

/**
 * Regular trading hours per market. Holidays are not modelled.
 */
@Service
public class MarketHoursService {

    public enum Market {
        US(ZoneId.of("America/New_York"), LocalTime.of(9, 30), LocalTime.of(16, 0)),
        UK(ZoneId.of("Europe/London"), LocalTime.of(8, 0), LocalTime.of(16, 30));

        private final ZoneId zone;
        private final LocalTime open;
        private final LocalTime close;

        Market(ZoneId zone, LocalTime open, LocalTime close) {
            this.zone = zone;
            this.open = open;
            this.close = close;
        }

        public ZoneId zone() {
            return zone;
        }

        public LocalTime open() {
            return open;
        }

        public LocalTime close() {
            return close;
        }
    }

    public Market marketFor(String exchange, String currency) {
        if ("GBP".equalsIgnoreCase(currency) || "LSE".equalsIgnoreCase(exchange)) {
            return Market.UK;
        }
        return Market.US;
    }

    public boolean isOpen(String exchange, String currency, Instant now) {
        return isOpen(marketFor(exchange, currency), now);
    }

    public boolean isOpen(Market market, Instant now) {
        ZonedDateTime local = now.atZone(market.zone());
        if (isWeekend(local)) {
            return false;
        }
        LocalTime time = local.toLocalTime();
        return !time.isBefore(market.open()) && !time.isAfter(market.close());
    }

    /**
     * True when any of the configured market codes (US, UK) is open.
     */
    public boolean anyOpen(Collection<String> marketCodes, Instant now) {
        for (String code : marketCodes) {
            if (code == null) {
                continue;
            }
            if (isOpen(Market.valueOf(code.trim().toUpperCase()), now)) {
                return true;
            }
        }
        return false;
    }

    /**
     * True when the close is between 0 and {@code minutesBeforeClose} minutes away on a weekday.
     */
    public boolean isNearClose(String exchange, String currency, int minutesBeforeClose, Instant now) {
        if (minutesBeforeClose <= 0) {
            return false;
        }
        Market market = marketFor(exchange, currency);
        ZonedDateTime local = now.atZone(market.zone());
        if (isWeekend(local)) {
            return false;
        }
        ZonedDateTime close = local.with(market.close()).withSecond(0).withNano(0);
        double deltaMinutes = Duration.between(local, close).toMillis() / 60_000.0;
        return deltaMinutes >= 0 && deltaMinutes <= minutesBeforeClose;
    }

    private boolean isWeekend(ZonedDateTime local) {
        DayOfWeek day = local.getDayOfWeek();
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }
}
