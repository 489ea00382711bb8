package com.autotrader.backend.broker;

import java.util.List;
import java.util.Optional;

/**
 * Tag lookups over the account value feed.
 */
public final class AccountValues {

    public static final String BASE = "BASE";
    public static final String TOTAL_CASH_VALUE = "TotalCashValue";
    public static final String CASH_BALANCE = "CashBalance";
    public static final String NET_LIQUIDATION = "NetLiquidation";

    public static final List<String> SUMMARY_TAGS = List.of(
            TOTAL_CASH_VALUE,
            CASH_BALANCE,
            NET_LIQUIDATION,
            "GrossPositionValue",
            "AvailableFunds",
            "UnrealizedPnL",
            "RealizedPnL"
    );

    private AccountValues() {
    }

    /**
     * With a currency: exact currency line, then the BASE (or blank) line, then CashBalance in that
     * currency when TotalCashValue is asked for. Without one: BASE, USD, GBP, then the first parseable line.
     */
    public static Optional<Double> find(List<AccountValue> values, String tag, String currency) {
        List<AccountValue> matches = values.stream()
                .filter(v -> tag.equals(v.tag()))
                .toList();
        if (matches.isEmpty()) {
            return Optional.empty();
        }
        if (currency == null) {
            for (String preferred : List.of(BASE, "USD", "GBP")) {
                Optional<Double> found = firstParseable(matches, preferred);
                if (found.isPresent()) {
                    return found;
                }
            }
            return matches.stream()
                    .map(v -> parse(v.value()))
                    .flatMap(Optional::stream)
                    .findFirst();
        }

        Optional<Double> exact = firstParseable(matches, currency);
        if (exact.isPresent()) {
            return exact;
        }
        Optional<Double> base = matches.stream()
                .filter(v -> v.currency() == null || v.currency().isEmpty() || BASE.equals(v.currency()))
                .map(v -> parse(v.value()))
                .flatMap(Optional::stream)
                .findFirst();
        if (base.isPresent()) {
            return base;
        }
        if (TOTAL_CASH_VALUE.equals(tag)) {
            return values.stream()
                    .filter(v -> CASH_BALANCE.equals(v.tag()) && currency.equals(v.currency()))
                    .map(v -> parse(v.value()))
                    .flatMap(Optional::stream)
                    .findFirst();
        }
        return Optional.empty();
    }

    public static Optional<Double> netLiquidation(List<AccountValue> values) {
        return find(values, NET_LIQUIDATION, null);
    }

    private static Optional<Double> firstParseable(List<AccountValue> matches, String currency) {
        return matches.stream()
                .filter(v -> currency.equals(v.currency()))
                .map(v -> parse(v.value()))
                .flatMap(Optional::stream)
                .findFirst();
    }

    public static Optional<Double> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Double.parseDouble(raw.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
