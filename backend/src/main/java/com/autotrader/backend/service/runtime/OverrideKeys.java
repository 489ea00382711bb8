package com.autotrader.backend.service.runtime;

import com.autotrader.backend.exception.InvalidRuntimeConfigException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Override paths the runtime config may set, each with the check its value must pass.
 */
public final class OverrideKeys {

    /**
     * Paths whose value is an object taken as a whole rather than a subtree of further paths.
     */
    public static final Set<String> MAP_VALUED = Set.of("trading.min_cash_reserve_by_currency");

    private static final Set<String> MARKETS = Set.of("US", "UK");
    private static final int MAX_PROMPT_LENGTH = 20_000;

    private static final Map<String, Consumer<JsonNode>> VALIDATORS;

    static {
        Map<String, Consumer<JsonNode>> v = new LinkedHashMap<>();
        v.put("trading.max_cash_utilisation", n -> fraction(n, "trading.max_cash_utilisation"));
        v.put("trading.risk_per_trade", n -> fraction(n, "trading.risk_per_trade"));
        v.put("trading.max_positions", n -> nonNegativeInt(n, "trading.max_positions"));
        v.put("trading.max_new_positions_per_cycle", n -> nonNegativeInt(n, "trading.max_new_positions_per_cycle"));
        v.put("trading.cash_budget_tag", n -> nonEmptyString(n, "trading.cash_budget_tag"));
        v.put("trading.markets", OverrideKeys::markets);
        v.put("trading.min_cash_reserve_by_currency", OverrideKeys::cashReserves);
        v.put("trading.max_share_price", n -> positiveNumber(n, "trading.max_share_price"));
        v.put("trading.min_share_price", n -> positiveNumber(n, "trading.min_share_price"));
        v.put("trading.min_avg_volume", n -> nonNegativeInt(n, "trading.min_avg_volume"));
        v.put("trading.exclude_microcap", n -> bool(n, "trading.exclude_microcap"));
        v.put("trading.volatility_threshold", n -> nonNegativeNumber(n, "trading.volatility_threshold"));
        v.put("trading.screener.max_candidates", n -> positiveInt(n, "trading.screener.max_candidates"));
        v.put("trading.screener.scan_codes", n -> stringList(n, "trading.screener.scan_codes", 20));
        v.put("trading.screener.include_reddit_symbols", n -> bool(n, "trading.screener.include_reddit_symbols"));
        v.put("trading.screener.include_symbols", n -> stringList(n, "trading.screener.include_symbols", 500));
        v.put("trading.screener.exclude_symbols", n -> stringList(n, "trading.screener.exclude_symbols", 500));
        v.put("ai.model", n -> nonEmptyString(n, "ai.model"));
        v.put("ai.shortlist_system_prompt", n -> prompt(n, "ai.shortlist_system_prompt"));
        v.put("ai.buy_selection_system_prompt", n -> prompt(n, "ai.buy_selection_system_prompt"));
        v.put("ai.position_review_system_prompt", n -> prompt(n, "ai.position_review_system_prompt"));
        v.put("ai.order_review_system_prompt", n -> prompt(n, "ai.order_review_system_prompt"));
        v.put("intraday.enabled", n -> bool(n, "intraday.enabled"));
        v.put("intraday.cycle_interval_seconds", n -> nonNegativeInt(n, "intraday.cycle_interval_seconds"));
        v.put("intraday.cycle_interval_seconds_closed", n -> nonNegativeInt(n, "intraday.cycle_interval_seconds_closed"));
        v.put("intraday.flatten_minutes_before_close", n -> nonNegativeInt(n, "intraday.flatten_minutes_before_close"));
        v.put("reddit.enabled", n -> bool(n, "reddit.enabled"));
        VALIDATORS = Collections.unmodifiableMap(v);
    }

    private OverrideKeys() {
    }

    public static Set<String> paths() {
        return VALIDATORS.keySet();
    }

    public static void validate(String path, JsonNode value) {
        Consumer<JsonNode> validator = VALIDATORS.get(path);
        if (validator == null) {
            throw new InvalidRuntimeConfigException("Unsupported override key: " + path);
        }
        validator.accept(value);
    }

    private static void fraction(JsonNode n, String name) {
        double v = number(n, name);
        if (v < 0.0 || v > 1.0) {
            throw invalid(name + " must be between 0 and 1");
        }
    }

    private static void positiveNumber(JsonNode n, String name) {
        if (number(n, name) <= 0) {
            throw invalid(name + " must be > 0");
        }
    }

    private static void nonNegativeNumber(JsonNode n, String name) {
        if (number(n, name) < 0) {
            throw invalid(name + " must be >= 0");
        }
    }

    private static double number(JsonNode n, String name) {
        if (n == null || !n.isNumber()) {
            throw invalid(name + " must be a number");
        }
        return n.asDouble();
    }

    private static void nonNegativeInt(JsonNode n, String name) {
        if (n == null || !n.isIntegralNumber()) {
            throw invalid(name + " must be an integer");
        }
        if (n.asLong() < 0) {
            throw invalid(name + " must be >= 0");
        }
    }

    private static void positiveInt(JsonNode n, String name) {
        nonNegativeInt(n, name);
        if (n.asLong() <= 0) {
            throw invalid(name + " must be > 0");
        }
    }

    private static void bool(JsonNode n, String name) {
        if (n == null || !n.isBoolean()) {
            throw invalid(name + " must be boolean");
        }
    }

    private static void nonEmptyString(JsonNode n, String name) {
        if (n == null || !n.isTextual() || n.asText().isBlank()) {
            throw invalid(name + " must be a non-empty string");
        }
    }

    private static void prompt(JsonNode n, String name) {
        if (n == null || !n.isTextual()) {
            throw invalid(name + " must be a string");
        }
        if (n.asText().length() > MAX_PROMPT_LENGTH) {
            throw invalid(name + " is too long (max " + MAX_PROMPT_LENGTH + " characters)");
        }
    }

    private static void stringList(JsonNode n, String name, int maxItems) {
        if (n == null || !n.isArray()) {
            throw invalid(name + " must be an array");
        }
        if (n.size() > maxItems) {
            throw invalid(name + " must have at most " + maxItems + " entries");
        }
        for (JsonNode item : n) {
            if (!item.isTextual() || item.asText().isBlank()) {
                throw invalid(name + " entries must be non-empty strings");
            }
        }
    }

    private static void markets(JsonNode n) {
        if (n == null || !n.isArray() || n.isEmpty()) {
            throw invalid("trading.markets must be a non-empty array");
        }
        for (JsonNode item : n) {
            if (!item.isTextual() || item.asText().isBlank()) {
                throw invalid("trading.markets entries must be non-empty strings");
            }
            String market = item.asText().trim().toUpperCase();
            if (!MARKETS.contains(market)) {
                throw invalid("Unsupported market: " + market);
            }
        }
    }

    private static void cashReserves(JsonNode n) {
        if (n == null || !n.isObject()) {
            throw invalid("trading.min_cash_reserve_by_currency must be an object");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = n.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            if (entry.getKey().isBlank()) {
                throw invalid("Currency codes must be non-empty strings");
            }
            if (!entry.getValue().isNumber()) {
                throw invalid("Reserve for " + entry.getKey() + " must be a number");
            }
            if (entry.getValue().asDouble() < 0) {
                throw invalid("Reserve for " + entry.getKey() + " must be >= 0");
            }
        }
    }

    private static InvalidRuntimeConfigException invalid(String message) {
        return new InvalidRuntimeConfigException(message);
    }
}
