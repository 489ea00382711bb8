package com.autotrader.backend.trading;

import com.autotrader.backend.config.TraderProperties;

import java.util.Map;
import java.util.Set;

/**
 * Cycle-wide inputs to candidate research.
 */
public record ResearchContext(TraderProperties config,
                              MarketContext marketContext,
                              Set<String> openSymbols,
                              Map<String, Double> budgets) {
}
