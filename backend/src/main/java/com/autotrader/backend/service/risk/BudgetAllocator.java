package com.autotrader.backend.service.risk;

import com.autotrader.backend.broker.AccountValue;
import com.autotrader.backend.broker.AccountValues;
import com.autotrader.backend.config.TraderProperties;
import com.autotrader.backend.service.EventStreamService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-currency cash budgets for one cycle.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BudgetAllocator {

    private final EventStreamService eventStreamService;

    public Map<String, Double> allocate(List<AccountValue> accountValues, Collection<String> currencies,
                                       TraderProperties.Trading trading) {
        Map<String, Double> budgets = new LinkedHashMap<>();
        for (String currency : currencies) {
            if (currency == null || budgets.containsKey(currency)) {
                continue;
            }
            budgets.put(currency, budgetFor(accountValues, currency, trading));
        }
        return budgets;
    }

    public double budgetFor(List<AccountValue> accountValues, String currency, TraderProperties.Trading trading) {
        String tag = trading.getCashBudgetTag();
        Optional<Double> available = AccountValues.find(accountValues, tag, currency);
        if (available.isEmpty()) {
            eventStreamService.error("Budget", "Cash",
                    tag + " not available for " + currency + "; budget set to 0.");
            return 0.0;
        }
        double reserve = trading.getMinCashReserveByCurrency() == null
                ? 0.0
                : trading.getMinCashReserveByCurrency().getOrDefault(currency, 0.0);
        double budget = compute(available.get(), trading.getMaxCashUtilisation(), reserve);
        eventStreamService.info("Budget", "Cash", String.format(
                "%s budget: %.2f (available %.2f, utilisation %.2f, reserve %.2f)",
                currency, budget, available.get(), trading.getMaxCashUtilisation(), reserve));
        return budget;
    }

    /**
     * max(0, min(available * utilisation, available - reserve)).
     */
    public static double compute(double available, double utilisation, double reserve) {
        return Math.max(0.0, Math.min(available * utilisation, available - reserve));
    }
}
