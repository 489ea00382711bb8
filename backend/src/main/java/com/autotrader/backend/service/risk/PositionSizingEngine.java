package com.autotrader.backend.service.risk;

import com.autotrader.backend.config.TraderProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * ATR stop, R-multiple take-profit and fixed-fractional quantity, capped by the cash budget.
 */
@Service
@Slf4j
public class PositionSizingEngine {

    public record SizingResult(int quantity, Double stopLoss, Double takeProfit, String rejection) {

        public boolean accepted() {
            return rejection == null;
        }

        static SizingResult rejected(String reason) {
            return new SizingResult(0, null, null, reason);
        }
    }

    public SizingResult size(double price, Double atr, Double netLiquidation, double remainingBudget,
                             String currency, TraderProperties cfg) {
        if (atr == null || atr.isNaN()) {
            return SizingResult.rejected("Selected by AI but ATR missing; cannot set stop-loss");
        }
        double stopLoss = price - cfg.getIntraday().getStopAtrMultiplier() * atr;
        if (stopLoss <= 0) {
            return SizingResult.rejected("Selected by AI but stop-loss would be <= 0; skipping");
        }
        if (netLiquidation == null) {
            return SizingResult.rejected("Selected by AI but net liquidation not available; cannot size position");
        }
        int byRisk = quantityForRisk(netLiquidation, cfg.getTrading().getRiskPerTrade(), price, stopLoss);
        int affordable = price <= 0 ? 0 : (int) Math.floor(Math.max(0.0, remainingBudget) / price);
        int quantity = Math.min(byRisk, affordable);
        if (quantity <= 0) {
            return SizingResult.rejected("Selected by AI but insufficient " + currency + " budget for position sizing");
        }
        double takeProfit = price + cfg.getIntraday().getTakeProfitR() * (price - stopLoss);
        log.info("Sizing: qty={} (risk {} / affordable {}) price={} stop={} tp={}",
                quantity, byRisk, affordable, price, stopLoss, takeProfit);
        return new SizingResult(quantity, stopLoss, takeProfit, null);
    }

    /**
     * floor(equity * riskPerTrade / |price - stop|), or 0 when the stop equals the price.
     */
    public static int quantityForRisk(double equity, double riskPerTrade, double price, double stopLoss) {
        double riskPerShare = Math.abs(price - stopLoss);
        if (riskPerShare == 0) {
            return 0;
        }
        return (int) Math.floor(equity * riskPerTrade / riskPerShare);
    }
}
