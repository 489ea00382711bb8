package com.autotrader.backend.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Tick rounding for exit orders. Protective stops round down, take-profits round up,
 * so rounding never tightens either exit.
 */
public final class PriceTicks {

    private PriceTicks() {
    }

    public static double roundDown(double price, double minTick) {
        return round(price, minTick, RoundingMode.FLOOR);
    }

    public static double roundUp(double price, double minTick) {
        return round(price, minTick, RoundingMode.CEILING);
    }

    private static double round(double price, double minTick, RoundingMode mode) {
        if (minTick <= 0) {
            return price;
        }
        BigDecimal p = new BigDecimal(Double.toString(price));
        BigDecimal t = new BigDecimal(Double.toString(minTick));
        BigDecimal steps = p.divide(t, 0, mode);
        return steps.multiply(t).doubleValue();
    }
}
