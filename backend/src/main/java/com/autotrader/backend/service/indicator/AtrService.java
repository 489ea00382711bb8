package com.autotrader.backend.service.indicator;

import com.autotrader.backend.model.Candle;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class AtrService {

    public static final int PERIOD = 14;

    /**
     * Wilder-smoothed average true range, or null with fewer than {@code PERIOD + 1} bars.
     */
    public Double calculate(List<Candle> candles) {
        if (candles == null || candles.size() < PERIOD + 1) {
            return null;
        }
        List<Double> trueRanges = new ArrayList<>(candles.size() - 1);
        for (int i = 1; i < candles.size(); i++) {
            Candle curr = candles.get(i);
            Candle prev = candles.get(i - 1);
            trueRanges.add(Math.max(curr.getHigh() - curr.getLow(),
                    Math.max(Math.abs(curr.getHigh() - prev.getClose()), Math.abs(curr.getLow() - prev.getClose()))));
        }
        double atr = trueRanges.subList(0, PERIOD).stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        for (int i = PERIOD; i < trueRanges.size(); i++) {
            atr = ((atr * (PERIOD - 1)) + trueRanges.get(i)) / PERIOD;
        }
        return atr;
    }

    /**
     * ATR divided by the last close.
     */
    public Double volatilityRatio(Double atr, List<Candle> candles) {
        if (atr == null || candles == null || candles.isEmpty()) {
            return null;
        }
        double lastClose = candles.get(candles.size() - 1).getClose();
        return lastClose <= 0 ? null : atr / lastClose;
    }
}
