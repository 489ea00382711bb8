package com.autotrader.backend.service.indicator;

import com.autotrader.backend.model.Candle;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Wilder RSI over closes. Returns empty when there are not enough bars for one full period.
 */
@Service
public class RsiService {

    public static final int PERIOD = 14;

    public Double calculate(List<Candle> candles) {
        return calculate(candles, PERIOD);
    }

    public Double calculate(List<Candle> candles, int period) {
        if (candles == null || candles.size() < period + 1) {
            return null;
        }

        double avgGain = 0.0;
        double avgLoss = 0.0;
        for (int i = 1; i <= period; i++) {
            double change = candles.get(i).getClose() - candles.get(i - 1).getClose();
            if (change > 0) {
                avgGain += change;
            } else {
                avgLoss += Math.abs(change);
            }
        }
        avgGain /= period;
        avgLoss /= period;

        for (int i = period + 1; i < candles.size(); i++) {
            double change = candles.get(i).getClose() - candles.get(i - 1).getClose();
            avgGain = ((avgGain * (period - 1)) + Math.max(change, 0.0)) / period;
            avgLoss = ((avgLoss * (period - 1)) + Math.max(-change, 0.0)) / period;
        }

        if (avgLoss == 0) {
            return 100.0;
        }
        double rs = avgGain / avgLoss;
        return 100.0 - (100.0 / (1.0 + rs));
    }
}
