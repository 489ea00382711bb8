package com.autotrader.backend.service.indicator;

import com.autotrader.backend.model.Candle;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Short-horizon momentum read from the last ten bars.
 */
@Service
public class BarMomentumService {

    private static final int WINDOW = 10;
    private static final int MIN_BARS = 5;

    public BarMomentum calculate(List<Candle> candles) {
        if (candles == null || candles.size() < MIN_BARS) {
            return null;
        }
        List<Candle> recent = candles.subList(Math.max(0, candles.size() - WINDOW), candles.size());
        int n = recent.size();
        double last = recent.get(n - 1).getClose();
        double fifthLast = recent.get(n - 5).getClose();
        double first = recent.get(0).getClose();

        double momentum5 = fifthLast > 0 ? (last - fifthLast) / fifthLast * 100.0 : 0.0;
        double momentum10 = n >= WINDOW && first > 0 ? (last - first) / first * 100.0 : 0.0;

        double volumeAcceleration = 1.0;
        if (n >= 3) {
            double recentAvg = (recent.get(n - 1).getVolume() + recent.get(n - 2).getVolume()
                    + recent.get(n - 3).getVolume()) / 3.0;
            double olderAvg = (recent.get(0).getVolume() + recent.get(1).getVolume()
                    + recent.get(2).getVolume()) / 3.0;
            volumeAcceleration = olderAvg > 0 ? recentAvg / olderAvg : 1.0;
        }

        int greenBars = 0;
        for (Candle candle : recent.subList(n - 5, n)) {
            if (candle.getClose() > candle.getOpen()) {
                greenBars++;
            }
        }

        String trend;
        if (momentum5 > 0.5 && greenBars >= 3) {
            trend = "bullish";
        } else if (momentum5 < -0.5 && greenBars <= 2) {
            trend = "bearish";
        } else {
            trend = "neutral";
        }
        return new BarMomentum(round2(momentum5), round2(momentum10), round2(volumeAcceleration), greenBars, trend);
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    public record BarMomentum(double momentum5BarsPct,
                              double momentum10BarsPct,
                              double volumeAcceleration,
                              int greenBarsLast5,
                              String trend) {}
}
