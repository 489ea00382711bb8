package com.autotrader.backend.service.indicator;

import com.autotrader.backend.model.Candle;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class BollingerBandService {

    public static final int PERIOD = 20;
    public static final double DEVIATION = 2.0;

    public BollingerBands calculate(List<Candle> candles) {
        if (candles == null || candles.size() < PERIOD) {
            return null;
        }
        List<Candle> window = candles.subList(candles.size() - PERIOD, candles.size());
        double mean = window.stream().mapToDouble(Candle::getClose).average().orElse(0.0);
        double variance = window.stream()
                .mapToDouble(candle -> {
                    double diff = candle.getClose() - mean;
                    return diff * diff;
                })
                .average()
                .orElse(0.0);
        double standardDeviation = Math.sqrt(variance);
        double upper = mean + (standardDeviation * DEVIATION);
        double lower = mean - (standardDeviation * DEVIATION);
        return new BollingerBands(upper, mean, lower, upper - lower);
    }

    public record BollingerBands(double upper, double middle, double lower, double width) {}
}
