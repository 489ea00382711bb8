package com.autotrader.backend.service.indicator;

import com.autotrader.backend.model.Candle;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Bundles the per-symbol technical signals handed to the decision service.
 */
@Service
@RequiredArgsConstructor
public class SignalService {

    private final RsiService rsiService;
    private final AtrService atrService;
    private final BollingerBandService bollingerBandService;
    private final BarMomentumService barMomentumService;

    public SignalBundle compute(List<Candle> candles) {
        if (candles == null || candles.isEmpty()) {
            return SignalBundle.EMPTY;
        }
        Double atr = atrService.calculate(candles);
        BollingerBandService.BollingerBands bands = bollingerBandService.calculate(candles);
        return new SignalBundle(
                candles.get(candles.size() - 1).getClose(),
                rsiService.calculate(candles),
                atr,
                atrService.volatilityRatio(atr, candles),
                bands == null ? null : bands.middle(),
                barMomentumService.calculate(candles));
    }

    public record SignalBundle(Double lastClose,
                               Double rsi14,
                               Double atr,
                               Double volatilityRatio,
                               Double bollingerMid,
                               BarMomentumService.BarMomentum barMomentum) {

        public static final SignalBundle EMPTY = new SignalBundle(null, null, null, null, null, null);
    }
}
