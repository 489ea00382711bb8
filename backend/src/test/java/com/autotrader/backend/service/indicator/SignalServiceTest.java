package com.autotrader.backend.service.indicator;

import com.autotrader.backend.model.Candle;
import com.autotrader.backend.util.TestCandleFactory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SignalServiceTest {

    private final SignalService signalService = new SignalService(new RsiService(), new AtrService(),
            new BollingerBandService(), new BarMomentumService());

    @Test
    void steadyUptrendSignals() {
        List<Candle> candles = TestCandleFactory.trendingCandles(30, 100.0, 1.0);

        SignalService.SignalBundle signals = signalService.compute(candles);

        assertThat(signals.lastClose()).isEqualTo(130.0);
        assertThat(signals.rsi14()).isEqualTo(100.0);
        assertThat(signals.atr()).isCloseTo(1.5, within(1e-9));
        assertThat(signals.volatilityRatio()).isCloseTo(1.5 / 130.0, within(1e-9));
        assertThat(signals.bollingerMid()).isCloseTo(120.5, within(1e-9));
        assertThat(signals.barMomentum().trend()).isEqualTo("bullish");
        assertThat(signals.barMomentum().greenBarsLast5()).isEqualTo(5);
    }

    @Test
    void shortHistoryLeavesIndicatorsEmpty() {
        SignalService.SignalBundle signals = signalService.compute(TestCandleFactory.trendingCandles(6, 10.0, 0.1));

        assertThat(signals.lastClose()).isCloseTo(10.6, within(1e-9));
        assertThat(signals.rsi14()).isNull();
        assertThat(signals.atr()).isNull();
        assertThat(signals.volatilityRatio()).isNull();
        assertThat(signals.bollingerMid()).isNull();
        assertThat(signals.barMomentum()).isNotNull();
    }

    @Test
    void noBarsMeansEmptyBundle() {
        assertThat(signalService.compute(List.of())).isEqualTo(SignalService.SignalBundle.EMPTY);
    }

    @Test
    void flatTapeIsNeutral() {
        BarMomentumService.BarMomentum momentum = new BarMomentumService()
                .calculate(TestCandleFactory.flatCandles(10, 50.0));

        assertThat(momentum.trend()).isEqualTo("neutral");
        assertThat(momentum.momentum10BarsPct()).isZero();
        assertThat(momentum.volumeAcceleration()).isEqualTo(1.0);
    }
}
