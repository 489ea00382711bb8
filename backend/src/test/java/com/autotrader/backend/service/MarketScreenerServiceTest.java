package com.autotrader.backend.service;

import com.autotrader.backend.broker.BrokerBridgeService;
import com.autotrader.backend.broker.Contract;
import com.autotrader.backend.broker.ScanResult;
import com.autotrader.backend.config.TraderProperties;
import com.autotrader.backend.exception.BrokerTimeoutException;
import com.autotrader.backend.trading.Candidate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class MarketScreenerServiceTest {

    private final BrokerBridgeService bridge = mock(BrokerBridgeService.class);
    private final MarketScreenerService screener = new MarketScreenerService(bridge);
    private TraderProperties config;

    @BeforeEach
    void setUp() {
        config = new TraderProperties();
    }

    @Test
    void manualSymbolsComeFirstAndDuplicatesCollapse() {
        config.getTrading().getScreener().setIncludeSymbols(List.of("aapl", "VOD,UK", "TSLA"));
        config.getTrading().getScreener().setExcludeSymbols(List.of("tsla,US"));
        when(bridge.await(any())).thenReturn(List.of(
                new ScanResult(0, contract("AAPL", "NMS")),
                new ScanResult(1, contract("MSFT", "NMS")),
                new ScanResult(2, contract("PENNY", "SCM")),
                new ScanResult(3, contract("TSLA", "NMS"))));

        List<Candidate> universe = screener.screen(config);

        assertThat(universe).extracting(Candidate::symbol).containsExactly("AAPL", "MSFT");
        assertThat(universe.get(0).scanSource()).isEqualTo("Manual");
        assertThat(universe.get(1).scanSource()).isEqualTo("Most Active");
    }

    @Test
    void failingScansAreSkipped() {
        config.getTrading().getScreener().setIncludeSymbols(List.of("NVDA"));
        when(bridge.await(any())).thenThrow(new BrokerTimeoutException("scanner timed out"));

        assertThat(screener.screen(config)).extracting(Candidate::symbol).containsExactly("NVDA");
    }

    @Test
    void universeIsCapped() {
        config.getTrading().getScreener().setMaxCandidates(2);
        config.getTrading().getScreener().setIncludeSymbols(List.of("A", "B", "C"));
        config.getTrading().getScreener().setScanCodes(List.of());

        assertThat(screener.screen(config)).extracting(Candidate::symbol).containsExactly("A", "B");
    }

    @Test
    void noMarketsMeansEmptyUniverse() {
        config.getTrading().setMarkets(List.of(" "));

        assertThat(screener.screen(config)).isEmpty();
    }

    @Test
    void unqualifiedManualSymbolGoesToUsWhenBothMarketsAreOn() {
        config.getTrading().setMarkets(List.of("UK", "US"));
        config.getTrading().getScreener().setIncludeSymbols(List.of("IBM", "BARC,UK", "XYZ,JP"));
        config.getTrading().getScreener().setScanCodes(List.of());

        List<Candidate> universe = screener.screen(config);

        assertThat(universe).extracting(Candidate::symbol).containsExactly("IBM", "BARC");
        assertThat(universe).extracting(Candidate::currency).containsExactly("USD", "GBP");
    }

    @Test
    void dedupeIgnoresCaseAndBlankSymbols() {
        List<Candidate> out = MarketScreenerService.dedupe(List.of(
                Candidate.us("abc", "Manual", ""),
                Candidate.us("ABC", "Most Active", ""),
                Candidate.us(" ", "Most Active", "")));

        assertThat(out).singleElement().extracting(Candidate::scanSource).isEqualTo("Manual");
    }

    private static Contract contract(String symbol, String tradingClass) {
        return new Contract(1, symbol, "STK", "SMART", "NASDAQ", "USD", tradingClass);
    }
}
