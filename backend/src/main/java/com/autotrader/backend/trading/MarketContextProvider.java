package com.autotrader.backend.trading;

import com.autotrader.backend.broker.BrokerBridgeService;
import com.autotrader.backend.broker.Contract;
import com.autotrader.backend.broker.Quote;
import com.autotrader.backend.service.EventStreamService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;

@Slf4j
@Service
@RequiredArgsConstructor
public class MarketContextProvider {

    private final BrokerBridgeService bridge;
    private final EventStreamService events;

    /**
     * Best effort: any broker failure yields {@link MarketContext#unavailable()}.
     */
    public MarketContext fetch() {
        events.updateLiveStatus("Market", "Fetching SPY/QQQ context");
        try {
            Quote spy = quote("SPY");
            Quote qqq = quote("QQQ");
            Double spyChange = changePct(spy);
            Double qqqChange = changePct(qqq);
            MarketContext context = new MarketContext(spy.price(), spyChange, qqq.price(), qqqChange,
                    MarketContext.sentimentFor(spyChange));
            events.info("Market", "Context", "Market: SPY " + orNa(spyChange) + "%, QQQ " + orNa(qqqChange) + "%");
            return context;
        } catch (RuntimeException e) {
            log.debug("Failed to fetch market context: {}", e.getMessage());
            return MarketContext.unavailable();
        }
    }

    /**
     * Percent change of last (or close) against the previous close, rounded to 2 places.
     */
    static Double changePct(Quote quote) {
        Double last = quote.price();
        Double previous = quote.close();
        if (last == null || !Quote.isUsable(previous)) {
            return null;
        }
        return BigDecimal.valueOf((last - previous) / previous * 100.0)
                .setScale(2, RoundingMode.HALF_UP)
                .doubleValue();
    }

    private Quote quote(String symbol) {
        Contract stock = Contract.stock(symbol, "SMART", "USD");
        Contract contract = bridge.await(bridge.qualifyContract(stock)).orElse(stock);
        return bridge.await(bridge.getQuote(contract));
    }

    private static String orNa(Double value) {
        return value == null ? "N/A" : value.toString();
    }
}
