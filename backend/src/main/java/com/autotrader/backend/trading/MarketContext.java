package com.autotrader.backend.trading;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Broad-market backdrop from SPY and QQQ, passed to every decision call of a cycle.
 */
public record MarketContext(Double spyPrice, Double spyChangePct, Double qqqPrice, Double qqqChangePct,
                            String marketSentiment) {

    public static final String BULLISH = "bullish";
    public static final String BEARISH = "bearish";
    public static final String NEUTRAL = "neutral";

    public static MarketContext unavailable() {
        return new MarketContext(null, null, null, null, NEUTRAL);
    }

    /**
     * Bullish above +0.3% on SPY, bearish below -0.3%, neutral otherwise (including no data).
     */
    public static String sentimentFor(Double spyChangePct) {
        double change = spyChangePct == null ? 0.0 : spyChangePct;
        if (change > 0.3) {
            return BULLISH;
        }
        if (change < -0.3) {
            return BEARISH;
        }
        return NEUTRAL;
    }

    public Map<String, Object> toPayload() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("spy_price", spyPrice);
        out.put("spy_change_pct", spyChangePct);
        out.put("qqq_price", qqqPrice);
        out.put("qqq_change_pct", qqqChangePct);
        out.put("market_sentiment", marketSentiment);
        return out;
    }
}
