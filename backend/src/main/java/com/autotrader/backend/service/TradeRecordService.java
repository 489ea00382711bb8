package com.autotrader.backend.service;

import com.autotrader.backend.model.Trade;
import com.autotrader.backend.repository.TradeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;

@Slf4j
@Service
@RequiredArgsConstructor
public class TradeRecordService {

    public static final String BUY = "BUY";
    public static final String SELL = "SELL";
    public static final String STATUS_SOLD = "SOLD";

    private final TradeRepository tradeRepository;

    /**
     * Persists a trade record. Failures are logged and swallowed so a placed order is never undone by
     * a bookkeeping error.
     */
    public Trade record(String symbol, String action, int quantity, Double price, Double stopLoss,
                        Double takeProfit, Double sentimentScore, String status, String rationale) {
        Trade trade = Trade.builder()
                .createdAt(Instant.now())
                .symbol(symbol)
                .action(action)
                .quantity(quantity)
                .price(price)
                .stopLoss(stopLoss)
                .takeProfit(takeProfit)
                .sentimentScore(sentimentScore)
                .status(status)
                .rationale(rationale == null || rationale.length() <= 4000 ? rationale : rationale.substring(0, 4000))
                .build();
        try {
            return tradeRepository.save(trade);
        } catch (RuntimeException e) {
            log.error("Failed to record {} trade for {}: {}", action, symbol, e.getMessage());
            return trade;
        }
    }
}
