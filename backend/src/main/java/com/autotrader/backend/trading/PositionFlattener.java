package com.autotrader.backend.trading;

import com.autotrader.backend.broker.BrokerBridgeService;
import com.autotrader.backend.broker.BrokerOrder;
import com.autotrader.backend.broker.Contract;
import com.autotrader.backend.broker.OpenTrade;
import com.autotrader.backend.broker.PortfolioItem;
import com.autotrader.backend.service.EventStreamService;
import com.autotrader.backend.service.MarketHoursService;
import com.autotrader.backend.service.OrderExecutionService;
import com.autotrader.backend.service.TradeRecordService;
import com.autotrader.backend.trading.review.PositionMetadataStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Intraday exit: positions whose market closes within the configured window are taken to zero with a
 * market order after their working orders are cancelled.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PositionFlattener {

    private final BrokerBridgeService bridge;
    private final OrderExecutionService orderExecution;
    private final MarketHoursService marketHours;
    private final TradeRecordService tradeRecordService;
    private final PositionMetadataStore metadataStore;
    private final EventStreamService events;

    /**
     * Returns the number of positions a flattening order was placed for.
     */
    public int flattenIfNeeded(int minutesBeforeClose, Instant now) {
        List<PortfolioItem> portfolio;
        try {
            portfolio = bridge.await(bridge.getPortfolio());
        } catch (RuntimeException e) {
            events.error("Broker", "Flatten", "Failed to load portfolio for flattening: " + e.getMessage());
            return 0;
        }

        int flattened = 0;
        for (PortfolioItem item : portfolio) {
            Contract contract = item.contract();
            if (contract == null || contract.symbol() == null || item.position() == 0) {
                continue;
            }
            if (!marketHours.isNearClose(contract.exchange(), contract.currency(), minutesBeforeClose, now)) {
                continue;
            }
            String symbol = contract.symbol();
            try {
                events.updateLiveStatus(symbol, "Flattening before close (" + minutesBeforeClose + "m)");
                events.info(symbol, "Flatten", "Flattening position before close (" + minutesBeforeClose + "m)");
                orderExecution.cancelOrdersForSymbol(symbol);

                String action = item.position() > 0 ? BrokerOrder.SELL : BrokerOrder.BUY;
                int quantity = (int) Math.abs(item.position());
                if (quantity <= 0) {
                    continue;
                }
                OpenTrade trade = orderExecution.placeMarketOrder(contract, action, quantity);
                metadataStore.clear(symbol);
                String status = trade == null || trade.status() == null ? "Submitted" : trade.status();
                Double price = Double.isFinite(item.marketPrice()) && item.marketPrice() > 0 ? item.marketPrice() : null;
                tradeRecordService.record(symbol, action, quantity, price, null, null, null, status,
                        "Flatten before close (" + minutesBeforeClose + "m)");
                flattened++;
            } catch (RuntimeException e) {
                events.error(symbol, "Flatten", "Flattening failed: " + e.getMessage());
            }
        }
        return flattened;
    }
}
