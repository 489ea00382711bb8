package com.autotrader.backend.trading;

import com.autotrader.backend.broker.BrokerBridgeService;
import com.autotrader.backend.broker.BrokerOrder;
import com.autotrader.backend.broker.Contract;
import com.autotrader.backend.broker.PortfolioItem;
import com.autotrader.backend.exception.BrokerTimeoutException;
import com.autotrader.backend.service.EventStreamService;
import com.autotrader.backend.service.MarketHoursService;
import com.autotrader.backend.service.OrderExecutionService;
import com.autotrader.backend.service.TradeRecordService;
import com.autotrader.backend.trading.review.PositionMetadataStore;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PositionFlattenerTest {

    private static final Instant NOW = Instant.parse("2024-01-10T20:55:00Z");
    private static final Contract AAPL = new Contract(265598, "AAPL", "STK", "SMART", "NASDAQ", "USD", "NMS");
    private static final Contract VOD = new Contract(12345, "VOD", "STK", "LSE", "LSE", "GBP", "VOD");

    private final BrokerBridgeService bridge = mock(BrokerBridgeService.class);
    private final OrderExecutionService orderExecution = mock(OrderExecutionService.class);
    private final MarketHoursService marketHours = mock(MarketHoursService.class);
    private final TradeRecordService tradeRecordService = mock(TradeRecordService.class);
    private final EventStreamService events = mock(EventStreamService.class);
    private final PositionMetadataStore metadataStore = new PositionMetadataStore();
    private final PositionFlattener flattener = new PositionFlattener(bridge, orderExecution, marketHours,
            tradeRecordService, metadataStore, events);

    @Test
    void onlyPositionsNearTheirCloseAreFlattened() {
        when(bridge.await(any())).thenReturn(List.of(
                item(AAPL, 10, 101.5),
                item(VOD, 200, 0.72)));
        when(marketHours.isNearClose("SMART", "USD", 10, NOW)).thenReturn(true);
        when(marketHours.isNearClose("LSE", "GBP", 10, NOW)).thenReturn(false);
        metadataStore.getOrCreate("AAPL", 95.0, NOW.minusSeconds(3600)).incrementAdjustments();
        metadataStore.getOrCreate("VOD", 0.7, NOW.minusSeconds(3600));

        int flattened = flattener.flattenIfNeeded(10, NOW);

        assertThat(flattened).isEqualTo(1);
        verify(orderExecution).cancelOrdersForSymbol("AAPL");
        verify(orderExecution).placeMarketOrder(AAPL, BrokerOrder.SELL, 10);
        verify(tradeRecordService).record("AAPL", BrokerOrder.SELL, 10, 101.5, null, null, null, "Submitted",
                "Flatten before close (10m)");
        verify(orderExecution, never()).placeMarketOrder(eq(VOD), anyString(), anyInt());
        assertThat(metadataStore.get("AAPL")).isEmpty();
        assertThat(metadataStore.get("VOD")).isPresent();
    }

    @Test
    void shortPositionIsBoughtBack() {
        when(bridge.await(any())).thenReturn(List.of(item(AAPL, -5, Double.NaN)));
        when(marketHours.isNearClose(anyString(), anyString(), anyInt(), any())).thenReturn(true);

        flattener.flattenIfNeeded(10, NOW);

        verify(orderExecution).placeMarketOrder(AAPL, BrokerOrder.BUY, 5);
        verify(tradeRecordService).record("AAPL", BrokerOrder.BUY, 5, null, null, null, null, "Submitted",
                "Flatten before close (10m)");
    }

    @Test
    void portfolioFailureFlattensNothing() {
        when(bridge.await(any())).thenThrow(new BrokerTimeoutException("portfolio timed out"));

        assertThat(flattener.flattenIfNeeded(10, NOW)).isZero();
        verify(events).error("Broker", "Flatten", "Failed to load portfolio for flattening: portfolio timed out");
    }

    private static PortfolioItem item(Contract contract, double position, double marketPrice) {
        return new PortfolioItem("DU123", contract, position, marketPrice, position * marketPrice, 100.0, 0.0, 0.0);
    }
}
