package com.autotrader.backend.trading.review;

import com.autotrader.backend.broker.BrokerBridgeService;
import com.autotrader.backend.broker.BrokerOrder;
import com.autotrader.backend.broker.Contract;
import com.autotrader.backend.broker.OpenTrade;
import com.autotrader.backend.config.TraderProperties;
import com.autotrader.backend.exception.BrokerNotConnectedException;
import com.autotrader.backend.exception.DecisionException;
import com.autotrader.backend.model.PositionReview;
import com.autotrader.backend.service.EventStreamService;
import com.autotrader.backend.service.OrderExecutionService;
import com.autotrader.backend.service.ReviewLogService;
import com.autotrader.backend.service.TradeRecordService;
import com.autotrader.backend.service.decision.DecisionService;
import com.autotrader.backend.service.decision.PositionReviewDecision;
import com.autotrader.backend.service.indicator.SignalService;
import com.autotrader.backend.trading.MarketContext;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PositionReviewEngineTest {

    private static final Contract AAPL = Contract.stock("AAPL", "SMART", "USD");
    private static final Instant NOW = Instant.parse("2024-01-10T16:00:00Z");

    private final BrokerBridgeService bridge = mock(BrokerBridgeService.class);
    private final OrderExecutionService orderExecution = mock(OrderExecutionService.class);
    private final DecisionService decisionService = mock(DecisionService.class);
    private final ReviewLogService reviewLogService = mock(ReviewLogService.class);
    private final TradeRecordService tradeRecordService = mock(TradeRecordService.class);
    private final EventStreamService events = mock(EventStreamService.class);
    private final PositionMetadataStore metadataStore = new PositionMetadataStore();

    private PositionReviewEngine engine;
    private TraderProperties config;
    private PositionReviewEngine.PositionState state;

    @BeforeEach
    void setUp() {
        engine = new PositionReviewEngine(bridge, orderExecution, decisionService, mock(SignalService.class),
                metadataStore, reviewLogService, tradeRecordService, events, new ObjectMapper());
        config = new TraderProperties();
        state = new PositionReviewEngine.PositionState(AAPL, 10, 100.0, 105.0, 50.0, 5.0);
        when(bridge.await(any())).thenThrow(new BrokerNotConnectedException("offline"));
        when(orderExecution.ordersSummary("AAPL"))
                .thenReturn(new OrderExecutionService.OrdersSummary(95.0, 11, 110.0, 12));
        when(orderExecution.pendingSellOrders("AAPL")).thenReturn(List.of());
    }

    @Test
    void sellExecutesRecordsTradeAndClearsMetadata() {
        decide(new PositionReviewDecision(PositionReviewDecision.SELL, null, null, 0.8, 0.9, "momentum gone", List.of()));
        when(orderExecution.sellPosition(AAPL, 10)).thenReturn(marketSell());

        PositionReview review = engine.review(config, state, List.of(), MarketContext.unavailable(), NOW);

        assertThat(review.isExecuted()).isTrue();
        assertThat(review.getExecutionResult()).isEqualTo(TradeRecordService.STATUS_SOLD);
        assertThat(metadataStore.get("AAPL")).isEmpty();
        verify(tradeRecordService).record("AAPL", TradeRecordService.SELL, 10, 105.0, null, null, 0.8,
                TradeRecordService.STATUS_SOLD, "momentum gone");
        verify(reviewLogService).recordPositionReview(review);
    }

    @Test
    void sellIsRefusedWhileAMarketSellIsPending() {
        decide(new PositionReviewDecision(PositionReviewDecision.SELL, null, null, 0.8, 0.9, "exit", List.of()));
        when(orderExecution.pendingSellOrders("AAPL")).thenReturn(List.of(
                new OrderExecutionService.PendingSellOrder(40, BrokerOrder.MARKET, 10, "Submitted")));

        PositionReview review = engine.review(config, state, List.of(), MarketContext.unavailable(), NOW);

        assertThat(review.isExecuted()).isFalse();
        verify(orderExecution, never()).sellPosition(any(), anyInt());
    }

    @Test
    void protectiveExitsDoNotBlockASell() {
        decide(new PositionReviewDecision(PositionReviewDecision.SELL, null, null, 0.8, 0.9, "exit", List.of()));
        when(orderExecution.pendingSellOrders("AAPL")).thenReturn(List.of(
                new OrderExecutionService.PendingSellOrder(11, BrokerOrder.STOP, 10, "PreSubmitted"),
                new OrderExecutionService.PendingSellOrder(12, BrokerOrder.LIMIT, 10, "Submitted")));
        when(orderExecution.sellPosition(AAPL, 10)).thenReturn(marketSell());

        PositionReview review = engine.review(config, state, List.of(), MarketContext.unavailable(), NOW);

        assertThat(review.isExecuted()).isTrue();
    }

    @Test
    void stopAtOrAboveCurrentPriceIsRejected() {
        decide(new PositionReviewDecision(PositionReviewDecision.ADJUST_STOP, 105.0, null, 0.7, 0.5, "tighten",
                List.of()));

        PositionReview review = engine.review(config, state, List.of(), MarketContext.unavailable(), NOW);

        assertThat(review.isExecuted()).isFalse();
        assertThat(review.getAction()).isEqualTo(PositionReviewDecision.ADJUST_STOP);
        verify(orderExecution, never()).upsertStopLoss(any(), anyDouble(), any());
    }

    @Test
    void takeProfitAtOrBelowCurrentPriceIsRejected() {
        decide(new PositionReviewDecision(PositionReviewDecision.ADJUST_TP, null, 104.0, 0.7, 0.5, "lower",
                List.of()));

        PositionReview review = engine.review(config, state, List.of(), MarketContext.unavailable(), NOW);

        assertThat(review.isExecuted()).isFalse();
        verify(orderExecution, never()).upsertTakeProfit(any(), anyDouble(), any());
    }

    @Test
    void validTakeProfitIsUpsertedAndCounted() {
        decide(new PositionReviewDecision(PositionReviewDecision.ADJUST_TP, null, 120.0, 0.7, 0.5, "extend",
                List.of("trend", "volume")));
        when(orderExecution.upsertTakeProfit(AAPL, 120.0, 10)).thenReturn(true);

        PositionReview review = engine.review(config, state, List.of(), MarketContext.unavailable(), NOW);

        assertThat(review.isExecuted()).isTrue();
        assertThat(review.getExecutionResult()).isEqualTo("TP -> 120.00");
        assertThat(review.getKeyFactors()).isEqualTo("[\"trend\",\"volume\"]");
        assertThat(metadataStore.get("AAPL").orElseThrow().getAdjustmentCount()).isEqualTo(1);
    }

    @Test
    void adjustmentsStopAtTheConfiguredLimit() {
        config.getPositionManagement().setMaxAdjustmentsPerPosition(1);
        decide(new PositionReviewDecision(PositionReviewDecision.ADJUST_STOP, 100.0, null, 0.7, 0.5, "trail",
                List.of()));
        when(orderExecution.upsertStopLoss(AAPL, 100.0, 10)).thenReturn(true);

        PositionReview first = engine.review(config, state, List.of(), MarketContext.unavailable(), NOW);
        PositionReview second = engine.review(config, state, List.of(), MarketContext.unavailable(), NOW);

        assertThat(first.isExecuted()).isTrue();
        assertThat(first.getExecutionResult()).isEqualTo("STOP -> 100.00");
        assertThat(second.isExecuted()).isFalse();
        verify(orderExecution, times(1)).upsertStopLoss(AAPL, 100.0, 10);
    }

    @Test
    void closedPositionDoesNotLeaveMetadataForTheNextEntry() {
        config.getPositionManagement().setMaxAdjustmentsPerPosition(2);
        PositionReviewEngine.PositionState winner =
                new PositionReviewEngine.PositionState(AAPL, 10, 100.0, 120.0, 200.0, 20.0);
        decide(new PositionReviewDecision(PositionReviewDecision.ADJUST_TP, null, 130.0, 0.7, 0.5, "extend",
                List.of()));
        when(orderExecution.upsertTakeProfit(AAPL, 130.0, 10)).thenReturn(true);
        engine.review(config, winner, List.of(), MarketContext.unavailable(), NOW);
        engine.review(config, winner, List.of(), MarketContext.unavailable(), NOW);
        assertThat(metadataStore.get("AAPL").orElseThrow().getAdjustmentCount()).isEqualTo(2);

        // the take-profit filled: the next pass sees no AAPL position
        doReturn(List.of()).when(bridge).await(any());
        assertThat(engine.reviewAll(config, List.of(), MarketContext.unavailable(), NOW.plusSeconds(3600)))
                .isEmpty();
        assertThat(metadataStore.get("AAPL")).isEmpty();
        doThrow(new BrokerNotConnectedException("offline")).when(bridge).await(any());

        PositionReviewEngine.PositionState reentry =
                new PositionReviewEngine.PositionState(AAPL, 20, 50.0, 50.0, 0.0, 0.0);
        decide(new PositionReviewDecision(PositionReviewDecision.ADJUST_TP, null, 60.0, 0.7, 0.5, "room to run",
                List.of()));
        when(orderExecution.upsertTakeProfit(AAPL, 60.0, 20)).thenReturn(true);

        PositionReview review = engine.review(config, reentry, List.of(), MarketContext.unavailable(),
                NOW.plusSeconds(7200));

        assertThat(review.isExecuted()).isTrue();
        assertThat(review.getMinutesHeld()).isZero();
        PositionMetadata fresh = metadataStore.get("AAPL").orElseThrow();
        assertThat(fresh.getEntryPrice()).isEqualTo(50.0);
        assertThat(fresh.getPeakPnlPct()).isZero();
        assertThat(fresh.getAdjustmentCount()).isEqualTo(1);
    }

    @Test
    void decisionFailureIsRecordedAsError() {
        when(decisionService.reviewPosition(eq(config), anyMap())).thenThrow(new DecisionException("bad json"));

        PositionReview review = engine.review(config, state, List.of(), MarketContext.unavailable(), NOW);

        assertThat(review.getAction()).isEqualTo(PositionReviewEngine.ACTION_ERROR);
        assertThat(review.getRationale()).isEqualTo("DecisionException: bad json");
        assertThat(review.isExecuted()).isFalse();
        verify(reviewLogService).recordPositionReview(review);
    }

    @Test
    void holdIsRecordedButNotExecuted() {
        decide(new PositionReviewDecision(PositionReviewDecision.HOLD, null, null, 0.6, 0.2, "fine", List.of()));

        PositionReview review = engine.review(config, state, List.of(), MarketContext.unavailable(), NOW);

        assertThat(review.isExecuted()).isFalse();
        assertThat(review.getCurrentStopLoss()).isEqualTo(95.0);
        assertThat(review.getCurrentTakeProfit()).isEqualTo(110.0);
        assertThat(review.getPnlPct()).isEqualTo(5.0);
    }

    @Test
    void pnlPercentIsRelativeToAverageCost() {
        assertThat(PositionReviewEngine.pnlPct(100.0, 97.5)).isCloseTo(-2.5, within(1e-9));
        assertThat(PositionReviewEngine.pnlPct(0.0, 97.5)).isZero();
    }

    private void decide(PositionReviewDecision decision) {
        when(decisionService.reviewPosition(eq(config), anyMap())).thenReturn(decision);
    }

    private static OpenTrade marketSell() {
        BrokerOrder order = BrokerOrder.builder()
                .orderId(41)
                .action(BrokerOrder.SELL)
                .orderType(BrokerOrder.MARKET)
                .totalQuantity(10)
                .build();
        return new OpenTrade(AAPL, order, "Submitted", 0, 10, NOW);
    }
}
