package com.autotrader.backend.trading.review;

import com.autotrader.backend.broker.BrokerBridgeService;
import com.autotrader.backend.broker.Contract;
import com.autotrader.backend.config.TraderProperties;
import com.autotrader.backend.exception.BrokerNotConnectedException;
import com.autotrader.backend.exception.DecisionException;
import com.autotrader.backend.model.OrderReview;
import com.autotrader.backend.service.EventStreamService;
import com.autotrader.backend.service.OrderExecutionService;
import com.autotrader.backend.service.OrderExecutionService.OrderForReview;
import com.autotrader.backend.service.ReviewLogService;
import com.autotrader.backend.service.decision.DecisionService;
import com.autotrader.backend.service.decision.OrderReviewDecision;
import com.autotrader.backend.trading.MarketContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OrderReviewEngineTest {

    private static final Contract AAPL = Contract.stock("AAPL", "SMART", "USD");

    private final BrokerBridgeService bridge = mock(BrokerBridgeService.class);
    private final OrderExecutionService orderExecution = mock(OrderExecutionService.class);
    private final DecisionService decisionService = mock(DecisionService.class);
    private final ReviewLogService reviewLogService = mock(ReviewLogService.class);
    private final EventStreamService events = mock(EventStreamService.class);

    private OrderReviewEngine engine;
    private final TraderProperties config = new TraderProperties();

    @BeforeEach
    void setUp() {
        engine = new OrderReviewEngine(bridge, orderExecution, decisionService, reviewLogService, events);
        when(bridge.await(any())).thenThrow(new BrokerNotConnectedException("offline"));
    }

    @Test
    void bracketChildrenAndYoungOrdersAreNotReviewed() {
        OrderForReview standalone = order(1, 0, 30);
        OrderForReview child = order(2, 1, 30);
        OrderForReview young = order(3, 0, 2);

        List<OrderForReview> selected = OrderReviewEngine.selectForReview(List.of(standalone, child, young), 5);

        assertThat(selected).containsExactly(standalone);
    }

    @Test
    void reviewAllOnlyAsksAboutStandaloneOrders() {
        when(orderExecution.openOrdersForReview()).thenReturn(List.of(order(1, 0, 30), order(2, 1, 30)));
        when(decisionService.reviewOrder(eq(config), anyMap()))
                .thenReturn(new OrderReviewDecision(OrderReviewDecision.KEEP, null, 0.6, "still valid"));

        List<OrderReview> reviews = engine.reviewAll(config, MarketContext.unavailable(), 0);

        assertThat(reviews).singleElement().satisfies(r -> {
            assertThat(r.getOrderId()).isEqualTo(1L);
            assertThat(r.isExecuted()).isFalse();
        });
    }

    @Test
    void cancelDecisionCancelsTheOrder() {
        when(decisionService.reviewOrder(eq(config), anyMap()))
                .thenReturn(new OrderReviewDecision(OrderReviewDecision.CANCEL, null, 0.8, "stale"));
        when(orderExecution.cancelOrder(1)).thenReturn(true);

        OrderReview review = engine.review(config, order(1, 0, 30), MarketContext.unavailable());

        assertThat(review.getAction()).isEqualTo(OrderReviewDecision.CANCEL);
        assertThat(review.isExecuted()).isTrue();
        verify(orderExecution).cancelOrder(1);
        verify(reviewLogService).recordOrderReview(review);
    }

    @Test
    void nonPositiveNewPriceIsNotApplied() {
        when(decisionService.reviewOrder(eq(config), anyMap()))
                .thenReturn(new OrderReviewDecision(OrderReviewDecision.ADJUST_PRICE, 0.0, 0.8, "chase"));

        OrderReview review = engine.review(config, order(1, 0, 30), MarketContext.unavailable());

        assertThat(review.isExecuted()).isFalse();
        verify(orderExecution, never()).adjustOrderPrice(anyInt(), anyDouble());
    }

    @Test
    void adjustPriceMovesTheOrder() {
        when(decisionService.reviewOrder(eq(config), anyMap()))
                .thenReturn(new OrderReviewDecision(OrderReviewDecision.ADJUST_PRICE, 101.5, 0.8, "chase"));
        when(orderExecution.adjustOrderPrice(1, 101.5)).thenReturn(true);

        OrderReview review = engine.review(config, order(1, 0, 30), MarketContext.unavailable());

        assertThat(review.isExecuted()).isTrue();
        assertThat(review.getNewPrice()).isEqualTo(101.5);
    }

    @Test
    void decisionFailureIsRecordedAsError() {
        when(decisionService.reviewOrder(eq(config), anyMap())).thenThrow(new DecisionException("timeout"));

        OrderReview review = engine.review(config, order(1, 0, 30), MarketContext.unavailable());

        assertThat(review.getAction()).isEqualTo(PositionReviewEngine.ACTION_ERROR);
        assertThat(review.getRationale()).isEqualTo("DecisionException: timeout");
        verify(reviewLogService).recordOrderReview(review);
    }

    private static OrderForReview order(int orderId, int parentId, int ageMinutes) {
        return new OrderForReview(orderId, AAPL, "BUY", "LMT", 10, 99.0, "Submitted", 0, 10, ageMinutes, parentId);
    }
}
