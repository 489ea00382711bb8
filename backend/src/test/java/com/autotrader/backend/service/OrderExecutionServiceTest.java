package com.autotrader.backend.service;

import com.autotrader.backend.broker.BrokerBridgeService;
import com.autotrader.backend.broker.BrokerOrder;
import com.autotrader.backend.broker.Contract;
import com.autotrader.backend.broker.FakeBrokerSession;
import com.autotrader.backend.broker.OpenTrade;
import com.autotrader.backend.config.BrokerProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class OrderExecutionServiceTest {

    private static final Contract AAPL = Contract.stock("AAPL", "SMART", "USD");

    private FakeBrokerSession session;
    private BrokerBridgeService bridge;
    private OrderExecutionService orders;

    @BeforeEach
    void setUp() {
        session = new FakeBrokerSession();
        BrokerProperties props = new BrokerProperties();
        props.setOpenOrdersTtlMillis(0);
        bridge = new BrokerBridgeService(props, Optional.of(session));
        bridge.start();
        orders = new OrderExecutionService(bridge);
    }

    @AfterEach
    void tearDown() {
        bridge.stop();
    }

    @Test
    void upsertStopLossTwiceKeepsASingleStopOrder() {
        session.holdLong("AAPL", 10, 100.0);

        assertThat(orders.upsertStopLoss(AAPL, 95.037, null)).isTrue();
        assertThat(orders.upsertStopLoss(AAPL, 94.5, null)).isTrue();

        List<OpenTrade> stops = session.openTradesFor("AAPL").stream()
                .filter(t -> t.order().hasType(BrokerOrder.STOP))
                .toList();
        assertThat(stops).hasSize(1);
        assertThat(stops.get(0).order().getAuxPrice()).isEqualTo(94.5);
        assertThat(stops.get(0).order().getTotalQuantity()).isEqualTo(10.0);
        assertThat(stops.get(0).order().isSell()).isTrue();
    }

    @Test
    void stopRoundsDownAndLinksWithExistingTakeProfit() {
        session.holdLong("AAPL", 10, 100.0);
        session.placeOrder(AAPL, BrokerOrder.builder()
                .orderId(5)
                .action(BrokerOrder.SELL)
                .orderType(BrokerOrder.LIMIT)
                .totalQuantity(10)
                .lmtPrice(110.0)
                .build());

        orders.upsertStopLoss(AAPL, 95.037, null);

        List<OpenTrade> trades = session.openTradesFor("AAPL");
        assertThat(trades).hasSize(2);
        assertThat(trades).allSatisfy(t -> {
            assertThat(t.order().getOcaGroup()).isEqualTo("OCA_EXIT_AAPL");
            assertThat(t.order().getOcaType()).isEqualTo(OrderExecutionService.OCA_CANCEL_WITH_BLOCK);
        });
        OrderExecutionService.OrdersSummary summary = orders.ordersSummary("AAPL");
        assertThat(summary.stopLoss()).isEqualTo(95.03);
        assertThat(summary.takeProfit()).isEqualTo(110.0);
        assertThat(summary.takeProfitOrderId()).isEqualTo(5);
    }

    @Test
    void takeProfitUpsertIsIdempotentAndRoundsUp() {
        session.holdLong("AAPL", 10, 100.0);

        orders.upsertTakeProfit(AAPL, 110.001, null);
        orders.upsertTakeProfit(AAPL, 110.001, null);

        List<OpenTrade> limits = session.openTradesFor("AAPL").stream()
                .filter(t -> t.order().hasType(BrokerOrder.LIMIT))
                .toList();
        assertThat(limits).hasSize(1);
        assertThat(limits.get(0).order().getLmtPrice()).isEqualTo(110.01);
    }

    @Test
    void upsertWithoutPositionPlacesNothing() {
        assertThat(orders.upsertStopLoss(AAPL, 95.0, null)).isFalse();
        assertThat(session.placedOrders()).isEmpty();
    }

    @Test
    void bracketBuyAttachesChildrenToParent() {
        OpenTrade parent = orders.executeBuyOrder(AAPL, 20, 48.0, 52.0);

        int parentId = parent.order().getOrderId();
        List<OpenTrade> trades = session.openTradesFor("AAPL");
        assertThat(trades).hasSize(3);
        assertThat(trades).filteredOn(t -> t.order().getParentId() == parentId)
                .hasSize(2)
                .allSatisfy(t -> {
                    assertThat(t.order().isSell()).isTrue();
                    assertThat(t.order().getOcaGroup()).isEqualTo("OCA_" + parentId);
                });
        assertThat(parent.order().hasType(BrokerOrder.MARKET)).isTrue();
    }

    @Test
    void sellIsCappedAtHeldQuantityAndCancelsExits() {
        session.holdLong("AAPL", 10, 100.0);
        orders.upsertStopLoss(AAPL, 95.0, null);

        OpenTrade sell = orders.sellPosition(AAPL, 25);

        assertThat(sell.order().getTotalQuantity()).isEqualTo(10.0);
        assertThat(sell.order().hasType(BrokerOrder.MARKET)).isTrue();
        assertThat(session.openTradesFor("AAPL")).extracting(t -> t.order().getOrderType())
                .containsExactly(BrokerOrder.MARKET);
    }

    @Test
    void orphanedSellOrdersAreCancelled() {
        session.placeOrder(AAPL, BrokerOrder.builder()
                .orderId(7)
                .action(BrokerOrder.SELL)
                .orderType(BrokerOrder.STOP)
                .totalQuantity(5)
                .auxPrice(90.0)
                .build());

        assertThat(orders.cancelOrphanedSellOrders()).isEqualTo(1);
        assertThat(session.openTradesFor("AAPL")).isEmpty();
    }

    @Test
    void shortPositionIsCoveredAfterItsOrdersAreCancelled() {
        session.holdShort("TSLA", 30, 200.0);
        session.holdLong("AAPL", 10, 100.0);
        Contract tsla = Contract.stock("TSLA", "SMART", "USD");
        session.placeOrder(tsla, BrokerOrder.builder()
                .orderId(21)
                .action(BrokerOrder.SELL)
                .orderType(BrokerOrder.LIMIT)
                .totalQuantity(30)
                .lmtPrice(210.0)
                .build());
        orders.upsertStopLoss(AAPL, 95.0, null);

        List<OrderExecutionService.ClosedShort> closed = orders.closeAllShorts();

        assertThat(closed).containsExactly(new OrderExecutionService.ClosedShort("TSLA", 30));
        assertThat(session.openTradesFor("TSLA")).singleElement().satisfies(t -> {
            assertThat(t.order().getOrderId()).isNotEqualTo(21);
            assertThat(t.order().getAction()).isEqualTo(BrokerOrder.BUY);
            assertThat(t.order().hasType(BrokerOrder.MARKET)).isTrue();
            assertThat(t.order().getTotalQuantity()).isEqualTo(30.0);
        });
        assertThat(session.openTradesFor("AAPL")).extracting(t -> t.order().getOrderType())
                .containsExactly(BrokerOrder.STOP);
    }

    @Test
    void closeShortLeavesLongAndFlatPositionsAlone() {
        session.holdLong("AAPL", 10, 100.0);

        assertThat(orders.closeShortPosition("AAPL", "SMART", "USD")).isNull();
        assertThat(orders.closeShortPosition("MSFT", "SMART", "USD")).isNull();
        assertThat(orders.closeAllShorts()).isEmpty();
        assertThat(session.placedOrders()).isEmpty();
    }

    @Test
    void adjustOrderPriceMovesLimitInPlace() {
        session.placeOrder(AAPL, BrokerOrder.builder()
                .orderId(9)
                .action(BrokerOrder.BUY)
                .orderType(BrokerOrder.LIMIT)
                .totalQuantity(5)
                .lmtPrice(99.0)
                .build());

        assertThat(orders.adjustOrderPrice(9, 101.5)).isTrue();
        assertThat(session.openTradesFor("AAPL")).singleElement()
                .satisfies(t -> assertThat(t.order().getLmtPrice()).isEqualTo(101.5));
    }
}
