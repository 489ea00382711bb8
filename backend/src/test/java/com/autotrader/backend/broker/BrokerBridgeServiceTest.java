package com.autotrader.backend.broker;

import com.autotrader.backend.config.BrokerProperties;
import com.autotrader.backend.exception.BrokerNotConnectedException;
import com.autotrader.backend.exception.BrokerTimeoutException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BrokerBridgeServiceTest {

    private BrokerBridgeService bridge;

    @AfterEach
    void tearDown() {
        if (bridge != null) {
            bridge.stop();
        }
    }

    @Test
    void callsFailFastWhenBrokerDisabled() {
        BrokerProperties props = new BrokerProperties();
        props.setEnabled(false);
        bridge = new BrokerBridgeService(props, Optional.empty());
        bridge.start();

        CompletableFuture<Quote> quote = bridge.getQuote(Contract.stock("AAPL", "SMART", "USD"));

        assertThat(quote).isCompletedExceptionally();
        assertThat(bridge.isReady()).isFalse();
        assertThatThrownBy(() -> bridge.await(quote)).isInstanceOf(BrokerNotConnectedException.class);
    }

    @Test
    void connectsAndReportsAccount() {
        FakeBrokerSession session = new FakeBrokerSession();
        bridge = started(session, new BrokerProperties());

        assertThat(bridge.isReady()).isTrue();
        assertThat(bridge.getState()).isEqualTo(ConnectionState.CONNECTED);
        assertThat(bridge.getAccount()).isEqualTo("DU123");
    }

    @Test
    void connectionStatusIsReadWithoutTouchingTheSession() {
        FakeBrokerSession session = new FakeBrokerSession();
        bridge = started(session, new BrokerProperties());

        assertThat(bridge.isConnected()).isTrue();
        assertThat(bridge.isReady()).isTrue();

        assertThat(session.connectionCheckThreads()).doesNotContain(Thread.currentThread().getName());
    }

    @Test
    void concurrentOpenOrderRefreshesShareOneRequest() {
        FakeBrokerSession session = new FakeBrokerSession();
        bridge = started(session, new BrokerProperties());
        CountDownLatch gate = new CountDownLatch(1);
        session.gateOpenTrades(gate);

        CompletableFuture<List<OpenTrade>> first = bridge.getOpenTrades();
        CompletableFuture<List<OpenTrade>> second = bridge.getOpenTrades();
        gate.countDown();

        assertThat(bridge.await(first)).isEmpty();
        assertThat(bridge.await(second)).isEmpty();
        assertThat(session.openTradesRequests()).isEqualTo(1);
    }

    @Test
    void timeoutAbandonsTheWaitButNotTheCall() throws Exception {
        FakeBrokerSession session = new FakeBrokerSession();
        bridge = started(session, new BrokerProperties());
        CountDownLatch gate = new CountDownLatch(1);
        session.gateBars(gate);

        CompletableFuture<?> bars = bridge.getHistoricalBars(Contract.stock("AAPL", "SMART", "USD"), "2 D",
                "5 mins", true, Duration.ofMillis(200));

        assertThatThrownBy(() -> bridge.await(bars)).isInstanceOf(BrokerTimeoutException.class);
        gate.countDown();
        assertThat(session.awaitBarsFinished(5)).isTrue();
        assertThat(bridge.await(bridge.nextOrderId())).isEqualTo(100);
    }

    private static BrokerBridgeService started(FakeBrokerSession session, BrokerProperties props) {
        BrokerBridgeService service = new BrokerBridgeService(props, Optional.of(session));
        service.start();
        return service;
    }
}
