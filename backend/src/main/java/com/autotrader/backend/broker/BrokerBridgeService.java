package com.autotrader.backend.broker;

import com.autotrader.backend.config.BrokerProperties;
import com.autotrader.backend.exception.BrokerNotConnectedException;
import com.autotrader.backend.exception.BrokerTimeoutException;
import com.autotrader.backend.exception.TradingException;
import com.autotrader.backend.model.Candle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Owns the brokerage session. Every session call runs on one dedicated thread; callers get futures
 * bounded by a timeout that only abandons the wait, never the call itself.
 */
@Slf4j
@Service
public class BrokerBridgeService implements SmartLifecycle {

    private final BrokerProperties properties;
    private final BrokerSession session;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final CountDownLatch readyLatch = new CountDownLatch(1);
    private final Object openOrdersLock = new Object();

    private volatile ScheduledExecutorService executor;
    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile String account;
    private long lastAttemptAtMillis;

    private List<OpenTrade> cachedOpenTrades;
    private long cachedOpenTradesAtMillis;
    private CompletableFuture<List<OpenTrade>> openTradesInFlight;

    public BrokerBridgeService(BrokerProperties properties, Optional<BrokerSession> session) {
        this.properties = properties;
        this.session = session.orElse(null);
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        if (!properties.isEnabled()) {
            log.info("Broker bridge disabled by configuration");
            return;
        }
        if (session == null) {
            log.error("No BrokerSession adapter registered; broker bridge stays disconnected");
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "broker-bridge");
            thread.setDaemon(true);
            return thread;
        });
        executor.scheduleWithFixedDelay(this::manageConnection, 0, 1, TimeUnit.SECONDS);
        try {
            if (!readyLatch.await(properties.getStartupWaitSeconds(), TimeUnit.SECONDS)) {
                log.warn("Broker not ready after {}s; continuing and retrying in background",
                        properties.getStartupWaitSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        ScheduledExecutorService current = executor;
        if (current == null) {
            return;
        }
        current.execute(() -> {
            try {
                session.disconnect();
            } catch (RuntimeException e) {
                log.warn("Broker disconnect failed: {}", e.getMessage());
            }
            state = ConnectionState.DISCONNECTED;
        });
        current.shutdown();
        try {
            if (!current.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Broker bridge thread did not stop within 5s");
                current.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            current.shutdownNow();
        }
        log.info("Broker bridge stopped");
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    public boolean isReady() {
        return running.get() && isConnected();
    }

    /**
     * Last state seen by the connection manager; safe from any thread.
     */
    public boolean isConnected() {
        return state == ConnectionState.CONNECTED;
    }

    public ConnectionState getState() {
        return state;
    }

    public String getAccount() {
        return account;
    }

    private void manageConnection() {
        if (!running.get()) {
            return;
        }
        try {
            if (state == ConnectionState.CONNECTED) {
                if (session.isConnected()) {
                    return;
                }
                log.warn("Broker session dropped; will reconnect");
                state = ConnectionState.DISCONNECTED;
            }
            long now = System.currentTimeMillis();
            long cooldownMillis = properties.getReconnectCooldownSeconds() * 1000L;
            if (lastAttemptAtMillis > 0 && now - lastAttemptAtMillis < cooldownMillis) {
                return;
            }
            lastAttemptAtMillis = now;
            connectOnce();
        } catch (RuntimeException e) {
            log.error("Broker connection manager failed", e);
        }
    }

    private void connectOnce() {
        state = ConnectionState.CONNECTING;
        log.info("Connecting to broker at {}:{} (client id {}, timeout {}s)", properties.getHost(),
                properties.getPort(), properties.getClientId(), properties.getConnectTimeoutSeconds());
        try {
            session.connect(properties.getHost(), properties.getPort(), properties.getClientId(),
                    properties.getConnectTimeoutSeconds());
            session.requestMarketDataType(properties.getMarketDataType());
            List<String> accounts = session.managedAccounts();
            account = accounts == null || accounts.isEmpty() ? null : accounts.get(0);
            if (account != null) {
                subscribeAccountUpdates(account);
            }
            state = ConnectionState.CONNECTED;
            readyLatch.countDown();
            log.info("Broker connected (account {})", account);
        } catch (RuntimeException e) {
            log.error("Broker connect failed: {}", e.getMessage());
            state = ConnectionState.DISCONNECTED;
            try {
                session.disconnect();
            } catch (RuntimeException disconnectError) {
                log.debug("Disconnect after failed connect raised: {}", disconnectError.getMessage());
            }
        }
    }

    private void subscribeAccountUpdates(String accountId) {
        try {
            session.subscribeAccountUpdates(accountId).whenComplete((ignored, error) -> {
                if (error != null) {
                    log.warn("Account update subscription failed for {}: {}", accountId, error.getMessage());
                }
            });
        } catch (RuntimeException e) {
            log.warn("Account update subscription failed for {}: {}", accountId, e.getMessage());
        }
    }

    public CompletableFuture<List<AccountSummaryItem>> getAccountSummary() {
        return submit("account summary", () -> {
            Map<String, AccountSummaryItem> byKey = new LinkedHashMap<>();
            for (AccountValue value : session.accountValues()) {
                if (!AccountValues.SUMMARY_TAGS.contains(value.tag())) {
                    continue;
                }
                AccountValues.parse(value.value()).ifPresent(parsed ->
                        byKey.put(value.tag() + "|" + value.currency(),
                                new AccountSummaryItem(value.tag(), parsed, value.currency())));
            }
            return List.copyOf(byKey.values());
        });
    }

    public CompletableFuture<List<AccountValue>> getAccountValues() {
        return submit("account values", () -> List.copyOf(session.accountValues()));
    }

    public CompletableFuture<List<PortfolioItem>> getPortfolio() {
        return submit("portfolio", () -> List.copyOf(session.portfolio()));
    }

    /**
     * Portfolio lines when the feed has them, otherwise raw positions priced from snapshot quotes.
     */
    public CompletableFuture<List<PositionRow>> getPositions() {
        return submit("positions", () -> {
            List<PositionRow> rows = new ArrayList<>();
            for (PortfolioItem item : session.portfolio()) {
                if (item.position() == 0) {
                    continue;
                }
                Contract c = item.contract();
                rows.add(new PositionRow(item.account(), c.symbol(), nullToEmpty(c.exchange()), c.currency(),
                        item.position(), item.averageCost(), item.marketPrice(), item.marketValue(),
                        item.unrealizedPnl(), item.realizedPnl()));
            }
            if (!rows.isEmpty()) {
                return rows;
            }
            for (PositionEntry entry : session.positions()) {
                if (entry.position() == 0) {
                    continue;
                }
                Contract c = entry.contract();
                Double price = null;
                try {
                    price = session.snapshotQuote(c).price();
                } catch (RuntimeException e) {
                    log.debug("Quote for {} unavailable: {}", c.symbol(), e.getMessage());
                }
                Double marketValue = price == null ? null : price * entry.position();
                Double unrealised = price == null ? null : (price - entry.averageCost()) * entry.position();
                rows.add(new PositionRow(entry.account(), c.symbol(), nullToEmpty(c.exchange()), c.currency(),
                        entry.position(), entry.averageCost(), price, marketValue, unrealised, null));
            }
            return rows;
        });
    }

    /**
     * Open orders, served from a short-lived cache. Concurrent refreshes share one session request.
     */
    public CompletableFuture<List<OpenTrade>> getOpenTrades() {
        if (!isConnected()) {
            return notConnected();
        }
        CompletableFuture<List<OpenTrade>> shared;
        synchronized (openOrdersLock) {
            long now = System.currentTimeMillis();
            if (cachedOpenTrades != null && now - cachedOpenTradesAtMillis < properties.getOpenOrdersTtlMillis()) {
                return CompletableFuture.completedFuture(cachedOpenTrades);
            }
            shared = openTradesInFlight;
            if (shared == null) {
                CompletableFuture<List<OpenTrade>> refresh = CompletableFuture.supplyAsync(
                        () -> List.copyOf(session.requestAllOpenTrades()), executor);
                openTradesInFlight = refresh;
                shared = refresh;
                refresh.whenComplete((result, error) -> {
                    synchronized (openOrdersLock) {
                        if (error == null) {
                            cachedOpenTrades = result;
                            cachedOpenTradesAtMillis = System.currentTimeMillis();
                        }
                        if (openTradesInFlight == refresh) {
                            openTradesInFlight = null;
                        }
                    }
                });
            }
        }
        return withTimeout(shared, "open orders", requestTimeout());
    }

    public CompletableFuture<List<OpenOrderRow>> getOpenOrders() {
        return getOpenTrades().thenApply(trades -> trades.stream().map(OpenOrderRow::from).toList());
    }

    public void invalidateOpenOrders() {
        synchronized (openOrdersLock) {
            cachedOpenTrades = null;
            cachedOpenTradesAtMillis = 0;
        }
    }

    public CompletableFuture<Optional<Contract>> qualifyContract(Contract contract) {
        return submit("qualify " + contract.symbol(), () -> {
            List<Contract> qualified = session.qualifyContracts(contract);
            return qualified == null || qualified.isEmpty() ? Optional.empty() : Optional.of(qualified.get(0));
        });
    }

    public CompletableFuture<List<ContractDetails>> getContractDetails(Contract contract) {
        return submit("contract details " + contract.symbol(), () -> List.copyOf(session.contractDetails(contract)));
    }

    public CompletableFuture<List<Candle>> getHistoricalBars(Contract contract, String duration, String barSize,
                                                            boolean useRth, Duration timeout) {
        return submit("historical bars " + contract.symbol(),
                () -> List.copyOf(session.historicalBars(contract, duration, barSize, useRth)), timeout);
    }

    public CompletableFuture<Quote> getQuote(Contract contract) {
        return submit("quote " + contract.symbol(), () -> {
            Quote quote = session.snapshotQuote(contract);
            return quote == null ? Quote.empty() : quote;
        });
    }

    public CompletableFuture<List<Headline>> getHeadlines(Contract contract, int lookbackDays, int limit) {
        Instant since = Instant.now().minus(Duration.ofDays(lookbackDays));
        return submit("headlines " + contract.symbol(), () -> List.copyOf(session.historicalNews(contract, since, limit)));
    }

    public CompletableFuture<List<ScanResult>> runScanner(ScanRequest request, Duration timeout) {
        return submit("scanner " + request.scanCode(), () -> List.copyOf(session.scanner(request)), timeout);
    }

    public CompletableFuture<Integer> nextOrderId() {
        return submit("next order id", session::nextOrderId);
    }

    public CompletableFuture<OpenTrade> placeOrder(Contract contract, BrokerOrder order) {
        return submit("place order " + contract.symbol(), () -> {
            OpenTrade trade = session.placeOrder(contract, order);
            invalidateOpenOrders();
            return trade;
        });
    }

    public CompletableFuture<Void> cancelOrder(BrokerOrder order) {
        return submit("cancel order " + order.getOrderId(), () -> {
            session.cancelOrder(order);
            invalidateOpenOrders();
            return null;
        });
    }

    /**
     * Blocks for a bridge future and rethrows its failure unwrapped.
     */
    public <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            throw translate(e, "broker call", requestTimeout());
        }
    }

    private <T> CompletableFuture<T> submit(String operation, Supplier<T> call) {
        return submit(operation, call, requestTimeout());
    }

    private <T> CompletableFuture<T> submit(String operation, Supplier<T> call, Duration timeout) {
        if (!isConnected()) {
            return notConnected();
        }
        CompletableFuture<T> underlying;
        try {
            underlying = CompletableFuture.supplyAsync(call, executor);
        } catch (java.util.concurrent.RejectedExecutionException e) {
            return notConnected();
        }
        return withTimeout(underlying, operation, timeout);
    }

    private <T> CompletableFuture<T> withTimeout(CompletableFuture<T> underlying, String operation, Duration timeout) {
        return underlying.copy()
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .exceptionallyCompose(error -> CompletableFuture.failedFuture(translate(error, operation, timeout)));
    }

    private RuntimeException translate(Throwable error, String operation, Duration timeout) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof TimeoutException) {
            return new BrokerTimeoutException(operation + " timed out after " + timeout.toSeconds() + "s", cause);
        }
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        return new TradingException(operation + " failed: " + cause.getMessage(), cause);
    }

    private <T> CompletableFuture<T> notConnected() {
        return CompletableFuture.failedFuture(new BrokerNotConnectedException("Broker not connected"));
    }

    private Duration requestTimeout() {
        return Duration.ofSeconds(properties.getRequestTimeoutSeconds());
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
