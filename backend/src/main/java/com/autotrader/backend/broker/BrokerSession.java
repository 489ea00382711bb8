package com.autotrader.backend.broker;

import com.autotrader.backend.model.Candle;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Wire-level brokerage client. Calls block the calling thread and are only ever issued from the
 * bridge's own thread, so implementations need not be thread-safe.
 */
public interface BrokerSession {

    void connect(String host, int port, int clientId, int timeoutSeconds);

    boolean isConnected();

    void disconnect();

    void requestMarketDataType(int marketDataType);

    List<String> managedAccounts();

    /**
     * Starts streaming account values and portfolio updates for the account.
     */
    CompletableFuture<Void> subscribeAccountUpdates(String account);

    List<AccountValue> accountValues();

    List<PortfolioItem> portfolio();

    List<PositionEntry> positions();

    /**
     * Requests every open order for the account, including ones placed by other clients.
     */
    List<OpenTrade> requestAllOpenTrades();

    List<Contract> qualifyContracts(Contract contract);

    List<ContractDetails> contractDetails(Contract contract);

    List<Candle> historicalBars(Contract contract, String duration, String barSize, boolean useRth);

    Quote snapshotQuote(Contract contract);

    List<Headline> historicalNews(Contract contract, Instant since, int limit);

    List<ScanResult> scanner(ScanRequest request);

    int nextOrderId();

    OpenTrade placeOrder(Contract contract, BrokerOrder order);

    void cancelOrder(BrokerOrder order);
}
