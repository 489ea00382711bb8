package com.autotrader.backend.service;

import com.autotrader.backend.broker.AccountValue;
import com.autotrader.backend.broker.AccountValues;
import com.autotrader.backend.broker.BrokerBridgeService;
import com.autotrader.backend.broker.OpenOrderRow;
import com.autotrader.backend.broker.PortfolioItem;
import com.autotrader.backend.broker.PositionRow;
import com.autotrader.backend.model.AccountSummarySnapshot;
import com.autotrader.backend.model.OpenOrderSnapshot;
import com.autotrader.backend.model.PerformanceSnapshot;
import com.autotrader.backend.model.PositionSnapshot;
import com.autotrader.backend.repository.AccountSummarySnapshotRepository;
import com.autotrader.backend.repository.OpenOrderSnapshotRepository;
import com.autotrader.backend.repository.PerformanceSnapshotRepository;
import com.autotrader.backend.repository.PositionSnapshotRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Per-cycle dashboard snapshots. Every method is best effort: failures become ERROR events and the
 * cycle carries on.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SnapshotService {

    static final List<String> PERSISTED_TAGS = List.of(
            "NetLiquidation", "TotalCashValue", "AvailableFunds", "GrossPositionValue", "CashBalance");

    private final BrokerBridgeService bridge;
    private final EventStreamService events;
    private final AccountSummarySnapshotRepository accountSummaryRepository;
    private final PerformanceSnapshotRepository performanceRepository;
    private final PositionSnapshotRepository positionSnapshotRepository;
    private final OpenOrderSnapshotRepository openOrderSnapshotRepository;

    /**
     * Stores the account summary tags and one performance row (equity plus P&L summed over the portfolio).
     */
    public void recordAccount(List<AccountValue> accountValues) {
        try {
            Instant batch = batchTime();
            List<AccountSummarySnapshot> rows = new ArrayList<>();
            for (AccountValue value : accountValues) {
                if (!PERSISTED_TAGS.contains(value.tag())) {
                    continue;
                }
                Optional<Double> parsed = AccountValues.parse(value.value());
                parsed.ifPresent(v -> rows.add(summaryRow(batch, value.tag(), v, value.currency())));
            }
            Double equity = AccountValues.netLiquidation(accountValues)
                    .orElseThrow(() -> new IllegalStateException("NetLiquidation not available in account summary"));

            double unrealised = 0.0;
            double realised = 0.0;
            try {
                for (PortfolioItem item : bridge.await(bridge.getPortfolio())) {
                    unrealised += finiteOrZero(item.unrealizedPnl());
                    realised += finiteOrZero(item.realizedPnl());
                }
            } catch (RuntimeException e) {
                log.warn("Failed to fetch P&L from portfolio: {}", e.getMessage());
            }
            rows.add(summaryRow(batch, "UnrealizedPnL", unrealised, AccountValues.BASE));
            rows.add(summaryRow(batch, "RealizedPnL", realised, AccountValues.BASE));
            accountSummaryRepository.saveAll(rows);
            performanceRepository.save(PerformanceSnapshot.builder()
                    .createdAt(batch)
                    .equity(equity)
                    .unrealizedPnl(unrealised)
                    .realizedPnl(realised)
                    .build());
        } catch (RuntimeException e) {
            events.error("Broker", "Account", "Failed to update account snapshot: " + e.getMessage());
        }
    }

    public void recordPositionsAndOrders() {
        try {
            Instant batch = batchTime();
            List<PositionSnapshot> rows = new ArrayList<>();
            for (PositionRow row : bridge.await(bridge.getPositions())) {
                rows.add(PositionSnapshot.builder()
                        .createdAt(batch)
                        .account(row.account())
                        .symbol(row.symbol())
                        .exchange(row.exchange())
                        .currency(row.currency())
                        .quantity(row.quantity())
                        .avgCost(row.avgCost())
                        .marketPrice(row.marketPrice())
                        .marketValue(row.marketValue())
                        .unrealisedPnl(row.unrealisedPnl())
                        .realisedPnl(row.realisedPnl())
                        .build());
            }
            positionSnapshotRepository.saveAll(rows);
        } catch (RuntimeException e) {
            events.error("Broker", "Snapshot", "Failed to snapshot positions: " + e.getMessage());
        }

        try {
            Instant batch = batchTime();
            List<OpenOrderSnapshot> rows = new ArrayList<>();
            for (OpenOrderRow row : bridge.await(bridge.getOpenOrders())) {
                rows.add(OpenOrderSnapshot.builder()
                        .createdAt(batch)
                        .orderId((long) row.orderId())
                        .symbol(row.symbol() == null ? "" : row.symbol())
                        .exchange(row.exchange())
                        .currency(row.currency())
                        .action(row.action())
                        .orderType(row.orderType())
                        .totalQty(row.totalQty())
                        .filled(row.filled())
                        .remaining(row.remaining())
                        .status(row.status())
                        .lmtPrice(row.lmtPrice())
                        .auxPrice(row.auxPrice())
                        .build());
            }
            openOrderSnapshotRepository.saveAll(rows);
        } catch (RuntimeException e) {
            events.error("Broker", "Snapshot", "Failed to snapshot open orders: " + e.getMessage());
        }
    }

    private static AccountSummarySnapshot summaryRow(Instant batch, String tag, Double value, String currency) {
        return AccountSummarySnapshot.builder()
                .createdAt(batch)
                .tag(tag)
                .value(value)
                .currency(currency)
                .build();
    }

    /**
     * Rows of one snapshot share this timestamp; micro precision survives a database round trip.
     */
    static Instant batchTime() {
        return Instant.now().truncatedTo(ChronoUnit.MICROS);
    }

    private static double finiteOrZero(double value) {
        return Double.isFinite(value) ? value : 0.0;
    }
}
