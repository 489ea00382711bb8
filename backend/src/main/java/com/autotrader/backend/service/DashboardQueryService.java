package com.autotrader.backend.service;

import com.autotrader.backend.model.AccountSummarySnapshot;
import com.autotrader.backend.model.EventLog;
import com.autotrader.backend.model.LiveStatus;
import com.autotrader.backend.model.OpenOrderSnapshot;
import com.autotrader.backend.model.OrderReview;
import com.autotrader.backend.model.PerformanceSnapshot;
import com.autotrader.backend.model.PositionReview;
import com.autotrader.backend.model.PositionSnapshot;
import com.autotrader.backend.model.ResearchLog;
import com.autotrader.backend.model.Trade;
import com.autotrader.backend.repository.AccountSummarySnapshotRepository;
import com.autotrader.backend.repository.EventLogRepository;
import com.autotrader.backend.repository.LiveStatusRepository;
import com.autotrader.backend.repository.OpenOrderSnapshotRepository;
import com.autotrader.backend.repository.OrderReviewRepository;
import com.autotrader.backend.repository.PerformanceSnapshotRepository;
import com.autotrader.backend.repository.PositionReviewRepository;
import com.autotrader.backend.repository.PositionSnapshotRepository;
import com.autotrader.backend.repository.ResearchLogRepository;
import com.autotrader.backend.repository.TradeRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Dashboard reads. Each query runs on the persistence executor with a short bound so a slow database
 * never hangs the API; a failed read returns an empty result.
 */
@Slf4j
@Service
public class DashboardQueryService {

    static final long READ_TIMEOUT_SECONDS = 3;
    static final int MAX_LIMIT = 1000;

    private final ThreadPoolTaskExecutor persistenceExecutor;
    private final EventLogRepository eventLogRepository;
    private final LiveStatusRepository liveStatusRepository;
    private final ResearchLogRepository researchLogRepository;
    private final TradeRepository tradeRepository;
    private final PositionReviewRepository positionReviewRepository;
    private final OrderReviewRepository orderReviewRepository;
    private final PerformanceSnapshotRepository performanceRepository;
    private final AccountSummarySnapshotRepository accountSummaryRepository;
    private final PositionSnapshotRepository positionSnapshotRepository;
    private final OpenOrderSnapshotRepository openOrderSnapshotRepository;

    public DashboardQueryService(@Qualifier("persistenceExecutor") ThreadPoolTaskExecutor persistenceExecutor,
                                 EventLogRepository eventLogRepository,
                                 LiveStatusRepository liveStatusRepository,
                                 ResearchLogRepository researchLogRepository,
                                 TradeRepository tradeRepository,
                                 PositionReviewRepository positionReviewRepository,
                                 OrderReviewRepository orderReviewRepository,
                                 PerformanceSnapshotRepository performanceRepository,
                                 AccountSummarySnapshotRepository accountSummaryRepository,
                                 PositionSnapshotRepository positionSnapshotRepository,
                                 OpenOrderSnapshotRepository openOrderSnapshotRepository) {
        this.persistenceExecutor = persistenceExecutor;
        this.eventLogRepository = eventLogRepository;
        this.liveStatusRepository = liveStatusRepository;
        this.researchLogRepository = researchLogRepository;
        this.tradeRepository = tradeRepository;
        this.positionReviewRepository = positionReviewRepository;
        this.orderReviewRepository = orderReviewRepository;
        this.performanceRepository = performanceRepository;
        this.accountSummaryRepository = accountSummaryRepository;
        this.positionSnapshotRepository = positionSnapshotRepository;
        this.openOrderSnapshotRepository = openOrderSnapshotRepository;
    }

    public LiveStatus liveStatus() {
        LiveStatus idle = LiveStatus.builder()
                .id(LiveStatus.SINGLETON_ID)
                .currentSymbol("Idle")
                .currentStep("Waiting for cycle")
                .lastUpdate(Instant.now())
                .build();
        return read("live status", () -> liveStatusRepository.findById(LiveStatus.SINGLETON_ID).orElse(idle), idle);
    }

    public List<EventLog> events(int limit) {
        return read("events", () -> eventLogRepository.findAllByOrderByIdDesc(page(limit)), List.of());
    }

    public List<EventLog> eventsAfter(long afterId) {
        return read("events after " + afterId, () -> eventLogRepository.findTop500ByIdGreaterThanOrderByIdAsc(afterId), List.of());
    }

    public long latestEventId() {
        return read("latest event id",
                () -> eventLogRepository.findTopByOrderByIdDesc().map(EventLog::getId).orElse(0L), 0L);
    }

    public List<ResearchLog> research(int limit) {
        return read("research", () -> researchLogRepository.findAllByOrderByIdDesc(page(limit)), List.of());
    }

    public List<Trade> trades(int limit) {
        return read("trades", () -> tradeRepository.findAllByOrderByIdDesc(page(limit)), List.of());
    }

    public List<PositionReview> positionReviews(int limit) {
        return read("position reviews", () -> positionReviewRepository.findAllByOrderByIdDesc(page(limit)), List.of());
    }

    public List<OrderReview> orderReviews(int limit) {
        return read("order reviews", () -> orderReviewRepository.findAllByOrderByIdDesc(page(limit)), List.of());
    }

    public List<PerformanceSnapshot> performance(int limit) {
        return read("performance", () -> performanceRepository.findAllByOrderByIdDesc(page(limit)), List.of());
    }

    public List<AccountSummarySnapshot> latestAccountSummary() {
        return read("account summary", () -> accountSummaryRepository.findTopByOrderByIdDesc()
                .map(latest -> accountSummaryRepository.findByCreatedAtOrderByIdAsc(latest.getCreatedAt()))
                .orElse(List.of()), List.of());
    }

    public List<PositionSnapshot> latestPositions() {
        return read("positions snapshot", () -> positionSnapshotRepository.findTopByOrderByIdDesc()
                .map(latest -> positionSnapshotRepository.findByCreatedAtOrderByIdAsc(latest.getCreatedAt()))
                .orElse(List.of()), List.of());
    }

    public List<OpenOrderSnapshot> latestOpenOrders() {
        return read("open orders snapshot", () -> openOrderSnapshotRepository.findTopByOrderByIdDesc()
                .map(latest -> openOrderSnapshotRepository.findByCreatedAtOrderByIdAsc(latest.getCreatedAt()))
                .orElse(List.of()), List.of());
    }

    private static PageRequest page(int limit) {
        return PageRequest.of(0, Math.max(1, Math.min(limit, MAX_LIMIT)));
    }

    private <T> T read(String name, Supplier<T> query, T fallback) {
        CompletableFuture<T> future = CompletableFuture.supplyAsync(query, persistenceExecutor);
        try {
            return future.get(READ_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Dashboard read '{}' timed out after {}s", name, READ_TIMEOUT_SECONDS);
        } catch (ExecutionException e) {
            log.warn("Dashboard read '{}' failed: {}", name, e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Dashboard read '{}' interrupted", name);
        }
        return fallback;
    }
}
