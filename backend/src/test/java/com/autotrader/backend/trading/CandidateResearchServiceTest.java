package com.autotrader.backend.trading;

import com.autotrader.backend.broker.BrokerBridgeService;
import com.autotrader.backend.config.TraderProperties;
import com.autotrader.backend.exception.BrokerNotConnectedException;
import com.autotrader.backend.model.ResearchLog;
import com.autotrader.backend.service.EventStreamService;
import com.autotrader.backend.service.MarketHoursService;
import com.autotrader.backend.service.ResearchLogService;
import com.autotrader.backend.service.decision.DecisionService;
import com.autotrader.backend.service.decision.ShortlistDecision;
import com.autotrader.backend.service.indicator.SignalService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CandidateResearchServiceTest {

    private static final Instant NOW = Instant.parse("2024-01-10T16:00:00Z");

    private final BrokerBridgeService bridge = mock(BrokerBridgeService.class);
    private final MarketHoursService marketHours = mock(MarketHoursService.class);
    private final ResearchLogService researchLogService = mock(ResearchLogService.class);
    private final EventStreamService events = mock(EventStreamService.class);

    private ThreadPoolTaskExecutor executor;
    private CandidateResearchService service;
    private TraderProperties config;
    private Map<String, Double> budgets;

    @BeforeEach
    void setUp() {
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setThreadNamePrefix("research-test-");
        executor.initialize();
        service = new CandidateResearchService(bridge, mock(SignalService.class), mock(DecisionService.class),
                marketHours, researchLogService, events, new ObjectMapper(), executor);
        config = new TraderProperties();
        budgets = new HashMap<>(Map.of("USD", 5_000.0));
        when(marketHours.isOpen(anyString(), anyString(), any())).thenReturn(true);
        when(marketHours.isNearClose(anyString(), anyString(), anyInt(), any())).thenReturn(false);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void allGatesPassedMeansShortlisted() {
        CandidateResearchService.Analysis result = service.applyGates(aapl(), analysis(150.0), context(Set.of()), NOW);

        assertThat(result.eligible()).isTrue();
        assertThat(result.decision()).isEqualTo(ResearchLogService.SHORTLISTED);
        assertThat(result.reason()).isEqualTo("AI: SHORTLIST");
    }

    @Test
    void closedMarketIsCheckedFirst() {
        when(marketHours.isOpen(anyString(), anyString(), any())).thenReturn(false);
        budgets.clear();

        CandidateResearchService.Analysis result = service.applyGates(aapl(), analysis(150.0),
                context(Set.of("AAPL")), NOW);

        assertThat(result.eligible()).isFalse();
        assertThat(result.reason()).isEqualTo("Market closed: AI: SHORTLIST");
    }

    @Test
    void nearCloseBlocksNewEntriesOnlyWhenIntradayIsOn() {
        when(marketHours.isNearClose(anyString(), anyString(), eq(10), any())).thenReturn(true);

        assertThat(service.applyGates(aapl(), analysis(150.0), context(Set.of()), NOW).reason())
                .isEqualTo("Too close to market close (no new entries)");

        config.getIntraday().setEnabled(false);
        assertThat(service.applyGates(aapl(), analysis(150.0), context(Set.of()), NOW).eligible()).isTrue();
    }

    @Test
    void heldSymbolIsRejected() {
        CandidateResearchService.Analysis result = service.applyGates(aapl(), analysis(150.0),
                context(Set.of("AAPL")), NOW);

        assertThat(result.reason()).isEqualTo("Already holding a position");
        assertThat(result.decision()).isEqualTo(ResearchLogService.REJECTED);
    }

    @Test
    void emptyCurrencyBudgetIsRejected() {
        budgets.put("USD", 0.0);

        assertThat(service.applyGates(aapl(), analysis(150.0), context(Set.of()), NOW).reason())
                .isEqualTo("No available cash budget for USD");
        assertThat(service.applyGates(Candidate.uk("VOD", "MOST_ACTIVE", "VOD"), analysis(1.2),
                context(Set.of()), NOW).reason())
                .isEqualTo("No available cash budget for GBP");
    }

    @Test
    void missingPriceIsRejected() {
        CandidateResearchService.Analysis result = service.applyGates(aapl(), analysis(null), context(Set.of()), NOW);

        assertThat(result.eligible()).isFalse();
        assertThat(result.reason()).isEqualTo("No usable price");
    }

    @Test
    void everyCandidateGetsOneResearchRow() {
        when(bridge.await(any())).thenReturn(Optional.empty(), List.of(), Optional.empty(), List.of());

        List<EligibleCandidate> eligible = service.research(
                List.of(aapl(), Candidate.us("MSFT", "TOP_PERC_GAIN", "MSFT")), context(Set.of()));

        assertThat(eligible).isEmpty();
        ArgumentCaptor<ResearchLog> rows = ArgumentCaptor.forClass(ResearchLog.class);
        verify(researchLogService, times(2)).record(rows.capture());
        assertThat(rows.getAllValues()).extracting(ResearchLog::getSymbol).containsExactly("AAPL", "MSFT");
        assertThat(rows.getAllValues()).extracting(ResearchLog::getReason).containsOnly("No market data");
    }

    @Test
    void brokerFailureStillProducesAResearchRow() {
        when(bridge.await(any())).thenThrow(new BrokerNotConnectedException("offline"));

        service.research(List.of(aapl()), context(Set.of()));

        ArgumentCaptor<ResearchLog> row = ArgumentCaptor.forClass(ResearchLog.class);
        verify(researchLogService).record(row.capture());
        assertThat(row.getValue().getDecision()).isEqualTo(ResearchLogService.REJECTED);
        assertThat(row.getValue().getReason()).isEqualTo("Connection error: offline");
    }

    @Test
    void slowSymbolIsCutOffWithoutInterruptingTheWorker() throws InterruptedException {
        config.getTrading().setSymbolTimeoutSeconds(1);
        AtomicBoolean interrupted = new AtomicBoolean();
        CountDownLatch finished = new CountDownLatch(1);
        when(bridge.await(any())).thenAnswer(invocation -> {
            try {
                Thread.sleep(2_500);
            } catch (InterruptedException e) {
                interrupted.set(true);
            } finally {
                finished.countDown();
            }
            throw new BrokerNotConnectedException("late");
        });

        List<EligibleCandidate> eligible = service.research(List.of(aapl()), context(Set.of()));

        assertThat(eligible).isEmpty();
        assertThat(finished.await(10, TimeUnit.SECONDS)).isTrue();
        assertThat(interrupted).isFalse();
        ArgumentCaptor<ResearchLog> row = ArgumentCaptor.forClass(ResearchLog.class);
        verify(researchLogService).record(row.capture());
        assertThat(row.getValue().getReason()).isEqualTo("Symbol processing timed out after 1s");
        verify(events).warn("AAPL", "Timeout", "Symbol timed out after 1s");
    }

    private ResearchContext context(Set<String> openSymbols) {
        return new ResearchContext(config, MarketContext.unavailable(), openSymbols, budgets);
    }

    private static Candidate aapl() {
        return Candidate.us("AAPL", "MOST_ACTIVE", "AAPL");
    }

    private static CandidateResearchService.Analysis analysis(Double price) {
        ShortlistDecision shortlist = new ShortlistDecision(ShortlistDecision.SHORTLIST, 0.7, 0.8, 0.2, "setup",
                List.of(), List.of());
        return new CandidateResearchService.Analysis(price, 55.0, 1.1, 0.2, 0.8, "{}", ResearchLogService.REJECTED,
                "AI: SHORTLIST", null, 2.0, shortlist, false);
    }
}
