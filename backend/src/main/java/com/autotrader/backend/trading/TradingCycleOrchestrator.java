package com.autotrader.backend.trading;

import com.autotrader.backend.broker.AccountValue;
import com.autotrader.backend.broker.AccountValues;
import com.autotrader.backend.broker.BrokerBridgeService;
import com.autotrader.backend.broker.OpenTrade;
import com.autotrader.backend.broker.PositionRow;
import com.autotrader.backend.config.TraderProperties;
import com.autotrader.backend.model.OrderReview;
import com.autotrader.backend.model.PositionReview;
import com.autotrader.backend.service.EventStreamService;
import com.autotrader.backend.service.MarketHoursService;
import com.autotrader.backend.service.MarketScreenerService;
import com.autotrader.backend.service.OrderExecutionService;
import com.autotrader.backend.service.RedditTickerSource;
import com.autotrader.backend.service.ResearchLogService;
import com.autotrader.backend.service.SnapshotService;
import com.autotrader.backend.service.TradeRecordService;
import com.autotrader.backend.service.decision.BuySelection;
import com.autotrader.backend.service.decision.DecisionService;
import com.autotrader.backend.service.risk.BudgetAllocator;
import com.autotrader.backend.service.risk.PositionSizingEngine;
import com.autotrader.backend.service.runtime.RuntimeConfigService;
import com.autotrader.backend.trading.review.OrderReviewEngine;
import com.autotrader.backend.trading.review.PositionReviewEngine;
import com.autotrader.backend.trading.review.TopCandidate;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * One trading cycle: config reload, safety net, flattening, reviews, screening, research, ranking,
 * selection and execution. {@link #runCycle()} returns how long to wait before the next cycle.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradingCycleOrchestrator {

    static final int TOP_CANDIDATES_KEPT = 10;
    static final String NOT_SELECTED = "Shortlisted; not selected this cycle";
    static final String PLACEMENT_FAILED = "Selected by AI but order placement failed";

    private final RuntimeConfigService runtimeConfigService;
    private final TraderProperties baseProperties;
    private final BrokerBridgeService bridge;
    private final OrderExecutionService orderExecution;
    private final PositionFlattener flattener;
    private final PositionReviewEngine positionReviewEngine;
    private final OrderReviewEngine orderReviewEngine;
    private final MarketHoursService marketHours;
    private final MarketScreenerService screener;
    private final RedditTickerSource redditTickerSource;
    private final SnapshotService snapshotService;
    private final MarketContextProvider marketContextProvider;
    private final BudgetAllocator budgetAllocator;
    private final CandidateResearchService researchService;
    private final DecisionService decisionService;
    private final PositionSizingEngine sizingEngine;
    private final ResearchLogService researchLogService;
    private final TradeRecordService tradeRecordService;
    private final EventStreamService events;
    private final MeterRegistry meterRegistry;

    private volatile List<TopCandidate> lastTopCandidates = List.of();
    private volatile MarketContext lastMarketContext;
    private volatile Instant lastReviewAt;

    public Duration runCycle() {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            return doRunCycle(Instant.now());
        } finally {
            sample.stop(meterRegistry.timer("trading_cycle_duration"));
        }
    }

    /**
     * Delay to use after a cycle failed outright.
     */
    public Duration failureDelay() {
        try {
            return seconds(runtimeConfigService.effectiveConfig().getIntraday().getCycleIntervalSeconds());
        } catch (RuntimeException e) {
            return seconds(baseProperties.getIntraday().getCycleIntervalSeconds());
        }
    }

    public List<TopCandidate> lastTopCandidates() {
        return lastTopCandidates;
    }

    private Duration doRunCycle(Instant started) {
        TraderProperties config;
        try {
            config = runtimeConfigService.effectiveConfig();
        } catch (RuntimeException e) {
            String msg = "Runtime config unavailable/invalid: " + e.getClass().getSimpleName() + ": " + e.getMessage();
            log.error(msg);
            events.error("Config", "Runtime", msg);
            events.updateLiveStatus("Config", "Runtime config error; trading paused");
            return seconds(baseProperties.getIntraday().getCycleIntervalSeconds());
        }
        TraderProperties.Intraday intraday = config.getIntraday();
        Duration interval = seconds(intraday.getCycleIntervalSeconds());

        if (!bridge.isReady()) {
            events.warn("Broker", "Connection", "Broker not connected; waiting for next cycle");
            events.updateLiveStatus("Broker", "Not connected; waiting for next cycle");
            return interval;
        }

        safetyNet();

        events.info("Cycle", "Start", "Starting analysis cycle");
        if (intraday.isEnabled()) {
            flattener.flattenIfNeeded(intraday.getFlattenMinutesBeforeClose(), Instant.now());
        }

        reviewIfDue(config, Instant.now());

        if (intraday.isEnabled() && !marketHours.anyOpen(MarketScreenerService.markets(config.getTrading()), Instant.now())) {
            int closedSeconds = intraday.getCycleIntervalSecondsClosed();
            String msg = "Market closed; next cycle in ~" + Math.max(1, Math.round(closedSeconds / 60.0)) + " min";
            events.info("Cycle", "MarketClosed", msg);
            events.updateLiveStatus("Idle", msg);
            return seconds(closedSeconds);
        }

        List<Candidate> universe;
        try {
            universe = buildUniverse(config);
        } catch (RuntimeException e) {
            events.error("Screener", "Scan", "Screener failed: " + e.getMessage());
            events.updateLiveStatus("Screener", "Screener failed; waiting for next cycle");
            return interval;
        }
        if (universe.isEmpty()) {
            String msg = "No candidates returned by the screener";
            events.error("Screener", "Scan", msg);
            events.updateLiveStatus("Screener", msg);
            return interval;
        }
        events.info("Screener", "Scan", "Screener returned " + universe.size() + " candidates");

        List<AccountValue> accountValues;
        Set<String> openSymbols;
        try {
            accountValues = bridge.await(bridge.getAccountValues());
            openSymbols = openSymbols(bridge.await(bridge.getPositions()));
        } catch (RuntimeException e) {
            events.error("Broker", "Positions", "Failed to retrieve account state: " + e.getMessage());
            events.updateLiveStatus("Broker", "Failed to retrieve open positions; waiting for next cycle");
            return interval;
        }
        snapshotService.recordAccount(accountValues);
        snapshotService.recordPositionsAndOrders();
        MarketContext marketContext = marketContextProvider.fetch();
        lastMarketContext = marketContext;

        Set<String> currencies = new TreeSet<>();
        universe.forEach(c -> currencies.add(c.currency()));
        Map<String, Double> budgets = new LinkedHashMap<>(
                budgetAllocator.allocate(accountValues, currencies, config.getTrading()));

        List<EligibleCandidate> eligible = researchService.research(universe,
                new ResearchContext(config, marketContext, openSymbols, budgets));

        if (!eligible.isEmpty()) {
            selectAndExecute(config, eligible, openSymbols.size(), budgets,
                    AccountValues.netLiquidation(accountValues).orElse(null), marketContext);
        }
        lastTopCandidates = topCandidates(eligible);

        return pace(Duration.between(started, Instant.now()), interval);
    }

    private void selectAndExecute(TraderProperties config, List<EligibleCandidate> eligible, int openCount,
                                  Map<String, Double> budgets, Double netLiquidation, MarketContext marketContext) {
        events.updateLiveStatus("Selector", "Comparing " + eligible.size() + " shortlisted candidates");
        events.info("Selector", "Rank", "Comparing " + eligible.size() + " shortlisted candidates");
        rank(eligible);
        for (EligibleCandidate candidate : eligible) {
            researchLogService.updateDecision(candidate.getResearchLogId(), ResearchLogService.SHORTLISTED,
                    candidate.getReason(), candidate.getRank());
        }

        TraderProperties.Trading trading = config.getTrading();
        int maxNew = capacity(trading.getMaxPositions(), openCount, trading.getMaxNewPositionsPerCycle());
        if (maxNew <= 0) {
            events.info("Risk", "Limits", "No capacity for new positions (" + openCount + "/" + trading.getMaxPositions() + ")");
            events.updateLiveStatus("Idle", "At position limit; waiting for next cycle");
            return;
        }

        List<String> symbols = eligible.stream().map(EligibleCandidate::symbol).toList();
        BuySelection selection;
        try {
            selection = decisionService.selectBuys(config, selectionPayload(eligible, maxNew, budgets, marketContext),
                    symbols, maxNew);
        } catch (RuntimeException e) {
            String msg = "Buy selection AI failed: " + e.getClass().getSimpleName() + ": " + e.getMessage();
            log.error(msg);
            events.error("Selector", "AI", msg);
            events.updateLiveStatus("Selector", "AI selection error; waiting for next cycle");
            return;
        }
        if (!selection.rationale().isBlank()) {
            events.info("Selector", "AI", "Buy selection: " + selection.rationale());
        }

        Set<String> desired = new HashSet<>(selection.selectedSymbols());
        for (EligibleCandidate candidate : eligible) {
            if (!desired.contains(candidate.symbol())) {
                researchLogService.updateDecision(candidate.getResearchLogId(), ResearchLogService.SHORTLISTED,
                        NOT_SELECTED, candidate.getRank());
            }
        }

        List<String> placed = executeSelected(config, eligible, selection.selectedSymbols(), maxNew, budgets, netLiquidation);
        events.info("Selector", "Result", "Selected " + placed.size() + " trades: "
                + (placed.isEmpty() ? "None" : String.join(", ", placed)));
    }

    /**
     * Places the selected buys strictly in order, decrementing the currency budget after each one.
     * Returns the symbols an order was placed for.
     */
    List<String> executeSelected(TraderProperties config, List<EligibleCandidate> eligible, List<String> selected,
                                 int maxNew, Map<String, Double> budgets, Double netLiquidation) {
        Map<String, EligibleCandidate> bySymbol = new LinkedHashMap<>();
        eligible.forEach(c -> bySymbol.put(c.symbol().toUpperCase(Locale.ROOT), c));

        List<String> placed = new ArrayList<>();
        for (String symbol : new LinkedHashSet<>(selected)) {
            if (placed.size() >= maxNew) {
                break;
            }
            EligibleCandidate candidate = bySymbol.get(symbol.toUpperCase(Locale.ROOT));
            if (candidate == null) {
                continue;
            }
            String currency = candidate.currency();
            double price = candidate.getPrice();
            double remaining = budgets.getOrDefault(currency, 0.0);

            PositionSizingEngine.SizingResult sizing = sizingEngine.size(price, candidate.getAtr(), netLiquidation,
                    remaining, currency, config);
            if (!sizing.accepted()) {
                researchLogService.updateDecision(candidate.getResearchLogId(), ResearchLogService.SHORTLISTED,
                        sizing.rejection(), candidate.getRank());
                continue;
            }
            double cost = sizing.quantity() * price;
            if (cost > remaining) {
                researchLogService.updateDecision(candidate.getResearchLogId(), ResearchLogService.SHORTLISTED,
                        "Selected by AI but insufficient " + currency + " budget for position sizing", candidate.getRank());
                continue;
            }

            events.updateLiveStatus(candidate.symbol(), "Placing order (rank " + candidate.getRank() + ")");
            events.info(candidate.symbol(), "Trade", "AI selected for BUY (rank " + candidate.getRank() + "): "
                    + candidate.getReason());
            OpenTrade trade;
            try {
                trade = orderExecution.executeBuyOrder(candidate.getContract(), sizing.quantity(),
                        sizing.stopLoss(), sizing.takeProfit());
            } catch (RuntimeException e) {
                log.error("Order placement failed for {}", candidate.symbol(), e);
                events.error(candidate.symbol(), "Trade", "Order placement failed: " + e.getMessage());
                trade = null;
            }
            if (trade == null) {
                researchLogService.updateDecision(candidate.getResearchLogId(), ResearchLogService.SHORTLISTED,
                        PLACEMENT_FAILED, candidate.getRank());
                continue;
            }

            String status = trade.status() == null || trade.status().isBlank() ? "Submitted" : trade.status();
            tradeRecordService.record(candidate.symbol(), TradeRecordService.BUY, sizing.quantity(), price,
                    sizing.stopLoss(), sizing.takeProfit(), candidate.sentiment(), status, candidate.getReason());
            budgets.put(currency, Math.max(0.0, remaining - cost));
            placed.add(candidate.symbol());
            researchLogService.updateDecision(candidate.getResearchLogId(), ResearchLogService.TRADE,
                    "Order placed (" + status + ")", candidate.getRank());
        }
        return placed;
    }

    private void safetyNet() {
        try {
            int orphaned = orderExecution.cancelOrphanedSellOrders();
            if (orphaned > 0) {
                events.warn("Safety", "Shorts", "Cancelled " + orphaned + " orphaned SELL order(s)");
            }
            for (OrderExecutionService.ClosedShort closed : orderExecution.closeAllShorts()) {
                events.warn(closed.symbol(), "Shorts", "Closed short position: " + closed.quantity() + " shares");
            }
        } catch (RuntimeException e) {
            events.error("Safety", "Shorts", "Safety check failed: " + e.getMessage());
        }
    }

    private void reviewIfDue(TraderProperties config, Instant now) {
        Duration reviewInterval = seconds(config.getPositionManagement().getReviewIntervalSeconds());
        if (lastReviewAt != null && Duration.between(lastReviewAt, now).compareTo(reviewInterval) < 0) {
            return;
        }
        lastReviewAt = now;
        try {
            long actions = positionReviewEngine.reviewAll(config, lastTopCandidates, lastMarketContext, now).stream()
                    .filter(PositionReview::isExecuted)
                    .count();
            if (actions > 0) {
                events.info("PM", "Summary", "Position Manager: " + actions + " actions executed");
            }
            long orderActions = orderReviewEngine.reviewAll(config, lastMarketContext,
                            config.getPositionManagement().getMinOrderAgeMinutes()).stream()
                    .filter(OrderReview::isExecuted)
                    .count();
            if (orderActions > 0) {
                events.info("OM", "Summary", "Order Manager: " + orderActions + " actions executed");
            }
        } catch (RuntimeException e) {
            log.error("Position/Order management failed", e);
            events.error("PM", "Error", "Position/Order management failed: " + e.getMessage());
        }
    }

    private List<Candidate> buildUniverse(TraderProperties config) {
        events.updateLiveStatus("Screener", "Requesting scanner results");
        List<Candidate> universe = new ArrayList<>(screener.screen(config));
        if (config.getTrading().getScreener().isIncludeRedditSymbols() && config.getReddit().isEnabled()) {
            try {
                Set<String> existing = new HashSet<>();
                universe.forEach(c -> existing.add(c.symbol()));
                List<Candidate> reddit = redditTickerSource.candidates(config, existing,
                        MarketScreenerService.excludedSymbols(config.getTrading().getScreener()));
                if (!reddit.isEmpty()) {
                    events.info("Reddit", "Universe", "Added " + reddit.size() + " Reddit symbols to the universe");
                }
                universe.addAll(reddit);
            } catch (RuntimeException e) {
                events.error("Reddit", "Universe", "Reddit universe augmentation failed: " + e.getMessage());
            }
        }
        return MarketScreenerService.dedupe(universe);
    }

    private Map<String, Object> selectionPayload(List<EligibleCandidate> eligible, int maxNew,
                                                 Map<String, Double> budgets, MarketContext marketContext) {
        List<Map<String, Object>> candidates = new ArrayList<>();
        for (EligibleCandidate c : eligible) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("symbol", c.symbol());
            item.put("exchange", c.getCandidate().exchange());
            item.put("currency", c.currency());
            item.put("price", c.getPrice());
            item.put("rank", c.getRank());
            item.put("score", c.score());
            item.put("ai", c.getShortlist());
            item.put("notes", c.getReason());
            candidates.add(item);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("max_new", maxNew);
        payload.put("budget_remaining", budgets);
        payload.put("candidates", candidates);
        payload.put("market_context", marketContext == null ? null : marketContext.toPayload());
        return payload;
    }

    /**
     * Score descending, candidates without a score last; ranks start at 1.
     */
    static void rank(List<EligibleCandidate> eligible) {
        eligible.sort(Comparator.comparing(EligibleCandidate::score,
                Comparator.nullsLast(Comparator.reverseOrder())));
        for (int i = 0; i < eligible.size(); i++) {
            eligible.get(i).setRank(i + 1);
        }
    }

    static int capacity(int maxPositions, int openCount, int maxNewPerCycle) {
        return Math.max(0, Math.min(maxPositions - openCount, maxNewPerCycle));
    }

    static List<TopCandidate> topCandidates(List<EligibleCandidate> ranked) {
        return ranked.stream()
                .limit(TOP_CANDIDATES_KEPT)
                .map(c -> new TopCandidate(c.symbol(), c.score(), c.getReason(), c.sentiment()))
                .toList();
    }

    private Duration pace(Duration elapsed, Duration interval) {
        double minutes = elapsed.toMillis() / 60_000.0;
        Duration remaining = remainingDelay(elapsed, interval);
        if (remaining.isZero()) {
            long overrun = elapsed.minus(interval).toSeconds();
            String msg = String.format(Locale.ROOT, "Cycle took %.1fmin (overran by %ds); starting next immediately",
                    minutes, overrun);
            log.warn(msg);
            events.warn("Cycle", "Timing", msg);
            events.updateLiveStatus("Cycle", String.format(Locale.ROOT, "Overran (%.1fmin); restarting", minutes));
        } else {
            double remainingMinutes = remaining.toMillis() / 60_000.0;
            String msg = String.format(Locale.ROOT, "Cycle complete in %.1fmin. Next in %.1fmin", minutes, remainingMinutes);
            log.info(msg);
            events.info("Cycle", "Complete", msg);
            events.updateLiveStatus("Idle", String.format(Locale.ROOT, "Next cycle in %.1fmin", remainingMinutes));
        }
        return remaining;
    }

    /**
     * Whatever is left of the interval, or zero when the cycle overran it.
     */
    static Duration remainingDelay(Duration elapsed, Duration interval) {
        return elapsed.compareTo(interval) >= 0 ? Duration.ZERO : interval.minus(elapsed);
    }

    private static Set<String> openSymbols(List<PositionRow> positions) {
        Set<String> symbols = new HashSet<>();
        for (PositionRow row : positions) {
            if (row.quantity() != 0 && row.symbol() != null) {
                symbols.add(row.symbol());
            }
        }
        return symbols;
    }

    private static Duration seconds(int value) {
        return Duration.ofSeconds(Math.max(0, value));
    }
}
