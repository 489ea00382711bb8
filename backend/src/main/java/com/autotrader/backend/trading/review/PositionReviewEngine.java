package com.autotrader.backend.trading.review;

import com.autotrader.backend.broker.BrokerBridgeService;
import com.autotrader.backend.broker.BrokerOrder;
import com.autotrader.backend.broker.Contract;
import com.autotrader.backend.broker.Headline;
import com.autotrader.backend.broker.PortfolioItem;
import com.autotrader.backend.broker.PositionRow;
import com.autotrader.backend.broker.Quote;
import com.autotrader.backend.config.TraderProperties;
import com.autotrader.backend.model.Candle;
import com.autotrader.backend.model.PositionReview;
import com.autotrader.backend.service.EventStreamService;
import com.autotrader.backend.service.OrderExecutionService;
import com.autotrader.backend.service.ReviewLogService;
import com.autotrader.backend.service.TradeRecordService;
import com.autotrader.backend.service.decision.DecisionService;
import com.autotrader.backend.service.decision.PositionReviewDecision;
import com.autotrader.backend.service.indicator.SignalService;
import com.autotrader.backend.trading.MarketContext;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.function.BooleanSupplier;

/**
 * Asks the decision service what to do with each long position and carries out the answer:
 * hold, sell, or move the stop-loss or take-profit.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PositionReviewEngine {

    public static final String ACTION_ERROR = "ERROR";

    static final int MAX_ROTATION_CANDIDATES = 5;
    static final int HEADLINE_LOOKBACK_DAYS = 3;
    static final int HEADLINE_LIMIT = 5;

    private final BrokerBridgeService bridge;
    private final OrderExecutionService orderExecution;
    private final DecisionService decisionService;
    private final SignalService signalService;
    private final PositionMetadataStore metadataStore;
    private final ReviewLogService reviewLogService;
    private final TradeRecordService tradeRecordService;
    private final EventStreamService events;
    private final ObjectMapper objectMapper;

    /**
     * Snapshot of one position at review time.
     */
    record PositionState(Contract contract, int quantity, double entryPrice, double currentPrice,
                         double unrealisedPnl, double pnlPct) {
    }

    public List<PositionReview> reviewAll(TraderProperties config, List<TopCandidate> topCandidates,
                                          MarketContext marketContext, Instant now) {
        List<PositionRow> positions = bridge.await(bridge.getPositions()).stream()
                .filter(p -> p.quantity() > 0)
                .toList();
        // positions closed by a stop, take-profit or flatten fill leave no other trace
        Set<String> held = positions.stream().map(PositionRow::symbol).collect(Collectors.toSet());
        metadataStore.retainOnly(held);
        if (positions.isEmpty()) {
            log.debug("No open positions to review");
            return List.of();
        }
        List<PortfolioItem> portfolio = loadPortfolio();

        events.updateLiveStatus("Position Manager", "Reviewing " + positions.size() + " positions");
        events.info("PM", "Start", "Reviewing " + positions.size() + " open positions");
        Duration interval = Duration.ofSeconds(config.getPositionManagement().getReviewIntervalSeconds());

        List<PositionReview> reviews = new ArrayList<>();
        for (PositionRow position : positions) {
            if (!metadataStore.tryStartReview(position.symbol(), interval, now)) {
                continue;
            }
            try {
                PositionState state = resolveState(position, portfolio);
                if (state == null) {
                    log.warn("Cannot get current price for {}; skipping review", position.symbol());
                    continue;
                }
                reviews.add(review(config, state, topCandidates, marketContext, now));
            } catch (RuntimeException e) {
                log.error("Error reviewing position {}", position.symbol(), e);
                events.error(position.symbol(), "PM", "Position review failed: " + e.getMessage());
            }
        }
        events.updateLiveStatus("Position Manager",
                "Reviewed " + positions.size() + " positions, " + reviews.size() + " decisions");
        return reviews;
    }

    PositionReview review(TraderProperties config, PositionState state, List<TopCandidate> topCandidates,
                          MarketContext marketContext, Instant now) {
        Contract contract = state.contract();
        String symbol = contract.symbol();

        PositionMetadata metadata = metadataStore.getOrCreate(symbol, state.entryPrice(), now);
        metadata.observe(state.pnlPct(), state.currentPrice());
        double drawdown = metadata.drawdownFromPeakPct(state.pnlPct());
        int minutesHeld = metadata.minutesHeld(now);

        OrderExecutionService.OrdersSummary orders = orderExecution.ordersSummary(symbol);
        Double distanceToStop = orders.stopLoss() == null ? null
                : (state.currentPrice() - orders.stopLoss()) / state.currentPrice() * 100.0;
        Double distanceToTp = orders.takeProfit() == null ? null
                : (orders.takeProfit() - state.currentPrice()) / state.currentPrice() * 100.0;

        PositionReview.PositionReviewBuilder record = PositionReview.builder()
                .createdAt(now)
                .symbol(symbol)
                .exchange(contract.exchange())
                .currency(contract.currency())
                .entryPrice(state.entryPrice())
                .currentPrice(state.currentPrice())
                .quantity(state.quantity())
                .unrealisedPnl(state.unrealisedPnl())
                .pnlPct(state.pnlPct())
                .minutesHeld(minutesHeld)
                .currentStopLoss(orders.stopLoss())
                .currentTakeProfit(orders.takeProfit());

        Map<String, Object> positionContext = new LinkedHashMap<>();
        positionContext.put("entry_price", state.entryPrice());
        positionContext.put("current_price", state.currentPrice());
        positionContext.put("quantity", state.quantity());
        positionContext.put("unrealised_pnl", state.unrealisedPnl());
        positionContext.put("pnl_pct", state.pnlPct());
        positionContext.put("peak_pnl_pct", metadata.getPeakPnlPct());
        positionContext.put("peak_price", metadata.getPeakPrice());
        positionContext.put("drawdown_from_peak_pct", drawdown);
        positionContext.put("minutes_held", minutesHeld);
        positionContext.put("adjustment_count", metadata.getAdjustmentCount());

        Map<String, Object> orderContext = new LinkedHashMap<>();
        orderContext.put("current_stop_loss", orders.stopLoss());
        orderContext.put("current_take_profit", orders.takeProfit());
        orderContext.put("distance_to_stop_pct", distanceToStop);
        orderContext.put("distance_to_tp_pct", distanceToTp);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("symbol", symbol);
        payload.put("exchange", contract.exchange());
        payload.put("currency", contract.currency());
        payload.put("position", positionContext);
        payload.put("orders", orderContext);
        putSignals(payload, config, contract);
        payload.put("news_headlines", headlines(contract));
        payload.put("market_context", marketContext == null ? null : marketContext.toPayload());
        if (config.getPositionManagement().isOpportunityRotationEnabled() && topCandidates != null) {
            payload.put("top_candidates", topCandidates.stream().limit(MAX_ROTATION_CANDIDATES).toList());
        }

        events.info(symbol, "PM-AI", String.format(Locale.ROOT, "AI reviewing position (%.1f%%)", state.pnlPct()));
        PositionReviewDecision decision;
        try {
            decision = decisionService.reviewPosition(config, payload);
        } catch (RuntimeException e) {
            String failure = e.getClass().getSimpleName() + ": " + e.getMessage();
            log.error("AI position review failed for {}: {}", symbol, failure);
            events.error(symbol, "PM-AI", "AI review failed: " + failure);
            PositionReview failed = record.action(ACTION_ERROR).rationale(failure).executed(false).build();
            reviewLogService.recordPositionReview(failed);
            return failed;
        }

        record.action(decision.action())
                .newStopLoss(decision.newStopLoss())
                .newTakeProfit(decision.newTakeProfit())
                .confidence(decision.confidence())
                .urgency(decision.urgency())
                .rationale(decision.rationale())
                .keyFactors(toJson(decision.keyFactors()));

        String result = execute(config, state, metadata, decision);
        PositionReview review = record.executed(result != null).executionResult(result).build();
        reviewLogService.recordPositionReview(review);
        return review;
    }

    /**
     * Returns the execution result on confirmed success, null otherwise.
     */
    private String execute(TraderProperties config, PositionState state, PositionMetadata metadata,
                           PositionReviewDecision decision) {
        Contract contract = state.contract();
        String symbol = contract.symbol();
        double confidence = decision.confidence();
        switch (decision.action()) {
            case PositionReviewDecision.HOLD -> {
                events.info(symbol, "PM-Hold", String.format(Locale.ROOT, "AI: HOLD (conf %.2f) - %s",
                        confidence, decision.rationale()));
                return null;
            }
            case PositionReviewDecision.SELL -> {
                return sell(state, decision);
            }
            case PositionReviewDecision.ADJUST_STOP -> {
                Double newStop = decision.newStopLoss();
                if (newStop == null || newStop <= 0 || newStop >= state.currentPrice()) {
                    events.warn(symbol, "PM-Adjust", String.format(Locale.ROOT,
                            "AI: ADJUST_STOP invalid new_stop_loss=%s vs current_price=%.4f", newStop, state.currentPrice()));
                    return null;
                }
                if (adjustmentLimitReached(config, metadata, symbol, decision.action())) {
                    return null;
                }
                events.info(symbol, "PM-Adjust", String.format(Locale.ROOT, "AI: ADJUST_STOP to %.2f (conf %.2f)",
                        newStop, confidence));
                return adjust(() -> orderExecution.upsertStopLoss(contract, newStop, state.quantity()), metadata,
                        symbol, "ADJUST_STOP", String.format(Locale.ROOT, "STOP -> %.2f", newStop));
            }
            case PositionReviewDecision.ADJUST_TP -> {
                Double newTp = decision.newTakeProfit();
                if (newTp == null || newTp <= state.currentPrice()) {
                    events.warn(symbol, "PM-Adjust", String.format(Locale.ROOT,
                            "AI: ADJUST_TP invalid new_take_profit=%s <= current_price=%.4f", newTp, state.currentPrice()));
                    return null;
                }
                if (adjustmentLimitReached(config, metadata, symbol, decision.action())) {
                    return null;
                }
                events.info(symbol, "PM-Adjust", String.format(Locale.ROOT, "AI: ADJUST_TP to %.2f (conf %.2f)",
                        newTp, confidence));
                return adjust(() -> orderExecution.upsertTakeProfit(contract, newTp, state.quantity()), metadata,
                        symbol, "ADJUST_TP", String.format(Locale.ROOT, "TP -> %.2f", newTp));
            }
            default -> {
                log.warn("Unhandled review action {} for {}", decision.action(), symbol);
                return null;
            }
        }
    }

    private String sell(PositionState state, PositionReviewDecision decision) {
        Contract contract = state.contract();
        String symbol = contract.symbol();
        long pending = orderExecution.pendingSellOrders(symbol).stream()
                .filter(o -> BrokerOrder.MARKET.equalsIgnoreCase(o.orderType()))
                .count();
        if (pending > 0) {
            events.warn(symbol, "PM-Skip", "AI: SELL suggested but " + pending + " SELL order(s) already pending");
            return null;
        }
        events.info(symbol, "PM-Sell", String.format(Locale.ROOT, "AI: SELL (conf %.2f) - %s",
                decision.confidence(), decision.rationale()));
        try {
            if (orderExecution.sellPosition(contract, state.quantity()) == null) {
                return null;
            }
        } catch (RuntimeException e) {
            events.error(symbol, "PM-Sell", "SELL failed: " + e.getMessage());
            return null;
        }
        metadataStore.clear(symbol);
        tradeRecordService.record(symbol, TradeRecordService.SELL, state.quantity(), state.currentPrice(), null, null,
                decision.confidence(), TradeRecordService.STATUS_SOLD, decision.rationale());
        events.info(symbol, "PM-Sell", "Executed SELL for " + state.quantity() + " shares");
        return TradeRecordService.STATUS_SOLD;
    }

    private boolean adjustmentLimitReached(TraderProperties config, PositionMetadata metadata, String symbol,
                                           String action) {
        int max = config.getPositionManagement().getMaxAdjustmentsPerPosition();
        if (metadata.getAdjustmentCount() < max) {
            return false;
        }
        events.warn(symbol, "PM-Adjust", "AI: " + action + " refused; adjustment limit reached (" + max + ")");
        return true;
    }

    private String adjust(BooleanSupplier upsert, PositionMetadata metadata, String symbol,
                          String action, String result) {
        try {
            if (!upsert.getAsBoolean()) {
                return null;
            }
        } catch (RuntimeException e) {
            events.error(symbol, "PM-Adjust", action + " failed: " + e.getMessage());
            return null;
        }
        metadata.incrementAdjustments();
        return result;
    }

    /**
     * Price and P&L from the portfolio; otherwise a quote (last, then close) or, failing that, the average cost.
     */
    PositionState resolveState(PositionRow position, List<PortfolioItem> portfolio) {
        String symbol = position.symbol();
        int quantity = (int) position.quantity();
        double avgCost = position.avgCost();
        PortfolioItem item = portfolio.stream()
                .filter(p -> p.contract() != null && Objects.equals(p.contract().symbol(), symbol))
                .findFirst()
                .orElse(null);

        if (item != null && Quote.isUsable(item.marketPrice())) {
            double price = item.marketPrice();
            return new PositionState(item.contract(), quantity, avgCost, price, item.unrealizedPnl(),
                    pnlPct(avgCost, price));
        }

        Contract stock = Contract.stock(symbol, exchangeOrSmart(position.exchange()), position.currency());
        Contract contract = bridge.await(bridge.qualifyContract(stock)).orElse(stock);
        Double price = null;
        try {
            price = bridge.await(bridge.getQuote(contract)).price();
        } catch (RuntimeException e) {
            log.debug("Quote unavailable for {}: {}", symbol, e.getMessage());
        }
        if (price == null && avgCost > 0) {
            price = avgCost;
        }
        if (price == null) {
            return null;
        }
        return new PositionState(contract, quantity, avgCost, price, (price - avgCost) * quantity,
                pnlPct(avgCost, price));
    }

    static double pnlPct(double avgCost, double price) {
        return avgCost > 0 ? (price - avgCost) / avgCost * 100.0 : 0.0;
    }

    private void putSignals(Map<String, Object> payload, TraderProperties config, Contract contract) {
        TraderProperties.Intraday intraday = config.getIntraday();
        try {
            List<Candle> bars = bridge.await(bridge.getHistoricalBars(contract, intraday.getDuration(),
                    intraday.getBarSize(), intraday.isUseRth(),
                    Duration.ofSeconds(config.getTrading().getSymbolTimeoutSeconds())));
            SignalService.SignalBundle signals = signalService.compute(bars);
            Map<String, Object> indicators = new LinkedHashMap<>();
            indicators.put("rsi_14", signals.rsi14());
            indicators.put("atr", signals.atr());
            indicators.put("volatility_ratio", signals.volatilityRatio());
            payload.put("indicators", indicators);
            payload.put("bar_momentum", signals.barMomentum());
        } catch (RuntimeException e) {
            log.debug("Signals unavailable for {}: {}", contract.symbol(), e.getMessage());
        }
    }

    private List<String> headlines(Contract contract) {
        try {
            return bridge.await(bridge.getHeadlines(contract, HEADLINE_LOOKBACK_DAYS, HEADLINE_LIMIT)).stream()
                    .map(Headline::headline)
                    .toList();
        } catch (RuntimeException e) {
            log.debug("Headlines unavailable for {}: {}", contract.symbol(), e.getMessage());
            return List.of();
        }
    }

    private List<PortfolioItem> loadPortfolio() {
        try {
            return bridge.await(bridge.getPortfolio());
        } catch (RuntimeException e) {
            log.warn("Portfolio unavailable for position review: {}", e.getMessage());
            return List.of();
        }
    }

    private String toJson(List<String> values) {
        try {
            return objectMapper.writeValueAsString(values == null ? List.of() : values);
        } catch (JsonProcessingException e) {
            return String.join(", ", values);
        }
    }

    private static String exchangeOrSmart(String exchange) {
        return exchange == null || exchange.isBlank() ? "SMART" : exchange;
    }
}
