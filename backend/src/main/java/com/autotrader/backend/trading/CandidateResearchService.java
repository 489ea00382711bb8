package com.autotrader.backend.trading;

import com.autotrader.backend.broker.BrokerBridgeService;
import com.autotrader.backend.broker.Contract;
import com.autotrader.backend.broker.Headline;
import com.autotrader.backend.broker.Quote;
import com.autotrader.backend.config.TraderProperties;
import com.autotrader.backend.exception.BrokerNotConnectedException;
import com.autotrader.backend.exception.BrokerTimeoutException;
import com.autotrader.backend.model.Candle;
import com.autotrader.backend.model.ResearchLog;
import com.autotrader.backend.service.EventStreamService;
import com.autotrader.backend.service.MarketHoursService;
import com.autotrader.backend.service.ResearchLogService;
import com.autotrader.backend.service.decision.DecisionService;
import com.autotrader.backend.service.decision.ShortlistDecision;
import com.autotrader.backend.service.indicator.SignalService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Researches the cycle's universe one candidate at a time. Each candidate runs on the research executor
 * under a hard timeout and always ends in exactly one research row, whatever happened.
 */
@Slf4j
@Service
public class CandidateResearchService {

    static final int HEADLINE_LOOKBACK_DAYS = 7;
    static final int HEADLINE_LIMIT = 10;
    static final String DAILY_DURATION = "3 M";
    static final String DAILY_BAR_SIZE = "1 day";

    private final BrokerBridgeService bridge;
    private final SignalService signalService;
    private final DecisionService decisionService;
    private final MarketHoursService marketHours;
    private final ResearchLogService researchLogService;
    private final EventStreamService events;
    private final ObjectMapper objectMapper;
    private final ThreadPoolTaskExecutor researchExecutor;

    public CandidateResearchService(BrokerBridgeService bridge,
                                    SignalService signalService,
                                    DecisionService decisionService,
                                    MarketHoursService marketHours,
                                    ResearchLogService researchLogService,
                                    EventStreamService events,
                                    ObjectMapper objectMapper,
                                    @Qualifier("researchExecutor") ThreadPoolTaskExecutor researchExecutor) {
        this.bridge = bridge;
        this.signalService = signalService;
        this.decisionService = decisionService;
        this.marketHours = marketHours;
        this.researchLogService = researchLogService;
        this.events = events;
        this.objectMapper = objectMapper;
        this.researchExecutor = researchExecutor;
    }

    /**
     * Outcome of analysing one candidate. {@code eligible} is set only when every gate passed.
     */
    record Analysis(Double price, Double rsi, Double volatilityRatio, Double sentiment, Double score,
                    String aiReasoning, String decision, String reason, Contract contract, Double atr,
                    ShortlistDecision shortlist, boolean eligible) {

        static Analysis rejected(String reason) {
            return new Analysis(null, null, null, null, null, "", ResearchLogService.REJECTED, reason,
                    null, null, null, false);
        }

        Analysis withDecision(String decision, String reason, boolean eligible) {
            return new Analysis(price, rsi, volatilityRatio, sentiment, score, aiReasoning, decision, reason,
                    contract, atr, shortlist, eligible);
        }
    }

    public List<EligibleCandidate> research(List<Candidate> universe, ResearchContext context) {
        List<EligibleCandidate> eligible = new ArrayList<>();
        int timeoutSeconds = context.config().getTrading().getSymbolTimeoutSeconds();
        int total = universe.size();
        for (int i = 0; i < total; i++) {
            Candidate candidate = universe.get(i);
            String progress = "(" + (i + 1) + "/" + total + ")";
            events.updateLiveStatus(candidate.symbol(), "Initiating analysis " + progress);

            Analysis analysis = runBounded(candidate, context, progress, timeoutSeconds);
            Long researchId = researchLogService.record(ResearchLog.builder()
                    .symbol(candidate.symbol())
                    .exchange(candidate.exchange())
                    .currency(candidate.currency())
                    .price(analysis.price())
                    .rsi(analysis.rsi())
                    .volatilityRatio(analysis.volatilityRatio())
                    .sentimentScore(analysis.sentiment())
                    .aiReasoning(analysis.aiReasoning())
                    .score(analysis.score())
                    .decision(analysis.decision())
                    .reason(analysis.reason())
                    .build());
            events.info(candidate.symbol(), "Decision", "Decision: " + analysis.decision() + " (" + analysis.reason() + ")");

            if (analysis.eligible()) {
                eligible.add(new EligibleCandidate(candidate, analysis.contract(), analysis.price(), analysis.atr(),
                        analysis.shortlist(), analysis.reason(), researchId));
            }
        }
        return eligible;
    }

    private Analysis runBounded(Candidate candidate, ResearchContext context, String progress, int timeoutSeconds) {
        Future<Analysis> future = researchExecutor.submit(() -> analyse(candidate, context, progress));
        try {
            return future.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            // the worker is left to finish its broker call
            events.warn(candidate.symbol(), "Timeout", "Symbol timed out after " + timeoutSeconds + "s");
            return Analysis.rejected("Symbol processing timed out after " + timeoutSeconds + "s");
        } catch (ExecutionException e) {
            return Analysis.rejected(describeFailure(candidate.symbol(), e.getCause() == null ? e : e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return Analysis.rejected("Research interrupted");
        }
    }

    private String describeFailure(String symbol, Throwable cause) {
        if (cause instanceof BrokerTimeoutException) {
            events.warn(symbol, "Timeout", "Timeout: " + cause.getMessage());
            return "Timeout during analysis: " + cause.getMessage();
        }
        if (cause instanceof BrokerNotConnectedException) {
            events.error(symbol, "Error", "Connection error: " + cause.getMessage());
            return "Connection error: " + cause.getMessage();
        }
        String description = cause.getClass().getSimpleName() + ": " + cause.getMessage();
        log.error("Research failed for {}", symbol, cause);
        events.error(symbol, "Error", "Unexpected error: " + description);
        return "Error during analysis: " + description;
    }

    Analysis analyse(Candidate candidate, ResearchContext context, String progress) {
        TraderProperties config = context.config();
        TraderProperties.Intraday intraday = config.getIntraday();
        String symbol = candidate.symbol();

        events.updateLiveStatus(symbol, "Fetching market data " + progress);
        events.info(symbol, "Market Data", "Fetching market data");
        Contract contract = bridge.await(bridge.qualifyContract(candidate.contract())).orElse(candidate.contract());
        List<Candle> bars = bridge.await(bridge.getHistoricalBars(contract,
                intraday.isEnabled() ? intraday.getDuration() : DAILY_DURATION,
                intraday.isEnabled() ? intraday.getBarSize() : DAILY_BAR_SIZE,
                intraday.isUseRth(),
                Duration.ofSeconds(config.getTrading().getSymbolTimeoutSeconds())));
        if (bars.isEmpty()) {
            return Analysis.rejected("No market data");
        }

        events.updateLiveStatus(symbol, "Calculating technical indicators " + progress);
        SignalService.SignalBundle signals = signalService.compute(bars);
        Double price = signals.lastClose();

        Quote quote = Quote.empty();
        try {
            quote = bridge.await(bridge.getQuote(contract));
        } catch (RuntimeException e) {
            log.debug("Quote snapshot unavailable for {}: {}", symbol, e.getMessage());
        }

        events.updateLiveStatus(symbol, "Fetching news " + progress);
        List<String> headlines = new ArrayList<>();
        try {
            for (Headline headline : bridge.await(bridge.getHeadlines(contract, HEADLINE_LOOKBACK_DAYS, HEADLINE_LIMIT))) {
                headlines.add(headline.headline());
            }
        } catch (RuntimeException e) {
            events.warn(symbol, "News", "Headlines unavailable: " + e.getMessage());
        }

        List<String> sources = new ArrayList<>();
        if (!headlines.isEmpty()) {
            sources.add("News");
        }
        if (quote.volume() != null) {
            sources.add("Fundamentals");
        }
        sources.add("Technicals");
        String label = "AI (" + String.join("+", sources) + ")";

        events.updateLiveStatus(symbol, "AI shortlist (" + config.getAi().getModel() + ") " + progress);
        events.info(symbol, "AI", "AI shortlist using: " + String.join(", ", sources));
        ShortlistDecision shortlist = decisionService.shortlist(config,
                shortlistPayload(candidate, price, signals, quote, headlines, context));

        String decisionWord = shortlist.isShortlisted() ? ShortlistDecision.SHORTLIST : ShortlistDecision.SKIP;
        String reason = String.format(Locale.ROOT, "%s: %s (conf %.2f) - %s",
                label, decisionWord, shortlist.confidence(), shortlist.rationale());
        Analysis analysis = new Analysis(price, signals.rsi14(), signals.volatilityRatio(), shortlist.sentiment(),
                shortlist.score(), toJson(shortlist), ResearchLogService.REJECTED, reason, contract, signals.atr(),
                shortlist, false);
        if (!shortlist.isShortlisted()) {
            return analysis;
        }
        return applyGates(candidate, analysis, context, Instant.now());
    }

    /**
     * Hard gates in order: market closed, too close to the close, already holding, no budget.
     */
    Analysis applyGates(Candidate candidate, Analysis analysis, ResearchContext context, Instant now) {
        TraderProperties.Intraday intraday = context.config().getIntraday();
        String exchange = candidate.exchange();
        String currency = candidate.currency();
        if (!marketHours.isOpen(exchange, currency, now)) {
            return analysis.withDecision(ResearchLogService.REJECTED, "Market closed: " + analysis.reason(), false);
        }
        if (intraday.isEnabled()
                && marketHours.isNearClose(exchange, currency, intraday.getFlattenMinutesBeforeClose(), now)) {
            return analysis.withDecision(ResearchLogService.REJECTED, "Too close to market close (no new entries)", false);
        }
        if (context.openSymbols().contains(candidate.symbol())) {
            return analysis.withDecision(ResearchLogService.REJECTED, "Already holding a position", false);
        }
        if (context.budgets().getOrDefault(currency, 0.0) <= 0.0) {
            return analysis.withDecision(ResearchLogService.REJECTED, "No available cash budget for " + currency, false);
        }
        if (analysis.price() == null || analysis.price() <= 0) {
            return analysis.withDecision(ResearchLogService.REJECTED, "No usable price", false);
        }
        return analysis.withDecision(ResearchLogService.SHORTLISTED, analysis.reason(), true);
    }

    private Map<String, Object> shortlistPayload(Candidate candidate, Double price, SignalService.SignalBundle signals,
                                                 Quote quote, List<String> headlines, ResearchContext context) {
        TraderProperties.Intraday intraday = context.config().getIntraday();

        Map<String, Object> indicators = new LinkedHashMap<>();
        indicators.put("rsi_14", signals.rsi14());
        indicators.put("atr", signals.atr());
        indicators.put("volatility_ratio", signals.volatilityRatio());
        indicators.put("bb_mid", signals.bollingerMid());

        Map<String, Object> quoteContext = new LinkedHashMap<>();
        quoteContext.put("last", quote.last());
        quoteContext.put("prev_close", quote.close());
        quoteContext.put("bid", quote.bid());
        quoteContext.put("ask", quote.ask());
        quoteContext.put("spread_pct", quote.spreadPct());
        quoteContext.put("volume", quote.volume());

        Map<String, Object> intradayContext = new LinkedHashMap<>();
        intradayContext.put("enabled", intraday.isEnabled());
        intradayContext.put("bar_size", intraday.getBarSize());
        intradayContext.put("duration", intraday.getDuration());
        intradayContext.put("use_rth", intraday.isUseRth());
        intradayContext.put("flatten_minutes_before_close", intraday.getFlattenMinutesBeforeClose());
        intradayContext.put("stop_atr_multiplier", intraday.getStopAtrMultiplier());
        intradayContext.put("take_profit_r", intraday.getTakeProfitR());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("symbol", candidate.symbol());
        payload.put("exchange", candidate.exchange());
        payload.put("currency", candidate.currency());
        payload.put("price", price);
        payload.put("indicators", indicators);
        payload.put("bar_momentum", signals.barMomentum());
        payload.put("fundamentals", quoteContext);
        payload.put("news_headlines", headlines);
        payload.put("intraday", intradayContext);
        payload.put("market_context", context.marketContext() == null ? null : context.marketContext().toPayload());
        return payload;
    }

    private String toJson(ShortlistDecision shortlist) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(shortlist);
        } catch (JsonProcessingException e) {
            log.warn("Cannot serialise shortlist decision: {}", e.getOriginalMessage());
            return "";
        }
    }
}
