package com.autotrader.backend.service;

import com.autotrader.backend.broker.BrokerBridgeService;
import com.autotrader.backend.broker.Contract;
import com.autotrader.backend.config.TraderProperties;
import com.autotrader.backend.trading.Candidate;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls {@code $TICKER} mentions from public subreddit listings. Posts are fetched at most once per
 * hour and kept in memory between cycles.
 */
@Slf4j
@Service
public class RedditTickerSource {

    static final Pattern TICKER = Pattern.compile("\\$([A-Z]{1,5})\\b");
    private static final Duration FETCH_INTERVAL = Duration.ofHours(1);
    private static final String USER_AGENT = "AutoTrader/1.0";

    private final RestTemplate redditRestTemplate;
    private final BrokerBridgeService bridge;

    private volatile List<String> cachedTexts = List.of();
    private volatile Instant lastFetch = Instant.EPOCH;

    public RedditTickerSource(@Qualifier("redditRestTemplate") RestTemplate redditRestTemplate,
                              BrokerBridgeService bridge) {
        this.redditRestTemplate = redditRestTemplate;
        this.bridge = bridge;
    }

    /**
     * Qualified candidates for the most-mentioned tickers, skipping ones already in the universe or excluded.
     */
    public List<Candidate> candidates(TraderProperties config, Set<String> existing, Set<String> excluded) {
        refreshIfDue(config.getReddit());
        List<String> markets = MarketScreenerService.markets(config.getTrading());
        boolean excludeMicrocap = config.getTrading().isExcludeMicrocap();
        int max = Math.max(1, config.getReddit().getMaxSymbols());

        List<Candidate> out = new ArrayList<>();
        for (String symbol : rankMentions(cachedTexts).keySet()) {
            if (existing.contains(symbol) || excluded.contains(symbol)) {
                continue;
            }
            Optional<Candidate> candidate = Optional.empty();
            if (markets.contains(MarketScreenerService.US)) {
                candidate = qualify(Contract.stock(symbol, Candidate.US_EXCHANGE, "USD"), excludeMicrocap)
                        .map(tc -> Candidate.us(symbol, "Reddit", tc));
            }
            if (candidate.isEmpty() && markets.contains(MarketScreenerService.UK)) {
                candidate = qualify(Contract.stock(symbol, Candidate.UK_EXCHANGE, "GBP"), excludeMicrocap)
                        .map(tc -> Candidate.uk(symbol, "Reddit", tc));
            }
            candidate.ifPresent(out::add);
            if (out.size() >= max) {
                break;
            }
        }
        return out;
    }

    /**
     * Mention counts per ticker, most mentioned first.
     */
    static Map<String, Integer> rankMentions(List<String> texts) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String text : texts) {
            Matcher matcher = TICKER.matcher(text.toUpperCase(Locale.ROOT));
            while (matcher.find()) {
                counts.merge(matcher.group(1), 1, Integer::sum);
            }
        }
        Map<String, Integer> ranked = new LinkedHashMap<>();
        counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .forEachOrdered(e -> ranked.put(e.getKey(), e.getValue()));
        return ranked;
    }

    private Optional<String> qualify(Contract contract, boolean excludeMicrocap) {
        try {
            Optional<Contract> qualified = bridge.await(bridge.qualifyContract(contract));
            if (qualified.isEmpty()) {
                return Optional.empty();
            }
            String tradingClass = qualified.get().tradingClass() == null ? "" : qualified.get().tradingClass();
            if (excludeMicrocap && MarketScreenerService.EXCLUDED_TRADING_CLASSES.contains(tradingClass)) {
                return Optional.empty();
            }
            return Optional.of(tradingClass);
        } catch (RuntimeException e) {
            log.debug("Reddit symbol {} not qualified: {}", contract.symbol(), e.getMessage());
            return Optional.empty();
        }
    }

    private void refreshIfDue(TraderProperties.Reddit reddit) {
        Instant now = Instant.now();
        if (Duration.between(lastFetch, now).compareTo(FETCH_INTERVAL) < 0) {
            return;
        }
        // Attempt time is recorded up front so a failing fetch is not retried until the next interval.
        lastFetch = now;
        List<String> texts = new ArrayList<>();
        for (String subreddit : reddit.getSubreddits()) {
            texts.addAll(fetchListing(subreddit, reddit.getPostLimit()));
        }
        cachedTexts = List.copyOf(texts);
        log.info("Reddit cache refreshed: {} posts from {} subreddits", texts.size(), reddit.getSubreddits().size());
    }

    private List<String> fetchListing(String subreddit, int limit) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.USER_AGENT, USER_AGENT);
        String url = "https://www.reddit.com/r/" + subreddit + "/new.json?limit=" + limit;
        JsonNode body = redditRestTemplate.exchange(url, HttpMethod.GET, new HttpEntity<>(headers), JsonNode.class).getBody();
        List<String> out = new ArrayList<>();
        if (body == null) {
            return out;
        }
        for (JsonNode child : body.path("data").path("children")) {
            JsonNode data = child.path("data");
            out.add(data.path("title").asText("") + " " + data.path("selftext").asText(""));
        }
        return out;
    }
}
