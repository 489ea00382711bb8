package com.autotrader.backend.service;

import com.autotrader.backend.broker.BrokerBridgeService;
import com.autotrader.backend.broker.Contract;
import com.autotrader.backend.broker.ScanRequest;
import com.autotrader.backend.broker.ScanResult;
import com.autotrader.backend.config.TraderProperties;
import com.autotrader.backend.trading.Candidate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builds the cycle universe: manual include symbols first, then broker scanner results per enabled
 * market, minus exclusions and microcap listings, de-duplicated and capped.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MarketScreenerService {

    public static final Set<String> EXCLUDED_TRADING_CLASSES = Set.of("SCM");
    public static final String US = "US";
    public static final String UK = "UK";

    private static final Map<String, String> SCAN_CODE_LABELS = Map.of(
            "MOST_ACTIVE", "Most Active",
            "TOP_PERC_GAIN", "Top Gainers",
            "HOT_BY_VOLUME", "High Volume",
            "HIGH_VS_13W_HI", "Near 13-Week High");
    private static final Duration SCAN_TIMEOUT = Duration.ofSeconds(20);
    private static final int SCAN_ROWS = 50;

    private final BrokerBridgeService bridge;

    public List<Candidate> screen(TraderProperties config) {
        TraderProperties.Trading trading = config.getTrading();
        TraderProperties.Screener screener = trading.getScreener();
        List<String> markets = markets(trading);
        if (markets.isEmpty()) {
            log.error("No markets configured (trading.markets is empty); skipping scanner cycle.");
            return List.of();
        }
        Set<String> excluded = excludedSymbols(screener);
        List<Candidate> candidates = new ArrayList<>(manualCandidates(screener, markets, excluded));

        for (String market : markets) {
            for (String scanCode : screener.getScanCodes()) {
                String code = scanCode.trim().toUpperCase(Locale.ROOT);
                candidates.addAll(scan(market, code, trading, excluded));
            }
        }

        List<Candidate> unique = dedupe(candidates);
        int cap = screener.getMaxCandidates() > 0 ? screener.getMaxCandidates() : 250;
        log.info("Screening found {} unique candidates across all scans", unique.size());
        return unique.size() <= cap ? unique : new ArrayList<>(unique.subList(0, cap));
    }

    public static List<String> markets(TraderProperties.Trading trading) {
        List<String> out = new ArrayList<>();
        for (String m : trading.getMarkets()) {
            if (m != null && !m.isBlank()) {
                out.add(m.trim().toUpperCase(Locale.ROOT));
            }
        }
        return out;
    }

    /**
     * Upper-cased exclusions; an entry like {@code "ABC,US"} excludes {@code ABC}.
     */
    public static Set<String> excludedSymbols(TraderProperties.Screener screener) {
        Set<String> out = new HashSet<>();
        for (String raw : screener.getExcludeSymbols()) {
            if (raw != null && !raw.isBlank()) {
                out.add(raw.trim().toUpperCase(Locale.ROOT).split(",", 2)[0].trim());
            }
        }
        return out;
    }

    public static List<Candidate> dedupe(List<Candidate> candidates) {
        Map<String, Candidate> bySymbol = new LinkedHashMap<>();
        for (Candidate c : candidates) {
            String key = c.symbol() == null ? "" : c.symbol().trim().toUpperCase(Locale.ROOT);
            if (!key.isEmpty()) {
                bySymbol.putIfAbsent(key, c);
            }
        }
        return new ArrayList<>(bySymbol.values());
    }

    List<Candidate> manualCandidates(TraderProperties.Screener screener, List<String> markets, Set<String> excluded) {
        List<Candidate> out = new ArrayList<>();
        for (String entry : screener.getIncludeSymbols()) {
            if (entry == null || entry.isBlank()) {
                continue;
            }
            String symbol;
            String market;
            if (entry.contains(",")) {
                String[] parts = entry.split(",", 2);
                symbol = parts[0].trim().toUpperCase(Locale.ROOT);
                market = parts[1].trim().toUpperCase(Locale.ROOT);
                if (symbol.isEmpty() || !(US.equals(market) || UK.equals(market))) {
                    continue;
                }
            } else {
                symbol = entry.trim().toUpperCase(Locale.ROOT);
                market = markets.size() == 1 ? markets.get(0) : (markets.contains(US) ? US : markets.get(0));
            }
            if (excluded.contains(symbol)) {
                continue;
            }
            if (!markets.contains(market)) {
                log.warn("include_symbols entry '{}' ignored (market {} not enabled)", entry, market);
                continue;
            }
            out.add(US.equals(market) ? Candidate.us(symbol, "Manual", "") : Candidate.uk(symbol, "Manual", ""));
        }
        return out;
    }

    private List<Candidate> scan(String market, String scanCode, TraderProperties.Trading trading, Set<String> excluded) {
        String label = SCAN_CODE_LABELS.getOrDefault(scanCode, scanCode);
        String location = US.equals(market) ? "STK.US.MAJOR" : "STK.LSE";
        ScanRequest request = new ScanRequest("STK", location, scanCode,
                trading.getMinSharePrice(), trading.getMaxSharePrice(), trading.getMinAvgVolume(), SCAN_ROWS);
        List<ScanResult> results;
        try {
            results = bridge.await(bridge.runScanner(request, SCAN_TIMEOUT));
        } catch (RuntimeException e) {
            log.warn("{} scan {} failed: {}", market, scanCode, e.getMessage());
            return List.of();
        }
        List<Candidate> out = new ArrayList<>();
        for (ScanResult result : results) {
            Contract contract = result.contract();
            if (contract == null || contract.symbol() == null) {
                continue;
            }
            String symbol = contract.symbol().toUpperCase(Locale.ROOT);
            String tradingClass = contract.tradingClass() == null ? "" : contract.tradingClass();
            if (excluded.contains(symbol)) {
                continue;
            }
            if (trading.isExcludeMicrocap() && EXCLUDED_TRADING_CLASSES.contains(tradingClass)) {
                log.debug("Skipping {} (trading class {})", symbol, tradingClass);
                continue;
            }
            out.add(US.equals(market) ? Candidate.us(symbol, label, tradingClass) : Candidate.uk(symbol, label, tradingClass));
        }
        return out;
    }
}
