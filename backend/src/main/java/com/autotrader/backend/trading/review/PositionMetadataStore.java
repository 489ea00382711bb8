package com.autotrader.backend.trading.review;

import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory position metadata and per-symbol review timestamps. Lost on restart; metadata is then
 * recreated from the average cost on first sight.
 */
@Component
public class PositionMetadataStore {

    private final Map<String, PositionMetadata> metadata = new ConcurrentHashMap<>();
    private final Map<String, Instant> lastReviewed = new ConcurrentHashMap<>();

    public PositionMetadata getOrCreate(String symbol, double entryPrice, Instant now) {
        return metadata.computeIfAbsent(symbol, s -> new PositionMetadata(now, entryPrice));
    }

    public Optional<PositionMetadata> get(String symbol) {
        return Optional.ofNullable(metadata.get(symbol));
    }

    public void clear(String symbol) {
        metadata.remove(symbol);
        lastReviewed.remove(symbol);
    }

    /**
     * Drops metadata and review timestamps for every symbol no longer held.
     */
    public void retainOnly(Set<String> heldSymbols) {
        metadata.keySet().retainAll(heldSymbols);
        lastReviewed.keySet().retainAll(heldSymbols);
    }

    /**
     * Marks the symbol reviewed and returns true when the interval since the last review has elapsed.
     */
    public boolean tryStartReview(String symbol, Duration interval, Instant now) {
        Instant previous = lastReviewed.get(symbol);
        if (previous != null && Duration.between(previous, now).compareTo(interval) < 0) {
            return false;
        }
        lastReviewed.put(symbol, now);
        return true;
    }
}
