package com.autotrader.backend.trading.review;

/**
 * A ranked candidate from the last research cycle, offered to position reviews as a rotation target.
 */
public record TopCandidate(String symbol, Double score, String rationale, Double sentiment) {
}
