package com.autotrader.backend.service.decision;

import com.autotrader.backend.config.TraderProperties;

/**
 * Built-in system prompts. Each describes the JSON contract its validator enforces; a non-blank
 * {@code ai.*_system_prompt} in the effective config replaces the built-in text.
 */
final class DecisionPrompts {

    static final String SHORTLIST = String.join("\n",
            "You evaluate one US/UK equity as an intraday long entry candidate.",
            "You receive price, technical indicators, bar momentum, quote data, market context and news headlines.",
            "Some fields may be null; judge with what is available.",
            "SHORTLIST a stock when the setup has a clear edge worth comparing against other candidates; otherwise SKIP.",
            "Return ONLY valid JSON with:",
            "  decision: SHORTLIST | SKIP",
            "  confidence: 0.0..1.0",
            "  score: 0.0..1.0 (attractiveness right now, used for ranking)",
            "  sentiment: -1.0..1.0",
            "  rationale: string (<= 180 chars)",
            "  key_factors: array of strings (<= 6)",
            "  key_risks: array of strings (<= 6)");

    static final String BUY_SELECTION = String.join("\n",
            "You select which shortlisted stocks to BUY this cycle, in priority order.",
            "Pick at most max_new symbols from the candidates; fewer or none is allowed.",
            "Prefer liquid setups with manageable risk and consider the remaining cash budgets.",
            "Return ONLY valid JSON with:",
            "  selected_symbols: array of strings (0..max_new, priority order)",
            "  rationale: string (<= 250 chars)");

    static final String POSITION_REVIEW = String.join("\n",
            "You manage an open intraday long position.",
            "You receive entry and current price, P&L, peak P&L and drawdown, current stop-loss and take-profit,",
            "indicators, momentum, market context, headlines and alternative candidates.",
            "Options: HOLD, SELL (exit at market), ADJUST_STOP (new_stop_loss below current price),",
            "ADJUST_TP (new_take_profit above current price).",
            "Return ONLY valid JSON with:",
            "  action: HOLD | SELL | ADJUST_STOP | ADJUST_TP",
            "  new_stop_loss: number or null",
            "  new_take_profit: number or null",
            "  confidence: 0.0..1.0",
            "  urgency: 0.0..1.0",
            "  rationale: string (<= 200 chars)",
            "  key_factors: array of strings (<= 5)");

    static final String ORDER_REVIEW = String.join("\n",
            "You review one unfilled standalone order against the current market.",
            "Options: KEEP, CANCEL, ADJUST_PRICE (limit price for LMT, trigger price for STP).",
            "Return ONLY valid JSON with:",
            "  action: KEEP | CANCEL | ADJUST_PRICE",
            "  new_price: number or null",
            "  confidence: 0.0..1.0",
            "  rationale: string (<= 200 chars)");

    private DecisionPrompts() {
    }

    static String shortlist(TraderProperties.Ai ai) {
        return pick(ai.getShortlistSystemPrompt(), SHORTLIST);
    }

    static String buySelection(TraderProperties.Ai ai) {
        return pick(ai.getBuySelectionSystemPrompt(), BUY_SELECTION);
    }

    static String positionReview(TraderProperties.Ai ai) {
        return pick(ai.getPositionReviewSystemPrompt(), POSITION_REVIEW);
    }

    static String orderReview(TraderProperties.Ai ai) {
        return pick(ai.getOrderReviewSystemPrompt(), ORDER_REVIEW);
    }

    private static String pick(String override, String fallback) {
        return override == null || override.isBlank() ? fallback : override.trim();
    }
}
