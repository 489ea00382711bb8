package com.autotrader.backend.service.decision;

import java.util.List;

public record PositionReviewDecision(String action,
                                     Double newStopLoss,
                                     Double newTakeProfit,
                                     double confidence,
                                     double urgency,
                                     String rationale,
                                     List<String> keyFactors) {

    public static final String HOLD = "HOLD";
    public static final String SELL = "SELL";
    public static final String ADJUST_STOP = "ADJUST_STOP";
    public static final String ADJUST_TP = "ADJUST_TP";
}
