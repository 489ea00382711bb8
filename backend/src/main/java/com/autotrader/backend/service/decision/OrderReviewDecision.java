package com.autotrader.backend.service.decision;

public record OrderReviewDecision(String action, Double newPrice, double confidence, String rationale) {

    public static final String KEEP = "KEEP";
    public static final String CANCEL = "CANCEL";
    public static final String ADJUST_PRICE = "ADJUST_PRICE";
}
