package com.autotrader.backend.service.decision;

import java.util.List;

public record ShortlistDecision(String decision,
                                double confidence,
                                double score,
                                double sentiment,
                                String rationale,
                                List<String> keyFactors,
                                List<String> keyRisks) {

    public static final String SHORTLIST = "SHORTLIST";
    public static final String SKIP = "SKIP";

    public boolean isShortlisted() {
        return SHORTLIST.equals(decision);
    }
}
