package com.autotrader.backend.trading;

import com.autotrader.backend.broker.Contract;
import com.autotrader.backend.service.decision.ShortlistDecision;
import lombok.Getter;
import lombok.Setter;

/**
 * A shortlisted candidate that passed the hard gates. The rank is assigned after every candidate of
 * the cycle has been researched.
 */
@Getter
public class EligibleCandidate {

    private final Candidate candidate;
    private final Contract contract;
    private final double price;
    private final Double atr;
    private final ShortlistDecision shortlist;
    private final String reason;
    private final Long researchLogId;
    @Setter
    private Integer rank;

    public EligibleCandidate(Candidate candidate, Contract contract, double price, Double atr,
                             ShortlistDecision shortlist, String reason, Long researchLogId) {
        this.candidate = candidate;
        this.contract = contract;
        this.price = price;
        this.atr = atr;
        this.shortlist = shortlist;
        this.reason = reason;
        this.researchLogId = researchLogId;
    }

    public String symbol() {
        return candidate.symbol();
    }

    public String currency() {
        return candidate.currency();
    }

    public Double score() {
        return shortlist == null ? null : shortlist.score();
    }

    public Double sentiment() {
        return shortlist == null ? null : shortlist.sentiment();
    }
}
