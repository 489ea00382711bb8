package com.autotrader.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "research_log")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResearchLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(nullable = false, length = 64)
    private String symbol;

    @Column(length = 32)
    private String exchange;

    @Column(length = 8)
    private String currency;

    private Double price;

    private Double rsi;

    @Column(name = "volatility_ratio")
    private Double volatilityRatio;

    @Column(name = "sentiment_score")
    private Double sentimentScore;

    @Column(name = "ai_reasoning", length = 20000)
    private String aiReasoning;

    private Double score;

    @Column(name = "candidate_rank")
    private Integer rank;

    @Column(nullable = false, length = 32)
    private String decision;

    @Column(length = 2000)
    private String reason;
}
