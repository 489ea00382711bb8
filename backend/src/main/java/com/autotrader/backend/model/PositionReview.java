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
@Table(name = "position_reviews")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PositionReview {

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

    @Column(name = "entry_price")
    private Double entryPrice;

    @Column(name = "current_price")
    private Double currentPrice;

    private Integer quantity;

    @Column(name = "unrealised_pnl")
    private Double unrealisedPnl;

    @Column(name = "pnl_pct")
    private Double pnlPct;

    @Column(name = "minutes_held")
    private Integer minutesHeld;

    @Column(name = "current_stop_loss")
    private Double currentStopLoss;

    @Column(name = "current_take_profit")
    private Double currentTakeProfit;

    @Column(nullable = false, length = 32)
    private String action;

    @Column(name = "new_stop_loss")
    private Double newStopLoss;

    @Column(name = "new_take_profit")
    private Double newTakeProfit;

    private Double confidence;

    private Double urgency;

    @Column(length = 4000)
    private String rationale;

    @Column(name = "key_factors", length = 4000)
    private String keyFactors;

    @Column(nullable = false)
    private boolean executed;

    @Column(name = "execution_result", length = 1000)
    private String executionResult;
}
