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
@Table(name = "positions_snapshot")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PositionSnapshot {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(length = 64)
    private String account;

    @Column(nullable = false, length = 64)
    private String symbol;

    @Column(length = 32)
    private String exchange;

    @Column(length = 8)
    private String currency;

    private Double quantity;

    @Column(name = "avg_cost")
    private Double avgCost;

    @Column(name = "market_price")
    private Double marketPrice;

    @Column(name = "market_value")
    private Double marketValue;

    @Column(name = "unrealised_pnl")
    private Double unrealisedPnl;

    @Column(name = "realised_pnl")
    private Double realisedPnl;
}
