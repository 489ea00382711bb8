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
@Table(name = "order_reviews")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderReview {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "order_id")
    private Long orderId;

    @Column(nullable = false, length = 64)
    private String symbol;

    @Column(name = "order_type", length = 16)
    private String orderType;

    @Column(name = "order_action", length = 8)
    private String orderAction;

    @Column(name = "order_quantity")
    private Integer orderQuantity;

    @Column(name = "order_price")
    private Double orderPrice;

    @Column(name = "current_price")
    private Double currentPrice;

    @Column(name = "bid_price")
    private Double bidPrice;

    @Column(name = "ask_price")
    private Double askPrice;

    @Column(name = "price_distance_pct")
    private Double priceDistancePct;

    @Column(name = "order_age_minutes")
    private Integer orderAgeMinutes;

    @Column(nullable = false, length = 32)
    private String action;

    @Column(name = "new_price")
    private Double newPrice;

    private Double confidence;

    @Column(length = 4000)
    private String rationale;

    @Column(nullable = false)
    private boolean executed;
}
