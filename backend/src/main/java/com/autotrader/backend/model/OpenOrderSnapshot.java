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
@Table(name = "open_orders_snapshot")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OpenOrderSnapshot {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "order_id")
    private Long orderId;

    @Column(nullable = false, length = 64)
    private String symbol;

    @Column(length = 32)
    private String exchange;

    @Column(length = 8)
    private String currency;

    @Column(length = 8)
    private String action;

    @Column(name = "order_type", length = 16)
    private String orderType;

    @Column(name = "total_qty")
    private Double totalQty;

    private Double filled;

    private Double remaining;

    @Column(length = 32)
    private String status;

    @Column(name = "lmt_price")
    private Double lmtPrice;

    @Column(name = "aux_price")
    private Double auxPrice;
}
