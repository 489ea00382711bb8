package com.autotrader.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Singleton row (id 1) describing what the loop is doing right now.
 */
@Entity
@Table(name = "live_status")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LiveStatus {

    public static final long SINGLETON_ID = 1L;

    @Id
    private Long id;

    @Column(name = "current_symbol", length = 64)
    private String currentSymbol;

    @Column(name = "current_step", length = 512)
    private String currentStep;

    @Column(name = "last_update", nullable = false)
    private Instant lastUpdate;
}
