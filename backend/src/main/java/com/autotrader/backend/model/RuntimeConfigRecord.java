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

@Entity
@Table(name = "runtime_config")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RuntimeConfigRecord {

    public static final long SINGLETON_ID = 1L;

    @Id
    private Long id;

    @Column(name = "config_json", nullable = false, length = 200000)
    private String configJson;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
