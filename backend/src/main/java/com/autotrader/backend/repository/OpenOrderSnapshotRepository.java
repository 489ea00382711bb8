package com.autotrader.backend.repository;

import com.autotrader.backend.model.OpenOrderSnapshot;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface OpenOrderSnapshotRepository extends JpaRepository<OpenOrderSnapshot, Long> {

    Optional<OpenOrderSnapshot> findTopByOrderByIdDesc();

    List<OpenOrderSnapshot> findByCreatedAtOrderByIdAsc(Instant createdAt);
}
