package com.autotrader.backend.repository;

import com.autotrader.backend.model.PositionSnapshot;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface PositionSnapshotRepository extends JpaRepository<PositionSnapshot, Long> {

    Optional<PositionSnapshot> findTopByOrderByIdDesc();

    List<PositionSnapshot> findByCreatedAtOrderByIdAsc(Instant createdAt);
}
