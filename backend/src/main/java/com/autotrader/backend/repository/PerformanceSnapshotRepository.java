package com.autotrader.backend.repository;

import com.autotrader.backend.model.PerformanceSnapshot;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface PerformanceSnapshotRepository extends JpaRepository<PerformanceSnapshot, Long> {

    List<PerformanceSnapshot> findAllByOrderByIdDesc(Pageable pageable);
}
