package com.autotrader.backend.repository;

import com.autotrader.backend.model.EventLog;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface EventLogRepository extends JpaRepository<EventLog, Long> {

    List<EventLog> findAllByOrderByIdDesc(Pageable pageable);

    List<EventLog> findTop500ByIdGreaterThanOrderByIdAsc(Long afterId);

    Optional<EventLog> findTopByOrderByIdDesc();
}
