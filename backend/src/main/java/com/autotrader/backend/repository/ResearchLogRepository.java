package com.autotrader.backend.repository;

import com.autotrader.backend.model.ResearchLog;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ResearchLogRepository extends JpaRepository<ResearchLog, Long> {

    List<ResearchLog> findAllByOrderByIdDesc(Pageable pageable);
}
