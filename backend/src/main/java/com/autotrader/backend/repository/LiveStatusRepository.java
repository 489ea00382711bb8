package com.autotrader.backend.repository;

import com.autotrader.backend.model.LiveStatus;
import org.springframework.data.jpa.repository.JpaRepository;

public interface LiveStatusRepository extends JpaRepository<LiveStatus, Long> {
}
