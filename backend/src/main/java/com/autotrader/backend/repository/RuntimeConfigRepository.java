package com.autotrader.backend.repository;

import com.autotrader.backend.model.RuntimeConfigRecord;
import org.springframework.data.jpa.repository.JpaRepository;

public interface RuntimeConfigRepository extends JpaRepository<RuntimeConfigRecord, Long> {
}
