package com.autotrader.backend.repository;

import com.autotrader.backend.model.Trade;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface TradeRepository extends JpaRepository<Trade, Long> {

    List<Trade> findAllByOrderByIdDesc(Pageable pageable);
}
