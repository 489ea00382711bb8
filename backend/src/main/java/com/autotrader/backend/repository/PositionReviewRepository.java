package com.autotrader.backend.repository;

import com.autotrader.backend.model.PositionReview;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface PositionReviewRepository extends JpaRepository<PositionReview, Long> {

    List<PositionReview> findAllByOrderByIdDesc(Pageable pageable);
}
