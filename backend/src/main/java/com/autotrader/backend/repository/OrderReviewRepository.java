package com.autotrader.backend.repository;

import com.autotrader.backend.model.OrderReview;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface OrderReviewRepository extends JpaRepository<OrderReview, Long> {

    List<OrderReview> findAllByOrderByIdDesc(Pageable pageable);
}
