package com.autotrader.backend.service;

import com.autotrader.backend.model.OrderReview;
import com.autotrader.backend.model.PositionReview;
import com.autotrader.backend.repository.OrderReviewRepository;
import com.autotrader.backend.repository.PositionReviewRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;

@Slf4j
@Service
@RequiredArgsConstructor
public class ReviewLogService {

    private final PositionReviewRepository positionReviewRepository;
    private final OrderReviewRepository orderReviewRepository;

    public void recordPositionReview(PositionReview review) {
        if (review.getCreatedAt() == null) {
            review.setCreatedAt(Instant.now());
        }
        try {
            positionReviewRepository.save(review);
        } catch (RuntimeException e) {
            log.error("Failed to record position review for {}: {}", review.getSymbol(), e.getMessage());
        }
    }

    public void recordOrderReview(OrderReview review) {
        if (review.getCreatedAt() == null) {
            review.setCreatedAt(Instant.now());
        }
        try {
            orderReviewRepository.save(review);
        } catch (RuntimeException e) {
            log.error("Failed to record order review for {} #{}: {}", review.getSymbol(), review.getOrderId(), e.getMessage());
        }
    }
}
