package com.autotrader.backend.service;

import com.autotrader.backend.model.ResearchLog;
import com.autotrader.backend.repository.ResearchLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Research rows explain each cycle on the dashboard: one row per researched candidate, updated as the
 * candidate moves through ranking and selection.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResearchLogService {

    public static final String REJECTED = "REJECTED";
    public static final String SHORTLISTED = "SHORTLISTED";
    public static final String TRADE = "TRADE";

    private static final int MAX_REASON = 2000;

    private final ResearchLogRepository researchLogRepository;

    @Transactional
    public Long record(ResearchLog entry) {
        if (entry.getCreatedAt() == null) {
            entry.setCreatedAt(Instant.now());
        }
        entry.setReason(truncate(entry.getReason()));
        return researchLogRepository.save(entry).getId();
    }

    @Transactional
    public void updateDecision(Long id, String decision, String reason, Integer rank) {
        if (id == null) {
            return;
        }
        researchLogRepository.findById(id).ifPresentOrElse(row -> {
            row.setDecision(decision);
            row.setReason(truncate(reason));
            row.setRank(rank);
            researchLogRepository.save(row);
        }, () -> log.warn("Research row {} not found for decision update", id));
    }

    private static String truncate(String reason) {
        if (reason == null || reason.length() <= MAX_REASON) {
            return reason;
        }
        return reason.substring(0, MAX_REASON);
    }
}
