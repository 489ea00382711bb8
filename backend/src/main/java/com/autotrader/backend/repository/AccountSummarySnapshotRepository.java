package com.autotrader.backend.repository;

import com.autotrader.backend.model.AccountSummarySnapshot;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface AccountSummarySnapshotRepository extends JpaRepository<AccountSummarySnapshot, Long> {

    Optional<AccountSummarySnapshot> findTopByOrderByIdDesc();

    List<AccountSummarySnapshot> findByCreatedAtOrderByIdAsc(Instant createdAt);
}
