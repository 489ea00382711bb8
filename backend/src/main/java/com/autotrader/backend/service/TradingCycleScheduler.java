package com.autotrader.backend.service;

import com.autotrader.backend.trading.TradingCycleOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Drives the trading loop. A short tick checks whether the next cycle is due; each cycle decides its
 * own follow-up delay. A failed cycle is recorded and retried after the cycle interval.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "trader.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class TradingCycleScheduler {

    private final TradingCycleOrchestrator orchestrator;
    private final ScheduledTaskGuard guard;

    private volatile Instant nextRunAt = Instant.EPOCH;

    @Scheduled(fixedDelayString = "${trader.scheduler.tick-millis:1000}")
    public void tick() {
        Instant now = Instant.now();
        if (now.isBefore(nextRunAt)) {
            return;
        }
        boolean completed = guard.run("TradingCycle", () -> {
            Duration delay = orchestrator.runCycle();
            nextRunAt = Instant.now().plus(delay);
        });
        if (!completed) {
            nextRunAt = Instant.now().plus(orchestrator.failureDelay());
        }
    }

    public Instant nextRunAt() {
        return nextRunAt;
    }
}
