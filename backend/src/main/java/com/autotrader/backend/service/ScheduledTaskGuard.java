package com.autotrader.backend.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
@RequiredArgsConstructor
public class ScheduledTaskGuard {

    private final EventStreamService eventStreamService;

    public boolean run(String taskName, Runnable task) {
        try {
            task.run();
            return true;
        } catch (Throwable t) {
            log.error("Scheduled task failed task={}", taskName, t);
            eventStreamService.error("System", taskName,
                    "Scheduled task failed: " + t.getClass().getSimpleName() + ": " + t.getMessage());
            return false;
        }
    }
}
