package com.autotrader.backend.service;

import com.autotrader.backend.model.EventLog;
import com.autotrader.backend.model.LiveStatus;
import com.autotrader.backend.repository.EventLogRepository;
import com.autotrader.backend.repository.LiveStatusRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Dashboard-visible events and the live status line. Recording never throws into the trading loop.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EventStreamService {

    public static final String INFO = "INFO";
    public static final String WARN = "WARN";
    public static final String ERROR = "ERROR";

    private static final int MAX_MESSAGE_LENGTH = 4000;

    private final EventLogRepository eventLogRepository;
    private final LiveStatusRepository liveStatusRepository;

    public void info(String symbol, String step, String message) {
        record(INFO, symbol, step, message);
    }

    public void warn(String symbol, String step, String message) {
        record(WARN, symbol, step, message);
    }

    public void error(String symbol, String step, String message) {
        record(ERROR, symbol, step, message);
    }

    public void record(String level, String symbol, String step, String message) {
        switch (level) {
            case ERROR -> log.error("[{}][{}] {}", symbol, step, message);
            case WARN -> log.warn("[{}][{}] {}", symbol, step, message);
            default -> log.info("[{}][{}] {}", symbol, step, message);
        }
        try {
            eventLogRepository.save(EventLog.builder()
                    .createdAt(Instant.now())
                    .level(level)
                    .symbol(symbol)
                    .step(step)
                    .message(truncate(message))
                    .build());
        } catch (Exception e) {
            log.warn("Failed to record event {}:{} - {}", symbol, step, e.getMessage());
        }
    }

    public void updateLiveStatus(String symbol, String step) {
        try {
            liveStatusRepository.save(LiveStatus.builder()
                    .id(LiveStatus.SINGLETON_ID)
                    .currentSymbol(symbol)
                    .currentStep(step)
                    .lastUpdate(Instant.now())
                    .build());
        } catch (Exception e) {
            log.warn("Failed to update live status {}:{} - {}", symbol, step, e.getMessage());
        }
    }

    private static String truncate(String message) {
        if (message == null) {
            return "";
        }
        return message.length() <= MAX_MESSAGE_LENGTH ? message : message.substring(0, MAX_MESSAGE_LENGTH);
    }
}
