package com.autotrader.backend.service;

import com.autotrader.backend.model.EventLog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Server-sent events of new event_stream rows. Every subscriber keeps its own cursor; one poll per
 * second reads everything after the lowest cursor and fans it out.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EventSseGateway {

    static final long EMITTER_TIMEOUT_MS = 30L * 60L * 1000L;
    static final String EVENT_NAME = "event";

    private final DashboardQueryService queries;

    private final Map<String, Subscriber> subscribers = new ConcurrentHashMap<>();

    /**
     * Opens a stream starting after {@code afterId}, or after the newest event when no cursor is given.
     */
    public SseEmitter subscribe(Long afterId) {
        long cursor = afterId != null && afterId >= 0 ? afterId : queries.latestEventId();
        SseEmitter emitter = new SseEmitter(EMITTER_TIMEOUT_MS);
        String id = UUID.randomUUID().toString();
        subscribers.put(id, new Subscriber(emitter, new AtomicLong(cursor)));

        emitter.onCompletion(() -> subscribers.remove(id));
        emitter.onTimeout(() -> remove(id));
        emitter.onError(e -> remove(id));

        try {
            emitter.send(SseEmitter.event().name("init").data(Map.of("after_id", cursor)));
        } catch (IOException e) {
            log.debug("SSE subscriber {} closed before init", id);
            remove(id);
        }
        return emitter;
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    @Scheduled(fixedDelayString = "${trader.events.stream-poll-millis:1000}")
    public void poll() {
        if (subscribers.isEmpty()) {
            return;
        }
        long lowest = subscribers.values().stream()
                .mapToLong(s -> s.cursor().get())
                .min()
                .orElse(0L);
        List<EventLog> fresh = queries.eventsAfter(lowest);
        if (fresh.isEmpty()) {
            return;
        }
        subscribers.forEach((id, subscriber) -> deliver(id, subscriber, fresh));
    }

    private void deliver(String id, Subscriber subscriber, List<EventLog> fresh) {
        for (EventLog event : fresh) {
            if (event.getId() <= subscriber.cursor().get()) {
                continue;
            }
            try {
                subscriber.emitter().send(SseEmitter.event()
                        .id(String.valueOf(event.getId()))
                        .name(EVENT_NAME)
                        .data(event));
                subscriber.cursor().set(event.getId());
            } catch (IOException | IllegalStateException e) {
                log.debug("SSE send failed; dropping subscriber {}", id);
                remove(id);
                return;
            }
        }
    }

    private void remove(String id) {
        Subscriber subscriber = subscribers.remove(id);
        if (subscriber != null) {
            try {
                subscriber.emitter().complete();
            } catch (IllegalStateException e) {
                log.debug("SSE subscriber {} already completed", id);
            }
        }
    }

    private record Subscriber(SseEmitter emitter, AtomicLong cursor) {
    }
}
