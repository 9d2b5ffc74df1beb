package com.truthlens.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Server-Sent Event connections of this instance, grouped by user.
 *
 * A user may hold several connections (one per open client). Emitters are
 * removed on completion, timeout or error, and on the first failed send.
 */
@Component
@Slf4j
public class NotificationStreamRegistry {

    static final long SSE_TIMEOUT_MS = 30 * 60 * 1000L;

    private final Map<UUID, List<SseEmitter>> emitters = new ConcurrentHashMap<>();

    public SseEmitter register(UUID userId) {
        return register(userId, new SseEmitter(SSE_TIMEOUT_MS));
    }

    SseEmitter register(UUID userId, SseEmitter emitter) {
        emitters.computeIfAbsent(userId, key -> new CopyOnWriteArrayList<>()).add(emitter);

        emitter.onCompletion(() -> {
            log.debug("SSE connection completed: userId={}", userId);
            remove(userId, emitter);
        });
        emitter.onTimeout(() -> {
            log.debug("SSE connection timed out: userId={}", userId);
            remove(userId, emitter);
        });
        emitter.onError(ex -> {
            log.warn("SSE connection error: userId={}, error={}", userId, ex.getMessage());
            remove(userId, emitter);
        });

        try {
            emitter.send(SseEmitter.event()
                    .name("connected")
                    .data(Map.of(
                            "message", "Notification stream established",
                            "userId", userId.toString(),
                            "timestamp", Instant.now().toString()
                    )));
        } catch (IOException e) {
            remove(userId, emitter);
            throw new IllegalStateException("Failed to establish notification stream", e);
        }

        log.info("SSE connection established: userId={}, connections={}", userId, connectionsOf(userId));
        return emitter;
    }

    /**
     * Send a JSON event to every connection of the user on this instance.
     *
     * @return number of connections the event was written to
     */
    public int deliver(UUID userId, String eventName, String json) {
        List<SseEmitter> userEmitters = emitters.get(userId);
        if (userEmitters == null || userEmitters.isEmpty()) {
            return 0;
        }

        int delivered = 0;
        for (SseEmitter emitter : userEmitters) {
            try {
                emitter.send(SseEmitter.event()
                        .name(eventName)
                        .data(json, MediaType.APPLICATION_JSON));
                delivered++;
            } catch (IOException | IllegalStateException e) {
                log.warn("Dropping broken SSE connection: userId={}, error={}", userId, e.getMessage());
                remove(userId, emitter);
            }
        }
        log.debug("SSE event delivered: userId={}, event={}, connections={}", userId, eventName, delivered);
        return delivered;
    }

    public int connectionsOf(UUID userId) {
        List<SseEmitter> userEmitters = emitters.get(userId);
        return userEmitters == null ? 0 : userEmitters.size();
    }

    public int activeConnections() {
        return emitters.values().stream().mapToInt(List::size).sum();
    }

    private void remove(UUID userId, SseEmitter emitter) {
        emitters.computeIfPresent(userId, (key, list) -> {
            list.remove(emitter);
            return list.isEmpty() ? null : list;
        });
    }
}
