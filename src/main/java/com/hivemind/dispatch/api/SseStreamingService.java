package com.hivemind.dispatch.api;

import com.hivemind.core.events.EventBus;
import com.hivemind.core.events.HivemindEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bridges {@link EventBus} subscriptions to {@link SseEmitter} instances.
 * <p>
 * Each connected client gets an emitter subscribed to one objective's events; events are
 * forwarded as named SSE frames numbered per stream. The stream ends when the objective
 * completes or is cancelled. Idle connections receive a comment heartbeat.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;
    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;
    private static final Set<String> CLOSING_EVENTS = Set.of("objective.completed", "objective.cancelled");

    private final EventBus eventBus;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventBus eventBus, long timeoutMs) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS, HEARTBEAT_INTERVAL_SECONDS, TimeUnit.SECONDS);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void sendHeartbeats() {
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException e) {
                // onError/onCompletion callbacks clean up
                log.debug("Heartbeat failed for objective {}: {}", registration.objectiveId, e.getMessage());
            } catch (IllegalStateException e) {
                log.debug("Heartbeat skipped for objective {} (emitter not active)", registration.objectiveId);
            }
        }
    }

    /**
     * Creates an SSE emitter that streams events for the given objective.
     */
    public SseEmitter createEmitter(String objectiveId) {
        SseEmitter emitter = new SseEmitter(timeoutMs);

        var registration = new EmitterRegistration(objectiveId, emitter);
        registration.subscription = eventBus.subscribe(objectiveId, event -> forward(registration, event));
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> cleanup(registration));
        emitter.onTimeout(() -> cleanup(registration));
        emitter.onError(ex -> {
            log.debug("SSE emitter error for objective {}: {}", objectiveId, ex.getMessage());
            cleanup(registration);
        });

        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Failed to send initial frame for objective {}: {}", objectiveId, e.getMessage());
        }

        log.info("SSE emitter created for objective {} (timeout={}ms)", objectiveId, timeoutMs);
        return emitter;
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    /**
     * Sends one event as a named frame with a per-stream sequence id. Terminal objective
     * events close the stream after delivery.
     */
    private void forward(EmitterRegistration registration, HivemindEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("objectiveId", event.objectiveId());
        if (event.taskId() != null) {
            data.put("taskId", event.taskId());
        }
        data.putAll(event.payload());
        data.put("timestamp", event.timestamp().toString());

        try {
            registration.emitter.send(SseEmitter.event()
                    .id(String.valueOf(registration.sequence.incrementAndGet()))
                    .name(event.eventType())
                    .data(data));
        } catch (IOException | IllegalStateException e) {
            log.debug("Failed to send SSE event {} for objective {}: {}",
                    event.eventType(), event.objectiveId(), e.getMessage());
        }

        if (CLOSING_EVENTS.contains(event.eventType())) {
            log.info("Objective {} finished ({}), closing SSE stream", registration.objectiveId, event.eventType());
            registration.emitter.complete();
            cleanup(registration);
        }
    }

    private void cleanup(EmitterRegistration registration) {
        if (activeRegistrations.remove(registration)) {
            registration.subscription.unsubscribe();
        }
    }

    private static final class EmitterRegistration {
        private final String objectiveId;
        private final SseEmitter emitter;
        private final AtomicLong sequence = new AtomicLong();
        private volatile EventBus.Subscription subscription;

        private EmitterRegistration(String objectiveId, SseEmitter emitter) {
            this.objectiveId = objectiveId;
            this.emitter = emitter;
        }
    }
}
