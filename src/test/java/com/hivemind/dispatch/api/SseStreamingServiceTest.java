package com.hivemind.dispatch.api;

import com.hivemind.core.events.EventBus;
import com.hivemind.core.events.HivemindEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SseStreamingServiceTest {

    private EventBus eventBus;
    private SseStreamingService service;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
        service = new SseStreamingService(eventBus, 5_000);
    }

    @AfterEach
    void tearDown() {
        service.stopHeartbeat();
    }

    @Test
    @DisplayName("each client gets its own emitter")
    void separateEmitters() {
        SseEmitter first = service.createEmitter("OBJ-1");
        SseEmitter second = service.createEmitter("OBJ-1");

        assertNotSame(first, second);
        assertEquals(2, service.activeEmitterCount());
    }

    @Test
    @DisplayName("publishing to a subscribed objective does not throw without a connected client")
    void publishWithoutClient() {
        service.createEmitter("OBJ-1");

        assertDoesNotThrow(() -> eventBus.publish(
                HivemindEvent.forTask("todo.updated", "OBJ-1", "OBJ-1-T01", Map.of("status", "COMPLETED"))));
    }

    @Test
    @DisplayName("events for other objectives are ignored")
    void otherObjectives() {
        service.createEmitter("OBJ-1");

        assertDoesNotThrow(() -> eventBus.publish(HivemindEvent.of("objective.analyzed", "OBJ-2", Map.of())));
        assertEquals(1, service.activeEmitterCount());
    }

    @Test
    @DisplayName("a completed objective closes its streams")
    void completionClosesStream() {
        service.createEmitter("OBJ-1");
        service.createEmitter("OBJ-2");

        eventBus.publish(HivemindEvent.of("objective.completed", "OBJ-1", Map.of("taskCount", 8)));

        assertEquals(1, service.activeEmitterCount());
        assertDoesNotThrow(() -> eventBus.publish(HivemindEvent.of("todo.updated", "OBJ-1", Map.of())));
    }

    @Test
    @DisplayName("cancellation closes every stream of the objective")
    void cancellationClosesStreams() {
        service.createEmitter("OBJ-1");
        service.createEmitter("OBJ-1");

        eventBus.publish(HivemindEvent.of("objective.cancelled", "OBJ-1", Map.of("cancelledTasks", 3)));

        assertEquals(0, service.activeEmitterCount());
    }
}
