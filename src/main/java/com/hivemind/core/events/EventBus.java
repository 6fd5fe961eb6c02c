package com.hivemind.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for coordinator lifecycle events.
 * <p>
 * Supports per-objective subscriptions and global subscriptions that receive every event.
 * A throwing subscriber never prevents delivery to the others.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<HivemindEvent>>> objectiveSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<HivemindEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(HivemindEvent event) {
        log.debug("Publishing event: {} for objective {}", event.eventType(), event.objectiveId());

        if (event.objectiveId() != null) {
            List<Consumer<HivemindEvent>> subs = objectiveSubscribers.get(event.objectiveId());
            if (subs != null) {
                for (Consumer<HivemindEvent> subscriber : subs) {
                    deliverSafely(subscriber, event);
                }
            }
        }

        for (Consumer<HivemindEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events of one objective.
     *
     * @return a handle to unsubscribe later
     */
    public Subscription subscribe(String objectiveId, Consumer<HivemindEvent> consumer) {
        objectiveSubscribers.computeIfAbsent(objectiveId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to objective {}", objectiveId);
        return () -> {
            CopyOnWriteArrayList<Consumer<HivemindEvent>> subs = objectiveSubscribers.get(objectiveId);
            if (subs != null) {
                subs.remove(consumer);
                if (subs.isEmpty()) {
                    objectiveSubscribers.remove(objectiveId, subs);
                }
            }
        };
    }

    public Subscription subscribeAll(Consumer<HivemindEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<HivemindEvent> subscriber, HivemindEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
