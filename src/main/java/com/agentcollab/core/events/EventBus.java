package com.agentcollab.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for stage, session and review events.
 * <p>
 * Supports per-phase subscriptions and global subscriptions that receive all events.
 * Publishing is safe from lens worker threads and heartbeat tickers.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-phase subscribers keyed by phase. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<CollabEvent>>> phaseSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<CollabEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    /**
     * Publish an event to the subscribers of its phase and to global subscribers.
     * A failing subscriber never affects the publisher or other subscribers.
     */
    public void publish(CollabEvent event) {
        log.debug("Publishing event: {} for stage {}", event.eventType(), event.stageId());

        if (event.phase() != null) {
            List<Consumer<CollabEvent>> subs = phaseSubscribers.get(event.phase());
            if (subs != null) {
                for (Consumer<CollabEvent> subscriber : subs) {
                    deliverSafely(subscriber, event);
                }
            }
        }

        for (Consumer<CollabEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    public Subscription subscribe(String phase, Consumer<CollabEvent> consumer) {
        phaseSubscribers.computeIfAbsent(phase, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> {
            CopyOnWriteArrayList<Consumer<CollabEvent>> subs = phaseSubscribers.get(phase);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    public Subscription subscribeAll(Consumer<CollabEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<CollabEvent> subscriber, CollabEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
