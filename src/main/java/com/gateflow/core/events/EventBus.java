package com.gateflow.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for pipeline events.
 * <p>
 * Supports per-run subscriptions (keyed by requestId) and global subscriptions.
 * A subscriber that throws never affects the run or the other subscribers.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<PipelineEvent>>> runSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<PipelineEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(PipelineEvent event) {
        log.debug("Publishing event: {} for run {}", event.eventType(), event.requestId());

        List<Consumer<PipelineEvent>> subs = runSubscribers.get(event.requestId());
        if (subs != null) {
            for (Consumer<PipelineEvent> subscriber : subs) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<PipelineEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events of one run.
     *
     * @return a handle to unsubscribe later
     */
    public Subscription subscribe(String requestId, Consumer<PipelineEvent> consumer) {
        runSubscribers.computeIfAbsent(requestId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> {
            CopyOnWriteArrayList<Consumer<PipelineEvent>> subs = runSubscribers.get(requestId);
            if (subs != null) {
                subs.remove(consumer);
                if (subs.isEmpty()) {
                    runSubscribers.remove(requestId, subs);
                }
            }
        };
    }

    public Subscription subscribeAll(Consumer<PipelineEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<PipelineEvent> subscriber, PipelineEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
