package com.asyncreview.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for question streams.
 * <p>
 * Subscriptions are keyed by question id. Thread-safe for concurrent publish and
 * subscribe operations.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<ReviewEvent>>> subscribers =
            new ConcurrentHashMap<>();

    /**
     * Publish an event to the subscribers of its question.
     *
     * @param event the event to publish
     */
    public void publish(ReviewEvent event) {
        log.debug("Publishing event: {} for question {}", event.eventType(), event.questionId());
        List<Consumer<ReviewEvent>> subs = subscribers.get(event.questionId());
        if (subs != null) {
            for (Consumer<ReviewEvent> subscriber : subs) {
                deliverSafely(subscriber, event);
            }
        }
    }

    /**
     * Subscribe to events for a specific question.
     *
     * @param questionId the question stream to subscribe to
     * @param consumer   callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String questionId, Consumer<ReviewEvent> consumer) {
        subscribers.computeIfAbsent(questionId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to question {}", questionId);
        return () -> subscribers.computeIfPresent(questionId, (k, subs) -> {
            subs.remove(consumer);
            return subs.isEmpty() ? null : subs;
        });
    }

    public int subscriberCount(String questionId) {
        List<Consumer<ReviewEvent>> subs = subscribers.get(questionId);
        return subs == null ? 0 : subs.size();
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<ReviewEvent> subscriber, ReviewEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
