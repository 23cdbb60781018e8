package com.asyncreview.dispatch.api;

import com.asyncreview.core.events.EventBus;
import com.asyncreview.core.events.ReviewEvent;
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
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bridges {@link EventBus} subscriptions to {@link SseEmitter} instances for SSE streaming.
 * <p>
 * Each question stream gets one emitter subscribed to the bus under the question id. The
 * emitter is completed after the terminal {@code complete} or {@code error} event. If the
 * client goes away first (timeout, I/O error, early completion), the disconnect callback
 * runs so the question can be cancelled.
 * <p>
 * Heartbeats are sent as SSE comments to keep idle connections open through proxies.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    /** Default emitter timeout: 15 minutes. */
    private static final long DEFAULT_TIMEOUT_MS = 15 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

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
        heartbeatScheduler.scheduleAtFixedRate(
                this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS,
                HEARTBEAT_INTERVAL_SECONDS,
                TimeUnit.SECONDS
        );
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
                log.debug("Heartbeat failed for question {} (connection likely closed): {}",
                        registration.questionId, e.getMessage());
            } catch (IllegalStateException e) {
                log.debug("Heartbeat skipped for question {} (emitter not active)", registration.questionId);
            }
        }
    }

    /**
     * Creates an SSE emitter that streams the events of one question.
     *
     * @param questionId   the question stream to forward
     * @param onDisconnect run when the client goes away before the terminal event
     * @return a configured {@link SseEmitter}
     */
    public SseEmitter createEmitter(String questionId, Runnable onDisconnect) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        var finished = new AtomicBoolean();

        EventBus.Subscription subscription = eventBus.subscribe(questionId, event -> {
            sendEvent(emitter, event);
            if (event.isTerminal() && finished.compareAndSet(false, true)) {
                emitter.complete();
            }
        });

        var registration = new EmitterRegistration(questionId, emitter, subscription);
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> {
            log.debug("SSE emitter completed for question {}", questionId);
            cleanup(registration);
            if (finished.compareAndSet(false, true)) {
                onDisconnect.run();
            }
        });
        emitter.onTimeout(() -> {
            log.debug("SSE emitter timed out for question {}", questionId);
            cleanup(registration);
            finished.set(true);
            onDisconnect.run();
        });
        emitter.onError(ex -> {
            log.debug("SSE emitter error for question {}: {}", questionId, ex.getMessage());
            cleanup(registration);
            finished.set(true);
            onDisconnect.run();
        });

        log.info("SSE emitter created for question {} (timeout={}ms)", questionId, timeoutMs);
        return emitter;
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    private void sendEvent(SseEmitter emitter, ReviewEvent event) {
        try {
            Map<String, Object> data = new LinkedHashMap<>();
            if (event.sessionId() != null) {
                data.put("sessionId", event.sessionId());
            }
            data.put("questionId", event.questionId());
            data.putAll(event.payload());
            data.put("timestamp", event.timestamp().toString());

            emitter.send(SseEmitter.event()
                    .name(event.eventType())
                    .data(data));
        } catch (IOException | IllegalStateException e) {
            log.debug("Failed to send SSE event {} for question {}: {}",
                    event.eventType(), event.questionId(), e.getMessage());
        }
    }

    private void cleanup(EmitterRegistration registration) {
        registration.subscription.unsubscribe();
        activeRegistrations.remove(registration);
    }

    private record EmitterRegistration(
            String questionId,
            SseEmitter emitter,
            EventBus.Subscription subscription
    ) {}
}
