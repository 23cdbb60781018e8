package com.asyncreview.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a question is answered, used for SSE streaming.
 *
 * @param eventType  one of "start", "iteration", "block", "citations", "complete", "error"
 * @param sessionId  the review session the question belongs to (nullable for codebase questions)
 * @param questionId the question stream this event belongs to
 * @param payload    event data
 * @param timestamp  when the event occurred
 */
public record ReviewEvent(
    String eventType,
    String sessionId,
    String questionId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String START = "start";
    public static final String ITERATION = "iteration";
    public static final String BLOCK = "block";
    public static final String CITATIONS = "citations";
    public static final String COMPLETE = "complete";
    public static final String ERROR = "error";

    /** Returns {@code true} for the events that end a stream. */
    public boolean isTerminal() {
        return COMPLETE.equals(eventType) || ERROR.equals(eventType);
    }
}
