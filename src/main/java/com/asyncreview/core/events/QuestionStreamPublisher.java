package com.asyncreview.core.events;

import com.asyncreview.core.model.AnswerBlock;
import com.asyncreview.core.model.Citation;
import com.asyncreview.core.model.IterationRecord;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Publishes the events of one question stream in order: {@code start}, one
 * {@code iteration} per round, one {@code block} per answer block, {@code citations},
 * then {@code complete}. An {@code error} replaces everything that has not been sent yet;
 * nothing is published after a terminal event.
 */
public class QuestionStreamPublisher {

    private final EventBus eventBus;
    private final String sessionId;
    private final String questionId;
    private boolean closed;

    public QuestionStreamPublisher(EventBus eventBus, String sessionId, String questionId) {
        this.eventBus = eventBus;
        this.sessionId = sessionId;
        this.questionId = questionId;
    }

    public String questionId() {
        return questionId;
    }

    public void start(String question) {
        publish(ReviewEvent.START, Map.of("question", question));
    }

    public void iteration(IterationRecord record) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("iteration", record.index());
        payload.put("maxIterations", record.maxIterations());
        payload.put("reasoning", record.reasoning() == null ? "" : record.reasoning());
        payload.put("code", record.code());
        payload.put("output", record.output());
        publish(ReviewEvent.ITERATION, payload);
    }

    /** Sends the block events, the citations event and {@code complete}. */
    public void answer(List<AnswerBlock> blocks, List<Citation> citations, Map<String, Object> completion) {
        for (int i = 0; i < blocks.size(); i++) {
            var payload = new LinkedHashMap<String, Object>();
            payload.put("index", i);
            payload.put("block", blocks.get(i));
            publish(ReviewEvent.BLOCK, payload);
        }
        publish(ReviewEvent.CITATIONS, Map.of("citations", citations));
        publish(ReviewEvent.COMPLETE, completion);
        closed = true;
    }

    public void error(String message) {
        publish(ReviewEvent.ERROR, Map.of("message", message == null ? "Unknown error" : message));
        closed = true;
    }

    /** Ends the stream without a terminal event; used when the client has gone away. */
    public void abandon() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    private void publish(String type, Map<String, Object> payload) {
        if (closed) {
            return;
        }
        eventBus.publish(new ReviewEvent(type, sessionId, questionId, payload, Instant.now()));
    }
}
