package com.asyncreview.core.trace;

import com.asyncreview.core.model.IterationRecord;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Append-only record of one question run. Mutated only through {@link TraceRecorder}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Trace {

    private final String id;
    private final String question;
    private final String sessionRef;
    private final Instant startedAt;
    private final List<IterationRecord> iterations = new ArrayList<>();
    private String answer;
    private List<String> sources = List.of();
    private String error;
    private Instant endedAt;

    @JsonIgnore
    private final AtomicBoolean persisted = new AtomicBoolean(false);

    Trace(String id, String question, String sessionRef, Instant startedAt) {
        this.id = id;
        this.question = question;
        this.sessionRef = sessionRef;
        this.startedAt = startedAt;
    }

    public String getId() { return id; }
    public String getQuestion() { return question; }
    public String getSessionRef() { return sessionRef; }
    public Instant getStartedAt() { return startedAt; }
    public List<IterationRecord> getIterations() { return Collections.unmodifiableList(iterations); }
    public String getAnswer() { return answer; }
    public List<String> getSources() { return sources; }
    public String getError() { return error; }
    public Instant getEndedAt() { return endedAt; }

    @JsonIgnore
    public boolean isPersisted() { return persisted.get(); }

    @JsonIgnore
    public boolean isEnded() { return endedAt != null; }

    synchronized void append(IterationRecord record) {
        if (endedAt != null) {
            throw new IllegalStateException("Trace " + id + " has already ended");
        }
        iterations.add(record);
    }

    synchronized void complete(String answer, List<String> sources, Instant at) {
        this.answer = answer;
        this.sources = sources == null ? List.of() : List.copyOf(sources);
        this.endedAt = at;
    }

    synchronized void fail(String error, Instant at) {
        this.error = error;
        this.endedAt = at;
    }

    boolean markPersisted() {
        return persisted.compareAndSet(false, true);
    }
}
