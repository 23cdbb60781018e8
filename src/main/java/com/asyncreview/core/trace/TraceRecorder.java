package com.asyncreview.core.trace;

import com.asyncreview.core.config.AsyncReviewProperties;
import com.asyncreview.core.model.IterationRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Creates, appends to, finishes and persists {@link Trace}s.
 * <p>
 * A trace is written once as pretty-printed JSON to
 * {@code <trace-directory>/<yyyyMMdd_HHmmss>_<id>.json}. Write failures are logged
 * and never propagate to the caller.
 */
@Component
public class TraceRecorder {

    private static final Logger log = LoggerFactory.getLogger(TraceRecorder.class);

    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final AsyncReviewProperties.Trace config;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public TraceRecorder(AsyncReviewProperties properties) {
        this(properties, Clock.systemDefaultZone());
    }

    TraceRecorder(AsyncReviewProperties properties, Clock clock) {
        this.config = properties.getTrace();
        this.clock = clock;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Trace start(String question, String sessionRef) {
        String id = UUID.randomUUID().toString().substring(0, 8);
        return new Trace(id, question, sessionRef, clock.instant());
    }

    public void append(Trace trace, IterationRecord record) {
        trace.append(record);
    }

    public void complete(Trace trace, String answer, List<String> sources) {
        trace.complete(answer, sources, clock.instant());
    }

    public void fail(Trace trace, String error) {
        trace.fail(error, clock.instant());
    }

    /**
     * Writes the trace if it has not been written yet.
     *
     * @return the written file, empty if persistence is disabled, already done or failed
     */
    public Optional<Path> persist(Trace trace) {
        if (!config.isEnabled() || !trace.markPersisted()) {
            return Optional.empty();
        }
        Path dir = Path.of(config.getDirectory());
        Path file = dir.resolve(LocalDateTime.now(clock).format(FILE_STAMP) + "_" + trace.getId() + ".json");
        try {
            Files.createDirectories(dir);
            objectMapper.writeValue(file.toFile(), trace);
            log.debug("Trace {} written to {}", trace.getId(), file);
            return Optional.of(file);
        } catch (IOException e) {
            log.warn("Failed to persist trace {} to {}: {}", trace.getId(), dir, e.getMessage());
            return Optional.empty();
        }
    }
}
