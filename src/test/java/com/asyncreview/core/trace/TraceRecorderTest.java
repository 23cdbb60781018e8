package com.asyncreview.core.trace;

import com.asyncreview.core.config.AsyncReviewProperties;
import com.asyncreview.core.model.IterationRecord;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link TraceRecorder}.
 */
class TraceRecorderTest {

    @TempDir
    Path traceDir;

    private AsyncReviewProperties properties;
    private TraceRecorder recorder;

    @BeforeEach
    void setUp() {
        properties = new AsyncReviewProperties();
        properties.getTrace().setDirectory(traceDir.toString());
        Clock clock = Clock.fixed(Instant.parse("2026-03-04T05:06:07Z"), ZoneOffset.UTC);
        recorder = new TraceRecorder(properties, clock);
    }

    private static IterationRecord round(int index) {
        return new IterationRecord(index, 20, "look", "print(1)", "1", Map.of());
    }

    @Test
    @DisplayName("writes a timestamped JSON file with the iterations and answer")
    void persistsJson() throws IOException {
        Trace trace = recorder.start("What does it do?", "/repo");
        recorder.append(trace, round(1));
        recorder.complete(trace, "It parses.", List.of("a.py:1-2"));

        Optional<Path> written = recorder.persist(trace);

        assertTrue(written.isPresent());
        assertEquals("20260304_050607_" + trace.getId() + ".json", written.get().getFileName().toString());
        JsonNode json = new ObjectMapper().readTree(written.get().toFile());
        assertEquals("What does it do?", json.get("question").asText());
        assertEquals(1, json.get("iterations").size());
        assertEquals("It parses.", json.get("answer").asText());
        assertEquals("2026-03-04T05:06:07Z", json.get("startedAt").asText());
        assertFalse(json.has("error"));
    }

    @Test
    @DisplayName("a trace is written only once")
    void persistedOnce() throws IOException {
        Trace trace = recorder.start("q", "s");
        recorder.fail(trace, "boom");

        assertTrue(recorder.persist(trace).isPresent());
        assertTrue(recorder.persist(trace).isEmpty());
        try (Stream<Path> files = Files.list(traceDir)) {
            assertEquals(1, files.count());
        }
    }

    @Test
    @DisplayName("appending after the trace ended is rejected")
    void appendAfterEndRejected() {
        Trace trace = recorder.start("q", "s");
        recorder.complete(trace, "a", List.of());

        assertThrows(IllegalStateException.class, () -> recorder.append(trace, round(1)));
    }

    @Test
    @DisplayName("disabled tracing writes nothing")
    void disabled() {
        properties.getTrace().setEnabled(false);
        Trace trace = recorder.start("q", "s");

        assertTrue(recorder.persist(trace).isEmpty());
    }

    @Test
    @DisplayName("write failures are swallowed into an empty result")
    void writeFailure() throws IOException {
        Path blocker = traceDir.resolve("blocker");
        Files.writeString(blocker, "not a directory");
        properties.getTrace().setDirectory(blocker.resolve("traces").toString());
        Trace trace = recorder.start("q", "s");

        assertTrue(recorder.persist(trace).isEmpty());
    }
}
