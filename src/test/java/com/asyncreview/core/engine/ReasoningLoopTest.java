package com.asyncreview.core.engine;

import com.asyncreview.core.config.AsyncReviewProperties;
import com.asyncreview.core.llm.ModelAction;
import com.asyncreview.core.llm.ModelInvocationException;
import com.asyncreview.core.llm.PromptState;
import com.asyncreview.core.llm.ReasoningModel;
import com.asyncreview.core.metrics.ReviewMetrics;
import com.asyncreview.core.model.IterationRecord;
import com.asyncreview.core.trace.TraceRecorder;
import com.asyncreview.sandbox.ExecutionResult;
import com.asyncreview.sandbox.ExecutionSandbox;
import com.asyncreview.sandbox.SandboxExecutionException;
import com.asyncreview.sandbox.SandboxSession;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link ReasoningLoop}.
 */
class ReasoningLoopTest {

    @TempDir
    Path traceDir;

    private ReasoningModel model;
    private ExecutionSandbox sandbox;
    private SandboxSession session;
    private SimpleMeterRegistry registry;
    private AsyncReviewProperties properties;
    private ReasoningLoop loop;

    @BeforeEach
    void setUp() {
        model = mock(ReasoningModel.class);
        sandbox = mock(ExecutionSandbox.class);
        session = mock(SandboxSession.class);
        when(sandbox.openSession(anyString())).thenReturn(session);
        when(model.generate(any())).thenReturn(new ModelAction("look around", "print(len(codebase))"));

        registry = new SimpleMeterRegistry();
        properties = new AsyncReviewProperties();
        properties.getTrace().setDirectory(traceDir.toString());
        loop = new ReasoningLoop(model, sandbox, new TraceRecorder(properties),
                new ReviewMetrics(registry), properties);
    }

    @AfterEach
    void tearDown() {
        loop.shutdown();
    }

    private static LoopRequest request() {
        return new LoopRequest("codebase", "/repo", "What does it do?", "Answer the question",
                Map.of("codebase", "overview", "question", "What does it do?"),
                Map.of("contents", Map.of("a.py", "print(1)")),
                List.of("answer", "sources"));
    }

    private static ExecutionResult submit(String answer, Object sources) {
        return new ExecutionResult("submitted", Map.of("answer", answer, "sources", sources));
    }

    private List<Path> traceFiles() throws IOException {
        try (Stream<Path> files = Files.list(traceDir)) {
            return files.toList();
        }
    }

    // -- Submission --------------------------------------------------------

    @Nested
    @DisplayName("submission")
    class SubmissionTests {

        @Test
        @DisplayName("SUBMIT on the first round ends the run with its fields")
        void submitEndsRun() throws Exception {
            when(session.execute(anyString(), anyMap())).thenReturn(submit("It parses.", List.of("a.py:1-2")));

            LoopOutcome outcome = loop.run(request());

            assertEquals("It parses.", outcome.answer());
            assertEquals(List.of("a.py:1-2"), outcome.referenceList());
            assertFalse(outcome.exhausted());
            assertFalse(outcome.cancelled());
            assertEquals(1, outcome.llmCalls());
            assertEquals(1, outcome.iterations().size());
            verify(model, never()).extractFallback(any());
            verify(session).close();
        }

        @Test
        @DisplayName("comma-separated references are split into a list")
        void stringReferences() throws Exception {
            when(session.execute(anyString(), anyMap())).thenReturn(submit("ok", "a.py:1-2, b.py:3-4"));

            LoopOutcome outcome = loop.run(request());

            assertEquals(List.of("a.py:1-2", "b.py:3-4"), outcome.referenceList());
        }

        @Test
        @DisplayName("inputs and side channels are both defined in the sandbox")
        @SuppressWarnings("unchecked")
        void variablesInjected() throws Exception {
            when(session.execute(anyString(), anyMap())).thenReturn(submit("ok", List.of()));

            loop.run(request());

            ArgumentCaptor<Map<String, Object>> vars = ArgumentCaptor.forClass(Map.class);
            verify(session).execute(eq("print(len(codebase))"), vars.capture());
            assertEquals("overview", vars.getValue().get("codebase"));
            assertEquals(Map.of("a.py", "print(1)"), vars.getValue().get("contents"));
        }

        @Test
        @DisplayName("writes one trace file for the run")
        void traceWritten() throws Exception {
            when(session.execute(anyString(), anyMap())).thenReturn(submit("ok", List.of()));

            LoopOutcome outcome = loop.run(request());

            List<Path> files = traceFiles();
            assertEquals(1, files.size());
            assertTrue(files.get(0).getFileName().toString().endsWith(outcome.traceId() + ".json"));
            assertEquals(1.0, registry.get("asyncreview.loop.outcomes").tag("outcome", "done").counter().count());
        }
    }

    // -- Budgets -----------------------------------------------------------

    @Nested
    @DisplayName("budgets")
    class BudgetTests {

        @Test
        @DisplayName("iteration cap leads to exactly one fallback extraction")
        void iterationCap() throws Exception {
            properties.getLoop().setMaxIterations(3);
            when(session.execute(anyString(), anyMap())).thenReturn(ExecutionResult.output("42"));
            when(model.extractFallback(any())).thenReturn(Map.of("answer", "Best guess", "sources", List.of()));

            LoopOutcome outcome = loop.run(request());

            assertTrue(outcome.exhausted());
            assertEquals("Best guess", outcome.answer());
            assertEquals(3, outcome.iterations().size());
            assertEquals(4, outcome.llmCalls());
            verify(model, times(3)).generate(any());
            verify(model, times(1)).extractFallback(any());
        }

        @Test
        @DisplayName("model-call budget holds one call back for the fallback")
        void callBudget() throws Exception {
            properties.getLoop().setMaxLlmCalls(4);
            when(session.execute(anyString(), anyMap())).thenReturn(ExecutionResult.output("42"));
            when(model.extractFallback(any())).thenReturn(Map.of("answer", "Partial"));

            LoopOutcome outcome = loop.run(request());

            assertTrue(outcome.exhausted());
            assertEquals(4, outcome.llmCalls());
            assertEquals(3, outcome.iterations().size());
        }

        @Test
        @DisplayName("fallback with no answer yields an empty answer")
        void emptyFallback() throws Exception {
            properties.getLoop().setMaxIterations(1);
            when(session.execute(anyString(), anyMap())).thenReturn(ExecutionResult.output(""));
            when(model.extractFallback(any())).thenReturn(null);

            LoopOutcome outcome = loop.run(request());

            assertEquals("", outcome.answer());
            assertEquals(List.of(), outcome.referenceList());
        }

        @Test
        @DisplayName("observations are truncated to the output bound")
        void outputTruncated() throws Exception {
            properties.getLoop().setMaxOutputChars(10);
            when(session.execute(anyString(), anyMap()))
                    .thenReturn(ExecutionResult.output("x".repeat(50)))
                    .thenReturn(submit("ok", List.of()));

            LoopOutcome outcome = loop.run(request());

            assertEquals("x".repeat(10), outcome.iterations().get(0).output());
        }

        @Test
        @DisplayName("the fallback sees the full history")
        void fallbackSeesHistory() throws Exception {
            properties.getLoop().setMaxIterations(2);
            when(session.execute(anyString(), anyMap())).thenReturn(ExecutionResult.output("step"));
            when(model.extractFallback(any())).thenReturn(Map.of("answer", "done"));

            loop.run(request());

            ArgumentCaptor<PromptState> state = ArgumentCaptor.forClass(PromptState.class);
            verify(model).extractFallback(state.capture());
            assertEquals(2, state.getValue().history().size());
            assertEquals(List.of("contents"), state.getValue().sideChannels());
        }
    }

    // -- Failures ----------------------------------------------------------

    @Nested
    @DisplayName("failures")
    class FailureTests {

        @Test
        @DisplayName("sandbox errors become observations and the run continues")
        void sandboxErrorObserved() throws Exception {
            when(session.execute(anyString(), anyMap()))
                    .thenThrow(new SandboxExecutionException("NameError: name 'x' is not defined"))
                    .thenReturn(submit("ok", List.of()));

            LoopOutcome outcome = loop.run(request());

            assertEquals("[Error] NameError: name 'x' is not defined", outcome.iterations().get(0).output());
            assertEquals("ok", outcome.answer());
            assertEquals(1.0, registry.get("asyncreview.sandbox.errors").counter().count());
        }

        @Test
        @DisplayName("an unavailable sandbox is reported in every observation")
        void sandboxUnavailable() {
            when(sandbox.openSession(anyString())).thenThrow(new SandboxExecutionException("docker not running"));
            properties.getLoop().setMaxIterations(2);
            when(model.extractFallback(any())).thenReturn(Map.of("answer", "unknown"));

            LoopOutcome outcome = loop.run(request());

            assertEquals(2, outcome.iterations().size());
            assertTrue(outcome.iterations().get(0).output().startsWith("[Error] Sandbox unavailable"));
            assertTrue(outcome.exhausted());
        }

        @Test
        @DisplayName("model failures end the run and the trace records the error")
        void modelFailure() throws Exception {
            when(model.generate(any())).thenThrow(new IllegalStateException("rate limited"));

            var ex = assertThrows(ModelInvocationException.class, () -> loop.run(request()));

            assertEquals("Model call failed: rate limited", ex.getMessage());
            verify(session).close();
            List<Path> files = traceFiles();
            assertEquals(1, files.size());
            assertTrue(Files.readString(files.get(0)).contains("rate limited"));
            assertEquals(1.0, registry.get("asyncreview.loop.outcomes").tag("outcome", "failed").counter().count());
        }

        @Test
        @DisplayName("model invocation exceptions pass through unchanged")
        void modelInvocationPassesThrough() {
            var original = new ModelInvocationException("bad json");
            when(model.generate(any())).thenThrow(original);

            var ex = assertThrows(ModelInvocationException.class, () -> loop.run(request()));

            assertSame(original, ex);
        }

        @Test
        @DisplayName("a model call over the timeout fails the run")
        void modelTimeout() {
            properties.getLoop().setModelTimeout(Duration.ofMillis(100));
            when(model.generate(any())).thenAnswer(inv -> {
                Thread.sleep(5_000);
                return new ModelAction("late", "pass");
            });

            var ex = assertThrows(ModelInvocationException.class, () -> loop.run(request()));

            assertTrue(ex.getMessage().contains("timed out"));
        }

        @Test
        @DisplayName("a null action is a model failure")
        void nullAction() {
            when(model.generate(any())).thenReturn(null);

            assertThrows(ModelInvocationException.class, () -> loop.run(request()));
        }
    }

    // -- Cancellation and listeners ----------------------------------------

    @Nested
    @DisplayName("cancellation")
    class CancellationTests {

        @Test
        @DisplayName("no round starts after cancellation and no fallback runs")
        void cancelStopsRun() throws Exception {
            when(session.execute(anyString(), anyMap())).thenReturn(ExecutionResult.output("1"));
            var cancelled = new AtomicBoolean();

            LoopOutcome outcome = loop.run(request(), record -> cancelled.set(true), cancelled::get);

            assertTrue(outcome.cancelled());
            assertFalse(outcome.exhausted());
            assertEquals("", outcome.answer());
            assertEquals(1, outcome.iterations().size());
            verify(model, times(1)).generate(any());
            verify(model, never()).extractFallback(any());
            verify(session).close();
        }

        @Test
        @DisplayName("cancelled before the first round runs nothing")
        void cancelledUpFront() {
            LoopOutcome outcome = loop.run(request(), IterationListener.NONE, () -> true);

            assertTrue(outcome.cancelled());
            assertTrue(outcome.iterations().isEmpty());
            verify(model, never()).generate(any());
        }

        @Test
        @DisplayName("the listener receives every round in order")
        void listenerOrder() throws Exception {
            properties.getLoop().setMaxIterations(3);
            when(session.execute(anyString(), anyMap())).thenReturn(ExecutionResult.output("."));
            when(model.extractFallback(any())).thenReturn(Map.of("answer", "a"));
            List<IterationRecord> seen = new ArrayList<>();

            loop.run(request(), seen::add, () -> false);

            assertEquals(List.of(1, 2, 3), seen.stream().map(IterationRecord::index).toList());
            assertTrue(seen.stream().allMatch(r -> r.maxIterations() == 3));
        }
    }
}
