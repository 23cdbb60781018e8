package com.asyncreview.core.review;

import com.asyncreview.core.InvalidInputException;
import com.asyncreview.core.config.AsyncReviewProperties;
import com.asyncreview.core.diff.ContentContextAssembler;
import com.asyncreview.core.engine.IterationListener;
import com.asyncreview.core.engine.LoopOutcome;
import com.asyncreview.core.engine.LoopRequest;
import com.asyncreview.core.engine.ReasoningLoop;
import com.asyncreview.core.events.EventBus;
import com.asyncreview.core.events.QuestionStreamPublisher;
import com.asyncreview.core.events.ReviewEvent;
import com.asyncreview.core.llm.ModelInvocationException;
import com.asyncreview.core.metrics.ReviewMetrics;
import com.asyncreview.core.model.ChangeSet;
import com.asyncreview.core.model.ChangedFile;
import com.asyncreview.core.model.ConversationTurn;
import com.asyncreview.core.model.DiffFileContext;
import com.asyncreview.core.model.DiffSelection;
import com.asyncreview.core.model.DiffSide;
import com.asyncreview.core.model.FileContents;
import com.asyncreview.core.model.FileStatus;
import com.asyncreview.core.model.IterationRecord;
import com.asyncreview.core.model.SelectionMode;
import com.asyncreview.core.session.ReviewSessionService;
import com.asyncreview.core.session.SessionNotFoundException;
import com.asyncreview.provider.FileVersions;
import com.asyncreview.provider.TransientProviderException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link DiffQuestionService}.
 */
class DiffQuestionServiceTest {

    private ReviewSessionService sessions;
    private ReasoningLoop loop;
    private SimpleMeterRegistry registry;
    private AsyncReviewProperties properties;
    private DiffQuestionService service;

    @BeforeEach
    void setUp() {
        sessions = mock(ReviewSessionService.class);
        loop = mock(ReasoningLoop.class);
        registry = new SimpleMeterRegistry();
        properties = new AsyncReviewProperties();
        service = new DiffQuestionService(sessions, new ContentContextAssembler(properties), loop,
                new ReviewMetrics(registry), properties);

        when(sessions.require("S1")).thenReturn(changeSet(
                new ChangedFile("a.py", FileStatus.MODIFIED, 2, 1, "@@ -1 +1,2 @@\n-x = 1\n+x = 2\n+y = 3")));
        when(sessions.fetchContent("S1", "a.py")).thenReturn(new FileVersions(
                new FileContents("a.py", "x = 1", "o/r/base/a.py"),
                new FileContents("a.py", "x = 2\ny = 3", "o/r/head/a.py")));
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    static ChangeSet changeSet(ChangedFile... files) {
        return new ChangeSet("S1", "github", "github.com", "o", "r", 7, "Fix parser", "Handles empty input",
                "base", "head", List.of(files), "dev", "open", false, "fix", "main",
                List.of(), List.of(), 2, 1, Instant.now());
    }

    private static LoopOutcome outcome(String answer, Object citations, boolean exhausted, boolean cancelled) {
        return new LoopOutcome(answer, citations, Map.of("answer", answer), List.of(),
                exhausted, cancelled, 1, null);
    }

    private void loopReturns(LoopOutcome outcome) {
        when(loop.run(any(LoopRequest.class), any(IterationListener.class), any(BooleanSupplier.class)))
                .thenReturn(outcome);
    }

    private LoopRequest capturedRequest() {
        ArgumentCaptor<LoopRequest> request = ArgumentCaptor.forClass(LoopRequest.class);
        verify(loop).run(request.capture(), any(IterationListener.class), any(BooleanSupplier.class));
        return request.getValue();
    }

    // -- ask ---------------------------------------------------------------

    @Nested
    @DisplayName("ask")
    class AskTests {

        @Test
        @DisplayName("parses the answer into blocks and keeps only grounded citations")
        void groundsCitations() {
            loopReturns(outcome("Looks fine.\n```python\nx = 2\n```", List.of("a.py:1-2", "a.py:40-41"), false, false));

            DiffAnswer answer = service.ask("S1", "Is this safe?", List.of(), null, IterationListener.NONE, () -> false);

            assertEquals(2, answer.blocks().size());
            assertEquals(1, answer.citations().size());
            assertEquals(1, answer.citations().get(0).startLine());
            assertEquals(1.0, registry.get("asyncreview.citations.dropped").counter().count());
            assertFalse(answer.cancelled());
        }

        @Test
        @DisplayName("builds the loop inputs in order with file_data as side channel")
        void loopInputs() {
            loopReturns(outcome("ok", List.of(), false, false));
            var selection = new DiffSelection("a.py", DiffSide.ADDITIONS, 1, 2, SelectionMode.RANGE);

            service.ask("S1", "Why?", List.of(ConversationTurn.user("hi"), ConversationTurn.assistant("hello")),
                    selection, IterationListener.NONE, () -> false);

            LoopRequest request = capturedRequest();
            assertEquals("diff", request.kind());
            assertEquals(List.of("diff_context", "pr_info", "selection", "conversation", "question"),
                    new ArrayList<>(request.inputs().keySet()));
            assertEquals("PR #7: Fix parser\nHandles empty input", request.inputs().get("pr_info"));
            assertEquals("USER: hi\nASSISTANT: hello", request.inputs().get("conversation"));
            assertTrue(request.inputs().get("selection").startsWith("Selected: a.py"));
            assertTrue(request.inputs().get("diff_context").contains("### New Version:\nx = 2\ny = 3"));
            assertEquals(List.of("answer", "citations"), request.outputFields());
            @SuppressWarnings("unchecked")
            var fileData = (Map<String, Map<String, String>>) request.sideChannels().get("file_data");
            assertEquals("x = 1", fileData.get("a.py").get("old"));
        }

        @Test
        @DisplayName("no selection and no conversation use placeholders")
        void placeholders() {
            loopReturns(outcome("ok", null, false, false));

            service.ask("S1", "Why?", null, null, IterationListener.NONE, () -> false);

            LoopRequest request = capturedRequest();
            assertEquals(DiffQuestionService.NO_SELECTION, request.inputs().get("selection"));
            assertEquals(DiffQuestionService.NO_CONVERSATION, request.inputs().get("conversation"));
        }

        @Test
        @DisplayName("a cancelled run returns an empty cancelled answer")
        void cancelled() {
            loopReturns(outcome("", null, false, true));

            DiffAnswer answer = service.ask("S1", "Why?", List.of(), null, IterationListener.NONE, () -> true);

            assertTrue(answer.cancelled());
            assertTrue(answer.blocks().isEmpty());
            assertTrue(answer.citations().isEmpty());
        }

        @Test
        @DisplayName("blank questions are rejected before anything is fetched")
        void blankQuestion() {
            assertThrows(InvalidInputException.class,
                    () -> service.ask("S1", "  ", List.of(), null, IterationListener.NONE, () -> false));
            verifyNoInteractions(loop);
        }

        @Test
        @DisplayName("unknown sessions propagate SessionNotFoundException")
        void unknownSession() {
            when(sessions.require("nope")).thenThrow(new SessionNotFoundException("nope"));

            assertThrows(SessionNotFoundException.class,
                    () -> service.ask("nope", "Why?", List.of(), null, IterationListener.NONE, () -> false));
        }
    }

    // -- fetchFiles --------------------------------------------------------

    @Nested
    @DisplayName("fetchFiles")
    class FetchFilesTests {

        @Test
        @DisplayName("a failed fetch falls back to the patch")
        void failedFetchKeepsPatch() {
            when(sessions.fetchContent("S1", "a.py")).thenThrow(new TransientProviderException("HTTP 500", 500));

            List<DiffFileContext> files = service.fetchFiles(sessions.require("S1"));

            assertNull(files.get(0).oldFile());
            assertNull(files.get(0).newFile());
            assertNotNull(files.get(0).patch());
        }

        @Test
        @DisplayName("files past the fetch limit are not fetched")
        void fetchLimit() {
            properties.getDiff().setMaxFetchedFiles(1);
            service.shutdown();
            service = new DiffQuestionService(sessions, new ContentContextAssembler(properties), loop,
                    new ReviewMetrics(registry), properties);
            ChangeSet cs = changeSet(
                    new ChangedFile("a.py", FileStatus.MODIFIED, 1, 1, "@@ -1 +1 @@\n-a\n+b"),
                    new ChangedFile("b.py", FileStatus.ADDED, 1, 0, "@@ -0,0 +1 @@\n+c"));

            List<DiffFileContext> files = service.fetchFiles(cs);

            assertEquals(2, files.size());
            assertNotNull(files.get(0).newFile());
            assertNull(files.get(1).newFile());
            assertEquals(FileStatus.ADDED, files.get(1).status());
            verify(sessions, never()).fetchContent("S1", "b.py");
        }
    }

    // -- askStreaming ------------------------------------------------------

    @Nested
    @DisplayName("askStreaming")
    class StreamingTests {

        private final List<ReviewEvent> events = new ArrayList<>();
        private QuestionStreamPublisher publisher;

        @BeforeEach
        void subscribe() {
            var bus = new EventBus();
            bus.subscribe("q1", events::add);
            publisher = new QuestionStreamPublisher(bus, "S1", "q1");
        }

        private List<String> types() {
            return events.stream().map(ReviewEvent::eventType).toList();
        }

        @Test
        @DisplayName("streams start, rounds, blocks, citations and complete")
        void streamsInOrder() {
            when(loop.run(any(LoopRequest.class), any(IterationListener.class), any(BooleanSupplier.class)))
                    .thenAnswer(inv -> {
                        IterationListener listener = inv.getArgument(1);
                        listener.onIteration(new IterationRecord(1, 20, "r", "print(1)", "1", Map.of()));
                        return outcome("Fine.", List.of("a.py:1-1"), false, false);
                    });

            service.askStreaming("S1", "Why?", List.of(), null, publisher, () -> false);

            assertEquals(List.of("start", "iteration", "block", "citations", "complete"), types());
            assertEquals(false, events.get(4).payload().get("exhausted"));
        }

        @Test
        @DisplayName("a model failure becomes a single error event")
        void errorEvent() {
            when(loop.run(any(LoopRequest.class), any(IterationListener.class), any(BooleanSupplier.class)))
                    .thenThrow(new ModelInvocationException("Model call timed out after 120s"));

            service.askStreaming("S1", "Why?", List.of(), null, publisher, () -> false);

            assertEquals(List.of("start", "error"), types());
            assertEquals("Model call timed out after 120s", events.get(1).payload().get("message"));
        }

        @Test
        @DisplayName("a cancelled stream ends without a terminal event")
        void cancelledStream() {
            loopReturns(outcome("", null, false, true));

            service.askStreaming("S1", "Why?", List.of(), null, publisher, () -> true);

            assertEquals(List.of("start"), types());
            assertTrue(publisher.isClosed());
        }
    }
}
