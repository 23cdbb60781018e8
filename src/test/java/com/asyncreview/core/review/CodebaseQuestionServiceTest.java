package com.asyncreview.core.review;

import com.asyncreview.core.InvalidInputException;
import com.asyncreview.core.config.AsyncReviewProperties;
import com.asyncreview.core.engine.IterationListener;
import com.asyncreview.core.engine.LoopOutcome;
import com.asyncreview.core.engine.LoopRequest;
import com.asyncreview.core.engine.ReasoningLoop;
import com.asyncreview.core.metrics.ReviewMetrics;
import com.asyncreview.core.model.ConversationTurn;
import com.asyncreview.core.snapshot.SnapshotBuilder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link CodebaseQuestionService}.
 */
class CodebaseQuestionServiceTest {

    @TempDir
    Path repo;

    private ReasoningLoop loop;
    private SimpleMeterRegistry registry;
    private CodebaseQuestionService service;

    @BeforeEach
    void setUp() throws IOException {
        Files.writeString(repo.resolve("app.py"), "def main():\n    pass\n");
        loop = mock(ReasoningLoop.class);
        registry = new SimpleMeterRegistry();
        var properties = new AsyncReviewProperties();
        service = new CodebaseQuestionService(new SnapshotBuilder(properties), loop,
                new ReviewMetrics(registry), properties);
    }

    // -- ask ---------------------------------------------------------------

    @Nested
    @DisplayName("ask")
    class AskTests {

        @Test
        @DisplayName("runs the loop over the snapshot and returns answer and sources")
        void asksOverSnapshot() {
            when(loop.run(any(LoopRequest.class), any(IterationListener.class), any(BooleanSupplier.class)))
                    .thenReturn(new LoopOutcome("It runs `main`.", List.of("app.py:1-2"), Map.of(),
                            List.of(), false, false, 1, null));

            CodebaseAnswer answer = service.ask(repo, "What runs?", List.of(), IterationListener.NONE);

            assertEquals("It runs `main`.", answer.answer());
            assertEquals(List.of("app.py:1-2"), answer.sources());
            assertEquals(1, answer.blocks().size());
            assertFalse(answer.exhausted());

            ArgumentCaptor<LoopRequest> captor = ArgumentCaptor.forClass(LoopRequest.class);
            verify(loop).run(captor.capture(), any(IterationListener.class), any(BooleanSupplier.class));
            LoopRequest request = captor.getValue();
            assertEquals("codebase", request.kind());
            assertEquals(List.of("codebase", "conversation_history", "question"),
                    new ArrayList<>(request.inputs().keySet()));
            assertEquals("No previous conversation.", request.inputs().get("conversation_history"));
            assertEquals(List.of("answer", "sources"), request.outputFields());
            @SuppressWarnings("unchecked")
            var contents = (Map<String, String>) request.sideChannels().get("codebase");
            assertEquals("def main():\n    pass\n", contents.get("app.py"));
            assertEquals(1.0, registry.get("asyncreview.snapshot.files").summary().totalAmount());
        }

        @Test
        @DisplayName("blank questions are rejected without scanning")
        void blankQuestion() {
            assertThrows(InvalidInputException.class,
                    () -> service.ask(repo, " ", List.of(), IterationListener.NONE));
            verifyNoInteractions(loop);
        }
    }

    // -- formatHistory -----------------------------------------------------

    @Nested
    @DisplayName("formatHistory")
    class FormatHistoryTests {

        @Test
        @DisplayName("empty history has a placeholder")
        void empty() {
            assertEquals("No previous conversation.", CodebaseQuestionService.formatHistory(List.of()));
            assertEquals("No previous conversation.", CodebaseQuestionService.formatHistory(null));
        }

        @Test
        @DisplayName("turns are numbered as question and answer pairs")
        void numbered() {
            String text = CodebaseQuestionService.formatHistory(List.of(
                    ConversationTurn.user("What is this?"),
                    ConversationTurn.assistant("A parser."),
                    ConversationTurn.user("Which one?")));

            assertEquals("Previous conversation:\n\nQ1: What is this?\nA1: A parser.\n\nQ2: Which one?", text);
        }
    }
}
