package com.asyncreview.core.review;

import com.asyncreview.core.llm.LlmService;
import com.asyncreview.core.llm.LlmService.ModelTier;
import com.asyncreview.core.llm.ModelInvocationException;
import com.asyncreview.core.model.ChangedFile;
import com.asyncreview.core.model.ConversationTurn;
import com.asyncreview.core.model.FileStatus;
import com.asyncreview.core.session.ReviewSessionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link SuggestionService}.
 */
class SuggestionServiceTest {

    private LlmService llmService;
    private SuggestionService service;

    @BeforeEach
    void setUp() {
        var sessions = mock(ReviewSessionService.class);
        llmService = mock(LlmService.class);
        service = new SuggestionService(sessions, llmService);
        when(sessions.require("S1")).thenReturn(DiffQuestionServiceTest.changeSet(
                new ChangedFile("a.py", FileStatus.ADDED, 1, 0, "@@ -0,0 +1 @@\n+x")));
    }

    private void respond(List<String> suggestions) {
        when(llmService.structuredCall(eq(ModelTier.SUB), anyString(), anyString(),
                eq(SuggestionService.Suggestions.class))).thenReturn(new SuggestionService.Suggestions(suggestions));
    }

    @Test
    @DisplayName("returns cleaned model suggestions capped at five")
    void cleanedSuggestions() {
        respond(Arrays.asList(" Check nulls ", "", null, "Add tests", "Review naming", "Explain API", "Perf", "Extra"));

        List<String> result = service.suggest("S1", List.of(), "Looks fine.");

        assertEquals(List.of("Check nulls", "Add tests", "Review naming", "Explain API", "Perf"), result);
    }

    @Test
    @DisplayName("an empty model result falls back to the defaults")
    void emptyFallsBack() {
        respond(List.of());

        assertEquals(SuggestionService.FALLBACK, service.suggest("S1", List.of(), ""));
    }

    @Test
    @DisplayName("a model failure falls back to the defaults")
    void failureFallsBack() {
        when(llmService.structuredCall(eq(ModelTier.SUB), anyString(), anyString(),
                eq(SuggestionService.Suggestions.class))).thenThrow(new ModelInvocationException("timeout"));

        assertEquals(SuggestionService.FALLBACK, service.suggest("S1", null, null));
    }

    @Test
    @DisplayName("recent conversation keeps the last three turns, clipped")
    void recentConversation() {
        String text = SuggestionService.recentConversation(List.of(
                ConversationTurn.user("first"),
                ConversationTurn.assistant("second"),
                ConversationTurn.user("third"),
                ConversationTurn.assistant("x".repeat(300))));

        assertEquals("assistant: second\nuser: third\nassistant: " + "x".repeat(200), text);
        assertEquals("", SuggestionService.recentConversation(List.of()));
    }

    @Test
    @DisplayName("PR context clips the description")
    void prContext() {
        var cs = DiffQuestionServiceTest.changeSet();
        assertEquals("PR: Fix parser\nHandles empty input", SuggestionService.prContext(cs));
    }
}
