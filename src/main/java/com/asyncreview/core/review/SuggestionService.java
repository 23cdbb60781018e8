package com.asyncreview.core.review;

import com.asyncreview.core.llm.LlmService;
import com.asyncreview.core.llm.LlmService.ModelTier;
import com.asyncreview.core.llm.ModelInvocationException;
import com.asyncreview.core.model.ChangeSet;
import com.asyncreview.core.model.ConversationTurn;
import com.asyncreview.core.session.ReviewSessionService;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Proposes short follow-up questions after an answer, using the sub model.
 */
@Service
public class SuggestionService {

    private static final Logger log = LoggerFactory.getLogger(SuggestionService.class);

    static final String SYSTEM_PROMPT =
            "Generate 4-5 short, relevant follow-up questions or actions for the user reviewing this pull request. "
            + "Keep each suggestion to at most 5 words.";
    static final List<String> FALLBACK = List.of(
            "Explain changes", "Identify bugs", "Suggest tests", "Performance check");
    static final int MAX_SUGGESTIONS = 5;

    record Suggestions(
        @JsonPropertyDescription("4-5 short suggestion strings, max 5 words each")
        List<String> suggestions
    ) {}

    private final ReviewSessionService sessions;
    private final LlmService llmService;

    public SuggestionService(ReviewSessionService sessions, LlmService llmService) {
        this.sessions = sessions;
        this.llmService = llmService;
    }

    /**
     * @throws com.asyncreview.core.session.SessionNotFoundException if the session is unknown
     */
    public List<String> suggest(String sessionId, List<ConversationTurn> conversation, String lastAnswer) {
        ChangeSet changeSet = sessions.require(sessionId);
        String user = "## PR context\n" + prContext(changeSet)
                + "\n\n## Recent conversation\n" + recentConversation(conversation)
                + "\n\n## Last answer\n" + clip(lastAnswer, 500);
        try {
            Suggestions result = llmService.structuredCall(ModelTier.SUB, SYSTEM_PROMPT, user, Suggestions.class);
            List<String> suggestions = result.suggestions() == null ? List.of() : result.suggestions().stream()
                    .filter(Objects::nonNull)
                    .map(String::strip)
                    .filter(s -> !s.isEmpty())
                    .limit(MAX_SUGGESTIONS)
                    .toList();
            return suggestions.isEmpty() ? FALLBACK : suggestions;
        } catch (ModelInvocationException e) {
            log.warn("Suggestion generation failed, using defaults: {}", e.getMessage());
            return FALLBACK;
        }
    }

    static String prContext(ChangeSet changeSet) {
        return "PR: " + changeSet.title() + "\n" + clip(changeSet.body(), 500);
    }

    static String recentConversation(List<ConversationTurn> conversation) {
        if (conversation == null || conversation.isEmpty()) {
            return "";
        }
        return conversation.subList(Math.max(0, conversation.size() - 3), conversation.size()).stream()
                .map(turn -> turn.role() + ": " + clip(turn.content(), 200))
                .collect(Collectors.joining("\n"));
    }

    private static String clip(String text, int max) {
        if (text == null) {
            return "";
        }
        return text.length() <= max ? text : text.substring(0, max);
    }
}
