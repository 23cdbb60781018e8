package com.asyncreview.core.review;

import com.asyncreview.core.InvalidInputException;
import com.asyncreview.core.answer.AnswerParser;
import com.asyncreview.core.config.AsyncReviewProperties;
import com.asyncreview.core.engine.IterationListener;
import com.asyncreview.core.engine.LoopOutcome;
import com.asyncreview.core.engine.LoopRequest;
import com.asyncreview.core.engine.ReasoningLoop;
import com.asyncreview.core.metrics.ReviewMetrics;
import com.asyncreview.core.model.ConversationTurn;
import com.asyncreview.core.model.Snapshot;
import com.asyncreview.core.snapshot.SnapshotBuilder;
import com.asyncreview.core.snapshot.SnapshotOverview;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Answers questions about a local repository.
 * <p>
 * The snapshot overview is shown to the model as {@code codebase}; the full file texts are
 * available in the sandbox under the same name as a path-to-content dict.
 */
@Service
public class CodebaseQuestionService {

    private static final Logger log = LoggerFactory.getLogger(CodebaseQuestionService.class);

    static final String TASK = "Answer the question about the codebase. "
            + "Read the relevant files before answering and list the files and lines you relied on in `sources`.";
    static final List<String> OUTPUT_FIELDS = List.of("answer", "sources");

    private final SnapshotBuilder snapshotBuilder;
    private final ReasoningLoop reasoningLoop;
    private final ReviewMetrics metrics;
    private final int overviewChars;

    public CodebaseQuestionService(SnapshotBuilder snapshotBuilder,
                                   ReasoningLoop reasoningLoop,
                                   ReviewMetrics metrics,
                                   AsyncReviewProperties properties) {
        this.snapshotBuilder = snapshotBuilder;
        this.reasoningLoop = reasoningLoop;
        this.metrics = metrics;
        this.overviewChars = properties.getSnapshot().getOverviewChars();
    }

    /** Builds a snapshot of {@code repo}. */
    public Snapshot snapshot(Path repo) {
        Snapshot snapshot = snapshotBuilder.build(repo);
        metrics.recordSnapshot(snapshot.totalFiles(), snapshot.totalBytes());
        return snapshot;
    }

    public CodebaseAnswer ask(Path repo, String question, List<ConversationTurn> history, IterationListener listener) {
        requireQuestion(question);
        return ask(snapshot(repo), question, history, listener);
    }

    /**
     * Answers {@code question} against an already built snapshot, so an interactive
     * session can ask several questions without rescanning.
     */
    public CodebaseAnswer ask(Snapshot snapshot, String question, List<ConversationTurn> history,
                              IterationListener listener) {
        requireQuestion(question);
        var inputs = new LinkedHashMap<String, String>();
        inputs.put("codebase", SnapshotOverview.render(snapshot, overviewChars));
        inputs.put("conversation_history", formatHistory(history));
        inputs.put("question", question);

        var request = new LoopRequest("codebase", snapshot.root(), question, TASK,
                inputs, Map.of("codebase", snapshot.contents()), OUTPUT_FIELDS);
        LoopOutcome outcome = reasoningLoop.run(request, listener, () -> false);
        log.info("Answered question over {} ({} files, {} rounds)",
                snapshot.root(), snapshot.totalFiles(), outcome.iterations().size());
        return new CodebaseAnswer(outcome.answer(), AnswerParser.parse(outcome.answer()),
                outcome.referenceList(), outcome.iterations(), outcome.exhausted(), outcome.traceId());
    }

    /**
     * Numbers prior turns as {@code Q1:}/{@code A1:} pairs.
     */
    static String formatHistory(List<ConversationTurn> history) {
        if (history == null || history.isEmpty()) {
            return "No previous conversation.";
        }
        var lines = new ArrayList<String>();
        lines.add("Previous conversation:");
        int n = 0;
        for (ConversationTurn turn : history) {
            if ("assistant".equals(turn.role())) {
                lines.add("A" + Math.max(n, 1) + ": " + turn.content());
            } else {
                n++;
                lines.add("\nQ" + n + ": " + turn.content());
            }
        }
        return String.join("\n", lines);
    }

    private static void requireQuestion(String question) {
        if (question == null || question.isBlank()) {
            throw new InvalidInputException("A question is required");
        }
    }
}
