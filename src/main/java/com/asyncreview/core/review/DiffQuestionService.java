package com.asyncreview.core.review;

import com.asyncreview.core.InvalidInputException;
import com.asyncreview.core.answer.AnswerParser;
import com.asyncreview.core.answer.CitationParser;
import com.asyncreview.core.answer.DiffGrounding;
import com.asyncreview.core.config.AsyncReviewProperties;
import com.asyncreview.core.diff.ContentContextAssembler;
import com.asyncreview.core.diff.DiffContext;
import com.asyncreview.core.engine.IterationListener;
import com.asyncreview.core.engine.LoopOutcome;
import com.asyncreview.core.engine.LoopRequest;
import com.asyncreview.core.engine.ReasoningLoop;
import com.asyncreview.core.events.QuestionStreamPublisher;
import com.asyncreview.core.metrics.ReviewMetrics;
import com.asyncreview.core.model.ChangeSet;
import com.asyncreview.core.model.ChangedFile;
import com.asyncreview.core.model.Citation;
import com.asyncreview.core.model.ConversationTurn;
import com.asyncreview.core.model.DiffFileContext;
import com.asyncreview.core.model.DiffSelection;
import com.asyncreview.core.session.ReviewSessionService;
import com.asyncreview.provider.FileVersions;
import com.asyncreview.provider.TransientProviderException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

/**
 * Answers questions about a loaded pull/merge request.
 * <p>
 * Base and head contents of the first files are fetched in parallel before the loop starts.
 * The model sees the rendered content context as {@code diff_context}; every file's full text
 * is reachable in the sandbox through {@code file_data}. Returned citations are kept only when
 * they point at lines the model was actually shown.
 */
@Service
public class DiffQuestionService {

    private static final Logger log = LoggerFactory.getLogger(DiffQuestionService.class);

    static final String TASK = "Answer the question about the pull request. Ground every claim in the "
            + "diff context or in `file_data`, and cite the lines you relied on in `citations`.";
    static final List<String> OUTPUT_FIELDS = List.of("answer", "citations");
    static final String NO_SELECTION = "No specific selection (reviewing entire changeset).";
    static final String NO_CONVERSATION = "No previous conversation.";

    private final ReviewSessionService sessions;
    private final ContentContextAssembler assembler;
    private final ReasoningLoop reasoningLoop;
    private final ReviewMetrics metrics;
    private final int maxFetchedFiles;
    private final ExecutorService fetchExecutor;

    public DiffQuestionService(ReviewSessionService sessions,
                               ContentContextAssembler assembler,
                               ReasoningLoop reasoningLoop,
                               ReviewMetrics metrics,
                               AsyncReviewProperties properties) {
        this.sessions = sessions;
        this.assembler = assembler;
        this.reasoningLoop = reasoningLoop;
        this.metrics = metrics;
        this.maxFetchedFiles = properties.getDiff().getMaxFetchedFiles();
        var counter = new AtomicInteger();
        this.fetchExecutor = Executors.newFixedThreadPool(Math.max(1, properties.getDiff().getFetchConcurrency()), r -> {
            var t = new Thread(r, "content-fetch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    public void shutdown() {
        fetchExecutor.shutdownNow();
    }

    /**
     * Runs one question to completion.
     *
     * @param sessionId    a loaded session
     * @param question     the user's question
     * @param conversation prior turns, oldest first
     * @param selection    the user's selection in the diff, or {@code null}
     * @param listener     receives every round
     * @param cancellation polled before every round
     * @return the parsed, grounded answer; empty and marked cancelled when cancelled
     */
    public DiffAnswer ask(String sessionId, String question, List<ConversationTurn> conversation,
                          DiffSelection selection, IterationListener listener, BooleanSupplier cancellation) {
        if (question == null || question.isBlank()) {
            throw new InvalidInputException("A question is required");
        }
        ChangeSet changeSet = sessions.require(sessionId);
        List<DiffFileContext> files = fetchFiles(changeSet);
        DiffContext context = assembler.assemble(files);

        var inputs = new LinkedHashMap<String, String>();
        inputs.put("diff_context", context.text());
        inputs.put("pr_info", changeSet.describe());
        inputs.put("selection", selection == null ? NO_SELECTION : selection.describe());
        inputs.put("conversation", formatConversation(conversation));
        inputs.put("question", question);

        var request = new LoopRequest("diff", sessionId, question, TASK, inputs,
                Map.of(ContentContextAssembler.SIDE_CHANNEL_NAME, ContentContextAssembler.sideChannel(files)),
                OUTPUT_FIELDS);
        LoopOutcome outcome = reasoningLoop.run(request, listener, cancellation);
        if (outcome.cancelled()) {
            return DiffAnswer.cancelled(outcome.traceId());
        }

        List<Citation> parsed = CitationParser.parse(outcome.references());
        List<Citation> grounded = DiffGrounding.filter(parsed, context.visibleLines());
        if (grounded.size() < parsed.size()) {
            metrics.recordDroppedCitations(parsed.size() - grounded.size());
        }
        return new DiffAnswer(AnswerParser.parse(outcome.answer()), grounded,
                outcome.exhausted(), false, outcome.traceId());
    }

    /**
     * Runs one question and reports it on {@code publisher}: {@code start}, the rounds, then
     * the answer, or a single {@code error}. A cancelled run ends the stream silently.
     */
    public void askStreaming(String sessionId, String question, List<ConversationTurn> conversation,
                             DiffSelection selection, QuestionStreamPublisher publisher,
                             BooleanSupplier cancellation) {
        publisher.start(question);
        try {
            DiffAnswer answer = ask(sessionId, question, conversation, selection, publisher::iteration, cancellation);
            if (answer.cancelled()) {
                log.info("Question {} cancelled by the client", publisher.questionId());
                publisher.abandon();
                return;
            }
            var completion = new LinkedHashMap<String, Object>();
            completion.put("exhausted", answer.exhausted());
            if (answer.traceId() != null) {
                completion.put("traceId", answer.traceId());
            }
            publisher.answer(answer.blocks(), answer.citations(), completion);
        } catch (RuntimeException e) {
            log.error("Question {} failed: {}", publisher.questionId(), e.getMessage(), e);
            publisher.error(e.getMessage());
        }
    }

    /**
     * Fetches base and head versions of the first files concurrently and waits for all of
     * them. A file whose fetch fails is rendered from its patch alone.
     */
    List<DiffFileContext> fetchFiles(ChangeSet changeSet) {
        List<ChangedFile> all = changeSet.files();
        int fetched = Math.min(all.size(), maxFetchedFiles);
        var futures = new ArrayList<CompletableFuture<FileVersions>>();
        for (int i = 0; i < fetched; i++) {
            String path = all.get(i).path();
            futures.add(CompletableFuture.supplyAsync(() -> fetchOne(changeSet.sessionId(), path), fetchExecutor));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        var files = new ArrayList<DiffFileContext>(all.size());
        for (int i = 0; i < all.size(); i++) {
            ChangedFile f = all.get(i);
            FileVersions versions = i < fetched ? futures.get(i).join() : FileVersions.NONE;
            files.add(new DiffFileContext(f.path(), versions.oldFile(), versions.newFile(), f.patch(),
                    f.status(), f.additions(), f.deletions()));
        }
        log.info("Fetched contents for {} of {} files", fetched, all.size());
        return files;
    }

    private FileVersions fetchOne(String sessionId, String path) {
        try {
            return sessions.fetchContent(sessionId, path);
        } catch (TransientProviderException e) {
            log.warn("Could not fetch contents of {}: {}", path, e.getMessage());
            return FileVersions.NONE;
        }
    }

    static String formatConversation(List<ConversationTurn> conversation) {
        if (conversation == null || conversation.isEmpty()) {
            return NO_CONVERSATION;
        }
        return conversation.stream()
                .map(turn -> turn.role().toUpperCase(Locale.ROOT) + ": " + turn.content())
                .collect(Collectors.joining("\n"));
    }
}
