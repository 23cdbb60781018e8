package com.asyncreview.dispatch.api;

import com.asyncreview.core.InvalidInputException;
import com.asyncreview.core.events.EventBus;
import com.asyncreview.core.events.QuestionStreamPublisher;
import com.asyncreview.core.model.ChangeSet;
import com.asyncreview.core.model.FileContents;
import com.asyncreview.core.model.ReviewReport;
import com.asyncreview.core.review.DiffAnswer;
import com.asyncreview.core.review.DiffQuestionService;
import com.asyncreview.core.review.FastReviewService;
import com.asyncreview.core.review.SuggestionService;
import com.asyncreview.core.session.ReviewSessionService;
import com.asyncreview.provider.FileVersions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * REST controller for loading change requests and asking questions about them.
 */
@RestController
@RequestMapping("/api/reviews")
public class ReviewController {

    private static final Logger log = LoggerFactory.getLogger(ReviewController.class);

    private final ReviewSessionService sessions;
    private final DiffQuestionService diffQuestions;
    private final FastReviewService fastReview;
    private final SuggestionService suggestions;
    private final SseStreamingService sseStreamingService;
    private final EventBus eventBus;
    private final Executor streamExecutor;

    public ReviewController(ReviewSessionService sessions,
                            DiffQuestionService diffQuestions,
                            FastReviewService fastReview,
                            SuggestionService suggestions,
                            SseStreamingService sseStreamingService,
                            EventBus eventBus,
                            @Qualifier(QuestionStreamConfig.EXECUTOR) Executor streamExecutor) {
        this.sessions = sessions;
        this.diffQuestions = diffQuestions;
        this.fastReview = fastReview;
        this.suggestions = suggestions;
        this.sseStreamingService = sseStreamingService;
        this.eventBus = eventBus;
        this.streamExecutor = streamExecutor;
    }

    /**
     * POST /api/reviews — Load a pull/merge request into a new session.
     */
    @PostMapping
    public ResponseEntity<ChangeSet> load(@RequestBody LoadReviewRequest request) {
        ChangeSet changeSet = sessions.load(request.url());
        return ResponseEntity.status(HttpStatus.CREATED).body(changeSet);
    }

    /**
     * GET /api/reviews/{id} — The loaded change set.
     */
    @GetMapping("/{id}")
    public ResponseEntity<ChangeSet> get(@PathVariable String id) {
        return sessions.getCached(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * GET /api/reviews/{id}/file?path= — Base and head text of one file.
     */
    @GetMapping("/{id}/file")
    public ResponseEntity<Map<String, Object>> file(@PathVariable String id, @RequestParam String path) {
        FileVersions versions = sessions.fetchContent(id, path);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("path", path);
        body.put("old", versions.oldFile() == null ? null : versions.oldFile().text());
        body.put("new", versions.newFile() == null ? null : versions.newFile().text());
        FileContents either = versions.newFile() != null ? versions.newFile() : versions.oldFile();
        if (either != null) {
            body.put("hash", either.hash());
        }
        return ResponseEntity.ok(body);
    }

    /**
     * POST /api/reviews/{id}/ask — Answer a question and return when done.
     */
    @PostMapping("/{id}/ask")
    public ResponseEntity<DiffAnswer> ask(@PathVariable String id, @RequestBody AskRequest request) {
        DiffAnswer answer = diffQuestions.ask(id, request.question(), request.conversation(),
                request.selection(), record -> {}, () -> false);
        return ResponseEntity.ok(answer);
    }

    /**
     * POST /api/reviews/{id}/ask/stream — Answer a question as an SSE stream of
     * start, iteration, block, citations and complete (or error) events.
     */
    @PostMapping(value = "/{id}/ask/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter askStream(@PathVariable String id, @RequestBody AskRequest request) {
        if (request.question() == null || request.question().isBlank()) {
            throw new InvalidInputException("A question is required");
        }
        sessions.require(id);

        String questionId = UUID.randomUUID().toString().substring(0, 8);
        var cancelled = new AtomicBoolean();
        SseEmitter emitter = sseStreamingService.createEmitter(questionId, () -> {
            if (!cancelled.getAndSet(true)) {
                log.info("Client disconnected from question {}", questionId);
            }
        });
        var publisher = new QuestionStreamPublisher(eventBus, id, questionId);
        try {
            CompletableFuture.runAsync(() -> diffQuestions.askStreaming(id, request.question(),
                    request.conversation(), request.selection(), publisher, cancelled::get), streamExecutor);
        } catch (RejectedExecutionException e) {
            cancelled.set(true);
            emitter.complete();
            throw e;
        }
        return emitter;
    }

    /**
     * POST /api/reviews/{id}/review — Single-pass review of the change set.
     */
    @PostMapping("/{id}/review")
    public ResponseEntity<ReviewReport> review(@PathVariable String id) {
        return ResponseEntity.ok(fastReview.review(id));
    }

    /**
     * POST /api/reviews/{id}/suggestions — Follow-up question suggestions.
     */
    @PostMapping("/{id}/suggestions")
    public ResponseEntity<Map<String, List<String>>> suggestions(@PathVariable String id,
                                                                 @RequestBody SuggestionsRequest request) {
        List<String> result = suggestions.suggest(id, request.conversation(), request.lastAnswer());
        return ResponseEntity.ok(Map.of("suggestions", result));
    }
}
