package com.asyncreview.core.review;

import com.asyncreview.core.answer.CitationParser;
import com.asyncreview.core.answer.DiffGrounding;
import com.asyncreview.core.config.AsyncReviewProperties;
import com.asyncreview.core.diff.DiffContext;
import com.asyncreview.core.diff.PatchContextAssembler;
import com.asyncreview.core.llm.LlmParseException;
import com.asyncreview.core.llm.LlmService;
import com.asyncreview.core.llm.LlmService.ModelTier;
import com.asyncreview.core.metrics.ReviewMetrics;
import com.asyncreview.core.model.ChangeSet;
import com.asyncreview.core.model.ChangedFile;
import com.asyncreview.core.model.Citation;
import com.asyncreview.core.model.DiffFileContext;
import com.asyncreview.core.model.ReviewIssue;
import com.asyncreview.core.model.ReviewReport;
import com.asyncreview.core.session.ReviewSessionService;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Single-pass review of a change set: one structured call on the sub model over the raw
 * patches, no execution loop. Issue citations are kept only when they fall inside the
 * hunks that were shown.
 */
@Service
public class FastReviewService {

    private static final Logger log = LoggerFactory.getLogger(FastReviewService.class);

    static final String SYSTEM_PROMPT = """
            You are a senior code reviewer. Analyze the provided diffs and pull request info.
            Identify key issues such as potential bugs (high confidence logic or security errors),
            investigation items (potential issues requiring confirmation), or style and best-practice
            notes (informational).

            Each issue has:
            - title
            - severity: 'low', 'medium', 'high' or 'critical'
            - category: 'bug', 'investigation' or 'informational'
            - explanation: markdown, at least 2-3 sentences of context on why this is an issue
            - citations: strings in the format 'path:start_line-end_line'
            - fixSuggestions and testsToAdd: optional lists of strings

            DIFF-BOUNDED CITATIONS ONLY.
            You may only cite line numbers that are visible in the diff context: lines starting with
            '+', '-' or ' ' inside a hunk that was shown to you. Never cite lines outside the visible
            hunks, never infer original file line numbers and never cite ranges a hunk skips over.
            If a problem exists in code that is not visible in a hunk, explain it in plain text and
            return an empty citations list for that issue.

            Also write a concise summary of the changes.
            """;

    static final String DEFAULT_TITLE = "Review Note";
    static final String DEFAULT_SEVERITY = "medium";
    static final String DEFAULT_CATEGORY = "informational";

    /** Structured output of the review call. */
    record ReviewResponse(
        @JsonPropertyDescription("Issues found in the changes")
        List<IssueResponse> issues,
        @JsonPropertyDescription("Concise summary of the changes")
        String summary
    ) {}

    record IssueResponse(
        String title,
        @JsonPropertyDescription("One of low, medium, high, critical")
        String severity,
        @JsonPropertyDescription("One of bug, investigation, informational")
        String category,
        String explanation,
        @JsonPropertyDescription("Cited diff lines, each as 'path:start-end'")
        List<String> citations,
        List<String> fixSuggestions,
        List<String> testsToAdd
    ) {}

    private final ReviewSessionService sessions;
    private final PatchContextAssembler assembler;
    private final LlmService llmService;
    private final ReviewMetrics metrics;
    private final int fileLimit;

    public FastReviewService(ReviewSessionService sessions,
                             PatchContextAssembler assembler,
                             LlmService llmService,
                             ReviewMetrics metrics,
                             AsyncReviewProperties properties) {
        this.sessions = sessions;
        this.assembler = assembler;
        this.llmService = llmService;
        this.metrics = metrics;
        this.fileLimit = properties.getDiff().getReviewFileLimit();
    }

    /**
     * Reviews a loaded session.
     *
     * @return the issues found; an empty report when the model output cannot be parsed
     * @throws com.asyncreview.core.session.SessionNotFoundException if the session is unknown
     */
    public ReviewReport review(String sessionId) {
        ChangeSet changeSet = sessions.require(sessionId);
        List<DiffFileContext> files = changeSet.files().stream()
                .limit(fileLimit)
                .map(FastReviewService::toContext)
                .toList();
        DiffContext context = assembler.assemble(files);
        String user = "## Pull Request\n" + changeSet.describe() + "\n\n## Diff Context\n" + context.text();

        ReviewResponse response;
        try {
            response = llmService.structuredCall(ModelTier.SUB, SYSTEM_PROMPT, user, ReviewResponse.class);
        } catch (LlmParseException e) {
            log.error("Review output for session {} could not be parsed: {}", sessionId, e.getMessage());
            return new ReviewReport(List.of(), "");
        }

        var issues = new ArrayList<ReviewIssue>();
        int dropped = 0;
        if (response.issues() != null) {
            for (IssueResponse item : response.issues()) {
                if (item == null) {
                    continue;
                }
                List<Citation> cited = CitationParser.parse(item.citations());
                List<Citation> grounded = DiffGrounding.filter(cited, context.visibleLines());
                dropped += cited.size() - grounded.size();
                issues.add(new ReviewIssue(
                        orDefault(item.title(), DEFAULT_TITLE),
                        orDefault(item.severity(), DEFAULT_SEVERITY),
                        orDefault(item.category(), DEFAULT_CATEGORY),
                        item.explanation() == null ? "" : item.explanation(),
                        grounded,
                        item.fixSuggestions(),
                        item.testsToAdd()));
            }
        }
        if (dropped > 0) {
            metrics.recordDroppedCitations(dropped);
        }
        log.info("Review of session {} found {} issues across {} files", sessionId, issues.size(), files.size());
        return new ReviewReport(issues, response.summary() == null ? "" : response.summary());
    }

    private static DiffFileContext toContext(ChangedFile f) {
        return DiffFileContext.ofPatch(f.path(), f.status(), f.additions(), f.deletions(), f.patch());
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
