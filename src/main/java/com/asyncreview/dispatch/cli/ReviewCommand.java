package com.asyncreview.dispatch.cli;

import com.asyncreview.core.AsyncReviewException;
import com.asyncreview.core.model.ChangeSet;
import com.asyncreview.core.model.ReviewIssue;
import com.asyncreview.core.model.ReviewReport;
import com.asyncreview.core.review.DiffAnswer;
import com.asyncreview.core.review.DiffQuestionService;
import com.asyncreview.core.review.FastReviewService;
import com.asyncreview.core.session.ReviewSessionService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * CLI command: asyncreview review &lt;url&gt;
 * <p>
 * Loads a pull/merge request and runs the single-pass review, or answers one
 * question about it when {@code --question} is given.
 */
@Command(name = "review", mixinStandardHelpOptions = true, description = "Review a GitHub pull request or GitLab merge request")
@Component
public class ReviewCommand implements Runnable {

    @Parameters(index = "0", description = "Pull request or merge request URL")
    private String url;

    @Option(names = {"--question", "-q"}, description = "Ask a question about the change instead of reviewing it")
    private String question;

    private final ReviewSessionService sessions;
    private final FastReviewService fastReview;
    private final DiffQuestionService diffQuestions;

    public ReviewCommand(ReviewSessionService sessions, FastReviewService fastReview,
                         DiffQuestionService diffQuestions) {
        this.sessions = sessions;
        this.fastReview = fastReview;
        this.diffQuestions = diffQuestions;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        try {
            ConsoleOutput.info("Loading " + url + "...");
            ChangeSet changeSet = sessions.load(url);
            ConsoleOutput.info(String.format("PR #%d: %s (%d files, +%d -%d)", changeSet.number(),
                    changeSet.title(), changeSet.changedFiles(), changeSet.additions(), changeSet.deletions()));

            if (question != null && !question.isBlank()) {
                DiffAnswer answer = diffQuestions.ask(changeSet.sessionId(), question, List.of(), null,
                        ConsoleOutput::iteration, () -> false);
                ConsoleOutput.answer(answer.blocks());
                ConsoleOutput.citations(answer.citations());
                return;
            }

            ReviewReport report = fastReview.review(changeSet.sessionId());
            if (!report.summary().isBlank()) {
                System.out.println(report.summary());
                System.out.println();
            }
            for (ReviewIssue issue : report.issues()) {
                ConsoleOutput.issue(issue);
            }
            ConsoleOutput.success(report.issues().size() + " issue" + (report.issues().size() != 1 ? "s" : "") + " found");
        } catch (AsyncReviewException e) {
            ConsoleOutput.error(AsyncReviewCommand.rootCauseMessage(e));
        }
    }
}
