package com.asyncreview.dispatch.cli;

import com.asyncreview.core.AsyncReviewException;
import com.asyncreview.core.engine.IterationListener;
import com.asyncreview.core.review.CodebaseAnswer;
import com.asyncreview.core.review.CodebaseQuestionService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.List;

/**
 * CLI command: asyncreview ask &lt;repo&gt; "&lt;question&gt;"
 * <p>
 * Snapshots the repository, runs one question through the reasoning loop and prints
 * each step followed by the answer and its sources.
 */
@Command(name = "ask", mixinStandardHelpOptions = true, description = "Ask one question about a local repository")
@Component
public class AskCommand implements Runnable {

    @Parameters(index = "0", description = "Repository directory")
    private Path repo;

    @Parameters(index = "1", description = "Natural language question")
    private String question;

    @Option(names = {"--quiet", "-q"}, description = "Only print the final answer")
    private boolean quiet;

    private final CodebaseQuestionService questionService;

    public AskCommand(CodebaseQuestionService questionService) {
        this.questionService = questionService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Scanning " + repo.toAbsolutePath().normalize() + "...");
        long start = System.currentTimeMillis();

        IterationListener listener = quiet ? IterationListener.NONE : ConsoleOutput::iteration;
        CodebaseAnswer answer;
        try {
            answer = questionService.ask(repo, question, List.of(), listener);
        } catch (AsyncReviewException e) {
            ConsoleOutput.error(AsyncReviewCommand.rootCauseMessage(e));
            return;
        }

        ConsoleOutput.answer(answer.blocks());
        ConsoleOutput.sources(answer.sources());
        if (answer.exhausted()) {
            ConsoleOutput.warn("Step budget ran out; the answer was extracted from the exploration so far.");
        }
        ConsoleOutput.success("Done in " + ConsoleOutput.formatDuration(System.currentTimeMillis() - start)
                + " (" + answer.iterations().size() + " steps)");
    }
}
