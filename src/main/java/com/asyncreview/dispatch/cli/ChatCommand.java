package com.asyncreview.dispatch.cli;

import com.asyncreview.core.AsyncReviewException;
import com.asyncreview.core.model.ConversationTurn;
import com.asyncreview.core.model.Snapshot;
import com.asyncreview.core.review.CodebaseAnswer;
import com.asyncreview.core.review.CodebaseQuestionService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * CLI command: asyncreview chat &lt;repo&gt;
 * <p>
 * Interactive session over one snapshot. Prior turns are passed with each question.
 * A failed question prints an error and the session continues.
 */
@Command(name = "chat", mixinStandardHelpOptions = true, description = "Interactive Q&A over a local repository")
@Component
public class ChatCommand implements Runnable {

    static final String HELP = """
            Commands:
              quit, exit  leave the session
              help        show this help
              reset       forget the conversation so far
              history     show the conversation so far
              files       list the files in the snapshot
              info        show snapshot statistics
            Anything else is asked as a question.""";

    @Parameters(index = "0", description = "Repository directory")
    private Path repo;

    private final CodebaseQuestionService questionService;

    public ChatCommand(CodebaseQuestionService questionService) {
        this.questionService = questionService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        Snapshot snapshot;
        try {
            snapshot = questionService.snapshot(repo);
        } catch (AsyncReviewException e) {
            ConsoleOutput.error(AsyncReviewCommand.rootCauseMessage(e));
            return;
        }
        ConsoleOutput.info("Loaded " + snapshot.totalFiles() + " files from " + snapshot.root()
                + ". Type 'help' for commands.");
        try {
            session(snapshot, new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Reads commands and questions until {@code quit} or end of input.
     *
     * @return the conversation as it stood when the session ended
     */
    List<ConversationTurn> session(Snapshot snapshot, BufferedReader in) throws IOException {
        var history = new ArrayList<ConversationTurn>();
        while (true) {
            System.out.print("> ");
            System.out.flush();
            String line = in.readLine();
            if (line == null) {
                return history;
            }
            String input = line.strip();
            if (input.isEmpty()) {
                continue;
            }
            switch (input.toLowerCase(Locale.ROOT)) {
                case "quit", "exit" -> {
                    return history;
                }
                case "help" -> System.out.println(HELP);
                case "reset" -> {
                    history.clear();
                    ConsoleOutput.info("Conversation cleared.");
                }
                case "history" -> printHistory(history);
                case "files" -> snapshot.files().keySet().forEach(path -> System.out.println("  " + path));
                case "info" -> printInfo(snapshot);
                default -> ask(snapshot, input, history);
            }
        }
    }

    private void ask(Snapshot snapshot, String question, List<ConversationTurn> history) {
        try {
            CodebaseAnswer answer = questionService.ask(snapshot, question, List.copyOf(history),
                    ConsoleOutput::iteration);
            ConsoleOutput.answer(answer.blocks());
            ConsoleOutput.sources(answer.sources());
            history.add(ConversationTurn.user(question));
            history.add(ConversationTurn.assistant(answer.answer()));
        } catch (AsyncReviewException e) {
            ConsoleOutput.error(AsyncReviewCommand.rootCauseMessage(e));
        }
    }

    private static void printHistory(List<ConversationTurn> history) {
        if (history.isEmpty()) {
            ConsoleOutput.info("No conversation yet.");
            return;
        }
        for (ConversationTurn turn : history) {
            System.out.println(turn.role() + ": " + ConsoleOutput.firstLine(turn.content()));
        }
    }

    private static void printInfo(Snapshot snapshot) {
        ConsoleOutput.info("Root: " + snapshot.root());
        ConsoleOutput.info("Files: " + snapshot.totalFiles() + " loaded of " + snapshot.fileTree().size()
                + " discovered, " + snapshot.totalBytes() + " bytes");
        for (Map.Entry<String, Integer> lang : snapshot.languages().entrySet()) {
            System.out.println("  " + lang.getKey() + ": " + lang.getValue());
        }
    }
}
