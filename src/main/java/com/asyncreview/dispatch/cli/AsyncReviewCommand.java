package com.asyncreview.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for AsyncReview.
 * Routes to subcommands: ask, chat, review, serve.
 */
@Command(
        name = "asyncreview",
        mixinStandardHelpOptions = true,
        version = "AsyncReview 0.1.0",
        description = "Ask questions about codebases and pull requests",
        subcommands = {
                AskCommand.class,
                ChatCommand.class,
                ReviewCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class AsyncReviewCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }

    static String rootCauseMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
