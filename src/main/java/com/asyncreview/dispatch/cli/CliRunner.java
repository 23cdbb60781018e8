package com.asyncreview.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

import java.util.Arrays;

/**
 * Runs the picocli command tree inside the Spring Boot lifecycle and reports its exit code.
 * In serve mode nothing is parsed; the embedded web server keeps the JVM alive.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    static final int EXIT_FAILURE = 1;

    private final AsyncReviewCommand rootCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(AsyncReviewCommand rootCommand, IFactory factory) {
        this.rootCommand = rootCommand;
        this.factory = factory;
    }

    public static boolean isServeMode(String... args) {
        return Arrays.asList(args).contains("serve");
    }

    /**
     * Command line with the AsyncReview error handling: an exception escaping a command
     * prints its root cause as one error line and exits with status 1.
     */
    static CommandLine commandLine(AsyncReviewCommand rootCommand, IFactory factory) {
        var commandLine = new CommandLine(rootCommand, factory);
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            ConsoleOutput.error(cmd.getCommandName() + " failed: " + AsyncReviewCommand.rootCauseMessage(ex));
            return EXIT_FAILURE;
        });
        return commandLine;
    }

    @Override
    public void run(String... args) {
        if (isServeMode(args)) {
            return;
        }
        exitCode = commandLine(rootCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
