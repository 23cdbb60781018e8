package com.asyncreview.sandbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * {@link ExecutionSandbox} that runs the Python runner as a local child process.
 * No isolation beyond a private working directory; meant for machines without Docker.
 */
public class LocalProcessSandbox implements ExecutionSandbox {

    private static final Logger log = LoggerFactory.getLogger(LocalProcessSandbox.class);

    private final SandboxProperties properties;

    public LocalProcessSandbox(SandboxProperties properties) {
        this.properties = properties;
    }

    @Override
    public SandboxSession openSession(String runId) {
        var workspace = RunnerWorkspace.create(Path.of(properties.getWorkRoot()), runId);
        log.info("Opened local sandbox session {} (workspace {})", runId, workspace.dir());
        return new ProcessSession(workspace);
    }

    private final class ProcessSession implements SandboxSession {

        private final RunnerWorkspace workspace;

        ProcessSession(RunnerWorkspace workspace) {
            this.workspace = workspace;
        }

        @Override
        public ExecutionResult execute(String code, Map<String, Object> variables) throws SandboxExecutionException {
            workspace.prepareCell(code, variables);
            Path dir = workspace.dir();
            List<String> command = List.of(
                    properties.getPythonCommand(), dir.resolve(RunnerWorkspace.RUNNER).toString(), dir.toString());
            try {
                Process process = new ProcessBuilder(command)
                        .directory(dir.toFile())
                        .redirectErrorStream(true)
                        .redirectOutput(dir.resolve("output.txt").toFile())
                        .start();
                if (!process.waitFor(properties.getTimeoutSeconds(), TimeUnit.SECONDS)) {
                    process.destroyForcibly();
                    throw new SandboxExecutionException("Cell timed out after " + properties.getTimeoutSeconds() + "s");
                }
                String output = Files.readString(dir.resolve("output.txt"), StandardCharsets.UTF_8);
                if (process.exitValue() != 0) {
                    throw new SandboxExecutionException(output.isBlank() ? "Cell exited with status " + process.exitValue() : output.strip());
                }
                return new ExecutionResult(output, workspace.readSubmission());
            } catch (IOException e) {
                throw new SandboxExecutionException("Failed to run " + properties.getPythonCommand() + ": " + e.getMessage(), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SandboxExecutionException("Interrupted while running cell", e);
            }
        }

        @Override
        public void close() {
            workspace.delete();
        }
    }
}
