package com.asyncreview.sandbox;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;

/**
 * Host directory shared with the Python runner of one session.
 * <p>
 * Layout: {@code runner.py} (copied from the classpath), {@code cell.py} and
 * {@code vars.json} written before each cell, {@code submit.json} written by
 * {@code SUBMIT(...)}, and {@code state.pkl} holding globals between cells.
 */
final class RunnerWorkspace {

    private static final Logger log = LoggerFactory.getLogger(RunnerWorkspace.class);

    static final String RUNNER_RESOURCE = "/sandbox/runner.py";
    static final String RUNNER = "runner.py";

    private final Path dir;
    private final ObjectMapper objectMapper = new ObjectMapper();

    private RunnerWorkspace(Path dir) {
        this.dir = dir;
    }

    static RunnerWorkspace create(Path workRoot, String runId) {
        try {
            Files.createDirectories(workRoot);
            Path dir = Files.createTempDirectory(workRoot, "asyncreview-" + runId + "-");
            try (InputStream runner = RunnerWorkspace.class.getResourceAsStream(RUNNER_RESOURCE)) {
                if (runner == null) {
                    throw new SandboxExecutionException("Runner script missing from classpath: " + RUNNER_RESOURCE);
                }
                Files.copy(runner, dir.resolve(RUNNER), StandardCopyOption.REPLACE_EXISTING);
            }
            return new RunnerWorkspace(dir);
        } catch (IOException e) {
            throw new SandboxExecutionException("Failed to prepare sandbox workspace: " + e.getMessage(), e);
        }
    }

    Path dir() {
        return dir;
    }

    void prepareCell(String code, Map<String, Object> variables) throws SandboxExecutionException {
        try {
            Files.writeString(dir.resolve("cell.py"), code);
            objectMapper.writeValue(dir.resolve("vars.json").toFile(), variables);
            Files.deleteIfExists(dir.resolve("submit.json"));
        } catch (IOException e) {
            throw new SandboxExecutionException("Failed to write cell: " + e.getMessage(), e);
        }
    }

    /** Fields passed to {@code SUBMIT(...)} by the last cell, or {@code null}. */
    Map<String, Object> readSubmission() throws SandboxExecutionException {
        Path submit = dir.resolve("submit.json");
        if (!Files.exists(submit)) {
            return null;
        }
        try {
            return objectMapper.readValue(submit.toFile(), new TypeReference<Map<String, Object>>() {});
        } catch (IOException e) {
            throw new SandboxExecutionException("Unreadable SUBMIT payload: " + e.getMessage(), e);
        }
    }

    void delete() {
        try {
            FileSystemUtils.deleteRecursively(dir);
        } catch (IOException e) {
            log.warn("Failed to delete sandbox workspace {}: {}", dir, e.getMessage());
        }
    }
}
