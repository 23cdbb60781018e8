package com.asyncreview.sandbox;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LocalProcessSandboxTest {

    @TempDir
    Path workRoot;

    private LocalProcessSandbox sandbox(String pythonCommand) {
        var properties = new SandboxProperties();
        properties.setWorkRoot(workRoot.toString());
        properties.setPythonCommand(pythonCommand);
        return new LocalProcessSandbox(properties);
    }

    @Test
    void openSessionPreparesWorkspaceAndCloseRemovesIt() throws Exception {
        SandboxSession session = sandbox("python3").openSession("local1");
        Path dir;
        try (var entries = Files.list(workRoot)) {
            dir = entries.findFirst().orElseThrow();
        }
        assertTrue(Files.exists(dir.resolve(RunnerWorkspace.RUNNER)));

        session.close();

        assertFalse(Files.exists(dir));
    }

    @Test
    void missingInterpreterIsAnExecutionError() {
        try (SandboxSession session = sandbox("asyncreview-no-such-python").openSession("local2")) {
            var e = assertThrows(SandboxExecutionException.class,
                    () -> session.execute("print(1)", Map.of()));
            assertTrue(e.getMessage().startsWith("Failed to run asyncreview-no-such-python"));
        }
    }
}
