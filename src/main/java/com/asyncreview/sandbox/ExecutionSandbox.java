package com.asyncreview.sandbox;

/**
 * Abstraction for isolated code execution.
 * Implementations: DockerPythonSandbox (default), LocalProcessSandbox (no container).
 */
public interface ExecutionSandbox {

    /**
     * Opens a session for one question run.
     *
     * @param runId identifier used to name the session's resources
     */
    SandboxSession openSession(String runId);
}
