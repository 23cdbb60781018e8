package com.asyncreview.sandbox;

import java.util.Map;

/**
 * A stateful code-execution session. Variables defined by one cell are visible to the next.
 */
public interface SandboxSession extends AutoCloseable {

    /**
     * Runs one cell with the given variables defined beforehand.
     *
     * @param code      Python source of the cell
     * @param variables values injected as globals (strings, lists, maps)
     * @return captured output and, if the cell called {@code SUBMIT}, the submitted fields
     * @throws SandboxExecutionException if the cell raised or could not be run
     */
    ExecutionResult execute(String code, Map<String, Object> variables) throws SandboxExecutionException;

    @Override
    void close();
}
