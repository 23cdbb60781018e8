package com.asyncreview.core.engine;

import com.asyncreview.core.config.AsyncReviewProperties;
import com.asyncreview.core.llm.ModelAction;
import com.asyncreview.core.llm.ModelInvocationException;
import com.asyncreview.core.llm.PromptState;
import com.asyncreview.core.llm.ReasoningModel;
import com.asyncreview.core.logging.MdcContext;
import com.asyncreview.core.metrics.ReviewMetrics;
import com.asyncreview.core.model.IterationRecord;
import com.asyncreview.core.trace.Trace;
import com.asyncreview.core.trace.TraceRecorder;
import com.asyncreview.sandbox.ExecutionResult;
import com.asyncreview.sandbox.ExecutionSandbox;
import com.asyncreview.sandbox.SandboxExecutionException;
import com.asyncreview.sandbox.SandboxSession;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Drives one question through the bounded reason → execute → observe cycle.
 * <p>
 * Each round asks the {@link ReasoningModel} for reasoning and code, runs the code in a
 * {@link SandboxSession}, and feeds the (truncated) output back as history. A round whose
 * code calls {@code SUBMIT(...)} ends the run. When the iteration cap or the model-call
 * budget runs out first, one fallback extraction produces the answer instead; one call of
 * the budget is always held back for it.
 * <p>
 * Sandbox failures become {@code [Error] ...} observations. Model failures and timeouts
 * end the run with a {@link ModelInvocationException} after the trace is persisted.
 */
@Service
public class ReasoningLoop {

    private static final Logger log = LoggerFactory.getLogger(ReasoningLoop.class);

    static final String CANCELLED = "cancelled";

    private final ReasoningModel model;
    private final ExecutionSandbox sandbox;
    private final TraceRecorder traceRecorder;
    private final ReviewMetrics metrics;
    private final AsyncReviewProperties.Loop config;
    private final ExecutorService modelExecutor;

    public ReasoningLoop(ReasoningModel model,
                         ExecutionSandbox sandbox,
                         TraceRecorder traceRecorder,
                         ReviewMetrics metrics,
                         AsyncReviewProperties properties) {
        this.model = model;
        this.sandbox = sandbox;
        this.traceRecorder = traceRecorder;
        this.metrics = metrics;
        this.config = properties.getLoop();
        var counter = new AtomicInteger();
        this.modelExecutor = Executors.newCachedThreadPool(r -> {
            var t = new Thread(r, "model-call-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    public void shutdown() {
        modelExecutor.shutdownNow();
    }

    /** Runs to completion with no listener and no cancellation. */
    public LoopOutcome run(LoopRequest request) {
        return run(request, IterationListener.NONE, () -> false);
    }

    /**
     * Runs the loop to a terminal state.
     *
     * @param request      inputs, side channels and output fields of the run
     * @param listener     notified after every round
     * @param cancellation polled before every round; once {@code true} no new round starts
     * @return the outcome; exactly one answer unless cancelled
     * @throws ModelInvocationException if a model call fails or times out
     */
    public LoopOutcome run(LoopRequest request, IterationListener listener, BooleanSupplier cancellation) {
        var run = new Run(request, listener, cancellation);
        long start = System.currentTimeMillis();
        LoopState state = LoopState.INIT;
        try {
            while (state != LoopState.TERMINATED) {
                state = transition(state, run);
            }
            metrics.recordOutcome(run.cancelled ? "cancelled" : run.exhausted ? "exhausted" : "done");
            metrics.recordIterationDepth(run.history.size());
            log.info("Run {} finished after {} rounds, {} model calls{}", run.trace.getId(),
                    run.history.size(), run.llmCalls, run.exhausted ? " (fallback)" : "");
            return run.outcome();
        } catch (RuntimeException e) {
            metrics.recordOutcome("failed");
            if (run.trace != null) {
                traceRecorder.fail(run.trace, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
                traceRecorder.persist(run.trace);
            }
            log.error("Run failed after {} rounds: {}", run.history.size(), e.getMessage());
            throw e;
        } finally {
            if (run.session != null) {
                run.session.close();
            }
            metrics.recordLoopDuration(request.kind(), System.currentTimeMillis() - start);
            MdcContext.clear();
        }
    }

    /** The single transition function of the run. */
    LoopState transition(LoopState state, Run run) {
        return switch (state) {
            case INIT -> init(run);
            case ITERATING -> iterate(run);
            case DONE -> finish(run);
            case EXHAUSTED -> fallback(run);
            case TERMINATED -> LoopState.TERMINATED;
        };
    }

    private LoopState init(Run run) {
        run.trace = traceRecorder.start(run.request.question(), run.request.sessionRef());
        MdcContext.setRun(run.request.sessionRef(), run.trace.getId());
        log.info("Run {} started (max {} iterations, {} model calls)",
                run.trace.getId(), config.getMaxIterations(), config.getMaxLlmCalls());
        try {
            run.session = sandbox.openSession(run.trace.getId());
        } catch (SandboxExecutionException e) {
            log.warn("Sandbox unavailable for run {}: {}", run.trace.getId(), e.getMessage());
            run.sandboxError = e.getMessage();
        }
        return LoopState.ITERATING;
    }

    private LoopState iterate(Run run) {
        if (run.cancellation.getAsBoolean()) {
            return cancel(run);
        }
        int maxIterations = config.getMaxIterations();
        int roundBudget = Math.max(1, config.getMaxLlmCalls()) - 1;
        if (run.history.size() >= maxIterations || run.llmCalls >= roundBudget) {
            log.info("Run {} out of budget after {} rounds", run.trace.getId(), run.history.size());
            return LoopState.EXHAUSTED;
        }

        int index = run.history.size() + 1;
        MdcContext.setIteration(index);
        ModelAction action = callModel(() -> model.generate(run.promptState(index, maxIterations)));
        run.llmCalls++;
        if (action == null) {
            throw new ModelInvocationException("Model returned no action for round " + index);
        }

        String code = action.executableCode();
        String output;
        Map<String, Object> submitted = null;
        try {
            ExecutionResult result = execute(run, code);
            output = result.output();
            submitted = result.submitted();
        } catch (SandboxExecutionException e) {
            log.warn("Round {} execution failed: {}", index, firstLine(e.getMessage()));
            metrics.incrementSandboxErrors();
            output = "[Error] " + e.getMessage();
        }

        var artifacts = new LinkedHashMap<String, Object>();
        if (submitted != null) {
            artifacts.put("submitted", submitted);
        }
        var record = new IterationRecord(index, maxIterations, action.reasoning(), code,
                truncate(output, config.getMaxOutputChars()), artifacts);
        run.history.add(record);
        traceRecorder.append(run.trace, record);
        run.listener.onIteration(record);

        if (submitted != null) {
            run.outputs = submitted;
            return LoopState.DONE;
        }
        return LoopState.ITERATING;
    }

    private LoopState fallback(Run run) {
        if (run.cancellation.getAsBoolean()) {
            return cancel(run);
        }
        run.exhausted = true;
        Map<String, Object> extracted = callModel(() -> model.extractFallback(
                run.promptState(run.history.size(), config.getMaxIterations())));
        run.llmCalls++;
        run.outputs = extracted == null ? Map.of() : extracted;
        return finish(run);
    }

    private LoopState finish(Run run) {
        Object answer = run.outputs.get("answer");
        run.answer = answer == null ? "" : answer.toString();
        run.references = run.outputs.get(run.request.referencesField());
        traceRecorder.complete(run.trace, run.answer, referenceStrings(run.references));
        traceRecorder.persist(run.trace);
        return LoopState.TERMINATED;
    }

    private LoopState cancel(Run run) {
        log.info("Run {} cancelled after {} rounds", run.trace.getId(), run.history.size());
        run.cancelled = true;
        run.answer = "";
        traceRecorder.fail(run.trace, CANCELLED);
        traceRecorder.persist(run.trace);
        return LoopState.TERMINATED;
    }

    private ExecutionResult execute(Run run, String code) throws SandboxExecutionException {
        if (run.session == null) {
            throw new SandboxExecutionException("Sandbox unavailable: " + run.sandboxError);
        }
        var variables = new LinkedHashMap<String, Object>(run.request.inputs());
        variables.putAll(run.request.sideChannels());
        return run.session.execute(code, variables);
    }

    /**
     * Runs a model call under the configured timeout. Every failure surfaces as a
     * {@link ModelInvocationException}.
     */
    private <T> T callModel(Supplier<T> call) {
        Duration timeout = config.getModelTimeout();
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Future<T> future = modelExecutor.submit(() -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                return call.get();
            } finally {
                MDC.clear();
            }
        });
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ModelInvocationException("Model call timed out after " + timeout.toSeconds() + "s", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ModelInvocationException mie) {
                throw mie;
            }
            throw new ModelInvocationException("Model call failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new ModelInvocationException("Interrupted while waiting for the model", e);
        }
    }

    static String truncate(String text, int max) {
        if (text == null) {
            return "";
        }
        return text.length() <= max ? text : text.substring(0, max);
    }

    private static String firstLine(String text) {
        if (text == null) {
            return "";
        }
        int nl = text.indexOf('\n');
        return nl < 0 ? text : text.substring(0, nl);
    }

    static List<String> referenceStrings(Object references) {
        if (references == null) {
            return List.of();
        }
        if (references instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return Arrays.stream(references.toString().split(","))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    /** Mutable state of one run, owned by the thread calling {@link #run}. */
    static final class Run {
        final LoopRequest request;
        final IterationListener listener;
        final BooleanSupplier cancellation;
        final List<IterationRecord> history = new ArrayList<>();
        Trace trace;
        SandboxSession session;
        String sandboxError;
        int llmCalls;
        Map<String, Object> outputs = Map.of();
        String answer = "";
        Object references;
        boolean exhausted;
        boolean cancelled;

        Run(LoopRequest request, IterationListener listener, BooleanSupplier cancellation) {
            this.request = request;
            this.listener = listener;
            this.cancellation = cancellation;
        }

        PromptState promptState(int iteration, int maxIterations) {
            return new PromptState(
                    request.task(),
                    request.inputs(),
                    new ArrayList<>(request.sideChannels().keySet()),
                    request.outputFields(),
                    history,
                    iteration,
                    maxIterations);
        }

        LoopOutcome outcome() {
            return new LoopOutcome(answer, references, outputs, history, exhausted, cancelled, llmCalls, trace);
        }
    }
}
