package com.asyncreview.core.llm;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Reusable service that wraps Spring AI's {@link ChatClient} to produce
 * structured (typed) output from LLM calls.
 * <p>
 * Uses {@link BeanOutputConverter} to generate a JSON schema from the target
 * Java class, append format instructions to the user prompt, and deserialize
 * the LLM's JSON response into the requested type. Calls go to the main model
 * unless a {@link ModelTier} is given, and each one is abandoned after
 * {@code asyncreview.llm.call-timeout}.
 */
@Service
public class LlmService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    /** Which configured model a call is routed to. */
    public enum ModelTier { MAIN, SUB }

    private final ChatClient chatClient;
    private final LlmProperties properties;
    private final ExecutorService callExecutor;

    public LlmService(ChatClient.Builder builder,
                      LlmProperties properties,
                      @Value("${spring.ai.openai.base-url:NOT_SET}") String baseUrl) {
        this.chatClient = builder.build();
        this.properties = properties;
        var counter = new AtomicInteger();
        this.callExecutor = Executors.newCachedThreadPool(r -> {
            var t = new Thread(r, "llm-call-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        log.info("LlmService initialized, base-url: {}, main model: {}, sub model: {}, timeout: {}s",
                baseUrl, properties.getMainModel(), properties.getSubModel(),
                properties.getCallTimeout().toSeconds());
    }

    @PreDestroy
    public void shutdown() {
        callExecutor.shutdownNow();
    }

    public <T> T structuredCall(String systemPrompt, String userPrompt, Class<T> outputType) {
        return structuredCall(ModelTier.MAIN, systemPrompt, userPrompt, outputType);
    }

    /**
     * Sends a system + user prompt to the LLM and returns the response
     * deserialized into the given {@code outputType}.
     *
     * @param tier         which configured model to call
     * @param systemPrompt instructions for the LLM's role / behaviour
     * @param userPrompt   the request text
     * @param outputType   the Java class (record or POJO) to deserialize into
     * @param <T>          target type
     * @return an instance of {@code T} populated from the LLM's JSON response
     * @throws LlmEmptyResponseException if the model returned no content
     * @throws LlmParseException         if the content cannot be parsed
     * @throws ModelInvocationException  if the call fails or exceeds the call timeout
     */
    public <T> T structuredCall(ModelTier tier, String systemPrompt, String userPrompt, Class<T> outputType) {
        String model = tier == ModelTier.SUB ? properties.getSubModel() : properties.getMainModel();
        log.info("LLM call started → {} on {}", outputType.getSimpleName(), model);
        long start = System.currentTimeMillis();
        var converter = new BeanOutputConverter<>(outputType);
        String response = withTimeout(model, () -> chatClient.prompt()
                .options(ChatOptions.builder().model(model).build())
                .system(systemPrompt)
                .user(userPrompt + "\n\n" + converter.getFormat())
                .call()
                .content());
        long elapsed = System.currentTimeMillis() - start;
        log.info("LLM call complete → {} ({}s)", outputType.getSimpleName(), String.format("%.1f", elapsed / 1000.0));
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("LLM returned empty content for " + outputType.getSimpleName()
                    + ". Check that the model is reachable and supports structured JSON output.");
        }
        try {
            return converter.convert(response);
        } catch (Exception e) {
            log.warn("Failed to parse LLM response to {}: {}", outputType.getSimpleName(), e.getMessage());
            log.debug("Raw LLM response: {}", response);
            return parseWithJackson(response, outputType);
        }
    }

    private String withTimeout(String model, Supplier<String> call) {
        Duration timeout = properties.getCallTimeout();
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Future<String> future = callExecutor.submit(() -> {
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
            throw new ModelInvocationException("LLM call to " + model + " timed out after "
                    + timeout.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            throw new ModelInvocationException("LLM call to " + model + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new ModelInvocationException("Interrupted while waiting for " + model, e);
        }
    }

    /**
     * Fallback JSON parsing using Jackson ObjectMapper with lenient settings.
     */
    <T> T parseWithJackson(String json, Class<T> outputType) {
        try {
            var mapper = new ObjectMapper();
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            mapper.configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true);
            mapper.configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);
            mapper.registerModule(new ParameterNamesModule());

            String cleaned = json.trim();
            if (cleaned.startsWith("```json")) {
                cleaned = cleaned.substring(7);
            } else if (cleaned.startsWith("```")) {
                cleaned = cleaned.substring(3);
            }
            if (cleaned.endsWith("```")) {
                cleaned = cleaned.substring(0, cleaned.length() - 3);
            }
            cleaned = cleaned.trim();

            T result = mapper.readValue(cleaned, outputType);
            log.info("Jackson fallback parsing succeeded for {}", outputType.getSimpleName());
            return result;
        } catch (Exception e2) {
            log.error("Jackson fallback parsing FAILED for {}: {}", outputType.getSimpleName(), e2.getMessage());
            throw new LlmParseException("Failed to parse LLM response to " + outputType.getSimpleName()
                    + ": " + e2.getMessage(), e2);
        }
    }
}
