package com.asyncreview.dispatch.api;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded worker pool for streamed questions. A full queue rejects new streams.
 */
@Configuration
public class QuestionStreamConfig {

    public static final String EXECUTOR = "questionStreamExecutor";

    @Bean(name = EXECUTOR)
    public ThreadPoolTaskExecutor questionStreamExecutor(
            @Value("${asyncreview.stream.max-concurrent:8}") int maxConcurrent,
            @Value("${asyncreview.stream.queue-capacity:32}") int queueCapacity) {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(maxConcurrent);
        executor.setMaxPoolSize(maxConcurrent);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("question-stream-");
        executor.setDaemon(true);
        executor.initialize();
        return executor;
    }
}
