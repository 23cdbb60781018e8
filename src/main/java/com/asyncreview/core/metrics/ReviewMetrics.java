package com.asyncreview.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for question runs, snapshots and providers.
 */
@Service
public class ReviewMetrics {

    private final MeterRegistry registry;

    public ReviewMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordLoopDuration(String kind, long ms) {
        Timer.builder("asyncreview.loop.duration")
                .tag("kind", kind)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordIterationDepth(int depth) {
        DistributionSummary.builder("asyncreview.loop.iterations")
                .register(registry)
                .record(depth);
    }

    /**
     * @param outcome "done", "exhausted", "failed" or "cancelled"
     */
    public void recordOutcome(String outcome) {
        Counter.builder("asyncreview.loop.outcomes")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void incrementSandboxErrors() {
        Counter.builder("asyncreview.sandbox.errors")
                .description("Sandbox executions that failed and were fed back as observations")
                .register(registry)
                .increment();
    }

    public void recordSnapshot(int files, long bytes) {
        DistributionSummary.builder("asyncreview.snapshot.files")
                .register(registry)
                .record(files);
        DistributionSummary.builder("asyncreview.snapshot.bytes")
                .baseUnit("bytes")
                .register(registry)
                .record(bytes);
    }

    public void recordProviderLoad(String provider, boolean success) {
        Counter.builder("asyncreview.provider.loads")
                .tag("provider", provider)
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
    }

    public void recordDroppedCitations(int count) {
        Counter.builder("asyncreview.citations.dropped")
                .description("Citations rejected because they point outside the rendered context")
                .register(registry)
                .increment(count);
    }
}
