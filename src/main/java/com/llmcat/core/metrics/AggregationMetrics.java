package com.llmcat.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for aggregation runs.
 */
@Service
public class AggregationMetrics {

    private final MeterRegistry registry;

    public AggregationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRunDuration(long ms) {
        Timer.builder("llmcat.run.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records one processed task.
     *
     * @param kind    "file" or "url"
     * @param success whether content was read or fetched
     */
    public void recordTask(String kind, boolean success) {
        Counter.builder("llmcat.tasks.total")
                .tag("kind", kind)
                .tag("outcome", success ? "ok" : "error")
                .register(registry)
                .increment();
    }

    public void recordTokens(long tokens) {
        DistributionSummary.builder("llmcat.tokens.total")
                .description("Tokens counted per run")
                .register(registry)
                .record(tokens);
    }

    /**
     * @param workers threads spawned for a run, 0 when tasks ran on the calling thread
     */
    public void recordWorkers(int workers) {
        DistributionSummary.builder("llmcat.workers.spawned")
                .description("Worker threads spawned per run")
                .register(registry)
                .record(workers);
    }
}
