package com.llmcat.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class AggregationMetricsTest {

    private SimpleMeterRegistry registry;
    private AggregationMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new AggregationMetrics(registry);
    }

    @Test
    void recordRunDuration() {
        metrics.recordRunDuration(250);
        var timer = registry.find("llmcat.run.duration").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
        assertEquals(250.0, timer.totalTime(TimeUnit.MILLISECONDS), 1.0);
    }

    @Test
    void recordTaskTagsKindAndOutcome() {
        metrics.recordTask("file", true);
        metrics.recordTask("file", true);
        metrics.recordTask("url", false);

        assertEquals(2.0, registry.find("llmcat.tasks.total")
                .tag("kind", "file").tag("outcome", "ok").counter().count());
        assertEquals(1.0, registry.find("llmcat.tasks.total")
                .tag("kind", "url").tag("outcome", "error").counter().count());
    }

    @Test
    void recordTokensAndWorkers() {
        metrics.recordTokens(1200);
        metrics.recordWorkers(4);

        assertEquals(1200.0, registry.find("llmcat.tokens.total").summary().totalAmount());
        assertEquals(4.0, registry.find("llmcat.workers.spawned").summary().totalAmount());
    }
}
