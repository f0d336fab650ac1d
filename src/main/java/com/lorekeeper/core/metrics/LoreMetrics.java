package com.lorekeeper.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for dispatch and curation.
 */
@Service
public class LoreMetrics {

    private final MeterRegistry registry;

    public LoreMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordDispatch(String role, String state, long ms) {
        Timer.builder("lorekeeper.dispatch.duration")
                .tag("role", role)
                .tag("state", state)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordDispatchDepth(int depth) {
        DistributionSummary.builder("lorekeeper.dispatch.depth")
                .register(registry)
                .record(depth);
    }

    /**
     * Records a dispatch declined before invocation.
     *
     * @param reason "depth_exceeded", "cycle" or "unknown_tool"
     */
    public void recordDeclined(String reason) {
        Counter.builder("lorekeeper.dispatch.declined")
                .description("Dispatch requests declined before any inference call")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * @param outcome "promoted", "dismissed", "disputed" or "pending"
     */
    public void recordCuration(String outcome, int count) {
        if (count <= 0) return;
        Counter.builder("lorekeeper.curator.outcomes")
                .tag("outcome", outcome)
                .register(registry)
                .increment(count);
    }

    /**
     * Records a conditional canon write that lost to a concurrent writer and was re-checked.
     */
    public void recordCanonRetry() {
        Counter.builder("lorekeeper.canon.cas_retries")
                .description("Canon promotions retried after a version conflict")
                .register(registry)
                .increment();
    }

    public void recordSession(String status) {
        Counter.builder("lorekeeper.sessions.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }
}
