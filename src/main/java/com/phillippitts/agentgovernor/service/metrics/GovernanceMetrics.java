package com.phillippitts.agentgovernor.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for governance decisions.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Penalties applied per level and removed per reason</li>
 *   <li>Appeals filed and reviewed per decision</li>
 *   <li>Event-bus publish failures per topic</li>
 *   <li>Throttle rejections and evaluation latency</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available under /actuator/metrics.
 */
@Component
public class GovernanceMetrics {

    private static final String METRIC_PREFIX = "agentgovernor";

    private final MeterRegistry registry;

    public GovernanceMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Increments the applied-penalty counter.
     *
     * @param level penalty level 1..6
     */
    public void incrementPenaltyApplied(int level) {
        Counter.builder(METRIC_PREFIX + ".penalty.applied")
                .description("Number of penalties applied")
                .tag("level", String.valueOf(level))
                .register(registry)
                .increment();
    }

    /**
     * Increments the removed-penalty counter.
     *
     * @param reason performance_improved, appeal_approved or expired
     */
    public void incrementPenaltyRemoved(String reason) {
        Counter.builder(METRIC_PREFIX + ".penalty.removed")
                .description("Number of penalties lifted")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementAppealFiled(boolean automatic) {
        Counter.builder(METRIC_PREFIX + ".appeal.filed")
                .description("Number of appeals filed")
                .tag("automatic", String.valueOf(automatic))
                .register(registry)
                .increment();
    }

    /**
     * @param decision approved or denied
     */
    public void incrementAppealReviewed(String decision) {
        Counter.builder(METRIC_PREFIX + ".appeal.reviewed")
                .description("Number of appeals reviewed")
                .tag("decision", decision)
                .register(registry)
                .increment();
    }

    public void incrementPublishFailure(String topic) {
        Counter.builder(METRIC_PREFIX + ".bus.publish.failure")
                .description("Number of event-bus messages that could not be delivered")
                .tag("topic", topic)
                .register(registry)
                .increment();
    }

    public void incrementThrottleRejection() {
        Counter.builder(METRIC_PREFIX + ".throttle.rejected")
                .description("Number of task admissions refused by a throttle")
                .register(registry)
                .increment();
    }

    /**
     * Records how long one agent evaluation took.
     *
     * @param outcome healthy, penalized or failed
     */
    public void recordEvaluation(String outcome, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".evaluation.latency")
                .description("Time taken to evaluate one agent")
                .tag("outcome", outcome)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }
}
