package com.phillippitts.agentgovernor.domain;

import java.util.Objects;

/**
 * Immutable snapshot of an agent's telemetry as supplied by the metrics source.
 *
 * <p>All ratios are in [0,1] except {@link ResourceUsage}, whose values are relative to the
 * agent's allocation (1.0 = fully used, above 1.0 = over-allocation).
 *
 * @param agentId                  agent the snapshot belongs to
 * @param errorRate                fraction of tasks that ended in an error
 * @param timeoutRate              fraction of tasks that timed out
 * @param successRate              fraction of tasks that succeeded
 * @param qualityScore             most recent aggregate quality score
 * @param baselineQuality          historical quality baseline
 * @param currentQuality           quality over the current evaluation window
 * @param collaborationSuccessRate fraction of successful collaborations
 * @param collaborationFailureRate fraction of failed collaborations
 * @param resourceUsage            usage ratios relative to allocation
 * @param taskCount                number of tasks in the evaluation window
 * @param avgResponseTime          average response time in milliseconds
 */
public record AgentMetrics(
        String agentId,
        double errorRate,
        double timeoutRate,
        double successRate,
        double qualityScore,
        double baselineQuality,
        double currentQuality,
        double collaborationSuccessRate,
        double collaborationFailureRate,
        ResourceUsage resourceUsage,
        int taskCount,
        double avgResponseTime
) {

    public AgentMetrics {
        Objects.requireNonNull(agentId, "agentId must not be null");
        if (taskCount < 0) {
            throw new IllegalArgumentException("taskCount must not be negative, got: " + taskCount);
        }
        if (resourceUsage == null) {
            resourceUsage = ResourceUsage.IDLE;
        }
    }

    /**
     * Relative quality drop against the baseline; 0 when no baseline is known.
     */
    public double qualityDrop() {
        if (baselineQuality <= 0.0) {
            return 0.0;
        }
        return (baselineQuality - currentQuality) / baselineQuality;
    }

    /**
     * Resource usage ratios relative to allocation.
     */
    public record ResourceUsage(double cpu, double memory, double network) {

        public static final ResourceUsage IDLE = new ResourceUsage(0.0, 0.0, 0.0);

        /** Highest ratio across all dimensions. */
        public double peak() {
            return Math.max(cpu, Math.max(memory, network));
        }
    }
}
