package com.phillippitts.agentgovernor.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.function.ToDoubleFunction;

/**
 * Metrics an improvement plan can set targets on, each with its comparison direction.
 */
public enum TargetMetric {
    ERROR_RATE("errorRate", false, AgentMetrics::errorRate),
    TIMEOUT_RATE("timeoutRate", false, AgentMetrics::timeoutRate),
    QUALITY_SCORE("qualityScore", true, AgentMetrics::qualityScore),
    COLLABORATION_SUCCESS_RATE("collaborationSuccessRate", true, AgentMetrics::collaborationSuccessRate),
    RESOURCE_USAGE("resourceUsage", false, m -> m.resourceUsage().peak());

    private final String key;
    private final boolean higherIsBetter;
    private final ToDoubleFunction<AgentMetrics> reader;

    TargetMetric(String key, boolean higherIsBetter, ToDoubleFunction<AgentMetrics> reader) {
        this.key = key;
        this.higherIsBetter = higherIsBetter;
        this.reader = reader;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public boolean higherIsBetter() {
        return higherIsBetter;
    }

    /** Reads this metric's current value from a snapshot. */
    public double read(AgentMetrics metrics) {
        return reader.applyAsDouble(metrics);
    }

    /**
     * Returns true when the current value meets the target (inclusive).
     */
    public boolean isMet(double current, double target) {
        return higherIsBetter ? current >= target : current <= target;
    }
}
