package com.phillippitts.agentgovernor.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Situational view of an agent's evaluation, so penalties are never derived from raw
 * numbers alone.
 *
 * @param agentId          evaluated agent
 * @param metrics          telemetry the context was built from
 * @param taskDifficulty   how hard the recent workload was
 * @param systemConditions load and network health around the agent
 * @param agentState       historical baseline of the agent
 * @param externalFactors  infrastructure problems outside the agent's control
 * @param analyzedAt       when the context was built
 */
public record EvaluationContext(
        String agentId,
        AgentMetrics metrics,
        TaskDifficulty taskDifficulty,
        SystemConditions systemConditions,
        AgentState agentState,
        ExternalFactors externalFactors,
        Instant analyzedAt
) {

    public EvaluationContext {
        Objects.requireNonNull(agentId, "agentId must not be null");
        Objects.requireNonNull(metrics, "metrics must not be null");
        Objects.requireNonNull(taskDifficulty, "taskDifficulty must not be null");
        Objects.requireNonNull(systemConditions, "systemConditions must not be null");
        Objects.requireNonNull(agentState, "agentState must not be null");
        Objects.requireNonNull(externalFactors, "externalFactors must not be null");
        Objects.requireNonNull(analyzedAt, "analyzedAt must not be null");
    }

    public record TaskDifficulty(double averageDifficulty, boolean wasAssignedHarderTasks) {}

    public record SystemConditions(double systemLoad, int queueBacklog, double networkLatencyMs, boolean highLatency) {}

    /**
     * @param historicalPerformance long-run success rate
     * @param recentQuality         quality readings from earlier evaluations, oldest first
     * @param recentResourcePeak    peak resource ratios from earlier evaluations, oldest first
     */
    public record AgentState(double historicalPerformance, List<Double> recentQuality, List<Double> recentResourcePeak) {

        public AgentState {
            recentQuality = recentQuality == null ? List.of() : List.copyOf(recentQuality);
            recentResourcePeak = recentResourcePeak == null ? List.of() : List.copyOf(recentResourcePeak);
        }
    }

    public record ExternalFactors(boolean busIssues, boolean networkIssues, boolean dependencyFailures) {}
}
