package com.phillippitts.agentgovernor.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * An active sanction against one agent. An agent holds at most one at a time.
 *
 * @param id              opaque identifier
 * @param agentId         sanctioned agent
 * @param level           severity band
 * @param reason          human-readable summary of the triggers
 * @param triggeredBy     trigger types that caused the penalty, in detection order
 * @param metricsAtStart  telemetry that produced the penalty
 * @param improvementPlan targets to recover
 * @param appealStatus    current appeal state
 * @param appliedAt       when the penalty took effect
 * @param expiresAt       automatic expiry, or {@code null} when it lasts until graduation
 * @param appealDeadline  last moment an appeal may be filed
 */
public record Penalty(
        String id,
        String agentId,
        PenaltyLevel level,
        String reason,
        List<TriggerType> triggeredBy,
        AgentMetrics metricsAtStart,
        ImprovementPlan improvementPlan,
        AppealStatus appealStatus,
        Instant appliedAt,
        Instant expiresAt,
        Instant appealDeadline
) {

    public Penalty {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(agentId, "agentId must not be null");
        Objects.requireNonNull(level, "level must not be null");
        Objects.requireNonNull(metricsAtStart, "metricsAtStart must not be null");
        Objects.requireNonNull(improvementPlan, "improvementPlan must not be null");
        Objects.requireNonNull(appealStatus, "appealStatus must not be null");
        Objects.requireNonNull(appliedAt, "appliedAt must not be null");
        if (triggeredBy == null || triggeredBy.isEmpty()) {
            throw new IllegalArgumentException("A penalty must be triggered by at least one trigger");
        }
        triggeredBy = List.copyOf(triggeredBy);
    }

    /** Symbolic label of the level, e.g. {@code COMPUTE_REDUCTION}. */
    @JsonProperty("name")
    public String name() {
        return level.name();
    }

    @JsonProperty("description")
    public String description() {
        return level.description();
    }

    @JsonProperty("restrictions")
    public Restrictions restrictions() {
        return level.restrictions();
    }

    @JsonIgnore
    public boolean isExpired(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }

    public Penalty withAppealStatus(AppealStatus status) {
        return new Penalty(id, agentId, level, reason, triggeredBy, metricsAtStart, improvementPlan,
                status, appliedAt, expiresAt, appealDeadline);
    }
}
