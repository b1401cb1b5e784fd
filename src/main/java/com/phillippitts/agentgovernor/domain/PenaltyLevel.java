package com.phillippitts.agentgovernor.domain;

import java.time.Duration;
import java.util.List;

/**
 * Six severity bands, strictly ordered. Durations are {@code null} where a penalty
 * lasts until remediation graduation.
 */
public enum PenaltyLevel {
    WARNING(1, "Tracking only, no actual penalty", Duration.ofHours(1),
            Restrictions.NONE),
    COMPUTE_REDUCTION(2, "CPU/memory reduced by 10%", Duration.ofHours(2),
            new Restrictions(0.9, -1, null, true, false)),
    PERMISSION_DOWNGRADE(3, "Restricted to simpler tasks", Duration.ofHours(4),
            new Restrictions(0.8, -2, List.of("simple", "routine"), false, false)),
    TASK_DEPRIORITIZATION(4, "Receives tasks only when no other agents available", Duration.ofHours(8),
            new Restrictions(0.7, -5, List.of("simple", "routine", "backup"), false, false)),
    MANDATORY_RETRAINING(5, "Removed from production queue, must complete retraining", null,
            new Restrictions(0.5, -10, List.of("training"), false, true)),
    SUSPENSION(6, "Removed from all queues, under investigation", Duration.ofHours(24),
            new Restrictions(0.0, -100, List.of(), false, true));

    public static final int MIN = 1;
    public static final int MAX = 6;

    private final int level;
    private final String description;
    private final Duration duration;
    private final Restrictions restrictions;

    PenaltyLevel(int level, String description, Duration duration, Restrictions restrictions) {
        this.level = level;
        this.description = description;
        this.duration = duration;
        this.restrictions = restrictions;
    }

    public int level() {
        return level;
    }

    public String description() {
        return description;
    }

    /** @return how long the penalty lasts, or {@code null} when it ends only on graduation */
    public Duration duration() {
        return duration;
    }

    public Restrictions restrictions() {
        return restrictions;
    }

    /** Whether this level enrols the agent in mandatory remediation. */
    public boolean requiresRemediation() {
        return level >= MANDATORY_RETRAINING.level;
    }

    /**
     * Resolves a numeric level.
     *
     * @throws IllegalArgumentException if the level is outside 1..6
     */
    public static PenaltyLevel of(int level) {
        for (PenaltyLevel candidate : values()) {
            if (candidate.level == level) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Penalty level must be between " + MIN + " and " + MAX + ", got: " + level);
    }
}
