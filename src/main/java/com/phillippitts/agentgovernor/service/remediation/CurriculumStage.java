package com.phillippitts.agentgovernor.service.remediation;

import java.time.Duration;

/**
 * The four retraining stages, in order, with increasing requirements.
 *
 * <p>Diagnosis and skill review are time-boxed study stages; the practice stages are judged
 * on task results.
 */
public enum CurriculumStage {
    DIAGNOSIS("Diagnosis", 0, 0.0, 1.0, Duration.ofMinutes(3)),
    SKILL_REVIEW("Skill Review", 0, 0.0, 1.0, Duration.ofMinutes(7)),
    SUPERVISED_PRACTICE("Supervised Practice", 10, 0.85, 0.15, Duration.ZERO),
    GRADUATED_TASKS("Graduated Tasks", 10, 0.85, 0.15, Duration.ZERO);

    private final String displayName;
    private final int minimumTasks;
    private final double minimumSuccessRate;
    private final double maximumErrorRate;
    private final Duration minimumTime;

    CurriculumStage(String displayName, int minimumTasks, double minimumSuccessRate,
                    double maximumErrorRate, Duration minimumTime) {
        this.displayName = displayName;
        this.minimumTasks = minimumTasks;
        this.minimumSuccessRate = minimumSuccessRate;
        this.maximumErrorRate = maximumErrorRate;
        this.minimumTime = minimumTime;
    }

    public String displayName() {
        return displayName;
    }

    public int minimumTasks() {
        return minimumTasks;
    }

    public double minimumSuccessRate() {
        return minimumSuccessRate;
    }

    public double maximumErrorRate() {
        return maximumErrorRate;
    }

    public Duration minimumTime() {
        return minimumTime;
    }

    public boolean isFinal() {
        return ordinal() == values().length - 1;
    }

    /** Next stage, or {@code null} after the final one. */
    public CurriculumStage next() {
        return isFinal() ? null : values()[ordinal() + 1];
    }

    /**
     * Whether an attempt meets this stage's requirements.
     *
     * @param enforceMinimumTime false skips the time-in-stage requirement
     */
    public boolean isPassedBy(StageAttempt attempt, Duration timeSpent, boolean enforceMinimumTime) {
        if (attempt.tasksCompleted() < minimumTasks) {
            return false;
        }
        if (minimumTasks > 0) {
            if (attempt.successRate() < minimumSuccessRate || attempt.errorRate() > maximumErrorRate) {
                return false;
            }
        }
        return !enforceMinimumTime || timeSpent.compareTo(minimumTime) >= 0;
    }
}
