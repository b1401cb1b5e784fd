package com.phillippitts.agentgovernor.service.remediation;

import java.time.Instant;

/**
 * One attempt at a curriculum stage. Mutated only while its session's monitor is held.
 */
public final class StageAttempt {

    private final CurriculumStage stage;
    private final int attemptNumber;
    private final Instant startedAt;
    private Instant completedAt;
    private int successCount;
    private int failureCount;
    private Boolean passed;

    StageAttempt(CurriculumStage stage, int attemptNumber, Instant startedAt) {
        this.stage = stage;
        this.attemptNumber = attemptNumber;
        this.startedAt = startedAt;
    }

    void record(boolean success) {
        if (success) {
            successCount++;
        } else {
            failureCount++;
        }
    }

    void close(boolean result, Instant at) {
        this.passed = result;
        this.completedAt = at;
    }

    public CurriculumStage stage() {
        return stage;
    }

    public int attemptNumber() {
        return attemptNumber;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public int successCount() {
        return successCount;
    }

    public int failureCount() {
        return failureCount;
    }

    public int tasksCompleted() {
        return successCount + failureCount;
    }

    public double successRate() {
        int total = tasksCompleted();
        return total == 0 ? 0.0 : (double) successCount / total;
    }

    public double errorRate() {
        int total = tasksCompleted();
        return total == 0 ? 0.0 : (double) failureCount / total;
    }

    public boolean isOpen() {
        return passed == null;
    }

    public boolean passed() {
        return Boolean.TRUE.equals(passed);
    }
}
