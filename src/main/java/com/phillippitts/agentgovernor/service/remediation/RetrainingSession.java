package com.phillippitts.agentgovernor.service.remediation;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One agent's pass through the curriculum.
 *
 * <p>Mutable; {@link RemediationManager} mutates it only while holding the session's monitor.
 * Readers outside the manager should go through {@link RemediationManager#getProgress(String)}.
 */
public final class RetrainingSession {

    public enum Status { IN_PROGRESS, GRADUATED, FAILED, CANCELLED }

    private final String sessionId;
    private final String agentId;
    private final Set<Deficiency> deficiencies;
    private final Instant startedAt;
    private final List<StageAttempt> attempts = new ArrayList<>();
    private Status status = Status.IN_PROGRESS;
    private Instant completedAt;
    private String failureReason;
    private double score;

    RetrainingSession(String sessionId, String agentId, Set<Deficiency> deficiencies, Instant startedAt) {
        this.sessionId = sessionId;
        this.agentId = agentId;
        this.deficiencies = Collections.unmodifiableSet(new LinkedHashSet<>(deficiencies));
        this.startedAt = startedAt;
    }

    StageAttempt begin(CurriculumStage stage, Instant at) {
        int attempt = (int) attempts.stream().filter(a -> a.stage() == stage).count() + 1;
        StageAttempt next = new StageAttempt(stage, attempt, at);
        attempts.add(next);
        return next;
    }

    void graduate(double finalScore, Instant at) {
        this.score = finalScore;
        this.status = Status.GRADUATED;
        this.completedAt = at;
    }

    void fail(String reason, double finalScore, Instant at) {
        this.score = finalScore;
        this.status = Status.FAILED;
        this.failureReason = reason;
        this.completedAt = at;
    }

    void cancel(String reason, Instant at) {
        this.status = Status.CANCELLED;
        this.failureReason = reason;
        this.completedAt = at;
    }

    /** Current (last started) attempt. */
    public StageAttempt currentAttempt() {
        return attempts.get(attempts.size() - 1);
    }

    public CurriculumStage currentStage() {
        return currentAttempt().stage();
    }

    public int currentStageIndex() {
        return currentStage().ordinal();
    }

    public List<StageAttempt> attempts() {
        return Collections.unmodifiableList(attempts);
    }

    public int completedStages() {
        return (int) attempts.stream().filter(StageAttempt::passed).count();
    }

    /**
     * Success rate over every task recorded in passed attempts; 0 when none were recorded.
     */
    public double aggregateScore() {
        int tasks = 0;
        int successes = 0;
        for (StageAttempt attempt : attempts) {
            if (attempt.passed()) {
                tasks += attempt.tasksCompleted();
                successes += attempt.successCount();
            }
        }
        return tasks == 0 ? 0.0 : (double) successes / tasks;
    }

    public String sessionId() {
        return sessionId;
    }

    public String agentId() {
        return agentId;
    }

    public Set<Deficiency> deficiencies() {
        return deficiencies;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public Status status() {
        return status;
    }

    public boolean isGraduated() {
        return status == Status.GRADUATED;
    }

    public boolean isLive() {
        return status == Status.IN_PROGRESS;
    }

    public String failureReason() {
        return failureReason;
    }

    /** Final aggregate score; 0 until the session ends. */
    public double score() {
        return score;
    }

    /** Time from start to completion; {@link Duration#ZERO} while live. */
    public Duration duration() {
        return completedAt == null ? Duration.ZERO : Duration.between(startedAt, completedAt);
    }
}
