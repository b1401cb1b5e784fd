package com.phillippitts.agentgovernor.service.remediation;

import com.phillippitts.agentgovernor.config.properties.GovernanceProperties;
import com.phillippitts.agentgovernor.domain.Trigger;
import com.phillippitts.agentgovernor.exception.InvalidTransitionException;
import com.phillippitts.agentgovernor.exception.NotFoundException;
import com.phillippitts.agentgovernor.service.collaborator.BusNotifier;
import com.phillippitts.agentgovernor.service.remediation.event.RemediationFailedEvent;
import com.phillippitts.agentgovernor.service.remediation.event.RemediationGraduatedEvent;
import com.phillippitts.agentgovernor.service.remediation.event.RemediationStartedEvent;
import com.phillippitts.agentgovernor.service.remediation.event.StageCompletedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs agents through the four-stage retraining curriculum.
 *
 * <p><b>Session policy:</b> at most one live session per agent. Starting retraining for an
 * agent that already has one keeps the live session and returns its id.
 *
 * <p><b>Progression:</b> task results are recorded against the current stage; closing a stage
 * checks its requirements. A failed stage is retried until
 * {@code governance.remediation.max-stage-attempts} is used up, after which the session fails.
 * Passing the final stage graduates the agent only if the aggregate score over passed stages
 * reaches {@code governance.remediation.minimum-graduation-score}.
 *
 * <p><b>Thread safety:</b> session creation is atomic per agent via
 * {@link ConcurrentHashMap#computeIfAbsent}; every mutation holds the session's monitor.
 * Events are published after the monitor is released.
 */
public class RemediationManager {

    private static final Logger LOG = LogManager.getLogger(RemediationManager.class);

    private final ApplicationEventPublisher publisher;
    private final BusNotifier notifier;
    private final GovernanceProperties.Remediation settings;
    private final Clock clock;

    private final Map<String, RetrainingSession> active = new ConcurrentHashMap<>();
    private final List<RetrainingSession> finished = new CopyOnWriteArrayList<>();

    public RemediationManager(ApplicationEventPublisher publisher,
                              BusNotifier notifier,
                              GovernanceProperties properties,
                              Clock clock) {
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.notifier = Objects.requireNonNull(notifier, "notifier");
        this.settings = properties.getRemediation();
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Starts retraining, or returns the live session's id when one exists.
     *
     * @param triggers triggers behind the penalty; they determine the deficiencies addressed
     * @return session id
     */
    public String startRetraining(String agentId, List<Trigger> triggers) {
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(triggers, "triggers");

        boolean[] created = {false};
        RetrainingSession session = active.computeIfAbsent(agentId, id -> {
            created[0] = true;
            Instant now = clock.instant();
            RetrainingSession s = new RetrainingSession(UUID.randomUUID().toString(), id, deficienciesOf(triggers), now);
            s.begin(CurriculumStage.DIAGNOSIS, now);
            return s;
        });

        if (!created[0]) {
            LOG.info("Agent {} already in retraining session {}; keeping it", agentId, session.sessionId());
            return session.sessionId();
        }

        List<String> deficiencies = session.deficiencies().stream().map(Deficiency::tag).toList();
        LOG.info("Retraining started for agent {} (session {}, deficiencies {})",
                agentId, session.sessionId(), deficiencies);
        publisher.publishEvent(new RemediationStartedEvent(agentId, session.sessionId(), deficiencies, session.startedAt()));
        notifyBus("started", agentId, session.sessionId(), Map.of("deficiencies", deficiencies));
        return session.sessionId();
    }

    /**
     * Records the outcome of one supervised task in the current stage.
     *
     * @throws NotFoundException if the agent has no live session
     */
    public void recordTaskResult(String agentId, boolean success) {
        RetrainingSession session = requireLive(agentId);
        synchronized (session) {
            ensureLive(session);
            session.currentAttempt().record(success);
        }
    }

    /**
     * Closes the current stage and advances, retries or ends the session.
     *
     * @return the closed attempt
     * @throws NotFoundException if the agent has no live session
     */
    public StageAttempt completeStage(String agentId) {
        RetrainingSession session = requireLive(agentId);
        List<Object> events = new ArrayList<>(2);
        StageAttempt closed;

        synchronized (session) {
            ensureLive(session);
            Instant now = clock.instant();
            closed = session.currentAttempt();
            CurriculumStage stage = closed.stage();
            Duration spent = Duration.between(closed.startedAt(), now);
            boolean passed = stage.isPassedBy(closed, spent, settings.isEnforceMinimumStageTime());
            closed.close(passed, now);
            events.add(new StageCompletedEvent(agentId, session.sessionId(), stage.displayName(),
                    closed.attemptNumber(), passed, closed.successRate(), now));

            if (passed && stage.isFinal()) {
                double score = session.aggregateScore();
                if (score >= settings.getMinimumGraduationScore()) {
                    session.graduate(score, now);
                    events.add(new RemediationGraduatedEvent(agentId, session.sessionId(), score, now));
                } else {
                    String reason = String.format(Locale.ROOT, "Aggregate score %.2f below required %.2f",
                            score, settings.getMinimumGraduationScore());
                    session.fail(reason, score, now);
                    events.add(new RemediationFailedEvent(agentId, session.sessionId(), reason, now));
                }
            } else if (passed) {
                session.begin(stage.next(), now);
            } else if (closed.attemptNumber() >= settings.getMaxStageAttempts()) {
                String reason = "Failed stage " + stage.displayName() + " after " + closed.attemptNumber() + " attempts";
                session.fail(reason, session.aggregateScore(), now);
                events.add(new RemediationFailedEvent(agentId, session.sessionId(), reason, now));
            } else {
                LOG.info("Agent {} did not pass {}; retrying", agentId, stage.displayName());
                session.begin(stage, now);
            }

            if (!session.isLive()) {
                active.remove(agentId, session);
                finished.add(session);
            }
        }

        for (Object event : events) {
            publisher.publishEvent(event);
            if (event instanceof RemediationGraduatedEvent g) {
                LOG.info("Agent {} graduated from retraining with score {}", agentId, g.score());
                notifyBus("completed", agentId, g.sessionId(), Map.of("score", g.score()));
            } else if (event instanceof RemediationFailedEvent f) {
                LOG.warn("Retraining failed for agent {}: {}", agentId, f.reason());
                notifyBus("failed", agentId, f.sessionId(), Map.of("reason", f.reason()));
            } else if (event instanceof StageCompletedEvent s) {
                notifyBus("stage_completed", agentId, s.sessionId(),
                        Map.of("stage", s.stage(), "attempt", s.attempt(), "passed", s.passed()));
            }
        }
        return closed;
    }

    /**
     * Ends a live session without graduation, e.g. because its penalty was lifted.
     * Cancelled sessions do not count towards graduation statistics.
     *
     * @return true if a live session was cancelled
     */
    public boolean cancelRetraining(String agentId, String reason) {
        RetrainingSession session = active.get(agentId);
        if (session == null) {
            return false;
        }
        synchronized (session) {
            if (!session.isLive()) {
                return false;
            }
            session.cancel(reason, clock.instant());
            active.remove(agentId, session);
        }
        LOG.info("Retraining session {} for agent {} cancelled: {}", session.sessionId(), agentId, reason);
        notifyBus("cancelled", agentId, session.sessionId(), Map.of("reason", reason));
        return true;
    }

    /** Progress of the agent's live session, or {@code null} when there is none. */
    public RemediationProgress getProgress(String agentId) {
        RetrainingSession session = active.get(agentId);
        if (session == null) {
            return null;
        }
        synchronized (session) {
            StageAttempt current = session.currentAttempt();
            int total = CurriculumStage.values().length;
            int completed = session.completedStages();
            return new RemediationProgress(
                    session.sessionId(),
                    agentId,
                    session.deficiencies().stream().map(Deficiency::tag).toList(),
                    current.stage().displayName(),
                    current.attemptNumber(),
                    current.tasksCompleted(),
                    current.successRate(),
                    completed,
                    total,
                    (double) completed / total,
                    session.status());
        }
    }

    /** The agent's live session, or {@code null}. */
    public RetrainingSession getSession(String agentId) {
        return active.get(agentId);
    }

    public boolean isInRemediation(String agentId) {
        return active.containsKey(agentId);
    }

    public int getActiveCount() {
        return active.size();
    }

    public RemediationStatistics getStatistics() {
        int successful = 0;
        int failed = 0;
        Duration total = Duration.ZERO;
        for (RetrainingSession s : finished) {
            if (s.status() == RetrainingSession.Status.GRADUATED) {
                successful++;
            } else if (s.status() == RetrainingSession.Status.FAILED) {
                failed++;
            } else {
                continue;
            }
            total = total.plus(s.duration());
        }
        int completed = successful + failed;
        return new RemediationStatistics(
                active.size(),
                completed,
                successful,
                failed,
                completed > 0 ? (double) successful / completed : 0.0,
                completed > 0 ? total.dividedBy(completed) : Duration.ZERO);
    }

    private RetrainingSession requireLive(String agentId) {
        RetrainingSession session = active.get(agentId);
        if (session == null) {
            throw new NotFoundException("RetrainingSession", agentId);
        }
        return session;
    }

    private static void ensureLive(RetrainingSession session) {
        if (!session.isLive()) {
            throw new InvalidTransitionException("Retraining session " + session.sessionId() + " has ended",
                    session.status().name());
        }
    }

    private void notifyBus(String type, String agentId, String sessionId, Map<String, Object> details) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", type);
        payload.put("agentId", agentId);
        payload.put("sessionId", sessionId);
        payload.putAll(details);
        payload.put("timestamp", clock.instant().toString());
        notifier.notify(BusNotifier.RETRAINING_TOPIC, "retraining." + type, payload);
    }

    private static Set<Deficiency> deficienciesOf(List<Trigger> triggers) {
        Set<Deficiency> result = new LinkedHashSet<>();
        for (Trigger trigger : triggers) {
            result.add(Deficiency.forTrigger(trigger.type()));
        }
        return result;
    }
}
