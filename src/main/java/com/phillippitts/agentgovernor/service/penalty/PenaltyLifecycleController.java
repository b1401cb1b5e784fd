package com.phillippitts.agentgovernor.service.penalty;

import com.phillippitts.agentgovernor.config.properties.GovernanceProperties;
import com.phillippitts.agentgovernor.domain.AgentMetrics;
import com.phillippitts.agentgovernor.domain.AnomalyReport;
import com.phillippitts.agentgovernor.domain.Appeal;
import com.phillippitts.agentgovernor.domain.AppealDecision;
import com.phillippitts.agentgovernor.domain.AppealGrounds;
import com.phillippitts.agentgovernor.domain.AppealReview;
import com.phillippitts.agentgovernor.domain.AppealStatus;
import com.phillippitts.agentgovernor.domain.EvaluationContext;
import com.phillippitts.agentgovernor.domain.FairnessMetrics;
import com.phillippitts.agentgovernor.domain.GovernanceDashboard;
import com.phillippitts.agentgovernor.domain.ImprovementPlan;
import com.phillippitts.agentgovernor.domain.Penalty;
import com.phillippitts.agentgovernor.domain.PenaltyLevel;
import com.phillippitts.agentgovernor.domain.PenaltyStatus;
import com.phillippitts.agentgovernor.domain.ProbationPeriod;
import com.phillippitts.agentgovernor.domain.TargetMetric;
import com.phillippitts.agentgovernor.domain.Trigger;
import com.phillippitts.agentgovernor.exception.CollaboratorFailureException;
import com.phillippitts.agentgovernor.exception.InvalidTransitionException;
import com.phillippitts.agentgovernor.exception.NotFoundException;
import com.phillippitts.agentgovernor.service.collaborator.BusNotifier;
import com.phillippitts.agentgovernor.service.collaborator.CollaboratorGateway;
import com.phillippitts.agentgovernor.service.evaluation.PerformanceEvaluator;
import com.phillippitts.agentgovernor.service.metrics.GovernanceMetrics;
import com.phillippitts.agentgovernor.service.penalty.event.AppealFiledEvent;
import com.phillippitts.agentgovernor.service.penalty.event.AppealReviewedEvent;
import com.phillippitts.agentgovernor.service.penalty.event.PenaltyAppliedEvent;
import com.phillippitts.agentgovernor.service.penalty.event.PenaltyRemovedEvent;
import com.phillippitts.agentgovernor.service.penalty.event.PenaltyReversedEvent;
import com.phillippitts.agentgovernor.service.penalty.event.ProbationEndedEvent;
import com.phillippitts.agentgovernor.service.penalty.event.ProbationStartedEvent;
import com.phillippitts.agentgovernor.service.remediation.RemediationManager;
import com.phillippitts.agentgovernor.service.remediation.RemediationStatistics;
import com.phillippitts.agentgovernor.service.remediation.event.RemediationGraduatedEvent;
import com.phillippitts.agentgovernor.service.throttle.ResourceThrottle;
import com.phillippitts.agentgovernor.util.GovernanceLogContext;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the penalty lifecycle of every agent.
 *
 * <p>State machine per agent:
 * <pre>
 * Healthy -> Penalized -> Appealed -> (Reversed | Penalized)
 * Penalized -> Recovering -> Healthy
 * Penalized(level >= 5) -> InRemediation -> Graduated -> Probation
 * </pre>
 *
 * <p><b>Locking:</b> each agent's records (penalty, throttle, probation, retraining start,
 * its appeals) are guarded by that agent's {@link ReentrantLock}; there is no global lock, so
 * different agents are evaluated fully in parallel. Metrics are fetched before the lock is
 * taken. A lock is dropped together with the agent's records in {@link #releaseAgent}.
 *
 * <p><b>Notifications:</b> in-process events and event-bus messages are sent after the state
 * change and outside the lock. The one exception is the retraining-started notification,
 * which is sent while the session is registered under the lock. Bus delivery is best-effort
 * and never rolls state back.
 *
 * <p><b>Retention:</b> per agent only the most recent penalties are kept, next to a count of
 * every penalty ever applied. Fleet fairness is computed from running totals.
 */
public class PenaltyLifecycleController {

    private static final Logger LOG = LogManager.getLogger(PenaltyLifecycleController.class);

    public static final String REASON_RECOVERED = "performance_improved";
    public static final String REASON_APPEAL_APPROVED = "appeal_approved";
    public static final String REASON_EXPIRED = "expired";

    private static final double REQUIRED_IMPROVEMENT = 0.30;
    private static final int RETRAINING_SEVERITY = 4;
    private static final int RECENT_PENALTIES = 5;
    private static final List<Duration> CHECKPOINT_OFFSETS = List.of(
            Duration.ofMinutes(30), Duration.ofHours(1), Duration.ofHours(2), Duration.ofHours(4));

    private final CollaboratorGateway gateway;
    private final PerformanceEvaluator evaluator;
    private final RemediationManager remediation;
    private final BusNotifier notifier;
    private final ApplicationEventPublisher publisher;
    private final GovernanceMetrics metrics;
    private final GovernanceProperties properties;
    private final Clock clock;

    private final Map<String, Penalty> penalties = new ConcurrentHashMap<>();
    private final Map<String, Appeal> appeals = new ConcurrentHashMap<>();
    private final Map<String, ResourceThrottle> throttles = new ConcurrentHashMap<>();
    private final Map<String, ProbationPeriod> probation = new ConcurrentHashMap<>();
    private final Map<String, PenaltyHistory> history = new ConcurrentHashMap<>();
    private final AtomicInteger penaltiesApplied = new AtomicInteger();
    private final Map<String, ReentrantLock> agentLocks = new ConcurrentHashMap<>();

    public PenaltyLifecycleController(CollaboratorGateway gateway,
                                      PerformanceEvaluator evaluator,
                                      RemediationManager remediation,
                                      BusNotifier notifier,
                                      ApplicationEventPublisher publisher,
                                      GovernanceMetrics metrics,
                                      GovernanceProperties properties,
                                      Clock clock) {
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.remediation = Objects.requireNonNull(remediation, "remediation");
        this.notifier = Objects.requireNonNull(notifier, "notifier");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Fetches live metrics, evaluates them and applies a penalty when any trigger fires.
     *
     * @return the applied penalty, or {@code null} when performance is acceptable
     * @throws CollaboratorFailureException if metrics cannot be fetched; nothing is applied
     */
    public Penalty evaluateAgentPerformance(String agentId) {
        Objects.requireNonNull(agentId, "agentId");
        long t0 = System.nanoTime();
        try (CloseableThreadContext.Instance ignored = GovernanceLogContext.forAgent(agentId, "evaluate")) {
            AgentMetrics current;
            try {
                current = gateway.fetchMetrics(agentId);
            } catch (CollaboratorFailureException e) {
                LOG.warn("Evaluation of {} aborted: {}", agentId, e.getMessage());
                metrics.recordEvaluation("failed", System.nanoTime() - t0);
                throw e;
            }

            EvaluationContext context = evaluator.analyzeContext(agentId, current);
            List<Trigger> triggers = evaluator.evaluateTriggers(current, context);
            if (triggers.isEmpty()) {
                LOG.debug("Agent {} within thresholds", agentId);
                metrics.recordEvaluation("healthy", System.nanoTime() - t0);
                return null;
            }

            int level = evaluator.determinePenaltyLevel(triggers, context);
            Penalty penalty = applyPenalty(agentId, level, triggers, context);
            metrics.recordEvaluation("penalized", System.nanoTime() - t0);
            return penalty;
        }
    }

    /**
     * Applies a penalty, replacing any active one for the agent.
     *
     * <p>A replacement inherits the id, appeal status and appeal deadline of a penalty that
     * is under appeal or whose appeal was denied, so the appeal keeps applying to it.
     *
     * <p>Adjusts the agent's throttle, starts retraining at level 5 and above, and files an
     * automatic appeal when anomaly detection asks for review.
     *
     * @param level penalty level 1..6
     * @return the stored penalty, with its appeal status as of return
     * @throws IllegalArgumentException if level is out of range or triggers are empty
     */
    public Penalty applyPenalty(String agentId, int level, List<Trigger> triggers, EvaluationContext context) {
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(context, "context");
        if (triggers == null || triggers.isEmpty()) {
            throw new IllegalArgumentException("A penalty requires at least one trigger");
        }
        PenaltyLevel penaltyLevel = PenaltyLevel.of(level);

        Penalty penalty;
        Penalty previous;
        ReentrantLock lock = lockAgent(agentId);
        try {
            Instant now = clock.instant();
            previous = penalties.get(agentId);
            boolean appealed = previous != null && previous.appealStatus() != AppealStatus.NONE;
            penalty = new Penalty(
                    appealed ? previous.id() : UUID.randomUUID().toString(),
                    agentId,
                    penaltyLevel,
                    PerformanceEvaluator.generateReason(triggers),
                    triggers.stream().map(Trigger::type).toList(),
                    context.metrics(),
                    createImprovementPlan(triggers, now),
                    appealed ? previous.appealStatus() : AppealStatus.NONE,
                    now,
                    penaltyLevel.duration() == null ? null : now.plus(penaltyLevel.duration()),
                    appealed ? previous.appealDeadline()
                            : now.plus(Duration.ofMinutes(properties.getAppeals().getWindowMinutes())));
            penalties.put(agentId, penalty);
            history.computeIfAbsent(agentId, id -> new PenaltyHistory()).add(penalty);
            penaltiesApplied.incrementAndGet();
            throttles.computeIfAbsent(agentId, id -> ResourceThrottle.from(properties.getThrottle(), clock))
                    .applyPenalty(penaltyLevel.level());

            // registered under the lock so a concurrent recovery check sees the session
            if (penaltyLevel.requiresRemediation()) {
                remediation.startRetraining(agentId, triggers);
            } else if (previous != null && previous.level().requiresRemediation()) {
                remediation.cancelRetraining(agentId, "penalty replaced by level " + level);
            }
        } finally {
            lock.unlock();
        }

        if (previous != null) {
            LOG.info("Penalty {} for {} replaced by level {}", previous.id(), agentId, level);
        }
        LOG.info("Applied {} (level {}) to {}: {}", penaltyLevel, level, agentId, penalty.reason());

        metrics.incrementPenaltyApplied(level);
        publisher.publishEvent(new PenaltyAppliedEvent(penalty, penalty.appliedAt()));
        notifier.notify(BusNotifier.PENALTIES_TOPIC, "penalty.applied.level" + level + "." + agentId,
                message("penalty_applied", Map.of("penalty", penalty)));

        AnomalyReport report = evaluator.detectAnomalies(penalty, triggers, context);
        if (report.autoReviewTriggered()) {
            LOG.warn("Anomalies around penalty {} for {} (score {}): {}",
                    penalty.id(), agentId, report.anomalyScore(), report.recommendation());
            fileAutomaticAppeal(penalty, report);
        }
        return penalties.getOrDefault(agentId, penalty);
    }

    /**
     * Lifts the agent's penalty once every improvement target is met.
     *
     * <p>No-op when the agent has no penalty or is still in retraining. Repeated calls after
     * recovery do nothing.
     *
     * @return true if a penalty was removed
     * @throws CollaboratorFailureException if metrics cannot be fetched
     */
    public boolean checkForRecovery(String agentId) {
        if (!penalties.containsKey(agentId)) {
            return false;
        }
        if (remediation.isInRemediation(agentId)) {
            LOG.debug("Recovery check for {} deferred: retraining in progress", agentId);
            return false;
        }

        try (CloseableThreadContext.Instance ignored = GovernanceLogContext.forAgent(agentId, "recovery")) {
            AgentMetrics current = gateway.fetchMetrics(agentId);
            Penalty removed;
            boolean probationEnded;
            ReentrantLock lock = lockAgent(agentId);
            try {
                Penalty penalty = penalties.get(agentId);
                if (penalty == null || remediation.isInRemediation(agentId)) {
                    return false;
                }
                List<TargetMetric> unmet = penalty.improvementPlan().unmetTargets(current);
                if (!unmet.isEmpty()) {
                    LOG.debug("Agent {} still misses targets {}", agentId, unmet);
                    return false;
                }
                removed = penalties.remove(agentId);
                probationEnded = liftRestrictions(agentId);
            } finally {
                lock.unlock();
            }
            afterRemoval(removed, REASON_RECOVERED, probationEnded);
            return true;
        }
    }

    /**
     * Files an appeal against the agent's active penalty.
     *
     * @return appeal id
     * @throws NotFoundException          if the agent has no penalty with this id
     * @throws InvalidTransitionException if an appeal is pending, was already decided, or the
     *                                    deadline has passed
     */
    public String fileAppeal(String penaltyId, String agentId, AppealGrounds grounds) {
        return fileAppeal(penaltyId, agentId, grounds, false).id();
    }

    /**
     * Records a reviewer's decision. Approval reverses the penalty and resets the throttle;
     * denial keeps it with appeal status denied.
     *
     * @throws NotFoundException          if the appeal does not exist
     * @throws InvalidTransitionException if the appeal was already reviewed
     */
    public Appeal reviewAppeal(String appealId, String reviewerId, AppealDecision decision, List<String> comments) {
        Objects.requireNonNull(reviewerId, "reviewerId");
        Objects.requireNonNull(decision, "decision");
        Appeal filed = appeals.get(appealId);
        if (filed == null) {
            throw new NotFoundException("Appeal", appealId);
        }
        String agentId = filed.agentId();

        try (CloseableThreadContext.Instance ignored = GovernanceLogContext.forAgent(agentId, "review")) {
            Appeal resolved;
            Penalty reversed = null;
            boolean probationEnded = false;
            ReentrantLock lock = lockAgent(agentId);
            try {
                Appeal current = appeals.get(appealId);
                if (current.isResolved()) {
                    throw new InvalidTransitionException("Appeal " + appealId + " was already reviewed",
                            current.status().tag());
                }
                resolved = current.resolve(new AppealReview(reviewerId, decision, comments, clock.instant()));
                appeals.put(appealId, resolved);

                Penalty penalty = penalties.get(agentId);
                if (penalty != null && penalty.id().equals(resolved.penaltyId())) {
                    if (decision == AppealDecision.APPROVED) {
                        reversed = penalties.remove(agentId);
                        probationEnded = liftRestrictions(agentId);
                    } else {
                        penalties.put(agentId, penalty.withAppealStatus(AppealStatus.DENIED));
                    }
                }
            } finally {
                lock.unlock();
            }

            LOG.info("Appeal {} for {} {} by {}", appealId, agentId, decision.tag(), reviewerId);
            metrics.incrementAppealReviewed(decision.tag());
            publisher.publishEvent(new AppealReviewedEvent(resolved));

            if (reversed != null) {
                afterRemoval(reversed, REASON_APPEAL_APPROVED, probationEnded);
                publisher.publishEvent(new PenaltyReversedEvent(agentId, reversed.id(), appealId, reviewerId,
                        resolved.review().reviewedAt()));
                notifier.notify(BusNotifier.PENALTIES_TOPIC, "penalty.reversed." + agentId,
                        message("penalty_reversed", Map.of("penalty", reversed, "appeal", resolved)));
            }
            return resolved;
        }
    }

    /**
     * Removes every penalty whose duration has elapsed.
     *
     * @return number of penalties removed
     */
    public int expirePenalties() {
        int removedCount = 0;
        for (String agentId : List.copyOf(penalties.keySet())) {
            Penalty removed = null;
            boolean probationEnded = false;
            ReentrantLock lock = lockAgent(agentId);
            try {
                Penalty penalty = penalties.get(agentId);
                if (penalty != null && penalty.isExpired(clock.instant())) {
                    removed = penalties.remove(agentId);
                    probationEnded = liftRestrictions(agentId);
                }
            } finally {
                lock.unlock();
            }
            if (removed != null) {
                afterRemoval(removed, REASON_EXPIRED, probationEnded);
                removedCount++;
            }
        }
        return removedCount;
    }

    /**
     * Starts probation for an agent that graduated from retraining.
     */
    @EventListener
    public void onRemediationGraduated(RemediationGraduatedEvent event) {
        startProbation(event.agentId());
    }

    public ProbationPeriod startProbation(String agentId) {
        GovernanceProperties.Probation settings = properties.getProbation();
        Instant now = clock.instant();
        Duration length = Duration.ofMinutes(settings.getDurationMinutes());
        ProbationPeriod period = new ProbationPeriod(agentId, now, now.plus(length), length,
                settings.getMinimumSuccessRate(), settings.getMaximumErrorRate(), settings.getQualityThreshold());
        ReentrantLock lock = lockAgent(agentId);
        try {
            probation.put(agentId, period);
        } finally {
            lock.unlock();
        }
        LOG.info("Agent {} on probation until {}", agentId, period.endsAt());
        publisher.publishEvent(new ProbationStartedEvent(period));
        return period;
    }

    /**
     * Admits a task for the agent if its throttle has enough tokens. Agents that were never
     * penalized have no throttle and are always admitted.
     */
    public boolean tryAdmitTask(String agentId, double tokens) {
        ResourceThrottle throttle = throttles.get(agentId);
        if (throttle == null || throttle.consumeTokens(tokens)) {
            return true;
        }
        metrics.incrementThrottleRejection();
        return false;
    }

    /** Point-in-time counts over penalties, appeals, probation and retraining. */
    public GovernanceDashboard getDashboard() {
        List<Penalty> active = List.copyOf(penalties.values());
        Map<String, Integer> byLevel = new LinkedHashMap<>();
        for (PenaltyLevel level : PenaltyLevel.values()) {
            byLevel.put("level" + level.level(), 0);
        }
        for (Penalty p : active) {
            byLevel.merge("level" + p.level().level(), 1, Integer::sum);
        }

        List<Appeal> allAppeals = List.copyOf(appeals.values());
        int pending = 0;
        int approved = 0;
        int denied = 0;
        for (Appeal a : allAppeals) {
            switch (a.status()) {
                case PENDING -> pending++;
                case APPROVED -> approved++;
                case DENIED -> denied++;
                default -> { }
            }
        }
        int total = allAppeals.size();

        RemediationStatistics retraining = remediation.getStatistics();
        return new GovernanceDashboard(
                active.size(),
                byLevel,
                new GovernanceDashboard.AppealSummary(pending, approved, denied, total,
                        total > 0 ? (double) approved / total : 0.0),
                new GovernanceDashboard.ProbationSummary(probation.size(), List.copyOf(probation.keySet())),
                new GovernanceDashboard.RetrainingSummary(retraining.active(), retraining.completed(),
                        retraining.graduationRate()));
    }

    public PenaltyStatus getPenaltyStatus(String agentId) {
        PenaltyHistory past = history.get(agentId);
        ResourceThrottle throttle = throttles.get(agentId);
        return new PenaltyStatus(
                penalties.get(agentId),
                throttle == null ? null : throttle.getStatus(),
                probation.get(agentId),
                past == null ? 0 : past.total(),
                past == null ? List.of() : past.recent());
    }

    /** Fairness over every penalty ever applied and every appeal ever filed. */
    public FairnessMetrics getFairnessReport() {
        return evaluator.getFairnessMetrics(penaltiesApplied.get(), List.copyOf(appeals.values()));
    }

    /**
     * Drops everything held for an agent that left the fleet: throttle, probation, penalty
     * history, metric readings and its lock. Fleet-wide totals and filed appeals are kept.
     *
     * @return true if anything was held for the agent
     * @throws InvalidTransitionException if the agent still holds a penalty or is in retraining
     */
    public boolean releaseAgent(String agentId) {
        Objects.requireNonNull(agentId, "agentId");
        boolean held;
        ReentrantLock lock = lockAgent(agentId);
        try {
            Penalty active = penalties.get(agentId);
            if (active != null) {
                throw new InvalidTransitionException("Agent " + agentId + " still holds penalty " + active.id(),
                        "penalized");
            }
            if (remediation.isInRemediation(agentId)) {
                throw new InvalidTransitionException("Agent " + agentId + " is still in retraining", "retraining");
            }
            held = throttles.remove(agentId) != null
                    | probation.remove(agentId) != null
                    | history.remove(agentId) != null;
            evaluator.forgetAgent(agentId);
            agentLocks.remove(agentId, lock);
        } finally {
            lock.unlock();
        }
        LOG.info("Released agent {}", agentId);
        return held;
    }

    public Penalty getActivePenalty(String agentId) {
        return penalties.get(agentId);
    }

    public Appeal getAppeal(String appealId) {
        Appeal appeal = appeals.get(appealId);
        if (appeal == null) {
            throw new NotFoundException("Appeal", appealId);
        }
        return appeal;
    }

    /** Agents currently holding a penalty. */
    public List<String> getPenalizedAgents() {
        return List.copyOf(penalties.keySet());
    }

    private Appeal fileAppeal(String penaltyId, String agentId, AppealGrounds grounds, boolean automatic) {
        Objects.requireNonNull(penaltyId, "penaltyId");
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(grounds, "grounds");

        Appeal appeal;
        ReentrantLock lock = lockAgent(agentId);
        try {
            Penalty penalty = penalties.get(agentId);
            if (penalty == null || !penalty.id().equals(penaltyId)) {
                throw new NotFoundException("Penalty", penaltyId, "no active penalty with this id for agent " + agentId);
            }
            if (penalty.appealStatus() == AppealStatus.PENDING || penalty.appealStatus() == AppealStatus.DENIED) {
                throw new InvalidTransitionException("Penalty " + penaltyId + " cannot be appealed again",
                        penalty.appealStatus().tag());
            }
            Instant now = clock.instant();
            if (now.isAfter(penalty.appealDeadline())) {
                throw new InvalidTransitionException("Appeal deadline has passed for penalty " + penaltyId,
                        penalty.appealStatus().tag());
            }
            appeal = Appeal.pending(UUID.randomUUID().toString(), penaltyId, agentId, grounds, now);
            appeals.put(appeal.id(), appeal);
            penalties.put(agentId, penalty.withAppealStatus(AppealStatus.PENDING));
        } finally {
            lock.unlock();
        }

        LOG.info("Appeal {} filed against penalty {} for {} ({})", appeal.id(), penaltyId, agentId, grounds.type());
        metrics.incrementAppealFiled(automatic);
        publisher.publishEvent(new AppealFiledEvent(appeal, automatic));
        notifier.notify(BusNotifier.PENALTIES_TOPIC, "penalty.appeal.filed." + agentId,
                message("appeal_filed", Map.of("appeal", appeal)));
        return appeal;
    }

    private void fileAutomaticAppeal(Penalty penalty, AnomalyReport report) {
        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("metrics", penalty.metricsAtStart());
        evidence.put("anomalies", report.anomalies());
        evidence.put("anomalyScore", report.anomalyScore());
        evidence.put("systemicFactors", report.recommendation());
        AppealGrounds grounds = new AppealGrounds(AppealGrounds.SYSTEMIC_ISSUE,
                "Automatic appeal triggered by anomaly detection", evidence);
        try {
            fileAppeal(penalty.id(), penalty.agentId(), grounds, true);
        } catch (NotFoundException | InvalidTransitionException e) {
            LOG.warn("Automatic appeal for penalty {} not filed: {}", penalty.id(), e.getMessage());
        }
    }

    /** Resets the throttle and ends probation. Caller holds the agent's lock. */
    private boolean liftRestrictions(String agentId) {
        ResourceThrottle throttle = throttles.get(agentId);
        if (throttle != null) {
            throttle.reset();
        }
        return probation.remove(agentId) != null;
    }

    private void afterRemoval(Penalty removed, String reason, boolean probationEnded) {
        String agentId = removed.agentId();
        Instant now = clock.instant();
        LOG.info("Penalty {} lifted for {} ({})", removed.id(), agentId, reason);
        remediation.cancelRetraining(agentId, "penalty lifted: " + reason);
        metrics.incrementPenaltyRemoved(reason);
        publisher.publishEvent(new PenaltyRemovedEvent(agentId, removed.id(), reason, now));
        if (probationEnded) {
            publisher.publishEvent(new ProbationEndedEvent(agentId, now));
        }
        notifier.notify(BusNotifier.PENALTIES_TOPIC, "penalty.removed." + agentId,
                message("penalty_removed", Map.of("agentId", agentId, "penaltyId", removed.id(), "reason", reason)));
    }

    private ImprovementPlan createImprovementPlan(List<Trigger> triggers, Instant now) {
        GovernanceProperties.Targets targets = properties.getTargets();
        Map<TargetMetric, Double> goals = new EnumMap<>(TargetMetric.class);
        for (Trigger trigger : triggers) {
            TargetMetric metric = trigger.type().recoveryMetric();
            goals.put(metric, targetFor(metric, targets));
        }
        List<Instant> checkpoints = new ArrayList<>(CHECKPOINT_OFFSETS.size());
        for (Duration offset : CHECKPOINT_OFFSETS) {
            checkpoints.add(now.plus(offset));
        }
        boolean retraining = triggers.stream().anyMatch(t -> t.severity() >= RETRAINING_SEVERITY);
        return new ImprovementPlan(goals, REQUIRED_IMPROVEMENT, checkpoints, retraining);
    }

    private static double targetFor(TargetMetric metric, GovernanceProperties.Targets targets) {
        return switch (metric) {
            case ERROR_RATE -> targets.getErrorRate();
            case TIMEOUT_RATE -> targets.getTimeoutRate();
            case QUALITY_SCORE -> targets.getQualityScore();
            case COLLABORATION_SUCCESS_RATE -> targets.getCollaborationSuccessRate();
            case RESOURCE_USAGE -> targets.getResourceUsage();
        };
    }

    private Map<String, Object> message(String type, Map<String, Object> body) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", type);
        payload.putAll(body);
        payload.put("timestamp", clock.instant().toString());
        return payload;
    }

    /**
     * Acquires the agent's lock. Retries when {@link #releaseAgent} dropped the lock between
     * lookup and acquisition, so two callers never hold different locks for one agent.
     */
    private ReentrantLock lockAgent(String agentId) {
        while (true) {
            ReentrantLock lock = agentLocks.computeIfAbsent(agentId, id -> new ReentrantLock());
            lock.lock();
            if (agentLocks.get(agentId) == lock) {
                return lock;
            }
            lock.unlock();
        }
    }

    /** Most recent penalties of one agent and how many were ever applied. */
    private static final class PenaltyHistory {
        private final Deque<Penalty> recent = new ArrayDeque<>(RECENT_PENALTIES);
        private int total;

        synchronized void add(Penalty penalty) {
            recent.addLast(penalty);
            if (recent.size() > RECENT_PENALTIES) {
                recent.removeFirst();
            }
            total++;
        }

        synchronized int total() {
            return total;
        }

        synchronized List<Penalty> recent() {
            return List.copyOf(recent);
        }
    }
}
