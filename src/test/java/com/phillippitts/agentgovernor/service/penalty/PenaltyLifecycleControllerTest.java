package com.phillippitts.agentgovernor.service.penalty;

import com.phillippitts.agentgovernor.domain.AgentMetrics;
import com.phillippitts.agentgovernor.domain.Appeal;
import com.phillippitts.agentgovernor.domain.AppealDecision;
import com.phillippitts.agentgovernor.domain.AppealGrounds;
import com.phillippitts.agentgovernor.domain.AppealStatus;
import com.phillippitts.agentgovernor.domain.EvaluationContext;
import com.phillippitts.agentgovernor.domain.GovernanceDashboard;
import com.phillippitts.agentgovernor.domain.Penalty;
import com.phillippitts.agentgovernor.domain.PenaltyLevel;
import com.phillippitts.agentgovernor.domain.PenaltyStatus;
import com.phillippitts.agentgovernor.domain.TargetMetric;
import com.phillippitts.agentgovernor.domain.Trigger;
import com.phillippitts.agentgovernor.domain.TriggerType;
import com.phillippitts.agentgovernor.exception.CollaboratorFailureException;
import com.phillippitts.agentgovernor.exception.InvalidTransitionException;
import com.phillippitts.agentgovernor.exception.NotFoundException;
import com.phillippitts.agentgovernor.service.collaborator.SystemSnapshot;
import com.phillippitts.agentgovernor.service.penalty.event.AppealFiledEvent;
import com.phillippitts.agentgovernor.service.penalty.event.PenaltyAppliedEvent;
import com.phillippitts.agentgovernor.service.penalty.event.PenaltyRemovedEvent;
import com.phillippitts.agentgovernor.service.penalty.event.PenaltyReversedEvent;
import com.phillippitts.agentgovernor.service.penalty.event.ProbationEndedEvent;
import com.phillippitts.agentgovernor.service.penalty.event.ProbationStartedEvent;
import com.phillippitts.agentgovernor.service.remediation.event.RemediationGraduatedEvent;
import com.phillippitts.agentgovernor.testutil.GovernanceFixture;
import com.phillippitts.agentgovernor.testutil.StubMetricsSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class PenaltyLifecycleControllerTest {

    private static final String AGENT = "agent-1";

    private GovernanceFixture fx;
    private PenaltyLifecycleController controller;

    @BeforeEach
    void setUp() {
        fx = new GovernanceFixture();
        controller = fx.controller;
    }

    @Test
    void errorRateViolationAppliesWarning() {
        fx.metricsSource.set(StubMetricsSource.withErrorRate(AGENT, 0.15));

        Penalty penalty = controller.evaluateAgentPerformance(AGENT);

        assertThat(penalty.level()).isEqualTo(PenaltyLevel.WARNING);
        assertThat(penalty.triggeredBy()).containsExactly(TriggerType.ERROR_RATE);
        assertThat(penalty.reason()).isEqualTo("Error rate (15.0%) exceeds threshold (10%)");
        assertThat(penalty.improvementPlan().targetMetrics())
                .containsOnlyKeys(TargetMetric.ERROR_RATE)
                .hasEntrySatisfying(TargetMetric.ERROR_RATE, target -> assertThat(target).isLessThan(0.10));
        assertThat(penalty.appealStatus()).isEqualTo(AppealStatus.NONE);
        assertThat(penalty.expiresAt()).isEqualTo(penalty.appliedAt().plus(Duration.ofHours(1)));
        assertThat(penalty.appealDeadline()).isEqualTo(penalty.appliedAt().plus(Duration.ofMinutes(60)));
        assertThat(controller.getActivePenalty(AGENT)).isEqualTo(penalty);
        assertThat(fx.publisher.eventsOfType(PenaltyAppliedEvent.class)).hasSize(1);
        assertThat(fx.eventBus.routingKeys()).containsExactly("penalty.applied.level1." + AGENT);
        assertThat(fx.registry.find("agentgovernor.penalty.applied").tag("level", "1").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void healthyAgentIsNotPenalized() {
        assertThat(controller.evaluateAgentPerformance(AGENT)).isNull();

        assertThat(controller.getActivePenalty(AGENT)).isNull();
        assertThat(fx.eventBus.messages()).isEmpty();
        assertThat(fx.registry.find("agentgovernor.evaluation.latency").tag("outcome", "healthy").timer().count())
                .isEqualTo(1);
    }

    @Test
    void metricsFailureAppliesNothing() {
        fx.metricsSource.failing = true;

        assertThatThrownBy(() -> controller.evaluateAgentPerformance(AGENT))
                .isInstanceOf(CollaboratorFailureException.class)
                .hasMessageContaining("metrics-source");
        assertThat(controller.getActivePenalty(AGENT)).isNull();
    }

    @Test
    void recoveryLiftsPenaltyOnceTargetsAreMet() {
        fx.metricsSource.set(StubMetricsSource.withErrorRate(AGENT, 0.15));
        Penalty penalty = controller.evaluateAgentPerformance(AGENT);
        fx.metricsSource.set(StubMetricsSource.withErrorRate(AGENT, 0.03));

        assertThat(controller.checkForRecovery(AGENT)).isTrue();
        assertThat(controller.checkForRecovery(AGENT)).isFalse();

        assertThat(controller.getActivePenalty(AGENT)).isNull();
        assertThat(fx.publisher.eventsOfType(PenaltyRemovedEvent.class)).singleElement()
                .satisfies(e -> {
                    assertThat(e.penaltyId()).isEqualTo(penalty.id());
                    assertThat(e.reason()).isEqualTo(PenaltyLifecycleController.REASON_RECOVERED);
                });
        assertThat(fx.eventBus.routingKeys()).contains("penalty.removed." + AGENT);
        assertThat(controller.getPenaltyStatus(AGENT).throttle().penaltyMultiplier()).isEqualTo(1.0);
    }

    @Test
    void recoveryRequiresEveryTarget() {
        fx.metricsSource.set(metrics(0.15, 0.65, 0.35));
        Penalty penalty = controller.evaluateAgentPerformance(AGENT);
        assertThat(penalty.triggeredBy()).containsExactly(TriggerType.ERROR_RATE, TriggerType.COLLABORATION_FAILURE);

        fx.metricsSource.set(metrics(0.03, 0.65, 0.35));
        assertThat(controller.checkForRecovery(AGENT)).isFalse();
        assertThat(controller.getActivePenalty(AGENT)).isNotNull();

        fx.metricsSource.set(metrics(0.03, 0.85, 0.15));
        assertThat(controller.checkForRecovery(AGENT)).isTrue();
    }

    @Test
    void recoveryWithoutPenaltyDoesNotFetchMetrics() {
        assertThat(controller.checkForRecovery(AGENT)).isFalse();
        assertThat(fx.metricsSource.calls()).isZero();
    }

    @Test
    void approvedAppealReversesPenalty() {
        Penalty penalty = penalize();
        controller.tryAdmitTask(AGENT, 60.0);

        String appealId = controller.fileAppeal(penalty.id(), AGENT, grounds());
        assertThat(controller.getActivePenalty(AGENT).appealStatus()).isEqualTo(AppealStatus.PENDING);
        assertThat(controller.getAppeal(appealId).status()).isEqualTo(AppealStatus.PENDING);

        Appeal reviewed = controller.reviewAppeal(appealId, "reviewer-9", AppealDecision.APPROVED, List.of("outage confirmed"));

        assertThat(reviewed.status()).isEqualTo(AppealStatus.APPROVED);
        assertThat(reviewed.review().reviewerId()).isEqualTo("reviewer-9");
        assertThat(controller.getActivePenalty(AGENT)).isNull();
        assertThat(controller.getPenaltyStatus(AGENT).throttle().available()).isEqualTo(100.0);
        assertThat(fx.publisher.eventsOfType(PenaltyReversedEvent.class)).singleElement()
                .satisfies(e -> assertThat(e.appealId()).isEqualTo(appealId));
        assertThat(fx.publisher.eventsOfType(PenaltyRemovedEvent.class)).singleElement()
                .satisfies(e -> assertThat(e.reason()).isEqualTo(PenaltyLifecycleController.REASON_APPEAL_APPROVED));
        assertThat(fx.eventBus.routingKeys()).contains("penalty.reversed." + AGENT);
    }

    @Test
    void appealCanOnlyBeReviewedOnce() {
        Penalty penalty = penalize();
        String appealId = controller.fileAppeal(penalty.id(), AGENT, grounds());
        controller.reviewAppeal(appealId, "reviewer-9", AppealDecision.APPROVED, List.of());

        assertThatThrownBy(() -> controller.reviewAppeal(appealId, "reviewer-2", AppealDecision.DENIED, List.of()))
                .isInstanceOf(InvalidTransitionException.class)
                .hasMessageContaining("already reviewed");
        assertThat(controller.getAppeal(appealId).status()).isEqualTo(AppealStatus.APPROVED);
    }

    @Test
    void deniedAppealKeepsPenaltyAndBlocksFurtherAppeals() {
        Penalty penalty = penalize();
        String appealId = controller.fileAppeal(penalty.id(), AGENT, grounds());

        controller.reviewAppeal(appealId, "reviewer-9", AppealDecision.DENIED, List.of("metrics are accurate"));

        assertThat(controller.getActivePenalty(AGENT).appealStatus()).isEqualTo(AppealStatus.DENIED);
        assertThatThrownBy(() -> controller.fileAppeal(penalty.id(), AGENT, grounds()))
                .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    void pendingAppealBlocksSecondAppeal() {
        Penalty penalty = penalize();
        controller.fileAppeal(penalty.id(), AGENT, grounds());

        assertThatThrownBy(() -> controller.fileAppeal(penalty.id(), AGENT, grounds()))
                .isInstanceOf(InvalidTransitionException.class)
                .hasMessageContaining("pending");
    }

    @Test
    void appealAgainstUnknownPenaltyCreatesNothing() {
        penalize();

        assertThatThrownBy(() -> controller.fileAppeal("no-such-penalty", AGENT, grounds()))
                .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> controller.fileAppeal("no-such-penalty", "agent-unknown", grounds()))
                .isInstanceOf(NotFoundException.class);
        assertThat(controller.getDashboard().appeals().total()).isZero();
        assertThat(controller.getActivePenalty(AGENT).appealStatus()).isEqualTo(AppealStatus.NONE);
    }

    @Test
    void reviewOfUnknownAppealIsNotFound() {
        assertThatThrownBy(() -> controller.reviewAppeal("missing", "reviewer", AppealDecision.APPROVED, List.of()))
                .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> controller.getAppeal("missing"))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void appealAfterDeadlineIsRejected() {
        Penalty penalty = penalize();
        fx.clock.advance(Duration.ofMinutes(61));

        assertThatThrownBy(() -> controller.fileAppeal(penalty.id(), AGENT, grounds()))
                .isInstanceOf(InvalidTransitionException.class)
                .hasMessageContaining("deadline");
    }

    @Test
    void busFailureDoesNotRollBackPenalty() {
        fx.eventBus.failing = true;
        fx.metricsSource.set(StubMetricsSource.withErrorRate(AGENT, 0.15));

        Penalty penalty = controller.evaluateAgentPerformance(AGENT);

        assertThat(controller.getActivePenalty(AGENT)).isEqualTo(penalty);
        assertThat(fx.publisher.eventsOfType(PenaltyAppliedEvent.class)).hasSize(1);
        assertThat(fx.registry.find("agentgovernor.bus.publish.failure").tag("topic", "agent.penalties")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void severePenaltyStartsRetrainingAndDefersRecovery() {
        Penalty penalty = controller.applyPenalty(AGENT, 5,
                List.of(new Trigger(TriggerType.ERROR_RATE, 0.45, 0.10, 4)), context(SystemSnapshot.NOMINAL));

        assertThat(penalty.expiresAt()).isNull();
        assertThat(fx.remediation.isInRemediation(AGENT)).isTrue();

        fx.metricsSource.set(StubMetricsSource.healthy(AGENT));
        assertThat(controller.checkForRecovery(AGENT)).isFalse();
        assertThat(controller.getActivePenalty(AGENT)).isNotNull();

        fx.clock.advance(Duration.ofDays(30));
        assertThat(controller.expirePenalties()).isZero();
    }

    @Test
    void graduationStartsProbationAndRecoveryEndsIt() {
        controller.applyPenalty(AGENT, 5,
                List.of(new Trigger(TriggerType.ERROR_RATE, 0.45, 0.10, 4)), context(SystemSnapshot.NOMINAL));
        graduate();

        RemediationGraduatedEvent graduated = fx.publisher.eventsOfType(RemediationGraduatedEvent.class).get(0);
        controller.onRemediationGraduated(graduated);

        PenaltyStatus status = controller.getPenaltyStatus(AGENT);
        assertThat(status.probation()).isNotNull();
        assertThat(status.probation().duration()).isEqualTo(Duration.ofMinutes(240));
        assertThat(fx.publisher.eventsOfType(ProbationStartedEvent.class)).hasSize(1);
        assertThat(controller.getDashboard().probation().agents()).containsExactly(AGENT);

        fx.metricsSource.set(StubMetricsSource.healthy(AGENT));
        assertThat(controller.checkForRecovery(AGENT)).isTrue();
        assertThat(controller.getPenaltyStatus(AGENT).probation()).isNull();
        assertThat(fx.publisher.eventsOfType(ProbationEndedEvent.class)).hasSize(1);
    }

    @Test
    void suspiciousPenaltyIsAppealedAutomatically() {
        SystemSnapshot stressed = new SystemSnapshot(0.9, 50, 80.0, true, true, false);

        Penalty penalty = controller.applyPenalty(AGENT, 6,
                List.of(new Trigger(TriggerType.ERROR_RATE, 0.12, 0.10, 1)), context(stressed));

        assertThat(penalty.appealStatus()).isEqualTo(AppealStatus.PENDING);
        assertThat(fx.publisher.eventsOfType(AppealFiledEvent.class)).singleElement()
                .satisfies(e -> {
                    assertThat(e.automatic()).isTrue();
                    assertThat(e.appeal().grounds().type()).isEqualTo(AppealGrounds.SYSTEMIC_ISSUE);
                    assertThat(e.appeal().grounds().evidence()).containsKeys("metrics", "anomalyScore");
                });
        assertThat(fx.registry.find("agentgovernor.appeal.filed").tag("automatic", "true").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void expiredPenaltiesAreRemoved() {
        penalize();
        fx.clock.advance(Duration.ofMinutes(59));
        assertThat(controller.expirePenalties()).isZero();

        fx.clock.advance(Duration.ofMinutes(2));
        assertThat(controller.expirePenalties()).isEqualTo(1);

        assertThat(controller.getActivePenalty(AGENT)).isNull();
        assertThat(fx.publisher.eventsOfType(PenaltyRemovedEvent.class)).singleElement()
                .satisfies(e -> assertThat(e.reason()).isEqualTo(PenaltyLifecycleController.REASON_EXPIRED));
    }

    @Test
    void newPenaltyReplacesActiveOneAndOnlyRecentPenaltiesAreKept() {
        fx.metricsSource.set(StubMetricsSource.withErrorRate(AGENT, 0.15));
        List<Penalty> applied = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            applied.add(controller.evaluateAgentPerformance(AGENT));
        }
        Penalty last = applied.get(6);

        PenaltyStatus status = controller.getPenaltyStatus(AGENT);
        assertThat(status.active()).isEqualTo(last);
        assertThat(status.historySize()).isEqualTo(7);
        assertThat(status.recentPenalties()).containsExactlyElementsOf(applied.subList(2, 7));
        assertThat(controller.getDashboard().totalPenalties()).isEqualTo(1);
        assertThat(controller.getFairnessReport().totalPenalties()).isEqualTo(7);
    }

    @Test
    void throttleGatesOnlyPenalizedAgents() {
        assertThat(controller.tryAdmitTask("agent-free", 1_000.0)).isTrue();

        penalize();
        assertThat(controller.tryAdmitTask(AGENT, 100.0)).isTrue();
        assertThat(controller.tryAdmitTask(AGENT, 1.0)).isFalse();

        assertThat(fx.registry.find("agentgovernor.throttle.rejected").counter().count()).isEqualTo(1.0);
    }

    @Test
    void dashboardCountsAppealsAndLevels() {
        Penalty penalty = penalize();
        String appealId = controller.fileAppeal(penalty.id(), AGENT, grounds());
        controller.reviewAppeal(appealId, "reviewer", AppealDecision.DENIED, List.of());
        fx.metricsSource.set(StubMetricsSource.withErrorRate("agent-2", 0.15));
        controller.evaluateAgentPerformance("agent-2");

        GovernanceDashboard dashboard = controller.getDashboard();

        assertThat(dashboard.totalPenalties()).isEqualTo(2);
        assertThat(dashboard.byLevel()).contains(entry("level1", 2), entry("level6", 0));
        assertThat(dashboard.appeals().denied()).isEqualTo(1);
        assertThat(dashboard.appeals().approvalRate()).isZero();
        assertThat(controller.getPenalizedAgents()).containsExactlyInAnyOrder(AGENT, "agent-2");
    }

    @Test
    void fairnessReflectsApprovedAppeals() {
        Penalty penalty = penalize();
        String appealId = controller.fileAppeal(penalty.id(), AGENT, grounds());
        controller.reviewAppeal(appealId, "reviewer", AppealDecision.APPROVED, List.of());

        assertThat(controller.getFairnessReport().approvedAppeals()).isEqualTo(1);
        assertThat(controller.getFairnessReport().fairnessScore()).isLessThan(100.0);
    }

    @Test
    void agentsAreEvaluatedIndependentlyInParallel() throws Exception {
        int agents = 16;
        for (int i = 0; i < agents; i++) {
            fx.metricsSource.set(StubMetricsSource.withErrorRate("agent-" + i, 0.15));
        }
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Penalty>> results = new ArrayList<>();
        try {
            for (int i = 0; i < agents; i++) {
                String agentId = "agent-" + i;
                results.add(pool.submit(() -> {
                    start.await();
                    return controller.evaluateAgentPerformance(agentId);
                }));
            }
            start.countDown();
            for (Future<Penalty> f : results) {
                assertThat(f.get(10, TimeUnit.SECONDS)).isNotNull();
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(controller.getPenalizedAgents()).hasSize(agents);
        assertThat(controller.getFairnessReport().totalPenalties()).isEqualTo(agents);
    }

    @Test
    void concurrentEvaluationsOfOneAgentLeaveOneActivePenalty() throws Exception {
        fx.metricsSource.set(StubMetricsSource.withErrorRate(AGENT, 0.15));
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Penalty>> results = new ArrayList<>();
        try {
            for (int i = 0; i < 20; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return controller.evaluateAgentPerformance(AGENT);
                }));
            }
            start.countDown();
            for (Future<Penalty> f : results) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        PenaltyStatus status = controller.getPenaltyStatus(AGENT);
        assertThat(status.historySize()).isEqualTo(20);
        assertThat(status.recentPenalties()).contains(status.active());
        assertThat(controller.getPenalizedAgents()).containsExactly(AGENT);
    }

    @Test
    void reEvaluationKeepsPendingAppealAttachedToPenalty() {
        Penalty penalty = penalize();
        String appealId = controller.fileAppeal(penalty.id(), AGENT, grounds());

        Penalty replacement = controller.evaluateAgentPerformance(AGENT);

        assertThat(replacement.id()).isEqualTo(penalty.id());
        assertThat(replacement.appealStatus()).isEqualTo(AppealStatus.PENDING);
        assertThat(replacement.appealDeadline()).isEqualTo(penalty.appealDeadline());

        controller.reviewAppeal(appealId, "reviewer-9", AppealDecision.APPROVED, List.of());
        assertThat(controller.getActivePenalty(AGENT)).isNull();
    }

    @Test
    void reEvaluationKeepsDenialFinal() {
        Penalty penalty = penalize();
        String appealId = controller.fileAppeal(penalty.id(), AGENT, grounds());
        controller.reviewAppeal(appealId, "reviewer-9", AppealDecision.DENIED, List.of());

        Penalty replacement = controller.evaluateAgentPerformance(AGENT);

        assertThat(replacement.appealStatus()).isEqualTo(AppealStatus.DENIED);
        assertThatThrownBy(() -> controller.fileAppeal(replacement.id(), AGENT, grounds()))
                .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    void lighterReplacementCancelsRetraining() {
        controller.applyPenalty(AGENT, 5,
                List.of(new Trigger(TriggerType.ERROR_RATE, 0.45, 0.10, 4)), context(SystemSnapshot.NOMINAL));
        assertThat(fx.remediation.isInRemediation(AGENT)).isTrue();

        controller.applyPenalty(AGENT, 2,
                List.of(new Trigger(TriggerType.ERROR_RATE, 0.20, 0.10, 2)), context(SystemSnapshot.NOMINAL));

        assertThat(fx.remediation.isInRemediation(AGENT)).isFalse();
        fx.metricsSource.set(StubMetricsSource.healthy(AGENT));
        assertThat(controller.checkForRecovery(AGENT)).isTrue();
    }

    @Test
    void concurrentRecoveryNeverLeavesRetrainingWithoutPenalty() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        List<Trigger> triggers = List.of(new Trigger(TriggerType.ERROR_RATE, 0.45, 0.10, 4));
        try {
            for (int i = 0; i < 100; i++) {
                String agent = "race-" + i;
                fx.metricsSource.set(StubMetricsSource.healthy(agent));
                EvaluationContext context = fx.evaluator.analyzeContext(agent, StubMetricsSource.withErrorRate(agent, 0.45));
                CountDownLatch start = new CountDownLatch(1);

                Future<Penalty> apply = pool.submit(() -> {
                    start.await();
                    return controller.applyPenalty(agent, 5, triggers, context);
                });
                Future<Boolean> recover = pool.submit(() -> {
                    start.await();
                    boolean recovered = false;
                    for (int attempt = 0; attempt < 20 && !recovered; attempt++) {
                        recovered = controller.checkForRecovery(agent);
                    }
                    return recovered;
                });
                start.countDown();
                apply.get(10, TimeUnit.SECONDS);
                recover.get(10, TimeUnit.SECONDS);

                if (fx.remediation.isInRemediation(agent)) {
                    assertThat(controller.getActivePenalty(agent)).as(agent).isNotNull();
                }
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void releaseDropsRecordsOfRecoveredAgent() {
        penalize();
        fx.metricsSource.set(StubMetricsSource.healthy(AGENT));
        controller.checkForRecovery(AGENT);

        assertThat(controller.releaseAgent(AGENT)).isTrue();

        PenaltyStatus status = controller.getPenaltyStatus(AGENT);
        assertThat(status.historySize()).isZero();
        assertThat(status.throttle()).isNull();
        assertThat(controller.getFairnessReport().totalPenalties()).isEqualTo(1);
        assertThat(controller.releaseAgent(AGENT)).isFalse();

        fx.metricsSource.set(StubMetricsSource.withErrorRate(AGENT, 0.15));
        assertThat(controller.evaluateAgentPerformance(AGENT)).isNotNull();
    }

    @Test
    void releaseOfPenalizedAgentIsRejected() {
        penalize();

        assertThatThrownBy(() -> controller.releaseAgent(AGENT))
                .isInstanceOf(InvalidTransitionException.class)
                .hasMessageContaining("still holds penalty");
        assertThat(controller.getPenaltyStatus(AGENT).historySize()).isEqualTo(1);
    }

    private Penalty penalize() {
        fx.metricsSource.set(StubMetricsSource.withErrorRate(AGENT, 0.15));
        return controller.evaluateAgentPerformance(AGENT);
    }

    private EvaluationContext context(SystemSnapshot snapshot) {
        fx.conditions = snapshot;
        return fx.evaluator.analyzeContext(AGENT, StubMetricsSource.withErrorRate(AGENT, 0.45));
    }

    private void graduate() {
        fx.properties.getRemediation().setEnforceMinimumStageTime(false);
        fx.remediation.completeStage(AGENT);
        fx.remediation.completeStage(AGENT);
        for (int stage = 0; stage < 2; stage++) {
            for (int i = 0; i < 10; i++) {
                fx.remediation.recordTaskResult(AGENT, true);
            }
            fx.remediation.completeStage(AGENT);
        }
    }

    private static AgentMetrics metrics(double errorRate, double collaborationSuccess, double collaborationFailure) {
        return new AgentMetrics(AGENT, errorRate, 0.05, 0.85, 0.9, 0.9, 0.9, collaborationSuccess, collaborationFailure,
                new AgentMetrics.ResourceUsage(0.8, 0.8, 0.5), 20, 800.0);
    }

    private static AppealGrounds grounds() {
        return new AppealGrounds("environmental_factors", "Upstream outage during the window",
                Map.of("incident", "INC-42"));
    }
}
