package com.phillippitts.agentgovernor.service.remediation;

import com.phillippitts.agentgovernor.domain.Trigger;
import com.phillippitts.agentgovernor.domain.TriggerType;
import com.phillippitts.agentgovernor.exception.NotFoundException;
import com.phillippitts.agentgovernor.service.remediation.event.RemediationFailedEvent;
import com.phillippitts.agentgovernor.service.remediation.event.RemediationGraduatedEvent;
import com.phillippitts.agentgovernor.service.remediation.event.RemediationStartedEvent;
import com.phillippitts.agentgovernor.service.remediation.event.StageCompletedEvent;
import com.phillippitts.agentgovernor.testutil.GovernanceFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RemediationManagerTest {

    private static final String AGENT = "agent-r";
    private static final List<Trigger> TRIGGERS = List.of(
            new Trigger(TriggerType.ERROR_RATE, 0.45, 0.10, 4),
            new Trigger(TriggerType.QUALITY_DROP, 0.35, 0.20, 3));

    private GovernanceFixture fx;
    private RemediationManager manager;

    @BeforeEach
    void setUp() {
        fx = new GovernanceFixture();
        manager = fx.remediation;
    }

    @Test
    void startsAtDiagnosisWithDeficienciesFromTriggers() {
        String sessionId = manager.startRetraining(AGENT, TRIGGERS);

        RemediationProgress progress = manager.getProgress(AGENT);
        assertThat(progress.sessionId()).isEqualTo(sessionId);
        assertThat(progress.currentStage()).isEqualTo("Diagnosis");
        assertThat(progress.deficiencies()).containsExactly("error_handling", "quality_assurance");
        assertThat(progress.totalStages()).isEqualTo(4);
        assertThat(progress.overallProgress()).isZero();
        assertThat(fx.publisher.eventsOfType(RemediationStartedEvent.class)).hasSize(1);
        assertThat(fx.eventBus.routingKeys()).containsExactly("retraining.started");
    }

    @Test
    void secondStartKeepsLiveSession() {
        String first = manager.startRetraining(AGENT, TRIGGERS);
        String second = manager.startRetraining(AGENT, List.of(new Trigger(TriggerType.RESOURCE_ABUSE, 2.5, 1.5, 4)));

        assertThat(second).isEqualTo(first);
        assertThat(manager.getActiveCount()).isEqualTo(1);
        assertThat(fx.publisher.eventsOfType(RemediationStartedEvent.class)).hasSize(1);
    }

    @Test
    void fullCurriculumGraduatesAgent() {
        manager.startRetraining(AGENT, TRIGGERS);

        passTimedStage(Duration.ofMinutes(3));
        passTimedStage(Duration.ofMinutes(7));
        passPracticeStage(9);
        assertThat(manager.getProgress(AGENT).currentStage()).isEqualTo("Graduated Tasks");
        passPracticeStage(9);

        assertThat(manager.isInRemediation(AGENT)).isFalse();
        assertThat(manager.getProgress(AGENT)).isNull();
        assertThat(fx.publisher.eventsOfType(RemediationGraduatedEvent.class)).singleElement()
                .satisfies(e -> assertThat(e.score()).isEqualTo(0.9));
        assertThat(fx.publisher.eventsOfType(StageCompletedEvent.class)).hasSize(4);
        assertThat(fx.eventBus.routingKeys()).contains("retraining.completed");

        RemediationStatistics stats = manager.getStatistics();
        assertThat(stats.successful()).isEqualTo(1);
        assertThat(stats.graduationRate()).isEqualTo(1.0);
        assertThat(stats.averageDuration()).isEqualTo(Duration.ofMinutes(10));
    }

    @Test
    void stageClosedBeforeMinimumTimeIsRetried() {
        manager.startRetraining(AGENT, TRIGGERS);

        StageAttempt early = manager.completeStage(AGENT);

        assertThat(early.passed()).isFalse();
        assertThat(manager.getProgress(AGENT).currentStage()).isEqualTo("Diagnosis");
        assertThat(manager.getProgress(AGENT).attempt()).isEqualTo(2);
    }

    @Test
    void minimumTimeCanBeWaived() {
        fx.properties.getRemediation().setEnforceMinimumStageTime(false);
        manager.startRetraining(AGENT, TRIGGERS);

        assertThat(manager.completeStage(AGENT).passed()).isTrue();
        assertThat(manager.completeStage(AGENT).passed()).isTrue();
        assertThat(manager.getProgress(AGENT).currentStage()).isEqualTo("Supervised Practice");
        assertThat(manager.getProgress(AGENT).completedStages()).isEqualTo(2);
    }

    @Test
    void exhaustingStageAttemptsFailsSession() {
        fx.properties.getRemediation().setEnforceMinimumStageTime(false);
        manager.startRetraining(AGENT, TRIGGERS);
        manager.completeStage(AGENT);
        manager.completeStage(AGENT);

        failPracticeStage();
        assertThat(manager.isInRemediation(AGENT)).isTrue();
        failPracticeStage();

        assertThat(manager.isInRemediation(AGENT)).isFalse();
        assertThat(fx.publisher.eventsOfType(RemediationFailedEvent.class)).singleElement()
                .satisfies(e -> assertThat(e.reason()).contains("Supervised Practice").contains("2 attempts"));
        assertThat(manager.getStatistics().failed()).isEqualTo(1);
        assertThat(fx.eventBus.routingKeys()).contains("retraining.failed");
    }

    @Test
    void lowAggregateScoreFailsInsteadOfGraduating() {
        fx.properties.getRemediation().setEnforceMinimumStageTime(false);
        fx.properties.getRemediation().setMinimumGraduationScore(0.95);
        manager.startRetraining(AGENT, TRIGGERS);
        manager.completeStage(AGENT);
        manager.completeStage(AGENT);
        passPracticeStage(9);
        passPracticeStage(9);

        assertThat(fx.publisher.eventsOfType(RemediationGraduatedEvent.class)).isEmpty();
        assertThat(fx.publisher.eventsOfType(RemediationFailedEvent.class)).singleElement()
                .satisfies(e -> assertThat(e.reason()).startsWith("Aggregate score 0.90"));
    }

    @Test
    void cancelledSessionIsLeftOutOfStatistics() {
        manager.startRetraining(AGENT, TRIGGERS);

        assertThat(manager.cancelRetraining(AGENT, "penalty lifted")).isTrue();
        assertThat(manager.cancelRetraining(AGENT, "again")).isFalse();

        RemediationStatistics stats = manager.getStatistics();
        assertThat(stats.active()).isZero();
        assertThat(stats.completed()).isZero();
        assertThat(stats.graduationRate()).isZero();
        assertThat(fx.eventBus.routingKeys()).containsExactly("retraining.started", "retraining.cancelled");
    }

    @Test
    void taskResultsWithoutSessionAreRejected() {
        assertThatThrownBy(() -> manager.recordTaskResult(AGENT, true))
                .isInstanceOf(NotFoundException.class)
                .hasMessageContaining(AGENT);
        assertThatThrownBy(() -> manager.completeStage(AGENT))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void busFailureDoesNotStopProgression() {
        fx.eventBus.failing = true;
        fx.properties.getRemediation().setEnforceMinimumStageTime(false);

        manager.startRetraining(AGENT, TRIGGERS);
        manager.completeStage(AGENT);

        assertThat(manager.getProgress(AGENT).currentStage()).isEqualTo("Skill Review");
        assertThat(fx.registry.find("agentgovernor.bus.publish.failure").counter().count()).isEqualTo(2.0);
    }

    private void passTimedStage(Duration minimum) {
        fx.clock.advance(minimum);
        assertThat(manager.completeStage(AGENT).passed()).isTrue();
    }

    private void passPracticeStage(int successes) {
        for (int i = 0; i < 10; i++) {
            manager.recordTaskResult(AGENT, i < successes);
        }
        assertThat(manager.completeStage(AGENT).passed()).isTrue();
    }

    private void failPracticeStage() {
        for (int i = 0; i < 10; i++) {
            manager.recordTaskResult(AGENT, i < 5);
        }
        assertThat(manager.completeStage(AGENT).passed()).isFalse();
    }
}
