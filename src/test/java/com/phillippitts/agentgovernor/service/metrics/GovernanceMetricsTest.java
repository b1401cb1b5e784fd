package com.phillippitts.agentgovernor.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class GovernanceMetricsTest {

    private MeterRegistry registry;
    private GovernanceMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new GovernanceMetrics(registry);
    }

    @Test
    void shouldCountPenaltiesPerLevel() {
        metrics.incrementPenaltyApplied(2);
        metrics.incrementPenaltyApplied(2);
        metrics.incrementPenaltyApplied(5);

        Counter level2 = registry.find("agentgovernor.penalty.applied").tag("level", "2").counter();
        Counter level5 = registry.find("agentgovernor.penalty.applied").tag("level", "5").counter();
        assertThat(level2).isNotNull();
        assertThat(level2.count()).isEqualTo(2.0);
        assertThat(level5.count()).isEqualTo(1.0);
    }

    @Test
    void shouldCountRemovalsByReason() {
        metrics.incrementPenaltyRemoved("expired");

        assertThat(registry.find("agentgovernor.penalty.removed").tag("reason", "expired").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void shouldSeparateManualAndAutomaticAppeals() {
        metrics.incrementAppealFiled(true);
        metrics.incrementAppealFiled(false);
        metrics.incrementAppealFiled(false);

        assertThat(registry.find("agentgovernor.appeal.filed").tag("automatic", "true").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.find("agentgovernor.appeal.filed").tag("automatic", "false").counter().count())
                .isEqualTo(2.0);
    }

    @Test
    void shouldCountReviewsAndRejections() {
        metrics.incrementAppealReviewed("approved");
        metrics.incrementThrottleRejection();

        assertThat(registry.find("agentgovernor.appeal.reviewed").tag("decision", "approved").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.find("agentgovernor.throttle.rejected").counter().count()).isEqualTo(1.0);
    }

    @Test
    void shouldRecordEvaluationLatencyByOutcome() {
        metrics.recordEvaluation("penalized", TimeUnit.MILLISECONDS.toNanos(40));

        Timer timer = registry.find("agentgovernor.evaluation.latency").tag("outcome", "penalized").timer();
        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(1);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(40.0);
    }
}
