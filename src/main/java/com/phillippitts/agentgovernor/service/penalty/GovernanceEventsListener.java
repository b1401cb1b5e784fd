package com.phillippitts.agentgovernor.service.penalty;

import com.phillippitts.agentgovernor.service.penalty.event.AppealFiledEvent;
import com.phillippitts.agentgovernor.service.penalty.event.AppealReviewedEvent;
import com.phillippitts.agentgovernor.service.penalty.event.PenaltyAppliedEvent;
import com.phillippitts.agentgovernor.service.penalty.event.PenaltyRemovedEvent;
import com.phillippitts.agentgovernor.service.penalty.event.PenaltyReversedEvent;
import com.phillippitts.agentgovernor.service.penalty.event.ProbationEndedEvent;
import com.phillippitts.agentgovernor.service.penalty.event.ProbationStartedEvent;
import com.phillippitts.agentgovernor.service.remediation.event.RemediationFailedEvent;
import com.phillippitts.agentgovernor.service.remediation.event.RemediationGraduatedEvent;
import com.phillippitts.agentgovernor.service.remediation.event.RemediationStartedEvent;
import com.phillippitts.agentgovernor.service.remediation.event.StageCompletedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/** Audit log of governance events. Evidence payloads are not logged. */
@Component
class GovernanceEventsListener {
    private static final Logger LOG = LogManager.getLogger(GovernanceEventsListener.class);

    @EventListener
    void onPenaltyApplied(PenaltyAppliedEvent e) {
        LOG.warn("Penalty applied: agent={}, level={}, id={}, triggers={}",
                e.penalty().agentId(), e.penalty().level().level(), e.penalty().id(), e.penalty().triggeredBy());
    }

    @EventListener
    void onPenaltyRemoved(PenaltyRemovedEvent e) {
        LOG.info("Penalty removed: agent={}, id={}, reason={}", e.agentId(), e.penaltyId(), e.reason());
    }

    @EventListener
    void onPenaltyReversed(PenaltyReversedEvent e) {
        LOG.info("Penalty reversed: agent={}, id={}, appeal={}, reviewer={}",
                e.agentId(), e.penaltyId(), e.appealId(), e.reviewerId());
    }

    @EventListener
    void onAppealFiled(AppealFiledEvent e) {
        LOG.info("Appeal filed: agent={}, appeal={}, grounds={}, automatic={}",
                e.appeal().agentId(), e.appeal().id(), e.appeal().grounds().type(), e.automatic());
    }

    @EventListener
    void onAppealReviewed(AppealReviewedEvent e) {
        LOG.info("Appeal reviewed: agent={}, appeal={}, status={}",
                e.appeal().agentId(), e.appeal().id(), e.appeal().status().tag());
    }

    @EventListener
    void onRemediationStarted(RemediationStartedEvent e) {
        LOG.info("Retraining started: agent={}, session={}, deficiencies={}",
                e.agentId(), e.sessionId(), e.deficiencies());
    }

    @EventListener
    void onStageCompleted(StageCompletedEvent e) {
        LOG.info("Retraining stage closed: agent={}, stage={}, attempt={}, passed={}",
                e.agentId(), e.stage(), e.attempt(), e.passed());
    }

    @EventListener
    void onGraduated(RemediationGraduatedEvent e) {
        LOG.info("Retraining graduated: agent={}, session={}, score={}", e.agentId(), e.sessionId(), e.score());
    }

    @EventListener
    void onRemediationFailed(RemediationFailedEvent e) {
        LOG.warn("Retraining failed: agent={}, session={}, reason={}", e.agentId(), e.sessionId(), e.reason());
    }

    @EventListener
    void onProbationStarted(ProbationStartedEvent e) {
        LOG.info("Probation started: agent={}, until={}", e.probation().agentId(), e.probation().endsAt());
    }

    @EventListener
    void onProbationEnded(ProbationEndedEvent e) {
        LOG.info("Probation ended: agent={}", e.agentId());
    }
}
