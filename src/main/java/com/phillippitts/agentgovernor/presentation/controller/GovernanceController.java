package com.phillippitts.agentgovernor.presentation.controller;

import com.phillippitts.agentgovernor.domain.Appeal;
import com.phillippitts.agentgovernor.domain.AppealDecision;
import com.phillippitts.agentgovernor.domain.AppealGrounds;
import com.phillippitts.agentgovernor.domain.FairnessMetrics;
import com.phillippitts.agentgovernor.domain.GovernanceDashboard;
import com.phillippitts.agentgovernor.domain.Penalty;
import com.phillippitts.agentgovernor.domain.PenaltyStatus;
import com.phillippitts.agentgovernor.exception.NotFoundException;
import com.phillippitts.agentgovernor.service.penalty.PenaltyLifecycleController;
import com.phillippitts.agentgovernor.service.remediation.RemediationManager;
import com.phillippitts.agentgovernor.service.remediation.RemediationProgress;
import com.phillippitts.agentgovernor.service.remediation.StageAttempt;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST surface over the governance engine. Authorization and message-schema validation are
 * expected upstream.
 */
@RestController
@RequestMapping("/api/governance")
class GovernanceController {

    private final PenaltyLifecycleController lifecycle;
    private final RemediationManager remediation;

    GovernanceController(PenaltyLifecycleController lifecycle, RemediationManager remediation) {
        this.lifecycle = lifecycle;
        this.remediation = remediation;
    }

    @PostMapping("/agents/{agentId}/evaluate")
    ResponseEntity<Penalty> evaluate(@PathVariable String agentId) {
        Penalty penalty = lifecycle.evaluateAgentPerformance(agentId);
        return penalty == null ? ResponseEntity.noContent().build() : ResponseEntity.ok(penalty);
    }

    @PostMapping("/agents/{agentId}/recovery")
    Map<String, Object> checkRecovery(@PathVariable String agentId) {
        return Map.of("agentId", agentId, "recovered", lifecycle.checkForRecovery(agentId));
    }

    @GetMapping("/agents/{agentId}/status")
    PenaltyStatus status(@PathVariable String agentId) {
        return lifecycle.getPenaltyStatus(agentId);
    }

    @DeleteMapping("/agents/{agentId}")
    Map<String, Object> release(@PathVariable String agentId) {
        return Map.of("agentId", agentId, "released", lifecycle.releaseAgent(agentId));
    }

    @PostMapping("/agents/{agentId}/admit")
    Map<String, Object> admit(@PathVariable String agentId,
                              @RequestParam(defaultValue = "1") double tokens) {
        return Map.of("agentId", agentId, "admitted", lifecycle.tryAdmitTask(agentId, tokens));
    }

    @GetMapping("/agents/{agentId}/retraining")
    RemediationProgress retraining(@PathVariable String agentId) {
        RemediationProgress progress = remediation.getProgress(agentId);
        if (progress == null) {
            throw new NotFoundException("RetrainingSession", agentId);
        }
        return progress;
    }

    @PostMapping("/agents/{agentId}/retraining/tasks")
    ResponseEntity<Void> recordTask(@PathVariable String agentId, @Valid @RequestBody TaskResultRequest request) {
        remediation.recordTaskResult(agentId, request.success());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/agents/{agentId}/retraining/stage")
    StageOutcome completeStage(@PathVariable String agentId) {
        StageAttempt attempt = remediation.completeStage(agentId);
        return new StageOutcome(attempt.stage().displayName(), attempt.attemptNumber(), attempt.passed(),
                attempt.tasksCompleted(), attempt.successRate());
    }

    @PostMapping("/appeals")
    ResponseEntity<Map<String, String>> fileAppeal(@Valid @RequestBody AppealRequest request) {
        AppealGrounds grounds = new AppealGrounds(request.groundsType(), request.explanation(), request.evidence());
        String appealId = lifecycle.fileAppeal(request.penaltyId(), request.agentId(), grounds);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("appealId", appealId));
    }

    @GetMapping("/appeals/{appealId}")
    Appeal appeal(@PathVariable String appealId) {
        return lifecycle.getAppeal(appealId);
    }

    @PostMapping("/appeals/{appealId}/review")
    Appeal review(@PathVariable String appealId, @Valid @RequestBody ReviewRequest request) {
        return lifecycle.reviewAppeal(appealId, request.reviewerId(), request.decision(), request.comments());
    }

    @GetMapping("/dashboard")
    GovernanceDashboard dashboard() {
        return lifecycle.getDashboard();
    }

    @GetMapping("/fairness")
    FairnessMetrics fairness() {
        return lifecycle.getFairnessReport();
    }

    record TaskResultRequest(@NotNull Boolean success) { }

    record AppealRequest(
            @NotBlank String penaltyId,
            @NotBlank String agentId,
            @NotBlank String groundsType,
            String explanation,
            Map<String, Object> evidence
    ) { }

    record ReviewRequest(@NotBlank String reviewerId, @NotNull AppealDecision decision, List<String> comments) { }

    record StageOutcome(String stage, int attempt, boolean passed, int tasksCompleted, double successRate) { }
}
