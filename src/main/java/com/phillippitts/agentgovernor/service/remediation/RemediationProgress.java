package com.phillippitts.agentgovernor.service.remediation;

import java.util.List;

/**
 * Snapshot of a live retraining session.
 *
 * @param currentStage    display name of the stage in progress
 * @param attempt         attempt number within the current stage
 * @param overallProgress passed stages divided by total stages
 */
public record RemediationProgress(
        String sessionId,
        String agentId,
        List<String> deficiencies,
        String currentStage,
        int attempt,
        int stageTasksCompleted,
        double stageSuccessRate,
        int completedStages,
        int totalStages,
        double overallProgress,
        RetrainingSession.Status status
) {}
