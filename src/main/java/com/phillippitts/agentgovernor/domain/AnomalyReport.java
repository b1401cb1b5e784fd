package com.phillippitts.agentgovernor.domain;

/**
 * Result of checking a penalty for signs that it may be unfair.
 *
 * @param anomalies           individual findings
 * @param anomalyScore        weighted sum of findings in [0,1]
 * @param autoReviewTriggered whether the penalty must go to a reviewer automatically
 * @param recommendation      human-readable advice
 */
public record AnomalyReport(Anomalies anomalies, double anomalyScore, boolean autoReviewTriggered, String recommendation) {

    public record Anomalies(
            boolean disproportionatePenalty,
            boolean environmentalAnomaly,
            boolean systemStress,
            boolean suddenPerformanceDrop
    ) {}
}
