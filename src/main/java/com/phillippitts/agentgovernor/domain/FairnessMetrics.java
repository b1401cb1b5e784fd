package com.phillippitts.agentgovernor.domain;

/**
 * Health of the governance process as a whole.
 *
 * @param falsePositiveRate approved appeals over all penalties
 * @param appealSuccessRate approved appeals over all appeals
 * @param fairnessScore     0..100, high when few penalties are overturned
 */
public record FairnessMetrics(
        int totalPenalties,
        int totalAppeals,
        int approvedAppeals,
        double falsePositiveRate,
        double appealSuccessRate,
        double fairnessScore
) {}
